package pal.xafs.utilities;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class XafsConfigManagerTest {

    @Test
    void testDefaults_LoadedFromClasspath() {
        XafsConfigManager config = XafsConfigManager.withOverrides(Map.of());
        assertEquals(5201, config.getInt(0, "event_bus", "controller_port"));
        assertEquals(5301, config.getInt(0, "event_bus", "viewer_port"));
        assertEquals(-1.0, config.getDouble(0, "hardware", "encoder_direction"));
        assertEquals(10.0, config.getDouble(0, "dark_current", "count_s"));
        assertFalse(config.getSection("fly_scan").isEmpty());
    }

    @Test
    void testGetters_FallbackOnMissingKey() {
        XafsConfigManager config = XafsConfigManager.withOverrides(Map.of());
        assertNull(config.getConfigItem("no", "such", "key"));
        assertEquals(7, config.getInt(7, "hardware", "missing"));
        assertEquals("x", config.getString("x", "missing"));
        assertTrue(config.getBoolean(true, "missing"));
        assertTrue(config.getSection("missing").isEmpty());
    }

    @Test
    void testOverrides_DeepMerge() {
        XafsConfigManager config = XafsConfigManager.withOverrides(
                Map.of("hardware", Map.of("retries", 5)));
        assertEquals(5, config.getInt(0, "hardware", "retries"));
        // siblings of an overridden key survive
        assertEquals(2000, config.getInt(0, "hardware", "call_timeout_ms"));
    }

    @Test
    void testGetInt_MalformedValue() {
        XafsConfigManager config = XafsConfigManager.withOverrides(
                Map.of("viewer", Map.of("history_depth", "three")));
        assertEquals(3, config.getInt(3, "viewer", "history_depth"));
    }

    @Test
    void testLoad_OverlayFile(@TempDir Path dir) throws IOException {
        Path overlay = dir.resolve("site.yml");
        Files.writeString(overlay, "event_bus:\n  controller_port: 6000\nviewer:\n  align_ratio: 2.5\n",
                StandardCharsets.UTF_8);

        XafsConfigManager config = XafsConfigManager.load(overlay.toString());
        try {
            assertSame(config, XafsConfigManager.getInstance());
            assertEquals(overlay.toString(), config.getOverlayPath());
            assertEquals(6000, config.getInt(0, "event_bus", "controller_port"));
            assertEquals(5301, config.getInt(0, "event_bus", "viewer_port"));
            assertEquals(2.5, config.getDouble(0, "viewer", "align_ratio"));
        } finally {
            XafsConfigManager.load(null);
        }
    }

    @Test
    void testLoad_MissingOverlayKeepsDefaults(@TempDir Path dir) {
        XafsConfigManager config = XafsConfigManager.load(dir.resolve("absent.yml").toString());
        try {
            assertEquals(5201, config.getInt(0, "event_bus", "controller_port"));
        } finally {
            XafsConfigManager.load(null);
        }
    }
}
