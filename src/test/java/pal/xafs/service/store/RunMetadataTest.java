package pal.xafs.service.store;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import pal.xafs.model.Channel;
import pal.xafs.model.DarkCurrent;
import pal.xafs.model.ScanCategory;
import pal.xafs.model.ScanMode;

import static org.junit.jupiter.api.Assertions.*;

class RunMetadataTest {

    @Test
    void testStartDocument_Keys() {
        JsonObject doc = RunMetadata.builder()
                .category(ScanCategory.MEASURE)
                .mode(ScanMode.FLY)
                .e0(8979)
                .scanPoints(1200)
                .darkCurrent(new DarkCurrent(120, 80, 5, 40))
                .gains(6, 7, 8, 9)
                .flyGeometry(8779, 9779, 12.9, 11.5, 1e-5, 10, 0.1)
                .coolTime(60)
                .slits(1, 2, 3, 4)
                .beamCurrent(399.5)
                .build()
                .toStartDocument();

        assertEquals("measure", doc.get("scan_type").getAsString());
        assertEquals("fly", doc.get("scan_mode").getAsString());
        assertEquals(8979.0, doc.get("E0").getAsDouble());
        assertEquals(1200, doc.get("scan_points").getAsInt());
        assertEquals(120.0, doc.get("darkI0").getAsDouble());
        assertEquals(9, doc.get("gainIr").getAsInt());
        assertEquals(1e-5, doc.get("enc_resolution").getAsDouble());
        assertEquals(10, doc.get("scan_encoder_steps").getAsInt());
        assertEquals(0.1, doc.get("motor_speed").getAsDouble());
        assertEquals(12.9, doc.get("startTh").getAsDouble());
        assertEquals(60.0, doc.get("coolTime").getAsDouble());
        assertEquals(4.0, doc.get("slitRight").getAsDouble());
        assertEquals(399.5, doc.get("beamcurrent").getAsDouble());
        assertFalse(doc.has("delay_time"));
    }

    @Test
    void testFromStartDocument_ReadsRecordedRun() throws DataUnavailableException {
        JsonObject doc = JsonParser.parseString("{\"scan_type\":\"calibration\",\"E0\":8979.0,"
                + "\"scan_points\":250,\"darkI0\":100,\"darkIt\":50,\"darkIf\":0,\"darkIr\":25,"
                + "\"gainI0\":7,\"delay_time\":0.1,\"operator\":\"beamline\"}").getAsJsonObject();

        RunMetadata metadata = RunMetadata.fromStartDocument(doc);
        assertEquals(ScanCategory.CALIBRATION, metadata.category());
        assertEquals(ScanMode.STEP, metadata.mode());
        assertEquals(8979.0, metadata.e0());
        assertEquals(250, metadata.scanPoints());
        assertEquals(new DarkCurrent(100, 50, 0, 25), metadata.darkCurrent());
        assertEquals(7, metadata.gain(Channel.I0));
        assertNull(metadata.gain(Channel.IT));
        assertEquals(0.1, metadata.delayTime());
        assertEquals("beamline", metadata.operator());
        assertNull(metadata.encoderResolution());
        assertArrayEquals(new double[]{0, 0, 0, 0}, metadata.slits());
    }

    @Test
    void testFromStartDocument_Rejects() {
        assertThrows(DataUnavailableException.class, () -> RunMetadata.fromStartDocument(null));
        assertThrows(DataUnavailableException.class, () -> RunMetadata.fromStartDocument(
                JsonParser.parseString("{\"scan_type\":\"dark\",\"E0\":1.0}").getAsJsonObject()));
        assertThrows(DataUnavailableException.class, () -> RunMetadata.fromStartDocument(
                JsonParser.parseString("{\"scan_type\":\"measure\"}").getAsJsonObject()));
        assertThrows(DataUnavailableException.class, () -> RunMetadata.fromStartDocument(
                JsonParser.parseString("{\"scan_type\":\"measure\",\"E0\":\"edge\"}").getAsJsonObject()));
    }

    @Test
    void testBuilder_RequiresTypeModeAndEdge() {
        assertThrows(IllegalStateException.class, () -> RunMetadata.builder().category(ScanCategory.ALIGN).build());
    }
}
