package pal.xafs.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * XafsConfigManager
 *
 * <p>Singleton holding the beamline YAML configuration:
 *   - Loads the bundled {@code xafs-defaults.yml} from the classpath.
 *   - Deep-merges an optional site file on top of the defaults.
 *   - Offers typed getters by key path, with a fallback value for missing keys.
 */
public class XafsConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(XafsConfigManager.class);

    public static final String DEFAULTS_RESOURCE = "/xafs-defaults.yml";

    private static XafsConfigManager instance;

    private final Map<String, Object> configData;
    private final String overlayPath;

    private XafsConfigManager(String overlayPath) {
        this.overlayPath = overlayPath;
        this.configData = loadDefaults();
        if (overlayPath != null) {
            merge(configData, loadConfig(overlayPath));
        }
    }

    /**
     * Returns the shared instance, loading the bundled defaults on first use.
     */
    public static synchronized XafsConfigManager getInstance() {
        if (instance == null) {
            instance = new XafsConfigManager(null);
        }
        return instance;
    }

    /**
     * Replaces the shared instance with defaults overlaid by the given site file.
     *
     * @param overlayPath filesystem path of a YAML file, or null for defaults only
     * @return the new shared instance
     */
    public static synchronized XafsConfigManager load(String overlayPath) {
        instance = new XafsConfigManager(overlayPath);
        logger.info("Loaded configuration (overlay: {})", overlayPath == null ? "none" : overlayPath);
        return instance;
    }

    /**
     * Builds an instance that is not shared, from defaults plus the given overrides.
     */
    public static XafsConfigManager withOverrides(Map<String, Object> overrides) {
        XafsConfigManager manager = new XafsConfigManager(null);
        merge(manager.configData, overrides);
        return manager;
    }

    public Map<String, Object> getAllConfig() {
        return Collections.unmodifiableMap(configData);
    }

    public String getOverlayPath() {
        return overlayPath;
    }

    /**
     * @param keys key path, e.g. "event_bus", "controller_port"
     * @return the value at the end of the path, or null if any key is missing
     */
    public Object getConfigItem(String... keys) {
        Object current = configData;
        for (String key : keys) {
            if (current instanceof Map<?, ?> map && map.containsKey(key)) {
                current = map.get(key);
            } else {
                logger.debug("Config key not found: {}", Arrays.toString(keys));
                return null;
            }
        }
        return current;
    }

    public String getString(String fallback, String... keys) {
        Object v = getConfigItem(keys);
        return v != null ? v.toString() : fallback;
    }

    public int getInt(int fallback, String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.intValue();
        if (v == null) return fallback;
        try {
            return Integer.parseInt(v.toString().trim());
        } catch (NumberFormatException e) {
            logger.warn("Expected int at {} but got {}", String.join("/", keys), v);
            return fallback;
        }
    }

    public double getDouble(double fallback, String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.doubleValue();
        if (v == null) return fallback;
        try {
            return Double.parseDouble(v.toString().trim());
        } catch (NumberFormatException e) {
            logger.warn("Expected double at {} but got {}", String.join("/", keys), v);
            return fallback;
        }
    }

    public boolean getBoolean(boolean fallback, String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Boolean b) return b;
        return v != null ? Boolean.parseBoolean(v.toString().trim()) : fallback;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getSection(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof Map<?, ?>) ? (Map<String, Object>) v : Collections.emptyMap();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> loadDefaults() {
        try (InputStream in = XafsConfigManager.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                logger.error("Bundled defaults {} not found on classpath", DEFAULTS_RESOURCE);
                return new LinkedHashMap<>();
            }
            Object loaded = new Yaml().load(in);
            if (loaded instanceof Map) {
                return deepCopy((Map<String, Object>) loaded);
            }
        } catch (Exception e) {
            logger.error("Error parsing bundled defaults", e);
        }
        return new LinkedHashMap<>();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> loadConfig(String path) {
        Yaml yaml = new Yaml();
        try (InputStream in = new FileInputStream(path)) {
            Object loaded = yaml.load(in);
            if (loaded instanceof Map) {
                return new LinkedHashMap<>((Map<String, Object>) loaded);
            } else {
                logger.error("YAML root is not a map: {}", path);
            }
        } catch (FileNotFoundException e) {
            logger.error("YAML file not found: {}", path, e);
        } catch (Exception e) {
            logger.error("Error parsing YAML: {}", path, e);
        }
        return new LinkedHashMap<>();
    }

    @SuppressWarnings("unchecked")
    private static void merge(Map<String, Object> target, Map<String, Object> overlay) {
        for (Map.Entry<String, Object> entry : overlay.entrySet()) {
            Object existing = target.get(entry.getKey());
            if (existing instanceof Map<?, ?> && entry.getValue() instanceof Map<?, ?>) {
                merge((Map<String, Object>) existing, (Map<String, Object>) entry.getValue());
            } else {
                target.put(entry.getKey(), entry.getValue());
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : source.entrySet()) {
            Object value = entry.getValue();
            copy.put(entry.getKey(), value instanceof Map<?, ?> m ? deepCopy((Map<String, Object>) m) : value);
        }
        return copy;
    }
}
