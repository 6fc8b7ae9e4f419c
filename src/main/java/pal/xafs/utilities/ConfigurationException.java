package pal.xafs.utilities;

/**
 * Thrown when a scan definition cannot produce a valid trajectory.
 * The scan is never started.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
