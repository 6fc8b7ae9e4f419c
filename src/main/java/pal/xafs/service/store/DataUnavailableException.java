package pal.xafs.service.store;

/**
 * A run's data or metadata cannot be read yet (still being written, or incomplete).
 * Callers skip the run and try again later.
 */
public class DataUnavailableException extends Exception {

    public DataUnavailableException(String message) {
        super(message);
    }

    public DataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
