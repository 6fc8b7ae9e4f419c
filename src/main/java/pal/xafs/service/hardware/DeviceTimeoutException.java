package pal.xafs.service.hardware;

import java.io.IOException;

/**
 * A hardware read or write did not succeed within its retries, or a fly-scan
 * did not complete within the allowed time.
 */
public class DeviceTimeoutException extends IOException {

    public DeviceTimeoutException(String message) {
        super(message);
    }

    public DeviceTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
