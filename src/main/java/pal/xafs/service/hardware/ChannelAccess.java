package pal.xafs.service.hardware;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pal.xafs.utilities.XafsConfigManager;

import java.io.IOException;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Wraps {@link HardwareChannels} with a per-call timeout and a small fixed number of retries.
 * Every failure mode (exception, timeout, unacknowledged write) counts as one attempt; when all
 * attempts fail a {@link DeviceTimeoutException} is thrown.
 */
public class ChannelAccess implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ChannelAccess.class);

    private final HardwareChannels channels;
    private final int attempts;
    private final long retryDelayMs;
    private final long callTimeoutMs;

    private final ExecutorService callExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "ChannelAccess");
        t.setDaemon(true);
        return t;
    });

    public ChannelAccess(HardwareChannels channels, int attempts, long retryDelayMs, long callTimeoutMs) {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be at least 1");
        }
        this.channels = channels;
        this.attempts = attempts;
        this.retryDelayMs = retryDelayMs;
        this.callTimeoutMs = callTimeoutMs;
    }

    public static ChannelAccess fromConfig(HardwareChannels channels, XafsConfigManager config) {
        return new ChannelAccess(channels,
                config.getInt(3, "hardware", "retries"),
                config.getInt(50, "hardware", "retry_delay_ms"),
                config.getInt(2000, "hardware", "call_timeout_ms"));
    }

    public double read(ScalarChannel channel) throws DeviceTimeoutException {
        return call("read " + channel, () -> channels.readScalar(channel));
    }

    public void write(ScalarChannel channel, double value) throws DeviceTimeoutException {
        call("write " + channel + "=" + value, () -> {
            if (!channels.writeScalar(channel, value)) {
                throw new IOException("write not acknowledged");
            }
            return Boolean.TRUE;
        });
    }

    /**
     * Single attempt without retries. Missing data is returned as an empty array.
     */
    public double[] readWaveformOnce(WaveformChannel channel) throws DeviceTimeoutException {
        double[] values = invoke(() -> channels.readWaveform(channel), "read " + channel);
        return values == null ? new double[0] : values;
    }

    private <T> T call(String description, Callable<T> action) throws DeviceTimeoutException {
        DeviceTimeoutException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return invoke(action, description);
            } catch (DeviceTimeoutException e) {
                last = e;
                logger.debug("{} failed (attempt {}/{}): {}", description, attempt, attempts, e.getMessage());
                if (attempt < attempts && !sleep(retryDelayMs)) {
                    break;
                }
            }
        }
        throw new DeviceTimeoutException(description + " failed after " + attempts + " attempts",
                last == null ? null : last.getCause());
    }

    private <T> T invoke(Callable<T> action, String description) throws DeviceTimeoutException {
        Future<T> future = callExecutor.submit(action);
        try {
            return future.get(callTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DeviceTimeoutException(description + " timed out after " + callTimeoutMs + " ms", e);
        } catch (ExecutionException e) {
            throw new DeviceTimeoutException(description + ": " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new DeviceTimeoutException(description + " interrupted", e);
        }
    }

    private static boolean sleep(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void close() {
        callExecutor.shutdownNow();
    }
}
