package pal.xafs.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pal.xafs.model.Channel;
import pal.xafs.model.DarkCurrent;
import pal.xafs.utilities.XafsConfigManager;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Map;

/**
 * Measures the amplifier dark current with the beam shutter closed.
 *
 * <p>Sequence: zero-correct the amplifiers and wait for the correction, switch zero check off,
 * make a short test count, then count for the measurement time. The rate of each channel is
 * the integer count per second.</p>
 */
public class DarkCurrentWorkflow {
    private static final Logger logger = LoggerFactory.getLogger(DarkCurrentWorkflow.class);

    private final AmplifierControl amplifiers;
    private final ScalerCounter scaler;
    private final double zeroCorrectionTime;
    private final double testCountTime;
    private final double countTime;

    private DarkCurrent current = DarkCurrent.none();
    private boolean needsDarkCurrent = true;

    public DarkCurrentWorkflow(AmplifierControl amplifiers, ScalerCounter scaler,
                               double zeroCorrectionTime, double testCountTime, double countTime) {
        if (!(countTime > 0)) {
            throw new IllegalArgumentException("Count time must be positive");
        }
        this.amplifiers = amplifiers;
        this.scaler = scaler;
        this.zeroCorrectionTime = zeroCorrectionTime;
        this.testCountTime = testCountTime;
        this.countTime = countTime;
    }

    public static DarkCurrentWorkflow fromConfig(AmplifierControl amplifiers, ScalerCounter scaler,
                                                 XafsConfigManager config) {
        return new DarkCurrentWorkflow(amplifiers, scaler,
                config.getDouble(4, "dark_current", "zero_correction_s"),
                config.getDouble(1, "dark_current", "test_count_s"),
                config.getDouble(10, "dark_current", "count_s"));
    }

    /**
     * Runs the measurement. On failure the previous rates are kept and a new
     * measurement is still required.
     */
    public DarkCurrent measure() throws IOException {
        logger.info("Performing zero correction, waiting {} s", zeroCorrectionTime);
        amplifiers.zeroCorrect();
        sleep(zeroCorrectionTime);
        amplifiers.setZeroCheck(false);

        scaler.count(testCountTime);
        logger.info("Measuring dark current for {} s", countTime);
        Map<Channel, Double> counts = scaler.count(countTime);

        DarkCurrent measured = new DarkCurrent(
                rate(counts, Channel.I0), rate(counts, Channel.IT),
                rate(counts, Channel.IF), rate(counts, Channel.IR));
        synchronized (this) {
            current = measured;
            needsDarkCurrent = false;
        }
        logger.info("Dark current measured: {}", measured);
        return measured;
    }

    public synchronized DarkCurrent current() {
        return current;
    }

    public synchronized boolean needsDarkCurrent() {
        return needsDarkCurrent;
    }

    /**
     * Marks the stored rates stale, e.g. after an amplifier gain change.
     */
    public synchronized void invalidate() {
        needsDarkCurrent = true;
    }

    private double rate(Map<Channel, Double> counts, Channel channel) throws IOException {
        Double value = counts.get(channel);
        if (value == null || !Double.isFinite(value)) {
            throw new IOException("No dark count for " + channel.column());
        }
        return (int) (value / countTime);
    }

    private static void sleep(double seconds) throws InterruptedIOException {
        try {
            Thread.sleep((long) (seconds * 1000));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted during zero correction");
        }
    }
}
