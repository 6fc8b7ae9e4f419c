package pal.xafs.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pal.xafs.model.Channel;
import pal.xafs.model.FlySample;
import pal.xafs.model.SampleFrame;
import pal.xafs.service.hardware.ChannelAccess;
import pal.xafs.service.hardware.DeviceTimeoutException;
import pal.xafs.service.hardware.ScalarChannel;
import pal.xafs.service.store.RunMetadata;
import pal.xafs.service.store.RunRecord;
import pal.xafs.service.store.RunStore;
import pal.xafs.utilities.EnergyConversion;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plan executor that drives the monochromator through {@link ChannelAccess}, counts with a
 * {@link ScalerCounter} and records every row in a {@link RunStore}.
 */
public class HardwarePlanExecutor implements PlanExecutor {
    private static final Logger logger = LoggerFactory.getLogger(HardwarePlanExecutor.class);

    private final ChannelAccess channels;
    private final ScalerCounter scaler;
    private final RunStore store;
    private final long pollIntervalMs;
    private final long motionTimeoutMs;

    private RunRecord currentRun;
    private double dwellTime = 1.0;
    private double energy = Double.NaN;

    public HardwarePlanExecutor(ChannelAccess channels, ScalerCounter scaler, RunStore store,
                                long pollIntervalMs, long motionTimeoutMs) {
        this.channels = channels;
        this.scaler = scaler;
        this.store = store;
        this.pollIntervalMs = pollIntervalMs;
        this.motionTimeoutMs = motionTimeoutMs;
    }

    @Override
    public synchronized void openRun(RunMetadata metadata) {
        if (currentRun != null) {
            logger.warn("Run {} was not closed before opening a new one", currentRun.uid());
        }
        currentRun = new RunRecord(metadata.toStartDocument());
        store.add(currentRun);
        logger.info("Opened run {} ({} {})", currentRun.uid(), metadata.category(), metadata.mode());
    }

    @Override
    public synchronized void closeRun() {
        if (currentRun != null) {
            logger.info("Closed run {} with {} rows", currentRun.uid(), currentRun.rowCount());
            currentRun = null;
        }
    }

    @Override
    public void moveEnergy(double target) throws IOException {
        double angle = EnergyConversion.energyToAngle(target);
        if (Double.isNaN(angle)) {
            throw new IOException("Energy " + target + " eV is out of range of the monochromator");
        }
        logger.debug("Moving to {} eV ({} deg)", target, angle);
        channels.write(ScalarChannel.MOTOR_POSITION, angle);
        waitForMotion();
        energy = target;
    }

    private void waitForMotion() throws IOException {
        long deadline = System.currentTimeMillis() + motionTimeoutMs;
        while (channels.read(ScalarChannel.MOTION_DONE) < 1.0) {
            if (System.currentTimeMillis() > deadline) {
                throw new DeviceTimeoutException("Monochromator did not settle within " + motionTimeoutMs + " ms");
            }
            try {
                Thread.sleep(pollIntervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while waiting for motion");
            }
        }
    }

    @Override
    public void setDwellTime(double seconds) {
        this.dwellTime = seconds;
    }

    @Override
    public void triggerAndRead(int step) throws IOException {
        Map<Channel, Double> counts = scaler.count(dwellTime);
        Map<String, Double> row = new LinkedHashMap<>();
        row.put(SampleFrame.TIME, System.currentTimeMillis() / 1000.0);
        row.put(SampleFrame.ENERGY, energy);
        row.put(SampleFrame.DWELL, dwellTime);
        for (Channel channel : Channel.values()) {
            row.put(channel.column(), counts.getOrDefault(channel, Double.NaN));
        }
        requireRun().appendRow(row);
        logger.trace("Step {} recorded at {} eV", step, energy);
    }

    @Override
    public void recordFlySamples(List<FlySample> samples) {
        RunRecord run = requireRun();
        for (FlySample s : samples) {
            Map<String, Double> row = new LinkedHashMap<>();
            row.put(SampleFrame.TIME, s.time());
            row.put(SampleFrame.ENCODER, s.encoder());
            row.put(Channel.I0.column(), s.ch1());
            row.put(Channel.IT.column(), s.ch2());
            row.put(Channel.IF.column(), s.ch3());
            row.put(Channel.IR.column(), s.ch4());
            run.appendRow(row);
        }
        logger.info("Recorded {} fly samples in run {}", samples.size(), run.uid());
    }

    private synchronized RunRecord requireRun() {
        if (currentRun == null) {
            throw new IllegalStateException("No open run");
        }
        return currentRun;
    }
}
