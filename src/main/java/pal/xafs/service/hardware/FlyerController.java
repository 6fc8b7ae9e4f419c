package pal.xafs.service.hardware;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pal.xafs.model.FlySample;
import pal.xafs.model.FlyerState;
import pal.xafs.utilities.XafsConfigManager;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives the buffered-counter fly scan of the monochromator.
 *
 * <p>Protocol: {@code arm -> start -> awaitCompletion -> drain}. A watcher task polls the
 * motion-done flag and resolves the session's completion future once the motor is settled
 * (done on two consecutive polls). Only {@code drain} copies data out of the capture buffer.</p>
 */
public class FlyerController implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(FlyerController.class);

    private static final int STEADY_POLLS = 2;

    private final ChannelAccess access;
    private final long pollIntervalMs;
    private final double encoderDirection;

    private final ScheduledExecutorService watcherExecutor = Executors.newSingleThreadScheduledExecutor(
            r -> {
                Thread t = new Thread(r, "FlyerWatcher");
                t.setDaemon(true);
                return t;
            }
    );

    public FlyerController(ChannelAccess access, long pollIntervalMs, double encoderDirection) {
        this.access = access;
        this.pollIntervalMs = pollIntervalMs;
        this.encoderDirection = encoderDirection;
    }

    public static FlyerController fromConfig(ChannelAccess access, XafsConfigManager config) {
        return new FlyerController(access,
                config.getInt(100, "hardware", "liveness_poll_ms"),
                config.getDouble(-1.0, "hardware", "encoder_direction"));
    }

    /**
     * Loads speed and capture step, clears the capture buffer and switches buffered counting on.
     *
     * @throws DeviceTimeoutException if a write is not acknowledged; the session stays IDLE
     */
    public void arm(FlyerSession session) throws DeviceTimeoutException {
        FlyerState state = session.getState();
        if (state != FlyerState.IDLE && state != FlyerState.DRAINED) {
            throw new ProtocolViolationException("arm", state);
        }
        session.forceState(FlyerState.IDLE);

        access.write(ScalarChannel.MOTOR_SPEED, session.getSpeed());
        access.write(ScalarChannel.CAPTURE_STEP_SIZE, session.getEncoderStepSize());
        access.write(ScalarChannel.CAPTURE_RESET, 1);
        access.write(ScalarChannel.CAPTURE_PRESET, 0);
        session.setResolution(access.read(ScalarChannel.ENCODER_RESOLUTION));
        access.write(ScalarChannel.CAPTURE_MODE, 1);

        session.resetCompletion();
        session.forceState(FlyerState.ARMED);
        logger.info("Armed {}", session);
    }

    /**
     * Issues the move to the target angle without waiting for it and starts the watcher.
     *
     * @throws ProtocolViolationException if the session is not ARMED
     */
    public void start(FlyerSession session) throws DeviceTimeoutException {
        if (!session.transition(FlyerState.ARMED, FlyerState.RUNNING)) {
            throw new ProtocolViolationException("start", session.getState());
        }
        try {
            access.write(ScalarChannel.MOTOR_POSITION, session.getTargetAngle());
        } catch (DeviceTimeoutException e) {
            logger.error("Could not start motion for {}", session, e);
            session.forceState(FlyerState.ARMED);
            throw e;
        }

        AtomicInteger donePolls = new AtomicInteger();
        session.setWatcher(watcherExecutor.scheduleWithFixedDelay(
                () -> poll(session, donePolls), pollIntervalMs, pollIntervalMs, TimeUnit.MILLISECONDS));
        logger.debug("Motion started towards {} deg", session.getTargetAngle());
    }

    private void poll(FlyerSession session, AtomicInteger donePolls) {
        if (session.getState() != FlyerState.RUNNING) {
            session.stopWatcher();
            return;
        }
        try {
            double done = access.read(ScalarChannel.MOTION_DONE);
            if (done >= 1.0) {
                if (donePolls.incrementAndGet() >= STEADY_POLLS
                        && session.transition(FlyerState.RUNNING, FlyerState.COMPLETING)) {
                    session.stopWatcher();
                    session.completion().complete(null);
                    logger.info("Motion completed for {}", session);
                }
            } else {
                donePolls.set(0);
            }
        } catch (DeviceTimeoutException e) {
            donePolls.set(0);
            logger.warn("Liveness poll failed: {}", e.getMessage());
        }
    }

    /**
     * Waits for the watcher to report completion. A timeout leaves the watcher running,
     * so a later call still observes a late completion.
     */
    public void awaitCompletion(FlyerSession session, Duration timeout) throws DeviceTimeoutException {
        try {
            session.completion().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new DeviceTimeoutException("Fly scan did not complete within " + timeout.toSeconds() + " s", e);
        } catch (CancellationException e) {
            throw new DeviceTimeoutException("Fly scan was cancelled", e);
        } catch (ExecutionException e) {
            throw new DeviceTimeoutException("Fly scan failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeviceTimeoutException("Interrupted while waiting for fly scan", e);
        }
    }

    /**
     * Copies the capture buffer out and switches buffered counting off.
     *
     * @return at most {@code requestedSamples} samples, all five waveforms truncated to the same length
     * @throws ProtocolViolationException if the motion has not completed
     */
    public List<FlySample> drain(FlyerSession session) throws DeviceTimeoutException {
        FlyerState state = session.getState();
        if (state != FlyerState.COMPLETING) {
            throw new ProtocolViolationException("drain", state);
        }
        access.write(ScalarChannel.CAPTURE_MODE, 0);
        double time = System.currentTimeMillis() / 1000.0;
        FlyWaveforms waveforms = readWaveforms(session.getRequestedSamples());
        if (waveforms.length() < session.getRequestedSamples()) {
            logger.warn("Capture buffer holds {} of {} requested samples",
                    waveforms.length(), session.getRequestedSamples());
        }
        List<FlySample> samples = waveforms.toSamples(time, encoderDirection,
                session.getResolution(), session.getStartAngle());
        session.setSamples(samples);
        session.forceState(FlyerState.DRAINED);
        logger.info("Drained {} samples", samples.size());
        return samples;
    }

    /**
     * Stops the motor and abandons the session. The completion future is cancelled
     * and the session returns to IDLE.
     */
    public void cancel(FlyerSession session) {
        FlyerState state = session.getState();
        logger.info("Cancelling fly scan in state {}", state);
        session.stopWatcher();
        session.completion().cancel(false);
        try {
            if (state == FlyerState.RUNNING || state == FlyerState.COMPLETING) {
                access.write(ScalarChannel.MOTOR_STOP, 1);
            }
            access.write(ScalarChannel.CAPTURE_MODE, 0);
        } catch (DeviceTimeoutException e) {
            logger.error("Hardware did not acknowledge cancel", e);
        } finally {
            session.forceState(FlyerState.IDLE);
        }
    }

    /**
     * Reads the capture buffer while a sweep is still running, without changing any session state.
     */
    public List<FlySample> readLiveWaveforms(int requestedSamples, double resolution, double startAngle)
            throws DeviceTimeoutException {
        double time = System.currentTimeMillis() / 1000.0;
        return readWaveforms(requestedSamples).toSamples(time, encoderDirection, resolution, startAngle);
    }

    private FlyWaveforms readWaveforms(int requested) {
        return FlyWaveforms.truncated(requested,
                readWithOneRetry(WaveformChannel.ENCODER),
                readWithOneRetry(WaveformChannel.I0),
                readWithOneRetry(WaveformChannel.IT),
                readWithOneRetry(WaveformChannel.IF),
                readWithOneRetry(WaveformChannel.IR));
    }

    private double[] readWithOneRetry(WaveformChannel channel) {
        for (int attempt = 1; attempt <= 2; attempt++) {
            try {
                double[] values = access.readWaveformOnce(channel);
                if (values.length > 0) {
                    return values;
                }
                logger.debug("Empty read on {} (attempt {})", channel, attempt);
            } catch (DeviceTimeoutException e) {
                logger.debug("Read of {} failed (attempt {}): {}", channel, attempt, e.getMessage());
            }
        }
        logger.warn("No data on {}, treating it as empty", channel);
        return new double[0];
    }

    @Override
    public void close() {
        watcherExecutor.shutdownNow();
    }
}
