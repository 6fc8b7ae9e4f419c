package pal.xafs.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pal.xafs.model.DarkCurrent;
import pal.xafs.model.EnergyStepSequence;
import pal.xafs.model.FlySample;
import pal.xafs.model.FlyerState;
import pal.xafs.model.ScanMode;
import pal.xafs.service.bus.EventMessage;
import pal.xafs.service.hardware.ChannelAccess;
import pal.xafs.service.hardware.DeviceTimeoutException;
import pal.xafs.service.hardware.FlyerController;
import pal.xafs.service.hardware.FlyerSession;
import pal.xafs.service.hardware.ScalarChannel;
import pal.xafs.service.store.RunMetadata;
import pal.xafs.utilities.ConfigurationException;
import pal.xafs.utilities.TrajectoryGenerator;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Runs step, repeated step and fly scans, and the dark-current measurement that precedes them.
 *
 * <p>The abort flag is checked before every trajectory step and every device write. Whatever
 * ends a scan, cleanup moves the monochromator back to E0, restores the fly speed, re-enables
 * the controls and stops the busy indicator.</p>
 */
public class ScanOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(ScanOrchestrator.class);

    private static final long AWAIT_SLICE_MS = 200;

    private final PlanExecutor executor;
    private final FlyerController flyer;
    private final ChannelAccess channels;
    private final ControlSurface controls;
    private final Consumer<EventMessage> toViewer;
    private final ScanTimings timings;
    private final DarkCurrentWorkflow darkCurrent;

    private final Object stateLock = new Object();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean aborted = new AtomicBoolean(false);
    private volatile FlyerSession activeSession;

    public ScanOrchestrator(PlanExecutor executor, FlyerController flyer, ChannelAccess channels,
                            ControlSurface controls, Consumer<EventMessage> toViewer, ScanTimings timings) {
        this(executor, flyer, channels, controls, toViewer, timings, null);
    }

    /**
     * @param darkCurrent workflow supplying the dark rates of step scans, may be null
     */
    public ScanOrchestrator(PlanExecutor executor, FlyerController flyer, ChannelAccess channels,
                            ControlSurface controls, Consumer<EventMessage> toViewer, ScanTimings timings,
                            DarkCurrentWorkflow darkCurrent) {
        this.executor = executor;
        this.flyer = flyer;
        this.channels = channels;
        this.controls = controls;
        this.toViewer = toViewer;
        this.timings = timings;
        this.darkCurrent = darkCurrent;
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isAborted() {
        return aborted.get();
    }

    /**
     * Runs a scan to completion on the calling thread.
     *
     * @throws ConfigurationException if the step trajectory is invalid; nothing is moved
     * @throws IllegalStateException  if another scan is running
     */
    public ScanOutcome run(ScanRequest request) {
        EnergyStepSequence sequence = null;
        if (request.kind() != ScanKind.FLY) {
            sequence = TrajectoryGenerator.build(request.segments()).toAbsolute(request.e0());
        }
        begin();
        logger.info("Starting {} {} scan at E0={} ({} repetitions)",
                request.category(), request.kind(), request.e0(), request.repetitions());

        Double originalSpeed = null;
        int completed = 0;
        try {
            toViewer.accept(EventMessage.xLabel("Energy [eV]"));
            toViewer.accept(EventMessage.blink(true));
            toViewer.accept(EventMessage.runEngine("running"));
            toViewer.accept(EventMessage.disableAbortButton(false));
            controls.setControlsEnabled(false);
            controls.setAbortEnabled(true);

            if (request.kind() == ScanKind.FLY) {
                originalSpeed = channels.read(ScalarChannel.MOTOR_SPEED);
                for (int rep = 0; rep < request.repetitions(); rep++) {
                    runFly(request, originalSpeed);
                    completed++;
                    if (rep < request.repetitions() - 1) {
                        double cooling = request.fly().coolingTime() != null
                                ? request.fly().coolingTime() : timings.defaultCoolingTime();
                        logger.info("Cooling monochromator for {} s before the next sweep", cooling);
                        pause(cooling);
                    }
                }
            } else {
                for (int rep = 0; rep < request.repetitions(); rep++) {
                    runStep(request, sequence);
                    completed++;
                }
            }
            logger.info("Scan finished, {} runs recorded", completed);
            return ScanOutcome.completed(completed);
        } catch (ScanAbortedException e) {
            logger.warn("Scan aborted after {} runs: {}", completed, e.getMessage());
            return ScanOutcome.aborted(completed);
        } catch (IOException | RuntimeException e) {
            logger.error("Scan failed after {} runs", completed, e);
            return ScanOutcome.failed(completed, e);
        } finally {
            cleanup(request.e0(), originalSpeed);
            finish();
        }
    }

    /**
     * Measures the dark current on the calling thread. The rates are kept by the workflow and
     * used by every later step scan that brings none of its own.
     *
     * @throws ScanAbortedException  if the operator aborted before the measurement started
     * @throws IllegalStateException if a scan is running or no workflow is configured
     */
    public DarkCurrent measureDarkCurrent() throws IOException, ScanAbortedException {
        if (darkCurrent == null) {
            throw new IllegalStateException("No dark-current workflow configured");
        }
        begin();
        logger.info("Starting dark-current measurement");
        try {
            toViewer.accept(EventMessage.blink(true));
            toViewer.accept(EventMessage.runEngine("running"));
            toViewer.accept(EventMessage.disableAbortButton(false));
            controls.setControlsEnabled(false);
            controls.setAbortEnabled(true);
            checkAbort();
            return darkCurrent.measure();
        } finally {
            cleanup(null, null);
            finish();
        }
    }

    /**
     * Stops the running scan. Safe to call any number of times and from any thread.
     */
    public void abort() {
        synchronized (stateLock) {
            if (!running.get()) {
                logger.debug("Abort ignored, nothing is running");
                return;
            }
            if (!aborted.compareAndSet(false, true)) {
                logger.debug("Abort already requested");
                return;
            }
            logger.warn("Abort requested");
            toViewer.accept(EventMessage.disableAbortButton(true));
        }
        FlyerSession session = activeSession;
        if (session != null) {
            flyer.cancel(session);
        }
    }

    private void begin() {
        synchronized (stateLock) {
            if (running.get()) {
                throw new IllegalStateException("A scan is already running");
            }
            running.set(true);
            aborted.set(false);
        }
    }

    // abort() holds the same lock, so no abort message can follow the final re-enable
    private void finish() {
        synchronized (stateLock) {
            toViewer.accept(EventMessage.disableAbortButton(false));
            running.set(false);
        }
    }

    private DarkCurrent stepDarkCurrent(ScanRequest request) {
        if (request.darkCurrent() != null) {
            return request.darkCurrent();
        }
        if (darkCurrent == null) {
            return DarkCurrent.none();
        }
        if (darkCurrent.needsDarkCurrent()) {
            logger.warn("Dark current has not been measured since the last change, using {}", darkCurrent.current());
        }
        return darkCurrent.current();
    }

    private void runStep(ScanRequest request, EnergyStepSequence sequence)
            throws IOException, ScanAbortedException {
        RunMetadata.Builder metadata = baseMetadata(request, ScanMode.STEP)
                .scanPoints(sequence.totalPoints())
                .darkCurrent(stepDarkCurrent(request))
                .delayTime(request.delayTime());

        double first = sequence.first();
        move(first - timings.stepPrepositionOffset());
        pause(timings.stepPrepositionSettle());
        move(first);
        pause(timings.stepStartSettle());

        executor.openRun(metadata.build());
        try {
            int step = 0;
            for (int segment = 0; segment < sequence.segmentCount(); segment++) {
                checkAbort();
                executor.setDwellTime(sequence.dwellTime(segment));
                for (double energy : sequence.segment(segment)) {
                    move(energy);
                    pause(request.delayTime());
                    checkAbort();
                    executor.triggerAndRead(step++);
                }
            }
        } finally {
            executor.closeRun();
            toViewer.accept(EventMessage.updateViewer());
        }
    }

    private void runFly(ScanRequest request, double originalSpeed) throws IOException, ScanAbortedException {
        FlyScanParameters fly = request.fly();
        checkAbort();
        double resolution = channels.read(ScalarChannel.ENCODER_RESOLUTION);
        FlyerSession session = FlyerSession.forEnergies(fly.startEnergy(), fly.stopEnergy(),
                fly.motorSpeed(), fly.encoderSteps(), resolution);

        move(fly.startEnergy() - timings.flyPrepositionOffset());
        pause(timings.flyPrepositionSettle());
        move(fly.startEnergy());
        pause(timings.flyStartSettle());

        checkAbort();
        flyer.arm(session);
        activeSession = session;
        toViewer.accept(EventMessage.flyStartTime(System.currentTimeMillis() / 1000.0));

        RunMetadata metadata = baseMetadata(request, ScanMode.FLY)
                .scanPoints(session.getRequestedSamples())
                .flyGeometry(fly.startEnergy(), fly.stopEnergy(), session.getStartAngle(),
                        session.getTargetAngle(), resolution, fly.encoderSteps(), fly.motorSpeed())
                .coolTime(fly.coolingTime() != null ? fly.coolingTime() : timings.defaultCoolingTime())
                .build();
        executor.openRun(metadata);
        try {
            checkAbort();
            flyer.start(session);
            awaitSweep(session);
            List<FlySample> samples = flyer.drain(session);
            executor.recordFlySamples(samples);
        } catch (IOException | ScanAbortedException | RuntimeException e) {
            if (session.getState() != FlyerState.IDLE) {
                flyer.cancel(session);
            }
            throw e;
        } finally {
            activeSession = null;
            executor.closeRun();
            toViewer.accept(EventMessage.updateViewer());
        }
        checkAbort();
        channels.write(ScalarChannel.MOTOR_SPEED, originalSpeed);
    }

    private void awaitSweep(FlyerSession session) throws DeviceTimeoutException, ScanAbortedException {
        long deadline = System.nanoTime() + (long) (timings.flyCompletionTimeout() * 1e9);
        while (true) {
            try {
                flyer.awaitCompletion(session, Duration.ofMillis(AWAIT_SLICE_MS));
                return;
            } catch (DeviceTimeoutException e) {
                checkAbort();
                if (session.completion().isCompletedExceptionally() || System.nanoTime() >= deadline) {
                    throw e;
                }
            }
        }
    }

    private void cleanup(Double e0, Double originalSpeed) {
        logger.info("Cleaning up{}", e0 != null ? ": returning to E0=" + e0 : "");
        try {
            if (originalSpeed != null) {
                try {
                    channels.write(ScalarChannel.MOTOR_SPEED, originalSpeed);
                } catch (DeviceTimeoutException e) {
                    logger.error("Could not restore the monochromator speed", e);
                }
            }
            if (e0 != null) {
                toViewer.accept(EventMessage.disableAbortButton(true));
                controls.setAbortEnabled(false);
                try {
                    executor.moveEnergy(e0);
                } catch (IOException e) {
                    logger.error("Could not return to E0={}", e0, e);
                }
            }
        } finally {
            toViewer.accept(EventMessage.blink(false));
            toViewer.accept(EventMessage.runEngine("idle"));
            controls.setControlsEnabled(true);
            controls.setAbortEnabled(true);
        }
    }

    private RunMetadata.Builder baseMetadata(ScanRequest request, ScanMode mode) {
        RunMetadata.Builder builder = RunMetadata.builder()
                .category(request.category())
                .mode(mode)
                .e0(request.e0())
                .time(System.currentTimeMillis() / 1000.0)
                .beamCurrent(request.beamCurrent());
        int[] gains = request.gains();
        if (gains != null) {
            builder.gains(gains[0], gains[1], gains[2], gains[3]);
        }
        double[] slits = request.slits();
        if (slits != null) {
            builder.slits(slits[0], slits[1], slits[2], slits[3]);
        }
        if (request.operator() != null) {
            builder.operator(request.operator());
        }
        return builder;
    }

    private void move(double energy) throws IOException, ScanAbortedException {
        checkAbort();
        executor.moveEnergy(energy);
    }

    private void checkAbort() throws ScanAbortedException {
        if (aborted.get()) {
            throw new ScanAbortedException("Scan aborted by operator");
        }
    }

    private void pause(double seconds) throws ScanAbortedException, IOException {
        long end = System.nanoTime() + (long) (seconds * 1e9);
        while (System.nanoTime() < end) {
            checkAbort();
            try {
                Thread.sleep(Math.min(100, Math.max(1, (end - System.nanoTime()) / 1_000_000)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while waiting");
            }
        }
        checkAbort();
    }
}
