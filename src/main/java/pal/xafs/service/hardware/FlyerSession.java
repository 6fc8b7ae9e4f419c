package pal.xafs.service.hardware;

import pal.xafs.model.FlySample;
import pal.xafs.model.FlyerState;
import pal.xafs.utilities.EnergyConversion;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One monochromator sweep: geometry, requested sample count and runtime state.
 * A session is driven by {@link FlyerController}; it may be re-armed after it was drained.
 */
public class FlyerSession {

    private final double startEnergy;
    private final double targetEnergy;
    private final double startAngle;
    private final double targetAngle;
    private final double speed;
    private final int encoderStepSize;
    private final int requestedSamples;

    private final AtomicReference<FlyerState> state = new AtomicReference<>(FlyerState.IDLE);
    private volatile CompletableFuture<Void> completion = new CompletableFuture<>();
    private volatile ScheduledFuture<?> watcher;
    private volatile double resolution = Double.NaN;
    private volatile List<FlySample> samples = Collections.emptyList();

    public FlyerSession(double startEnergy, double targetEnergy, double speed,
                        int encoderStepSize, int requestedSamples) {
        if (encoderStepSize <= 0) {
            throw new IllegalArgumentException("Encoder step size must be positive");
        }
        this.startEnergy = startEnergy;
        this.targetEnergy = targetEnergy;
        this.startAngle = EnergyConversion.energyToAngle(startEnergy);
        this.targetAngle = EnergyConversion.energyToAngle(targetEnergy);
        this.speed = speed;
        this.encoderStepSize = encoderStepSize;
        this.requestedSamples = requestedSamples;
    }

    /**
     * Session whose sample count is the angular span divided by the angle covered per sample.
     *
     * @param resolution degrees per encoder count
     */
    public static FlyerSession forEnergies(double startEnergy, double targetEnergy, double speed,
                                           int encoderStepSize, double resolution) {
        double span = Math.abs(EnergyConversion.energyToAngle(startEnergy)
                - EnergyConversion.energyToAngle(targetEnergy));
        int samples = (int) (span / resolution / encoderStepSize);
        return new FlyerSession(startEnergy, targetEnergy, speed, encoderStepSize, samples);
    }

    public double getStartEnergy() {
        return startEnergy;
    }

    public double getTargetEnergy() {
        return targetEnergy;
    }

    public double getStartAngle() {
        return startAngle;
    }

    public double getTargetAngle() {
        return targetAngle;
    }

    public double getSpeed() {
        return speed;
    }

    public int getEncoderStepSize() {
        return encoderStepSize;
    }

    public int getRequestedSamples() {
        return requestedSamples;
    }

    public FlyerState getState() {
        return state.get();
    }

    /**
     * @return the samples of the last drain, empty before the first one
     */
    public List<FlySample> getSamples() {
        return samples;
    }

    public CompletableFuture<Void> completion() {
        return completion;
    }

    double getResolution() {
        return resolution;
    }

    void setResolution(double resolution) {
        this.resolution = resolution;
    }

    boolean transition(FlyerState expected, FlyerState next) {
        return state.compareAndSet(expected, next);
    }

    void forceState(FlyerState next) {
        state.set(next);
    }

    void resetCompletion() {
        completion = new CompletableFuture<>();
    }

    void setWatcher(ScheduledFuture<?> watcher) {
        this.watcher = watcher;
    }

    void stopWatcher() {
        ScheduledFuture<?> w = watcher;
        if (w != null) {
            w.cancel(false);
            watcher = null;
        }
    }

    boolean isWatching() {
        ScheduledFuture<?> w = watcher;
        return w != null && !w.isDone();
    }

    void setSamples(List<FlySample> samples) {
        this.samples = Collections.unmodifiableList(samples);
    }

    @Override
    public String toString() {
        return String.format("FlyerSession[%.2f -> %.2f eV, speed=%.4f, step=%d, samples=%d, %s]",
                startEnergy, targetEnergy, speed, encoderStepSize, requestedSamples, state.get());
    }
}
