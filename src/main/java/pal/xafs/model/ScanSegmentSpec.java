package pal.xafs.model;

import java.util.Arrays;

/**
 * Piecewise definition of a step scan.
 *
 * <p>N boundary energies (eV, relative to the edge E0) delimit N-1 segments. Each segment
 * carries an active flag, a spacing mode, a step size (eV for {@link SegmentMode#ENERGY},
 * 1/Angstrom for {@link SegmentMode#MOMENTUM}) and a dwell time in seconds. Dwell times may
 * be given either for every segment or only for the active ones.</p>
 *
 * <p>Instances are immutable; arrays are copied on the way in and out.</p>
 */
public final class ScanSegmentSpec {

    private final double[] boundaries;
    private final boolean[] active;
    private final SegmentMode[] modes;
    private final double[] stepSizes;
    private final double[] dwellTimes;

    public ScanSegmentSpec(double[] boundaries, boolean[] active, SegmentMode[] modes,
                           double[] stepSizes, double[] dwellTimes) {
        this.boundaries = copy(boundaries);
        this.active = active == null ? null : active.clone();
        this.modes = modes == null ? null : modes.clone();
        this.stepSizes = copy(stepSizes);
        this.dwellTimes = copy(dwellTimes);
    }

    private static double[] copy(double[] values) {
        return values == null ? null : values.clone();
    }

    public double[] boundaries() {
        return copy(boundaries);
    }

    public boolean[] active() {
        return active == null ? null : active.clone();
    }

    public SegmentMode[] modes() {
        return modes == null ? null : modes.clone();
    }

    public double[] stepSizes() {
        return copy(stepSizes);
    }

    public double[] dwellTimes() {
        return copy(dwellTimes);
    }

    @Override
    public String toString() {
        return "ScanSegmentSpec{boundaries=" + Arrays.toString(boundaries)
                + ", active=" + Arrays.toString(active)
                + ", modes=" + Arrays.toString(modes)
                + ", steps=" + Arrays.toString(stepSizes)
                + ", dwell=" + Arrays.toString(dwellTimes) + "}";
    }
}
