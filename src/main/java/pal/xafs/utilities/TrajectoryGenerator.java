package pal.xafs.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pal.xafs.model.EnergyStepSequence;
import pal.xafs.model.ScanSegmentSpec;
import pal.xafs.model.SegmentMode;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the energy list of a step scan from its segment definition.
 *
 * <p>Rules:</p>
 * <ul>
 *   <li>The first active segment starts on its lower boundary.</li>
 *   <li>A segment that directly follows another active segment resumes one step past the
 *       previous segment's last point, so shared boundaries are never sampled twice.</li>
 *   <li>When an inactive segment separates two active ones, the later segment starts on its
 *       own lower boundary.</li>
 *   <li>An energy segment ends on its upper boundary when the boundary lies on its step grid.</li>
 *   <li>A momentum segment steps uniformly in k from the previous point and stops before the
 *       upper boundary.</li>
 *   <li>Every energy is rounded to 5 decimals.</li>
 * </ul>
 */
public final class TrajectoryGenerator {
    private static final Logger logger = LoggerFactory.getLogger(TrajectoryGenerator.class);

    private static final double RELATIVE_TOLERANCE = 1e-9;
    private static final double DECIMALS = 1e5;
    private static final double RESOLUTION = 1e-5;
    /** Largest point count of one segment. */
    static final long MAX_SEGMENT_POINTS = 100_000;

    private TrajectoryGenerator() {
    }

    public static EnergyStepSequence build(ScanSegmentSpec spec) {
        return build(spec.boundaries(), spec.active(), spec.modes(), spec.stepSizes(), spec.dwellTimes());
    }

    /**
     * @param boundaries N boundary energies relative to E0, increasing
     * @param active     N-1 flags
     * @param modes      N-1 spacing modes
     * @param stepSizes  N-1 step sizes, eV or 1/Angstrom depending on the mode
     * @param dwellTimes dwell time per segment (N-1 values) or per active segment
     * @return the generated sequence, relative to E0
     * @throws ConfigurationException if the definition is invalid
     */
    public static EnergyStepSequence build(double[] boundaries, boolean[] active, SegmentMode[] modes,
                                           double[] stepSizes, double[] dwellTimes) {
        validate(boundaries, active, modes, stepSizes, dwellTimes);

        int segmentCount = boundaries.length - 1;
        int activeCount = countActive(active);
        boolean dwellPerSegment = dwellTimes.length == segmentCount;

        List<double[]> segments = new ArrayList<>();
        List<Double> dwell = new ArrayList<>();
        int previousActive = -1;
        double previousLast = Double.NaN;
        SegmentMode previousMode = null;
        int activeOrdinal = 0;

        for (int i = 0; i < segmentCount; i++) {
            if (!active[i]) {
                continue;
            }
            boolean adjacent = previousActive == i - 1 && previousActive >= 0;
            double lower = boundaries[i];
            double upper = boundaries[i + 1];
            double step = stepSizes[i];

            double[] points;
            if (modes[i] == SegmentMode.MOMENTUM) {
                if (previousActive < 0) {
                    throw new ConfigurationException("Segment " + (i + 1)
                            + " is in k mode but has no preceding energy segment");
                }
                double origin = adjacent ? previousLast : lower;
                if (origin < 0) {
                    throw new ConfigurationException(String.format(
                            "Segment %d is in k mode but starts below the edge (%.3f eV)", i + 1, origin));
                }
                points = momentumSegment(origin, upper, step);
            } else {
                double start = previousActive < 0 || !adjacent ? lower : previousLast + step;
                points = energySegment(start, upper, step);
                if (previousMode == SegmentMode.MOMENTUM && adjacent) {
                    logger.debug("Segment {} restarts energy spacing after k mode at {}", i + 1, start);
                }
            }

            round(points);
            if (points.length == 0) {
                throw new ConfigurationException("Segment " + (i + 1) + " produces no scan points");
            }
            if (previousActive >= 0 && points[0] <= previousLast) {
                throw new ConfigurationException(String.format(
                        "Segment %d starts at %.5f, not above the previous point %.5f", i + 1, points[0], previousLast));
            }
            checkIncreasing(points, i);

            segments.add(points);
            dwell.add(dwellPerSegment ? dwellTimes[i] : dwellTimes[activeOrdinal]);
            previousActive = i;
            previousLast = points[points.length - 1];
            previousMode = modes[i];
            activeOrdinal++;
        }

        double[] dwellArray = new double[dwell.size()];
        for (int i = 0; i < dwellArray.length; i++) {
            dwellArray[i] = dwell.get(i);
        }
        EnergyStepSequence sequence = new EnergyStepSequence(segments, dwellArray);
        logger.info("Generated {} points in {} of {} segments ({} active), {} .. {} eV",
                sequence.totalPoints(), sequence.segmentCount(), segmentCount, activeCount,
                sequence.first(), sequence.last());
        return sequence;
    }

    /**
     * Points start, start+step, ... strictly below {@code stop}, with {@code stop} itself appended
     * when the next grid point would land on it.
     */
    static double[] energySegment(double start, double stop, double step) {
        double span = (stop - start) / step;
        long count = span <= 0 ? 0 : (long) Math.ceil(span - RELATIVE_TOLERANCE * Math.max(1.0, Math.abs(span)));
        checkPointCount(count, start, stop);
        int n = (int) count;
        boolean appendStop = n > 0 && isClose(start + n * step, stop);
        double[] points = new double[appendStop ? n + 1 : n];
        for (int i = 0; i < n; i++) {
            points[i] = start + i * step;
        }
        if (appendStop) {
            points[n] = stop;
        }
        return points;
    }

    /**
     * Uniform steps in k starting one step above the wavenumber of {@code originEnergy},
     * stopping before {@code stopEnergy}.
     */
    static double[] momentumSegment(double originEnergy, double stopEnergy, double kStep) {
        double k0 = EnergyConversion.energyToWavenumber(originEnergy);
        double span = (EnergyConversion.energyToWavenumber(stopEnergy) - k0) / kStep;
        checkPointCount(span <= 0 ? 0 : (long) Math.ceil(span), originEnergy, stopEnergy);
        List<Double> energies = new ArrayList<>();
        for (int n = 1; ; n++) {
            double energy = EnergyConversion.wavenumberToEnergy(k0 + n * kStep);
            if (energy >= stopEnergy || isClose(energy, stopEnergy)) {
                break;
            }
            energies.add(energy);
        }
        double[] points = new double[energies.size()];
        for (int i = 0; i < points.length; i++) {
            points[i] = energies.get(i);
        }
        return points;
    }

    private static void validate(double[] boundaries, boolean[] active, SegmentMode[] modes,
                                 double[] stepSizes, double[] dwellTimes) {
        if (boundaries == null || boundaries.length < 2) {
            throw new ConfigurationException("At least two boundary energies are required");
        }
        int segmentCount = boundaries.length - 1;
        if (active == null || active.length != segmentCount
                || modes == null || modes.length != segmentCount
                || stepSizes == null || stepSizes.length != segmentCount) {
            throw new ConfigurationException("Expected " + segmentCount
                    + " active flags, modes and step sizes for " + boundaries.length + " boundaries");
        }
        for (int i = 0; i < segmentCount; i++) {
            if (!(stepSizes[i] > 0) || Double.isInfinite(stepSizes[i])) {
                throw new ConfigurationException("Step size of segment " + (i + 1)
                        + " must be positive, got " + stepSizes[i]);
            }
            if (modes[i] == null) {
                throw new ConfigurationException("Segment " + (i + 1) + " has no mode");
            }
            if (modes[i] == SegmentMode.ENERGY && stepSizes[i] < RESOLUTION * (1 - RELATIVE_TOLERANCE)) {
                throw new ConfigurationException(String.format(
                        "Step of segment %d is below the 1e-5 eV resolution: %g eV", i + 1, stepSizes[i]));
            }
            if (active[i] && !(boundaries[i + 1] > boundaries[i])) {
                throw new ConfigurationException(String.format(
                        "Boundaries of segment %d must increase: %.3f -> %.3f", i + 1, boundaries[i], boundaries[i + 1]));
            }
        }
        int activeCount = countActive(active);
        if (activeCount == 0) {
            throw new ConfigurationException("No active scan segment");
        }
        if (dwellTimes == null || (dwellTimes.length != segmentCount && dwellTimes.length != activeCount)) {
            throw new ConfigurationException("Expected a dwell time per segment (" + segmentCount
                    + ") or per active segment (" + activeCount + ")");
        }
    }

    private static int countActive(boolean[] active) {
        int count = 0;
        for (boolean a : active) {
            if (a) count++;
        }
        return count;
    }

    private static void checkPointCount(long count, double from, double to) {
        if (count > MAX_SEGMENT_POINTS) {
            throw new ConfigurationException(String.format(
                    "Segment %.3f .. %.3f eV would need %d points, more than %d",
                    from, to, count, MAX_SEGMENT_POINTS));
        }
    }

    private static void round(double[] points) {
        for (int i = 0; i < points.length; i++) {
            points[i] = Math.rint(points[i] * DECIMALS) / DECIMALS;
        }
    }

    private static void checkIncreasing(double[] points, int segment) {
        for (int i = 1; i < points.length; i++) {
            if (!(points[i] > points[i - 1])) {
                throw new ConfigurationException(String.format(
                        "Step of segment %d is below the 1e-5 eV resolution near %.5f eV", segment + 1, points[i]));
            }
        }
    }

    private static boolean isClose(double a, double b) {
        return Math.abs(a - b) <= RELATIVE_TOLERANCE * Math.max(1.0, Math.max(Math.abs(a), Math.abs(b)));
    }
}
