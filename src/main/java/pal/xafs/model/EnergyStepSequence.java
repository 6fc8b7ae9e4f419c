package pal.xafs.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Energies to visit in a step scan, grouped per generated segment, with one dwell time per segment.
 *
 * <p>The flattened sequence is strictly increasing. Energies are relative to E0 as produced by the
 * trajectory generator; {@link #toAbsolute(double)} shifts them to absolute eV.</p>
 */
public final class EnergyStepSequence {

    private final List<double[]> segments;
    private final double[] dwellTimes;

    public EnergyStepSequence(List<double[]> segments, double[] dwellTimes) {
        if (segments.size() != dwellTimes.length) {
            throw new IllegalArgumentException("Expected one dwell time per segment, got "
                    + dwellTimes.length + " for " + segments.size() + " segments");
        }
        List<double[]> copies = new ArrayList<>(segments.size());
        for (double[] segment : segments) {
            copies.add(segment.clone());
        }
        this.segments = Collections.unmodifiableList(copies);
        this.dwellTimes = dwellTimes.clone();
    }

    public int segmentCount() {
        return segments.size();
    }

    public double[] segment(int index) {
        return segments.get(index).clone();
    }

    public double dwellTime(int index) {
        return dwellTimes[index];
    }

    public double[] dwellTimes() {
        return dwellTimes.clone();
    }

    public int totalPoints() {
        int total = 0;
        for (double[] segment : segments) {
            total += segment.length;
        }
        return total;
    }

    /**
     * @return all energies in scan order
     */
    public double[] flatten() {
        double[] all = new double[totalPoints()];
        int offset = 0;
        for (double[] segment : segments) {
            System.arraycopy(segment, 0, all, offset, segment.length);
            offset += segment.length;
        }
        return all;
    }

    public double first() {
        return segments.get(0)[0];
    }

    public double last() {
        double[] tail = segments.get(segments.size() - 1);
        return tail[tail.length - 1];
    }

    /**
     * @return the first energy of every segment followed by the final energy of the scan
     */
    public double[] segmentStartPoints() {
        double[] points = new double[segments.size() + 1];
        for (int i = 0; i < segments.size(); i++) {
            points[i] = segments.get(i)[0];
        }
        points[segments.size()] = last();
        return points;
    }

    /**
     * @param e0 edge energy in eV
     * @return a copy with every energy shifted by {@code e0}
     */
    public EnergyStepSequence toAbsolute(double e0) {
        List<double[]> shifted = new ArrayList<>(segments.size());
        for (double[] segment : segments) {
            double[] s = new double[segment.length];
            for (int i = 0; i < s.length; i++) {
                s[i] = segment[i] + e0;
            }
            shifted.add(s);
        }
        return new EnergyStepSequence(shifted, dwellTimes);
    }
}
