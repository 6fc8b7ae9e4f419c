package pal.xafs.ui.liveviewer;

import pal.xafs.model.Channel;
import pal.xafs.model.DarkCurrent;
import pal.xafs.model.SampleFrame;
import pal.xafs.model.XAxisType;
import pal.xafs.model.YAxisType;
import pal.xafs.service.store.DataUnavailableException;

import java.util.Arrays;

/**
 * Numerical steps of the live plot: dark correction, derived quantities,
 * finite filtering and the backward derivative.
 */
public final class SignalProcessing {

    private SignalProcessing() {
    }

    /**
     * raw - rate * dwell, element by element.
     */
    public static double[] subtractDark(double[] raw, double rate, double[] dwell) {
        double[] corrected = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            corrected[i] = raw[i] - rate * dwell[i];
        }
        return corrected;
    }

    /**
     * Dark-corrects every channel column present in the frame. Frames without a dwell
     * column (fly scans) are returned unchanged.
     */
    public static SampleFrame correct(SampleFrame frame, DarkCurrent dark) {
        if (!frame.has(SampleFrame.DWELL)) {
            return frame;
        }
        double[] dwell = frame.column(SampleFrame.DWELL);
        SampleFrame corrected = frame;
        for (Channel channel : Channel.values()) {
            if (frame.has(channel.column())) {
                corrected = corrected.with(channel.column(),
                        subtractDark(frame.column(channel), dark.rate(channel), dwell));
            }
        }
        return corrected;
    }

    public static double[] deriveY(YAxisType type, SampleFrame frame) throws DataUnavailableException {
        return switch (type) {
            case TRANSMITTANCE -> negLogRatio(require(frame, Channel.IT), require(frame, Channel.I0));
            case FLUORESCENCE -> ratio(require(frame, Channel.IF), require(frame, Channel.I0));
            case REFERENCE -> negLogRatio(require(frame, Channel.IR), require(frame, Channel.IT));
            case I0 -> require(frame, Channel.I0);
            case IT -> require(frame, Channel.IT);
            case IF -> require(frame, Channel.IF);
            case IR -> require(frame, Channel.IR);
        };
    }

    public static double[] deriveX(XAxisType type, SampleFrame frame, double e0) throws DataUnavailableException {
        if (type == XAxisType.INDEX) {
            double[] index = new double[frame.size()];
            for (int i = 0; i < index.length; i++) {
                index[i] = i;
            }
            return index;
        }
        double[] energy = frame.column(SampleFrame.ENERGY);
        if (energy == null) {
            throw new DataUnavailableException("Run has no " + SampleFrame.ENERGY + " column");
        }
        if (type == XAxisType.DELTA_ENERGY) {
            for (int i = 0; i < energy.length; i++) {
                energy[i] -= e0;
            }
        }
        return energy;
    }

    /**
     * Drops every index where x or y is NaN or infinite, keeping both arrays aligned.
     *
     * @return {x, y}
     */
    public static double[][] finitePairs(double[] x, double[] y) {
        int n = Math.min(x.length, y.length);
        double[] fx = new double[n];
        double[] fy = new double[n];
        int k = 0;
        for (int i = 0; i < n; i++) {
            if (Double.isFinite(x[i]) && Double.isFinite(y[i])) {
                fx[k] = x[i];
                fy[k] = y[i];
                k++;
            }
        }
        return new double[][]{Arrays.copyOf(fx, k), Arrays.copyOf(fy, k)};
    }

    /**
     * Backward difference; the first point uses points 0 and 1.
     * Fewer than two points give an empty result.
     */
    public static double[] backwardDerivative(double[] x, double[] y) {
        int n = Math.min(x.length, y.length);
        if (n < 2) {
            return new double[0];
        }
        double[] der = new double[n];
        der[0] = (y[0] - y[1]) / (x[0] - x[1]);
        for (int i = 1; i < n; i++) {
            der[i] = (y[i] - y[i - 1]) / (x[i] - x[i - 1]);
        }
        return der;
    }

    /**
     * @return index of the first maximum, -1 for an empty array
     */
    public static int argMax(double[] values) {
        int best = -1;
        for (int i = 0; i < values.length; i++) {
            if (best < 0 || values[i] > values[best]) {
                best = i;
            }
        }
        return best;
    }

    private static double[] require(SampleFrame frame, Channel channel) throws DataUnavailableException {
        double[] values = frame.column(channel);
        if (values == null) {
            throw new DataUnavailableException("Run has no " + channel.column() + " column");
        }
        return values;
    }

    private static double[] ratio(double[] numerator, double[] denominator) {
        double[] result = new double[numerator.length];
        for (int i = 0; i < result.length; i++) {
            result[i] = numerator[i] / denominator[i];
        }
        return result;
    }

    private static double[] negLogRatio(double[] numerator, double[] denominator) {
        double[] result = ratio(numerator, denominator);
        for (int i = 0; i < result.length; i++) {
            result[i] = -Math.log(result[i]);
        }
        return result;
    }
}
