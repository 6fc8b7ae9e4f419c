package pal.xafs.service.hardware;

import pal.xafs.model.FlySample;
import pal.xafs.utilities.EnergyConversion;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The five waveforms read back after a fly scan, already truncated to a common length.
 */
public record FlyWaveforms(double[] encoder, double[] i0, double[] it, double[] iF, double[] ir) {

    /**
     * Truncates every waveform to {@code min(requested, shortest length)}. Never pads.
     */
    public static FlyWaveforms truncated(int requested, double[] encoder, double[] i0, double[] it,
                                         double[] iF, double[] ir) {
        int n = Math.max(0, requested);
        for (double[] w : new double[][]{encoder, i0, it, iF, ir}) {
            n = Math.min(n, w.length);
        }
        return new FlyWaveforms(Arrays.copyOf(encoder, n), Arrays.copyOf(i0, n), Arrays.copyOf(it, n),
                Arrays.copyOf(iF, n), Arrays.copyOf(ir, n));
    }

    public int length() {
        return encoder.length;
    }

    public List<FlySample> toSamples(double time, double encoderSign, double resolution, double startAngle) {
        List<FlySample> samples = new ArrayList<>(length());
        for (int i = 0; i < length(); i++) {
            double angle = EnergyConversion.encoderToAngle(encoder[i], encoderSign, resolution, startAngle);
            samples.add(new FlySample(time, encoder[i], angle, EnergyConversion.angleToEnergy(angle),
                    i0[i], it[i], iF[i], ir[i]));
        }
        return samples;
    }
}
