package pal.xafs.model;

/**
 * One sample drained from the fly-scan capture buffer.
 *
 * @param time    acquisition time, seconds since the epoch
 * @param encoder raw encoder count
 * @param angle   monochromator angle in degrees derived from the encoder
 * @param energy  photon energy in eV derived from the angle
 * @param ch1     I0 counts
 * @param ch2     It counts
 * @param ch3     If counts
 * @param ch4     Ir counts
 */
public record FlySample(double time, double encoder, double angle, double energy,
                        double ch1, double ch2, double ch3, double ch4) {
}
