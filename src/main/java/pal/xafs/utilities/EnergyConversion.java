package pal.xafs.utilities;

/**
 * Conversions between monochromator angle, photon energy, encoder counts and
 * photoelectron wavenumber.
 *
 * <p>The monochromator is a Si(111) double-crystal: E = hc / (2 d sin(theta)).</p>
 */
public final class EnergyConversion {

    /** hc in eV*Angstrom */
    public static final double HC = 12398.5;
    /** Si(111) lattice spacing in Angstrom */
    public static final double SI_111_D = 5.4309 / Math.sqrt(3.0);
    /** k = 0.512 * sqrt(E), k in 1/Angstrom and E in eV above the edge */
    public static final double K_FACTOR = 0.512;

    private EnergyConversion() {
    }

    /**
     * @param angleDeg Bragg angle in degrees
     * @return photon energy in eV
     */
    public static double angleToEnergy(double angleDeg) {
        return HC / (2.0 * SI_111_D * Math.sin(Math.toRadians(angleDeg)));
    }

    /**
     * @param energy photon energy in eV
     * @return Bragg angle in degrees, NaN below the Si(111) cutoff energy
     */
    public static double energyToAngle(double energy) {
        return Math.toDegrees(Math.asin(HC / (2.0 * SI_111_D * energy)));
    }

    /**
     * Encoder counts to angle. A negative sign means increasing counts move the angle down.
     *
     * @param counts     raw encoder value
     * @param sign       encoder direction, +1 or -1
     * @param resolution degrees per count
     * @param startAngle angle at the start of the sweep
     * @return angle in degrees
     */
    public static double encoderToAngle(double counts, double sign, double resolution, double startAngle) {
        return sign * counts * resolution + startAngle;
    }

    public static double energyToWavenumber(double relativeEnergy) {
        return K_FACTOR * Math.sqrt(relativeEnergy);
    }

    public static double wavenumberToEnergy(double k) {
        double ratio = k / K_FACTOR;
        return ratio * ratio;
    }
}
