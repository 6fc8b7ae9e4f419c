package pal.xafs.controller;

/**
 * Geometry of a continuous monochromator sweep.
 *
 * @param startEnergy  absolute start energy in eV
 * @param stopEnergy   absolute stop energy in eV
 * @param motorSpeed   sweep speed of the theta motor
 * @param encoderSteps encoder counts accumulated per sample
 * @param repetitions  number of sweeps
 * @param coolingTime  pause between sweeps in seconds, null for the configured default
 */
public record FlyScanParameters(double startEnergy, double stopEnergy, double motorSpeed,
                                int encoderSteps, int repetitions, Double coolingTime) {

    public FlyScanParameters {
        if (!(stopEnergy > startEnergy)) {
            throw new IllegalArgumentException("Fly scan stop energy must be above the start energy");
        }
        if (encoderSteps <= 0 || repetitions <= 0 || !(motorSpeed > 0)) {
            throw new IllegalArgumentException("Fly scan speed, encoder steps and repetitions must be positive");
        }
    }
}
