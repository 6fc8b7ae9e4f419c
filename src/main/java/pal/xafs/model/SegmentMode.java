package pal.xafs.model;

/**
 * Spacing rule of one scan segment.
 */
public enum SegmentMode {
    /** Uniform steps in photon energy (eV). */
    ENERGY,
    /** Uniform steps in photoelectron wavenumber k (1/Angstrom). */
    MOMENTUM
}
