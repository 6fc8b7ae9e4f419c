package pal.xafs.model;

public enum XAxisType {
    /** Energy relative to the edge, E - E0 */
    DELTA_ENERGY,
    /** Absolute energy in eV */
    ENERGY,
    /** Sample index, used by alignment scans */
    INDEX
}
