package pal.xafs.model;

/**
 * Quantity plotted on the y axis of the live viewer.
 */
public enum YAxisType {
    /** -ln(It/I0) */
    TRANSMITTANCE,
    /** If/I0 */
    FLUORESCENCE,
    /** -ln(Ir/It) */
    REFERENCE,
    I0,
    IT,
    IF,
    IR
}
