package pal.xafs.controller;

import java.io.IOException;

/**
 * The four current amplifiers in front of the ion chambers.
 */
public interface AmplifierControl {

    /** Starts the zero correction on every amplifier. */
    void zeroCorrect() throws IOException;

    void setZeroCheck(boolean on) throws IOException;
}
