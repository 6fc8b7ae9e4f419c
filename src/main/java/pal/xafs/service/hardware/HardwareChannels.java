package pal.xafs.service.hardware;

import java.io.IOException;

/**
 * Raw access to beamline hardware. Implementations talk to the control system;
 * tests substitute an in-memory double.
 */
public interface HardwareChannels {

    double readScalar(ScalarChannel channel) throws IOException;

    /**
     * @return true once the control system acknowledged the write
     */
    boolean writeScalar(ScalarChannel channel, double value) throws IOException;

    /**
     * @return the buffered values, or null/empty when the read returned nothing
     */
    double[] readWaveform(WaveformChannel channel) throws IOException;
}
