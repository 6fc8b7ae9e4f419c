package pal.xafs.service.hardware;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ChannelAccessTest {

    private final HardwareChannels hardware = mock(HardwareChannels.class);
    private final ChannelAccess access = new ChannelAccess(hardware, 3, 1, 200);

    @AfterEach
    void tearDown() {
        access.close();
    }

    @Test
    void testRead_RetriesUntilSuccess() throws Exception {
        when(hardware.readScalar(ScalarChannel.MOTOR_SPEED))
                .thenThrow(new IOException("no reply"))
                .thenThrow(new IOException("no reply"))
                .thenReturn(0.25);

        assertEquals(0.25, access.read(ScalarChannel.MOTOR_SPEED));
        verify(hardware, times(3)).readScalar(ScalarChannel.MOTOR_SPEED);
    }

    @Test
    void testRead_GivesUpAfterAllAttempts() throws Exception {
        when(hardware.readScalar(ScalarChannel.MOTION_DONE)).thenThrow(new IOException("disconnected"));

        DeviceTimeoutException e = assertThrows(DeviceTimeoutException.class,
                () -> access.read(ScalarChannel.MOTION_DONE));
        assertTrue(e.getMessage().contains("3 attempts"));
        verify(hardware, times(3)).readScalar(ScalarChannel.MOTION_DONE);
    }

    @Test
    void testWrite_UnacknowledgedCountsAsFailure() throws Exception {
        when(hardware.writeScalar(ScalarChannel.CAPTURE_MODE, 1.0)).thenReturn(false, false, true);

        access.write(ScalarChannel.CAPTURE_MODE, 1.0);
        verify(hardware, times(3)).writeScalar(ScalarChannel.CAPTURE_MODE, 1.0);

        when(hardware.writeScalar(ScalarChannel.CAPTURE_MODE, 0.0)).thenReturn(false);
        assertThrows(DeviceTimeoutException.class, () -> access.write(ScalarChannel.CAPTURE_MODE, 0.0));
    }

    @Test
    void testRead_SlowCallTimesOut() throws Exception {
        when(hardware.readScalar(ScalarChannel.ENCODER_RESOLUTION)).thenAnswer(invocation -> {
            Thread.sleep(2000);
            return 1e-5;
        });
        ChannelAccess single = new ChannelAccess(hardware, 1, 0, 50);
        try {
            long start = System.nanoTime();
            assertThrows(DeviceTimeoutException.class, () -> single.read(ScalarChannel.ENCODER_RESOLUTION));
            assertTrue(System.nanoTime() - start < 1_500_000_000L);
        } finally {
            single.close();
        }
    }

    @Test
    void testReadWaveformOnce_NoRetryAndNullAsEmpty() throws Exception {
        when(hardware.readWaveform(WaveformChannel.I0)).thenReturn(null);
        assertEquals(0, access.readWaveformOnce(WaveformChannel.I0).length);

        when(hardware.readWaveform(WaveformChannel.IT)).thenThrow(new IOException("buffer busy"));
        assertThrows(DeviceTimeoutException.class, () -> access.readWaveformOnce(WaveformChannel.IT));
        verify(hardware, times(1)).readWaveform(WaveformChannel.IT);
    }

    @Test
    void testConstructor_RejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class, () -> new ChannelAccess(hardware, 0, 0, 100));
    }
}
