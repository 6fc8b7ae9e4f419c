package pal.xafs.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SampleFrameTest {

    @Test
    void testColumnsMustHaveEqualLength() {
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put("I0", new double[]{1, 2});
        columns.put("It", new double[]{1});
        assertThrows(IllegalArgumentException.class, () -> new SampleFrame(columns));
    }

    @Test
    void testWithAddsColumnWithoutTouchingOriginal() {
        SampleFrame frame = new SampleFrame(Map.of("I0", new double[]{1, 2}));
        SampleFrame energy = frame.with(SampleFrame.ENERGY, new double[]{8979, 8980});

        assertFalse(frame.has(SampleFrame.ENERGY));
        assertTrue(energy.has(SampleFrame.ENERGY));
        assertArrayEquals(new double[]{1, 2}, energy.column(Channel.I0));
        assertNull(energy.column(Channel.IT));
    }

    @Test
    void testEmptyFrame() {
        SampleFrame frame = new SampleFrame(Map.of());
        assertTrue(frame.isEmpty());
        assertEquals(0, frame.size());
    }
}
