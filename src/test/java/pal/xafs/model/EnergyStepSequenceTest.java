package pal.xafs.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EnergyStepSequenceTest {

    @Test
    void testSegmentStartPoints() {
        EnergyStepSequence seq = new EnergyStepSequence(
                List.of(new double[]{-20, -10}, new double[]{-5, 0, 5}), new double[]{1, 2});
        assertArrayEquals(new double[]{-20, -5, 5}, seq.segmentStartPoints());
        assertEquals(5, seq.totalPoints());
        assertEquals(-20, seq.first());
        assertEquals(5, seq.last());
    }

    @Test
    void testDwellCountMustMatch() {
        assertThrows(IllegalArgumentException.class,
                () -> new EnergyStepSequence(List.of(new double[]{1}), new double[]{1, 2}));
    }

    @Test
    void testSegmentsAreCopies() {
        double[] segment = {1, 2, 3};
        EnergyStepSequence seq = new EnergyStepSequence(List.of(segment), new double[]{1});
        segment[0] = 99;
        seq.segment(0)[1] = 99;
        assertArrayEquals(new double[]{1, 2, 3}, seq.flatten());
    }
}
