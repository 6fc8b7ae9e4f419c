package pal.xafs.ui.liveviewer;

import org.junit.jupiter.api.Test;
import pal.xafs.model.SampleFrame;
import pal.xafs.model.ScanCategory;
import pal.xafs.model.ScanMode;
import pal.xafs.service.store.RunMetadata;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScanStatusTest {

    private static RunMetadata metadata(ScanMode mode, int points) {
        return RunMetadata.builder().category(ScanCategory.MEASURE).mode(mode).e0(8979).scanPoints(points).build();
    }

    @Test
    void testStepScan_LoopTimeAndProgress() {
        SampleFrame frame = new SampleFrame(Map.of(SampleFrame.TIME, new double[]{100.0, 101.2, 102.437}));
        ScanStatus status = ScanStatus.of(frame, metadata(ScanMode.STEP, 10), ScanCategory.MEASURE, Double.NaN, 0);

        assertEquals(3, status.points());
        assertEquals(10, status.totalPoints());
        assertEquals(1.24, status.loopTime());
        assertNull(status.elapsedTime());
        assertEquals(40, status.progressPercent());
    }

    @Test
    void testFlyScan_ElapsedSinceStart() {
        SampleFrame frame = new SampleFrame(Map.of(SampleFrame.ENCODER, new double[]{0, 10, 20}));
        ScanStatus status = ScanStatus.of(frame, metadata(ScanMode.FLY, 300), ScanCategory.MEASURE, 1000.0, 1012.34);

        assertEquals(12.3, status.elapsedTime());
        assertNull(status.loopTime());
        assertEquals(1, status.progressPercent());
    }

    @Test
    void testAlign_NoProgressReported() {
        SampleFrame frame = new SampleFrame(Map.of(SampleFrame.TIME, new double[]{1, 2, 3}));
        ScanStatus status = ScanStatus.of(frame, metadata(ScanMode.STEP, 10), ScanCategory.ALIGN, Double.NaN, 0);

        assertEquals(0, status.totalPoints());
        assertNull(status.progressPercent());
    }

    @Test
    void testUnknownTotal_NoProgress() {
        SampleFrame frame = new SampleFrame(Map.of(SampleFrame.TIME, new double[]{1}));
        assertNull(ScanStatus.of(frame, metadata(ScanMode.STEP, 0), ScanCategory.MEASURE, Double.NaN, 0)
                .progressPercent());
    }
}
