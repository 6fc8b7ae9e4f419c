package pal.xafs.ui.liveviewer;

import org.junit.jupiter.api.Test;
import pal.xafs.model.ScanCategory;
import pal.xafs.model.XAxisType;
import pal.xafs.model.YAxisType;

import static org.junit.jupiter.api.Assertions.*;

class ViewerSettingsTest {

    @Test
    void testApplyCategory_MeasureYAxisSavedAndRestored() {
        ViewerSettings settings = new ViewerSettings(3, 1.0);
        settings.setYAxis(YAxisType.FLUORESCENCE);

        assertEquals(ViewerSettings.ENERGY_LABEL, settings.applyCategory(ScanCategory.CALIBRATION));
        assertEquals(YAxisType.TRANSMITTANCE, settings.getYAxis());
        assertTrue(settings.isDerivative());

        assertEquals(ViewerSettings.INDEX_LABEL, settings.applyCategory(ScanCategory.ALIGN));
        assertEquals(YAxisType.IT, settings.getYAxis());
        assertFalse(settings.isDerivative());

        assertEquals(ViewerSettings.ENERGY_LABEL, settings.applyCategory(ScanCategory.MEASURE));
        assertEquals(YAxisType.FLUORESCENCE, settings.getYAxis());
    }

    @Test
    void testApplyCategory_MeasureAgainKeepsCurrentY() {
        ViewerSettings settings = new ViewerSettings(3, 1.0);
        settings.setYAxis(YAxisType.REFERENCE);
        settings.applyCategory(ScanCategory.MEASURE);
        assertEquals(YAxisType.REFERENCE, settings.getYAxis());
    }

    @Test
    void testSnapshot_AlignForcesSingleRunByIndex() {
        ViewerSettings settings = new ViewerSettings(5, 2.0);
        settings.applyCategory(ScanCategory.ALIGN);
        ViewerSettings.Snapshot snap = settings.snapshot();

        assertEquals(1, snap.historyDepth());
        assertEquals(XAxisType.INDEX, snap.xAxis());
        assertEquals(2.0, snap.alignRatio());
        assertEquals(5, settings.getHistoryDepth());
    }

    @Test
    void testHistoryDepthClamped() {
        ViewerSettings settings = new ViewerSettings(0, 1.0);
        assertEquals(1, settings.getHistoryDepth());
        settings.setHistoryDepth(25);
        assertEquals(CurveStyleTable.MAX_SLOTS, settings.getHistoryDepth());
    }
}
