package pal.xafs.ui.liveviewer;

import pal.xafs.model.PlotSeries;

/**
 * Rendering surface of the live viewer. All methods are called on the rendering thread.
 */
public interface PlotCanvas {

    /** Adds the curve, replacing any curve with the same legend. */
    void addCurve(PlotSeries series);

    void removeCurve(String legend);

    void clearCurves();

    void setXLabel(String label);

    void setYLabel(String label);

    void setBusy(boolean busy);

    void setEngineStatus(String status);

    void setAbortEnabled(boolean enabled);

    void showScanStatus(ScanStatus status);
}
