package pal.xafs.ui.liveviewer;

import pal.xafs.model.ScanCategory;
import pal.xafs.model.XAxisType;
import pal.xafs.model.YAxisType;

/**
 * User-facing viewer options plus the active scan category. Thread-safe; the pipeline
 * reads an immutable {@link Snapshot} once per pass.
 */
public class ViewerSettings {

    public static final String ENERGY_LABEL = "Energy [eV]";
    public static final String INDEX_LABEL = "index";

    private ScanCategory category = ScanCategory.MEASURE;
    private int historyDepth;
    private XAxisType xAxis = XAxisType.DELTA_ENERGY;
    private YAxisType yAxis = YAxisType.TRANSMITTANCE;
    private YAxisType savedYAxis = YAxisType.TRANSMITTANCE;
    private boolean derivative;
    private double alignRatio;
    private double flyStartTime = Double.NaN;
    private boolean busy;

    /**
     * @param historyDepth runs shown per category, 1..10
     * @param alignRatio   factor applied to the second alignment readback
     */
    public ViewerSettings(int historyDepth, double alignRatio) {
        this.historyDepth = clampDepth(historyDepth);
        this.alignRatio = alignRatio;
    }

    public record Snapshot(ScanCategory category, int historyDepth, XAxisType xAxis, YAxisType yAxis,
                           boolean derivative, double alignRatio, double flyStartTime) {
    }

    public synchronized Snapshot snapshot() {
        int depth = category == ScanCategory.ALIGN ? 1 : historyDepth;
        XAxisType x = category == ScanCategory.ALIGN ? XAxisType.INDEX : xAxis;
        return new Snapshot(category, depth, x, yAxis, derivative, alignRatio, flyStartTime);
    }

    /**
     * Switches the active category and the axis defaults that go with it.
     * The measurement y axis is remembered when leaving the measurement tab and
     * restored when returning to it.
     *
     * @return the x-axis label for the new category
     */
    public synchronized String applyCategory(ScanCategory next) {
        ScanCategory previous = category;
        category = next;
        switch (next) {
            case MEASURE -> {
                if (previous != ScanCategory.MEASURE) {
                    yAxis = savedYAxis;
                }
                derivative = false;
                return ENERGY_LABEL;
            }
            case CALIBRATION -> {
                if (previous == ScanCategory.MEASURE) {
                    savedYAxis = yAxis;
                }
                yAxis = YAxisType.TRANSMITTANCE;
                derivative = true;
                return ENERGY_LABEL;
            }
            case ALIGN -> {
                if (previous == ScanCategory.MEASURE) {
                    savedYAxis = yAxis;
                }
                yAxis = YAxisType.IT;
                derivative = false;
                return INDEX_LABEL;
            }
        }
        throw new IllegalStateException("Unhandled category " + next);
    }

    public synchronized ScanCategory getCategory() {
        return category;
    }

    public synchronized int getHistoryDepth() {
        return historyDepth;
    }

    public synchronized void setHistoryDepth(int depth) {
        historyDepth = clampDepth(depth);
    }

    public synchronized XAxisType getXAxis() {
        return xAxis;
    }

    public synchronized void setXAxis(XAxisType xAxis) {
        this.xAxis = xAxis;
    }

    public synchronized YAxisType getYAxis() {
        return yAxis;
    }

    public synchronized void setYAxis(YAxisType yAxis) {
        this.yAxis = yAxis;
    }

    public synchronized boolean isDerivative() {
        return derivative;
    }

    public synchronized void setDerivative(boolean derivative) {
        this.derivative = derivative;
    }

    public synchronized double getAlignRatio() {
        return alignRatio;
    }

    public synchronized void setAlignRatio(double alignRatio) {
        this.alignRatio = alignRatio;
    }

    public synchronized double getFlyStartTime() {
        return flyStartTime;
    }

    public synchronized void setFlyStartTime(double flyStartTime) {
        this.flyStartTime = flyStartTime;
    }

    public synchronized boolean isBusy() {
        return busy;
    }

    public synchronized void setBusy(boolean busy) {
        this.busy = busy;
    }

    private static int clampDepth(int depth) {
        return Math.max(1, Math.min(CurveStyleTable.MAX_SLOTS, depth));
    }
}
