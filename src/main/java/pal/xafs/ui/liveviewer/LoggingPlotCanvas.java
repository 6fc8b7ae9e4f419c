package pal.xafs.ui.liveviewer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pal.xafs.model.PlotSeries;

/**
 * Headless canvas that writes every change to the log.
 */
public class LoggingPlotCanvas implements PlotCanvas {
    private static final Logger logger = LoggerFactory.getLogger(LoggingPlotCanvas.class);

    @Override
    public void addCurve(PlotSeries series) {
        logger.info("Curve {}", series);
    }

    @Override
    public void removeCurve(String legend) {
        logger.info("Removed curve {}", legend);
    }

    @Override
    public void clearCurves() {
        logger.info("Cleared curves");
    }

    @Override
    public void setXLabel(String label) {
        logger.debug("X label: {}", label);
    }

    @Override
    public void setYLabel(String label) {
        logger.debug("Y label: {}", label);
    }

    @Override
    public void setBusy(boolean busy) {
        logger.debug("Busy: {}", busy);
    }

    @Override
    public void setEngineStatus(String status) {
        logger.info("Run engine: {}", status);
    }

    @Override
    public void setAbortEnabled(boolean enabled) {
        logger.debug("Abort enabled: {}", enabled);
    }

    @Override
    public void showScanStatus(ScanStatus status) {
        logger.debug("{}", status);
    }
}
