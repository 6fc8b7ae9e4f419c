package pal.xafs.ui.liveviewer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pal.xafs.model.PlotSeries;
import pal.xafs.model.SampleFrame;
import pal.xafs.model.ScanCategory;
import pal.xafs.model.ScanMode;
import pal.xafs.model.XAxisType;
import pal.xafs.service.bus.EventMessage;
import pal.xafs.service.store.DataUnavailableException;
import pal.xafs.service.store.RunMetadata;
import pal.xafs.service.store.RunRecord;
import pal.xafs.service.store.RunStore;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Turns the most recent runs of the active category into plot curves.
 *
 * <p>Each pass runs on the worker executor behind an {@link UpdateSignal}; canvas changes go
 * through {@link PlotState}, which marshals them to the render executor. A run that cannot be
 * read is skipped for this pass and retried on the next one.</p>
 */
public class LivePlotPipeline {
    private static final Logger logger = LoggerFactory.getLogger(LivePlotPipeline.class);

    private final RunStore store;
    private final SampleRetriever retriever;
    private final ViewerSettings settings;
    private final PlotState plotState;
    private final CurveStyleTable styles;
    private final Consumer<EventMessage> toController;
    private final UpdateSignal signal;

    public LivePlotPipeline(RunStore store, SampleRetriever retriever, ViewerSettings settings,
                            PlotState plotState, CurveStyleTable styles,
                            Consumer<EventMessage> toController, Executor worker) {
        this.store = store;
        this.retriever = retriever;
        this.settings = settings;
        this.plotState = plotState;
        this.styles = styles;
        this.toController = toController;
        this.signal = new UpdateSignal(worker, this::runPass);
    }

    /**
     * Requests a pass. Requests made while a pass is running collapse into one.
     */
    public void update() {
        signal.raise();
    }

    public ViewerSettings getSettings() {
        return settings;
    }

    public PlotState getPlotState() {
        return plotState;
    }

    void runPass() {
        ViewerSettings.Snapshot snap = settings.snapshot();
        int depth = snap.historyDepth();

        for (int slot = depth; slot < CurveStyleTable.MAX_SLOTS; slot++) {
            plotState.remove(styles.legend(slot));
        }
        if (!snap.derivative() || snap.category() == ScanCategory.ALIGN) {
            plotState.remove(CurveStyleTable.DERIVATIVE_LEGEND);
        }

        List<RunRecord> runs = store.latest(snap.category(), depth);
        for (int slot = 0; slot < runs.size() && slot < depth; slot++) {
            RunRecord run = runs.get(slot);
            try {
                processSlot(slot, run, snap);
            } catch (DataUnavailableException e) {
                logger.debug("Slot {} skipped: {}", slot, e.getMessage());
            } catch (RuntimeException e) {
                logger.warn("Slot {} (run {}) failed", slot, run.uid(), e);
            }
        }
    }

    private void processSlot(int slot, RunRecord run, ViewerSettings.Snapshot snap) throws DataUnavailableException {
        RunMetadata metadata = run.metadata();
        String legend = styles.legend(slot);

        SampleFrame frame;
        try {
            frame = retriever.retrieve(run, metadata);
        } catch (DataUnavailableException e) {
            if (metadata.mode() == ScanMode.STEP && snap.category() != ScanCategory.ALIGN) {
                plotState.publish(PlotSeries.empty(legend, styles.zOrder(slot), styles.color(slot)));
            }
            throw e;
        }
        if (frame.isEmpty()) {
            return;
        }
        frame = SignalProcessing.correct(frame, metadata.darkCurrent());

        if (slot == 0) {
            reportStatus(frame, metadata, snap);
        }

        double[][] xy = SignalProcessing.finitePairs(
                SignalProcessing.deriveX(snap.xAxis(), frame, metadata.e0()),
                SignalProcessing.deriveY(snap.yAxis(), frame));
        double[] x = xy[0];
        double[] y = xy[1];
        plotState.publish(new PlotSeries(legend, x, y, styles.zOrder(slot), styles.color(slot),
                PlotSeries.YAxisSide.LEFT));

        if (slot != 0) {
            return;
        }
        switch (snap.category()) {
            case MEASURE -> publishDerivative(x, y, snap);
            case CALIBRATION -> {
                reportCalibrationPeak(x, y, metadata.e0(), snap.xAxis());
                publishDerivative(x, y, snap);
            }
            case ALIGN -> reportAlignment(y, snap.alignRatio());
        }
    }

    private void reportStatus(SampleFrame frame, RunMetadata metadata, ViewerSettings.Snapshot snap) {
        ScanStatus status = ScanStatus.of(frame, metadata, snap.category(), snap.flyStartTime(),
                System.currentTimeMillis() / 1000.0);
        plotState.render(canvas -> canvas.showScanStatus(status));
        if (status.progressPercent() != null) {
            toController.accept(EventMessage.progressBar(status.progressPercent()));
        }
    }

    private void publishDerivative(double[] x, double[] y, ViewerSettings.Snapshot snap) {
        if (!snap.derivative()) {
            return;
        }
        double[][] d = SignalProcessing.finitePairs(x, SignalProcessing.backwardDerivative(x, y));
        plotState.publish(new PlotSeries(CurveStyleTable.DERIVATIVE_LEGEND, d[0], d[1],
                styles.derivativeZOrder(), styles.derivativeColor(), PlotSeries.YAxisSide.RIGHT));
    }

    private void reportCalibrationPeak(double[] x, double[] y, double e0, XAxisType xAxis) {
        if (x.length <= 2) {
            return;
        }
        double[][] d = SignalProcessing.finitePairs(x, SignalProcessing.backwardDerivative(x, y));
        int peak = SignalProcessing.argMax(d[1]);
        if (peak < 0) {
            return;
        }
        double energy = xAxis == XAxisType.DELTA_ENERGY ? d[0][peak] + e0 : d[0][peak];
        toController.accept(EventMessage.ecalPeakEnergy(energy));
        toController.accept(EventMessage.ecalEnergyDifference(energy - e0));
    }

    private void reportAlignment(double[] y, double ratio) {
        if (y.length == 0) {
            return;
        }
        double last = y[y.length - 1];
        toController.accept(EventMessage.dcmI0(last));
        toController.accept(EventMessage.dcmI0Second(last * ratio));
    }
}
