package pal.xafs.ui.liveviewer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pal.xafs.model.ScanCategory;
import pal.xafs.service.bus.EventMessage;
import pal.xafs.service.bus.MessageDispatcher;
import pal.xafs.service.bus.MessageKind;

/**
 * Applies controller messages to the viewer.
 */
public class ViewerMessageHandler {
    private static final Logger logger = LoggerFactory.getLogger(ViewerMessageHandler.class);

    private final LivePlotPipeline pipeline;
    private final ViewerSettings settings;
    private final PlotState plotState;

    public ViewerMessageHandler(LivePlotPipeline pipeline) {
        this.pipeline = pipeline;
        this.settings = pipeline.getSettings();
        this.plotState = pipeline.getPlotState();
    }

    public MessageDispatcher registerOn(MessageDispatcher dispatcher) {
        return dispatcher
                .register(MessageKind.TAB_CHANGED, m -> tabChanged(ScanCategory.fromTabIndex(m.payloadAsInt())))
                .register(MessageKind.UPDATE_VIEWER, m -> pipeline.update())
                .register(MessageKind.X_LABEL, m -> plotState.render(c -> c.setXLabel(m.payload())))
                .register(MessageKind.Y_LABEL, m -> plotState.render(c -> c.setYLabel(m.payload())))
                .register(MessageKind.BLINK, this::blink)
                .register(MessageKind.RUN_ENGINE, m -> plotState.render(c -> c.setEngineStatus(m.payload())))
                .register(MessageKind.REMOVE_CURVE, m -> plotState.remove(m.payload()))
                .register(MessageKind.REMOVE_CURVES, m -> plotState.clear())
                .register(MessageKind.FLY_START_TIME, m -> settings.setFlyStartTime(m.payloadAsDouble()))
                .register(MessageKind.DISABLE_ABORT_BUTTON,
                        m -> plotState.render(c -> c.setAbortEnabled(!m.payloadAsBoolean())));
    }

    public void tabChanged(ScanCategory category) {
        String xLabel = settings.applyCategory(category);
        logger.info("Viewer switched to {}", category);
        if (!settings.isDerivative()) {
            plotState.remove(CurveStyleTable.DERIVATIVE_LEGEND);
        }
        plotState.render(c -> c.setXLabel(xLabel));
        pipeline.update();
    }

    private void blink(EventMessage message) {
        boolean on = message.payloadAsBoolean();
        settings.setBusy(on);
        plotState.render(c -> c.setBusy(on));
    }
}
