package pal.xafs.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pal.xafs.model.ScanCategory;
import pal.xafs.service.bus.EventMessage;
import pal.xafs.service.bus.MessageDispatcher;
import pal.xafs.service.bus.MessageKind;

import java.util.function.Consumer;

/**
 * Applies viewer messages to the controller.
 */
public class ControllerMessageHandler {
    private static final Logger logger = LoggerFactory.getLogger(ControllerMessageHandler.class);

    private final ScanOrchestrator orchestrator;
    private final ControllerDisplayState state;
    private final Consumer<EventMessage> toViewer;

    public ControllerMessageHandler(ScanOrchestrator orchestrator, ControllerDisplayState state,
                                    Consumer<EventMessage> toViewer) {
        this.orchestrator = orchestrator;
        this.state = state;
        this.toViewer = toViewer;
    }

    public MessageDispatcher registerOn(MessageDispatcher dispatcher) {
        return dispatcher
                .register(MessageKind.ABORT, m -> orchestrator.abort())
                .register(MessageKind.VIEWER_INITIALIZED, m -> {
                    logger.info("Viewer initialized, resending current tab");
                    toViewer.accept(EventMessage.tabChanged(state.getCurrentTab()));
                })
                .register(MessageKind.PROGRESS_BAR, m -> state.setProgress(m.payloadAsInt()))
                .register(MessageKind.ECAL_PEAK_ENERGY, m -> state.setPeakEnergy(m.payload()))
                .register(MessageKind.ECAL_ENERGY_DIFFERENCE, m -> state.setEnergyDifference(m.payload()))
                .register(MessageKind.DCM_I0, m -> state.setDcmI0(m.payload()))
                .register(MessageKind.DCM_I0_2, m -> state.setDcmI0Second(m.payload()));
    }

    /**
     * Called when the operator switches controller tabs.
     */
    public void selectTab(ScanCategory category) {
        state.setCurrentTab(category);
        toViewer.accept(EventMessage.tabChanged(category));
    }
}
