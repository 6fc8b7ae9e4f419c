package pal.xafs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pal.xafs.controller.AmplifierControl;
import pal.xafs.controller.ControlSurface;
import pal.xafs.controller.ControllerDisplayState;
import pal.xafs.controller.ControllerMessageHandler;
import pal.xafs.controller.DarkCurrentWorkflow;
import pal.xafs.controller.HardwarePlanExecutor;
import pal.xafs.controller.PlanExecutor;
import pal.xafs.controller.ScalerCounter;
import pal.xafs.controller.ScanAbortedException;
import pal.xafs.controller.ScanOrchestrator;
import pal.xafs.controller.ScanOutcome;
import pal.xafs.controller.ScanRequest;
import pal.xafs.controller.ScanTimings;
import pal.xafs.model.DarkCurrent;
import pal.xafs.service.bus.EventBusPublisher;
import pal.xafs.service.bus.EventBusSubscriber;
import pal.xafs.service.bus.EventMessage;
import pal.xafs.service.bus.MessageDispatcher;
import pal.xafs.service.bus.MessageKind;
import pal.xafs.service.hardware.ChannelAccess;
import pal.xafs.service.hardware.FlyerController;
import pal.xafs.service.hardware.HardwareChannels;
import pal.xafs.service.store.RunStore;
import pal.xafs.utilities.ScanLogger;
import pal.xafs.utilities.XafsConfigManager;

import java.io.File;
import java.io.IOException;

/**
 * Wires the acquisition side: hardware access, flyer, orchestrator and both ends of the event bus.
 */
public class ControllerProcess implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ControllerProcess.class);

    private final XafsConfigManager config;
    private final ChannelAccess channels;
    private final FlyerController flyer;
    private final EventBusPublisher publisher;
    private final EventBusSubscriber subscriber;
    private final ScanOrchestrator orchestrator;
    private final DarkCurrentWorkflow darkCurrent;
    private final ControllerDisplayState displayState = new ControllerDisplayState();
    private final ControllerMessageHandler messages;

    public ControllerProcess(XafsConfigManager config, HardwareChannels hardware, AmplifierControl amplifiers,
                             ScalerCounter scaler, RunStore store, ControlSurface controls) throws IOException {
        this.config = config;
        this.channels = ChannelAccess.fromConfig(hardware, config);
        this.flyer = FlyerController.fromConfig(channels, config);
        PlanExecutor executor = new HardwarePlanExecutor(channels, scaler, store,
                config.getInt(100, "hardware", "liveness_poll_ms"),
                (long) (config.getDouble(120, "hardware", "motion_timeout_s") * 1000));

        this.publisher = new EventBusPublisher("controller", config.getInt(5201, "event_bus", "controller_port"));
        this.darkCurrent = DarkCurrentWorkflow.fromConfig(amplifiers, scaler, config);
        this.orchestrator = new ScanOrchestrator(executor, flyer, channels, controls, this::sendToViewer,
                ScanTimings.fromConfig(config), darkCurrent);
        this.messages = new ControllerMessageHandler(orchestrator, displayState, this::sendToViewer);

        MessageDispatcher dispatcher = messages.registerOn(new MessageDispatcher());
        this.subscriber = new EventBusSubscriber("controller",
                config.getString("localhost", "event_bus", "host"),
                config.getInt(5301, "event_bus", "viewer_port"),
                config.getInt(1000, "event_bus", "reconnect_delay_ms"),
                dispatcher);
        subscriber.start();
        logger.info("Controller started");
    }

    private void sendToViewer(EventMessage message) {
        if (message.kind() == MessageKind.RUN_ENGINE) {
            displayState.setEngineState(message.payload());
        }
        publisher.send(message);
    }

    /**
     * Runs a scan on the calling thread, with a per-scan log file when one is configured.
     */
    public ScanOutcome runScan(ScanRequest request) {
        String logDir = config.getString("", "logging", "run_log_dir");
        if (logDir.isBlank()) {
            return orchestrator.run(request);
        }
        try (ScanLogger.Session session = ScanLogger.start(new File(logDir))) {
            return orchestrator.run(request);
        }
    }

    /**
     * Measures the dark current with the shutter closed; later step scans record the result.
     */
    public DarkCurrent measureDarkCurrent() throws IOException, ScanAbortedException {
        return orchestrator.measureDarkCurrent();
    }

    public ScanOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public DarkCurrentWorkflow getDarkCurrent() {
        return darkCurrent;
    }

    public ControllerDisplayState getDisplayState() {
        return displayState;
    }

    public ControllerMessageHandler getMessages() {
        return messages;
    }

    public int getPublisherPort() {
        return publisher.getPort();
    }

    @Override
    public void close() {
        subscriber.close();
        publisher.close();
        flyer.close();
        channels.close();
        logger.info("Controller stopped");
    }
}
