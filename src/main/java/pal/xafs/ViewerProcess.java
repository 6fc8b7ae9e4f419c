package pal.xafs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pal.xafs.service.bus.EventBusPublisher;
import pal.xafs.service.bus.EventBusSubscriber;
import pal.xafs.service.bus.EventMessage;
import pal.xafs.service.bus.MessageDispatcher;
import pal.xafs.service.store.RunStore;
import pal.xafs.ui.liveviewer.CurveStyleTable;
import pal.xafs.ui.liveviewer.FxRenderContext;
import pal.xafs.ui.liveviewer.LivePlotPipeline;
import pal.xafs.ui.liveviewer.LoggingPlotCanvas;
import pal.xafs.ui.liveviewer.PlotCanvas;
import pal.xafs.ui.liveviewer.PlotState;
import pal.xafs.ui.liveviewer.SampleRetriever;
import pal.xafs.ui.liveviewer.ViewerMessageHandler;
import pal.xafs.ui.liveviewer.ViewerSettings;
import pal.xafs.utilities.XafsConfigManager;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Wires the live viewer: pipeline, plot state and both ends of the event bus.
 */
public class ViewerProcess implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ViewerProcess.class);

    private final EventBusPublisher publisher;
    private final EventBusSubscriber subscriber;
    private final LivePlotPipeline pipeline;
    private final ViewerMessageHandler messages;

    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "LivePlotWorker");
        t.setDaemon(true);
        return t;
    });
    private final ScheduledExecutorService handshake = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "ViewerHandshake");
        t.setDaemon(true);
        return t;
    });

    /**
     * Headless viewer: curves go to the log and rendering runs on the pipeline worker.
     */
    public ViewerProcess(XafsConfigManager config, RunStore store) throws IOException {
        this(config, store, new LoggingPlotCanvas(), Runnable::run, null);
    }

    /**
     * Viewer drawing on a JavaFX canvas; the toolkit must already be running.
     */
    public static ViewerProcess onFxThread(XafsConfigManager config, RunStore store, PlotCanvas canvas,
                                           SampleRetriever.LiveWaveformSource liveSource) throws IOException {
        return new ViewerProcess(config, store, canvas, new FxRenderContext(), liveSource);
    }

    /**
     * @param renderExecutor executor of the rendering thread
     * @param liveSource     capture-buffer reader for running fly scans, may be null
     */
    public ViewerProcess(XafsConfigManager config, RunStore store, PlotCanvas canvas, Executor renderExecutor,
                         SampleRetriever.LiveWaveformSource liveSource) throws IOException {
        this.publisher = new EventBusPublisher("viewer", config.getInt(5301, "event_bus", "viewer_port"));

        ViewerSettings settings = new ViewerSettings(
                config.getInt(3, "viewer", "history_depth"),
                config.getDouble(1.0, "viewer", "align_ratio"));
        SampleRetriever retriever = new SampleRetriever(liveSource,
                config.getDouble(-1.0, "hardware", "encoder_direction"));
        this.pipeline = new LivePlotPipeline(store, retriever, settings, new PlotState(canvas, renderExecutor),
                CurveStyleTable.standard(), publisher::send, worker);
        this.messages = new ViewerMessageHandler(pipeline);

        MessageDispatcher dispatcher = messages.registerOn(new MessageDispatcher());
        this.subscriber = new EventBusSubscriber("viewer",
                config.getString("localhost", "event_bus", "host"),
                config.getInt(5201, "event_bus", "controller_port"),
                config.getInt(1000, "event_bus", "reconnect_delay_ms"),
                dispatcher);
        subscriber.start();
        announceWhenConnected();
        logger.info("Viewer started");
    }

    /**
     * Asks the controller for its current tab once the controller has subscribed.
     * Messages sent before that would be lost.
     */
    private void announceWhenConnected() {
        handshake.scheduleWithFixedDelay(() -> {
            if (publisher.subscriberCount() > 0 && subscriber.isConnected()) {
                publisher.send(EventMessage.viewerInitialized());
                handshake.shutdown();
            }
        }, 100, 100, TimeUnit.MILLISECONDS);
    }

    public void requestAbort() {
        logger.info("Abort requested from viewer");
        publisher.send(EventMessage.abort());
    }

    public LivePlotPipeline getPipeline() {
        return pipeline;
    }

    public ViewerMessageHandler getMessages() {
        return messages;
    }

    @Override
    public void close() {
        handshake.shutdownNow();
        subscriber.close();
        publisher.close();
        worker.shutdownNow();
        logger.info("Viewer stopped");
    }
}
