package pal.xafs;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import pal.xafs.controller.AmplifierControl;
import pal.xafs.controller.ControlSurface;
import pal.xafs.controller.ScalerCounter;
import pal.xafs.controller.ScanKind;
import pal.xafs.controller.ScanOutcome;
import pal.xafs.controller.ScanRequest;
import pal.xafs.model.Channel;
import pal.xafs.model.ScanCategory;
import pal.xafs.model.ScanSegmentSpec;
import pal.xafs.model.SegmentMode;
import pal.xafs.service.hardware.SimulatedHardware;
import pal.xafs.service.store.InMemoryRunStore;
import pal.xafs.utilities.XafsConfigManager;

import java.io.IOException;
import java.net.ServerSocket;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Controller and viewer talking over the loopback event bus, sharing one run store.
 */
class ControllerViewerIntegrationTest {

    private ControllerProcess controller;
    private ViewerProcess viewer;
    private InMemoryRunStore store;

    @BeforeEach
    void setUp() throws Exception {
        int controllerPort = freePort();
        int viewerPort = freePort();
        XafsConfigManager config = XafsConfigManager.withOverrides(Map.of(
                "event_bus", Map.of("host", "127.0.0.1", "controller_port", controllerPort,
                        "viewer_port", viewerPort, "reconnect_delay_ms", 50),
                "hardware", Map.of("liveness_poll_ms", 5, "motion_timeout_s", 5),
                "step_scan", Map.of("preposition_settle_s", 0, "start_settle_s", 0)));

        SimulatedHardware hardware = new SimulatedHardware();
        hardware.setAutoComplete(true);
        ScalerCounter scaler = mock(ScalerCounter.class);
        when(scaler.count(anyDouble())).thenReturn(
                Map.of(Channel.I0, 1000.0, Channel.IT, 400.0, Channel.IF, 20.0, Channel.IR, 300.0));

        store = new InMemoryRunStore();
        controller = new ControllerProcess(config, hardware, mock(AmplifierControl.class), scaler, store,
                mock(ControlSurface.class));
        viewer = new ViewerProcess(config, store);
    }

    @AfterEach
    void tearDown() {
        viewer.close();
        controller.close();
    }

    @Test
    void testTabSelectionReachesViewer() throws Exception {
        // the handshake resends the controller's tab once both sides are connected
        awaitCondition(() -> viewer.getPipeline().getSettings().getCategory() == ScanCategory.MEASURE);

        awaitCondition(() -> {
            controller.getMessages().selectTab(ScanCategory.CALIBRATION);
            return viewer.getPipeline().getSettings().getCategory() == ScanCategory.CALIBRATION;
        });
    }

    @Test
    void testCalibrationScanIsPlottedAndReported() throws Exception {
        awaitCondition(() -> {
            controller.getMessages().selectTab(ScanCategory.CALIBRATION);
            return viewer.getPipeline().getSettings().getCategory() == ScanCategory.CALIBRATION;
        });

        ScanRequest request = ScanRequest.builder()
                .category(ScanCategory.CALIBRATION)
                .kind(ScanKind.STEP)
                .e0(8979)
                .segments(new ScanSegmentSpec(new double[]{-20, 20}, new boolean[]{true},
                        new SegmentMode[]{SegmentMode.ENERGY}, new double[]{10}, new double[]{0.01}))
                .build();
        ScanOutcome outcome = controller.runScan(request);

        assertEquals(ScanOutcome.Status.COMPLETED, outcome.status());
        awaitCondition(() -> viewer.getPipeline().getPlotState().displayed("Data 0") != null);
        awaitCondition(() -> !controller.getDisplayState().getPeakEnergy().isEmpty());
        awaitCondition(() -> controller.getDisplayState().getProgress() == 100);
        assertEquals("idle", controller.getDisplayState().getEngineState());
    }

    @Test
    void testAbortFromViewerStopsRunningScan() throws Exception {
        ScanRequest request = ScanRequest.builder()
                .category(ScanCategory.MEASURE)
                .kind(ScanKind.STEP)
                .e0(8979)
                .delayTime(0.5)
                .segments(new ScanSegmentSpec(new double[]{-20, 20}, new boolean[]{true},
                        new SegmentMode[]{SegmentMode.ENERGY}, new double[]{2}, new double[]{0.01}))
                .build();
        CompletableFuture<ScanOutcome> outcome = CompletableFuture.supplyAsync(() -> controller.runScan(request));
        awaitCondition(() -> controller.getOrchestrator().isRunning());

        awaitCondition(() -> {
            viewer.requestAbort();
            return controller.getOrchestrator().isAborted();
        });

        assertEquals(ScanOutcome.Status.ABORTED, outcome.get(10, TimeUnit.SECONDS).status());
        assertFalse(controller.getOrchestrator().isRunning());
    }

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("condition not met within 10 s");
            }
            Thread.sleep(50);
        }
    }
}
