package pal.xafs.ui.liveviewer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import pal.xafs.model.FlySample;
import pal.xafs.model.PlotSeries;
import pal.xafs.model.SampleFrame;
import pal.xafs.model.ScanCategory;
import pal.xafs.model.ScanMode;
import pal.xafs.service.bus.EventMessage;
import pal.xafs.service.bus.MessageKind;
import pal.xafs.service.store.InMemoryRunStore;
import pal.xafs.service.store.RunMetadata;
import pal.xafs.service.store.RunRecord;
import pal.xafs.utilities.EnergyConversion;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

/**
 * Runs pipeline passes synchronously against an in-memory store.
 */
class LivePlotPipelineTest {

    private static final double E0 = 8979.0;

    private InMemoryRunStore store;
    private PlotCanvas canvas;
    private List<EventMessage> toController;
    private ViewerSettings settings;
    private AtomicInteger liveReads;
    private LivePlotPipeline pipeline;

    @BeforeEach
    void setUp() {
        store = new InMemoryRunStore();
        canvas = mock(PlotCanvas.class);
        toController = new ArrayList<>();
        settings = new ViewerSettings(3, 2.0);
        liveReads = new AtomicInteger();
        SampleRetriever retriever = new SampleRetriever((requested, resolution, startAngle) -> {
            liveReads.incrementAndGet();
            List<FlySample> samples = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                double angle = EnergyConversion.encoderToAngle(i * 10, -1.0, resolution, startAngle);
                samples.add(new FlySample(0, i * 10, angle, EnergyConversion.angleToEnergy(angle), 1000, 400, 50, 200));
            }
            return samples;
        }, -1.0);
        pipeline = new LivePlotPipeline(store, retriever, settings, new PlotState(canvas, Runnable::run),
                CurveStyleTable.standard(), toController::add, Runnable::run);
    }

    private RunRecord stepRun(ScanCategory category, int scanPoints, double[] delta, double[] absorbance) {
        RunRecord run = new RunRecord(RunMetadata.builder()
                .category(category).mode(ScanMode.STEP).e0(E0).scanPoints(scanPoints)
                .build().toStartDocument());
        for (int i = 0; i < delta.length; i++) {
            Map<String, Double> row = new LinkedHashMap<>();
            row.put(SampleFrame.TIME, 100.0 + i);
            row.put(SampleFrame.ENERGY, E0 + delta[i]);
            row.put(SampleFrame.DWELL, 1.0);
            row.put("I0", 1000.0);
            row.put("It", 1000.0 * Math.exp(-absorbance[i]));
            row.put("If", 10.0);
            row.put("Ir", 500.0);
            run.appendRow(row);
        }
        store.add(run);
        return run;
    }

    private List<EventMessage> sent(MessageKind kind) {
        return toController.stream().filter(m -> m.kind() == kind).toList();
    }

    @Test
    void testMeasure_CurvesPerSlotAndProgress() {
        stepRun(ScanCategory.MEASURE, 10, new double[]{-2, -1, 0}, new double[]{0.1, 0.2, 0.3});
        stepRun(ScanCategory.MEASURE, 10, new double[]{-2, -1, 0, 1}, new double[]{0.1, 0.2, 0.3, 0.4});

        pipeline.update();

        PlotSeries newest = pipeline.getPlotState().displayed("Data 0");
        assertNotNull(newest);
        assertEquals(4, newest.size());
        assertArrayEquals(new double[]{-2, -1, 0, 1}, newest.x(), 1e-9);
        assertEquals(0.4, newest.y()[3], 1e-9);
        assertEquals(30, newest.zOrder());
        assertEquals(3, pipeline.getPlotState().displayed("Data 1").size());
        assertNull(pipeline.getPlotState().displayed(CurveStyleTable.DERIVATIVE_LEGEND));

        assertEquals(List.of(EventMessage.progressBar(50)), sent(MessageKind.PROGRESS_BAR));
        verify(canvas).showScanStatus(any());
    }

    @Test
    void testMeasure_DerivativeOnRightAxis() {
        settings.setDerivative(true);
        stepRun(ScanCategory.MEASURE, 10, new double[]{0, 1, 2}, new double[]{0, 2, 7});

        pipeline.update();

        PlotSeries derivative = pipeline.getPlotState().displayed(CurveStyleTable.DERIVATIVE_LEGEND);
        assertEquals(PlotSeries.YAxisSide.RIGHT, derivative.yAxis());
        assertArrayEquals(new double[]{2, 2, 5}, derivative.y(), 1e-9);
    }

    @Test
    void testCalibration_ReportsPeakOfDerivative() {
        settings.applyCategory(ScanCategory.CALIBRATION);
        stepRun(ScanCategory.CALIBRATION, 5, new double[]{-2, -1, 0, 1, 2}, new double[]{0, 0.1, 0.2, 1.0, 1.1});

        pipeline.update();

        assertEquals(List.of(EventMessage.ecalPeakEnergy(8980.0)), sent(MessageKind.ECAL_PEAK_ENERGY));
        assertEquals("1.0000", sent(MessageKind.ECAL_ENERGY_DIFFERENCE).get(0).payload());
        assertNotNull(pipeline.getPlotState().displayed(CurveStyleTable.DERIVATIVE_LEGEND));
    }

    @Test
    void testCalibration_TooFewPointsNoPeak() {
        settings.applyCategory(ScanCategory.CALIBRATION);
        stepRun(ScanCategory.CALIBRATION, 5, new double[]{-2, -1}, new double[]{0, 0.1});

        pipeline.update();

        assertTrue(sent(MessageKind.ECAL_PEAK_ENERGY).isEmpty());
    }

    @Test
    void testAlign_ReportsLastTransmittedCounts() {
        settings.applyCategory(ScanCategory.ALIGN);
        stepRun(ScanCategory.ALIGN, 0, new double[]{0, 0, 0}, new double[]{0.5, 0.4, Math.log(1000.0 / 400.123)});

        pipeline.update();

        assertEquals("400.12", sent(MessageKind.DCM_I0).get(0).payload());
        assertEquals("800.25", sent(MessageKind.DCM_I0_2).get(0).payload());
        assertTrue(sent(MessageKind.PROGRESS_BAR).isEmpty());
        assertArrayEquals(new double[]{0, 1, 2}, pipeline.getPlotState().displayed("Data 0").x());
    }

    @Test
    void testStepRunWithoutRows_EmptyCurve() {
        stepRun(ScanCategory.MEASURE, 10, new double[0], new double[0]);

        pipeline.update();

        PlotSeries empty = pipeline.getPlotState().displayed("Data 0");
        assertNotNull(empty);
        assertEquals(0, empty.size());
    }

    @Test
    void testHistoryDepthShrinkRemovesOlderSlots() {
        for (int i = 0; i < 3; i++) {
            stepRun(ScanCategory.MEASURE, 10, new double[]{-1, 0}, new double[]{0.1, 0.2 + i});
        }
        pipeline.update();
        assertNotNull(pipeline.getPlotState().displayed("Data 2"));

        settings.setHistoryDepth(1);
        pipeline.update();

        assertNull(pipeline.getPlotState().displayed("Data 1"));
        assertNull(pipeline.getPlotState().displayed("Data 2"));
        verify(canvas).removeCurve("Data 2");
    }

    @Test
    void testUnchangedRunNotRedrawn() {
        stepRun(ScanCategory.MEASURE, 10, new double[]{-1, 0, 1}, new double[]{0.1, 0.2, 0.3});

        pipeline.update();
        pipeline.update();

        verify(canvas, times(1)).addCurve(argThat(s -> s.legend().equals("Data 0")));
    }

    @Test
    void testFlyRunWithoutRows_ReadsCaptureBufferLive() {
        RunRecord run = new RunRecord(RunMetadata.builder()
                .category(ScanCategory.MEASURE).mode(ScanMode.FLY).e0(E0).scanPoints(100)
                .flyGeometry(8900, 9200, EnergyConversion.energyToAngle(8900), EnergyConversion.energyToAngle(9200),
                        1e-5, 10, 0.1)
                .build().toStartDocument());
        store.add(run);

        pipeline.update();

        assertEquals(1, liveReads.get());
        PlotSeries curve = pipeline.getPlotState().displayed("Data 0");
        assertEquals(5, curve.size());
        assertEquals(8900 - E0, curve.x()[0], 1e-6);
    }

    @Test
    void testFlyRunMissingGeometry_Skipped() {
        store.add(new RunRecord(RunMetadata.builder()
                .category(ScanCategory.MEASURE).mode(ScanMode.FLY).e0(E0).build().toStartDocument()));

        pipeline.update();

        assertEquals(0, liveReads.get());
        assertEquals(0, pipeline.getPlotState().curveCount());
    }
}
