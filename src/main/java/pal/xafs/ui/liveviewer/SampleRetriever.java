package pal.xafs.ui.liveviewer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pal.xafs.model.FlySample;
import pal.xafs.model.SampleFrame;
import pal.xafs.model.ScanMode;
import pal.xafs.service.hardware.DeviceTimeoutException;
import pal.xafs.service.store.DataUnavailableException;
import pal.xafs.service.store.RunMetadata;
import pal.xafs.service.store.RunRecord;
import pal.xafs.utilities.EnergyConversion;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the samples of one run: from the store, or straight from the capture buffer
 * while a fly scan has not recorded any rows yet.
 */
public class SampleRetriever {
    private static final Logger logger = LoggerFactory.getLogger(SampleRetriever.class);

    /**
     * Source of the capture buffer of a running fly scan.
     */
    @FunctionalInterface
    public interface LiveWaveformSource {
        List<FlySample> read(int requestedSamples, double resolution, double startAngle) throws DeviceTimeoutException;
    }

    private final LiveWaveformSource liveSource;
    private final double encoderDirection;

    /**
     * @param liveSource       capture buffer access, null when live reads are not available
     * @param encoderDirection sign applied to encoder counts
     */
    public SampleRetriever(LiveWaveformSource liveSource, double encoderDirection) {
        this.liveSource = liveSource;
        this.encoderDirection = encoderDirection;
    }

    public SampleFrame retrieve(RunRecord run, RunMetadata metadata) throws DataUnavailableException {
        Optional<SampleFrame> primary = run.primary();
        if (metadata.mode() == ScanMode.STEP) {
            return primary.orElseThrow(() -> new DataUnavailableException("Run " + run.uid() + " has no primary stream"));
        }
        double resolution = required(metadata.encoderResolution(), "enc_resolution");
        double startAngle = required(metadata.startAngle(), "startTh");
        if (primary.isPresent()) {
            return withEnergyFromEncoder(primary.get(), resolution, startAngle);
        }
        return readLive(metadata, resolution, startAngle);
    }

    private SampleFrame withEnergyFromEncoder(SampleFrame frame, double resolution, double startAngle)
            throws DataUnavailableException {
        double[] encoder = frame.column(SampleFrame.ENCODER);
        if (encoder == null) {
            throw new DataUnavailableException("Fly run has no " + SampleFrame.ENCODER + " column");
        }
        double[] energy = new double[encoder.length];
        for (int i = 0; i < encoder.length; i++) {
            energy[i] = EnergyConversion.angleToEnergy(
                    EnergyConversion.encoderToAngle(encoder[i], encoderDirection, resolution, startAngle));
        }
        return frame.with(SampleFrame.ENERGY, energy);
    }

    private SampleFrame readLive(RunMetadata metadata, double resolution, double startAngle)
            throws DataUnavailableException {
        if (liveSource == null) {
            throw new DataUnavailableException("Fly run has no rows and live reads are disabled");
        }
        int requested = metadata.scanPoints() > 0 ? metadata.scanPoints() : Integer.MAX_VALUE;
        List<FlySample> samples;
        try {
            samples = liveSource.read(requested, resolution, startAngle);
        } catch (DeviceTimeoutException e) {
            throw new DataUnavailableException("Live capture buffer unavailable: " + e.getMessage(), e);
        }
        logger.trace("Read {} live samples", samples.size());

        int n = samples.size();
        double[] time = new double[n];
        double[] encoder = new double[n];
        double[] energy = new double[n];
        double[] i0 = new double[n];
        double[] it = new double[n];
        double[] iF = new double[n];
        double[] ir = new double[n];
        for (int i = 0; i < n; i++) {
            FlySample s = samples.get(i);
            time[i] = s.time();
            encoder[i] = s.encoder();
            energy[i] = s.energy();
            i0[i] = s.ch1();
            it[i] = s.ch2();
            iF[i] = s.ch3();
            ir[i] = s.ch4();
        }
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put(SampleFrame.TIME, time);
        columns.put(SampleFrame.ENCODER, encoder);
        columns.put(SampleFrame.ENERGY, energy);
        columns.put("I0", i0);
        columns.put("It", it);
        columns.put("If", iF);
        columns.put("Ir", ir);
        return new SampleFrame(columns);
    }

    private static double required(Double value, String key) throws DataUnavailableException {
        if (value == null) {
            throw new DataUnavailableException("Fly run start document has no " + key);
        }
        return value;
    }
}
