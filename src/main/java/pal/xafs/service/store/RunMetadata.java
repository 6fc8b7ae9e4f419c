package pal.xafs.service.store;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import pal.xafs.model.Channel;
import pal.xafs.model.DarkCurrent;
import pal.xafs.model.ScanCategory;
import pal.xafs.model.ScanMode;

/**
 * Typed view of the start document recorded with every run.
 * Field names follow the keys written into the document.
 */
public class RunMetadata {

    private static final Gson GSON = new GsonBuilder().serializeSpecialFloatingPointValues().create();

    @SerializedName("scan_type")
    private String scanType;
    @SerializedName("scan_mode")
    private String scanMode;
    @SerializedName("E0")
    private Double e0;
    @SerializedName("scan_points")
    private Integer scanPoints;

    private double darkI0;
    private double darkIt;
    private double darkIf;
    private double darkIr;

    private Integer gainI0;
    private Integer gainIt;
    private Integer gainIf;
    private Integer gainIr;

    private Double startE;
    private Double stopE;
    private Double startTh;
    private Double stopTh;
    @SerializedName("enc_resolution")
    private Double encResolution;
    @SerializedName("scan_encoder_steps")
    private Integer encoderSteps;
    @SerializedName("motor_speed")
    private Double motorSpeed;
    private Double coolTime;
    @SerializedName("delay_time")
    private Double delayTime;

    private Double slitTop;
    private Double slitBottom;
    private Double slitLeft;
    private Double slitRight;

    private Double time;
    private String operator;
    private Double beamcurrent;

    public RunMetadata() {
    }

    /**
     * @throws DataUnavailableException if the document cannot be read or lacks the scan type, mode or E0
     */
    public static RunMetadata fromStartDocument(JsonObject start) throws DataUnavailableException {
        if (start == null) {
            throw new DataUnavailableException("Run has no start document");
        }
        RunMetadata metadata;
        try {
            metadata = GSON.fromJson(start, RunMetadata.class);
        } catch (JsonParseException e) {
            throw new DataUnavailableException("Malformed start document: " + e.getMessage(), e);
        }
        if (metadata.category() == null) {
            throw new DataUnavailableException("Start document has no known scan_type: " + metadata.scanType);
        }
        if (metadata.e0 == null) {
            throw new DataUnavailableException("Start document has no E0");
        }
        return metadata;
    }

    public JsonObject toStartDocument() {
        JsonElement tree = GSON.toJsonTree(this);
        return tree.getAsJsonObject();
    }

    public ScanCategory category() {
        return ScanCategory.fromScanType(scanType);
    }

    /**
     * @return the scan mode, STEP when not recorded
     */
    public ScanMode mode() {
        return scanMode == null ? ScanMode.STEP : ScanMode.fromWireName(scanMode);
    }

    public double e0() {
        return e0 == null ? Double.NaN : e0;
    }

    public int scanPoints() {
        return scanPoints == null ? 0 : scanPoints;
    }

    public DarkCurrent darkCurrent() {
        return new DarkCurrent(darkI0, darkIt, darkIf, darkIr);
    }

    public Integer gain(Channel channel) {
        return switch (channel) {
            case I0 -> gainI0;
            case IT -> gainIt;
            case IF -> gainIf;
            case IR -> gainIr;
        };
    }

    public Double startEnergy() {
        return startE;
    }

    public Double stopEnergy() {
        return stopE;
    }

    public Double startAngle() {
        return startTh;
    }

    public Double stopAngle() {
        return stopTh;
    }

    public Double encoderResolution() {
        return encResolution;
    }

    public Integer encoderSteps() {
        return encoderSteps;
    }

    public Double motorSpeed() {
        return motorSpeed;
    }

    public Double coolTime() {
        return coolTime;
    }

    public Double delayTime() {
        return delayTime;
    }

    public Double time() {
        return time;
    }

    public String operator() {
        return operator;
    }

    public Double beamCurrent() {
        return beamcurrent;
    }

    public double[] slits() {
        return new double[]{nz(slitTop), nz(slitBottom), nz(slitLeft), nz(slitRight)};
    }

    private static double nz(Double value) {
        return value == null ? 0.0 : value;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Assembles the start document of a new run.
     */
    public static class Builder {
        private final RunMetadata m = new RunMetadata();

        public Builder category(ScanCategory category) {
            m.scanType = category.scanType();
            return this;
        }

        public Builder mode(ScanMode mode) {
            m.scanMode = mode.wireName();
            return this;
        }

        public Builder e0(double e0) {
            m.e0 = e0;
            return this;
        }

        public Builder scanPoints(int points) {
            m.scanPoints = points;
            return this;
        }

        public Builder darkCurrent(DarkCurrent dark) {
            m.darkI0 = dark.rate(Channel.I0);
            m.darkIt = dark.rate(Channel.IT);
            m.darkIf = dark.rate(Channel.IF);
            m.darkIr = dark.rate(Channel.IR);
            return this;
        }

        public Builder gains(int i0, int it, int iF, int ir) {
            m.gainI0 = i0;
            m.gainIt = it;
            m.gainIf = iF;
            m.gainIr = ir;
            return this;
        }

        public Builder flyGeometry(double startE, double stopE, double startTh, double stopTh,
                                   double encResolution, int encoderSteps, double motorSpeed) {
            m.startE = startE;
            m.stopE = stopE;
            m.startTh = startTh;
            m.stopTh = stopTh;
            m.encResolution = encResolution;
            m.encoderSteps = encoderSteps;
            m.motorSpeed = motorSpeed;
            return this;
        }

        public Builder coolTime(double seconds) {
            m.coolTime = seconds;
            return this;
        }

        public Builder delayTime(double seconds) {
            m.delayTime = seconds;
            return this;
        }

        public Builder slits(double top, double bottom, double left, double right) {
            m.slitTop = top;
            m.slitBottom = bottom;
            m.slitLeft = left;
            m.slitRight = right;
            return this;
        }

        public Builder time(double epochSeconds) {
            m.time = epochSeconds;
            return this;
        }

        public Builder operator(String operator) {
            m.operator = operator;
            return this;
        }

        public Builder beamCurrent(double current) {
            m.beamcurrent = current;
            return this;
        }

        public RunMetadata build() {
            if (m.scanType == null || m.scanMode == null || m.e0 == null) {
                throw new IllegalStateException("scan type, scan mode and E0 are required");
            }
            return m;
        }
    }
}
