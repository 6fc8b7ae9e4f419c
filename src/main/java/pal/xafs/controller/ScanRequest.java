package pal.xafs.controller;

import pal.xafs.model.DarkCurrent;
import pal.xafs.model.ScanCategory;
import pal.xafs.model.ScanSegmentSpec;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the orchestrator needs to run one scan. Built with {@link #builder()}.
 */
public class ScanRequest {

    private final ScanCategory category;
    private final ScanKind kind;
    private final double e0;
    private final ScanSegmentSpec segments;
    private final int repetitions;
    private final double delayTime;
    private final FlyScanParameters fly;
    private final DarkCurrent darkCurrent;
    private final int[] gains;
    private final double[] slits;
    private final String operator;
    private final double beamCurrent;

    private ScanRequest(Builder b) {
        this.category = b.category;
        this.kind = b.kind;
        this.e0 = b.e0;
        this.segments = b.segments;
        this.repetitions = b.kind == ScanKind.STEP ? 1
                : b.kind == ScanKind.FLY ? b.fly.repetitions() : b.repetitions;
        this.delayTime = b.delayTime;
        this.fly = b.fly;
        this.darkCurrent = b.darkCurrent;
        this.gains = b.gains == null ? null : b.gains.clone();
        this.slits = b.slits == null ? null : b.slits.clone();
        this.operator = b.operator;
        this.beamCurrent = b.beamCurrent;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ScanCategory category() {
        return category;
    }

    public ScanKind kind() {
        return kind;
    }

    public double e0() {
        return e0;
    }

    /** Segment definition of a step scan, null for fly scans. */
    public ScanSegmentSpec segments() {
        return segments;
    }

    public int repetitions() {
        return repetitions;
    }

    /** Settle time after each step move, seconds. */
    public double delayTime() {
        return delayTime;
    }

    public FlyScanParameters fly() {
        return fly;
    }

    /** Dark rates for a step scan, null to use the last measured ones. */
    public DarkCurrent darkCurrent() {
        return darkCurrent;
    }

    public int[] gains() {
        return gains == null ? null : gains.clone();
    }

    public double[] slits() {
        return slits == null ? null : slits.clone();
    }

    public String operator() {
        return operator;
    }

    public double beamCurrent() {
        return beamCurrent;
    }

    public static class Builder {
        private ScanCategory category;
        private ScanKind kind;
        private Double e0;
        private ScanSegmentSpec segments;
        private int repetitions = 1;
        private double delayTime;
        private FlyScanParameters fly;
        private DarkCurrent darkCurrent;
        private int[] gains;
        private double[] slits;
        private String operator;
        private double beamCurrent;

        private Builder() {
        }

        public Builder category(ScanCategory category) {
            this.category = category;
            return this;
        }

        public Builder kind(ScanKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder e0(double e0) {
            this.e0 = e0;
            return this;
        }

        public Builder segments(ScanSegmentSpec segments) {
            this.segments = segments;
            return this;
        }

        public Builder repetitions(int repetitions) {
            this.repetitions = repetitions;
            return this;
        }

        public Builder delayTime(double seconds) {
            this.delayTime = seconds;
            return this;
        }

        public Builder fly(FlyScanParameters fly) {
            this.fly = fly;
            return this;
        }

        public Builder darkCurrent(DarkCurrent darkCurrent) {
            this.darkCurrent = darkCurrent;
            return this;
        }

        public Builder gains(int i0, int it, int iF, int ir) {
            this.gains = new int[]{i0, it, iF, ir};
            return this;
        }

        public Builder slits(double top, double bottom, double left, double right) {
            this.slits = new double[]{top, bottom, left, right};
            return this;
        }

        public Builder operator(String operator) {
            this.operator = operator;
            return this;
        }

        public Builder beamCurrent(double beamCurrent) {
            this.beamCurrent = beamCurrent;
            return this;
        }

        private void validate() {
            List<String> missing = new ArrayList<>();

            if (category == null) missing.add("category");
            if (kind == null) missing.add("kind");
            if (e0 == null) missing.add("e0");
            if (kind == ScanKind.FLY && fly == null) missing.add("fly");
            if ((kind == ScanKind.STEP || kind == ScanKind.REPEATED_STEP) && segments == null) missing.add("segments");

            if (!missing.isEmpty()) {
                throw new IllegalStateException("Missing required parameters: " + String.join(", ", missing));
            }
            if (repetitions < 1) {
                throw new IllegalStateException("Repetitions must be at least 1, got " + repetitions);
            }
            if (delayTime < 0) {
                throw new IllegalStateException("Delay time must not be negative");
            }
        }

        public ScanRequest build() {
            validate();
            return new ScanRequest(this);
        }
    }
}
