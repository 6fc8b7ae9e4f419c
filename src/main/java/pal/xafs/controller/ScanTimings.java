package pal.xafs.controller;

import pal.xafs.utilities.XafsConfigManager;

/**
 * Pre-positioning offsets and settle times around a scan.
 */
public record ScanTimings(double stepPrepositionOffset, double stepPrepositionSettle, double stepStartSettle,
                          double flyPrepositionOffset, double flyPrepositionSettle, double flyStartSettle,
                          double flyCompletionTimeout, double defaultCoolingTime) {

    public static ScanTimings fromConfig(XafsConfigManager config) {
        return new ScanTimings(
                config.getDouble(200, "step_scan", "preposition_offset_ev"),
                config.getDouble(2.0, "step_scan", "preposition_settle_s"),
                config.getDouble(1.0, "step_scan", "start_settle_s"),
                config.getDouble(200, "fly_scan", "preposition_offset_ev"),
                config.getDouble(1.0, "fly_scan", "preposition_settle_s"),
                config.getDouble(2.0, "fly_scan", "start_settle_s"),
                config.getDouble(1800, "fly_scan", "completion_timeout_s"),
                config.getDouble(60, "fly_scan", "cooling_time_s"));
    }

    /**
     * Same offsets, no waiting. Used for simulated hardware.
     */
    public ScanTimings withoutDelays(double flyCompletionTimeout) {
        return new ScanTimings(stepPrepositionOffset, 0, 0, flyPrepositionOffset, 0, 0, flyCompletionTimeout, 0);
    }
}
