package pal.xafs.ui.liveviewer;

import pal.xafs.model.SampleFrame;
import pal.xafs.model.ScanCategory;
import pal.xafs.model.ScanMode;
import pal.xafs.service.store.RunMetadata;

/**
 * Progress of the newest run as shown in the viewer status bar.
 *
 * @param points          samples recorded so far
 * @param totalPoints     expected samples, 0 when unknown or not shown
 * @param loopTime        seconds between the last two step-scan rows, null otherwise
 * @param elapsedTime     seconds since a fly scan started, null otherwise
 * @param progressPercent progress to report to the controller, null when not reported
 */
public record ScanStatus(int points, int totalPoints, Double loopTime, Double elapsedTime, Integer progressPercent) {

    public static ScanStatus of(SampleFrame frame, RunMetadata metadata, ScanCategory category,
                                double flyStartTime, double nowSeconds) {
        int points = frame.size();
        Double loopTime = null;
        Double elapsed = null;
        if (points > 2) {
            if (metadata.mode() == ScanMode.STEP && frame.has(SampleFrame.TIME)) {
                double[] time = frame.column(SampleFrame.TIME);
                loopTime = Math.round((time[points - 1] - time[points - 2]) * 100.0) / 100.0;
            } else if (metadata.mode() == ScanMode.FLY) {
                double start = !Double.isNaN(flyStartTime) ? flyStartTime
                        : metadata.time() != null ? metadata.time() : Double.NaN;
                if (!Double.isNaN(start)) {
                    elapsed = Math.round((nowSeconds - start) * 10.0) / 10.0;
                }
            }
        }
        if (category == ScanCategory.ALIGN) {
            return new ScanStatus(points, 0, loopTime, elapsed, null);
        }
        int total = metadata.scanPoints();
        // the first sample of a run is never part of the primary stream
        Integer percent = total > 0 ? (int) ((points + 1) / (double) total * 100) : null;
        return new ScanStatus(points, total, loopTime, elapsed, percent);
    }
}
