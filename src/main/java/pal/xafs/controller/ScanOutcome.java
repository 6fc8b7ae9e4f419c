package pal.xafs.controller;

/**
 * Result of one orchestrated scan.
 *
 * @param status        how the scan ended
 * @param completedRuns runs that finished before the scan ended
 * @param failure       cause of a FAILED scan, null otherwise
 */
public record ScanOutcome(Status status, int completedRuns, Throwable failure) {

    public enum Status { COMPLETED, ABORTED, FAILED }

    public static ScanOutcome completed(int runs) {
        return new ScanOutcome(Status.COMPLETED, runs, null);
    }

    public static ScanOutcome aborted(int runs) {
        return new ScanOutcome(Status.ABORTED, runs, null);
    }

    public static ScanOutcome failed(int runs, Throwable cause) {
        return new ScanOutcome(Status.FAILED, runs, cause);
    }
}
