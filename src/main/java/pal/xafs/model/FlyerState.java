package pal.xafs.model;

/**
 * Lifecycle of a fly-scan session.
 */
public enum FlyerState {
    IDLE,
    /** Counters reset and capture mode on */
    ARMED,
    /** Motion issued, watcher polling the liveness flag */
    RUNNING,
    /** Watcher saw the motor settle; the capture buffer may be drained */
    COMPLETING,
    /** Waveforms copied out and capture mode off */
    DRAINED
}
