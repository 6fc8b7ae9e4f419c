package pal.xafs.service.hardware;

import pal.xafs.model.FlyerState;

/**
 * A flyer operation was called in a state that does not allow it,
 * for example {@code drain} before the motion completed.
 */
public class ProtocolViolationException extends IllegalStateException {

    private final FlyerState actual;

    public ProtocolViolationException(String operation, FlyerState actual) {
        super(operation + " is not allowed in state " + actual);
        this.actual = actual;
    }

    public FlyerState getActual() {
        return actual;
    }
}
