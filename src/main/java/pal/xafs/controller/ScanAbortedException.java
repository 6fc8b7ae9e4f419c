package pal.xafs.controller;

/**
 * The operator aborted the running scan.
 */
public class ScanAbortedException extends Exception {

    public ScanAbortedException(String message) {
        super(message);
    }
}
