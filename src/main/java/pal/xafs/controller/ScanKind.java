package pal.xafs.controller;

public enum ScanKind {
    STEP,
    REPEATED_STEP,
    FLY
}
