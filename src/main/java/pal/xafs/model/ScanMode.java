package pal.xafs.model;

/**
 * How a run's samples were acquired, as recorded in {@code scan_mode}.
 */
public enum ScanMode {
    STEP("normal"),
    FLY("fly");

    private final String wireName;

    ScanMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ScanMode fromWireName(String name) {
        for (ScanMode m : values()) {
            if (m.wireName.equals(name)) {
                return m;
            }
        }
        throw new IllegalArgumentException("Unknown scan mode: " + name);
    }
}
