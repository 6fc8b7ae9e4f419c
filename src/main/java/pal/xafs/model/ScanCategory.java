package pal.xafs.model;

/**
 * Kind of scan shown on a controller tab. The same value selects which runs the viewer plots.
 */
public enum ScanCategory {
    MEASURE("measure", 0),
    CALIBRATION("calibration", 1),
    ALIGN("tweak", 2);

    private final String scanType;
    private final int tabIndex;

    ScanCategory(String scanType, int tabIndex) {
        this.scanType = scanType;
        this.tabIndex = tabIndex;
    }

    /**
     * @return the {@code scan_type} value written to a run's start document
     */
    public String scanType() {
        return scanType;
    }

    public int tabIndex() {
        return tabIndex;
    }

    /**
     * Resolves a controller tab index. Indices past the last tab fall back to ALIGN,
     * matching the controller layout where every extra tab is an alignment tool.
     *
     * @param index tab index
     * @return category for the tab
     */
    public static ScanCategory fromTabIndex(int index) {
        return switch (index) {
            case 0 -> MEASURE;
            case 1 -> CALIBRATION;
            default -> ALIGN;
        };
    }

    /**
     * @param scanType value of {@code scan_type}
     * @return matching category, or null for run types the viewer does not plot
     */
    public static ScanCategory fromScanType(String scanType) {
        for (ScanCategory c : values()) {
            if (c.scanType.equals(scanType)) {
                return c;
            }
        }
        return null;
    }
}
