package pal.xafs.ui.liveviewer;

/**
 * Colours and z-orders of the history curves and the derivative curve.
 * Slot 0 (newest run) is drawn on top, the derivative next, older slots below.
 */
public final class CurveStyleTable {

    public static final int MAX_SLOTS = 10;
    public static final String DERIVATIVE_LEGEND = "derivative";

    private static final String[] COLORS = {
            "blue", "red", "green", "orange", "pink", "brown", "darkCyan", "violet", "darkBlue", "gray"
    };
    private static final String DERIVATIVE_COLOR = "darkBrown";
    private static final int TOP_Z = 30;
    private static final int DERIVATIVE_Z = 9;

    private static final CurveStyleTable STANDARD = new CurveStyleTable();

    private CurveStyleTable() {
    }

    public static CurveStyleTable standard() {
        return STANDARD;
    }

    public String legend(int slot) {
        checkSlot(slot);
        return "Data " + slot;
    }

    public String color(int slot) {
        checkSlot(slot);
        return COLORS[slot];
    }

    public int zOrder(int slot) {
        checkSlot(slot);
        return slot == 0 ? TOP_Z : DERIVATIVE_Z - slot;
    }

    public String derivativeColor() {
        return DERIVATIVE_COLOR;
    }

    public int derivativeZOrder() {
        return DERIVATIVE_Z;
    }

    private static void checkSlot(int slot) {
        if (slot < 0 || slot >= MAX_SLOTS) {
            throw new IllegalArgumentException("Curve slot out of range: " + slot);
        }
    }
}
