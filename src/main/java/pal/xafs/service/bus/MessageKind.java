package pal.xafs.service.bus;

import java.util.HashMap;
import java.util.Map;

/**
 * Every message that travels between the controller and the viewer, with its wire tag.
 */
public enum MessageKind {
    // controller -> viewer
    TAB_CHANGED("tabChanged", PayloadType.INTEGER),
    UPDATE_VIEWER("UpdateViewer", PayloadType.NONE),
    X_LABEL("XLabel", PayloadType.TEXT),
    Y_LABEL("YLabel", PayloadType.TEXT),
    BLINK("Blink", PayloadType.BOOLEAN),
    RUN_ENGINE("RunEngine", PayloadType.TEXT),
    REMOVE_CURVE("RemoveCurve", PayloadType.TEXT),
    REMOVE_CURVES("RemoveCurves", PayloadType.NONE),
    FLY_START_TIME("FlyStartTime", PayloadType.DECIMAL),
    DISABLE_ABORT_BUTTON("DisableAbortButton", PayloadType.BOOLEAN),

    // viewer -> controller
    ECAL_PEAK_ENERGY("EcalPeakEnergyLabel", PayloadType.DECIMAL),
    ECAL_ENERGY_DIFFERENCE("EcalEnergyDifferenceLabel", PayloadType.DECIMAL),
    PROGRESS_BAR("ProgressBar", PayloadType.INTEGER),
    ABORT("Abort", PayloadType.NONE),
    VIEWER_INITIALIZED("ViewerInitialized", PayloadType.NONE),
    DCM_I0("DCM_I0", PayloadType.DECIMAL),
    DCM_I0_2("DCM_I0_2", PayloadType.DECIMAL);

    public enum PayloadType { NONE, TEXT, INTEGER, DECIMAL, BOOLEAN }

    private static final Map<String, MessageKind> BY_TAG = new HashMap<>();

    static {
        for (MessageKind kind : values()) {
            BY_TAG.put(kind.tag, kind);
        }
    }

    private final String tag;
    private final PayloadType payloadType;

    MessageKind(String tag, PayloadType payloadType) {
        this.tag = tag;
        this.payloadType = payloadType;
    }

    public String tag() {
        return tag;
    }

    public PayloadType payloadType() {
        return payloadType;
    }

    /**
     * @return the kind for a wire tag, or null when the tag is unknown
     */
    public static MessageKind fromTag(String tag) {
        return BY_TAG.get(tag);
    }
}
