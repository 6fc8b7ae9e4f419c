package pal.xafs.service.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pal.xafs.model.ScanCategory;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * One event-bus message: a kind and a single scalar payload.
 * On the wire it is a single UTF-8 line {@code <tag>:<payload>}.
 */
public final class EventMessage {
    private static final Logger logger = LoggerFactory.getLogger(EventMessage.class);

    private final MessageKind kind;
    private final String payload;

    private EventMessage(MessageKind kind, String payload) {
        this.kind = Objects.requireNonNull(kind);
        this.payload = payload == null ? "" : payload;
        if (this.payload.indexOf('\n') >= 0 || this.payload.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("Payload of " + kind.tag() + " must not contain line breaks");
        }
    }

    public static EventMessage of(MessageKind kind, String payload) {
        return new EventMessage(kind, payload);
    }

    public static EventMessage tabChanged(ScanCategory category) {
        return new EventMessage(MessageKind.TAB_CHANGED, Integer.toString(category.tabIndex()));
    }

    public static EventMessage updateViewer() {
        return new EventMessage(MessageKind.UPDATE_VIEWER, "");
    }

    public static EventMessage xLabel(String label) {
        return new EventMessage(MessageKind.X_LABEL, label);
    }

    public static EventMessage yLabel(String label) {
        return new EventMessage(MessageKind.Y_LABEL, label);
    }

    public static EventMessage blink(boolean on) {
        return new EventMessage(MessageKind.BLINK, bool(on));
    }

    public static EventMessage runEngine(String state) {
        return new EventMessage(MessageKind.RUN_ENGINE, state);
    }

    public static EventMessage removeCurve(String legend) {
        return new EventMessage(MessageKind.REMOVE_CURVE, legend);
    }

    public static EventMessage removeCurves() {
        return new EventMessage(MessageKind.REMOVE_CURVES, "");
    }

    public static EventMessage flyStartTime(double epochSeconds) {
        return new EventMessage(MessageKind.FLY_START_TIME, Double.toString(epochSeconds));
    }

    public static EventMessage disableAbortButton(boolean disabled) {
        return new EventMessage(MessageKind.DISABLE_ABORT_BUTTON, bool(disabled));
    }

    public static EventMessage ecalPeakEnergy(double energy) {
        return new EventMessage(MessageKind.ECAL_PEAK_ENERGY, String.format(Locale.ROOT, "%.4f", energy));
    }

    public static EventMessage ecalEnergyDifference(double difference) {
        return new EventMessage(MessageKind.ECAL_ENERGY_DIFFERENCE, String.format(Locale.ROOT, "%.4f", difference));
    }

    public static EventMessage progressBar(int percent) {
        return new EventMessage(MessageKind.PROGRESS_BAR, Integer.toString(percent));
    }

    public static EventMessage abort() {
        return new EventMessage(MessageKind.ABORT, "");
    }

    public static EventMessage viewerInitialized() {
        return new EventMessage(MessageKind.VIEWER_INITIALIZED, "");
    }

    public static EventMessage dcmI0(double value) {
        return new EventMessage(MessageKind.DCM_I0, String.format(Locale.ROOT, "%.2f", value));
    }

    public static EventMessage dcmI0Second(double value) {
        return new EventMessage(MessageKind.DCM_I0_2, String.format(Locale.ROOT, "%.2f", value));
    }

    public MessageKind kind() {
        return kind;
    }

    public String payload() {
        return payload;
    }

    public String toWire() {
        if (payload.isEmpty() && kind.payloadType() == MessageKind.PayloadType.NONE) {
            return kind.tag();
        }
        return kind.tag() + ":" + payload;
    }

    /**
     * Parses one received line. Unknown tags and malformed payloads yield an empty result.
     */
    public static Optional<EventMessage> parse(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        int colon = trimmed.indexOf(':');
        String tag = colon < 0 ? trimmed : trimmed.substring(0, colon);
        String payload = colon < 0 ? "" : trimmed.substring(colon + 1);

        MessageKind kind = MessageKind.fromTag(tag);
        if (kind == null) {
            logger.debug("Ignoring unknown message: {}", trimmed);
            return Optional.empty();
        }
        if (!isValidPayload(kind, payload)) {
            logger.warn("Dropping {} with malformed payload '{}'", tag, payload);
            return Optional.empty();
        }
        return Optional.of(new EventMessage(kind, payload));
    }

    private static boolean isValidPayload(MessageKind kind, String payload) {
        String value = payload.strip();
        switch (kind.payloadType()) {
            case INTEGER:
                try {
                    Integer.parseInt(value);
                    return true;
                } catch (NumberFormatException e) {
                    return false;
                }
            case DECIMAL:
                try {
                    Double.parseDouble(value);
                    return true;
                } catch (NumberFormatException e) {
                    return false;
                }
            case BOOLEAN:
                return !value.isEmpty();
            default:
                return true;
        }
    }

    public int payloadAsInt() {
        return Integer.parseInt(payload.strip());
    }

    public double payloadAsDouble() {
        return Double.parseDouble(payload.strip());
    }

    /**
     * "true" and "1" (any case) are true, anything else false.
     */
    public boolean payloadAsBoolean() {
        String value = payload.strip();
        return value.equalsIgnoreCase("true") || value.equals("1");
    }

    private static String bool(boolean value) {
        return value ? "True" : "False";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventMessage other)) return false;
        return kind == other.kind && payload.equals(other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, payload);
    }

    @Override
    public String toString() {
        return toWire();
    }
}
