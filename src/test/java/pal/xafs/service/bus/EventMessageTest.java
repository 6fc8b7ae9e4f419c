package pal.xafs.service.bus;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import pal.xafs.model.ScanCategory;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EventMessageTest {

    @Test
    void testParse_TextPayloadWithSpace() {
        EventMessage message = EventMessage.parse("RemoveCurve:Data 3").orElseThrow();
        assertEquals(MessageKind.REMOVE_CURVE, message.kind());
        assertEquals("Data 3", message.payload());
    }

    @Test
    void testParse_UnknownTagIgnored() {
        assertTrue(EventMessage.parse("Foo:bar").isEmpty());
        assertTrue(EventMessage.parse("").isEmpty());
        assertTrue(EventMessage.parse(null).isEmpty());
    }

    @Test
    void testParse_MalformedNumericPayloadDropped() {
        assertTrue(EventMessage.parse("ProgressBar:abc").isEmpty());
        assertTrue(EventMessage.parse("FlyStartTime:").isEmpty());
        assertTrue(EventMessage.parse("Blink:").isEmpty());
    }

    @Test
    void testParse_PayloadKeepsLaterColons() {
        EventMessage message = EventMessage.parse("XLabel:time: s\n").orElseThrow();
        assertEquals("time: s", message.payload());
    }

    @Test
    void testTabChanged_WireFormat() {
        EventMessage message = EventMessage.tabChanged(ScanCategory.CALIBRATION);
        assertEquals("tabChanged:1", message.toWire());
        assertEquals(1, message.payloadAsInt());
    }

    @Test
    void testFormatting() {
        assertEquals("EcalPeakEnergyLabel:8980.1235", EventMessage.ecalPeakEnergy(8980.12345678).toWire());
        assertEquals("EcalEnergyDifferenceLabel:-1.5000", EventMessage.ecalEnergyDifference(-1.5).toWire());
        assertEquals("DCM_I0:1234.57", EventMessage.dcmI0(1234.5678).toWire());
        assertEquals("Blink:True", EventMessage.blink(true).toWire());
        assertEquals("DisableAbortButton:False", EventMessage.disableAbortButton(false).toWire());
        assertEquals("UpdateViewer", EventMessage.updateViewer().toWire());
        assertEquals("Abort", EventMessage.abort().toWire());
    }

    @Test
    void testPayloadAsBoolean() {
        assertTrue(EventMessage.parse("Blink:True").orElseThrow().payloadAsBoolean());
        assertTrue(EventMessage.parse("Blink:1").orElseThrow().payloadAsBoolean());
        assertFalse(EventMessage.parse("Blink:False").orElseThrow().payloadAsBoolean());
        assertFalse(EventMessage.parse("Blink:0").orElseThrow().payloadAsBoolean());
    }

    @Test
    void testLineBreakInPayloadRejected() {
        assertThrows(IllegalArgumentException.class, () -> EventMessage.xLabel("two\nlines"));
    }

    @ParameterizedTest
    @EnumSource(MessageKind.class)
    void testEveryKind_ParsesItsOwnWireForm(MessageKind kind) {
        String payload = switch (kind.payloadType()) {
            case NONE -> "";
            case TEXT -> "Energy [eV]";
            case INTEGER -> "2";
            case DECIMAL -> "8979.5";
            case BOOLEAN -> "True";
        };
        EventMessage message = EventMessage.of(kind, payload);
        Optional<EventMessage> parsed = EventMessage.parse(message.toWire());
        assertEquals(Optional.of(message), parsed);
        assertSame(kind, MessageKind.fromTag(kind.tag()));
    }
}
