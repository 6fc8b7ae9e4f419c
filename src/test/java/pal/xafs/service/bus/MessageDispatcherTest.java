package pal.xafs.service.bus;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessageDispatcherTest {

    @Test
    void testDispatch_RoutesByKind() {
        List<String> seen = new ArrayList<>();
        MessageDispatcher dispatcher = new MessageDispatcher()
                .register(MessageKind.X_LABEL, m -> seen.add("x:" + m.payload()))
                .register(MessageKind.UPDATE_VIEWER, m -> seen.add("update"));

        assertTrue(dispatcher.dispatchLine("XLabel:index"));
        assertTrue(dispatcher.dispatchLine("UpdateViewer"));
        assertFalse(dispatcher.dispatchLine("YLabel:mu"));
        assertFalse(dispatcher.dispatchLine("NotAMessage"));

        assertEquals(List.of("x:index", "update"), seen);
        assertTrue(dispatcher.hasHandler(MessageKind.X_LABEL));
        assertFalse(dispatcher.hasHandler(MessageKind.Y_LABEL));
    }

    @Test
    void testDispatch_FailingHandlerIsContained() {
        MessageDispatcher dispatcher = new MessageDispatcher()
                .register(MessageKind.ABORT, m -> {
                    throw new IllegalStateException("boom");
                });

        assertFalse(dispatcher.dispatch(EventMessage.abort()));
    }

    @Test
    void testRegister_ReplacesHandler() {
        List<String> seen = new ArrayList<>();
        MessageDispatcher dispatcher = new MessageDispatcher()
                .register(MessageKind.ABORT, m -> seen.add("first"))
                .register(MessageKind.ABORT, m -> seen.add("second"));

        dispatcher.dispatch(EventMessage.abort());
        assertEquals(List.of("second"), seen);
    }
}
