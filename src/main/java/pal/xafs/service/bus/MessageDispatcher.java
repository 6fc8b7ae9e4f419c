package pal.xafs.service.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Routes received messages to the handler registered for their kind.
 * A failing handler is logged and never propagates into the receive loop.
 */
public class MessageDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(MessageDispatcher.class);

    private final Map<MessageKind, MessageHandler> handlers = new EnumMap<>(MessageKind.class);

    public synchronized MessageDispatcher register(MessageKind kind, MessageHandler handler) {
        handlers.put(kind, handler);
        return this;
    }

    public synchronized boolean hasHandler(MessageKind kind) {
        return handlers.containsKey(kind);
    }

    /**
     * @return true if a handler ran without throwing
     */
    public boolean dispatch(EventMessage message) {
        MessageHandler handler;
        synchronized (this) {
            handler = handlers.get(message.kind());
        }
        if (handler == null) {
            logger.trace("No handler for {}", message.kind());
            return false;
        }
        try {
            handler.handle(message);
            return true;
        } catch (RuntimeException e) {
            logger.error("Handler for {} failed on '{}'", message.kind(), message.toWire(), e);
            return false;
        }
    }

    public boolean dispatchLine(String line) {
        return EventMessage.parse(line).map(this::dispatch).orElse(false);
    }
}
