package pal.xafs.service.bus;

@FunctionalInterface
public interface MessageHandler {

    void handle(EventMessage message);
}
