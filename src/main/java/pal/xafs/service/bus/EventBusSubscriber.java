package pal.xafs.service.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Receiving end of one bus direction. A dedicated thread connects to the publisher,
 * reconnecting after a fixed delay when it is not reachable, and hands every received
 * line to a {@link MessageDispatcher}.
 */
public class EventBusSubscriber implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventBusSubscriber.class);

    private final String name;
    private final String host;
    private final int port;
    private final long reconnectDelayMs;
    private final MessageDispatcher dispatcher;

    private final Object socketLock = new Object();
    private Socket socket;
    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private Thread receiveThread;

    public EventBusSubscriber(String name, String host, int port, long reconnectDelayMs,
                              MessageDispatcher dispatcher) {
        this.name = name;
        this.host = host;
        this.port = port;
        this.reconnectDelayMs = reconnectDelayMs;
        this.dispatcher = dispatcher;
    }

    public synchronized void start() {
        if (receiveThread != null) {
            return;
        }
        receiveThread = new Thread(this::receiveLoop, "EventBus-" + name + "-receive");
        receiveThread.setDaemon(true);
        receiveThread.start();
    }

    public boolean isConnected() {
        return connected.get();
    }

    private void receiveLoop() {
        while (!shuttingDown.get()) {
            try {
                Socket s = new Socket();
                synchronized (socketLock) {
                    if (shuttingDown.get()) {
                        return;
                    }
                    socket = s;
                }
                s.connect(new InetSocketAddress(host, port), (int) Math.max(reconnectDelayMs, 1000));
                connected.set(true);
                logger.info("{} subscriber connected to {}:{}", name, host, port);

                BufferedReader reader = new BufferedReader(new InputStreamReader(s.getInputStream(), StandardCharsets.UTF_8));
                String line;
                while ((line = reader.readLine()) != null) {
                    dispatcher.dispatchLine(line);
                }
                logger.info("{} publisher closed the connection", name);
            } catch (IOException e) {
                if (!shuttingDown.get()) {
                    logger.debug("{} subscriber cannot reach {}:{}: {}", name, host, port, e.getMessage());
                }
            } finally {
                connected.set(false);
                cleanup();
            }
            if (!shuttingDown.get()) {
                try {
                    Thread.sleep(reconnectDelayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    private void cleanup() {
        synchronized (socketLock) {
            if (socket != null) {
                try {
                    socket.close();
                } catch (IOException e) {
                    logger.debug("Error closing {} socket: {}", name, e.getMessage());
                }
                socket = null;
            }
        }
    }

    @Override
    public void close() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        cleanup();
        Thread t;
        synchronized (this) {
            t = receiveThread;
        }
        if (t != null) {
            t.interrupt();
        }
        logger.info("{} subscriber closed", name);
    }
}
