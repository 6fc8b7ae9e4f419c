package pal.xafs.service.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Publishing end of one bus direction. Any number of subscribers may connect; each
 * receives the messages sent after it connected. {@link #send} only enqueues, one
 * sender thread writes to all subscribers and drops those whose connection failed.
 */
public class EventBusPublisher implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventBusPublisher.class);

    private final String name;
    private final ServerSocket serverSocket;
    private final List<Subscriber> subscribers = new CopyOnWriteArrayList<>();
    private final BlockingQueue<String> outbox = new LinkedBlockingQueue<>();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private final Thread acceptThread;
    private final Thread senderThread;

    private record Subscriber(Socket socket, Writer writer) {
    }

    /**
     * Binds to the loopback interface.
     *
     * @param name label used in thread names and log lines
     * @param port TCP port, 0 for an ephemeral port
     */
    public EventBusPublisher(String name, int port) throws IOException {
        this(name, InetAddress.getLoopbackAddress(), port);
    }

    public EventBusPublisher(String name, InetAddress bindAddress, int port) throws IOException {
        this.name = name;
        this.serverSocket = new ServerSocket(port, 50, bindAddress);
        this.acceptThread = new Thread(this::acceptLoop, "EventBus-" + name + "-accept");
        this.acceptThread.setDaemon(true);
        this.senderThread = new Thread(this::sendLoop, "EventBus-" + name + "-send");
        this.senderThread.setDaemon(true);
        acceptThread.start();
        senderThread.start();
        logger.info("{} publisher listening on port {}", name, getPort());
    }

    public int getPort() {
        return serverSocket.getLocalPort();
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    /**
     * Queues a message for every connected subscriber. Never blocks.
     */
    public void send(EventMessage message) {
        if (shuttingDown.get()) {
            logger.debug("{} publisher closed, dropping {}", name, message);
            return;
        }
        outbox.offer(message.toWire());
    }

    private void acceptLoop() {
        while (!shuttingDown.get()) {
            try {
                Socket socket = serverSocket.accept();
                socket.setTcpNoDelay(true);
                Writer writer = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
                subscribers.add(new Subscriber(socket, writer));
                logger.info("{} subscriber connected from {}", name, socket.getRemoteSocketAddress());
            } catch (SocketException e) {
                if (!shuttingDown.get()) {
                    logger.error("{} accept failed", name, e);
                }
                return;
            } catch (IOException e) {
                logger.warn("{} could not accept subscriber: {}", name, e.getMessage());
            }
        }
    }

    private void sendLoop() {
        while (!shuttingDown.get()) {
            String line;
            try {
                line = outbox.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            for (Subscriber subscriber : subscribers) {
                try {
                    subscriber.writer().write(line);
                    subscriber.writer().write('\n');
                    subscriber.writer().flush();
                } catch (IOException e) {
                    logger.info("{} subscriber {} disconnected", name, subscriber.socket().getRemoteSocketAddress());
                    subscribers.remove(subscriber);
                    closeQuietly(subscriber.socket());
                }
            }
        }
    }

    private void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing subscriber socket: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        try {
            serverSocket.close();
        } catch (IOException e) {
            logger.debug("Error closing {} server socket: {}", name, e.getMessage());
        }
        senderThread.interrupt();
        for (Subscriber subscriber : subscribers) {
            closeQuietly(subscriber.socket());
        }
        subscribers.clear();
        logger.info("{} publisher closed", name);
    }
}
