package com.roomallocator.network;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zeromq.SocketType;
import org.zeromq.ZContext;
import org.zeromq.ZMQ;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * DEALER or ROUTER socket with the empty-delimiter envelope used between the
 * allocation server and its clients.
 * <p>
 * A ZeroMQ socket must only be used from one thread at a time. Either call
 * {@link #send}/{@link #receive} from a single thread, or start
 * {@link #listen} and send only from inside its callback.
 */
public class ZeroMQClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ZeroMQClient.class);
    private static final int POLL_INTERVAL_MS = 200;

    /**
     * One received message. {@code identity} is the sender's routing id on a
     * ROUTER socket and null on a DEALER socket. The id is kept as raw bytes:
     * peers without an explicit identity get a binary one from ZeroMQ.
     */
    public record Frame(byte[] identity, String body) {
        /**
         * Printable form of the identity, for logging only.
         */
        public String peer() {
            if (identity == null) {
                return null;
            }
            StringBuilder sb = new StringBuilder(identity.length * 2);
            for (byte b : identity) {
                if (b >= 0x20 && b < 0x7f) {
                    sb.append((char) b);
                } else {
                    sb.append(String.format("\\x%02x", b & 0xff));
                }
            }
            return sb.toString();
        }
    }

    private final ZContext context;
    private final String endpoint;
    private final SocketType socketType;
    private final ZMQ.Socket socket;
    private ExecutorService listenerThread;
    private volatile boolean listening = false;

    /**
     * @param endpoint   e.g. "tcp://localhost:5570" to connect or "tcp://*:5570" to bind
     * @param socketType DEALER (clients) or ROUTER (server)
     */
    public ZeroMQClient(String endpoint, SocketType socketType) {
        if (socketType != SocketType.DEALER && socketType != SocketType.ROUTER) {
            throw new IllegalArgumentException("Only DEALER or ROUTER socket types are supported");
        }
        this.context = new ZContext();
        this.endpoint = endpoint;
        this.socketType = socketType;
        this.socket = context.createSocket(socketType);
        this.socket.setLinger(0);

        if (socketType == SocketType.DEALER) {
            socket.setIdentity(("ALLOC-CLIENT-" + UUID.randomUUID()).getBytes(ZMQ.CHARSET));
        }
    }

    /**
     * Connects a DEALER socket to its endpoint.
     */
    public void connect() {
        if (socketType != SocketType.DEALER) {
            throw new IllegalStateException("Connect is only valid for DEALER sockets");
        }
        socket.connect(endpoint);
        logger.debug("DEALER socket connected to {}", endpoint);
    }

    /**
     * Binds a ROUTER socket to its endpoint.
     */
    public void bind() {
        if (socketType != SocketType.ROUTER) {
            throw new IllegalStateException("Bind is only valid for ROUTER sockets");
        }
        socket.bind(endpoint);
        logger.debug("ROUTER socket bound to {}", endpoint);
    }

    /**
     * Sends a message from a DEALER socket.
     *
     * @return true if ZeroMQ accepted the message
     */
    public boolean send(String body) {
        if (socketType != SocketType.DEALER) {
            throw new IllegalStateException("send is only valid for DEALER sockets, use reply");
        }
        socket.sendMore("");
        return socket.send(body.getBytes(ZMQ.CHARSET), 0);
    }

    /**
     * Sends a message from a ROUTER socket to the peer with the given identity,
     * exactly as it arrived in {@link Frame#identity()}.
     *
     * @return true if ZeroMQ accepted the message
     */
    public boolean reply(byte[] identity, String body) {
        if (socketType != SocketType.ROUTER) {
            throw new IllegalStateException("reply is only valid for ROUTER sockets, use send");
        }
        socket.sendMore(identity);
        socket.sendMore("");
        return socket.send(body.getBytes(ZMQ.CHARSET), 0);
    }

    /**
     * Waits up to {@code timeoutMs} for one message.
     */
    public Optional<Frame> receive(long timeoutMs) {
        try (ZMQ.Poller poller = context.createPoller(1)) {
            poller.register(socket, ZMQ.Poller.POLLIN);
            if (poller.poll(timeoutMs) > 0 && poller.pollin(0)) {
                return Optional.ofNullable(readFrame());
            }
        }
        return Optional.empty();
    }

    /**
     * Starts a background thread handing every received message to {@code callback}.
     */
    public void listen(Consumer<Frame> callback) {
        if (listening) {
            throw new IllegalStateException("Listener is already running");
        }
        listening = true;
        listenerThread = Executors.newSingleThreadExecutor(r -> new Thread(r, "zmq-listener-" + endpoint));

        listenerThread.submit(() -> {
            try (ZMQ.Poller poller = context.createPoller(1)) {
                poller.register(socket, ZMQ.Poller.POLLIN);
                while (listening && !Thread.currentThread().isInterrupted()) {
                    try {
                        if (poller.poll(POLL_INTERVAL_MS) > 0 && poller.pollin(0)) {
                            Frame frame = readFrame();
                            if (frame != null) {
                                callback.accept(frame);
                            }
                        }
                    } catch (Exception e) {
                        if (listening) {
                            logger.error("Error in listener thread: {}", e.getMessage(), e);
                        }
                    }
                }
            }
            logger.info("Message listener stopped for {}", endpoint);
        });
    }

    /**
     * Reads identity (ROUTER only), delimiter and body. Returns null on a
     * malformed envelope after draining its remaining parts.
     */
    private Frame readFrame() {
        byte[] identity = null;
        if (socketType == SocketType.ROUTER) {
            identity = socket.recv(0);
            if (identity == null || !socket.hasReceiveMore()) {
                return null;
            }
        }
        byte[] delimiter = socket.recv(0);
        if (delimiter == null || delimiter.length != 0 || !socket.hasReceiveMore()) {
            logger.warn("Dropping message without empty delimiter on {}", endpoint);
            drain();
            return null;
        }
        byte[] body = socket.recv(0);
        if (body == null) {
            return null;
        }
        drain();
        return new Frame(identity, new String(body, ZMQ.CHARSET));
    }

    private void drain() {
        while (socket.hasReceiveMore()) {
            socket.recv(0);
        }
    }

    /**
     * Stops the listener thread, if any.
     */
    public void stopListening() {
        listening = false;
        if (listenerThread != null) {
            listenerThread.shutdown();
            try {
                if (!listenerThread.awaitTermination(2000, TimeUnit.MILLISECONDS)) {
                    listenerThread.shutdownNow();
                }
            } catch (InterruptedException e) {
                listenerThread.shutdownNow();
                Thread.currentThread().interrupt();
            }
            listenerThread = null;
        }
    }

    public String getEndpoint() {
        return endpoint;
    }

    /**
     * Stops listening and releases the socket and context.
     */
    @Override
    public void close() {
        stopListening();
        context.close();
        logger.info("ZeroMQ client closed for {}", endpoint);
    }
}
