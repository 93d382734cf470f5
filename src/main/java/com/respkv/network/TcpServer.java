package com.respkv.network;

import com.respkv.command.CommandDispatcher;
import com.respkv.config.ServerConfig;
import com.respkv.core.KVStore;
import com.respkv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.CancelledKeyException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.time.Clock;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NIO-based RESP server.
 * A single selector thread accepts connections, reads requests, executes them
 * against the store, and writes replies. Commands are never run concurrently.
 */
public class TcpServer {

    private static final Logger logger = LoggerFactory.getLogger(TcpServer.class);

    // Select timeout when the expiry sweep is disabled
    private static final long IDLE_SELECT_TIMEOUT_MS = 1000;
    // Upper bound on entries removed by one sweep
    static final int SWEEP_LIMIT = 1000;

    private final ServerConfig config;
    private final KVStore store;
    private final MetricsCollector metrics;
    private final CommandDispatcher dispatcher;
    private final AtomicBoolean running;
    private final Map<SocketChannel, ConnectionHandler> connections;

    private Selector selector;
    private ServerSocketChannel serverChannel;
    private SelectionKey serverKey;
    private Thread serverThread;
    private volatile int boundPort;
    private long nextSweepNanos;

    /**
     * Create a new TCP server reading time from the system clock.
     *
     * @param config  listen address and tuning
     * @param store   the key-value store to use
     * @param metrics the metrics collector
     */
    public TcpServer(ServerConfig config, KVStore store, MetricsCollector metrics) {
        this(config, store, metrics, Clock.systemUTC());
    }

    /**
     * Create a new TCP server.
     *
     * @param config  listen address and tuning
     * @param store   the key-value store to use
     * @param metrics the metrics collector
     * @param clock   time source for relative expirations
     */
    public TcpServer(ServerConfig config, KVStore store, MetricsCollector metrics, Clock clock) {
        this.config = config;
        this.store = store;
        this.metrics = metrics;
        this.dispatcher = new CommandDispatcher(store, config, metrics, clock);
        this.running = new AtomicBoolean(false);
        this.connections = new ConcurrentHashMap<>();
        this.boundPort = config.getPort();
    }

    /**
     * Start the server on a new event loop thread.
     *
     * @throws IOException if the server cannot bind
     */
    public void start() throws IOException {
        bind();
        serverThread = new Thread(this::eventLoop, "respkv-event-loop-" + boundPort);
        serverThread.start();
    }

    /**
     * Start the server and run the event loop on the calling thread until stopped.
     *
     * @throws IOException if the server cannot bind
     */
    public void startAndBlock() throws IOException {
        bind();
        eventLoop();
    }

    private void bind() throws IOException {
        if (running.getAndSet(true)) {
            throw new IllegalStateException("Server already running");
        }

        try {
            selector = Selector.open();
            serverChannel = ServerSocketChannel.open();
            serverChannel.configureBlocking(false);
            serverChannel.socket().setReuseAddress(true);
            serverChannel.bind(new InetSocketAddress(config.getHost(), config.getPort()));
            serverKey = serverChannel.register(selector, SelectionKey.OP_ACCEPT);
        } catch (IOException | RuntimeException e) {
            running.set(false);
            cleanup();
            throw e;
        }

        boundPort = serverChannel.socket().getLocalPort();
        nextSweepNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.getExpireSweepIntervalMs());
        logger.info("RespKV server listening on {}:{}", config.getHost(), boundPort);
    }

    private void eventLoop() {
        long sweepIntervalMs = config.getExpireSweepIntervalMs();
        long selectTimeout = sweepIntervalMs > 0 ? sweepIntervalMs : IDLE_SELECT_TIMEOUT_MS;

        while (running.get()) {
            try {
                selector.select(selectTimeout);

                Set<SelectionKey> selected = selector.selectedKeys();
                if (selected.remove(serverKey)) {
                    acceptAll();
                }

                Iterator<SelectionKey> keys = selected.iterator();
                while (keys.hasNext()) {
                    SelectionKey key = keys.next();
                    keys.remove();

                    if (!key.isValid()) {
                        continue;
                    }

                    try {
                        if (key.isReadable()) {
                            read(key);
                        }
                        if (key.isValid() && key.isWritable()) {
                            write(key);
                        }
                    } catch (CancelledKeyException e) {
                        logger.trace("Key cancelled for {}", key.channel());
                    } catch (RuntimeException e) {
                        logger.error("Error handling connection {}: {}", key.channel(), e.getMessage(), e);
                        ConnectionHandler handler = (ConnectionHandler) key.attachment();
                        if (handler != null) {
                            closeConnection(key, handler);
                        } else {
                            key.cancel();
                        }
                    }
                }

                if (sweepIntervalMs > 0) {
                    sweepExpired(sweepIntervalMs);
                }
            } catch (IOException e) {
                if (running.get()) {
                    logger.error("Selector error: {}", e.getMessage());
                }
            }
        }

        cleanup();
    }

    private void acceptAll() {
        while (true) {
            SocketChannel clientChannel;
            try {
                clientChannel = serverChannel.accept();
            } catch (IOException e) {
                logger.warn("Accept failed: {}", e.getMessage());
                return;
            }
            if (clientChannel == null) {
                return;
            }
            register(clientChannel);
        }
    }

    private void register(SocketChannel clientChannel) {
        SelectionKey key;
        try {
            clientChannel.configureBlocking(false);
            clientChannel.socket().setTcpNoDelay(true);
            key = clientChannel.register(selector, SelectionKey.OP_READ);
        } catch (IOException e) {
            logger.warn("Could not register accepted connection: {}", e.getMessage());
            try {
                clientChannel.close();
            } catch (IOException closeEx) {
                logger.debug("Error closing rejected connection: {}", closeEx.getMessage());
            }
            return;
        }

        ConnectionHandler handler = new ConnectionHandler(clientChannel, dispatcher, metrics,
                this, config.getMaxInboundBufferBytes());
        key.attach(handler);
        connections.put(clientChannel, handler);
        logger.debug("Accepted connection from {}", handler.getRemoteAddress());
    }

    private void read(SelectionKey key) {
        ConnectionHandler handler = (ConnectionHandler) key.attachment();
        if (handler == null) {
            key.cancel();
            return;
        }

        if (!handler.handleRead(key)) {
            closeConnection(key, handler);
        }
    }

    private void write(SelectionKey key) {
        ConnectionHandler handler = (ConnectionHandler) key.attachment();
        if (handler == null) {
            key.cancel();
            return;
        }

        if (!handler.handleWrite(key)) {
            closeConnection(key, handler);
        }
    }

    private void closeConnection(SelectionKey key, ConnectionHandler handler) {
        key.cancel();
        connections.remove((SocketChannel) key.channel());
        handler.close();
    }

    private void sweepExpired(long sweepIntervalMs) {
        long now = System.nanoTime();
        if (now - nextSweepNanos < 0) {
            return;
        }
        nextSweepNanos = now + TimeUnit.MILLISECONDS.toNanos(sweepIntervalMs);
        int removed = store.purgeExpired(SWEEP_LIMIT);
        if (removed > 0) {
            logger.trace("Expiry sweep removed {} entries", removed);
        }
    }

    /**
     * Stop the server.
     */
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }

        logger.info("Stopping RespKV server on port {}", boundPort);

        // Wake up the selector to exit the event loop
        if (selector != null) {
            selector.wakeup();
        }

        // Wait for the server thread to finish
        if (serverThread != null && serverThread != Thread.currentThread()) {
            try {
                serverThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void cleanup() {
        for (ConnectionHandler handler : connections.values()) {
            handler.close();
        }
        connections.clear();

        if (serverChannel != null) {
            try {
                serverChannel.close();
            } catch (IOException e) {
                logger.debug("Error closing server channel: {}", e.getMessage());
            }
        }

        if (selector != null) {
            try {
                selector.close();
            } catch (IOException e) {
                logger.debug("Error closing selector: {}", e.getMessage());
            }
        }

        logger.info("RespKV server stopped on port {}", boundPort);
    }

    /**
     * Check if the server is running.
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Get the number of active connections.
     */
    public int getConnectionCount() {
        return connections.size();
    }

    /**
     * Get the port this server is listening on.
     * Before start, this is the configured port.
     */
    public int getPort() {
        return boundPort;
    }

    /**
     * Remove a connection from tracking.
     * Package-private, called by ConnectionHandler when connection is closed.
     */
    void removeConnection(SocketChannel channel) {
        connections.remove(channel);
    }
}
