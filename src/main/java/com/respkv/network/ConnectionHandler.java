package com.respkv.network;

import com.respkv.command.CommandDispatcher;
import com.respkv.network.protocol.ProtocolException;
import com.respkv.network.protocol.RespCodec;
import com.respkv.network.protocol.RespValue;
import com.respkv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.SelectionKey;
import java.nio.channels.SocketChannel;

/**
 * Handles one client connection on the event loop.
 * Decodes every complete request in arrival order, executes it, and queues
 * the reply; replies are flushed as far as the socket allows.
 */
public class ConnectionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionHandler.class);

    private final SocketChannel channel;
    private final CommandDispatcher dispatcher;
    private final MetricsCollector metrics;
    private final TcpServer server;
    private final ConnectionBuffer buffer;
    private final String clientAddress;

    private ConnectionState state = ConnectionState.READING;

    /**
     * Create a handler for an accepted channel.
     *
     * @param channel         the connected, non-blocking channel
     * @param dispatcher      executes decoded requests
     * @param metrics         the metrics collector
     * @param server          owning server, notified on close (nullable)
     * @param maxInboundBytes bound on buffered request bytes
     */
    public ConnectionHandler(SocketChannel channel, CommandDispatcher dispatcher, MetricsCollector metrics,
                             TcpServer server, int maxInboundBytes) {
        this.channel = channel;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.server = server;
        this.buffer = new ConnectionBuffer(maxInboundBytes);
        this.clientAddress = describe(channel);
        metrics.connectionOpened();
    }

    private static String describe(SocketChannel channel) {
        try {
            return String.valueOf(channel.getRemoteAddress());
        } catch (IOException e) {
            return "unknown";
        }
    }

    /**
     * Handle a read event from the selector.
     *
     * @param key the selection key
     * @return true if the connection should continue, false to close
     */
    public boolean handleRead(SelectionKey key) {
        if (state == ConnectionState.CLOSING) {
            return false;
        }
        try {
            int bytesRead = buffer.readFrom(channel);
            if (bytesRead == -1) {
                logger.debug("Client {} disconnected", clientAddress);
                return false;
            }
            if (bytesRead > 0) {
                processFrames();
            }
            return flush(key);
        } catch (ProtocolException e) {
            logger.warn("Protocol violation from {} (closing connection): {}", clientAddress, e.getMessage());
            metrics.recordProtocolError();
            sendFinalError("ERR Protocol error: " + e.getMessage());
            return false;
        } catch (IllegalStateException e) {
            logger.warn("Closing connection from {}: {}", clientAddress, e.getMessage());
            return false;
        } catch (IOException e) {
            logger.warn("Read error from {}: {}", clientAddress, e.getMessage());
            return false;
        }
    }

    private void processFrames() {
        state = ConnectionState.PROCESSING;
        RespValue request;
        while ((request = buffer.nextFrame()) != null) {
            RespValue reply = dispatcher.dispatch(request);
            buffer.enqueue(RespCodec.encode(reply));
        }
    }

    /**
     * Handle a write event from the selector.
     *
     * @param key the selection key
     * @return true if the connection should continue, false to close
     */
    public boolean handleWrite(SelectionKey key) {
        if (state == ConnectionState.CLOSING) {
            return false;
        }
        try {
            return flush(key);
        } catch (IOException e) {
            logger.warn("Write error to {}: {}", clientAddress, e.getMessage());
            return false;
        }
    }

    /**
     * Write pending replies and keep OP_WRITE interest only while some remain.
     */
    private boolean flush(SelectionKey key) throws IOException {
        if (buffer.hasPendingOutput()) {
            buffer.writeTo(channel);
        }
        if (buffer.hasPendingOutput()) {
            state = ConnectionState.WRITING;
            key.interestOps(key.interestOps() | SelectionKey.OP_WRITE);
        } else {
            state = ConnectionState.READING;
            key.interestOps(key.interestOps() & ~SelectionKey.OP_WRITE);
        }
        return true;
    }

    /**
     * Best-effort delivery of replies already queued plus a closing error.
     */
    private void sendFinalError(String message) {
        buffer.enqueue(RespCodec.encode(RespValue.error(message.replace('\r', ' ').replace('\n', ' '))));
        try {
            buffer.writeTo(channel);
        } catch (IOException e) {
            logger.debug("Could not deliver protocol error to {}: {}", clientAddress, e.getMessage());
        }
    }

    /**
     * Close this connection and release resources.
     * Idempotent - safe to call multiple times.
     */
    public void close() {
        if (state == ConnectionState.CLOSING) {
            return;
        }
        state = ConnectionState.CLOSING;

        try {
            channel.close();
        } catch (IOException e) {
            logger.debug("Error closing connection: {}", e.getMessage());
        }

        if (server != null) {
            server.removeConnection(channel);
        }

        metrics.connectionClosed();
        logger.debug("Connection closed: {}", clientAddress);
    }

    public ConnectionState getState() {
        return state;
    }

    public String getRemoteAddress() {
        return clientAddress;
    }

    ConnectionBuffer getBuffer() {
        return buffer;
    }
}
