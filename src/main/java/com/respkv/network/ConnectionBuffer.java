package com.respkv.network;

import com.respkv.network.protocol.RequestDecoder;
import com.respkv.network.protocol.RespValue;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.WritableByteChannel;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Per-connection byte buffers: unconsumed request bytes in, encoded replies out.
 * Not thread-safe; owned by the event loop.
 */
public class ConnectionBuffer {

    static final int INITIAL_CAPACITY = 16 * 1024;

    private final int maxInboundBytes;
    private final Deque<ByteBuffer> outbound = new ArrayDeque<>();
    private final RequestDecoder decoder = new RequestDecoder();

    // Read mode between calls: [position, limit) are received, unconsumed bytes
    private ByteBuffer inbound;

    /**
     * @param maxInboundBytes upper bound on buffered, unconsumed request bytes
     */
    public ConnectionBuffer(int maxInboundBytes) {
        if (maxInboundBytes <= 0) {
            throw new IllegalArgumentException("maxInboundBytes must be positive, got: " + maxInboundBytes);
        }
        this.maxInboundBytes = maxInboundBytes;
        this.inbound = ByteBuffer.allocate(Math.min(INITIAL_CAPACITY, maxInboundBytes));
        this.inbound.flip();
    }

    // ==================== Inbound ====================

    /**
     * Read whatever the channel has available.
     *
     * @param channel a non-blocking channel
     * @return bytes read, 0 if none were available, -1 at end of stream
     * @throws IOException           if the read fails
     * @throws IllegalStateException if the inbound bound would be exceeded
     */
    public int readFrom(ReadableByteChannel channel) throws IOException {
        inbound.compact();
        try {
            if (!inbound.hasRemaining()) {
                grow(inbound.capacity() + 1);
            }
            return channel.read(inbound);
        } finally {
            inbound.flip();
        }
    }

    /**
     * Append bytes as if they had been read from the socket.
     */
    public void append(byte[] bytes) {
        inbound.compact();
        try {
            if (inbound.remaining() < bytes.length) {
                grow(inbound.position() + bytes.length);
            }
            inbound.put(bytes);
        } finally {
            inbound.flip();
        }
    }

    /**
     * Decode and consume the next complete request. Elements of a request that
     * is still arriving are consumed and kept by the decoder.
     *
     * @return the request, or null if the buffered bytes do not hold a complete one
     * @throws com.respkv.network.protocol.ProtocolException if the bytes are malformed
     * @throws IllegalStateException if the partial request outgrows the inbound bound
     */
    public RespValue nextFrame() {
        RespValue request = decoder.decode(inbound);
        if (request == null && pendingRequestBytes() > maxInboundBytes) {
            throw limitExceeded();
        }
        return request;
    }

    /**
     * @return buffered bytes not yet consumed by the decoder
     */
    public int inboundBytes() {
        return inbound.remaining();
    }

    /**
     * @return bytes held for the current request: decoded elements plus unconsumed input
     */
    public long pendingRequestBytes() {
        return decoder.pendingFrameBytes() + inbound.remaining();
    }

    int inboundCapacity() {
        return inbound.capacity();
    }

    /**
     * Grow the inbound buffer to hold at least {@code required} bytes.
     * PRECONDITION: buffer is in write mode.
     */
    private void grow(int required) {
        if (required + decoder.pendingFrameBytes() > maxInboundBytes || inbound.capacity() >= maxInboundBytes) {
            throw limitExceeded();
        }
        long newCapacity = inbound.capacity();
        while (newCapacity < required) {
            newCapacity *= 2;
        }
        newCapacity = Math.min(newCapacity, maxInboundBytes);

        ByteBuffer grown = ByteBuffer.allocate((int) newCapacity);
        inbound.flip();
        grown.put(inbound);
        inbound = grown;
    }

    private IllegalStateException limitExceeded() {
        return new IllegalStateException("Inbound buffer limit of " + maxInboundBytes + " bytes exceeded");
    }

    // ==================== Outbound ====================

    /**
     * Queue an encoded reply. The buffer must be positioned for reading.
     */
    public void enqueue(ByteBuffer reply) {
        if (reply.hasRemaining()) {
            outbound.addLast(reply);
        }
    }

    public void enqueue(byte[] reply) {
        enqueue(ByteBuffer.wrap(reply));
    }

    public boolean hasPendingOutput() {
        return !outbound.isEmpty();
    }

    public long pendingOutputBytes() {
        long total = 0;
        for (ByteBuffer buffer : outbound) {
            total += buffer.remaining();
        }
        return total;
    }

    /**
     * Write queued replies, in order, until the channel stops accepting bytes.
     *
     * @param channel a non-blocking channel
     * @return bytes written
     * @throws IOException if the write fails
     */
    public long writeTo(WritableByteChannel channel) throws IOException {
        long written = 0;
        ByteBuffer head;
        while ((head = outbound.peekFirst()) != null) {
            written += channel.write(head);
            if (head.hasRemaining()) {
                break;
            }
            outbound.pollFirst();
        }
        return written;
    }
}
