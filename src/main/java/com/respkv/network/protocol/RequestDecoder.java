package com.respkv.network.protocol;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Incremental decoder for client requests (arrays of bulk strings).
 *
 * Unlike {@link RespCodec#decodeRequest(ByteBuffer)}, this decoder consumes the
 * array header and each bulk string element as soon as it is complete, and
 * remembers them until the rest of the frame arrives. Every received byte is
 * therefore parsed once, however many reads a large frame is spread over.
 *
 * Not thread-safe; one instance per connection.
 */
public final class RequestDecoder {

    private static final int NO_FRAME = -1;

    private int expected = NO_FRAME;
    private List<RespValue> elements;
    private long frameBytes;

    /**
     * Decode as much of the next request as the buffer holds.
     * The buffer position is advanced past every header and element consumed,
     * including those of a frame that is not yet complete.
     *
     * @param buffer received bytes, from position to limit
     * @return the complete request, or null if more bytes are required
     * @throws ProtocolException if the bytes can never form a valid request
     */
    public RespValue decode(ByteBuffer buffer) {
        if (expected == NO_FRAME && !readHeader(buffer)) {
            return null;
        }

        while (elements.size() < expected) {
            RespCodec.Cursor cursor = new RespCodec.Cursor(buffer);
            if (!cursor.hasRemaining()) {
                return null;
            }
            byte sigil = cursor.next();
            if (sigil != RespCodec.BULK_STRING_SIGIL) {
                throw new ProtocolException("Expected '$', got " + RespCodec.describe(sigil));
            }
            RespValue element = RespCodec.readBulkPayload(cursor, false);
            if (element == null) {
                return null;
            }
            elements.add(element);
            frameBytes += cursor.consumed();
            cursor.commit();
        }

        RespValue request = RespValue.arrayOwned(elements);
        reset();
        return request;
    }

    private boolean readHeader(ByteBuffer buffer) {
        RespCodec.Cursor cursor = new RespCodec.Cursor(buffer);
        if (!cursor.hasRemaining()) {
            return false;
        }
        byte sigil = cursor.next();
        if (sigil != RespCodec.ARRAY_SIGIL) {
            throw new ProtocolException("Expected '*', got " + RespCodec.describe(sigil));
        }
        byte[] header = RespCodec.readLine(cursor, RespCodec.MAX_HEADER_LINE);
        if (header == null) {
            return false;
        }
        long count = RespCodec.parseNumber(header);
        if (count < 0 || count > RespCodec.MAX_ARRAY_LENGTH) {
            throw new ProtocolException("Invalid multibulk length: " + count);
        }

        expected = (int) count;
        elements = new ArrayList<>(Math.min(expected, 16));
        frameBytes = cursor.consumed();
        cursor.commit();
        return true;
    }

    /**
     * @return true if part of a request has been consumed but not yet returned
     */
    public boolean inFrame() {
        return expected != NO_FRAME;
    }

    /**
     * @return wire bytes of the partial request consumed so far, 0 between requests
     */
    public long pendingFrameBytes() {
        return inFrame() ? frameBytes : 0;
    }

    /**
     * Drop any partial request.
     */
    public void reset() {
        expected = NO_FRAME;
        elements = null;
        frameBytes = 0;
    }
}
