package com.respkv.network.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP2 wire protocol encoder/decoder.
 *
 * Request:  *&lt;n&gt;\r\n followed by n bulk strings $&lt;len&gt;\r\n&lt;bytes&gt;\r\n
 * Response: +status, -error, :integer, $bulk, *array, $-1 (null bulk), *-1 (null array)
 *
 * Decoding never blocks and never consumes a partial frame: when the buffer holds
 * fewer bytes than a complete frame needs, {@link DecodeResult#incomplete()} is
 * returned and the buffer position is left untouched.
 */
public final class RespCodec {

    public static final byte SIMPLE_STRING_SIGIL = '+';
    public static final byte ERROR_SIGIL = '-';
    public static final byte INTEGER_SIGIL = ':';
    public static final byte BULK_STRING_SIGIL = '$';
    public static final byte ARRAY_SIGIL = '*';

    private static final byte CR = '\r';
    private static final byte LF = '\n';
    private static final byte[] CRLF = {CR, LF};
    private static final byte[] NULL_LENGTH = {'-', '1'};

    // Same limits Redis applies to client frames
    public static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;
    public static final int MAX_ARRAY_LENGTH = 1024 * 1024;

    // A length header is at most a sign and 19 digits; anything longer is garbage
    static final int MAX_HEADER_LINE = 64;
    // Status and error lines in replies
    static final int MAX_INLINE_LINE = 64 * 1024;
    static final int MAX_NESTING_DEPTH = 32;

    private RespCodec() {
        // Utility class
    }

    // ==================== Encoding ====================

    /**
     * Encode a value into a new buffer.
     *
     * @param value the value to encode
     * @return ByteBuffer positioned at start, ready to read
     */
    public static ByteBuffer encode(RespValue value) {
        ByteBuffer buffer = ByteBuffer.allocate(encodedSize(value));
        encode(value, buffer);
        buffer.flip();
        return buffer;
    }

    /**
     * Encode a value into a byte array.
     */
    public static byte[] encodeToBytes(RespValue value) {
        return encode(value).array();
    }

    /**
     * Encode a value into an existing buffer.
     *
     * @param value  the value to encode
     * @param buffer the buffer to write to (must have {@link #encodedSize} bytes remaining)
     */
    public static void encode(RespValue value, ByteBuffer buffer) {
        switch (value.getType()) {
            case SIMPLE_STRING:
                buffer.put(SIMPLE_STRING_SIGIL).put(value.getBytesUnsafe()).put(CRLF);
                break;
            case ERROR:
                buffer.put(ERROR_SIGIL).put(value.getBytesUnsafe()).put(CRLF);
                break;
            case INTEGER:
                buffer.put(INTEGER_SIGIL).put(ascii(value.getInteger())).put(CRLF);
                break;
            case BULK_STRING: {
                byte[] payload = value.getBytesUnsafe();
                buffer.put(BULK_STRING_SIGIL).put(ascii(payload.length)).put(CRLF);
                buffer.put(payload).put(CRLF);
                break;
            }
            case ARRAY: {
                List<RespValue> elements = value.getElements();
                buffer.put(ARRAY_SIGIL).put(ascii(elements.size())).put(CRLF);
                for (RespValue element : elements) {
                    encode(element, buffer);
                }
                break;
            }
            case NULL_BULK_STRING:
                buffer.put(BULK_STRING_SIGIL).put(NULL_LENGTH).put(CRLF);
                break;
            case NULL_ARRAY:
                buffer.put(ARRAY_SIGIL).put(NULL_LENGTH).put(CRLF);
                break;
            default:
                throw new IllegalStateException("Unknown type: " + value.getType());
        }
    }

    /**
     * Calculate the encoded size of a value.
     *
     * @param value the value
     * @return size in bytes
     */
    public static int encodedSize(RespValue value) {
        switch (value.getType()) {
            case SIMPLE_STRING:
            case ERROR:
                return 1 + value.getBytesUnsafe().length + 2;
            case INTEGER:
                return 1 + digits(value.getInteger()) + 2;
            case BULK_STRING: {
                int length = value.getBytesUnsafe().length;
                return 1 + digits(length) + 2 + length + 2;
            }
            case ARRAY: {
                List<RespValue> elements = value.getElements();
                int size = 1 + digits(elements.size()) + 2;
                for (RespValue element : elements) {
                    size += encodedSize(element);
                }
                return size;
            }
            case NULL_BULK_STRING:
            case NULL_ARRAY:
                return 1 + NULL_LENGTH.length + 2;
            default:
                throw new IllegalStateException("Unknown type: " + value.getType());
        }
    }

    private static byte[] ascii(long number) {
        return Long.toString(number).getBytes(StandardCharsets.US_ASCII);
    }

    private static int digits(long number) {
        return Long.toString(number).length();
    }

    // ==================== Decoding ====================

    /**
     * Decode one client request: an array of bulk strings.
     * The buffer position is not modified; callers advance it by
     * {@link DecodeResult#getBytesConsumed()} once they accept the frame.
     *
     * @param buffer the bytes received so far, from position to limit
     * @return complete result, or incomplete if more bytes are required
     * @throws ProtocolException if the bytes can never form a valid request
     */
    public static DecodeResult decodeRequest(ByteBuffer buffer) {
        ByteBuffer view = buffer.duplicate();
        RespValue request = new RequestDecoder().decode(view);
        if (request == null) {
            return DecodeResult.incomplete();
        }
        return DecodeResult.complete(request, view.position() - buffer.position());
    }

    /**
     * Decode any RESP2 value, as found in server replies.
     * The buffer position is not modified.
     *
     * @param buffer the bytes received so far, from position to limit
     * @return complete result, or incomplete if more bytes are required
     * @throws ProtocolException if the bytes violate the grammar
     */
    public static DecodeResult decode(ByteBuffer buffer) {
        Cursor cursor = new Cursor(buffer);
        RespValue value = readValue(cursor, 0);
        if (value == null) {
            return DecodeResult.incomplete();
        }
        return DecodeResult.complete(value, cursor.consumed());
    }

    private static RespValue readValue(Cursor cursor, int depth) {
        if (depth > MAX_NESTING_DEPTH) {
            throw new ProtocolException("Nesting deeper than " + MAX_NESTING_DEPTH);
        }
        if (!cursor.hasRemaining()) {
            return null;
        }
        byte sigil = cursor.next();
        switch (sigil) {
            case SIMPLE_STRING_SIGIL: {
                byte[] line = readLine(cursor, MAX_INLINE_LINE);
                return line != null ? RespValue.simpleStringOwned(line) : null;
            }
            case ERROR_SIGIL: {
                byte[] line = readLine(cursor, MAX_INLINE_LINE);
                return line != null ? RespValue.errorOwned(line) : null;
            }
            case INTEGER_SIGIL: {
                byte[] line = readLine(cursor, MAX_HEADER_LINE);
                return line != null ? RespValue.integer(parseNumber(line)) : null;
            }
            case BULK_STRING_SIGIL:
                return readBulkPayload(cursor, true);
            case ARRAY_SIGIL: {
                byte[] header = readLine(cursor, MAX_HEADER_LINE);
                if (header == null) {
                    return null;
                }
                long count = parseNumber(header);
                if (count == -1) {
                    return RespValue.nullArray();
                }
                if (count < 0 || count > MAX_ARRAY_LENGTH) {
                    throw new ProtocolException("Invalid multibulk length: " + count);
                }
                List<RespValue> elements = new ArrayList<>((int) Math.min(count, 16));
                for (long i = 0; i < count; i++) {
                    RespValue element = readValue(cursor, depth + 1);
                    if (element == null) {
                        return null;
                    }
                    elements.add(element);
                }
                return RespValue.arrayOwned(elements);
            }
            default:
                throw new ProtocolException("Unknown type sigil " + describe(sigil));
        }
    }

    /**
     * Read "&lt;len&gt;\r\n&lt;bytes&gt;\r\n" after the '$' sigil.
     *
     * @return the bulk string, or null if incomplete
     */
    static RespValue readBulkPayload(Cursor cursor, boolean allowNull) {
        byte[] header = readLine(cursor, MAX_HEADER_LINE);
        if (header == null) {
            return null;
        }
        long length = parseNumber(header);
        if (length == -1 && allowNull) {
            return RespValue.nullBulkString();
        }
        if (length < 0 || length > MAX_BULK_LENGTH) {
            throw new ProtocolException("Invalid bulk length: " + length);
        }
        if (cursor.remaining() < length + 2) {
            return null;
        }
        byte[] payload = cursor.take((int) length);
        if (cursor.next() != CR || cursor.next() != LF) {
            throw new ProtocolException("Bulk string of length " + length + " not terminated by CRLF");
        }
        return RespValue.bulkStringOwned(payload);
    }

    /**
     * Read bytes up to CRLF and step past the terminator.
     *
     * @return the line without CRLF, or null if the terminator has not arrived yet
     */
    static byte[] readLine(Cursor cursor, int maxLength) {
        int start = cursor.position;
        int limit = cursor.limit();
        for (int i = start; i < limit; i++) {
            if (i - start > maxLength) {
                throw new ProtocolException("Line exceeds " + maxLength + " bytes without CRLF");
            }
            byte b = cursor.buffer.get(i);
            if (b == LF) {
                throw new ProtocolException("Bare LF in line");
            }
            if (b == CR) {
                if (i + 1 >= limit) {
                    return null;
                }
                if (cursor.buffer.get(i + 1) != LF) {
                    throw new ProtocolException("CR not followed by LF");
                }
                byte[] line = cursor.take(i - start);
                cursor.skip(2);
                return line;
            }
        }
        if (limit - start > maxLength) {
            throw new ProtocolException("Line exceeds " + maxLength + " bytes without CRLF");
        }
        return null;
    }

    /**
     * Parse an optionally signed base-10 integer, rejecting anything else.
     */
    static long parseNumber(byte[] line) {
        if (line.length == 0) {
            throw new ProtocolException("Empty length");
        }
        boolean negative = line[0] == '-';
        int i = negative ? 1 : 0;
        if (i == line.length) {
            throw new ProtocolException("Invalid number: '-'");
        }
        long result = 0;
        for (; i < line.length; i++) {
            byte b = line[i];
            if (b < '0' || b > '9') {
                throw new ProtocolException("Invalid number: '"
                    + new String(line, StandardCharsets.US_ASCII) + "'");
            }
            if (result > (Long.MAX_VALUE - (b - '0')) / 10) {
                throw new ProtocolException("Number out of range: '"
                    + new String(line, StandardCharsets.US_ASCII) + "'");
            }
            result = result * 10 + (b - '0');
        }
        return negative ? -result : result;
    }

    static String describe(byte b) {
        if (b >= 0x20 && b < 0x7f) {
            return "'" + (char) b + "'";
        }
        return String.format("0x%02X", b & 0xff);
    }

    /**
     * Read position over a buffer that leaves the buffer's own position untouched.
     */
    static final class Cursor {
        private final ByteBuffer buffer;
        private final int origin;
        private int position;

        Cursor(ByteBuffer buffer) {
            this.buffer = buffer;
            this.origin = buffer.position();
            this.position = origin;
        }

        int limit() {
            return buffer.limit();
        }

        int remaining() {
            return buffer.limit() - position;
        }

        boolean hasRemaining() {
            return position < buffer.limit();
        }

        byte next() {
            return buffer.get(position++);
        }

        byte[] take(int length) {
            byte[] bytes = new byte[length];
            ByteBuffer view = buffer.duplicate();
            view.position(position);
            view.get(bytes);
            position += length;
            return bytes;
        }

        void skip(int length) {
            position += length;
        }

        int consumed() {
            return position - origin;
        }

        /**
         * Advance the underlying buffer past everything read so far.
         */
        void commit() {
            buffer.position(position);
        }
    }
}
