package com.respkv.network.protocol;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable RESP2 value: status string, error, integer, bulk string, array,
 * or one of the two null markers.
 */
public final class RespValue {

    /**
     * Wire-level kinds of value.
     */
    public enum Type {
        SIMPLE_STRING,
        ERROR,
        INTEGER,
        BULK_STRING,
        ARRAY,
        NULL_BULK_STRING,
        NULL_ARRAY
    }

    private static final RespValue NULL_BULK_STRING = new RespValue(Type.NULL_BULK_STRING, null, 0, null);
    private static final RespValue NULL_ARRAY = new RespValue(Type.NULL_ARRAY, null, 0, null);
    private static final RespValue EMPTY_ARRAY = new RespValue(Type.ARRAY, null, 0, Collections.emptyList());
    private static final RespValue OK = simpleString("OK");
    private static final RespValue PONG = simpleString("PONG");

    private final Type type;
    private final byte[] bytes;       // SIMPLE_STRING, ERROR, BULK_STRING
    private final long integer;       // INTEGER
    private final List<RespValue> elements; // ARRAY

    private RespValue(Type type, byte[] bytes, long integer, List<RespValue> elements) {
        this.type = type;
        this.bytes = bytes;
        this.integer = integer;
        this.elements = elements;
    }

    /**
     * Create a status reply ({@code +text}). Must not contain CR or LF.
     */
    public static RespValue simpleString(String text) {
        Objects.requireNonNull(text, "text");
        return new RespValue(Type.SIMPLE_STRING, lineBytes(text), 0, null);
    }

    /**
     * Create an error reply ({@code -message}). Must not contain CR or LF.
     */
    public static RespValue error(String message) {
        Objects.requireNonNull(message, "message");
        return new RespValue(Type.ERROR, lineBytes(message), 0, null);
    }

    public static RespValue integer(long value) {
        return new RespValue(Type.INTEGER, null, value, null);
    }

    /**
     * Create a bulk string holding a copy of the given bytes.
     */
    public static RespValue bulkString(byte[] value) {
        Objects.requireNonNull(value, "value");
        return new RespValue(Type.BULK_STRING, Arrays.copyOf(value, value.length), 0, null);
    }

    public static RespValue bulkString(String value) {
        Objects.requireNonNull(value, "value");
        return new RespValue(Type.BULK_STRING, value.getBytes(StandardCharsets.UTF_8), 0, null);
    }

    public static RespValue array(List<RespValue> elements) {
        Objects.requireNonNull(elements, "elements");
        if (elements.isEmpty()) {
            return EMPTY_ARRAY;
        }
        return new RespValue(Type.ARRAY, null, 0, Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    public static RespValue array(RespValue... elements) {
        return array(Arrays.asList(elements));
    }

    /**
     * Build a request-style array of bulk strings.
     */
    public static RespValue command(String... parts) {
        List<RespValue> elements = new ArrayList<>(parts.length);
        for (String part : parts) {
            elements.add(bulkString(part));
        }
        return array(elements);
    }

    public static RespValue emptyArray() {
        return EMPTY_ARRAY;
    }

    public static RespValue nullBulkString() {
        return NULL_BULK_STRING;
    }

    public static RespValue nullArray() {
        return NULL_ARRAY;
    }

    public static RespValue ok() {
        return OK;
    }

    public static RespValue pong() {
        return PONG;
    }

    /**
     * Wrap bytes the decoder already owns, without a defensive copy.
     */
    static RespValue bulkStringOwned(byte[] value) {
        return new RespValue(Type.BULK_STRING, value, 0, null);
    }

    static RespValue simpleStringOwned(byte[] value) {
        return new RespValue(Type.SIMPLE_STRING, value, 0, null);
    }

    static RespValue errorOwned(byte[] value) {
        return new RespValue(Type.ERROR, value, 0, null);
    }

    static RespValue arrayOwned(List<RespValue> elements) {
        return elements.isEmpty() ? EMPTY_ARRAY
                : new RespValue(Type.ARRAY, null, 0, Collections.unmodifiableList(elements));
    }

    private static byte[] lineBytes(String text) {
        if (text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("Status and error text cannot contain CR or LF");
        }
        return text.getBytes(StandardCharsets.UTF_8);
    }

    public Type getType() {
        return type;
    }

    /**
     * Get the raw payload without copying.
     * Do not modify the returned array.
     */
    public byte[] getBytesUnsafe() {
        return bytes;
    }

    /**
     * Decode the payload of a string-like value as UTF-8.
     *
     * @return the text, or null for non-string types
     */
    public String asString() {
        return bytes != null ? new String(bytes, StandardCharsets.UTF_8) : null;
    }

    public long getInteger() {
        if (type != Type.INTEGER) {
            throw new IllegalStateException("Not an integer: " + type);
        }
        return integer;
    }

    /**
     * Get the elements of an array.
     *
     * @return unmodifiable element list, or null for non-array types
     */
    public List<RespValue> getElements() {
        return elements;
    }

    public boolean isNull() {
        return type == Type.NULL_BULK_STRING || type == Type.NULL_ARRAY;
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RespValue that = (RespValue) o;
        return type == that.type &&
               integer == that.integer &&
               Arrays.equals(bytes, that.bytes) &&
               Objects.equals(elements, that.elements);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(type, integer, elements);
        result = 31 * result + Arrays.hashCode(bytes);
        return result;
    }

    @Override
    public String toString() {
        switch (type) {
            case SIMPLE_STRING:
                return "+" + asString();
            case ERROR:
                return "-" + asString();
            case INTEGER:
                return ":" + integer;
            case BULK_STRING:
                return "\"" + asString() + "\"";
            case ARRAY:
                return elements.toString();
            case NULL_BULK_STRING:
                return "(nil)";
            case NULL_ARRAY:
                return "(nil array)";
            default:
                throw new IllegalStateException("Unknown type: " + type);
        }
    }
}
