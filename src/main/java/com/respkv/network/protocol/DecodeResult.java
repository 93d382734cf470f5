package com.respkv.network.protocol;

/**
 * Outcome of a decode attempt: either a complete value together with the number
 * of bytes it occupied, or a signal that more bytes are needed.
 */
public final class DecodeResult {

    private static final DecodeResult INCOMPLETE = new DecodeResult(null, 0);

    private final RespValue value;
    private final int bytesConsumed;

    private DecodeResult(RespValue value, int bytesConsumed) {
        this.value = value;
        this.bytesConsumed = bytesConsumed;
    }

    public static DecodeResult complete(RespValue value, int bytesConsumed) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (bytesConsumed <= 0) {
            throw new IllegalArgumentException("bytesConsumed must be positive, got: " + bytesConsumed);
        }
        return new DecodeResult(value, bytesConsumed);
    }

    public static DecodeResult incomplete() {
        return INCOMPLETE;
    }

    public boolean isComplete() {
        return value != null;
    }

    /**
     * @return the decoded value, or null if incomplete
     */
    public RespValue getValue() {
        return value;
    }

    /**
     * @return bytes occupied by the value, or 0 if incomplete
     */
    public int getBytesConsumed() {
        return bytesConsumed;
    }

    @Override
    public String toString() {
        return isComplete()
            ? "DecodeResult{value=" + value + ", bytesConsumed=" + bytesConsumed + '}'
            : "DecodeResult{incomplete}";
    }
}
