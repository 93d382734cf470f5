package com.respkv.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable stored value with its optional absolute expiration.
 */
public final class KeyValuePair {

    /** Marker for entries that never expire. */
    public static final long NO_EXPIRY = 0;

    private final byte[] value;
    private final long expiresAt; // epoch millis, 0 means no expiration

    /**
     * Create a key-value pair with no expiration.
     *
     * @param value the value bytes
     */
    public KeyValuePair(byte[] value) {
        this(value, NO_EXPIRY);
    }

    /**
     * Create a key-value pair with an absolute expiration.
     *
     * @param value     the value bytes
     * @param expiresAt the expiration instant in epoch millis (0 for no expiration)
     */
    public KeyValuePair(byte[] value, long expiresAt) {
        Objects.requireNonNull(value, "value cannot be null");
        if (expiresAt < 0) {
            throw new IllegalArgumentException("expiresAt cannot be negative: " + expiresAt);
        }
        this.value = Arrays.copyOf(value, value.length);
        this.expiresAt = expiresAt;
    }

    /**
     * Get a copy of the value bytes.
     *
     * @return copy of the value
     */
    public byte[] getValue() {
        return Arrays.copyOf(value, value.length);
    }

    /**
     * Get the raw value bytes without copying.
     * Use with caution - do not modify the returned array.
     *
     * @return the internal value array
     */
    public byte[] getValueUnsafe() {
        return value;
    }

    /**
     * @return expiration timestamp in epoch millis, or 0 if no expiration
     */
    public long getExpiresAt() {
        return expiresAt;
    }

    public boolean hasTtl() {
        return expiresAt != NO_EXPIRY;
    }

    /**
     * Check whether this entry is expired at the given instant.
     * An entry is expired from its expiration millisecond onwards.
     *
     * @param nowMillis current time in epoch millis
     * @return true if expired
     */
    public boolean isExpiredAt(long nowMillis) {
        return expiresAt != NO_EXPIRY && expiresAt <= nowMillis;
    }

    /**
     * Get remaining TTL in milliseconds.
     *
     * @param nowMillis current time in epoch millis
     * @return remaining TTL, or -1 if no TTL, or 0 if expired
     */
    public long getRemainingTtl(long nowMillis) {
        if (expiresAt == NO_EXPIRY) {
            return -1;
        }
        return Math.max(0, expiresAt - nowMillis);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KeyValuePair that = (KeyValuePair) o;
        return expiresAt == that.expiresAt &&
               Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(expiresAt);
        result = 31 * result + Arrays.hashCode(value);
        return result;
    }

    @Override
    public String toString() {
        return "KeyValuePair{" +
               "valueLength=" + value.length +
               ", expiresAt=" + expiresAt +
               '}';
    }
}
