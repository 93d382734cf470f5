package com.respkv.core;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Binary-safe map key with content equality.
 * Keys are arbitrary bytes; the empty key is valid.
 */
public final class ByteKey {

    private final byte[] bytes;
    private final int hash;

    private ByteKey(byte[] bytes) {
        this.bytes = bytes;
        this.hash = Arrays.hashCode(bytes);
    }

    /**
     * Create a key holding a copy of the given bytes.
     *
     * @param bytes the key bytes
     * @return the key
     */
    public static ByteKey of(byte[] bytes) {
        Objects.requireNonNull(bytes, "key bytes cannot be null");
        return new ByteKey(Arrays.copyOf(bytes, bytes.length));
    }

    public static ByteKey of(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        return new ByteKey(key.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Get the raw key bytes without copying.
     * Do not modify the returned array.
     */
    public byte[] getBytesUnsafe() {
        return bytes;
    }

    public int length() {
        return bytes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ByteKey that = (ByteKey) o;
        return hash == that.hash && Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
