package com.respkv.core;

import java.util.Optional;

/**
 * Core storage interface for the key-value store.
 * Keys and values are binary-safe. Expiration instants are absolute epoch millis;
 * an entry is absent from its expiration millisecond onwards.
 * All implementations must be thread-safe.
 */
public interface KVStore {

    /**
     * Store a value under the given key.
     *
     * @param key       the key to store
     * @param value     the value to store
     * @param expiresAt absolute expiration in epoch millis (0 for no expiration)
     * @param condition precondition on the existing live entry
     * @param keepTtl   keep the expiration of the existing live entry instead of {@code expiresAt}
     * @return true if the value was written, false if the condition was not met
     */
    boolean set(byte[] key, byte[] value, long expiresAt, SetCondition condition, boolean keepTtl);

    /**
     * Store a value with no expiration, unconditionally.
     *
     * @param key   the key to store
     * @param value the value to store
     */
    default void set(byte[] key, byte[] value) {
        set(key, value, KeyValuePair.NO_EXPIRY, SetCondition.ALWAYS, false);
    }

    /**
     * Retrieve the entry for a given key.
     *
     * @param key the key to look up
     * @return the entry if found and not expired, empty otherwise
     */
    Optional<KeyValuePair> get(byte[] key);

    /**
     * Delete a key.
     *
     * @param key the key to delete
     * @return true if a live entry was removed
     */
    boolean delete(byte[] key);

    /**
     * Check if a key exists and is not expired.
     *
     * @param key the key to check
     * @return true if the key exists and is not expired
     */
    boolean exists(byte[] key);

    /**
     * Remove expired entries.
     *
     * @param limit maximum number of entries to remove
     * @return the number of entries removed
     */
    int purgeExpired(int limit);

    /**
     * Get the number of entries removed because they expired, lazily or by a sweep.
     *
     * @return cumulative expired-entry count
     */
    long expiredCount();

    /**
     * Get the number of entries in the store, including expired entries
     * that have not been removed yet.
     *
     * @return the number of entries
     */
    int size();

    /**
     * Clear all entries from the store.
     */
    void clear();
}
