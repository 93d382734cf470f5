package com.respkv.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * In-memory key-value store backed by a HashMap.
 * Every public method holds the store monitor, so a single command is never
 * observed half-applied. Expired entries are removed when observed, and in
 * batches by {@link #purgeExpired(int)}, which takes them soonest-first from an
 * expiry queue instead of scanning the keyspace.
 */
public class InMemoryStore implements KVStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryStore.class);

    // Stale queue entries tolerated beyond twice the live key count before a rebuild
    static final int EXPIRY_QUEUE_SLACK = 1024;

    private final Map<ByteKey, KeyValuePair> store;
    // One entry per TTL write; an entry goes stale once its key is rewritten or deleted
    private final PriorityQueue<Expiration> expiryQueue;
    private final Clock clock;
    private long expiredCount;

    /**
     * Create a store that reads time from the system UTC clock.
     */
    public InMemoryStore() {
        this(Clock.systemUTC());
    }

    /**
     * Create a store with an explicit time source.
     *
     * @param clock clock used to evaluate expiration
     */
    public InMemoryStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.store = new HashMap<>();
        this.expiryQueue = new PriorityQueue<>();
    }

    @Override
    public synchronized boolean set(byte[] key, byte[] value, long expiresAt,
                                    SetCondition condition, boolean keepTtl) {
        Objects.requireNonNull(condition, "condition cannot be null");
        ByteKey storeKey = ByteKey.of(key);
        KeyValuePair current = liveEntry(storeKey, clock.millis());

        if (!condition.permits(current != null)) {
            logger.trace("SET {} skipped: condition {} not met", storeKey, condition);
            return false;
        }

        long effectiveExpiry = expiresAt;
        if (keepTtl) {
            effectiveExpiry = current != null ? current.getExpiresAt() : KeyValuePair.NO_EXPIRY;
        }
        store.put(storeKey, new KeyValuePair(value, effectiveExpiry));
        // A kept expiry is already queued
        if (!keepTtl && expiresAt != KeyValuePair.NO_EXPIRY) {
            scheduleExpiry(storeKey, expiresAt);
        }
        logger.trace("SET {} ({} bytes, expiresAt={})", storeKey, value.length, effectiveExpiry);
        return true;
    }

    @Override
    public synchronized Optional<KeyValuePair> get(byte[] key) {
        return Optional.ofNullable(liveEntry(ByteKey.of(key), clock.millis()));
    }

    @Override
    public synchronized boolean delete(byte[] key) {
        ByteKey storeKey = ByteKey.of(key);
        if (liveEntry(storeKey, clock.millis()) == null) {
            return false;
        }
        store.remove(storeKey);
        logger.trace("DEL {}", storeKey);
        return true;
    }

    @Override
    public synchronized boolean exists(byte[] key) {
        return liveEntry(ByteKey.of(key), clock.millis()) != null;
    }

    @Override
    public synchronized int purgeExpired(int limit) {
        if (limit <= 0) {
            return 0;
        }
        long now = clock.millis();
        int removed = 0;
        Expiration head;
        while (removed < limit && (head = expiryQueue.peek()) != null && head.expiresAt <= now) {
            expiryQueue.poll();
            KeyValuePair entry = store.get(head.key);
            if (entry != null && entry.getExpiresAt() == head.expiresAt) {
                store.remove(head.key);
                removed++;
            }
        }
        if (removed > 0) {
            expiredCount += removed;
            logger.debug("Purged {} expired entries", removed);
        }
        return removed;
    }

    @Override
    public synchronized long expiredCount() {
        return expiredCount;
    }

    @Override
    public synchronized int size() {
        return store.size();
    }

    @Override
    public synchronized void clear() {
        store.clear();
        expiryQueue.clear();
    }

    synchronized int expiryQueueSize() {
        return expiryQueue.size();
    }

    /**
     * Queue a key for the active sweep, rebuilding the queue from live entries
     * when stale entries dominate it. Caller must hold the store monitor.
     */
    private void scheduleExpiry(ByteKey key, long expiresAt) {
        expiryQueue.add(new Expiration(expiresAt, key));
        if (expiryQueue.size() > 2L * store.size() + EXPIRY_QUEUE_SLACK) {
            expiryQueue.clear();
            for (Map.Entry<ByteKey, KeyValuePair> entry : store.entrySet()) {
                if (entry.getValue().hasTtl()) {
                    expiryQueue.add(new Expiration(entry.getValue().getExpiresAt(), entry.getKey()));
                }
            }
            logger.debug("Rebuilt expiry queue with {} entries", expiryQueue.size());
        }
    }

    /**
     * Look up an entry, removing it if it has expired.
     * Caller must hold the store monitor.
     */
    private KeyValuePair liveEntry(ByteKey key, long now) {
        KeyValuePair entry = store.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpiredAt(now)) {
            store.remove(key);
            expiredCount++;
            logger.trace("Expired {} on access", key);
            return null;
        }
        return entry;
    }

    /**
     * Pending expiration of one key, ordered soonest first.
     */
    private static final class Expiration implements Comparable<Expiration> {
        private final long expiresAt;
        private final ByteKey key;

        Expiration(long expiresAt, ByteKey key) {
            this.expiresAt = expiresAt;
            this.key = key;
        }

        @Override
        public int compareTo(Expiration other) {
            return Long.compare(expiresAt, other.expiresAt);
        }
    }
}
