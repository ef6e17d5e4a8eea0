package io.github.wcarmon.ttlcache;

import static java.util.Objects.requireNonNull;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.jetbrains.annotations.Nullable;

/**
 * Storage behind a {@link TtlCache}.
 * <p>
 * One map, one read/write lock. Reads share the lock, writes hold it exclusively.
 * Nothing here holds the lock while calling back into the store.
 * <p>
 * Holds no reference to the owning cache: the sweep task and the cleaner reach only this store.
 *
 * @param <K> cache key type
 * @param <V> cache value type
 */
final class EntryStore<K, V> {

    private static final Duration MAX_TTL = Duration.ofNanos(Long.MAX_VALUE);

    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final CapacityPolicy policy;

    /** Guarded by lock, replaced on reset */
    private Map<K, CacheEntry<V>> entries;

    EntryStore(CapacityPolicy policy, Clock clock) {
        requireNonNull(policy, "policy is required and null.");
        requireNonNull(clock, "clock is required and null.");

        this.clock = clock;
        this.policy = policy;
        this.entries = policy.newStore();
    }

    /**
     * Removes entries whose deadline passed.
     * <p>
     * Scans under the read lock, then deletes the collected keys under the write lock.
     * An entry which expires mid-scan is left for the next sweep.
     * A key rewritten between the phases is deleted anyway (no recheck),
     * a key added between the phases is never deleted by this call.
     *
     * @return number of entries removed
     */
    int cleanExpired() {
        final long now = nowNanos();
        final List<K> expired = new ArrayList<>();

        lock.readLock().lock();
        try {
            for (Map.Entry<K, CacheEntry<V>> e : entries.entrySet()) {
                if (e.getValue().isExpired(now)) {
                    expired.add(e.getKey());
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        if (expired.isEmpty()) {
            return 0;
        }

        int removed = 0;
        lock.writeLock().lock();
        try {
            for (K key : expired) {
                if (entries.remove(key) != null) {
                    removed++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        return removed;
    }

    boolean containsKey(K key) {
        requireNonNull(key, "key is required and null.");

        lock.readLock().lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Converts a TTL to an absolute deadline.
     *
     * @param ttl time to live, null/zero/negative means no expiration
     * @return epoch nanos deadline, or {@link CacheEntry#NEVER_EXPIRES}
     */
    long expiresAt(@Nullable Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return CacheEntry.NEVER_EXPIRES;
        }

        final long now = nowNanos();
        if (ttl.compareTo(MAX_TTL) >= 0) {
            return Long.MAX_VALUE;
        }

        final long ttlNanos = ttl.toNanos();
        if (ttlNanos >= Long.MAX_VALUE - now) {
            return Long.MAX_VALUE;
        }

        return now + ttlNanos;
    }

    /**
     * @param key - unique id for entry
     * @return value when present, expired or not
     */
    Optional<V> get(K key) {
        requireNonNull(key, "key is required and null.");

        final CacheEntry<V> entry = getEntry(key);
        if (entry == null) {
            return Optional.empty();
        }

        return Optional.of(entry.value());
    }

    /**
     * @param key - unique id for entry
     * @return value when present and not expired
     */
    Optional<V> getSafe(K key) {
        requireNonNull(key, "key is required and null.");

        final CacheEntry<V> entry = getEntry(key);
        if (entry == null || entry.isExpired(nowNanos())) {
            return Optional.empty();
        }

        return Optional.of(entry.value());
    }

    CapacityPolicy policy() {
        return policy;
    }

    void put(K key, V value, long expiresAtNanos) {
        requireNonNull(key, "key is required and null.");
        requireNonNull(value, "value is required and null.");

        final CacheEntry<V> entry = new CacheEntry<>(value, expiresAtNanos);

        lock.writeLock().lock();
        try {
            policy.beforeInsert(entries, key);
            entries.put(key, entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Writes every entry of batch under a single acquisition of the write lock.
     * Readers see either none or all of the batch.
     * <p>
     * The batch is validated before anything is written.
     */
    void putAll(Map<? extends K, ? extends V> batch, long expiresAtNanos) {
        requireNonNull(batch, "batch is required and null.");

        for (Map.Entry<? extends K, ? extends V> e : batch.entrySet()) {
            requireNonNull(e.getKey(), "batch key is required and null.");
            requireNonNull(e.getValue(), "batch value is required and null.");
        }

        if (batch.isEmpty()) {
            return;
        }

        lock.writeLock().lock();
        try {
            entries = policy.beforeInsertAll(entries, batch.size());

            for (Map.Entry<? extends K, ? extends V> e : batch.entrySet()) {
                entries.put(e.getKey(), new CacheEntry<>(e.getValue(), expiresAtNanos));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    void remove(K key) {
        requireNonNull(key, "key is required and null.");

        lock.writeLock().lock();
        try {
            entries.remove(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drops every entry, replacing the map with a fresh one sized for the policy
     */
    void reset() {
        lock.writeLock().lock();
        try {
            entries = policy.newStore();
        } finally {
            lock.writeLock().unlock();
        }
    }

    int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Nullable
    private CacheEntry<V> getEntry(K key) {
        lock.readLock().lock();
        try {
            return entries.get(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    private long nowNanos() {
        final Instant now = clock.instant();
        return ChronoUnit.NANOS.between(Instant.EPOCH, now);
    }
}
