package io.github.wcarmon.ttlcache;

import static java.util.Objects.requireNonNull;
import static java.util.Objects.requireNonNullElse;

import java.lang.ref.Cleaner;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An in-memory key-value cache with per-entry time-to-live.
 * Thread-safe, optional size bound, optional background sweep of expired entries.
 * <p>
 * Expired entries are not removed on read.
 * {@link #get} returns them until swept, {@link #getSafe} hides them.
 * <p>
 * A bounded cache evicts arbitrary entries (not LRU) to make room for new keys.
 * <p>
 * The background sweep runs with a fixed delay between runs, not at a fixed rate.
 * <p>
 * Usage:
 * <pre>{@code
 * try (TtlCache<String, String> cache = TtlCache.create(
 *         Duration.ofSeconds(1),   // default ttl
 *         Duration.ofSeconds(2),   // sweep interval
 *         5)) {                    // max size
 *
 *     cache.set("key", "x");
 *     cache.setWithTtl("key_1h", "x", Duration.ofHours(1));
 *     cache.getSafe("key").ifPresent(System.out::println);
 * }
 * }</pre>
 *
 * @param <K> cache key type (like a key in java.util.Map)
 * @param <V> cache value type (like a value in java.util.Map)
 */
public final class TtlCache<K, V> implements AutoCloseable {

    private static final Cleaner CLEANER = Cleaner.create();

    private static final Logger log = LoggerFactory.getLogger(TtlCache.class);

    /** Stops the sweep of a cache that was never closed */
    @Nullable
    private final Cleaner.Cleanable cleanable;

    /** Time to live for entries written without an explicit ttl */
    @Nullable
    private final Duration defaultTtl;

    private final EntryStore<K, V> store;

    /** Periodically removes expired entries, null when no cleanup interval is configured */
    @Nullable
    private final ExpirationSweeper sweeper;

    private TtlCache(
            @Nullable Duration defaultTtl,
            @Nullable Duration cleanupInterval,
            int maxSize,
            Clock clock,
            @Nullable ScheduledExecutorService executorService) {

        requireNonNull(clock, "clock is required and null.");

        this.defaultTtl = isPositive(defaultTtl) ? defaultTtl : null;
        this.store = new EntryStore<>(CapacityPolicy.forMaxSize(maxSize), clock);

        if (!isPositive(cleanupInterval)) {
            this.sweeper = null;
            this.cleanable = null;
            return;
        }

        this.sweeper = new ExpirationSweeper(store, cleanupInterval, executorService);
        this.sweeper.start();
        this.cleanable = CLEANER.register(this, new StopSweep(sweeper));
    }

    public static <K, V> TtlCacheBuilder<K, V> builder() {
        return new TtlCacheBuilder<>();
    }

    /**
     * @param defaultTtl      ttl for {@link #set} and {@link #setAll}, null/zero/negative: never expire
     * @param cleanupInterval delay between the end of one sweep and the start of the next
     *                        (fixed delay, not fixed rate), null/zero/negative: no background sweep
     * @param maxSize         max entry count, zero/negative: unbounded
     * @param <K>             cache key type
     * @param <V>             cache value type
     * @return a new cache, with its sweep already running (when configured)
     */
    public static <K, V> TtlCache<K, V> create(
            @Nullable Duration defaultTtl,
            @Nullable Duration cleanupInterval,
            int maxSize) {

        return TtlCache.<K, V>builder()
                .defaultTtl(defaultTtl)
                .cleanupInterval(cleanupInterval)
                .maxSize(maxSize)
                .build();
    }

    private static boolean isPositive(@Nullable Duration d) {
        return d != null && !d.isZero() && !d.isNegative();
    }

    /**
     * Removes expired entries now, independent of the background sweep
     *
     * @return number of entries removed
     */
    public int cleanExpired() {
        return store.cleanExpired();
    }

    /**
     * Removes all entries
     */
    public void clear() {
        store.reset();
    }

    /**
     * Stops the background sweep (if running) and removes all entries.
     * <p>
     * Idempotent. The cache stays usable afterwards, without a background sweep.
     */
    @Override
    public void close() {
        if (sweeper != null) {
            sweeper.stop();
        }

        if (cleanable != null) {
            cleanable.clean();
        }

        store.reset();
    }

    /**
     * Test if key is present in cache, expired or not
     *
     * @param key - unique id for entry
     * @return true when entry is present, else false
     */
    public boolean containsKey(K key) {
        return store.containsKey(key);
    }

    /**
     * Stale reads are possible: an expired entry is returned until it is swept or removed.
     *
     * @param key - unique id for entry
     * @return value when present, expired or not
     */
    public Optional<V> get(K key) {
        return store.get(key);
    }

    /**
     * Like {@link #get}, but treats an expired entry as absent.
     * The expired entry stays in the cache.
     *
     * @param key - unique id for entry
     * @return value when present and not expired
     */
    public Optional<V> getSafe(K key) {
        return store.getSafe(key);
    }

    /**
     * @param key - unique id for entry
     * @return value when present (expired or not), else null
     */
    @Nullable
    public V getValue(K key) {
        return store.get(key).orElse(null);
    }

    /**
     * checks if cache contains entries
     *
     * @return true when cache has zero entries
     */
    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * @return max entry count, 0 when unbounded
     */
    public int maxSize() {
        return store.policy().maxSize();
    }

    /**
     * Removes entry (when present)
     *
     * @param key - key whose cache entry will be removed
     */
    public void remove(K key) {
        store.remove(key);
    }

    /**
     * insert entry (when absent) or replace entry (when present), using the default ttl
     *
     * @param key   - unique id for entry
     * @param value
     */
    public void set(K key, V value) {
        setWithTtl(key, value, defaultTtl);
    }

    /**
     * Insert or replace every entry in batch, using the default ttl
     *
     * @param batch entries to write
     */
    public void setAll(Map<? extends K, ? extends V> batch) {
        setAllWithTtl(batch, defaultTtl);
    }

    /**
     * Insert or replace every entry in batch.
     * All entries share one deadline, the batch is applied atomically.
     * <p>
     * On a bounded cache, room is made before writing:
     * when size + batch size exceeds maxSize, that many existing entries are evicted
     * (all of them when the overflow reaches the current size).
     * Keys already present are counted as growth.
     *
     * @param batch entries to write
     * @param ttl   time to live, null/zero/negative: never expire
     */
    public void setAllWithTtl(Map<? extends K, ? extends V> batch, @Nullable Duration ttl) {
        store.putAll(batch, store.expiresAt(ttl));
    }

    /**
     * insert entry (when absent) or replace entry (when present).
     * <p>
     * On a full bounded cache, inserting a new key evicts one arbitrary entry first.
     *
     * @param key   - unique id for entry
     * @param value
     * @param ttl   time to live, null/zero/negative: never expire
     */
    public void setWithTtl(K key, V value, @Nullable Duration ttl) {
        store.put(key, value, store.expiresAt(ttl));
    }

    /**
     * Count stored entries, including expired entries not swept yet
     *
     * @return snapshot of the cache entry count
     */
    public int size() {
        return store.size();
    }

    /**
     * Runs on the cleaner thread.
     * Must not reference the cache.
     */
    private static final class StopSweep implements Runnable {

        private final ExpirationSweeper sweeper;

        StopSweep(ExpirationSweeper sweeper) {
            this.sweeper = sweeper;
        }

        @Override
        public void run() {
            if (sweeper.stop()) {
                log.warn("Unreachable TtlCache was never closed, stopped its expiration sweep");
            }
        }
    }

    public static class TtlCacheBuilder<K, V> {

        private @Nullable Duration cleanupInterval;
        private @Nullable Clock clock;
        private @Nullable Duration defaultTtl;
        private @Nullable ScheduledExecutorService executorService;
        private int maxSize;

        TtlCacheBuilder() {
        }

        public TtlCache<K, V> build() {
            return new TtlCache<>(
                    this.defaultTtl,
                    this.cleanupInterval,
                    this.maxSize,
                    requireNonNullElse(this.clock, Clock.systemUTC()),
                    this.executorService);
        }

        public TtlCacheBuilder<K, V> cleanupInterval(@Nullable Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
            return this;
        }

        public TtlCacheBuilder<K, V> clock(@Nullable Clock clock) {
            this.clock = clock;
            return this;
        }

        public TtlCacheBuilder<K, V> defaultTtl(@Nullable Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
            return this;
        }

        /**
         * @param executorService runs the sweep; left running on close.
         *                        When null, the cache owns a daemon thread.
         * @return this
         */
        public TtlCacheBuilder<K, V> executorService(
                @Nullable ScheduledExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        public TtlCacheBuilder<K, V> maxSize(int maxSize) {
            this.maxSize = maxSize;
            return this;
        }
    }
}
