package io.github.wcarmon.ttlcache;

import static java.util.Objects.requireNonNull;

/**
 * An Item in the cache
 *
 * @param value          value of the cache entry
 * @param expiresAtNanos epoch nanos after which the entry is stale, 0 when it never expires
 * @param <V>            value type
 */
record CacheEntry<V>(V value, long expiresAtNanos) {

    static final long NEVER_EXPIRES = 0L;

    CacheEntry {
        requireNonNull(value, "value is required and null.");
    }

    /**
     * @param nowNanos epoch nanos, sampled by the caller
     * @return true when the entry has a deadline and nowNanos is past it
     */
    boolean isExpired(long nowNanos) {
        if (expiresAtNanos == NEVER_EXPIRES) {
            return false;
        }

        return nowNanos > expiresAtNanos;
    }
}
