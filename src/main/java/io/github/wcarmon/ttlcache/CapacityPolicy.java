package io.github.wcarmon.ttlcache;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write-path strategy of an {@link EntryStore}.
 * <p>
 * Decides how a fresh store map is allocated and which existing entries
 * (if any) are dropped before a write so the store stays within its bound.
 * <p>
 * Called with the store's write lock held.
 */
interface CapacityPolicy {

    /** Upper bound for the initial capacity passed to {@link HashMap} */
    int MAX_CAPACITY_HINT = 1 << 16;

    static CapacityPolicy bounded(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive for a bounded policy");
        }

        return new Bounded(maxSize);
    }

    /**
     * @param maxSize max entry count, zero or negative means no bound
     * @return policy matching maxSize
     */
    static CapacityPolicy forMaxSize(int maxSize) {
        return maxSize > 0 ? bounded(maxSize) : unbounded();
    }

    static CapacityPolicy unbounded() {
        return Unbounded.INSTANCE;
    }

    /**
     * Make room for a single write.
     *
     * @param store the live store
     * @param key   key about to be written
     * @param <K>   key type
     */
    <K> void beforeInsert(Map<K, ?> store, K key);

    /**
     * Make room for a batch write.
     *
     * @param store     the live store
     * @param batchSize number of entries about to be written
     * @param <K>       key type
     * @param <E>       entry type
     * @return the store to write the batch into, either the given store or a replacement
     */
    <K, E> Map<K, E> beforeInsertAll(Map<K, E> store, int batchSize);

    /**
     * @return max entry count, 0 when unbounded
     */
    int maxSize();

    /**
     * @param <K> key type
     * @param <E> entry type
     * @return an empty store, presized for this policy
     */
    <K, E> Map<K, E> newStore();

    enum Unbounded implements CapacityPolicy {
        INSTANCE;

        @Override
        public <K> void beforeInsert(Map<K, ?> store, K key) {
        }

        @Override
        public <K, E> Map<K, E> beforeInsertAll(Map<K, E> store, int batchSize) {
            return store;
        }

        @Override
        public int maxSize() {
            return 0;
        }

        @Override
        public <K, E> Map<K, E> newStore() {
            return new HashMap<>();
        }
    }

    /**
     * Evicts arbitrary entries (whatever the map's iterator yields first).
     * Not LRU, not FIFO.
     */
    final class Bounded implements CapacityPolicy {

        private static final Logger log = LoggerFactory.getLogger(Bounded.class);

        private final int maxSize;

        private Bounded(int maxSize) {
            this.maxSize = maxSize;
        }

        private static void evict(Map<?, ?> store, int count) {
            final Iterator<?> it = store.keySet().iterator();

            int evicted = 0;
            while (evicted < count && it.hasNext()) {
                final Object victim = it.next();
                it.remove();
                evicted++;

                log.trace("Evicted key to stay within bound: {}", victim);
            }
        }

        @Override
        public <K> void beforeInsert(Map<K, ?> store, K key) {
            if (store.size() + 1 <= maxSize) {
                return;
            }

            // -- replacing an existing key does not grow the store
            if (store.containsKey(key)) {
                return;
            }

            evict(store, 1);
        }

        /**
         * Keys of the batch that are already present are not subtracted,
         * so an overlapping batch may evict more than strictly needed.
         * A batch larger than maxSize is written whole.
         */
        @Override
        public <K, E> Map<K, E> beforeInsertAll(Map<K, E> store, int batchSize) {
            final int newSize = store.size() + batchSize;
            if (newSize <= maxSize) {
                return store;
            }

            final int overflow = newSize - maxSize;
            if (store.size() <= overflow) {
                log.trace("Batch of {} displaces all {} entries", batchSize, store.size());
                return new HashMap<>(Math.min(batchSize, MAX_CAPACITY_HINT));
            }

            evict(store, overflow);
            return store;
        }

        @Override
        public int maxSize() {
            return maxSize;
        }

        @Override
        public <K, E> Map<K, E> newStore() {
            return new HashMap<>(Math.min(maxSize, MAX_CAPACITY_HINT));
        }

        @Override
        public String toString() {
            return "Bounded{maxSize=" + maxSize + '}';
        }
    }
}
