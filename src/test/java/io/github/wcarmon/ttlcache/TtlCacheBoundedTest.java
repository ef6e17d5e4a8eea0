package io.github.wcarmon.ttlcache;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@Timeout(value = 10L, unit = SECONDS)
class TtlCacheBoundedTest {

    TtlCache<String, Integer> subject;

    private static Map<String, Integer> batch(String prefix, int count) {
        final Map<String, Integer> out = new LinkedHashMap<>();
        for (int i = 0; i < count; i++) {
            out.put(prefix + i, i);
        }

        return out;
    }

    @AfterEach
    void tearDown() {
        if (subject != null) {
            subject.close();
        }
    }

    @Test
    void testClear_keepsBound() {
        // -- Arrange
        subject = TtlCache.create(null, null, 2);
        subject.set("a", 1);
        subject.set("b", 2);

        // -- Act
        subject.clear();
        subject.set("c", 3);
        subject.set("d", 4);
        subject.set("e", 5);

        // -- Assert
        assertEquals(2, subject.size());
        assertEquals(2, subject.maxSize());
    }

    @Test
    void testSet_maxSizeOne() {
        // -- Arrange
        subject = TtlCache.create(null, null, 1);

        // -- Act
        subject.set("a", 1);
        subject.set("b", 2);
        subject.set("c", 3);

        // -- Assert
        assertEquals(1, subject.size());

        final long survivors = Set.of("a", "b", "c")
                .stream()
                .filter(subject::containsKey)
                .count();
        assertEquals(1L, survivors);
    }

    @Test
    void testSet_replacingExistingKeyDoesNotEvict() {
        // -- Arrange
        subject = TtlCache.create(null, null, 2);
        subject.set("a", 1);
        subject.set("b", 2);
        assumeTrue(2 == subject.size());

        // -- Act
        subject.set("a", 10);

        // -- Assert
        assertEquals(2, subject.size());
        assertEquals(10, subject.getValue("a"));
        assertEquals(2, subject.getValue("b"));
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 7, 100})
    void testSet_sizeNeverExceedsMaxSize(int maxSize) {
        // -- Arrange
        subject = TtlCache.create(null, null, maxSize);

        // -- Act & Assert
        for (int i = 0; i < 1_000; i++) {
            subject.set("k" + ThreadLocalRandom.current().nextInt(500), i);
            assertTrue(subject.size() <= maxSize);
        }
    }

    @Test
    void testSetAll_batchLargerThanMaxSizeIsWrittenWhole() {
        // -- Arrange
        subject = TtlCache.create(null, null, 1);
        subject.set("a", 1);

        // -- Act
        subject.setAll(Map.of("d", 4, "e", 5, "f", 6));

        // -- Assert
        assertEquals(3, subject.size());
        assertTrue(subject.containsKey("d"));
        assertTrue(subject.containsKey("e"));
        assertTrue(subject.containsKey("f"));
    }

    @Test
    void testSetAll_evictsOverflow() {
        // -- Arrange
        subject = TtlCache.create(null, null, 10);
        subject.setAll(batch("old", 8));
        assumeTrue(8 == subject.size());

        // -- Act
        subject.setAll(batch("new", 4));

        // -- Assert: two old entries evicted to make room
        assertEquals(10, subject.size());
        batch("new", 4).keySet().forEach(k -> assertTrue(subject.containsKey(k)));

        final long oldLeft = batch("old", 8).keySet()
                .stream()
                .filter(subject::containsKey)
                .count();
        assertEquals(6L, oldLeft);
    }

    @Test
    void testSetAll_overflowAtLeastCurrentSizeDropsEverything() {
        // -- Arrange
        subject = TtlCache.create(null, null, 5);
        subject.setAll(batch("old", 2));

        // -- Act: overflow is 2 + 5 - 5 = 2, equal to the current size
        subject.setAll(batch("new", 5));

        // -- Assert
        assertEquals(5, subject.size());
        assertTrue(batch("old", 2).keySet().stream().noneMatch(subject::containsKey));
    }

    @Test
    void testSetAll_overlappingKeysCountAsGrowth() {
        // -- Arrange: small Integer keys iterate in ascending order, so victims are 0 and 1
        try (TtlCache<Integer, String> cache = TtlCache.create(null, null, 4)) {
            cache.setAll(Map.of(0, "a", 1, "b", 2, "c", 3, "d"));
            assumeTrue(4 == cache.size());

            // -- Act: rewrite two keys that are already present
            cache.setAll(Map.of(2, "cc", 3, "dd"));

            // -- Assert: two entries evicted although the batch only replaces
            assertEquals(2, cache.size());
            assertFalse(cache.containsKey(0));
            assertFalse(cache.containsKey(1));
            assertEquals("cc", cache.getValue(2));
            assertEquals("dd", cache.getValue(3));
        }
    }

    @Test
    void testSetAll_withinBoundDoesNotEvict() {
        // -- Arrange
        subject = TtlCache.create(null, null, 10);
        subject.setAll(batch("a", 3));

        // -- Act
        subject.setAll(batch("b", 7));

        // -- Assert
        assertEquals(10, subject.size());
        batch("a", 3).keySet().forEach(k -> assertTrue(subject.containsKey(k)));
    }
}
