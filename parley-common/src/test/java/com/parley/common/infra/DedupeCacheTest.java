package com.parley.common.infra;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DedupeCacheTest {

    @Nested
    class BasicBehavior {
        @Test
        void firstCheck_registersKey() {
            var cache = new DedupeCache("messages", 100);
            assertTrue(cache.checkAndRegister("1:10"));
            assertTrue(cache.contains("1:10"));
        }

        @Test
        void secondCheck_reportsAlreadyPresent() {
            var cache = new DedupeCache("messages", 100);
            assertTrue(cache.checkAndRegister("1:10"));
            assertFalse(cache.checkAndRegister("1:10"));
            assertEquals(1, cache.size());
        }

        @Test
        void emptyKey_isRejected() {
            var cache = new DedupeCache("messages", 100);
            assertThrows(IllegalArgumentException.class, () -> cache.checkAndRegister(""));
            assertThrows(IllegalArgumentException.class, () -> cache.checkAndRegister(null));
        }
    }

    @Nested
    class BoundedMemory {
        @Test
        void overflow_evictsOldestHalfInOneBatch() {
            int maxSize = 1000;
            var cache = new DedupeCache("messages", maxSize);
            for (int i = 0; i <= maxSize; i++) {
                assertTrue(cache.checkAndRegister("k" + i));
            }
            assertTrue(cache.size() <= maxSize);
            assertEquals(maxSize + 1 - maxSize / 2, cache.size());
            assertEquals(maxSize / 2, cache.evictedCount());
            // newest half survives, oldest half is gone
            for (int i = maxSize / 2; i <= maxSize; i++) {
                assertTrue(cache.contains("k" + i), "expected k" + i);
            }
            assertFalse(cache.contains("k0"));
            assertFalse(cache.contains("k" + (maxSize / 2 - 1)));
        }

        @Test
        void evictedKey_isAdmittedAgain() {
            var cache = new DedupeCache("commands", 4);
            for (int i = 0; i < 5; i++) {
                cache.checkAndRegister("k" + i);
            }
            assertTrue(cache.checkAndRegister("k0"));
        }

        @Test
        void sizeNeverExceedsBoundAcrossManyInserts() {
            var cache = new DedupeCache("commands", 500);
            for (int i = 0; i < 10_000; i++) {
                cache.checkAndRegister("k" + i);
                assertTrue(cache.size() <= 500);
            }
        }
    }

    @Nested
    class Concurrency {
        @Test
        void concurrentRegistrationOfSameKey_admitsExactlyOne() throws Exception {
            var cache = new DedupeCache("messages", 1000);
            int threads = 32;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> results = new ArrayList<>();
            try {
                for (int i = 0; i < threads; i++) {
                    results.add(pool.submit(() -> {
                        start.await();
                        return cache.checkAndRegister("E1:chan");
                    }));
                }
                start.countDown();
                int admitted = 0;
                for (Future<Boolean> f : results) {
                    if (f.get(5, TimeUnit.SECONDS)) {
                        admitted++;
                    }
                }
                assertEquals(1, admitted);
            } finally {
                pool.shutdownNow();
            }
        }
    }
}
