package deskgate.adapter.out.store.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import deskgate.support.MutableClock;

@DisplayName("InMemoryCounterStore")
class InMemoryCounterStoreTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private MutableClock clock;
    private InMemoryCounterStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        store = new InMemoryCounterStore(clock);
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    private long get(String id) {
        return store.get(id).await().atMost(TIMEOUT);
    }

    private long increment(String id, long ttlSeconds) {
        return store.incrementWithExpiry(id, ttlSeconds).await().atMost(TIMEOUT);
    }

    private long decrement(String id) {
        return store.decrement(id).await().atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("Counting")
    class CountingTests {

        @Test
        @DisplayName("should read unknown counters as zero")
        void shouldReadUnknownAsZero() {
            assertEquals(0, get("k"));
        }

        @Test
        @DisplayName("should return the value after each increment")
        void shouldIncrement() {
            assertEquals(1, increment("k", 60));
            assertEquals(2, increment("k", 60));
            assertEquals(2, get("k"));
        }

        @Test
        @DisplayName("should floor decrements at zero")
        void shouldFloorAtZero() {
            increment("k", 60);

            assertEquals(0, decrement("k"));
            assertEquals(0, decrement("k"));
        }

        @Test
        @DisplayName("should not create a counter on decrement")
        void shouldNotCreateOnDecrement() {
            assertEquals(0, decrement("k"));

            assertEquals(0, store.size());
        }

        @Test
        @DisplayName("should lose no increments under contention")
        void shouldCountConcurrently() throws Exception {
            var executor = Executors.newFixedThreadPool(16);
            try {
                var start = new CountDownLatch(1);
                var futures = new ArrayList<Future<Long>>();
                for (int i = 0; i < 500; i++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        return increment("hot", 60);
                    }));
                }
                start.countDown();
                for (var future : futures) {
                    future.get(5, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            assertEquals(500, get("hot"));
        }
    }

    @Nested
    @DisplayName("Expiry")
    class ExpiryTests {

        @Test
        @DisplayName("should read expired counters as zero")
        void shouldExpire() {
            increment("k", 60);

            clock.advance(60_000);

            assertEquals(0, get("k"));
        }

        @Test
        @DisplayName("should restart an expired counter at one")
        void shouldRestartExpiredCounter() {
            increment("k", 1);
            increment("k", 1);

            clock.advance(1_000);

            assertEquals(1, increment("k", 1));
        }

        @Test
        @DisplayName("should drop expired counters on decrement instead of reviving them")
        void shouldNotReviveOnDecrement() {
            increment("k", 1);
            clock.advance(1_500);

            assertEquals(0, decrement("k"));
            assertEquals(0, store.size());
        }

        @Test
        @DisplayName("should sweep only expired counters")
        void shouldSweepExpired() {
            increment("short", 1);
            increment("long", 60);
            clock.advance(2_000);

            store.sweep();

            assertEquals(1, store.size());
            assertEquals(1, get("long"));
        }

        @Test
        @DisplayName("should stay available")
        void shouldBeAvailable() {
            assertTrue(store.health().isAvailable());
            assertEquals("memory", store.name());
        }
    }
}
