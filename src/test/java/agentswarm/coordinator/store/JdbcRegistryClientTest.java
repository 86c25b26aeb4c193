package agentswarm.coordinator.store;

import agentswarm.support.MutableClock;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the JDBC registry store.
 */
class JdbcRegistryClientTest {

    private MutableClock clock;
    private JdbcRegistryClient registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-01-01T00:00:00Z");
        registry = H2Registries.open("registry", clock);
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void setThenGetReturnsValue() {
        registry.setWithTtl("agent:heartbeat:s1", "{\"a\":1}", Duration.ofSeconds(30));
        assertEquals("{\"a\":1}", registry.get("agent:heartbeat:s1"));
    }

    @Test
    void missingKeyReadsAsNull() {
        assertNull(registry.get("agent:heartbeat:nope"));
    }

    @Test
    void valueExpiresAfterTtl() {
        registry.setWithTtl("k", "v", Duration.ofSeconds(30));

        clock.advance(Duration.ofSeconds(29));
        assertEquals("v", registry.get("k"));

        clock.advance(Duration.ofSeconds(1));
        assertNull(registry.get("k"), "Value at exactly its expiry time should be gone");
    }

    @Test
    void rewriteResetsTtl() {
        registry.setWithTtl("k", "v1", Duration.ofSeconds(30));
        clock.advance(Duration.ofSeconds(20));
        registry.setWithTtl("k", "v2", Duration.ofSeconds(30));
        clock.advance(Duration.ofSeconds(20));

        assertEquals("v2", registry.get("k"));
    }

    @Test
    void setIfAbsentOnlyWritesOnce() {
        assertTrue(registry.setIfAbsentWithTtl("k", "first", Duration.ofSeconds(30)));
        assertFalse(registry.setIfAbsentWithTtl("k", "second", Duration.ofSeconds(30)));
        assertEquals("first", registry.get("k"));
    }

    @Test
    void setIfAbsentReplacesExpiredValue() {
        registry.setWithTtl("k", "old", Duration.ofSeconds(5));
        clock.advance(Duration.ofSeconds(10));

        assertTrue(registry.setIfAbsentWithTtl("k", "new", Duration.ofSeconds(5)));
        assertEquals("new", registry.get("k"));
    }

    @Test
    void concurrentSetIfAbsentHasSingleWinner() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                String value = "v" + i;
                futures.add(pool.submit(() -> {
                    go.await();
                    if (registry.setIfAbsentWithTtl("race", value, Duration.ofSeconds(30))) {
                        winners.incrementAndGet();
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, winners.get());
        assertNotNull(registry.get("race"));
    }

    @Test
    void deleteCountsOnlyLiveKeysAndIgnoresUnknown() {
        registry.setWithTtl("a", "1", Duration.ofSeconds(30));
        registry.setWithTtl("b", "2", Duration.ofSeconds(5));
        clock.advance(Duration.ofSeconds(10));

        assertEquals(1, registry.delete("a", "b", "c"));
        assertNull(registry.get("a"));
        assertEquals(0, registry.delete("a", "b", "c"));
    }

    @Test
    void nonPositiveTtlIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.setWithTtl("k", "v", Duration.ZERO));
    }

    @Test
    void pingReportsHealthyDatabase() {
        assertTrue(registry.ping());
    }
}
