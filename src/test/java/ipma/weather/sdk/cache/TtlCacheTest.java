package ipma.weather.sdk.cache;

import ipma.weather.sdk.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class TtlCacheTest {

    private MutableClock clock;
    private TtlCache<String> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        cache = new TtlCache<>("test", 60, clock);
    }

    @Test
    void get_freshEntry_returnsValue() {
        cache.set("k", "v");
        assertEquals(Optional.of("v"), cache.get("k"));
    }

    @Test
    void get_missingKey_returnsEmpty() {
        assertTrue(cache.get("nope").isEmpty());
    }

    @Test
    void get_ageEqualToTtl_isStillValid() {
        cache.set("k", "v");
        clock.advance(Duration.ofSeconds(60));
        assertEquals(Optional.of("v"), cache.get("k"));
    }

    @Test
    void get_afterTtl_returnsEmptyAndEvicts() {
        cache.set("k", "v");
        clock.advance(Duration.ofSeconds(61));

        assertTrue(cache.get("k").isEmpty());
        assertEquals(0, cache.size(), "Устаревшая запись должна быть физически удалена");
        assertTrue(cache.get("k").isEmpty());
    }

    @Test
    void set_afterStaleEviction_isRetrievableImmediately() {
        cache.set("k", "old");
        clock.advance(Duration.ofMinutes(5));
        assertTrue(cache.get("k").isEmpty());

        cache.set("k", "new");
        assertEquals(Optional.of("new"), cache.get("k"));
    }

    @Test
    void set_overwrite_resetsTimestamp() {
        cache.set("k", "v1");
        clock.advance(Duration.ofSeconds(50));
        cache.set("k", "v2");
        clock.advance(Duration.ofSeconds(50));

        assertEquals(Optional.of("v2"), cache.get("k"));
    }

    @Test
    void staleEntries_stayUntilRead() {
        cache.set("a", "1");
        cache.set("b", "2");
        clock.advance(Duration.ofSeconds(120));

        assertEquals(2, cache.size());
        cache.get("a");
        assertEquals(1, cache.size());
    }

    @Test
    void clear_onEmptyCache_isNoOp() {
        cache.clear();
        assertEquals(0, cache.size());
    }

    @Test
    void clear_removesAllKeys() {
        cache.set("a", "1");
        cache.set("b", "2");

        cache.clear();

        assertTrue(cache.get("a").isEmpty());
        assertTrue(cache.get("b").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void constructor_negativeTtl_throws() {
        assertThrows(IllegalArgumentException.class, () -> new TtlCache<String>("bad", -1, clock));
    }

    @Test
    void concurrentSetAndGet_keepsWholeEntries() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 1000; i++) {
                        cache.set("k" + (i % 10), "t" + thread);
                        cache.get("k" + (i % 10)).ifPresent(v -> assertTrue(v.startsWith("t")));
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(10, cache.size());
    }
}
