package in.linker.service.cache;

import com.github.benmanes.caffeine.cache.Ticker;
import in.linker.domain.repository.StoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ResolutionCache.
 *
 * Tests:
 * - Hits after the first population
 * - Single-flight population under concurrent misses
 * - Error propagation to every waiter, errors never cached
 * - Population timeout releases the in-flight slot
 * - Lifecycle ordering of concurrent writes
 * - Idle and absolute expiry
 */
@DisplayName("Resolution Cache Tests")
class ResolutionCacheTest {

    private ExecutorService storeExecutor;
    private ExecutorService callers;

    @BeforeEach
    void setUp() {
        storeExecutor = Executors.newFixedThreadPool(4);
        callers = Executors.newFixedThreadPool(16);
    }

    @AfterEach
    void tearDown() {
        storeExecutor.shutdownNow();
        callers.shutdownNow();
    }

    private ResolutionCache newCache(Duration timeout) {
        return new ResolutionCache(100, Duration.ofHours(1), Duration.ofMinutes(10), timeout, storeExecutor);
    }

    @Test
    void testSecondLookupIsHit() throws Exception {
        ResolutionCache cache = newCache(Duration.ofSeconds(2));
        AtomicInteger loads = new AtomicInteger();
        CachePopulator populator = code -> {
            loads.incrementAndGet();
            return CacheEntry.resolved("https://example.com/" + code, false);
        };

        CacheLookup first = cache.getOrPopulate("abc", populator);
        CacheLookup second = cache.getOrPopulate("abc", populator);

        assertEquals(CacheLookup.Source.MISS, first.source());
        assertEquals(CacheLookup.Source.HIT, second.source());
        assertEquals("https://example.com/abc", second.entry().destination());
        assertEquals(1, loads.get());
        assertEquals(0, cache.inFlightCount());
    }

    @Test
    void testConcurrentMissesShareOnePopulation() throws Exception {
        ResolutionCache cache = newCache(Duration.ofSeconds(5));
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch loading = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CachePopulator populator = code -> {
            loads.incrementAndGet();
            loading.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return CacheEntry.resolved("https://example.com/shared", false);
        };

        int callerCount = 10;
        List<Future<CacheLookup>> results = new ArrayList<>();
        for (int i = 0; i < callerCount; i++) {
            results.add(callers.submit(() -> cache.getOrPopulate("shared", populator)));
        }

        assertTrue(loading.await(5, TimeUnit.SECONDS), "Population should start");
        Thread.sleep(100);
        release.countDown();

        for (Future<CacheLookup> result : results) {
            assertEquals("https://example.com/shared", result.get(5, TimeUnit.SECONDS).entry().destination());
        }
        assertEquals(1, loads.get(), "Exactly one store load for concurrent misses");
        assertEquals(0, cache.inFlightCount());
    }

    @Test
    void testPopulationErrorReachesEveryWaiterAndIsNotCached() throws Exception {
        ResolutionCache cache = newCache(Duration.ofSeconds(5));
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch loading = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CachePopulator failing = code -> {
            loads.incrementAndGet();
            loading.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new StoreException("fetch_active", "connection refused");
        };

        List<Future<CacheLookup>> results = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            results.add(callers.submit(() -> cache.getOrPopulate("broken", failing)));
        }
        assertTrue(loading.await(5, TimeUnit.SECONDS));
        Thread.sleep(100);
        release.countDown();

        for (Future<CacheLookup> result : results) {
            ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
            assertInstanceOf(StoreException.class, e.getCause());
            assertTrue(e.getCause().getMessage().contains("connection refused"));
        }
        assertEquals(1, loads.get());
        assertNull(cache.peek("broken"), "Failures must not be cached");

        CacheLookup retry = cache.getOrPopulate("broken", code -> CacheEntry.resolved("https://example.com/ok", false));
        assertEquals(CacheLookup.Source.MISS, retry.source());
        assertEquals("https://example.com/ok", retry.entry().destination());
    }

    @Test
    void testRuntimeFailureIsWrappedAsStoreException() {
        ResolutionCache cache = newCache(Duration.ofSeconds(2));

        StoreException e = assertThrows(StoreException.class,
            () -> cache.getOrPopulate("boom", code -> { throw new IllegalArgumentException("bad row"); }));
        assertTrue(e.getMessage().contains("bad row"));
        assertNull(cache.peek("boom"));
    }

    @Test
    void testTimeoutReleasesSlotAndDiscardsLateResult() throws Exception {
        ResolutionCache cache = newCache(Duration.ofMillis(100));
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);
        CachePopulator slow = code -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            finished.countDown();
            return CacheEntry.resolved("https://example.com/late", false);
        };

        StoreException e = assertThrows(StoreException.class, () -> cache.getOrPopulate("slow", slow));
        assertTrue(e.getMessage().contains("timed out"), e.getMessage());

        waitUntil(() -> cache.inFlightCount() == 0);
        assertEquals(0, cache.inFlightCount());

        release.countDown();
        assertTrue(finished.await(5, TimeUnit.SECONDS));
        Thread.sleep(50);
        assertNull(cache.peek("slow"), "Result arriving after the timeout must be discarded");
    }

    @Test
    @DisplayName("Timed-out population fails every waiter and frees the slot")
    void testTimeoutFailsAllWaiters() throws Exception {
        ResolutionCache cache = newCache(Duration.ofMillis(200));
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch loading = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CachePopulator stuck = code -> {
            loads.incrementAndGet();
            loading.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return CacheEntry.resolved("https://example.com/late", false);
        };

        int waiterCount = 5;
        List<Future<CacheLookup>> results = new ArrayList<>();
        for (int i = 0; i < waiterCount; i++) {
            results.add(callers.submit(() -> cache.getOrPopulate("stuck", stuck)));
        }
        assertTrue(loading.await(5, TimeUnit.SECONDS));

        try {
            for (Future<CacheLookup> result : results) {
                ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
                assertInstanceOf(StoreException.class, e.getCause());
                assertTrue(e.getCause().getMessage().contains("timed out"), e.getCause().getMessage());
            }
        } finally {
            release.countDown();
        }

        assertEquals(1, loads.get(), "Waiters share the one population");
        waitUntil(() -> cache.inFlightCount() == 0);
        assertEquals(0, cache.inFlightCount());
        assertNull(cache.peek("stuck"));
    }

    @Test
    void testDeleteDuringPopulationWins() throws Exception {
        ResolutionCache cache = newCache(Duration.ofSeconds(5));
        CountDownLatch loading = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CachePopulator staleRead = code -> {
            loading.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return CacheEntry.resolved("https://example.com/stale", false);
        };

        Future<CacheLookup> reader = callers.submit(() -> cache.getOrPopulate("gone", staleRead));
        assertTrue(loading.await(5, TimeUnit.SECONDS));

        cache.writeThrough("gone", CacheEntry.deleted());
        release.countDown();

        assertEquals(CacheEntry.Kind.DELETED, reader.get(5, TimeUnit.SECONDS).entry().kind());
        assertEquals(CacheEntry.Kind.DELETED, cache.peek("gone").kind());
    }

    @Test
    void testWriteThroughFollowsLifecycle() {
        ResolutionCache cache = newCache(Duration.ofSeconds(1));

        cache.writeThrough("c", CacheEntry.absent());
        assertEquals(CacheEntry.Kind.ABSENT, cache.peek("c").kind());

        cache.writeThrough("c", CacheEntry.resolved("https://example.com/new", true));
        assertEquals(CacheEntry.Kind.RESOLVED, cache.peek("c").kind());
        assertTrue(cache.peek("c").hidden());

        cache.writeThrough("c", CacheEntry.absent());
        assertEquals(CacheEntry.Kind.RESOLVED, cache.peek("c").kind(), "Late absent read cannot hide a link");

        cache.writeThrough("c", CacheEntry.deleted());
        cache.writeThrough("c", CacheEntry.resolved("https://example.com/revived", false));
        assertEquals(CacheEntry.Kind.DELETED, cache.peek("c").kind(), "Deleted is terminal");
    }

    @Test
    void testEntriesExpireWhenIdle() throws Exception {
        AtomicLong nanos = new AtomicLong();
        Ticker ticker = nanos::get;
        ResolutionCache cache = new ResolutionCache(100, Duration.ofHours(1), Duration.ofMinutes(10),
            Duration.ofSeconds(2), storeExecutor, ticker);
        AtomicInteger loads = new AtomicInteger();
        CachePopulator populator = code -> {
            loads.incrementAndGet();
            return CacheEntry.absent();
        };

        cache.getOrPopulate("idle", populator);
        nanos.addAndGet(Duration.ofMinutes(5).toNanos());
        assertTrue(cache.getOrPopulate("idle", populator).isHit());

        nanos.addAndGet(Duration.ofMinutes(11).toNanos());
        assertEquals(CacheLookup.Source.MISS, cache.getOrPopulate("idle", populator).source());
        assertEquals(2, loads.get());
    }

    @Test
    void testEntriesExpireAfterTtlEvenWhenBusy() throws Exception {
        AtomicLong nanos = new AtomicLong();
        ResolutionCache cache = new ResolutionCache(100, Duration.ofMinutes(28), Duration.ofMinutes(10),
            Duration.ofSeconds(2), storeExecutor, nanos::get);
        AtomicInteger loads = new AtomicInteger();
        CachePopulator populator = code -> {
            loads.incrementAndGet();
            return CacheEntry.resolved("https://example.com/ttl", false);
        };

        cache.getOrPopulate("busy", populator);
        for (int i = 0; i < 6; i++) {
            nanos.addAndGet(Duration.ofMinutes(5).toNanos());
            cache.getOrPopulate("busy", populator);
        }
        // past 28 minutes: absolute expiry forced exactly one reload
        assertEquals(2, loads.get());
    }

    private static void waitUntil(java.util.function.BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
    }
}
