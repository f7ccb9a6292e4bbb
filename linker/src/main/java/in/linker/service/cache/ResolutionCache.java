package in.linker.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import in.linker.domain.repository.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounded code → {@link CacheEntry} cache with single-flight population.
 *
 * Features:
 * - Size bound plus idle and absolute expiry (Caffeine)
 * - At most one store population per code in flight; concurrent callers
 *   wait on the same future and receive the same value or the same error
 * - Populations that exceed the store timeout fail every waiter and release
 *   the in-flight slot
 * - Failed populations are never cached
 * - Writes merge with {@link CacheEntry#newer}, so a deleted code stays a
 *   tombstone no matter how late a concurrent read lands
 *
 * Usage:
 * <pre>
 * ResolutionCache cache = new ResolutionCache(1000, Duration.ofHours(1),
 *     Duration.ofMinutes(10), Duration.ofSeconds(2), storeExecutor);
 *
 * CacheLookup lookup = cache.getOrPopulate(code, c -> loadFromStore(c));
 * cache.writeThrough(code, CacheEntry.deleted());
 * </pre>
 */
public final class ResolutionCache {
    private static final Logger log = LoggerFactory.getLogger(ResolutionCache.class);

    private final Cache<String, CacheEntry> entries;
    private final ConcurrentHashMap<String, CompletableFuture<CacheEntry>> inFlight = new ConcurrentHashMap<>();
    private final Executor populateExecutor;
    private final Duration populateTimeout;

    public ResolutionCache(long capacity, Duration ttl, Duration idleTimeout,
                           Duration populateTimeout, Executor populateExecutor) {
        this(capacity, ttl, idleTimeout, populateTimeout, populateExecutor, Ticker.systemTicker());
    }

    public ResolutionCache(long capacity, Duration ttl, Duration idleTimeout,
                           Duration populateTimeout, Executor populateExecutor, Ticker ticker) {
        this.entries = Caffeine.newBuilder()
            .maximumSize(capacity)
            .expireAfterWrite(ttl)
            .expireAfterAccess(idleTimeout)
            .ticker(ticker)
            .build();
        this.populateExecutor = populateExecutor;
        this.populateTimeout = populateTimeout;
    }

    /**
     * Cached entry for {@code code}, or the result of a single-flight
     * population through {@code populator}.
     *
     * @throws StoreException if the population failed or timed out; every
     *         caller waiting on that population sees the same failure
     */
    public CacheLookup getOrPopulate(String code, CachePopulator populator) throws StoreException {
        CacheEntry cached = entries.getIfPresent(code);
        if (cached != null) {
            return new CacheLookup(cached, CacheLookup.Source.HIT);
        }

        CompletableFuture<CacheEntry> created = new CompletableFuture<>();
        CompletableFuture<CacheEntry> flight = inFlight.putIfAbsent(code, created);
        CacheLookup.Source source;
        if (flight == null) {
            flight = created;
            source = CacheLookup.Source.MISS;
            startPopulation(code, populator, created);
        } else {
            source = CacheLookup.Source.JOINED;
            log.debug("[CACHE] Joined in-flight population: code={}", code);
        }

        return new CacheLookup(await(code, flight), source);
    }

    /**
     * Store {@code entry} immediately, merged with any cached entry so the
     * code never moves backwards in its lifecycle.
     *
     * @return the entry now cached
     */
    public CacheEntry writeThrough(String code, CacheEntry entry) {
        return entries.asMap().merge(code, entry, CacheEntry::newer);
    }

    public CacheEntry peek(String code) {
        return entries.getIfPresent(code);
    }

    public long estimatedSize() {
        return entries.estimatedSize();
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private void startPopulation(String code, CachePopulator populator, CompletableFuture<CacheEntry> flight) {
        // Slot is released on every exit path: value, error or timeout
        flight.orTimeout(populateTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .whenComplete((entry, error) -> inFlight.remove(code, flight));

        // A previous population may have finished between our miss and putIfAbsent
        CacheEntry raced = entries.getIfPresent(code);
        if (raced != null) {
            flight.complete(raced);
            return;
        }

        try {
            populateExecutor.execute(() -> runPopulation(code, populator, flight));
        } catch (RejectedExecutionException e) {
            log.error("[CACHE] Population rejected for code={}: {}", code, e.getMessage());
            flight.completeExceptionally(new StoreException("populate", "Store executor rejected population", e));
        }
    }

    private void runPopulation(String code, CachePopulator populator, CompletableFuture<CacheEntry> flight) {
        if (flight.isDone()) {
            // timed out while queued
            return;
        }
        try {
            CacheEntry loaded = populator.load(code);
            if (loaded == null) {
                throw new IllegalStateException("populator returned null for " + code);
            }
            if (flight.isDone()) {
                log.debug("[CACHE] Discarding late population result: code={}", code);
                return;
            }
            flight.complete(writeThrough(code, loaded));
        } catch (StoreException e) {
            flight.completeExceptionally(e);
        } catch (RuntimeException e) {
            log.error("[CACHE] Population failed for code={}: {}", code, e.getMessage(), e);
            flight.completeExceptionally(new StoreException("populate", "Population failed: " + e.getMessage(), e));
        }
    }

    private CacheEntry await(String code, CompletableFuture<CacheEntry> flight) throws StoreException {
        try {
            return flight.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("populate", "Interrupted waiting for code " + code, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StoreException storeException) {
                throw storeException;
            }
            if (cause instanceof TimeoutException) {
                log.warn("[CACHE] Population timed out after {}ms: code={}", populateTimeout.toMillis(), code);
                throw new StoreException("populate",
                    "Population timed out after " + populateTimeout.toMillis() + "ms", cause);
            }
            throw new StoreException("populate", "Population failed", cause);
        }
    }
}
