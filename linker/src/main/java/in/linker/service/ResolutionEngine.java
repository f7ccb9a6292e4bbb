package in.linker.service;

import in.linker.domain.common.LinkResult;
import in.linker.domain.link.LinkRecord;
import in.linker.domain.link.LinkStatus;
import in.linker.domain.repository.InsertResult;
import in.linker.domain.repository.LinkRepository;
import in.linker.domain.repository.StoreException;
import in.linker.infrastructure.metrics.LinkMetrics;
import in.linker.security.InputValidator;
import in.linker.service.cache.CacheEntry;
import in.linker.service.cache.CacheLookup;
import in.linker.service.cache.ResolutionCache;
import in.linker.service.code.CodeGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Create / resolve / delete over the code generator, resolution cache and store.
 *
 * Per-code lifecycle: Unknown → Active → Deleted. Unknown is never stored; it
 * is a cache miss. The store is the only serialization point: the primary key
 * orders concurrent creates, the conditional status update orders deletes.
 * No application-level lock spans the three operations.
 *
 * Staleness: a delete writes a DELETED tombstone through to this instance's
 * cache, and cached entries only move forward in the lifecycle, so a
 * population that read the row as ACTIVE just before the delete committed
 * cannot revive it here. Requests already holding the resolved value when the
 * delete lands (at most one store round trip) may still redirect once. Other
 * engine instances converge when their entries expire.
 *
 * Store failures are never retried or masked here; they surface as
 * {@link LinkResult.Outcome#STORE_ERROR}.
 */
public final class ResolutionEngine {
    private static final Logger log = LoggerFactory.getLogger(ResolutionEngine.class);

    private final LinkRepository repository;
    private final ResolutionCache cache;
    private final CodeGenerator codeGenerator;
    private final InputValidator validator;
    private final int maxAttempts;
    private final LinkMetrics metrics;

    public ResolutionEngine(LinkRepository repository,
                            ResolutionCache cache,
                            CodeGenerator codeGenerator,
                            InputValidator validator,
                            int maxAttempts,
                            LinkMetrics metrics) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.repository = repository;
        this.cache = cache;
        this.codeGenerator = codeGenerator;
        this.validator = validator;
        this.maxAttempts = maxAttempts;
        this.metrics = metrics;
    }

    public LinkResult<LinkRecord> create(String destination) {
        return create(destination, false);
    }

    /**
     * Register {@code rawDestination} under a fresh code.
     *
     * Collisions (unique violation on insert) are retried with a new code up
     * to the configured number of attempts, then reported as EXHAUSTED.
     */
    public LinkResult<LinkRecord> create(String rawDestination, boolean hidden) {
        long start = System.nanoTime();

        String destination;
        try {
            destination = validator.validateDestination(rawDestination);
        } catch (IllegalArgumentException e) {
            log.debug("[ENGINE] Rejected destination: {}", e.getMessage());
            metrics.recordCreate(LinkResult.Outcome.VALIDATION_ERROR.name(), 0, since(start));
            return LinkResult.invalid(e.getMessage());
        }

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String code = codeGenerator.generate();

            InsertResult result;
            try {
                result = repository.insert(code, destination, hidden);
            } catch (StoreException e) {
                log.error("[ENGINE] Create failed on attempt {}: {}", attempt, e.getMessage());
                metrics.recordCreate(LinkResult.Outcome.STORE_ERROR.name(), attempt, since(start));
                return LinkResult.storeError(e.getMessage());
            }

            if (result.isInserted()) {
                // Overrides an ABSENT tombstone left by earlier probes of this code
                cache.writeThrough(code, CacheEntry.resolved(destination, hidden));
                metrics.updateCacheSize(cache.estimatedSize());
                metrics.recordCreate("CREATED", attempt, since(start));
                log.info("[ENGINE] Link created: code={}, attempts={}, hidden={}", code, attempt, hidden);
                return LinkResult.ok(result.record());
            }

            metrics.recordCollision();
            log.debug("[ENGINE] Code collision, retrying: attempt={}/{}", attempt, maxAttempts);
        }

        log.warn("[ENGINE] Code space exhausted after {} attempts", maxAttempts);
        metrics.recordCreate(LinkResult.Outcome.EXHAUSTED.name(), maxAttempts, since(start));
        return LinkResult.exhausted(maxAttempts);
    }

    /**
     * Resolve {@code code} to its destination.
     *
     * Never-existed and deleted codes both come back as NOT_FOUND.
     */
    public LinkResult<CacheEntry> resolve(String code) {
        if (!validator.isValidCode(code)) {
            metrics.recordResolve(LinkResult.Outcome.NOT_FOUND.name());
            return LinkResult.notFound();
        }

        CacheLookup lookup;
        try {
            lookup = cache.getOrPopulate(code, this::populate);
        } catch (StoreException e) {
            log.error("[ENGINE] Resolve failed for code={}: {}", code, e.getMessage());
            metrics.recordResolve(LinkResult.Outcome.STORE_ERROR.name());
            return LinkResult.storeError(e.getMessage());
        }

        metrics.recordCacheLookup(lookup.source().name());
        if (!lookup.isHit()) {
            metrics.updateCacheSize(cache.estimatedSize());
        }

        CacheEntry entry = lookup.entry();
        if (entry.isTombstone()) {
            metrics.recordResolve(LinkResult.Outcome.NOT_FOUND.name());
            return LinkResult.notFound();
        }

        metrics.recordResolve(LinkResult.Outcome.OK.name());
        return LinkResult.ok(entry);
    }

    /**
     * Delete {@code code}. Succeeds once; later calls report NOT_FOUND.
     */
    public LinkResult<Void> delete(String code) {
        if (!validator.isValidCode(code)) {
            metrics.recordDelete(LinkResult.Outcome.NOT_FOUND.name());
            return LinkResult.notFound();
        }

        boolean transitioned;
        try {
            transitioned = repository.markDeleted(code);
        } catch (StoreException e) {
            log.error("[ENGINE] Delete failed for code={}: {}", code, e.getMessage());
            metrics.recordDelete(LinkResult.Outcome.STORE_ERROR.name());
            return LinkResult.storeError(e.getMessage());
        }

        if (!transitioned) {
            metrics.recordDelete(LinkResult.Outcome.NOT_FOUND.name());
            return LinkResult.notFound();
        }

        cache.writeThrough(code, CacheEntry.deleted());
        metrics.recordDelete(LinkResult.Outcome.OK.name());
        log.info("[ENGINE] Link deleted: code={}", code);
        return LinkResult.ok(null);
    }

    /**
     * Active code registered for {@code rawDestination}, newest first.
     */
    public LinkResult<String> reverse(String rawDestination) {
        String destination;
        try {
            destination = validator.validateDestination(rawDestination);
        } catch (IllegalArgumentException e) {
            return LinkResult.invalid(e.getMessage());
        }

        try {
            Optional<String> code = repository.findActiveCodeByDestination(destination);
            return code.<LinkResult<String>>map(LinkResult::ok).orElseGet(LinkResult::notFound);
        } catch (StoreException e) {
            log.error("[ENGINE] Reverse lookup failed: {}", e.getMessage());
            return LinkResult.storeError(e.getMessage());
        }
    }

    /**
     * Stored status of {@code code}, for audit. Unlike {@link #resolve}, this
     * tells deleted codes apart from unknown ones.
     */
    public LinkResult<LinkStatus> status(String code) {
        if (!validator.isValidCode(code)) {
            return LinkResult.notFound();
        }
        try {
            Optional<LinkStatus> status = repository.fetchStatus(code);
            return status.<LinkResult<LinkStatus>>map(LinkResult::ok).orElseGet(LinkResult::notFound);
        } catch (StoreException e) {
            log.error("[ENGINE] Status lookup failed for code={}: {}", code, e.getMessage());
            return LinkResult.storeError(e.getMessage());
        }
    }

    /**
     * Stream every stored link to {@code sink}.
     *
     * @return number of links visited
     */
    public LinkResult<Long> export(Consumer<LinkRecord> sink) {
        try {
            return LinkResult.ok(repository.forEach(sink));
        } catch (StoreException e) {
            log.error("[ENGINE] Export failed: {}", e.getMessage());
            return LinkResult.storeError(e.getMessage());
        }
    }

    private CacheEntry populate(String code) throws StoreException {
        Optional<LinkRecord> active = repository.fetchActive(code);
        if (active.isPresent()) {
            return CacheEntry.resolved(active.get().destination(), active.get().hidden());
        }

        Optional<LinkStatus> status = repository.fetchStatus(code);
        if (status.isEmpty()) {
            metrics.recordTombstone(CacheEntry.Kind.ABSENT.name());
            return CacheEntry.absent();
        }
        if (status.get() == LinkStatus.ACTIVE) {
            // Created between the two reads
            Optional<LinkRecord> created = repository.fetchActive(code);
            if (created.isPresent()) {
                return CacheEntry.resolved(created.get().destination(), created.get().hidden());
            }
        }

        metrics.recordTombstone(CacheEntry.Kind.DELETED.name());
        return CacheEntry.deleted();
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
