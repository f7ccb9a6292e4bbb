package in.linker.infrastructure.metrics;

import java.time.Duration;
import java.util.Map;

/**
 * Link service metrics for monitoring and alerting.
 *
 * Fire-and-forget: implementations must never throw into the caller.
 *
 * Key metrics:
 * - Create outcomes, attempts per create, code collisions
 * - Cache hits, misses and joined populations
 * - Resolve and delete outcomes
 * - Store call latency and errors per operation
 */
public interface LinkMetrics {

    /**
     * Record a finished create.
     *
     * @param outcome CREATED, VALIDATION_ERROR, EXHAUSTED or STORE_ERROR
     * @param attempts Insert attempts made (0 when validation failed)
     * @param latency Time spent in the engine
     */
    void recordCreate(String outcome, int attempts, Duration latency);

    /**
     * Record a code collision that forced a retry.
     */
    void recordCollision();

    /**
     * Record a cache lookup.
     *
     * @param source HIT, MISS or JOINED
     */
    void recordCacheLookup(String source);

    /**
     * Record a tombstone produced by a population.
     *
     * @param reason ABSENT or DELETED
     */
    void recordTombstone(String reason);

    void recordResolve(String outcome);

    void recordDelete(String outcome);

    /**
     * Record one store call.
     *
     * @param operation insert, fetch_active, fetch_status, mark_deleted, reverse, list
     * @param success false if the call threw
     * @param latency Call duration
     */
    void recordStoreCall(String operation, boolean success, Duration latency);

    /**
     * Record an HTTP request routed to {@code handler}.
     */
    void recordHttpRequest(String handler);

    /**
     * Update the current number of cached entries.
     */
    void updateCacheSize(long size);

    /**
     * Point-in-time cache and collision summary for the health endpoint.
     */
    default Map<String, Object> snapshot() {
        return Map.of();
    }

    /**
     * Metrics that discard everything.
     */
    static LinkMetrics noop() {
        return NoopLinkMetrics.INSTANCE;
    }
}
