package in.linker.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Prometheus implementation of LinkMetrics interface.
 *
 * Metrics are exposed at /metrics endpoint.
 *
 * Key Metrics:
 * - linker_http_requests_total{handler} - Routed HTTP requests
 * - linker_creates_total{outcome} - Create outcomes
 * - linker_create_attempts - Insert attempts per create
 * - linker_create_latency_seconds - Engine time per create
 * - linker_code_collisions_total - Collisions that forced a retry
 * - linker_cache_lookups_total{source} - HIT / MISS / JOINED
 * - linker_cache_tombstones_total{reason} - ABSENT / DELETED tombstones populated
 * - linker_cache_entries - Current cache size
 * - linker_resolves_total{outcome}, linker_deletes_total{outcome}
 * - linker_store_latency_seconds{operation} - Store call latency
 * - linker_store_errors_total{operation} - Failed store calls
 *
 * Codes are never used as label values (unbounded cardinality).
 */
public class PrometheusLinkMetrics implements LinkMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusLinkMetrics.class);

    private final CollectorRegistry registry;

    private final Counter httpRequests;

    // Create metrics
    private final Counter creates;
    private final Histogram createAttempts;
    private final Histogram createLatency;
    private final Counter collisions;

    // Cache metrics
    private final Counter cacheLookups;
    private final Counter tombstones;
    private final Gauge cacheEntries;

    // Outcome metrics
    private final Counter resolves;
    private final Counter deletes;

    // Store metrics
    private final Histogram storeLatency;
    private final Counter storeErrors;

    public PrometheusLinkMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusLinkMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.httpRequests = Counter.build()
            .name("linker_http_requests_total")
            .help("Number of handled HTTP requests")
            .labelNames("handler")
            .register(registry);

        this.creates = Counter.build()
            .name("linker_creates_total")
            .help("Link creations by outcome")
            .labelNames("outcome")
            .register(registry);

        this.createAttempts = Histogram.build()
            .name("linker_create_attempts")
            .help("Insert attempts per create")
            .buckets(1, 2, 3, 5, 10)
            .register(registry);

        this.createLatency = Histogram.build()
            .name("linker_create_latency_seconds")
            .help("Create latency in seconds")
            .buckets(0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 2.0)
            .register(registry);

        this.collisions = Counter.build()
            .name("linker_code_collisions_total")
            .help("Generated codes rejected by the unique constraint")
            .register(registry);

        this.cacheLookups = Counter.build()
            .name("linker_cache_lookups_total")
            .help("Resolution cache lookups by source")
            .labelNames("source")
            .register(registry);

        this.tombstones = Counter.build()
            .name("linker_cache_tombstones_total")
            .help("Tombstones populated from the store")
            .labelNames("reason")
            .register(registry);

        this.cacheEntries = Gauge.build()
            .name("linker_cache_entries")
            .help("Approximate number of cached entries")
            .register(registry);

        this.resolves = Counter.build()
            .name("linker_resolves_total")
            .help("Resolutions by outcome")
            .labelNames("outcome")
            .register(registry);

        this.deletes = Counter.build()
            .name("linker_deletes_total")
            .help("Deletions by outcome")
            .labelNames("outcome")
            .register(registry);

        this.storeLatency = Histogram.build()
            .name("linker_store_latency_seconds")
            .help("Store call latency in seconds")
            .labelNames("operation")
            .buckets(0.0005, 0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 2.0)
            .register(registry);

        this.storeErrors = Counter.build()
            .name("linker_store_errors_total")
            .help("Failed store calls")
            .labelNames("operation")
            .register(registry);

        log.info("[PrometheusLinkMetrics] Initialized");
    }

    @Override
    public void recordCreate(String outcome, int attempts, Duration latency) {
        creates.labels(outcome).inc();
        if (attempts > 0) {
            createAttempts.observe(attempts);
        }
        createLatency.observe(latency.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordCollision() {
        collisions.inc();
    }

    @Override
    public void recordCacheLookup(String source) {
        cacheLookups.labels(source).inc();
    }

    @Override
    public void recordTombstone(String reason) {
        tombstones.labels(reason).inc();
    }

    @Override
    public void recordResolve(String outcome) {
        resolves.labels(outcome).inc();
    }

    @Override
    public void recordDelete(String outcome) {
        deletes.labels(outcome).inc();
    }

    @Override
    public void recordStoreCall(String operation, boolean success, Duration latency) {
        storeLatency.labels(operation).observe(latency.toNanos() / 1_000_000_000.0);
        if (!success) {
            storeErrors.labels(operation).inc();
        }
    }

    @Override
    public void recordHttpRequest(String handler) {
        httpRequests.labels(handler).inc();
    }

    @Override
    public void updateCacheSize(long size) {
        cacheEntries.set(size);
    }

    @Override
    public Map<String, Object> snapshot() {
        double hits = cacheLookups.labels("HIT").get();
        double misses = cacheLookups.labels("MISS").get();
        double joined = cacheLookups.labels("JOINED").get();
        double total = hits + misses + joined;

        Map<String, Object> map = new HashMap<>();
        map.put("cacheEntries", (long) cacheEntries.get());
        map.put("cacheHits", (long) hits);
        map.put("cacheMisses", (long) misses);
        map.put("cacheJoined", (long) joined);
        map.put("cacheHitRatio", total > 0 ? hits / total : 0.0);
        map.put("collisions", (long) collisions.get());
        return map;
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
