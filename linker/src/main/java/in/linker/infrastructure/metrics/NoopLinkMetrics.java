package in.linker.infrastructure.metrics;

import java.time.Duration;

/**
 * LinkMetrics that records nothing.
 */
final class NoopLinkMetrics implements LinkMetrics {

    static final NoopLinkMetrics INSTANCE = new NoopLinkMetrics();

    private NoopLinkMetrics() {}

    @Override public void recordCreate(String outcome, int attempts, Duration latency) {}
    @Override public void recordCollision() {}
    @Override public void recordCacheLookup(String source) {}
    @Override public void recordTombstone(String reason) {}
    @Override public void recordResolve(String outcome) {}
    @Override public void recordDelete(String outcome) {}
    @Override public void recordStoreCall(String operation, boolean success, Duration latency) {}
    @Override public void recordHttpRequest(String handler) {}
    @Override public void updateCacheSize(long size) {}
}
