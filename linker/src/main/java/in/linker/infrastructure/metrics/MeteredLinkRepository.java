package in.linker.infrastructure.metrics;

import in.linker.domain.link.LinkRecord;
import in.linker.domain.link.LinkStatus;
import in.linker.domain.repository.InsertResult;
import in.linker.domain.repository.LinkRepository;
import in.linker.domain.repository.StoreException;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * LinkRepository decorator that records latency and failures of every store call.
 */
public final class MeteredLinkRepository implements LinkRepository {

    private final LinkRepository delegate;
    private final LinkMetrics metrics;

    public MeteredLinkRepository(LinkRepository delegate, LinkMetrics metrics) {
        this.delegate = delegate;
        this.metrics = metrics;
    }

    @Override
    public InsertResult insert(String code, String destination, boolean hidden) throws StoreException {
        return timed("insert", () -> delegate.insert(code, destination, hidden));
    }

    @Override
    public Optional<LinkRecord> fetchActive(String code) throws StoreException {
        return timed("fetch_active", () -> delegate.fetchActive(code));
    }

    @Override
    public Optional<LinkStatus> fetchStatus(String code) throws StoreException {
        return timed("fetch_status", () -> delegate.fetchStatus(code));
    }

    @Override
    public boolean markDeleted(String code) throws StoreException {
        return timed("mark_deleted", () -> delegate.markDeleted(code));
    }

    @Override
    public Optional<String> findActiveCodeByDestination(String destination) throws StoreException {
        return timed("reverse", () -> delegate.findActiveCodeByDestination(destination));
    }

    @Override
    public long forEach(Consumer<LinkRecord> sink) throws StoreException {
        return timed("list", () -> delegate.forEach(sink));
    }

    private <T> T timed(String operation, StoreCall<T> call) throws StoreException {
        long start = System.nanoTime();
        boolean success = false;
        try {
            T result = call.run();
            success = true;
            return result;
        } finally {
            metrics.recordStoreCall(operation, success, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    @FunctionalInterface
    private interface StoreCall<T> {
        T run() throws StoreException;
    }
}
