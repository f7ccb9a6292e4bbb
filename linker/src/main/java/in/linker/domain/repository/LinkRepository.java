package in.linker.domain.repository;

import in.linker.domain.link.LinkRecord;
import in.linker.domain.link.LinkStatus;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Durable code → destination mapping. Single source of truth.
 *
 * Implementations must be safe under arbitrary concurrent use from many
 * engine instances; atomicity comes from the database (primary key on code,
 * conditional status update), never from an in-process lock.
 */
public interface LinkRepository {

    /**
     * Insert a new ACTIVE link. Returns {@link InsertResult#duplicate()} when
     * the code already exists in any status.
     */
    InsertResult insert(String code, String destination, boolean hidden) throws StoreException;

    /**
     * The record for {@code code} only if it is ACTIVE; empty when absent or deleted.
     */
    Optional<LinkRecord> fetchActive(String code) throws StoreException;

    /**
     * Status of {@code code}; empty when no row exists.
     */
    Optional<LinkStatus> fetchStatus(String code) throws StoreException;

    /**
     * Atomic ACTIVE → DELETED transition.
     *
     * @return true if this call performed the transition
     */
    boolean markDeleted(String code) throws StoreException;

    /**
     * Most recently created ACTIVE code pointing at {@code destination}.
     */
    Optional<String> findActiveCodeByDestination(String destination) throws StoreException;

    /**
     * Stream every record (any status) to {@code sink}, oldest first.
     *
     * @return number of records visited
     */
    long forEach(Consumer<LinkRecord> sink) throws StoreException;
}
