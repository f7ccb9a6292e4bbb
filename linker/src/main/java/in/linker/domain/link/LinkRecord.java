package in.linker.domain.link;

import java.time.Instant;

/**
 * Domain model for the links table.
 *
 * One row per code. Deletion flips {@code status} to DELETED; rows are never
 * removed, so a reader always sees either a live link or a definitive
 * tombstone.
 */
public record LinkRecord(
    String code,
    String destination,
    boolean hidden,
    LinkStatus status,

    // Audit trail
    Instant createdAt,
    Instant updatedAt
) {
    public LinkRecord {
        if (code == null || code.isEmpty()) {
            throw new IllegalArgumentException("code cannot be empty");
        }
        if (destination == null || destination.isEmpty()) {
            throw new IllegalArgumentException("destination cannot be empty");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }

    /**
     * A freshly registered link.
     */
    public static LinkRecord newActive(String code, String destination, boolean hidden, Instant now) {
        return new LinkRecord(code, destination, hidden, LinkStatus.ACTIVE, now, now);
    }

    public boolean isActive() {
        return status == LinkStatus.ACTIVE;
    }
}
