package in.linker.service.cache;

/**
 * In-memory projection of a link: resolved, or a tombstone.
 *
 * Kinds are ordered by the per-code lifecycle ABSENT → RESOLVED → DELETED.
 * {@link #newer} keeps whichever of two entries is further along, so a slow
 * store read can never move a cached code backwards (a late "absent" read
 * cannot hide a created link, a late "active" read cannot revive a deleted one).
 */
public record CacheEntry(
    Kind kind,
    String destination,
    boolean hidden
) {
    public enum Kind {
        ABSENT,     // tombstone: no row for this code
        RESOLVED,   // active link
        DELETED     // tombstone: row exists but was deleted
    }

    private static final CacheEntry ABSENT = new CacheEntry(Kind.ABSENT, null, false);
    private static final CacheEntry DELETED = new CacheEntry(Kind.DELETED, null, false);

    public CacheEntry {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (kind == Kind.RESOLVED && (destination == null || destination.isEmpty())) {
            throw new IllegalArgumentException("resolved entry needs a destination");
        }
    }

    public static CacheEntry resolved(String destination, boolean hidden) {
        return new CacheEntry(Kind.RESOLVED, destination, hidden);
    }

    public static CacheEntry absent() {
        return ABSENT;
    }

    public static CacheEntry deleted() {
        return DELETED;
    }

    public boolean isTombstone() {
        return kind != Kind.RESOLVED;
    }

    /**
     * The entry further along the lifecycle; {@code incoming} wins ties.
     */
    public static CacheEntry newer(CacheEntry current, CacheEntry incoming) {
        return incoming.kind.ordinal() >= current.kind.ordinal() ? incoming : current;
    }
}
