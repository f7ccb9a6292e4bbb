package in.linker.domain.link;

/**
 * Link lifecycle status.
 *
 * Flow: ACTIVE → DELETED (terminal, never reversed)
 */
public enum LinkStatus {
    ACTIVE,
    DELETED;

    public static LinkStatus fromDb(String value) {
        return LinkStatus.valueOf(value.trim().toUpperCase());
    }
}
