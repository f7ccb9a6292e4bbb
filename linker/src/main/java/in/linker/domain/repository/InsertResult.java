package in.linker.domain.repository;

import in.linker.domain.link.LinkRecord;

/**
 * Result of {@link LinkRepository#insert}: either the stored record or a
 * unique-key violation on the code.
 */
public record InsertResult(LinkRecord record, boolean duplicateCode) {

    public static InsertResult inserted(LinkRecord record) {
        return new InsertResult(record, false);
    }

    public static InsertResult duplicate() {
        return new InsertResult(null, true);
    }

    public boolean isInserted() {
        return !duplicateCode;
    }
}
