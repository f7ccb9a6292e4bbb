package in.linker.domain.repository;

/**
 * Failure talking to the persistent store (connectivity, timeout, SQL error).
 *
 * Checked so every caller of {@link LinkRepository} has to decide what a
 * store failure means at its call site.
 */
public class StoreException extends Exception {

    private final String operation;

    public StoreException(String operation, String message) {
        super(String.format("[%s] %s", operation, message));
        this.operation = operation;
    }

    public StoreException(String operation, String message, Throwable cause) {
        super(String.format("[%s] %s", operation, message), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
