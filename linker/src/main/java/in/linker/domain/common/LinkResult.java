package in.linker.domain.common;

/**
 * Outcome of an engine operation.
 *
 * Every call returns one of these instead of throwing, so the HTTP layer maps
 * {@link Outcome} to a status code in one place.
 *
 * @param <T> value carried by a successful outcome
 */
public record LinkResult<T>(
    Outcome outcome,
    T value,
    String message
) {
    public enum Outcome {
        OK,                 // value present
        VALIDATION_ERROR,   // caller fault, not retried
        NOT_FOUND,          // never existed or deleted; callers cannot tell which
        EXHAUSTED,          // no free code within the retry bound
        STORE_ERROR;        // store failure or timeout, propagated verbatim

        public boolean isClientFault() {
            return this == VALIDATION_ERROR || this == NOT_FOUND;
        }

        public boolean isServerFault() {
            return this == EXHAUSTED || this == STORE_ERROR;
        }
    }

    public static <T> LinkResult<T> ok(T value) {
        return new LinkResult<>(Outcome.OK, value, null);
    }

    public static <T> LinkResult<T> invalid(String message) {
        return new LinkResult<>(Outcome.VALIDATION_ERROR, null, message);
    }

    public static <T> LinkResult<T> notFound() {
        return new LinkResult<>(Outcome.NOT_FOUND, null, "Not found");
    }

    public static <T> LinkResult<T> exhausted(int attempts) {
        return new LinkResult<>(Outcome.EXHAUSTED, null,
            "No unused code found after " + attempts + " attempts");
    }

    public static <T> LinkResult<T> storeError(String message) {
        return new LinkResult<>(Outcome.STORE_ERROR, null, message);
    }

    public boolean isOk() {
        return outcome == Outcome.OK;
    }
}
