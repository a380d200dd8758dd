package io.tupla.core;

/**
 * Raised by the throwing ({@code ...OrThrow}) variants of table operations.
 * <p>
 * Carries the {@link TableError} the non-throwing variant would have returned.
 */
public class TuplaException extends RuntimeException {

    private final TableError error;

    public TuplaException(String operation, TableError error) {
        super(operation + " returned error " + error.describe());
        this.error = error;
    }

    public TuplaException(String message, Throwable cause) {
        super(message, cause);
        this.error = TableError.of(ErrorReason.UNKNOWN_ERROR);
    }

    public TuplaException(String message) {
        super(message);
        this.error = TableError.of(ErrorReason.UNKNOWN_ERROR);
    }

    public TableError error() {
        return error;
    }

    public ErrorReason reason() {
        return error.reason();
    }
}
