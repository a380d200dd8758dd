package io.tupla.core;

/**
 * Structured failure of a table operation.
 *
 * @param reason the failure reason
 * @param option the offending option name, only set for {@link ErrorReason#INVALID_OPTION}
 * @param value  the offending option value, only set for {@link ErrorReason#INVALID_OPTION}
 */
public record TableError(ErrorReason reason, String option, Object value) {

    public TableError {
        if (reason == null) {
            throw new IllegalArgumentException("reason required");
        }
    }

    public static TableError of(ErrorReason reason) {
        return new TableError(reason, null, null);
    }

    public static TableError invalidOption(String option, Object value) {
        return new TableError(ErrorReason.INVALID_OPTION, option, value);
    }

    public boolean is(ErrorReason candidate) {
        return reason == candidate;
    }

    /**
     * Human readable form, e.g. {@code invalid_option(key_pos=0)}.
     */
    public String describe() {
        if (option == null) {
            return reason.code();
        }
        return reason.code() + "(" + option + "=" + value + ")";
    }

    @Override
    public String toString() {
        return describe();
    }
}
