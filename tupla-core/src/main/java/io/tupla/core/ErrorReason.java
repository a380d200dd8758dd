package io.tupla.core;

import java.util.Locale;

/**
 * Reasons an operation on a table can fail.
 * <p>
 * Every non-throwing operation reports one of these through {@link Result}; the throwing
 * variants carry the same reason inside a {@link TuplaException}.
 */
public enum ErrorReason {
    // Structural / configuration
    INVALID_OPTION,
    TABLE_ALREADY_EXISTS,
    INVALID_KEYPOS,
    INVALID_TYPE,

    // Table existence
    TABLE_NOT_FOUND,

    // Access control
    READ_PROTECTED,
    WRITE_PROTECTED,

    // Record shape
    INVALID_RECORD,
    RECORD_TOO_SMALL,

    // Uniqueness
    KEY_ALREADY_EXISTS,
    RECORD_ALREADY_EXISTS,
    MULTI_FOUND,
    INVALID_SET,

    // Navigation
    EMPTY_TABLE,
    END_OF_TABLE,
    START_OF_TABLE,
    SET_NOT_ORDERED,

    // Matching
    INVALID_CONTINUATION,
    INVALID_SELECT_SPEC,
    KEY_NOT_FOUND,
    POSITION_OUT_OF_BOUNDS,

    // Ownership
    RECIPIENT_ALREADY_OWNS_TABLE,
    RECIPIENT_NOT_ALIVE,
    SENDER_NOT_TABLE_OWNER,
    TIMEOUT,

    UNKNOWN_ERROR;

    /**
     * Lower-case code used in messages, e.g. {@code key_already_exists}.
     */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
