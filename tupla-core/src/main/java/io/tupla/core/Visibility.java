package io.tupla.core;

import java.util.Locale;

/**
 * Who besides the owning actor may touch a table.
 */
public enum Visibility {
    /**
     * Owner reads and writes; nobody else.
     */
    PRIVATE,
    /**
     * Anyone reads; owner writes.
     */
    PROTECTED,
    /**
     * Anyone reads and writes.
     */
    PUBLIC;

    public boolean readableByOthers() {
        return this != PRIVATE;
    }

    public boolean writableByOthers() {
        return this == PUBLIC;
    }

    /**
     * Parse the option spelling ({@code private}, {@code protected}, {@code public}).
     *
     * @return the visibility, or null if the text is not a known level
     */
    public static Visibility parse(String text) {
        if (text == null) {
            return null;
        }
        return switch (text.toLowerCase(Locale.ROOT)) {
            case "private" -> PRIVATE;
            case "protected" -> PROTECTED;
            case "public" -> PUBLIC;
            default -> null;
        };
    }
}
