package io.tupla.core;

import java.util.Optional;

/**
 * Immutable per-table creation options.
 * <p>
 * Use the builder to create custom options:
 * <pre>
 * TableOptions options = TableOptions.builder()
 *     .name("sessions")
 *     .visibility(Visibility.PUBLIC)
 *     .keyPos(2)
 *     .build();
 * </pre>
 * The builder does not reject values; {@link #firstViolation()} reports the first illegal
 * field in declaration order and table creation refuses options that have one.
 *
 * @see OptionParser
 */
public final class TableOptions {

    private static final TableOptions DEFAULTS = builder().build();

    // Identity
    private final String name;

    // Access control
    private final Visibility visibility;
    private final Heir heir;

    // Record shape
    private final int keyPos;

    // Advisory hints, no effect on results
    private final boolean readConcurrency;
    private final boolean writeConcurrency;
    private final boolean compressed;

    private TableOptions(Builder builder) {
        this.name = builder.name;
        this.visibility = builder.visibility;
        this.heir = builder.heir;
        this.keyPos = builder.keyPos;
        this.readConcurrency = builder.readConcurrency;
        this.writeConcurrency = builder.writeConcurrency;
        this.compressed = builder.compressed;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TableOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Table name, or null for an unnamed table.
     */
    public String name() {
        return name;
    }

    /**
     * Requested visibility, or null to use the arena default.
     */
    public Visibility visibility() {
        return visibility;
    }

    public Heir heir() {
        return heir;
    }

    /**
     * 1-indexed position of the key inside each record.
     */
    public int keyPos() {
        return keyPos;
    }

    public boolean readConcurrency() {
        return readConcurrency;
    }

    public boolean writeConcurrency() {
        return writeConcurrency;
    }

    /**
     * Whether equal element values are pooled to save memory.
     */
    public boolean compressed() {
        return compressed;
    }

    /**
     * The first illegal option, if any.
     *
     * @return an {@link ErrorReason#INVALID_OPTION} error naming the option, or empty
     */
    public Optional<TableError> firstViolation() {
        if (name != null && name.isBlank()) {
            return Optional.of(TableError.invalidOption(OptionParser.NAME, name));
        }
        if (heir == null) {
            return Optional.of(TableError.invalidOption(OptionParser.HEIR, null));
        }
        if (keyPos < 1) {
            return Optional.of(TableError.invalidOption(OptionParser.KEY_POS, keyPos));
        }
        return Optional.empty();
    }

    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .visibility(visibility)
                .heir(heir)
                .keyPos(keyPos)
                .readConcurrency(readConcurrency)
                .writeConcurrency(writeConcurrency)
                .compressed(compressed);
    }

    @Override
    public String toString() {
        return "TableOptions{name=" + name
                + ", visibility=" + visibility
                + ", heir=" + heir
                + ", keyPos=" + keyPos
                + ", readConcurrency=" + readConcurrency
                + ", writeConcurrency=" + writeConcurrency
                + ", compressed=" + compressed + "}";
    }

    /**
     * Builder for TableOptions.
     */
    public static class Builder {
        private String name;
        private Visibility visibility;
        private Heir heir = Heir.NONE;
        private int keyPos = 1;
        private boolean readConcurrency;
        private boolean writeConcurrency;
        private boolean compressed;

        private Builder() {
        }

        /**
         * Register the table under a name unique within its arena.
         *
         * @param name the table name, null for an unnamed table
         * @return this builder for method chaining
         */
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder visibility(Visibility visibility) {
            this.visibility = visibility;
            return this;
        }

        public Builder heir(Heir heir) {
            this.heir = heir;
            return this;
        }

        public Builder heir(Actor actor, Object payload) {
            this.heir = Heir.of(actor, payload);
            return this;
        }

        /**
         * Set the key position.
         *
         * @param keyPos 1-indexed element position holding the key (default 1)
         * @return this builder for method chaining
         */
        public Builder keyPos(int keyPos) {
            this.keyPos = keyPos;
            return this;
        }

        public Builder readConcurrency(boolean readConcurrency) {
            this.readConcurrency = readConcurrency;
            return this;
        }

        public Builder writeConcurrency(boolean writeConcurrency) {
            this.writeConcurrency = writeConcurrency;
            return this;
        }

        public Builder compressed(boolean compressed) {
            this.compressed = compressed;
            return this;
        }

        public TableOptions build() {
            return new TableOptions(this);
        }
    }
}
