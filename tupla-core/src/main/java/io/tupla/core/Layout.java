package io.tupla.core;

/**
 * Storage discipline of a table.
 */
public enum Layout {
    /**
     * Unique keys, no defined order.
     */
    SET(true, false, false),
    /**
     * Unique keys, records kept in term order of their key.
     */
    ORDERED_SET(true, true, false),
    /**
     * Many records per key; inserting an identical record is a no-op.
     */
    BAG(false, false, false),
    /**
     * Many records per key; identical records may coexist.
     */
    DUPLICATE_BAG(false, false, true);

    private final boolean uniqueKeys;
    private final boolean ordered;
    private final boolean duplicateRecords;

    Layout(boolean uniqueKeys, boolean ordered, boolean duplicateRecords) {
        this.uniqueKeys = uniqueKeys;
        this.ordered = ordered;
        this.duplicateRecords = duplicateRecords;
    }

    public boolean uniqueKeys() {
        return uniqueKeys;
    }

    public boolean ordered() {
        return ordered;
    }

    public boolean duplicateRecords() {
        return duplicateRecords;
    }

    public static Layout set(boolean ordered) {
        return ordered ? ORDERED_SET : SET;
    }

    public static Layout bag(boolean duplicate) {
        return duplicate ? DUPLICATE_BAG : BAG;
    }
}
