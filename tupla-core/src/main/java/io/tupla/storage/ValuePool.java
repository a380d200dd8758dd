package io.tupla.storage;

import io.tupla.kernel.Tuple;

import java.util.HashMap;
import java.util.Map;

/**
 * Value pool for compressed tables.
 * Equal element values are stored once and shared by every record holding them.
 * Arrays are mutable and never pooled; nested tuples are pooled element-wise first.
 * <p>
 * Each pooled value counts the stored records referring to it and leaves the pool when the
 * last of them is released.
 */
final class ValuePool {
    private final Map<Object, Entry> values = new HashMap<>();

    private static final class Entry {
        private final Object value;
        private int references;

        private Entry(Object value) {
            this.value = value;
        }
    }

    /**
     * Copy of {@code record} whose elements are the pooled instances. Every element gains one
     * reference; balance it with {@link #release} once the record leaves the table.
     */
    Tuple intern(Tuple record) {
        return record.map(this::internValue);
    }

    private Object internValue(Object value) {
        if (value == null || value.getClass().isArray()) {
            return value;
        }
        if (value instanceof Tuple nested) {
            value = intern(nested);
        }
        var entry = values.computeIfAbsent(value, Entry::new);
        entry.references++;
        return entry.value;
    }

    /**
     * Drop one reference from every element of a record previously returned by {@link #intern}.
     */
    void release(Tuple record) {
        for (int pos = 1; pos <= record.arity(); pos++) {
            releaseValue(record.element(pos));
        }
    }

    private void releaseValue(Object value) {
        if (value == null || value.getClass().isArray()) {
            return;
        }
        if (value instanceof Tuple nested) {
            release(nested);
        }
        var entry = values.get(value);
        if (entry != null && --entry.references == 0) {
            values.remove(value);
        }
    }

    /**
     * Number of distinct pooled values.
     */
    int size() {
        return values.size();
    }

    /**
     * Drop all pooled values. Called when the table is emptied.
     */
    void clear() {
        values.clear();
    }
}
