package io.tupla.query;

import io.tupla.core.TableRef;

/**
 * Opaque cursor for resuming a paginated match or select.
 * <p>
 * Bound to one table and one compiled pattern or spec. Ordered tables resume strictly after the
 * last key examined; other layouts resume at the next unread record in key insertion order, so
 * records removed from a partly read key may shift the position and cause records of that key to
 * be skipped. {@link #isEnd()} marks the exhausted cursor.
 *
 * @param <R> result type of the pages it produces
 */
public final class Continuation<R> {

    public enum Kind {
        MATCH,
        SELECT
    }

    private static final Continuation<?> END = new Continuation<>(null, null, null, 0, null, false, 0, 0);

    private final TableRef table;
    private final Kind kind;
    private final Program<R> program;
    private final int limit;
    private final Object lastKey;
    private final boolean keyed;
    private final long sequence;
    private final int index;

    private Continuation(TableRef table, Kind kind, Program<R> program, int limit,
                         Object lastKey, boolean keyed, long sequence, int index) {
        this.table = table;
        this.kind = kind;
        this.program = program;
        this.limit = limit;
        this.lastKey = lastKey;
        this.keyed = keyed;
        this.sequence = sequence;
        this.index = index;
    }

    @SuppressWarnings("unchecked")
    public static <R> Continuation<R> end() {
        return (Continuation<R>) END;
    }

    static <R> Continuation<R> afterKey(TableRef table, Kind kind, Program<R> program, int limit, Object key) {
        return new Continuation<>(table, kind, program, limit, key, true, 0, 0);
    }

    static <R> Continuation<R> atPosition(TableRef table, Kind kind, Program<R> program, int limit,
                                          long sequence, int index) {
        return new Continuation<>(table, kind, program, limit, null, false, sequence, index);
    }

    public boolean isEnd() {
        return this == END;
    }

    /**
     * The table this cursor walks, null for the exhausted cursor.
     */
    public TableRef table() {
        return table;
    }

    public Kind kind() {
        return kind;
    }

    public int limit() {
        return limit;
    }

    Program<R> program() {
        return program;
    }

    boolean keyed() {
        return keyed;
    }

    Object lastKey() {
        return lastKey;
    }

    long sequence() {
        return sequence;
    }

    int index() {
        return index;
    }

    @Override
    public String toString() {
        if (isEnd()) {
            return "end_of_table";
        }
        return "Continuation{" + kind + " " + table + (keyed ? " after " + lastKey : " at " + sequence + "/" + index) + "}";
    }
}
