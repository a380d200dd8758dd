package io.tupla.query;

import io.tupla.kernel.Tuple;
import io.tupla.storage.Table;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Runs compiled programs over a table's records.
 * <p>
 * Every method expects the caller to hold the table's read lock, except
 * {@link #delete(Table, CompiledSpec)} which needs the write lock.
 */
public final class MatchEngine {

    private MatchEngine() {
    }

    public static <R> List<R> all(Table table, Program<R> program) {
        var results = new ArrayList<R>();
        for (var record : iterationOrder(table)) {
            program.apply(record, results::add);
        }
        return results;
    }

    /**
     * First page of at most {@code limit} results.
     */
    public static <R> Page<R> first(Table table, Continuation.Kind kind, Program<R> program, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1: " + limit);
        }
        var ordered = table.orderedStore();
        if (ordered != null) {
            return pageByKey(table, kind, program, limit, ordered.view().iterator());
        }
        return pageByPosition(table, kind, program, limit, 0, 0);
    }

    /**
     * Next page for a cursor issued by {@link #first}. The caller has checked that the cursor
     * belongs to {@code table}.
     */
    public static <R> Page<R> resume(Table table, Continuation<R> continuation) {
        if (continuation.isEnd()) {
            return Page.last(List.of());
        }
        var ordered = table.orderedStore();
        if (continuation.keyed() && ordered != null) {
            return pageByKey(table, continuation.kind(), continuation.program(), continuation.limit(),
                    ordered.after(continuation.lastKey()).iterator());
        }
        return pageByPosition(table, continuation.kind(), continuation.program(), continuation.limit(),
                continuation.sequence(), continuation.index());
    }

    public static int count(Table table, CompiledSpec spec) {
        var count = 0;
        for (var record : iterationOrder(table)) {
            if (spec.returnsTrue(record)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Remove every record for which {@code spec} returns {@code true}.
     *
     * @return number of records removed
     */
    public static int delete(Table table, CompiledSpec spec) {
        return table.store().deleteIf(spec::returnsTrue);
    }

    private static Iterable<Tuple> iterationOrder(Table table) {
        var ordered = table.orderedStore();
        if (ordered != null) {
            return ordered.view();
        }
        return () -> table.cursor(0, 0);
    }

    private static <R> Page<R> pageByKey(Table table, Continuation.Kind kind, Program<R> program, int limit,
                                         Iterator<Tuple> records) {
        var results = new ArrayList<R>(Math.min(limit, 64));
        Tuple last = null;
        while (results.size() < limit && records.hasNext()) {
            last = records.next();
            program.apply(last, results::add);
        }
        if (!records.hasNext()) {
            return Page.last(results);
        }
        var key = table.store().keyOf(last);
        return new Page<>(results, Continuation.afterKey(table.ref(), kind, program, limit, key));
    }

    private static <R> Page<R> pageByPosition(Table table, Continuation.Kind kind, Program<R> program, int limit,
                                              long sequence, int index) {
        var cursor = table.cursor(sequence, index);
        var results = new ArrayList<R>(Math.min(limit, 64));
        while (results.size() < limit && cursor.hasNext()) {
            program.apply(cursor.next(), results::add);
        }
        if (!cursor.hasNext()) {
            return Page.last(results);
        }
        return new Page<>(results, Continuation.atPosition(table.ref(), kind, program, limit,
                cursor.sequence(), cursor.index()));
    }
}
