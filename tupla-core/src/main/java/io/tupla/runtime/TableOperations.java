package io.tupla.runtime;

import io.tupla.core.Actor;
import io.tupla.core.ErrorReason;
import io.tupla.core.OptionParser;
import io.tupla.core.Result;
import io.tupla.core.TableError;
import io.tupla.core.TableRef;
import io.tupla.kernel.Tuple;
import io.tupla.query.Continuation;
import io.tupla.query.MatchEngine;
import io.tupla.query.MatchSpec;
import io.tupla.query.Page;
import io.tupla.query.Pattern;
import io.tupla.query.PatternCompiler;
import io.tupla.storage.OrderedRecordStore;
import io.tupla.storage.RecordStore;
import io.tupla.storage.Table;
import io.tupla.storage.TableInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Record, match and table-level operations of one arena, addressed by {@link TableRef}.
 * <p>
 * Every operation acts as {@link Actor#current()}, resolves the table, takes its read or write
 * lock, and passes the {@link AccessGate} before touching storage. Expected failures come back
 * as {@link Result} errors. Any other exception is logged and reported as
 * {@link ErrorReason#UNKNOWN_ERROR}.
 */
public final class TableOperations {
    private static final Logger log = LoggerFactory.getLogger(TableOperations.class);

    private static final String LIMIT = "limit";

    private final TuplaArena arena;

    TableOperations(TuplaArena arena) {
        this.arena = arena;
    }

    // ---- insert

    /**
     * Insert one record: replace on unique layouts, append on bags.
     */
    public Result<Void> insert(TableRef ref, Tuple record) {
        return write("insert", ref, table -> {
            var invalid = validate(table, record);
            if (invalid != null) {
                return Result.err(invalid);
            }
            table.store().insert(record);
            return Result.ok(null);
        });
    }

    /**
     * Insert one record unless its key (or, for duplicate bags, the identical record) exists.
     */
    public Result<Void> insertNew(TableRef ref, Tuple record) {
        return write("insertNew", ref, table -> {
            var invalid = validate(table, record);
            if (invalid != null) {
                return Result.err(invalid);
            }
            var conflict = table.store().conflict(record);
            if (conflict != null) {
                return Result.err(conflict);
            }
            table.store().insert(record);
            return Result.ok(null);
        });
    }

    /**
     * Insert all records atomically: either every record is stored or none is.
     */
    public Result<Void> insertMany(TableRef ref, List<Tuple> records) {
        return write("insertMany", ref, table -> {
            var invalid = validateAll(table, records);
            if (invalid != null) {
                return Result.err(invalid);
            }
            for (var record : records) {
                table.store().insert(record);
            }
            return Result.ok(null);
        });
    }

    /**
     * Insert all records atomically, or none if any conflicts with the table or with another
     * record of the batch.
     */
    public Result<Void> insertManyNew(TableRef ref, List<Tuple> records) {
        return write("insertManyNew", ref, table -> {
            var invalid = validateAll(table, records);
            if (invalid != null) {
                return Result.err(invalid);
            }
            var batch = RecordStore.create(table.layout(), table.keyPos());
            for (var record : records) {
                var conflict = table.store().conflict(record);
                if (conflict == null) {
                    conflict = batch.conflict(record);
                }
                if (conflict != null) {
                    return Result.err(conflict);
                }
                batch.insert(record);
            }
            for (var record : records) {
                table.store().insert(record);
            }
            return Result.ok(null);
        });
    }

    // ---- lookup

    public Result<List<Tuple>> lookup(TableRef ref, Object key) {
        return read("lookup", ref, table -> Result.ok(table.store().lookup(key)));
    }

    /**
     * Element {@code pos} of every record stored under {@code key}.
     */
    public Result<List<Object>> lookupElement(TableRef ref, Object key, int pos) {
        return read("lookupElement", ref, table -> {
            var records = table.store().lookup(key);
            if (records.isEmpty()) {
                return Result.err(ErrorReason.KEY_NOT_FOUND);
            }
            var elements = new ArrayList<Object>(records.size());
            for (var record : records) {
                if (pos < 1 || pos > record.arity()) {
                    return Result.err(ErrorReason.POSITION_OUT_OF_BOUNDS);
                }
                elements.add(record.element(pos));
            }
            return Result.ok(elements);
        });
    }

    public Result<Boolean> hasKey(TableRef ref, Object key) {
        return read("hasKey", ref, table -> Result.ok(table.store().containsKey(key)));
    }

    /**
     * All records: term order of keys for ordered tables, otherwise insertion order of keys.
     */
    public Result<List<Tuple>> toList(TableRef ref) {
        return read("toList", ref, table -> Result.ok(table.store().records()));
    }

    // ---- delete

    /**
     * @return number of records removed
     */
    public Result<Integer> delete(TableRef ref, Object key) {
        return write("delete", ref, table -> Result.ok(table.store().delete(key)));
    }

    public Result<Void> deleteAll(TableRef ref) {
        return write("deleteAll", ref, table -> {
            table.clear();
            return Result.ok(null);
        });
    }

    public Result<Void> deleteTable(TableRef ref) {
        return write("deleteTable", ref, table -> {
            arena.drop(table);
            return Result.ok(null);
        });
    }

    // ---- navigation

    public Result<Object> first(TableRef ref) {
        return navigate("first", ref, OrderedRecordStore::first, ErrorReason.EMPTY_TABLE);
    }

    public Result<Object> last(TableRef ref) {
        return navigate("last", ref, OrderedRecordStore::last, ErrorReason.EMPTY_TABLE);
    }

    /**
     * Key following {@code key} in term order; {@code key} need not be stored.
     */
    public Result<Object> next(TableRef ref, Object key) {
        return navigate("next", ref, store -> store.next(key), ErrorReason.END_OF_TABLE);
    }

    /**
     * Key preceding {@code key} in term order; {@code key} need not be stored.
     */
    public Result<Object> previous(TableRef ref, Object key) {
        return navigate("previous", ref, store -> store.previous(key), ErrorReason.START_OF_TABLE);
    }

    private Result<Object> navigate(String operation, TableRef ref, Function<OrderedRecordStore, Tuple> step,
                                    ErrorReason none) {
        return read(operation, ref, table -> {
            var ordered = table.orderedStore();
            if (ordered == null) {
                return Result.err(ErrorReason.SET_NOT_ORDERED);
            }
            var record = step.apply(ordered);
            return record == null ? Result.err(none) : Result.ok(ordered.keyOf(record));
        });
    }

    // ---- match / select

    /**
     * Bindings of every matching record, each ordered by variable number.
     */
    public Result<List<List<Object>>> match(TableRef ref, Pattern pattern) {
        return PatternCompiler.compile(pattern).flatMap(compiled ->
                read("match", ref, table -> Result.ok(MatchEngine.all(table, compiled))));
    }

    public Result<Page<List<Object>>> match(TableRef ref, Pattern pattern, int limit) {
        if (limit < 1) {
            return Result.err(TableError.invalidOption(LIMIT, limit));
        }
        return PatternCompiler.compile(pattern).flatMap(compiled -> read("match", ref, table ->
                Result.ok(MatchEngine.<List<Object>>first(table, Continuation.Kind.MATCH, compiled, limit))));
    }

    public Result<Page<List<Object>>> match(Continuation<List<Object>> continuation) {
        return resume("match", continuation, Continuation.Kind.MATCH);
    }

    public Result<List<Object>> select(TableRef ref, MatchSpec spec) {
        return PatternCompiler.compile(spec).flatMap(compiled ->
                read("select", ref, table -> Result.ok(MatchEngine.all(table, compiled))));
    }

    public Result<Page<Object>> select(TableRef ref, MatchSpec spec, int limit) {
        if (limit < 1) {
            return Result.err(TableError.invalidOption(LIMIT, limit));
        }
        return PatternCompiler.compile(spec).flatMap(compiled -> read("select", ref, table ->
                Result.ok(MatchEngine.<Object>first(table, Continuation.Kind.SELECT, compiled, limit))));
    }

    public Result<Page<Object>> select(Continuation<Object> continuation) {
        return resume("select", continuation, Continuation.Kind.SELECT);
    }

    /**
     * Atomically remove every record for which {@code spec} returns {@code true}.
     *
     * @return number of records removed
     */
    public Result<Integer> selectDelete(TableRef ref, MatchSpec spec) {
        return PatternCompiler.compile(spec).flatMap(compiled ->
                write("selectDelete", ref, table -> Result.ok(MatchEngine.delete(table, compiled))));
    }

    /**
     * Number of records for which {@code spec} returns {@code true}.
     */
    public Result<Integer> selectCount(TableRef ref, MatchSpec spec) {
        return PatternCompiler.compile(spec).flatMap(compiled ->
                read("selectCount", ref, table -> Result.ok(MatchEngine.count(table, compiled))));
    }

    private <R> Result<Page<R>> resume(String operation, Continuation<R> continuation, Continuation.Kind kind) {
        if (continuation == null) {
            return Result.err(ErrorReason.INVALID_CONTINUATION);
        }
        if (continuation.isEnd()) {
            return Result.ok(Page.last(List.of()));
        }
        if (continuation.kind() != kind) {
            return Result.err(ErrorReason.INVALID_CONTINUATION);
        }
        var found = guarded(operation, continuation.table(), () -> Result.ok(arena.find(continuation.table())));
        if (found.isErr()) {
            return Result.err(found.error());
        }
        if (found.value().isEmpty()) {
            return Result.err(ErrorReason.INVALID_CONTINUATION);
        }
        var table = found.value().get();
        return locked(operation, table, table.readLock(), false, t -> Result.ok(MatchEngine.resume(t, continuation)));
    }

    // ---- table level

    /**
     * Metadata snapshot. Not subject to protection.
     */
    public Result<TableInfo> info(TableRef ref) {
        return guarded("info", ref, () -> arena.find(ref)
                .<Result<TableInfo>>map(table -> Result.ok(table.info()))
                .orElseGet(() -> Result.err(ErrorReason.TABLE_NOT_FOUND)));
    }

    public Result<TableRef> rename(TableRef ref, String newName) {
        if (newName == null || newName.isBlank()) {
            return Result.err(TableError.invalidOption(OptionParser.NAME, newName));
        }
        return write("rename", ref, table -> arena.rename(table, newName));
    }

    public Result<TableRef> whereis(String name) {
        return guarded("whereis", null, () -> arena.find(name)
                .<Result<TableRef>>map(table -> Result.ok(table.ref()))
                .orElseGet(() -> Result.err(ErrorReason.TABLE_NOT_FOUND)));
    }

    /**
     * References of all live tables in creation order.
     */
    public Result<List<TableRef>> all() {
        return guarded("all", null, () -> {
            var refs = new ArrayList<TableRef>();
            for (var table : arena.tables()) {
                refs.add(table.ref());
            }
            return Result.ok(refs);
        });
    }

    // ---- plumbing

    private <T> Result<T> read(String operation, TableRef ref, Function<Table, Result<T>> body) {
        return access(operation, ref, false, body);
    }

    private <T> Result<T> write(String operation, TableRef ref, Function<Table, Result<T>> body) {
        return access(operation, ref, true, body);
    }

    private <T> Result<T> access(String operation, TableRef ref, boolean write, Function<Table, Result<T>> body) {
        var found = guarded(operation, ref, () -> Result.ok(arena.find(ref)));
        if (found.isErr()) {
            return Result.err(found.error());
        }
        if (found.value().isEmpty()) {
            return Result.err(ErrorReason.TABLE_NOT_FOUND);
        }
        var table = found.value().get();
        return locked(operation, table, write ? table.writeLock() : table.readLock(), write, body);
    }

    private <T> Result<T> locked(String operation, Table table, Lock lock, boolean write,
                                 Function<Table, Result<T>> body) {
        return guarded(operation, table.ref(), () -> {
            lock.lock();
            try {
                if (table.isDeleted()) {
                    return Result.err(ErrorReason.TABLE_NOT_FOUND);
                }
                var caller = Actor.current();
                var denied = write ? AccessGate.checkWrite(table, caller) : AccessGate.checkRead(table, caller);
                if (denied.isPresent()) {
                    return Result.err(denied.get());
                }
                return body.apply(table);
            } finally {
                lock.unlock();
            }
        });
    }

    private <T> Result<T> guarded(String operation, TableRef ref, Supplier<Result<T>> body) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            log.error("Unknown error in {} on table {}", operation, ref, e);
            return Result.err(ErrorReason.UNKNOWN_ERROR);
        }
    }

    private static TableError validate(Table table, Tuple record) {
        if (record == null) {
            return TableError.of(ErrorReason.INVALID_RECORD);
        }
        if (record.arity() < table.keyPos()) {
            return TableError.of(ErrorReason.RECORD_TOO_SMALL);
        }
        return null;
    }

    private static TableError validateAll(Table table, List<Tuple> records) {
        if (records == null) {
            return TableError.of(ErrorReason.INVALID_RECORD);
        }
        for (var record : records) {
            var invalid = validate(table, record);
            if (invalid != null) {
                return invalid;
            }
        }
        return null;
    }
}
