package io.tupla.api;

import io.tupla.core.ErrorReason;
import io.tupla.core.Layout;
import io.tupla.core.Result;
import io.tupla.core.TableKind;
import io.tupla.core.TableOptions;
import io.tupla.core.TableRef;
import io.tupla.kernel.Tuple;
import io.tupla.runtime.Tupla;
import io.tupla.runtime.TuplaArena;
import io.tupla.storage.Table;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Set of tuples with unique keys, optionally kept in term order of the key.
 * <pre>
 * TupleSet users = TupleSet.createOrThrow(Map.of("ordered", true, "key_pos", 1));
 * users.putOrThrow(Tuple.of(1, "ada", "admin"));
 * users.getOrThrow(1);          // {1, ada, admin}
 * users.firstOrThrow();         // 1
 * </pre>
 * Navigation ({@link #first()}, {@link #next(Object)}, ...) needs an ordered set and fails
 * with {@code set_not_ordered} otherwise.
 */
public final class TupleSet extends TableHandle<TupleSet> {

    private TupleSet(TuplaArena arena, Table table) {
        super(arena, table);
    }

    @Override
    TupleSet self() {
        return this;
    }

    // ---- creation

    public static Result<TupleSet> create() {
        return create(Tupla.defaultArena(), Map.of());
    }

    /**
     * Create from an option map; see {@link io.tupla.core.OptionParser} for the keys. The
     * {@code ordered} option selects an ordered set.
     */
    public static Result<TupleSet> create(Map<String, ?> options) {
        return create(Tupla.defaultArena(), options);
    }

    public static Result<TupleSet> create(TuplaArena arena, Map<String, ?> options) {
        return Facades.create(arena, TableKind.SET, options).map(table -> new TupleSet(arena, table));
    }

    public static Result<TupleSet> create(TableOptions options, boolean ordered) {
        return create(Tupla.defaultArena(), options, ordered);
    }

    public static Result<TupleSet> create(TuplaArena arena, TableOptions options, boolean ordered) {
        return Facades.create(arena, TableKind.SET, Layout.set(ordered), options)
                .map(table -> new TupleSet(arena, table));
    }

    public static TupleSet createOrThrow(Map<String, ?> options) {
        return create(options).orElseThrow("TupleSet.create");
    }

    public static TupleSet createOrThrow(TuplaArena arena, Map<String, ?> options) {
        return create(arena, options).orElseThrow("TupleSet.create");
    }

    public static TupleSet createOrThrow(TuplaArena arena, TableOptions options, boolean ordered) {
        return create(arena, options, ordered).orElseThrow("TupleSet.create");
    }

    /**
     * Facade over an existing set or ordered set; {@code invalid_type} for other layouts.
     */
    public static Result<TupleSet> wrapExisting(String name) {
        return wrapExisting(Tupla.defaultArena(), name);
    }

    public static Result<TupleSet> wrapExisting(TuplaArena arena, String name) {
        return Facades.wrap(arena, TableKind.SET, name).map(table -> new TupleSet(arena, table));
    }

    public static Result<TupleSet> wrapExisting(TuplaArena arena, TableRef ref) {
        return Facades.wrap(arena, TableKind.SET, ref).map(table -> new TupleSet(arena, table));
    }

    public static TupleSet wrapExistingOrThrow(TuplaArena arena, String name) {
        return wrapExisting(arena, name).orElseThrow("TupleSet.wrapExisting");
    }

    /**
     * Wait for a set offered to the calling actor, using the arena's default timeout.
     */
    public static Result<Transfer<TupleSet>> accept(TuplaArena arena) {
        return accept(arena, arena.configuration().acceptTimeout());
    }

    public static Result<Transfer<TupleSet>> accept(TuplaArena arena, Duration timeout) {
        return Facades.accept(arena, TableKind.SET, timeout).flatMap(request ->
                wrapExisting(arena, request.table()).map(set ->
                        new Transfer<>(set, request.gift(), request.from(), request.inherited())));
    }

    public static Transfer<TupleSet> acceptOrThrow(TuplaArena arena, Duration timeout) {
        return accept(arena, timeout).orElseThrow("TupleSet.accept");
    }

    // ---- writes

    /**
     * Insert, replacing any record with the same key.
     */
    public Result<TupleSet> put(Tuple record) {
        return returnSelf(ops().insert(ref(), record));
    }

    public TupleSet putOrThrow(Tuple record) {
        return put(record).orElseThrow(op("put"));
    }

    /**
     * Insert all records atomically; the last record wins for a repeated key.
     */
    public Result<TupleSet> put(List<Tuple> records) {
        return returnSelf(ops().insertMany(ref(), records));
    }

    public TupleSet putOrThrow(List<Tuple> records) {
        return put(records).orElseThrow(op("put"));
    }

    /**
     * Insert unless the key exists ({@code key_already_exists}).
     */
    public Result<TupleSet> putNew(Tuple record) {
        return returnSelf(ops().insertNew(ref(), record));
    }

    public TupleSet putNewOrThrow(Tuple record) {
        return putNew(record).orElseThrow(op("putNew"));
    }

    public Result<TupleSet> putNew(List<Tuple> records) {
        return returnSelf(ops().insertManyNew(ref(), records));
    }

    public TupleSet putNewOrThrow(List<Tuple> records) {
        return putNew(records).orElseThrow(op("putNew"));
    }

    public Result<TupleSet> delete(Object key) {
        return returnSelf(ops().delete(ref(), key));
    }

    public TupleSet deleteOrThrow(Object key) {
        return delete(key).orElseThrow(op("delete"));
    }

    // ---- reads

    /**
     * The record stored under {@code key}, or null.
     */
    public Result<Tuple> get(Object key) {
        return get(key, null);
    }

    public Result<Tuple> get(Object key, Tuple defaultValue) {
        return ops().lookup(ref(), key).flatMap(records -> {
            if (records.isEmpty()) {
                return Result.ok(defaultValue);
            }
            if (records.size() > 1) {
                return Result.err(ErrorReason.INVALID_SET);
            }
            return Result.ok(records.get(0));
        });
    }

    public Tuple getOrThrow(Object key) {
        return get(key).orElseThrow(op("get"));
    }

    public Tuple getOrThrow(Object key, Tuple defaultValue) {
        return get(key, defaultValue).orElseThrow(op("get"));
    }

    /**
     * Element {@code pos} of the record stored under {@code key}.
     */
    public Result<Object> getElement(Object key, int pos) {
        return ops().lookupElement(ref(), key, pos).map(elements -> elements.get(0));
    }

    public Object getElementOrThrow(Object key, int pos) {
        return getElement(key, pos).orElseThrow(op("getElement"));
    }

    // ---- navigation

    public Result<Object> first() {
        return ops().first(ref());
    }

    public Object firstOrThrow() {
        return first().orElseThrow(op("first"));
    }

    public Result<Object> last() {
        return ops().last(ref());
    }

    public Object lastOrThrow() {
        return last().orElseThrow(op("last"));
    }

    public Result<Object> next(Object key) {
        return ops().next(ref(), key);
    }

    public Object nextOrThrow(Object key) {
        return next(key).orElseThrow(op("next"));
    }

    public Result<Object> previous(Object key) {
        return ops().previous(ref(), key);
    }

    public Object previousOrThrow(Object key) {
        return previous(key).orElseThrow(op("previous"));
    }
}
