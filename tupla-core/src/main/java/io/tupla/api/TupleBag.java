package io.tupla.api;

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
 * Bag of tuples: many records per key, looked up in insertion order.
 * <p>
 * A plain bag ignores a record identical to one already stored; with the {@code duplicate}
 * option identical records are all kept.
 */
public final class TupleBag extends TableHandle<TupleBag> {

    private TupleBag(TuplaArena arena, Table table) {
        super(arena, table);
    }

    @Override
    TupleBag self() {
        return this;
    }

    // ---- creation

    public static Result<TupleBag> create() {
        return create(Tupla.defaultArena(), Map.of());
    }

    public static Result<TupleBag> create(Map<String, ?> options) {
        return create(Tupla.defaultArena(), options);
    }

    public static Result<TupleBag> create(TuplaArena arena, Map<String, ?> options) {
        return Facades.create(arena, TableKind.BAG, options).map(table -> new TupleBag(arena, table));
    }

    public static Result<TupleBag> create(TuplaArena arena, TableOptions options, boolean duplicate) {
        return Facades.create(arena, TableKind.BAG, Layout.bag(duplicate), options)
                .map(table -> new TupleBag(arena, table));
    }

    public static TupleBag createOrThrow(Map<String, ?> options) {
        return create(options).orElseThrow("TupleBag.create");
    }

    public static TupleBag createOrThrow(TuplaArena arena, Map<String, ?> options) {
        return create(arena, options).orElseThrow("TupleBag.create");
    }

    public static TupleBag createOrThrow(TuplaArena arena, TableOptions options, boolean duplicate) {
        return create(arena, options, duplicate).orElseThrow("TupleBag.create");
    }

    public static Result<TupleBag> wrapExisting(TuplaArena arena, String name) {
        return Facades.wrap(arena, TableKind.BAG, name).map(table -> new TupleBag(arena, table));
    }

    public static Result<TupleBag> wrapExisting(TuplaArena arena, TableRef ref) {
        return Facades.wrap(arena, TableKind.BAG, ref).map(table -> new TupleBag(arena, table));
    }

    public static TupleBag wrapExistingOrThrow(TuplaArena arena, String name) {
        return wrapExisting(arena, name).orElseThrow("TupleBag.wrapExisting");
    }

    public static Result<Transfer<TupleBag>> accept(TuplaArena arena, Duration timeout) {
        return Facades.accept(arena, TableKind.BAG, timeout).flatMap(request ->
                wrapExisting(arena, request.table()).map(bag ->
                        new Transfer<>(bag, request.gift(), request.from(), request.inherited())));
    }

    public static Transfer<TupleBag> acceptOrThrow(TuplaArena arena, Duration timeout) {
        return accept(arena, timeout).orElseThrow("TupleBag.accept");
    }

    // ---- writes

    public Result<TupleBag> add(Tuple record) {
        return returnSelf(ops().insert(ref(), record));
    }

    public TupleBag addOrThrow(Tuple record) {
        return add(record).orElseThrow(op("add"));
    }

    public Result<TupleBag> add(List<Tuple> records) {
        return returnSelf(ops().insertMany(ref(), records));
    }

    public TupleBag addOrThrow(List<Tuple> records) {
        return add(records).orElseThrow(op("add"));
    }

    /**
     * Insert unless the key is present; a duplicate bag instead refuses only an identical
     * record ({@code record_already_exists}).
     */
    public Result<TupleBag> addNew(Tuple record) {
        return returnSelf(ops().insertNew(ref(), record));
    }

    public TupleBag addNewOrThrow(Tuple record) {
        return addNew(record).orElseThrow(op("addNew"));
    }

    public Result<TupleBag> addNew(List<Tuple> records) {
        return returnSelf(ops().insertManyNew(ref(), records));
    }

    public TupleBag addNewOrThrow(List<Tuple> records) {
        return addNew(records).orElseThrow(op("addNew"));
    }

    /**
     * Remove every record stored under {@code key}.
     */
    public Result<TupleBag> delete(Object key) {
        return returnSelf(ops().delete(ref(), key));
    }

    public TupleBag deleteOrThrow(Object key) {
        return delete(key).orElseThrow(op("delete"));
    }

    // ---- reads

    public Result<List<Tuple>> lookup(Object key) {
        return ops().lookup(ref(), key);
    }

    public List<Tuple> lookupOrThrow(Object key) {
        return lookup(key).orElseThrow(op("lookup"));
    }

    public Result<List<Object>> lookupElement(Object key, int pos) {
        return ops().lookupElement(ref(), key, pos);
    }

    public List<Object> lookupElementOrThrow(Object key, int pos) {
        return lookupElement(key, pos).orElseThrow(op("lookupElement"));
    }
}
