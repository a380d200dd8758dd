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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Key/value view of a set: every record is a {@code {key, value}} pair with the key first.
 * <p>
 * The {@code key_pos} option is refused, and {@link #wrapExisting} fails with
 * {@code invalid_keypos} on a set whose key is not at position 1.
 */
public final class KeyValueSet extends TableHandle<KeyValueSet> {

    private KeyValueSet(TuplaArena arena, Table table) {
        super(arena, table);
    }

    @Override
    KeyValueSet self() {
        return this;
    }

    // ---- creation

    public static Result<KeyValueSet> create() {
        return create(Tupla.defaultArena(), Map.of());
    }

    public static Result<KeyValueSet> create(Map<String, ?> options) {
        return create(Tupla.defaultArena(), options);
    }

    public static Result<KeyValueSet> create(TuplaArena arena, Map<String, ?> options) {
        return Facades.create(arena, TableKind.KEY_VALUE_SET, options).map(table -> new KeyValueSet(arena, table));
    }

    public static Result<KeyValueSet> create(TuplaArena arena, TableOptions options, boolean ordered) {
        return Facades.create(arena, TableKind.KEY_VALUE_SET, Layout.set(ordered), options)
                .map(table -> new KeyValueSet(arena, table));
    }

    public static KeyValueSet createOrThrow(Map<String, ?> options) {
        return create(options).orElseThrow("KeyValueSet.create");
    }

    public static KeyValueSet createOrThrow(TuplaArena arena, Map<String, ?> options) {
        return create(arena, options).orElseThrow("KeyValueSet.create");
    }

    public static Result<KeyValueSet> wrapExisting(TuplaArena arena, String name) {
        return Facades.wrap(arena, TableKind.KEY_VALUE_SET, name).map(table -> new KeyValueSet(arena, table));
    }

    public static Result<KeyValueSet> wrapExisting(TuplaArena arena, TableRef ref) {
        return Facades.wrap(arena, TableKind.KEY_VALUE_SET, ref).map(table -> new KeyValueSet(arena, table));
    }

    public static KeyValueSet wrapExistingOrThrow(TuplaArena arena, String name) {
        return wrapExisting(arena, name).orElseThrow("KeyValueSet.wrapExisting");
    }

    public static Result<Transfer<KeyValueSet>> accept(TuplaArena arena, Duration timeout) {
        return Facades.accept(arena, TableKind.KEY_VALUE_SET, timeout).flatMap(request ->
                wrapExisting(arena, request.table()).map(set ->
                        new Transfer<>(set, request.gift(), request.from(), request.inherited())));
    }

    public static Transfer<KeyValueSet> acceptOrThrow(TuplaArena arena, Duration timeout) {
        return accept(arena, timeout).orElseThrow("KeyValueSet.accept");
    }

    // ---- writes

    public Result<KeyValueSet> put(Object key, Object value) {
        return returnSelf(ops().insert(ref(), Tuple.of(key, value)));
    }

    public KeyValueSet putOrThrow(Object key, Object value) {
        return put(key, value).orElseThrow(op("put"));
    }

    /**
     * Insert every entry atomically.
     */
    public Result<KeyValueSet> putAll(Map<?, ?> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("entries required");
        }
        var records = new ArrayList<Tuple>(entries.size());
        for (var entry : entries.entrySet()) {
            records.add(Tuple.of(entry.getKey(), entry.getValue()));
        }
        return returnSelf(ops().insertMany(ref(), records));
    }

    public KeyValueSet putAllOrThrow(Map<?, ?> entries) {
        return putAll(entries).orElseThrow(op("putAll"));
    }

    public Result<KeyValueSet> putNew(Object key, Object value) {
        return returnSelf(ops().insertNew(ref(), Tuple.of(key, value)));
    }

    public KeyValueSet putNewOrThrow(Object key, Object value) {
        return putNew(key, value).orElseThrow(op("putNew"));
    }

    public Result<KeyValueSet> delete(Object key) {
        return returnSelf(ops().delete(ref(), key));
    }

    public KeyValueSet deleteOrThrow(Object key) {
        return delete(key).orElseThrow(op("delete"));
    }

    // ---- reads

    /**
     * The value stored under {@code key}, or null.
     */
    public Result<Object> get(Object key) {
        return get(key, null);
    }

    public Result<Object> get(Object key, Object defaultValue) {
        return ops().lookup(ref(), key)
                .map(records -> records.isEmpty() ? defaultValue : value(records.get(0)));
    }

    public Object getOrThrow(Object key) {
        return get(key).orElseThrow(op("get"));
    }

    public Object getOrThrow(Object key, Object defaultValue) {
        return get(key, defaultValue).orElseThrow(op("get"));
    }

    /**
     * All entries in table order.
     */
    public Result<Map<Object, Object>> toMap() {
        return toList().map(records -> {
            var map = new LinkedHashMap<Object, Object>();
            for (var record : records) {
                map.put(record.element(1), value(record));
            }
            return map;
        });
    }

    public Map<Object, Object> toMapOrThrow() {
        return toMap().orElseThrow(op("toMap"));
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

    private static Object value(Tuple record) {
        return record.arity() > 1 ? record.element(2) : null;
    }
}
