package io.tupla.api;

import io.tupla.core.ErrorReason;
import io.tupla.core.Result;
import io.tupla.core.TableRef;
import io.tupla.kernel.Tuple;
import io.tupla.query.Pattern;
import io.tupla.runtime.Tupla;
import io.tupla.runtime.TuplaArena;

import java.util.List;

/**
 * Record operations on any table of an arena, addressed by reference, whatever its layout.
 */
public final class Records {

    private final TuplaArena arena;

    private Records(TuplaArena arena) {
        this.arena = arena;
    }

    public static Records of(TuplaArena arena) {
        if (arena == null) {
            throw new IllegalArgumentException("arena required");
        }
        return new Records(arena);
    }

    public static Records inDefaultArena() {
        return of(Tupla.defaultArena());
    }

    public Result<Void> insert(TableRef ref, Tuple record) {
        return arena.operations().insert(ref, record);
    }

    public void insertOrThrow(TableRef ref, Tuple record) {
        insert(ref, record).orElseThrow("Records.insert");
    }

    public Result<Void> insertNew(TableRef ref, Tuple record) {
        return arena.operations().insertNew(ref, record);
    }

    public void insertNewOrThrow(TableRef ref, Tuple record) {
        insertNew(ref, record).orElseThrow("Records.insertNew");
    }

    public Result<Void> insertMulti(TableRef ref, List<Tuple> records) {
        return arena.operations().insertMany(ref, records);
    }

    public void insertMultiOrThrow(TableRef ref, List<Tuple> records) {
        insertMulti(ref, records).orElseThrow("Records.insertMulti");
    }

    public Result<Void> insertMultiNew(TableRef ref, List<Tuple> records) {
        return arena.operations().insertManyNew(ref, records);
    }

    public void insertMultiNewOrThrow(TableRef ref, List<Tuple> records) {
        insertMultiNew(ref, records).orElseThrow("Records.insertMultiNew");
    }

    /**
     * The single record stored under {@code key}, null when absent, {@code multi_found} when
     * there are several.
     */
    public Result<Tuple> lookup(TableRef ref, Object key) {
        return arena.operations().lookup(ref, key).flatMap(records -> {
            if (records.size() > 1) {
                return Result.err(ErrorReason.MULTI_FOUND);
            }
            return Result.ok(records.isEmpty() ? null : records.get(0));
        });
    }

    public Tuple lookupOrThrow(TableRef ref, Object key) {
        return lookup(ref, key).orElseThrow("Records.lookup");
    }

    public Result<List<Tuple>> lookupMulti(TableRef ref, Object key) {
        return arena.operations().lookup(ref, key);
    }

    public List<Tuple> lookupMultiOrThrow(TableRef ref, Object key) {
        return lookupMulti(ref, key).orElseThrow("Records.lookupMulti");
    }

    public Result<List<List<Object>>> match(TableRef ref, Pattern pattern) {
        return arena.operations().match(ref, pattern);
    }

    public List<List<Object>> matchOrThrow(TableRef ref, Pattern pattern) {
        return match(ref, pattern).orElseThrow("Records.match");
    }
}
