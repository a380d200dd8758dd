package io.tupla.api;

import io.tupla.core.Actor;
import io.tupla.core.ErrorReason;
import io.tupla.core.Result;
import io.tupla.core.TableRef;
import io.tupla.kernel.Tuple;
import io.tupla.query.Continuation;
import io.tupla.query.MatchSpec;
import io.tupla.query.Page;
import io.tupla.query.Pattern;
import io.tupla.runtime.TableOperations;
import io.tupla.runtime.TuplaArena;
import io.tupla.storage.Table;
import io.tupla.storage.TableInfo;

import java.util.List;

/**
 * Operations shared by every facade.
 * <p>
 * Each operation returns a {@link Result}; its {@code ...OrThrow} twin returns the value or
 * throws {@link io.tupla.core.TuplaException} naming the facade operation, e.g.
 * {@code TupleSet.put returned error write_protected}.
 *
 * @param <S> the concrete facade type returned by mutating operations
 */
public abstract class TableHandle<S extends TableHandle<S>> {

    private final TuplaArena arena;
    private final TableRef ref;
    private volatile TableInfo info;

    TableHandle(TuplaArena arena, Table table) {
        this.arena = arena;
        this.ref = table.ref();
        this.info = table.info();
    }

    abstract S self();

    public TableRef ref() {
        return ref;
    }

    public TuplaArena arena() {
        return arena;
    }

    TableOperations ops() {
        return arena.operations();
    }

    String op(String name) {
        return getClass().getSimpleName() + "." + name;
    }

    <T> Result<S> returnSelf(Result<T> result) {
        return result.map(ignored -> self());
    }

    // ---- info

    /**
     * Metadata captured when this facade was created.
     */
    public TableInfo info() {
        return info;
    }

    /**
     * Metadata, re-read from the table when {@code refresh} is set.
     */
    public Result<TableInfo> info(boolean refresh) {
        if (!refresh) {
            return Result.ok(info);
        }
        var fresh = ops().info(ref);
        if (fresh.isOk()) {
            info = fresh.value();
        }
        return fresh;
    }

    public TableInfo infoOrThrow(boolean refresh) {
        return info(refresh).orElseThrow(op("info"));
    }

    // ---- reads

    public Result<Boolean> hasKey(Object key) {
        return ops().hasKey(ref, key);
    }

    public boolean hasKeyOrThrow(Object key) {
        return hasKey(key).orElseThrow(op("hasKey"));
    }

    public Result<List<Tuple>> toList() {
        return ops().toList(ref);
    }

    public List<Tuple> toListOrThrow() {
        return toList().orElseThrow(op("toList"));
    }

    // ---- match / select

    public Result<List<List<Object>>> match(Pattern pattern) {
        return ops().match(ref, pattern);
    }

    public List<List<Object>> matchOrThrow(Pattern pattern) {
        return match(pattern).orElseThrow(op("match"));
    }

    public Result<Page<List<Object>>> match(Pattern pattern, int limit) {
        return ops().match(ref, pattern, limit);
    }

    public Page<List<Object>> matchOrThrow(Pattern pattern, int limit) {
        return match(pattern, limit).orElseThrow(op("match"));
    }

    /**
     * Next page of a paginated match started on this table.
     */
    public Result<Page<List<Object>>> match(Continuation<List<Object>> continuation) {
        var foreign = checkOwnCursor(continuation);
        return foreign != null ? foreign : ops().match(continuation);
    }

    public Page<List<Object>> matchOrThrow(Continuation<List<Object>> continuation) {
        return match(continuation).orElseThrow(op("match"));
    }

    public Result<List<Object>> select(MatchSpec spec) {
        return ops().select(ref, spec);
    }

    public List<Object> selectOrThrow(MatchSpec spec) {
        return select(spec).orElseThrow(op("select"));
    }

    public Result<Page<Object>> select(MatchSpec spec, int limit) {
        return ops().select(ref, spec, limit);
    }

    public Page<Object> selectOrThrow(MatchSpec spec, int limit) {
        return select(spec, limit).orElseThrow(op("select"));
    }

    public Result<Page<Object>> select(Continuation<Object> continuation) {
        var foreign = checkOwnCursor(continuation);
        return foreign != null ? foreign : ops().select(continuation);
    }

    public Page<Object> selectOrThrow(Continuation<Object> continuation) {
        return select(continuation).orElseThrow(op("select"));
    }

    /**
     * Remove every record for which {@code spec} returns {@code true}.
     *
     * @return number of records removed
     */
    public Result<Integer> selectDelete(MatchSpec spec) {
        return ops().selectDelete(ref, spec);
    }

    public int selectDeleteOrThrow(MatchSpec spec) {
        return selectDelete(spec).orElseThrow(op("selectDelete"));
    }

    public Result<Integer> selectCount(MatchSpec spec) {
        return ops().selectCount(ref, spec);
    }

    public int selectCountOrThrow(MatchSpec spec) {
        return selectCount(spec).orElseThrow(op("selectCount"));
    }

    // ---- deletes

    /**
     * Delete the whole table.
     */
    public Result<S> delete() {
        return returnSelf(ops().deleteTable(ref));
    }

    public S deleteOrThrow() {
        return delete().orElseThrow(op("delete"));
    }

    public Result<S> deleteAll() {
        return returnSelf(ops().deleteAll(ref));
    }

    public S deleteAllOrThrow() {
        return deleteAll().orElseThrow(op("deleteAll"));
    }

    // ---- ownership

    /**
     * Offer this table to {@code recipient}; ownership moves when the recipient accepts.
     */
    public Result<S> giveAway(Actor recipient, Object gift) {
        return returnSelf(arena.ownership().giveAway(ref, recipient, gift));
    }

    public S giveAwayOrThrow(Actor recipient, Object gift) {
        return giveAway(recipient, gift).orElseThrow(op("giveAway"));
    }

    private <R> Result<Page<R>> checkOwnCursor(Continuation<R> continuation) {
        if (continuation != null && !continuation.isEnd() && !ref.equals(continuation.table())) {
            return Result.err(ErrorReason.INVALID_CONTINUATION);
        }
        return null;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + (info.name() == null ? ref : info.name() + " " + ref) + "}";
    }
}
