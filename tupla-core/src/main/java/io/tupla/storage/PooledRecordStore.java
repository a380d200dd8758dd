package io.tupla.storage;

import io.tupla.core.ErrorReason;
import io.tupla.core.Layout;
import io.tupla.kernel.Tuple;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Store of a compressed table: records enter through a {@link ValuePool} and release their
 * pooled values on every path that drops them (delete, conditional delete, replacement, no-op
 * bag insert and clear).
 */
final class PooledRecordStore implements RecordStore {
    private final RecordStore delegate;
    private final ValuePool pool;

    PooledRecordStore(RecordStore delegate, ValuePool pool) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate required");
        }
        if (pool == null) {
            throw new IllegalArgumentException("pool required");
        }
        this.delegate = delegate;
        this.pool = pool;
    }

    @Override
    public Layout layout() {
        return delegate.layout();
    }

    @Override
    public int keyPos() {
        return delegate.keyPos();
    }

    @Override
    public void insert(Tuple record) {
        var key = keyOf(record);
        var before = identities(delegate.lookup(key));
        var interned = pool.intern(record);
        delegate.insert(interned);
        var after = identities(delegate.lookup(key));
        for (var old : before) {
            if (!after.contains(old)) {
                pool.release(old);
            }
        }
        if (!after.contains(interned)) {
            // bag already held an identical record
            pool.release(interned);
        }
    }

    @Override
    public ErrorReason conflict(Tuple record) {
        return delegate.conflict(record);
    }

    @Override
    public List<Tuple> lookup(Object key) {
        return delegate.lookup(key);
    }

    @Override
    public boolean containsKey(Object key) {
        return delegate.containsKey(key);
    }

    @Override
    public int delete(Object key) {
        var removed = delegate.lookup(key);
        var count = delegate.delete(key);
        removed.forEach(pool::release);
        return count;
    }

    @Override
    public int deleteIf(Predicate<? super Tuple> filter) {
        var removed = new ArrayList<Tuple>();
        var count = delegate.deleteIf(record -> {
            if (filter.test(record)) {
                removed.add(record);
                return true;
            }
            return false;
        });
        removed.forEach(pool::release);
        return count;
    }

    @Override
    public void clear() {
        delegate.clear();
        pool.clear();
    }

    @Override
    public int size() {
        return delegate.size();
    }

    @Override
    public List<Tuple> records() {
        return delegate.records();
    }

    private static Set<Tuple> identities(List<Tuple> records) {
        var set = Collections.newSetFromMap(new IdentityHashMap<Tuple, Boolean>());
        set.addAll(records);
        return set;
    }
}
