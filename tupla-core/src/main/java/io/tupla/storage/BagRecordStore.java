package io.tupla.storage;

import io.tupla.core.ErrorReason;
import io.tupla.core.Layout;
import io.tupla.index.HashIndex;
import io.tupla.kernel.Tuple;

import java.util.List;
import java.util.function.Predicate;

/**
 * {@link Layout#BAG} and {@link Layout#DUPLICATE_BAG}: many records per key.
 * <p>
 * A plain bag keeps at most one copy of an identical record; a duplicate bag keeps them all.
 */
final class BagRecordStore implements RecordStore {
    private final int keyPos;
    private final boolean duplicates;
    private final HashIndex index = new HashIndex();

    BagRecordStore(int keyPos, boolean duplicates) {
        this.keyPos = keyPos;
        this.duplicates = duplicates;
    }

    @Override
    public Layout layout() {
        return Layout.bag(duplicates);
    }

    @Override
    public int keyPos() {
        return keyPos;
    }

    @Override
    public void insert(Tuple record) {
        var key = keyOf(record);
        if (!duplicates && index.lookup(key).contains(record)) {
            return;
        }
        index.add(key, record);
    }

    @Override
    public ErrorReason conflict(Tuple record) {
        var bucket = index.lookup(keyOf(record));
        if (bucket.isEmpty()) {
            return null;
        }
        if (duplicates) {
            return bucket.contains(record) ? ErrorReason.RECORD_ALREADY_EXISTS : null;
        }
        return ErrorReason.KEY_ALREADY_EXISTS;
    }

    @Override
    public List<Tuple> lookup(Object key) {
        return List.copyOf(index.lookup(key));
    }

    @Override
    public boolean containsKey(Object key) {
        return index.containsKey(key);
    }

    @Override
    public int delete(Object key) {
        return index.removeAll(key);
    }

    @Override
    public int deleteIf(Predicate<? super Tuple> filter) {
        return index.removeIf(filter);
    }

    @Override
    public void clear() {
        index.clear();
    }

    @Override
    public int size() {
        return index.recordCount();
    }

    @Override
    public List<Tuple> records() {
        return index.records();
    }

    HashIndex index() {
        return index;
    }
}
