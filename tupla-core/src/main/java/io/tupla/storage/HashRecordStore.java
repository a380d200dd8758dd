package io.tupla.storage;

import io.tupla.core.ErrorReason;
import io.tupla.core.Layout;
import io.tupla.index.HashIndex;
import io.tupla.kernel.Tuple;

import java.util.List;
import java.util.function.Predicate;

/**
 * {@link Layout#SET}: one record per key, keys compared with {@code equals}.
 */
final class HashRecordStore implements RecordStore {
    private final int keyPos;
    private final HashIndex index = new HashIndex();

    HashRecordStore(int keyPos) {
        this.keyPos = keyPos;
    }

    @Override
    public Layout layout() {
        return Layout.SET;
    }

    @Override
    public int keyPos() {
        return keyPos;
    }

    @Override
    public void insert(Tuple record) {
        index.put(keyOf(record), record);
    }

    @Override
    public ErrorReason conflict(Tuple record) {
        return index.containsKey(keyOf(record)) ? ErrorReason.KEY_ALREADY_EXISTS : null;
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
