package io.tupla.storage;

import io.tupla.core.ErrorReason;
import io.tupla.core.Layout;
import io.tupla.index.RangeIndex;
import io.tupla.kernel.Tuple;

import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;

/**
 * {@link Layout#ORDERED_SET}: one record per key, iterated in term order of the key.
 * <p>
 * Navigation methods return the neighbouring record, or null when there is none.
 */
public final class OrderedRecordStore implements RecordStore {
    private final int keyPos;
    private final RangeIndex index = new RangeIndex();

    OrderedRecordStore(int keyPos) {
        this.keyPos = keyPos;
    }

    @Override
    public Layout layout() {
        return Layout.ORDERED_SET;
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
        var record = index.lookup(key);
        return record == null ? List.of() : List.of(record);
    }

    @Override
    public boolean containsKey(Object key) {
        return index.containsKey(key);
    }

    @Override
    public int delete(Object key) {
        return index.remove(key) ? 1 : 0;
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
        return index.size();
    }

    @Override
    public List<Tuple> records() {
        return index.records();
    }

    public Tuple first() {
        return index.first();
    }

    public Tuple last() {
        return index.last();
    }

    public Tuple next(Object key) {
        return index.higher(key);
    }

    public Tuple previous(Object key) {
        return index.lower(key);
    }

    /**
     * Live view of the records with keys strictly after {@code key}, in key order. Valid only
     * while the table lock is held.
     */
    public Collection<Tuple> after(Object key) {
        return index.greaterThan(key);
    }

    /**
     * Live view of all records in key order. Valid only while the table lock is held.
     */
    public Collection<Tuple> view() {
        return index.all();
    }
}
