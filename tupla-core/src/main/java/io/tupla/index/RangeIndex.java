package io.tupla.index;

import io.tupla.kernel.TermOrder;
import io.tupla.kernel.Tuple;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Unique-key index ordered by {@link TermOrder}.
 * <p>
 * Keys that compare equal under term order ({@code 1} and {@code 1.0}) are the same key. Not
 * thread-safe: the owning table's lock guards every call.
 */
public final class RangeIndex {
    private final TreeMap<Object, Tuple> index = new TreeMap<>(TermOrder.INSTANCE);

    /**
     * @return the replaced record, or null if the key was absent
     */
    public Tuple put(Object key, Tuple record) {
        if (record == null) {
            throw new IllegalArgumentException("record required");
        }
        return index.put(key, record);
    }

    public Tuple lookup(Object key) {
        return index.get(key);
    }

    public boolean containsKey(Object key) {
        return index.containsKey(key);
    }

    public boolean remove(Object key) {
        if (!index.containsKey(key)) {
            return false;
        }
        index.remove(key);
        return true;
    }

    public int removeIf(Predicate<? super Tuple> filter) {
        var before = index.size();
        index.values().removeIf(filter);
        return before - index.size();
    }

    public void clear() {
        index.clear();
    }

    public int size() {
        return index.size();
    }

    public Tuple first() {
        return value(index.firstEntry());
    }

    public Tuple last() {
        return value(index.lastEntry());
    }

    /**
     * Record with the smallest key strictly greater than {@code key}; the key need not exist.
     */
    public Tuple higher(Object key) {
        return value(index.higherEntry(key));
    }

    /**
     * Record with the greatest key strictly less than {@code key}; the key need not exist.
     */
    public Tuple lower(Object key) {
        return value(index.lowerEntry(key));
    }

    /**
     * Records with keys strictly greater than {@code key}, in key order.
     */
    public Collection<Tuple> greaterThan(Object key) {
        return index.tailMap(key, false).values();
    }

    public Collection<Tuple> all() {
        return index.values();
    }

    public List<Tuple> records() {
        return new ArrayList<>(index.values());
    }

    private static Tuple value(Map.Entry<Object, Tuple> entry) {
        return entry == null ? null : entry.getValue();
    }
}
