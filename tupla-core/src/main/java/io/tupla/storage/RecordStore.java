package io.tupla.storage;

import io.tupla.core.ErrorReason;
import io.tupla.core.Layout;
import io.tupla.kernel.Tuple;

import java.util.List;
import java.util.function.Predicate;

/**
 * Raw record storage for one layout.
 * <p>
 * Implementations are not thread-safe; {@link Table} guards them with its lock. Callers check
 * that a record is long enough for the key position before handing it over.
 */
public interface RecordStore {

    static RecordStore create(Layout layout, int keyPos) {
        if (layout == null) {
            throw new IllegalArgumentException("layout required");
        }
        if (keyPos < 1) {
            throw new IllegalArgumentException("keyPos must be >= 1: " + keyPos);
        }
        return switch (layout) {
            case SET -> new HashRecordStore(keyPos);
            case ORDERED_SET -> new OrderedRecordStore(keyPos);
            case BAG -> new BagRecordStore(keyPos, false);
            case DUPLICATE_BAG -> new BagRecordStore(keyPos, true);
        };
    }

    Layout layout();

    int keyPos();

    default Object keyOf(Tuple record) {
        return record.element(keyPos());
    }

    /**
     * Insert with the layout's overwrite rule: replace on unique layouts, append on bags
     * (a bag ignores a record identical to a stored one).
     */
    void insert(Tuple record);

    /**
     * Why an insert-if-absent of {@code record} would be refused.
     *
     * @return {@link ErrorReason#KEY_ALREADY_EXISTS}, {@link ErrorReason#RECORD_ALREADY_EXISTS},
     *         or null when the record may be inserted
     */
    ErrorReason conflict(Tuple record);

    /**
     * Records stored under {@code key}, in insertion order for bags.
     */
    List<Tuple> lookup(Object key);

    boolean containsKey(Object key);

    /**
     * @return number of records removed
     */
    int delete(Object key);

    int deleteIf(Predicate<? super Tuple> filter);

    void clear();

    /**
     * Number of records.
     */
    int size();

    /**
     * Copy of all records in iteration order: term order of keys when ordered, otherwise
     * insertion order of keys.
     */
    List<Tuple> records();
}
