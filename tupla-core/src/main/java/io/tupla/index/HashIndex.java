package io.tupla.index;

import io.tupla.kernel.Tuple;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NoSuchElementException;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Key to record-bucket index keeping keys and each bucket in insertion order.
 * <p>
 * Keys compare with {@code equals}/{@code hashCode}, except {@code byte[]} keys, which compare by
 * content. The null key is allowed. Each key gets a sequence number when its bucket is created;
 * a {@link Scan} walks buckets in sequence order and can be restarted from a saved position
 * without copying the index. Not thread-safe: the owning table's lock guards every call.
 */
public final class HashIndex {
    private final Map<Object, Bucket> index = new HashMap<>();
    private final NavigableMap<Long, Bucket> bySequence = new TreeMap<>();
    private long nextSequence;
    private int records;

    private static final class Bucket {
        private final Object key;
        private final long sequence;
        private final List<Tuple> records = new ArrayList<>(1);

        private Bucket(Object key, long sequence) {
            this.key = key;
            this.sequence = sequence;
        }
    }

    /**
     * Append a record to the key's bucket.
     */
    public void add(Object key, Tuple record) {
        if (record == null) {
            throw new IllegalArgumentException("record required");
        }
        bucketFor(normalize(key)).records.add(record);
        records++;
    }

    /**
     * Make {@code record} the only record stored under {@code key}. A replaced key keeps its
     * original position.
     *
     * @return the replaced record, or null if the key was absent
     */
    public Tuple put(Object key, Tuple record) {
        if (record == null) {
            throw new IllegalArgumentException("record required");
        }
        var bucket = bucketFor(normalize(key));
        if (bucket.records.isEmpty()) {
            bucket.records.add(record);
            records++;
            return null;
        }
        var previous = bucket.records.get(0);
        records -= bucket.records.size() - 1;
        bucket.records.clear();
        bucket.records.add(record);
        return previous;
    }

    /**
     * Remove all records for the given key from the index.
     *
     * @return number of records removed
     */
    public int removeAll(Object key) {
        var bucket = index.remove(normalize(key));
        if (bucket == null) {
            return 0;
        }
        bySequence.remove(bucket.sequence);
        records -= bucket.records.size();
        return bucket.records.size();
    }

    /**
     * Remove every record accepted by {@code filter}, across all keys.
     *
     * @return number of records removed
     */
    public int removeIf(Predicate<? super Tuple> filter) {
        var removed = 0;
        Iterator<Bucket> buckets = bySequence.values().iterator();
        while (buckets.hasNext()) {
            var bucket = buckets.next();
            var before = bucket.records.size();
            bucket.records.removeIf(filter);
            removed += before - bucket.records.size();
            if (bucket.records.isEmpty()) {
                buckets.remove();
                index.remove(bucket.key);
            }
        }
        records -= removed;
        return removed;
    }

    public void clear() {
        index.clear();
        bySequence.clear();
        records = 0;
    }

    public List<Tuple> lookup(Object key) {
        var bucket = index.get(normalize(key));
        return bucket == null ? List.of() : Collections.unmodifiableList(bucket.records);
    }

    public boolean containsKey(Object key) {
        return index.containsKey(normalize(key));
    }

    /**
     * Number of distinct keys.
     */
    public int size() {
        return index.size();
    }

    public int recordCount() {
        return records;
    }

    /**
     * Copy of all records, keys in insertion order and each bucket in insertion order.
     */
    public List<Tuple> records() {
        var all = new ArrayList<Tuple>(records);
        for (var bucket : bySequence.values()) {
            all.addAll(bucket.records);
        }
        return all;
    }

    /**
     * Live walk over all records in the order of {@link #records()}, starting at the record
     * {@code index} of the bucket with sequence {@code sequence}. When that bucket is gone the
     * walk starts at the next later bucket. {@code scan(0, 0)} walks everything.
     */
    public Scan scan(long sequence, int index) {
        return new Scan(sequence, index);
    }

    private Bucket bucketFor(Object normalized) {
        var bucket = index.get(normalized);
        if (bucket == null) {
            bucket = new Bucket(normalized, nextSequence++);
            index.put(normalized, bucket);
            bySequence.put(bucket.sequence, bucket);
        }
        return bucket;
    }

    private static Object normalize(Object key) {
        return key instanceof byte[] bytes ? new BinaryKey(bytes) : key;
    }

    /**
     * Iterator over a {@link HashIndex}. Valid only while the index is not modified.
     * {@link #sequence()} and {@link #index()} give the position of the next record, from which
     * {@link HashIndex#scan} resumes.
     */
    public final class Scan implements Iterator<Tuple> {
        private final Iterator<Bucket> buckets;
        private Bucket bucket;
        private int next;

        private Scan(long sequence, int index) {
            this.buckets = bySequence.tailMap(sequence, true).values().iterator();
            if (buckets.hasNext()) {
                bucket = buckets.next();
                next = bucket.sequence == sequence ? Math.max(index, 0) : 0;
            }
            skipExhausted();
        }

        @Override
        public boolean hasNext() {
            return bucket != null;
        }

        @Override
        public Tuple next() {
            if (bucket == null) {
                throw new NoSuchElementException();
            }
            var record = bucket.records.get(next++);
            skipExhausted();
            return record;
        }

        /**
         * Sequence of the bucket holding the next record. Once exhausted, the sequence the next
         * new key will get.
         */
        public long sequence() {
            return bucket == null ? nextSequence : bucket.sequence;
        }

        public int index() {
            return bucket == null ? 0 : next;
        }

        private void skipExhausted() {
            while (bucket != null && next >= bucket.records.size()) {
                bucket = buckets.hasNext() ? buckets.next() : null;
                next = 0;
            }
        }
    }

    private record BinaryKey(byte[] bytes) {
        @Override
        public boolean equals(Object obj) {
            return obj instanceof BinaryKey other && Arrays.equals(bytes, other.bytes);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(bytes);
        }
    }
}
