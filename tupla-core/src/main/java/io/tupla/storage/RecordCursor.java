package io.tupla.storage;

import io.tupla.index.HashIndex;
import io.tupla.kernel.Tuple;

import java.util.Iterator;

/**
 * Live walk over the records of an unordered table, restartable from {@link #sequence()} and
 * {@link #index()} through {@link Table#cursor(long, int)}. Valid only while the table lock is
 * held.
 */
public final class RecordCursor implements Iterator<Tuple> {
    private final HashIndex.Scan scan;

    RecordCursor(HashIndex.Scan scan) {
        this.scan = scan;
    }

    @Override
    public boolean hasNext() {
        return scan.hasNext();
    }

    @Override
    public Tuple next() {
        return scan.next();
    }

    /**
     * Insertion sequence of the key holding the next record.
     */
    public long sequence() {
        return scan.sequence();
    }

    /**
     * Position of the next record within its key's records.
     */
    public int index() {
        return scan.index();
    }
}
