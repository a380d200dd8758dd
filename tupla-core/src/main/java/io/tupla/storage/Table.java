package io.tupla.storage;

import io.tupla.core.Actor;
import io.tupla.core.Heir;
import io.tupla.core.Layout;
import io.tupla.core.TableOptions;
import io.tupla.core.TableRef;
import io.tupla.core.Visibility;
import io.tupla.index.HashIndex;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A table: identity, access metadata, a record store and the lock guarding it.
 * <p>
 * With {@code read_concurrency} the lock is a read/write lock so readers proceed in parallel;
 * otherwise a single exclusive lock serves both roles. Record contents are touched only while
 * holding {@link #readLock()} or {@link #writeLock()}. Ownership changes and deletion take the
 * write lock, so a writer that passed the access check under the lock sees a stable owner.
 */
public final class Table {
    private final TableRef ref;
    private final TableOptions options;
    private final Layout layout;
    private final Visibility visibility;
    private final RecordStore store;
    private final OrderedRecordStore orderedStore;
    private final HashIndex hashIndex;
    private final ValuePool pool;
    private final Lock readLock;
    private final Lock writeLock;

    private volatile String name;
    private volatile Actor owner;
    private volatile boolean deleted;

    // Bumped on every give away and ownership change; guarded by writeLock
    private long transferId;

    /**
     * @param ref        reference allocated by the arena
     * @param layout     storage layout
     * @param options    validated options
     * @param visibility resolved visibility (options may leave it unset)
     * @param owner      creating actor
     * @param fairLocks  whether the lock is fair
     */
    public Table(TableRef ref, Layout layout, TableOptions options, Visibility visibility,
                 Actor owner, boolean fairLocks) {
        if (ref == null) {
            throw new IllegalArgumentException("ref required");
        }
        if (layout == null) {
            throw new IllegalArgumentException("layout required");
        }
        if (options == null) {
            throw new IllegalArgumentException("options required");
        }
        if (visibility == null) {
            throw new IllegalArgumentException("visibility required");
        }
        if (owner == null) {
            throw new IllegalArgumentException("owner required");
        }
        this.ref = ref;
        this.layout = layout;
        this.options = options;
        this.visibility = visibility;
        this.owner = owner;
        this.name = options.name();
        var raw = RecordStore.create(layout, options.keyPos());
        this.orderedStore = raw instanceof OrderedRecordStore ordered ? ordered : null;
        if (raw instanceof HashRecordStore hash) {
            this.hashIndex = hash.index();
        } else if (raw instanceof BagRecordStore bag) {
            this.hashIndex = bag.index();
        } else {
            this.hashIndex = null;
        }
        this.pool = options.compressed() ? new ValuePool() : null;
        this.store = pool == null ? raw : new PooledRecordStore(raw, pool);
        if (options.readConcurrency()) {
            var rw = new ReentrantReadWriteLock(fairLocks);
            this.readLock = rw.readLock();
            this.writeLock = rw.writeLock();
        } else {
            var exclusive = new ReentrantLock(fairLocks);
            this.readLock = exclusive;
            this.writeLock = exclusive;
        }
    }

    public TableRef ref() {
        return ref;
    }

    public String name() {
        return name;
    }

    /**
     * Change the registered name. The arena keeps its name binding in sync.
     */
    public void rename(String newName) {
        this.name = newName;
    }

    public Layout layout() {
        return layout;
    }

    public int keyPos() {
        return options.keyPos();
    }

    public Visibility visibility() {
        return visibility;
    }

    public Heir heir() {
        return options.heir();
    }

    public TableOptions options() {
        return options;
    }

    public Actor owner() {
        return owner;
    }

    public boolean isOwner(Actor actor) {
        return owner == actor;
    }

    public boolean isDeleted() {
        return deleted;
    }

    public Lock readLock() {
        return readLock;
    }

    public Lock writeLock() {
        return writeLock;
    }

    /**
     * The record store. Only valid while one of the table locks is held.
     */
    public RecordStore store() {
        return store;
    }

    /**
     * The ordered store, or null when the layout is not ordered.
     */
    public OrderedRecordStore orderedStore() {
        return orderedStore;
    }

    /**
     * Walk the records of an unordered table from a saved position, {@code (0, 0)} for the
     * start. Call with a table lock held.
     *
     * @throws IllegalStateException for an ordered table
     */
    public RecordCursor cursor(long sequence, int index) {
        if (hashIndex == null) {
            throw new IllegalStateException("Ordered tables are walked by key");
        }
        return new RecordCursor(hashIndex.scan(sequence, index));
    }

    /**
     * Distinct values held by the pool of a compressed table, 0 otherwise.
     */
    int pooledValueCount() {
        return pool == null ? 0 : pool.size();
    }

    /**
     * Remove every record. Call with the write lock held.
     */
    public void clear() {
        store.clear();
    }

    /**
     * Mark the table deleted and drop its records.
     *
     * @return false if it was already deleted
     */
    public boolean markDeleted() {
        writeLock.lock();
        try {
            if (deleted) {
                return false;
            }
            deleted = true;
            clear();
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Start a transfer: returns the id a later {@link #completeTransfer} must present.
     * Starting a new transfer invalidates every earlier one. Call with the write lock held.
     */
    public long beginTransfer() {
        return ++transferId;
    }

    /**
     * Move ownership from {@code from} to {@code to} if the table is live, {@code from} still
     * owns it and {@code expectedTransferId} is the latest transfer.
     *
     * @return true if ownership moved
     */
    public boolean completeTransfer(Actor from, Actor to, long expectedTransferId) {
        writeLock.lock();
        try {
            if (deleted || owner != from || transferId != expectedTransferId) {
                return false;
            }
            owner = to;
            transferId++;
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Hand the table to {@code heir} unconditionally. Call with the write lock held.
     */
    public void inherit(Actor heir) {
        owner = heir;
        transferId++;
    }

    /**
     * Snapshot of this table's metadata.
     */
    public TableInfo info() {
        readLock.lock();
        try {
            var records = store.records();
            long memory = 0;
            for (var record : records) {
                memory += record.arity() + 1L;
            }
            return new TableInfo(ref, name, layout, options.keyPos(), visibility, owner, heir(),
                    records.size(), memory, options.readConcurrency(), options.writeConcurrency(),
                    options.compressed());
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public String toString() {
        return name == null ? ref.toString() : name + " " + ref;
    }
}
