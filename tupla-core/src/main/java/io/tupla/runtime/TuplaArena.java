package io.tupla.runtime;

import io.tupla.core.Actor;
import io.tupla.core.ErrorReason;
import io.tupla.core.Layout;
import io.tupla.core.Result;
import io.tupla.core.TableOptions;
import io.tupla.core.TableRef;
import io.tupla.core.TuplaConfiguration;
import io.tupla.storage.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * An isolated table registry.
 * <p>
 * Multiple arenas can coexist in the same process, enabling:
 * <ul>
 * <li>Test isolation (fresh arena per test)</li>
 * <li>Independent name spaces (the same table name in two arenas)</li>
 * </ul>
 * <p>
 * Table references and names resolve only within the arena that created them. Closing an arena
 * deletes its tables. Most callers use {@link Tupla#defaultArena()}.
 */
public final class TuplaArena implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TuplaArena.class);

    private static final AtomicLong NEXT_ARENA_ID = new AtomicLong(1);

    private final long arenaId;
    private final TuplaConfiguration configuration;
    private final TableOperations operations;
    private final OwnershipProtocol ownership;
    private final Actor.TerminationListener terminationListener;

    // Arena-scoped state; name bindings live apart from table locks
    private final ConcurrentMap<Long, Table> tables = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Table> names = new ConcurrentHashMap<>();
    private final AtomicLong nextTableId = new AtomicLong(1);

    private final ReentrantReadWriteLock lifecycleLock = new ReentrantReadWriteLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public TuplaArena() {
        this(TuplaConfiguration.defaults());
    }

    public TuplaArena(TuplaConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.arenaId = NEXT_ARENA_ID.getAndIncrement();
        this.configuration = configuration;
        this.operations = new TableOperations(this);
        this.ownership = new OwnershipProtocol(this);
        this.terminationListener = new OwnerTerminationListener(ownership);
        Actor.addTerminationListener(terminationListener);
    }

    /**
     * Forwards owner terminations to an arena without keeping it reachable. Once the arena has
     * been collected the listener unregisters itself on the next termination.
     */
    private static final class OwnerTerminationListener implements Actor.TerminationListener {
        private final WeakReference<OwnershipProtocol> ownership;

        private OwnerTerminationListener(OwnershipProtocol ownership) {
            this.ownership = new WeakReference<>(ownership);
        }

        @Override
        public void onTerminated(Actor actor) {
            var target = ownership.get();
            if (target == null) {
                Actor.removeTerminationListener(this);
                return;
            }
            target.onOwnerTerminated(actor);
        }
    }

    /**
     * Get the unique ID of this arena.
     */
    public long arenaId() {
        return arenaId;
    }

    public TuplaConfiguration configuration() {
        return configuration;
    }

    public TableOperations operations() {
        return operations;
    }

    public OwnershipProtocol ownership() {
        return ownership;
    }

    /**
     * Create a table owned by the calling actor.
     *
     * @param layout  storage layout
     * @param options validated options
     * @return the new table, or {@link ErrorReason#TABLE_ALREADY_EXISTS} when the name is bound
     */
    public Result<Table> createTable(Layout layout, TableOptions options) {
        var violation = options.firstViolation();
        if (violation.isPresent()) {
            return Result.err(violation.get());
        }
        var readLock = lifecycleLock.readLock();
        readLock.lock();
        try {
            assertOpen();
            var ref = new TableRef(arenaId, nextTableId.getAndIncrement());
            var visibility = options.visibility() != null ? options.visibility() : configuration.defaultVisibility();
            var table = new Table(ref, layout, options, visibility, Actor.current(), configuration.fairLocks());
            if (options.name() != null && names.putIfAbsent(options.name(), table) != null) {
                return Result.err(ErrorReason.TABLE_ALREADY_EXISTS);
            }
            tables.put(ref.id(), table);
            log.debug("Created {} table {} owned by {}", layout, table, table.owner());
            return Result.ok(table);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Resolve a live table by reference.
     */
    public Optional<Table> find(TableRef ref) {
        if (ref == null || ref.arenaId() != arenaId) {
            return Optional.empty();
        }
        var readLock = lifecycleLock.readLock();
        readLock.lock();
        try {
            assertOpen();
            var table = tables.get(ref.id());
            return table == null || table.isDeleted() ? Optional.empty() : Optional.of(table);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Lock-free lookup of a live table, null when unknown, deleted or the arena is closed.
     * Safe to call while holding other locks.
     */
    Table peek(TableRef ref) {
        if (ref == null || ref.arenaId() != arenaId) {
            return null;
        }
        var table = tables.get(ref.id());
        return table == null || table.isDeleted() ? null : table;
    }

    /**
     * Resolve a live table by name.
     */
    public Optional<Table> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        var readLock = lifecycleLock.readLock();
        readLock.lock();
        try {
            assertOpen();
            var table = names.get(name);
            return table == null || table.isDeleted() ? Optional.empty() : Optional.of(table);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Live tables in creation order.
     */
    public List<Table> tables() {
        var readLock = lifecycleLock.readLock();
        readLock.lock();
        try {
            assertOpen();
            var live = new ArrayList<Table>(tables.size());
            for (var table : tables.values()) {
                if (!table.isDeleted()) {
                    live.add(table);
                }
            }
            live.sort(Comparator.comparingLong(t -> t.ref().id()));
            return live;
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Bind {@code table} to {@code newName}, releasing its old name. Call with the table's
     * write lock held.
     */
    Result<TableRef> rename(Table table, String newName) {
        var oldName = table.name();
        if (newName.equals(oldName)) {
            return Result.ok(table.ref());
        }
        var existing = names.putIfAbsent(newName, table);
        if (existing != null && existing != table) {
            return Result.err(ErrorReason.TABLE_ALREADY_EXISTS);
        }
        if (oldName != null) {
            names.remove(oldName, table);
        }
        table.rename(newName);
        log.debug("Renamed table {} from {} to {}", table.ref(), oldName, newName);
        return Result.ok(table.ref());
    }

    /**
     * Delete {@code table} and release its name.
     *
     * @return false if it was already deleted
     */
    boolean drop(Table table) {
        if (!table.markDeleted()) {
            return false;
        }
        tables.remove(table.ref().id(), table);
        var name = table.name();
        if (name != null) {
            names.remove(name, table);
        }
        log.debug("Deleted table {}", table);
        return true;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        var writeLock = lifecycleLock.writeLock();
        writeLock.lock();
        try {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            Actor.removeTerminationListener(terminationListener);
            for (var table : tables.values()) {
                table.markDeleted();
            }
            tables.clear();
            names.clear();
            log.debug("Closed arena {}", arenaId);
        } finally {
            writeLock.unlock();
        }
    }

    private void assertOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Arena is closed");
        }
    }
}
