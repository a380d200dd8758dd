package io.tupla.runtime;

import io.tupla.core.Actor;
import io.tupla.core.ErrorReason;
import io.tupla.core.Result;
import io.tupla.core.TableRef;
import io.tupla.storage.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Hand-off of table ownership between actors.
 * <p>
 * The owner offers a table with {@link #giveAway}, which posts a {@link TransferRequest} to the
 * recipient's mailbox; ownership moves only when the recipient calls {@link #accept}. A newer
 * offer for the same table makes older ones stale. When an owner terminates, each of its tables
 * passes to a live heir or is deleted.
 */
public final class OwnershipProtocol {
    private static final Logger log = LoggerFactory.getLogger(OwnershipProtocol.class);

    private final TuplaArena arena;

    OwnershipProtocol(TuplaArena arena) {
        this.arena = arena;
    }

    /**
     * Offer {@code ref} to {@code recipient}. Must be called by the owner.
     */
    public Result<Void> giveAway(TableRef ref, Actor recipient, Object gift) {
        try {
            return offer(ref, recipient, gift);
        } catch (RuntimeException e) {
            log.error("Unknown error in {} on table {}", "giveAway", ref, e);
            return Result.err(ErrorReason.UNKNOWN_ERROR);
        }
    }

    private Result<Void> offer(TableRef ref, Actor recipient, Object gift) {
        var found = arena.find(ref);
        if (found.isEmpty()) {
            return Result.err(ErrorReason.TABLE_NOT_FOUND);
        }
        var table = found.get();
        var sender = Actor.current();
        TransferRequest request;
        var lock = table.writeLock();
        lock.lock();
        try {
            if (table.isDeleted()) {
                return Result.err(ErrorReason.TABLE_NOT_FOUND);
            }
            if (!table.isOwner(sender)) {
                return Result.err(ErrorReason.SENDER_NOT_TABLE_OWNER);
            }
            if (recipient == sender) {
                return Result.err(ErrorReason.RECIPIENT_ALREADY_OWNS_TABLE);
            }
            if (recipient == null || !recipient.isAlive()) {
                return Result.err(ErrorReason.RECIPIENT_NOT_ALIVE);
            }
            request = new TransferRequest(ref, sender, gift, table.beginTransfer(), false);
        } finally {
            lock.unlock();
        }
        // mailbox locks are never taken while a table lock is held
        recipient.mailbox().post(request);
        log.debug("Table {} offered by {} to {}", table, sender, recipient);
        return Result.ok(null);
    }

    /**
     * Accept an offered table with the configured default timeout.
     */
    public Result<TransferRequest> accept(Predicate<Table> filter) {
        return accept(arena.configuration().acceptTimeout(), filter);
    }

    /**
     * Wait for an offer of a table accepted by {@code filter} and take ownership of it.
     * <p>
     * Stale offers for this arena are discarded while waiting; offers the filter rejects stay
     * in the mailbox. An interrupt ends the wait like a timeout, with the interrupt flag kept.
     *
     * @param timeout maximum wait
     * @param filter  which tables the caller is prepared to take
     * @return the accepted offer, or {@link ErrorReason#TIMEOUT}
     */
    public Result<TransferRequest> accept(Duration timeout, Predicate<Table> filter) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative: " + timeout);
        }
        try {
            return awaitOffer(timeout, filter);
        } catch (RuntimeException e) {
            log.error("Unknown error in {} on table {}", "accept", null, e);
            return Result.err(ErrorReason.UNKNOWN_ERROR);
        }
    }

    private Result<TransferRequest> awaitOffer(Duration timeout, Predicate<Table> filter) {
        var self = Actor.current();
        var deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            var remaining = Duration.ofNanos(Math.max(0L, deadline - System.nanoTime()));
            TransferRequest request;
            try {
                request = self.mailbox()
                        .receive(TransferRequest.class, r -> wanted(r, filter), remaining)
                        .orElse(null);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Result.err(ErrorReason.TIMEOUT);
            }
            if (request == null) {
                return Result.err(ErrorReason.TIMEOUT);
            }
            var table = arena.find(request.table()).orElse(null);
            if (table == null) {
                log.debug("Discarded offer of deleted table {}", request.table());
                continue;
            }
            if (request.inherited()) {
                if (table.isOwner(self)) {
                    return Result.ok(request);
                }
                log.debug("Discarded stale inheritance of {}", table);
                continue;
            }
            if (table.completeTransfer(request.from(), self, request.transferId())) {
                log.debug("Table {} accepted by {} from {}", table, self, request.from());
                return Result.ok(request);
            }
            log.debug("Discarded stale offer of {} from {}", table, request.from());
        }
    }

    /**
     * Pass every table owned by {@code owner} to its heir, or delete it when there is no live
     * heir. Registered as an {@link Actor.TerminationListener} by the arena.
     */
    void onOwnerTerminated(Actor owner) {
        if (arena.isClosed()) {
            return;
        }
        for (var table : arena.tables()) {
            if (table.isOwner(owner)) {
                inheritOrDelete(table, owner);
            }
        }
    }

    private void inheritOrDelete(Table table, Actor owner) {
        var heir = table.heir();
        var lock = table.writeLock();
        lock.lock();
        try {
            if (table.isDeleted() || !table.isOwner(owner)) {
                return;
            }
            if (heir.isNone() || heir.actor() == owner || !heir.actor().isAlive()) {
                arena.drop(table);
                return;
            }
            table.inherit(heir.actor());
        } finally {
            lock.unlock();
        }
        heir.actor().mailbox().post(new TransferRequest(table.ref(), owner, heir.payload(), 0L, true));
        log.debug("Table {} inherited by {} from {}", table, heir.actor(), owner);
    }

    private boolean wanted(TransferRequest request, Predicate<Table> filter) {
        if (request.table().arenaId() != arena.arenaId()) {
            return false;
        }
        // runs under the mailbox lock, so no lifecycle or table lock may be taken here
        var table = arena.peek(request.table());
        // stale offers are taken so that accept can discard them
        return table == null || filter.test(table);
    }
}
