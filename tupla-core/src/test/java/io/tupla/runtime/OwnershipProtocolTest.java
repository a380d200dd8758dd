package io.tupla.runtime;

import io.tupla.core.Actor;
import io.tupla.core.ErrorReason;
import io.tupla.core.Heir;
import io.tupla.core.Layout;
import io.tupla.core.TableOptions;
import io.tupla.core.TableRef;
import io.tupla.core.Visibility;
import io.tupla.kernel.Tuple;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@Timeout(value = 10, unit = TimeUnit.SECONDS)
class OwnershipProtocolTest {

    private static final Duration SHORT = Duration.ofMillis(50);

    private final TuplaArena arena = new TuplaArena();
    private final OwnershipProtocol ownership = arena.ownership();

    @AfterEach
    void closeArena() {
        arena.close();
    }

    private TableRef createAs(Actor owner, TableOptions options) {
        return owner.call(() -> arena.createTable(Layout.SET, options)).value().ref();
    }

    private Actor ownerOf(TableRef ref) {
        return arena.find(ref).orElseThrow().owner();
    }

    @Test
    void giveAwayMovesOwnershipOnAccept() {
        var a = Actor.spawn("a");
        var b = Actor.spawn("b");
        var ref = createAs(a, TableOptions.builder().visibility(Visibility.PRIVATE).build());

        assertThat(a.call(() -> ownership.giveAway(ref, b, "payload")).isOk()).isTrue();
        assertThat(ownerOf(ref)).isSameAs(a);

        var accepted = b.call(() -> ownership.accept(SHORT, table -> true)).value();

        assertThat(accepted.table()).isEqualTo(ref);
        assertThat(accepted.from()).isSameAs(a);
        assertThat(accepted.gift()).isEqualTo("payload");
        assertThat(accepted.inherited()).isFalse();
        assertThat(ownerOf(ref)).isSameAs(b);
    }

    @Test
    void formerOwnerLosesRights() {
        var a = Actor.spawn("a");
        var b = Actor.spawn("b");
        var ref = createAs(a, TableOptions.builder().visibility(Visibility.PRIVATE).build());
        a.call(() -> ownership.giveAway(ref, b, null));
        b.call(() -> ownership.accept(SHORT, table -> true));

        assertThat(a.call(() -> ownership.giveAway(ref, b, null)).error().reason())
                .isEqualTo(ErrorReason.SENDER_NOT_TABLE_OWNER);
        assertThat(a.call(() -> arena.operations().insert(ref, Tuple.of("k"))).error().reason())
                .isEqualTo(ErrorReason.WRITE_PROTECTED);
        assertThat(b.call(() -> arena.operations().insert(ref, Tuple.of("k"))).isOk()).isTrue();
    }

    @Test
    void giveAwayValidatesSenderAndRecipient() {
        var a = Actor.spawn("a");
        var b = Actor.spawn("b");
        var dead = Actor.spawn("dead");
        dead.terminate();
        var ref = createAs(a, TableOptions.defaults());

        assertThat(b.call(() -> ownership.giveAway(ref, a, null)).error().reason())
                .isEqualTo(ErrorReason.SENDER_NOT_TABLE_OWNER);
        assertThat(a.call(() -> ownership.giveAway(ref, a, null)).error().reason())
                .isEqualTo(ErrorReason.RECIPIENT_ALREADY_OWNS_TABLE);
        assertThat(a.call(() -> ownership.giveAway(ref, dead, null)).error().reason())
                .isEqualTo(ErrorReason.RECIPIENT_NOT_ALIVE);
        assertThat(a.call(() -> ownership.giveAway(new TableRef(arena.arenaId(), 999), b, null)).error().reason())
                .isEqualTo(ErrorReason.TABLE_NOT_FOUND);
    }

    @Test
    void newerOfferMakesOlderOneStale() {
        var a = Actor.spawn("a");
        var b = Actor.spawn("b");
        var c = Actor.spawn("c");
        var ref = createAs(a, TableOptions.defaults());
        a.call(() -> ownership.giveAway(ref, b, "first"));
        a.call(() -> ownership.giveAway(ref, c, "second"));

        assertThat(b.call(() -> ownership.accept(SHORT, table -> true)).error().reason())
                .isEqualTo(ErrorReason.TIMEOUT);
        assertThat(b.mailbox().size()).isZero();
        assertThat(c.call(() -> ownership.accept(SHORT, table -> true)).value().gift()).isEqualTo("second");
        assertThat(ownerOf(ref)).isSameAs(c);
    }

    @Test
    void offerOfDeletedTableIsDiscarded() {
        var a = Actor.spawn("a");
        var b = Actor.spawn("b");
        var ref = createAs(a, TableOptions.defaults());
        a.call(() -> ownership.giveAway(ref, b, null));
        a.call(() -> arena.operations().deleteTable(ref));

        assertThat(b.call(() -> ownership.accept(SHORT, table -> true)).error().reason())
                .isEqualTo(ErrorReason.TIMEOUT);
        assertThat(b.mailbox().size()).isZero();
    }

    @Test
    void rejectedOffersStayQueued() {
        var a = Actor.spawn("a");
        var b = Actor.spawn("b");
        var ref = createAs(a, TableOptions.defaults());
        a.call(() -> ownership.giveAway(ref, b, null));

        assertThat(b.call(() -> ownership.accept(SHORT, table -> table.layout() == Layout.BAG)).error().reason())
                .isEqualTo(ErrorReason.TIMEOUT);
        assertThat(b.mailbox().size()).isEqualTo(1);
        assertThat(b.call(() -> ownership.accept(SHORT, table -> true)).isOk()).isTrue();
    }

    @Test
    void acceptWaitsForOfferFromAnotherThread() throws Exception {
        var a = Actor.spawn("a");
        var b = Actor.spawn("b");
        var ref = createAs(a, TableOptions.defaults());
        var executor = Executors.newSingleThreadExecutor();
        try {
            var pending = executor.submit(() -> b.call(() -> ownership.accept(Duration.ofSeconds(5), table -> true)));
            Thread.sleep(50);
            a.call(() -> ownership.giveAway(ref, b, "late"));

            assertThat(pending.get(5, TimeUnit.SECONDS).value().gift()).isEqualTo("late");
        } finally {
            executor.shutdownNow();
        }
        assertThat(ownerOf(ref)).isSameAs(b);
    }

    @Test
    void interruptEndsWaitAndKeepsFlag() {
        Thread.currentThread().interrupt();
        try {
            var result = ownership.accept(Duration.ofSeconds(5), table -> true);

            assertThat(result.error().reason()).isEqualTo(ErrorReason.TIMEOUT);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void heirInheritsWhenOwnerTerminates() {
        var owner = Actor.spawn("owner");
        var heir = Actor.spawn("heir");
        var ref = createAs(owner, TableOptions.builder().heir(Heir.of(heir, "inheritance")).build());

        owner.terminate();

        assertThat(ownerOf(ref)).isSameAs(heir);
        var notice = heir.call(() -> ownership.accept(SHORT, table -> true)).value();
        assertThat(notice.inherited()).isTrue();
        assertThat(notice.gift()).isEqualTo("inheritance");
        assertThat(notice.from()).isSameAs(owner);
    }

    @Test
    void tableWithoutLiveHeirIsDeletedWithOwner() {
        var owner = Actor.spawn("owner");
        var heir = Actor.spawn("heir");
        var orphan = createAs(owner, TableOptions.defaults());
        var heirless = createAs(owner, TableOptions.builder().heir(Heir.of(heir, null)).build());
        heir.terminate();

        owner.terminate();

        assertThat(arena.find(orphan)).isEmpty();
        assertThat(arena.find(heirless)).isEmpty();
    }

    @Test
    void acceptedTableFollowsNewOwnerOnTermination() {
        var a = Actor.spawn("a");
        var b = Actor.spawn("b");
        var ref = createAs(a, TableOptions.defaults());
        a.call(() -> ownership.giveAway(ref, b, null));
        b.call(() -> ownership.accept(SHORT, table -> true));

        a.terminate();
        assertThat(arena.find(ref)).isPresent();

        b.terminate();
        assertThat(arena.find(ref)).isEmpty();
    }

    @Test
    void closedArenaGivesUnknownErrorInsteadOfThrowing() {
        var a = Actor.spawn("a");
        var b = Actor.spawn("b");
        var ref = createAs(a, TableOptions.defaults());
        a.call(() -> ownership.giveAway(ref, b, null));

        arena.close();

        assertThat(a.call(() -> ownership.giveAway(ref, b, null)).error().reason())
                .isEqualTo(ErrorReason.UNKNOWN_ERROR);
        assertThat(b.call(() -> ownership.accept(SHORT, table -> true)).error().reason())
                .isEqualTo(ErrorReason.UNKNOWN_ERROR);
    }

    @Test
    void acceptDoesNotBlockPostersWhileArenaCloses() throws Exception {
        var a = Actor.spawn("a");
        var b = Actor.spawn("b");
        var ref = createAs(a, TableOptions.defaults());
        a.call(() -> ownership.giveAway(ref, b, null));
        var table = arena.find(ref).orElseThrow();
        var executor = Executors.newFixedThreadPool(2);
        var held = true;
        table.writeLock().lock();
        try {
            var closing = executor.submit(arena::close);
            while (!arena.isClosed()) {
                Thread.sleep(1);
            }
            var accepting = executor.submit(() -> b.call(() -> ownership.accept(Duration.ofSeconds(5), t -> true)));
            while (b.mailbox().size() > 0) {
                Thread.sleep(1);
            }

            b.mailbox().post("ping");
            table.writeLock().unlock();
            held = false;

            closing.get(5, TimeUnit.SECONDS);
            assertThat(accepting.get(5, TimeUnit.SECONDS).error().reason()).isEqualTo(ErrorReason.UNKNOWN_ERROR);
            assertThat(b.mailbox().size()).isEqualTo(1);
        } finally {
            if (held) {
                table.writeLock().unlock();
            }
            executor.shutdownNow();
        }
    }
}
