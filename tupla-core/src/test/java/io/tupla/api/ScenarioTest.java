package io.tupla.api;

import io.tupla.core.Actor;
import io.tupla.core.ErrorReason;
import io.tupla.core.TuplaException;
import io.tupla.kernel.Tuple;
import io.tupla.runtime.TuplaArena;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static io.tupla.query.Pattern.ANY;
import static io.tupla.query.Pattern.tuple;
import static io.tupla.query.Pattern.var;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end walkthroughs of the public facades.
 */
class ScenarioTest {

    private final TuplaArena arena = new TuplaArena();

    @AfterEach
    void closeArena() {
        arena.close();
    }

    @Test
    void putOverwritesRecordWithSameKey() {
        var set = TupleSet.createOrThrow(arena, Map.of());

        set.putOrThrow(Tuple.of("k", 1)).putOrThrow(Tuple.of("k", 2));

        assertThat(set.getOrThrow("k")).isEqualTo(Tuple.of("k", 2));
        assertThat(set.toListOrThrow()).hasSize(1);
    }

    @Test
    void orderedSetNavigatesInKeyOrder() {
        var set = TupleSet.createOrThrow(arena, Map.of("ordered", true));
        set.putOrThrow(List.of(Tuple.of(3, "c"), Tuple.of(1, "a"), Tuple.of(2, "b")));

        assertThat(set.firstOrThrow()).isEqualTo(1);
        assertThat(set.nextOrThrow(1)).isEqualTo(2);
        assertThat(set.lastOrThrow()).isEqualTo(3);
        assertThat(set.previous(1).error().reason()).isEqualTo(ErrorReason.START_OF_TABLE);
        assertThatThrownBy(() -> set.previousOrThrow(1))
                .isInstanceOf(TuplaException.class)
                .hasMessage("TupleSet.previous returned error start_of_table");
    }

    @Test
    void bagKeepsInsertionOrderPerKey() {
        var bag = TupleBag.createOrThrow(arena, Map.of());

        bag.addOrThrow(Tuple.of("k", 1)).addOrThrow(Tuple.of("k", 2)).addOrThrow(Tuple.of("k", 1));

        assertThat(bag.lookupOrThrow("k")).containsExactly(Tuple.of("k", 1), Tuple.of("k", 2));
        assertThat(bag.lookupElementOrThrow("k", 2)).containsExactly(1, 2);
    }

    @Test
    void batchWithTooSmallRecordLeavesTableUnchanged() {
        var set = TupleSet.createOrThrow(arena, Map.of("key_pos", 2));
        set.putOrThrow(Tuple.of("a", 1));

        var result = set.put(List.of(Tuple.of("b", 2), Tuple.of("c")));

        assertThat(result.error().reason()).isEqualTo(ErrorReason.RECORD_TOO_SMALL);
        assertThat(set.toListOrThrow()).containsExactly(Tuple.of("a", 1));
    }

    @Test
    void giveAwayHandsPrivateTableToRecipient() {
        var a = Actor.spawn("a");
        var b = Actor.spawn("b");
        var set = a.call(() -> TupleSet.createOrThrow(arena, Map.of("visibility", "private")));
        a.run(() -> set.putOrThrow(Tuple.of("k", 1)));

        a.run(() -> set.giveAwayOrThrow(b, "p"));
        var transfer = b.call(() -> TupleSet.acceptOrThrow(arena, Duration.ofSeconds(1)));

        assertThat(transfer.gift()).isEqualTo("p");
        assertThat(transfer.from()).isSameAs(a);
        assertThat(transfer.inherited()).isFalse();
        assertThat(b.call(() -> transfer.table().getOrThrow("k"))).isEqualTo(Tuple.of("k", 1));
        assertThat(a.call(() -> set.giveAway(b, "p")).error().reason()).isEqualTo(ErrorReason.SENDER_NOT_TABLE_OWNER);
        assertThat(a.call(() -> set.put(Tuple.of("k", 2))).error().reason()).isEqualTo(ErrorReason.WRITE_PROTECTED);
    }

    @Test
    void matchPagesThroughOrderedSet() {
        var set = TupleSet.createOrThrow(arena, Map.of("ordered", true));
        set.putOrThrow(List.of(Tuple.of(1, "a"), Tuple.of(2, "b"), Tuple.of(3, "c")));

        var first = set.matchOrThrow(tuple(var(1), ANY), 2);
        var second = set.matchOrThrow(first.continuation());

        assertThat(first.results()).hasSize(2);
        assertThat(first.hasMore()).isTrue();
        assertThat(second.results()).hasSize(1);
        assertThat(second.continuation().isEnd()).isTrue();
        assertThat(set.matchOrThrow(second.continuation()).results()).isEmpty();
    }
}
