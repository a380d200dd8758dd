package io.tupla.query;

import io.tupla.core.Actor;
import io.tupla.core.Layout;
import io.tupla.core.TableOptions;
import io.tupla.core.TableRef;
import io.tupla.core.Visibility;
import io.tupla.kernel.Tuple;
import io.tupla.storage.Table;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.tupla.query.Pattern.ANY;
import static io.tupla.query.Pattern.tuple;
import static io.tupla.query.Pattern.var;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatchEngineTest {

    private static Table table(Layout layout, Object... keys) {
        var table = new Table(new TableRef(1, 1), layout, TableOptions.defaults(), Visibility.PUBLIC,
                Actor.current(), false);
        for (var key : keys) {
            table.store().insert(Tuple.of(key, "v" + key));
        }
        return table;
    }

    private static List<Object> results(List<?> results) {
        return new ArrayList<>(results);
    }

    private static CompiledPattern keys() {
        return PatternCompiler.compile(tuple(var(1), ANY)).value();
    }

    @Test
    void allVisitsOrderedTableInKeyOrder() {
        var table = table(Layout.ORDERED_SET, 3, 1, 2);

        assertThat(results(MatchEngine.all(table, keys()))).containsExactly(List.of(1), List.of(2), List.of(3));
    }

    @Test
    void orderedPagesResumeAfterLastKey() {
        var table = table(Layout.ORDERED_SET, 1, 2, 3);

        var first = MatchEngine.first(table, Continuation.Kind.MATCH, keys(), 2);
        table.store().insert(Tuple.of(0, "early"));
        var second = MatchEngine.resume(table, first.continuation());

        assertThat(results(first.results())).containsExactly(List.of(1), List.of(2));
        assertThat(first.hasMore()).isTrue();
        assertThat(results(second.results())).containsExactly(List.of(3));
        assertThat(second.continuation().isEnd()).isTrue();
    }

    @Test
    void exhaustedScanEndsOnFirstPage() {
        var page = MatchEngine.first(table(Layout.ORDERED_SET, 1, 2), Continuation.Kind.MATCH, keys(), 2);

        assertThat(page.results()).hasSize(2);
        assertThat(page.hasMore()).isFalse();
    }

    @Test
    void hashPagesWalkKeysInInsertionOrder() {
        var table = table(Layout.SET, "a", "b", "c");
        var pages = new ArrayList<Object>();

        var page = MatchEngine.first(table, Continuation.Kind.MATCH, keys(), 2);
        pages.addAll(page.results());
        while (page.hasMore()) {
            page = MatchEngine.resume(table, page.continuation());
            pages.addAll(page.results());
        }

        assertThat(pages).containsExactly(List.of("a"), List.of("b"), List.of("c"));
    }

    @Test
    void hashPagesResumeAtNextUnreadRecordDespiteEarlierDeletes() {
        var table = table(Layout.SET, "a", "b", "c", "d");

        var first = MatchEngine.first(table, Continuation.Kind.MATCH, keys(), 2);
        table.store().delete("a");
        table.store().insert(Tuple.of("e", "late"));
        var second = MatchEngine.resume(table, first.continuation());

        assertThat(results(first.results())).containsExactly(List.of("a"), List.of("b"));
        assertThat(results(second.results())).containsExactly(List.of("c"), List.of("d"));
        var third = MatchEngine.resume(table, second.continuation());
        assertThat(results(third.results())).containsExactly(List.of("e"));
        assertThat(third.hasMore()).isFalse();
    }

    @Test
    void bagPagesResumeInsideKey() {
        var table = new Table(new TableRef(1, 1), Layout.DUPLICATE_BAG, TableOptions.defaults(), Visibility.PUBLIC,
                Actor.current(), false);
        for (int i = 0; i < 3; i++) {
            table.store().insert(Tuple.of("k", i));
        }
        table.store().insert(Tuple.of("j", 9));
        var values = PatternCompiler.compile(tuple(ANY, var(1))).value();
        var collected = new ArrayList<Object>();

        var page = MatchEngine.first(table, Continuation.Kind.MATCH, values, 2);
        collected.addAll(page.results());
        while (page.hasMore()) {
            page = MatchEngine.resume(table, page.continuation());
            collected.addAll(page.results());
        }

        assertThat(collected).containsExactly(List.of(0), List.of(1), List.of(2), List.of(9));
    }

    @Test
    void pageMayHoldFewerResultsThanLimitWhenRecordsDoNotMatch() {
        var table = table(Layout.ORDERED_SET, 1, 2, 3, 4);
        var evens = PatternCompiler.compile(MatchSpec.records(tuple(var(1), ANY),
                Op.EQ.of(Op.REM.of(Expr.var(1), Expr.constant(2)), Expr.constant(0)))).value();

        var page = MatchEngine.first(table, Continuation.Kind.SELECT, evens, 2);

        assertThat(results(page.results())).containsExactly(Tuple.of(2, "v2"));
        assertThat(page.continuation().kind()).isEqualTo(Continuation.Kind.SELECT);
    }

    @Test
    void resumingEndGivesEmptyLastPage() {
        var page = MatchEngine.resume(table(Layout.SET), Continuation.<List<Object>>end());

        assertThat(page.results()).isEmpty();
        assertThat(page.hasMore()).isFalse();
    }

    @Test
    void countAndDeleteUseTrueResults() {
        var table = table(Layout.BAG, 1, 2, 3);
        var small = PatternCompiler.compile(MatchSpec.matching(tuple(var(1), ANY),
                Op.LT.of(Expr.var(1), Expr.constant(3)))).value();

        assertThat(MatchEngine.count(table, small)).isEqualTo(2);
        assertThat(MatchEngine.delete(table, small)).isEqualTo(2);
        assertThat(table.store().records()).containsExactly(Tuple.of(3, "v3"));
    }

    @Test
    void firstRejectsNonPositiveLimit() {
        assertThatThrownBy(() -> MatchEngine.first(table(Layout.SET), Continuation.Kind.MATCH, keys(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
