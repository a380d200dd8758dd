package io.tupla.runtime;

import io.tupla.core.Actor;
import io.tupla.core.ErrorReason;
import io.tupla.core.Layout;
import io.tupla.core.TableOptions;
import io.tupla.core.TuplaConfiguration;
import io.tupla.core.Visibility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.lang.ref.WeakReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TuplaArenaTest {

    private final TuplaArena arena = new TuplaArena();

    @AfterEach
    void closeArena() {
        arena.close();
    }

    @Test
    void createTableAssignsOwnerAndDefaultVisibility() {
        var table = arena.createTable(Layout.SET, TableOptions.defaults()).value();

        assertThat(table.owner()).isSameAs(Actor.current());
        assertThat(table.visibility()).isEqualTo(Visibility.PROTECTED);
        assertThat(table.ref().arenaId()).isEqualTo(arena.arenaId());
        assertThat(arena.find(table.ref())).contains(table);
    }

    @Test
    void configuredDefaultVisibilityApplies() {
        try (var other = new TuplaArena(TuplaConfiguration.builder().defaultVisibility(Visibility.PUBLIC).build())) {
            var table = other.createTable(Layout.BAG, TableOptions.defaults()).value();

            assertThat(table.visibility()).isEqualTo(Visibility.PUBLIC);
        }
    }

    @Test
    void namesAreUniqueWithinArena() {
        var options = TableOptions.builder().name("users").build();
        var table = arena.createTable(Layout.SET, options).value();

        assertThat(arena.createTable(Layout.SET, options).error().reason()).isEqualTo(ErrorReason.TABLE_ALREADY_EXISTS);
        assertThat(arena.find("users")).contains(table);
    }

    @Test
    void sameNameMayExistInTwoArenas() {
        var options = TableOptions.builder().name("shared").build();
        try (var other = new TuplaArena()) {
            assertThat(arena.createTable(Layout.SET, options).isOk()).isTrue();
            assertThat(other.createTable(Layout.SET, options).isOk()).isTrue();
        }
    }

    @Test
    void referencesDoNotResolveInOtherArenas() {
        var table = arena.createTable(Layout.SET, TableOptions.defaults()).value();
        try (var other = new TuplaArena()) {
            assertThat(other.find(table.ref())).isEmpty();
        }
    }

    @Test
    void droppedTableReleasesNameAndReference() {
        var table = arena.createTable(Layout.SET, TableOptions.builder().name("gone").build()).value();

        assertThat(arena.drop(table)).isTrue();
        assertThat(arena.drop(table)).isFalse();
        assertThat(arena.find(table.ref())).isEmpty();
        assertThat(arena.find("gone")).isEmpty();
        assertThat(arena.createTable(Layout.SET, TableOptions.builder().name("gone").build()).isOk()).isTrue();
    }

    @Test
    void tablesListsLiveTablesInCreationOrder() {
        var first = arena.createTable(Layout.SET, TableOptions.defaults()).value();
        var second = arena.createTable(Layout.BAG, TableOptions.defaults()).value();
        var third = arena.createTable(Layout.ORDERED_SET, TableOptions.defaults()).value();
        arena.drop(second);

        assertThat(arena.tables()).containsExactly(first, third);
    }

    @Test
    void closeDeletesTablesAndRejectsFurtherUse() {
        var table = arena.createTable(Layout.SET, TableOptions.defaults()).value();

        arena.close();

        assertThat(arena.isClosed()).isTrue();
        assertThat(table.isDeleted()).isTrue();
        assertThatThrownBy(() -> arena.createTable(Layout.SET, TableOptions.defaults()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Arena is closed");
    }

    @Test
    void defaultArenaIsShared() {
        assertThat(Tupla.defaultArena()).isSameAs(Tupla.defaultArena());
        assertThat(Tupla.defaultArena().configuration().acceptTimeout().toMillis()).isEqualTo(2000L);
    }

    @Test
    void unclosedArenaIsNotPinnedByTerminationListener() throws InterruptedException {
        var abandoned = new WeakReference<>(abandonedArena());

        for (int attempt = 0; attempt < 100 && abandoned.get() != null; attempt++) {
            System.gc();
            Thread.sleep(10);
        }

        assertThat(abandoned.get()).isNull();
        Actor.spawn("later").terminate();
    }

    private static TuplaArena abandonedArena() {
        var abandoned = new TuplaArena();
        abandoned.createTable(Layout.SET, TableOptions.defaults());
        return abandoned;
    }
}
