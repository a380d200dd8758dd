package io.tupla.api;

import io.tupla.core.ErrorReason;
import io.tupla.core.Layout;
import io.tupla.core.TableOptions;
import io.tupla.core.TuplaException;
import io.tupla.core.Visibility;
import io.tupla.kernel.Tuple;
import io.tupla.runtime.TuplaArena;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TablesTest {

    private final TuplaArena arena = new TuplaArena();
    private final Tables tables = Tables.of(arena);

    @AfterEach
    void closeArena() {
        arena.close();
    }

    @Test
    void createWithExplicitLayout() {
        var ref = tables.createOrThrow(Layout.DUPLICATE_BAG, TableOptions.builder().name("raw").build());

        assertThat(tables.infoOrThrow(ref).layout()).isEqualTo(Layout.DUPLICATE_BAG);
        assertThat(tables.whereisOrThrow("raw")).isEqualTo(ref);
    }

    @Test
    void createFromOptionMap() {
        var ref = tables.createOrThrow(Layout.ORDERED_SET, Map.of("visibility", "public", "key_pos", 2));

        var info = tables.infoOrThrow(ref);
        assertThat(info.visibility()).isEqualTo(Visibility.PUBLIC);
        assertThat(info.keyPos()).isEqualTo(2);
        assertThat(tables.create(Layout.SET, Map.of("ordered", true)).error().option()).isEqualTo("ordered");
    }

    @Test
    void infoAllCoversLiveTables() {
        var first = tables.createOrThrow(Layout.SET, TableOptions.defaults());
        var second = tables.createOrThrow(Layout.BAG, TableOptions.defaults());

        assertThat(tables.infoAll().value()).containsOnlyKeys(first, second);
        assertThat(tables.allOrThrow()).containsExactly(first, second);
    }

    @Test
    void renameAndDelete() {
        var ref = tables.createOrThrow(Layout.SET, TableOptions.builder().name("before").build());

        tables.renameOrThrow(ref, "after");
        tables.deleteOrThrow(ref);

        assertThat(tables.whereis("after").error().reason()).isEqualTo(ErrorReason.TABLE_NOT_FOUND);
        assertThatThrownBy(() -> tables.deleteOrThrow(ref))
                .isInstanceOf(TuplaException.class)
                .hasMessage("Tables.delete returned error table_not_found");
    }

    @Test
    void toListReadsThroughReference() {
        var ref = tables.createOrThrow(Layout.SET, TableOptions.defaults());
        Records.of(arena).insertOrThrow(ref, Tuple.of("k", 1));

        assertThat(tables.toListOrThrow(ref)).containsExactly(Tuple.of("k", 1));
    }
}
