package io.tupla.api;

import io.tupla.core.Layout;
import io.tupla.core.OptionParser;
import io.tupla.core.Result;
import io.tupla.core.TableKind;
import io.tupla.core.TableOptions;
import io.tupla.core.TableRef;
import io.tupla.kernel.Tuple;
import io.tupla.runtime.Tupla;
import io.tupla.runtime.TuplaArena;
import io.tupla.storage.Table;
import io.tupla.storage.TableInfo;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Table-level operations on any table of an arena, addressed by reference.
 */
public final class Tables {

    private final TuplaArena arena;

    private Tables(TuplaArena arena) {
        this.arena = arena;
    }

    public static Tables of(TuplaArena arena) {
        if (arena == null) {
            throw new IllegalArgumentException("arena required");
        }
        return new Tables(arena);
    }

    public static Tables inDefaultArena() {
        return of(Tupla.defaultArena());
    }

    /**
     * Create a table with an explicit layout.
     */
    public Result<TableRef> create(Layout layout, TableOptions options) {
        return Facades.create(arena, TableKind.RAW, layout, options).map(Table::ref);
    }

    /**
     * Create a table with an explicit layout from an option map. The layout options
     * ({@code ordered}, {@code duplicate}) are not accepted here.
     */
    public Result<TableRef> create(Layout layout, Map<String, ?> options) {
        if (layout == null) {
            throw new IllegalArgumentException("layout required");
        }
        return OptionParser.parse(TableKind.RAW, options)
                .flatMap(parsed -> arena.createTable(layout, parsed.options()))
                .map(Table::ref);
    }

    public TableRef createOrThrow(Layout layout, TableOptions options) {
        return create(layout, options).orElseThrow("Tables.create");
    }

    public TableRef createOrThrow(Layout layout, Map<String, ?> options) {
        return create(layout, options).orElseThrow("Tables.create");
    }

    /**
     * References of all live tables in creation order.
     */
    public Result<List<TableRef>> all() {
        return arena.operations().all();
    }

    public List<TableRef> allOrThrow() {
        return all().orElseThrow("Tables.all");
    }

    /**
     * Info for every live table, keyed by reference.
     */
    public Result<Map<TableRef, TableInfo>> infoAll() {
        return all().flatMap(refs -> {
            var infos = new LinkedHashMap<TableRef, TableInfo>();
            for (var ref : refs) {
                var info = arena.operations().info(ref);
                // deleted since listing
                if (info.isOk()) {
                    infos.put(ref, info.value());
                }
            }
            return Result.ok(infos);
        });
    }

    public Result<TableInfo> info(TableRef ref) {
        return arena.operations().info(ref);
    }

    public TableInfo infoOrThrow(TableRef ref) {
        return info(ref).orElseThrow("Tables.info");
    }

    public Result<Void> delete(TableRef ref) {
        return arena.operations().deleteTable(ref);
    }

    public void deleteOrThrow(TableRef ref) {
        delete(ref).orElseThrow("Tables.delete");
    }

    /**
     * Rebind the table to {@code newName}; the reference does not change.
     */
    public Result<TableRef> rename(TableRef ref, String newName) {
        return arena.operations().rename(ref, newName);
    }

    public TableRef renameOrThrow(TableRef ref, String newName) {
        return rename(ref, newName).orElseThrow("Tables.rename");
    }

    public Result<TableRef> whereis(String name) {
        return arena.operations().whereis(name);
    }

    public TableRef whereisOrThrow(String name) {
        return whereis(name).orElseThrow("Tables.whereis");
    }

    public Result<List<Tuple>> toList(TableRef ref) {
        return arena.operations().toList(ref);
    }

    public List<Tuple> toListOrThrow(TableRef ref) {
        return toList(ref).orElseThrow("Tables.toList");
    }
}
