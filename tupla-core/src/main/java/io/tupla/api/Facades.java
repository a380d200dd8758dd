package io.tupla.api;

import io.tupla.core.ErrorReason;
import io.tupla.core.Layout;
import io.tupla.core.OptionParser;
import io.tupla.core.Result;
import io.tupla.core.TableError;
import io.tupla.core.TableKind;
import io.tupla.core.TableOptions;
import io.tupla.core.TableRef;
import io.tupla.runtime.TransferRequest;
import io.tupla.runtime.TuplaArena;
import io.tupla.storage.Table;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Creation, wrapping and accept shared by the facades.
 */
final class Facades {

    private Facades() {
    }

    static Result<Table> create(TuplaArena arena, TableKind kind, Map<String, ?> options) {
        return OptionParser.parse(kind, options)
                .flatMap(parsed -> arena.createTable(parsed.layout(), parsed.options()));
    }

    static Result<Table> create(TuplaArena arena, TableKind kind, Layout layout, TableOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options required");
        }
        if (!kind.accepts(layout)) {
            return Result.err(ErrorReason.INVALID_TYPE);
        }
        if (!kind.keyPosAllowed() && options.keyPos() != 1) {
            return Result.err(TableError.invalidOption(OptionParser.KEY_POS, options.keyPos()));
        }
        return arena.createTable(layout, options);
    }

    static Result<Table> wrap(TuplaArena arena, TableKind kind, String name) {
        return wrap(kind, arena.find(name));
    }

    static Result<Table> wrap(TuplaArena arena, TableKind kind, TableRef ref) {
        return wrap(kind, arena.find(ref));
    }

    private static Result<Table> wrap(TableKind kind, Optional<Table> found) {
        if (found.isEmpty()) {
            return Result.err(ErrorReason.TABLE_NOT_FOUND);
        }
        var table = found.get();
        if (!kind.accepts(table.layout())) {
            return Result.err(ErrorReason.INVALID_TYPE);
        }
        if (!kind.keyPosAllowed() && table.keyPos() != 1) {
            return Result.err(ErrorReason.INVALID_KEYPOS);
        }
        return Result.ok(table);
    }

    /**
     * Accept only offers of tables this kind can wrap; other offers stay queued.
     */
    static Result<TransferRequest> accept(TuplaArena arena, TableKind kind, Duration timeout) {
        return arena.ownership().accept(timeout, table -> kind.accepts(table.layout())
                && (kind.keyPosAllowed() || table.keyPos() == 1));
    }
}
