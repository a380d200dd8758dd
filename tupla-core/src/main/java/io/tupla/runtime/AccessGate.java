package io.tupla.runtime;

import io.tupla.core.Actor;
import io.tupla.core.ErrorReason;
import io.tupla.core.TableError;
import io.tupla.storage.Table;

import java.util.Optional;

/**
 * Protection checks every read and write passes before touching storage.
 * <p>
 * The owner may always read and write. Others may read {@code PROTECTED} and {@code PUBLIC}
 * tables and write only {@code PUBLIC} ones.
 */
public final class AccessGate {

    private AccessGate() {
    }

    public static Optional<TableError> checkRead(Table table, Actor caller) {
        if (table.isOwner(caller) || table.visibility().readableByOthers()) {
            return Optional.empty();
        }
        return Optional.of(TableError.of(ErrorReason.READ_PROTECTED));
    }

    public static Optional<TableError> checkWrite(Table table, Actor caller) {
        if (table.isOwner(caller) || table.visibility().writableByOthers()) {
            return Optional.empty();
        }
        return Optional.of(TableError.of(ErrorReason.WRITE_PROTECTED));
    }
}
