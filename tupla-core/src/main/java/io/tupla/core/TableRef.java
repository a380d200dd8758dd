package io.tupla.core;

/**
 * Opaque reference to a table, unique per creation within an arena.
 * <p>
 * A reference outlives renames; it goes stale when the table is deleted.
 *
 * @param arenaId the owning arena
 * @param id      the per-arena table id
 */
public record TableRef(long arenaId, long id) {

    @Override
    public String toString() {
        return "#Ref<" + arenaId + "." + id + ">";
    }
}
