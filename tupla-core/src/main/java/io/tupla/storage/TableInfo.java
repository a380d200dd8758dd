package io.tupla.storage;

import io.tupla.core.Actor;
import io.tupla.core.Heir;
import io.tupla.core.Layout;
import io.tupla.core.TableRef;
import io.tupla.core.Visibility;

/**
 * Point-in-time snapshot of a table's metadata.
 *
 * @param ref              table reference
 * @param name             registered name, null for unnamed tables
 * @param layout           storage layout
 * @param keyPos           1-indexed key position
 * @param visibility       protection level
 * @param owner            owning actor
 * @param heir             heir, {@link Heir#NONE} when unset
 * @param size             number of records
 * @param memory           estimated footprint in words (one per element plus one per record)
 * @param readConcurrency  read concurrency hint
 * @param writeConcurrency write concurrency hint
 * @param compressed       whether element values are pooled
 */
public record TableInfo(
        TableRef ref,
        String name,
        Layout layout,
        int keyPos,
        Visibility visibility,
        Actor owner,
        Heir heir,
        int size,
        long memory,
        boolean readConcurrency,
        boolean writeConcurrency,
        boolean compressed) {
}
