package io.tupla.query;

import io.tupla.kernel.Tuple;

import java.util.function.Consumer;

/**
 * A compiled pattern or match spec, applied to one record at a time.
 *
 * @param <R> the per-record result type
 */
public interface Program<R> {

    /**
     * Apply to {@code record}, passing the result to {@code sink} when the record matches.
     *
     * @return true if the record matched
     */
    boolean apply(Tuple record, Consumer<? super R> sink);
}
