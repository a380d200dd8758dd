package io.tupla.query;

import java.util.Collections;
import java.util.List;

/**
 * One page of match or select results and the cursor for the next page.
 *
 * @param results      results of this page, at most the requested limit
 * @param continuation cursor for the next page, {@link Continuation#end()} when exhausted
 * @param <R>          result type
 */
public record Page<R>(List<R> results, Continuation<R> continuation) {

    public Page {
        if (results == null) {
            throw new IllegalArgumentException("results required");
        }
        if (continuation == null) {
            throw new IllegalArgumentException("continuation required");
        }
        results = Collections.unmodifiableList(results);
    }

    public static <R> Page<R> last(List<R> results) {
        return new Page<>(results, Continuation.end());
    }

    public boolean hasMore() {
        return !continuation.isEnd();
    }
}
