package io.tupla.query;

import java.util.Arrays;
import java.util.List;

/**
 * Ordered list of clauses; the first clause whose head matches and whose guards pass decides
 * a record's result.
 */
public record MatchSpec(List<MatchClause> clauses) {

    public MatchSpec {
        if (clauses == null) {
            throw new IllegalArgumentException("clauses required");
        }
        clauses = List.copyOf(clauses);
    }

    public static MatchSpec of(MatchClause... clauses) {
        return new MatchSpec(Arrays.asList(clauses));
    }

    /**
     * Single clause returning the whole record when {@code head} matches and all guards pass.
     */
    public static MatchSpec records(Pattern head, Expr... guards) {
        return of(MatchClause.of(head, Arrays.asList(guards), Expr.record()));
    }

    /**
     * Single clause returning {@code true} when {@code head} matches and all guards pass; the
     * shape select-delete and select-count look for.
     */
    public static MatchSpec matching(Pattern head, Expr... guards) {
        return of(MatchClause.of(head, Arrays.asList(guards), Expr.constant(true)));
    }
}
