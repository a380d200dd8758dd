package io.tupla.query;

import java.util.List;

/**
 * One clause of a {@link MatchSpec}: a head pattern, guards that must all evaluate to
 * {@code true}, and body expressions whose last value is the clause result.
 */
public record MatchClause(Pattern head, List<Expr> guards, List<Expr> body) {

    public MatchClause {
        if (head == null) {
            throw new IllegalArgumentException("head required");
        }
        if (guards == null) {
            throw new IllegalArgumentException("guards required");
        }
        if (body == null) {
            throw new IllegalArgumentException("body required");
        }
        guards = List.copyOf(guards);
        body = List.copyOf(body);
    }

    public static MatchClause of(Pattern head, Expr result) {
        return new MatchClause(head, List.of(), List.of(result));
    }

    public static MatchClause of(Pattern head, List<Expr> guards, Expr result) {
        return new MatchClause(head, guards, List.of(result));
    }
}
