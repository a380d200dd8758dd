package io.tupla.query;

import io.tupla.kernel.Tuple;

import java.util.List;
import java.util.function.Consumer;

/**
 * Match spec compiled to closures. Clauses are tried in order; the first whose head matches and
 * whose guards all yield {@code true} produces the result.
 */
public final class CompiledSpec implements Program<Object> {

    @FunctionalInterface
    interface Eval {
        Object eval(Tuple record, Object[] slots);
    }

    record Clause(CompiledPattern head, List<Eval> guards, List<Eval> body) {
    }

    private final List<Clause> clauses;

    CompiledSpec(List<Clause> clauses) {
        this.clauses = List.copyOf(clauses);
    }

    @Override
    public boolean apply(Tuple record, Consumer<? super Object> sink) {
        for (var clause : clauses) {
            var slots = clause.head().match(record);
            if (slots == null || !guardsPass(clause, record, slots)) {
                continue;
            }
            Object result = null;
            try {
                for (var expr : clause.body()) {
                    result = expr.eval(record, slots);
                }
            } catch (RuntimeException e) {
                // a failing body drops the record
                return false;
            }
            sink.accept(result);
            return true;
        }
        return false;
    }

    /**
     * Whether the match spec's result for {@code record} is {@code true}.
     */
    public boolean returnsTrue(Tuple record) {
        var holder = new Object[1];
        return apply(record, result -> holder[0] = result) && Boolean.TRUE.equals(holder[0]);
    }

    private static boolean guardsPass(Clause clause, Tuple record, Object[] slots) {
        try {
            for (var guard : clause.guards()) {
                if (!Boolean.TRUE.equals(guard.eval(record, slots))) {
                    return false;
                }
            }
            return true;
        } catch (RuntimeException e) {
            return false;
        }
    }
}
