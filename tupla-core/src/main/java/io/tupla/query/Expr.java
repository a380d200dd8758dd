package io.tupla.query;

import java.util.Arrays;
import java.util.List;

/**
 * Guard and body expressions of a match-spec clause.
 */
public sealed interface Expr
        permits Expr.Var, Expr.Const, Expr.WholeRecord, Expr.AllBindings, Expr.TupleOf, Expr.Call {

    static Expr var(int variable) {
        return new Var(variable);
    }

    static Expr constant(Object value) {
        return new Const(value);
    }

    /**
     * {@code $_}: the whole matched record.
     */
    static Expr record() {
        return new WholeRecord();
    }

    /**
     * {@code $$}: all bindings ordered by variable number.
     */
    static Expr bindings() {
        return new AllBindings();
    }

    static Expr tuple(Expr... elements) {
        return new TupleOf(Arrays.asList(elements));
    }

    record Var(int variable) implements Expr {
        public Var {
            if (variable < 1) {
                throw new IllegalArgumentException("variable must be >= 1: " + variable);
            }
        }
    }

    record Const(Object value) implements Expr {
    }

    record WholeRecord() implements Expr {
    }

    record AllBindings() implements Expr {
    }

    record TupleOf(List<Expr> elements) implements Expr {
        public TupleOf {
            if (elements == null) {
                throw new IllegalArgumentException("elements required");
            }
            elements = List.copyOf(elements);
        }
    }

    record Call(Op op, List<Expr> args) implements Expr {
        public Call {
            if (op == null) {
                throw new IllegalArgumentException("op required");
            }
            if (args == null) {
                throw new IllegalArgumentException("args required");
            }
            args = List.copyOf(args);
        }
    }
}
