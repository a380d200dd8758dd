package io.tupla.query;

import io.tupla.kernel.Tuple;

import java.util.ArrayList;
import java.util.List;

/**
 * Record pattern used by match and as the head of a match-spec clause.
 * <p>
 * Build patterns with the static helpers:
 * <pre>
 * Pattern p = Pattern.tuple(Pattern.var(1), "admin", Pattern.any());
 * </pre>
 * Plain values passed to {@link #tuple(Object...)} become literals. A variable that occurs more
 * than once must see equal values at every occurrence.
 */
public sealed interface Pattern permits Pattern.Literal, Pattern.Bind, Pattern.Ignore, Pattern.Nested {

    Ignore ANY = new Ignore();

    static Pattern any() {
        return ANY;
    }

    static Pattern var(int variable) {
        return new Bind(variable);
    }

    static Pattern literal(Object value) {
        return new Literal(value);
    }

    /**
     * Tuple pattern; each element is a {@link Pattern} or a literal value.
     */
    static Pattern tuple(Object... elements) {
        if (elements == null) {
            throw new IllegalArgumentException("elements required");
        }
        var patterns = new ArrayList<Pattern>(elements.length);
        for (var element : elements) {
            patterns.add(element instanceof Pattern p ? p : new Literal(element));
        }
        return new Nested(patterns);
    }

    /**
     * Matches a value equal to {@code value}; arrays and tuples compare by content.
     */
    record Literal(Object value) implements Pattern {
    }

    /**
     * Binds variable {@code $variable} to the value at this position.
     */
    record Bind(int variable) implements Pattern {
        public Bind {
            if (variable < 1) {
                throw new IllegalArgumentException("variable must be >= 1: " + variable);
            }
        }

        @Override
        public String toString() {
            return "$" + variable;
        }
    }

    /**
     * Matches anything without binding.
     */
    record Ignore() implements Pattern {
        @Override
        public String toString() {
            return "_";
        }
    }

    /**
     * Matches a {@link Tuple} of the same arity whose elements match element-wise.
     */
    record Nested(List<Pattern> elements) implements Pattern {
        public Nested {
            if (elements == null) {
                throw new IllegalArgumentException("elements required");
            }
            elements = List.copyOf(elements);
        }
    }
}
