package io.tupla.query;

import io.tupla.kernel.Tuple;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * Pattern compiled to a tree of closures. Produces the bindings of a matching record ordered
 * by variable number.
 */
public final class CompiledPattern implements Program<List<Object>> {

    @FunctionalInterface
    interface Matcher {
        boolean match(Object value, Object[] slots);
    }

    private final Matcher root;
    private final int[] variables;

    CompiledPattern(Matcher root, int[] variables) {
        this.root = root;
        this.variables = variables;
    }

    /**
     * Variable numbers bound by this pattern, ascending.
     */
    public int[] variables() {
        return variables.clone();
    }

    /**
     * Slot index of variable {@code $n}, or -1 when the pattern does not bind it.
     */
    int slotOf(int variable) {
        var index = Arrays.binarySearch(variables, variable);
        return index >= 0 ? index : -1;
    }

    int slotCount() {
        return variables.length;
    }

    /**
     * Match a record.
     *
     * @return the filled slots, or null if the record does not match
     */
    Object[] match(Tuple record) {
        var slots = new Object[variables.length];
        return root.match(record, slots) ? slots : null;
    }

    @Override
    public boolean apply(Tuple record, Consumer<? super List<Object>> sink) {
        var slots = match(record);
        if (slots == null) {
            return false;
        }
        sink.accept(bindings(slots));
        return true;
    }

    static List<Object> bindings(Object[] slots) {
        return Collections.unmodifiableList(Arrays.asList(slots));
    }
}
