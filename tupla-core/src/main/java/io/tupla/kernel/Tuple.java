package io.tupla.kernel;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Immutable fixed-arity record.
 * <p>
 * Elements are opaque values (null allowed). Positions are 1-indexed, matching the table key
 * position. Equality and hashing are deep, so array elements compare by content.
 */
public final class Tuple {
    private static final Tuple EMPTY = new Tuple(new Object[0]);

    private final Object[] elements;
    private int hash;

    private Tuple(Object[] elements) {
        this.elements = elements;
    }

    public static Tuple of(Object... elements) {
        if (elements == null) {
            throw new IllegalArgumentException("elements required");
        }
        if (elements.length == 0) {
            return EMPTY;
        }
        return new Tuple(elements.clone());
    }

    public static Tuple fromList(List<?> elements) {
        if (elements == null) {
            throw new IllegalArgumentException("elements required");
        }
        return elements.isEmpty() ? EMPTY : new Tuple(elements.toArray());
    }

    public int arity() {
        return elements.length;
    }

    /**
     * Element at a 1-indexed position.
     *
     * @throws IndexOutOfBoundsException if {@code pos} is outside {@code 1..arity()}
     */
    public Object element(int pos) {
        if (pos < 1 || pos > elements.length) {
            throw new IndexOutOfBoundsException("position " + pos + " outside 1.." + elements.length);
        }
        return elements[pos - 1];
    }

    public List<Object> elements() {
        return Collections.unmodifiableList(Arrays.asList(elements));
    }

    /**
     * Copy of this tuple with every element passed through {@code mapper}.
     */
    public Tuple map(UnaryOperator<Object> mapper) {
        var mapped = new Object[elements.length];
        for (var i = 0; i < elements.length; i++) {
            mapped[i] = mapper.apply(elements[i]);
        }
        return new Tuple(mapped);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Tuple other)) {
            return false;
        }
        return Arrays.deepEquals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        var h = hash;
        if (h == 0 && elements.length > 0) {
            h = Arrays.deepHashCode(elements);
            hash = h;
        }
        return h;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("{");
        for (var i = 0; i < elements.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            var element = elements[i];
            sb.append(element instanceof Object[] array ? Arrays.deepToString(array) : element);
        }
        return sb.append('}').toString();
    }
}
