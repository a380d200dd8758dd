package io.tupla.kernel;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Total order over arbitrary key values, used by ordered tables.
 * <p>
 * Values are ranked by category first:
 * <pre>
 * null &lt; numbers &lt; booleans &lt; characters &lt; strings &lt; enums &lt; byte[]
 *      &lt; tuples &lt; lists &lt; maps &lt; other
 * </pre>
 * Numbers compare by numeric value regardless of boxed type, so {@code 1}, {@code 1L} and
 * {@code 1.0} are the same key. Tuples compare by arity, then element-wise. Lists compare
 * element-wise with a shorter prefix first. Maps compare by size, then by sorted keys, then
 * by the values of those keys. Values of other types compare by class name, then with
 * {@link Comparable#compareTo} when both share a comparable class, and finally by
 * {@code toString()}.
 */
public final class TermOrder implements Comparator<Object> {

    public static final TermOrder INSTANCE = new TermOrder();

    private static final int NULL = 0;
    private static final int NUMBER = 1;
    private static final int BOOLEAN = 2;
    private static final int CHARACTER = 3;
    private static final int STRING = 4;
    private static final int ENUM = 5;
    private static final int BYTES = 6;
    private static final int TUPLE = 7;
    private static final int LIST = 8;
    private static final int MAP = 9;
    private static final int OTHER = 10;

    private static final int NEGATIVE_INFINITY = 0;
    private static final int FINITE = 1;
    private static final int POSITIVE_INFINITY = 2;
    private static final int NOT_A_NUMBER = 3;

    private TermOrder() {
    }

    public static boolean equal(Object a, Object b) {
        return INSTANCE.compare(a, b) == 0;
    }

    @Override
    public int compare(Object a, Object b) {
        if (a == b) {
            return 0;
        }
        var rankA = rank(a);
        var rankB = rank(b);
        if (rankA != rankB) {
            return Integer.compare(rankA, rankB);
        }
        return switch (rankA) {
            case NUMBER -> compareNumbers((Number) a, (Number) b);
            case BOOLEAN -> Boolean.compare((Boolean) a, (Boolean) b);
            case CHARACTER -> Character.compare((Character) a, (Character) b);
            case STRING -> CharSequence.compare((CharSequence) a, (CharSequence) b);
            case ENUM -> compareEnums((Enum<?>) a, (Enum<?>) b);
            case BYTES -> Arrays.compareUnsigned((byte[]) a, (byte[]) b);
            case TUPLE -> compareTuples((Tuple) a, (Tuple) b);
            case LIST -> compareLists((List<?>) a, (List<?>) b);
            case MAP -> compareMaps((Map<?, ?>) a, (Map<?, ?>) b);
            default -> compareOther(a, b);
        };
    }

    private static int rank(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof Number) {
            return NUMBER;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof Character) {
            return CHARACTER;
        }
        if (value instanceof CharSequence) {
            return STRING;
        }
        if (value instanceof Enum<?>) {
            return ENUM;
        }
        if (value instanceof byte[]) {
            return BYTES;
        }
        if (value instanceof Tuple) {
            return TUPLE;
        }
        if (value instanceof List<?>) {
            return LIST;
        }
        if (value instanceof Map<?, ?>) {
            return MAP;
        }
        return OTHER;
    }

    static int compareNumbers(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            if (a instanceof BigInteger || b instanceof BigInteger) {
                return toBigInteger(a).compareTo(toBigInteger(b));
            }
            return Long.compare(a.longValue(), b.longValue());
        }
        var rankA = finiteRank(a);
        var rankB = finiteRank(b);
        if (rankA != FINITE || rankB != FINITE) {
            return Integer.compare(rankA, rankB);
        }
        return toBigDecimal(a).compareTo(toBigDecimal(b));
    }

    /**
     * Infinities sit outside every finite number, big ones included; NaN sorts above +Infinity.
     */
    private static int finiteRank(Number n) {
        if (n instanceof Double || n instanceof Float) {
            var d = n.doubleValue();
            if (Double.isNaN(d)) {
                return NOT_A_NUMBER;
            }
            if (Double.isInfinite(d)) {
                return d > 0 ? POSITIVE_INFINITY : NEGATIVE_INFINITY;
            }
        }
        return FINITE;
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short
                || n instanceof Byte || n instanceof BigInteger;
    }


    private static BigInteger toBigInteger(Number n) {
        return n instanceof BigInteger big ? big : BigInteger.valueOf(n.longValue());
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal decimal) {
            return decimal;
        }
        if (n instanceof BigInteger big) {
            return new BigDecimal(big);
        }
        if (isIntegral(n)) {
            return BigDecimal.valueOf(n.longValue());
        }
        if (n instanceof Double || n instanceof Float) {
            return new BigDecimal(n.doubleValue());
        }
        try {
            return new BigDecimal(n.toString());
        } catch (NumberFormatException e) {
            return new BigDecimal(n.doubleValue());
        }
    }

    private static int compareEnums(Enum<?> a, Enum<?> b) {
        var byClass = a.getDeclaringClass().getName().compareTo(b.getDeclaringClass().getName());
        return byClass != 0 ? byClass : Integer.compare(a.ordinal(), b.ordinal());
    }

    private int compareTuples(Tuple a, Tuple b) {
        if (a.arity() != b.arity()) {
            return Integer.compare(a.arity(), b.arity());
        }
        for (var pos = 1; pos <= a.arity(); pos++) {
            var cmp = compare(a.element(pos), b.element(pos));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    private int compareLists(List<?> a, List<?> b) {
        var n = Math.min(a.size(), b.size());
        for (var i = 0; i < n; i++) {
            var cmp = compare(a.get(i), b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    private int compareMaps(Map<?, ?> a, Map<?, ?> b) {
        if (a.size() != b.size()) {
            return Integer.compare(a.size(), b.size());
        }
        List<Object> keysA = new ArrayList<>(a.keySet());
        List<Object> keysB = new ArrayList<>(b.keySet());
        keysA.sort(this);
        keysB.sort(this);
        var byKeys = compareLists(keysA, keysB);
        if (byKeys != 0) {
            return byKeys;
        }
        for (var i = 0; i < keysA.size(); i++) {
            var cmp = compare(a.get(keysA.get(i)), b.get(keysB.get(i)));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compareOther(Object a, Object b) {
        var classA = a.getClass();
        var classB = b.getClass();
        if (classA != classB) {
            return classA.getName().compareTo(classB.getName());
        }
        if (a instanceof Comparable comparable) {
            return comparable.compareTo(b);
        }
        return a.toString().compareTo(b.toString());
    }
}
