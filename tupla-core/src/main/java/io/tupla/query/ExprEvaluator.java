package io.tupla.query;

import io.tupla.kernel.TermOrder;
import io.tupla.kernel.Tuple;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Operator semantics for guards and bodies.
 * <p>
 * An operator applied to arguments it does not accept throws {@link EvaluationException}; a
 * guard that throws rejects the record. Integer arithmetic is exact: results widen from
 * {@code Integer} to {@code Long} to {@code BigInteger} as needed. {@link Op#DIVIDE} always
 * yields a {@code Double}.
 */
final class ExprEvaluator {

    private ExprEvaluator() {
    }

    /**
     * Raised when an operator cannot be applied. No stack trace: it is control flow.
     */
    static final class EvaluationException extends RuntimeException {
        EvaluationException(String message) {
            super(message, null, false, false);
        }
    }

    static Object apply(Op op, Object[] args) {
        return switch (op) {
            case EQ -> TermOrder.equal(args[0], args[1]);
            case NE -> !TermOrder.equal(args[0], args[1]);
            case EXACT_EQ -> exactlyEqual(args[0], args[1]);
            case EXACT_NE -> !exactlyEqual(args[0], args[1]);
            case LT -> TermOrder.INSTANCE.compare(args[0], args[1]) < 0;
            case LE -> TermOrder.INSTANCE.compare(args[0], args[1]) <= 0;
            case GT -> TermOrder.INSTANCE.compare(args[0], args[1]) > 0;
            case GE -> TermOrder.INSTANCE.compare(args[0], args[1]) >= 0;

            case AND, ANDALSO -> bool(op, args[0]) & bool(op, args[1]);
            case OR, ORELSE -> bool(op, args[0]) | bool(op, args[1]);
            case XOR -> bool(op, args[0]) ^ bool(op, args[1]);
            case NOT -> !bool(op, args[0]);

            case IS_NULL -> args[0] == null;
            case IS_NUMBER -> args[0] instanceof Number;
            case IS_INTEGER -> isIntegral(args[0]);
            case IS_FLOAT -> args[0] instanceof Double || args[0] instanceof Float
                    || args[0] instanceof BigDecimal;
            case IS_BOOLEAN -> args[0] instanceof Boolean;
            case IS_STRING -> args[0] instanceof CharSequence;
            case IS_BINARY -> args[0] instanceof byte[];
            case IS_TUPLE -> args[0] instanceof Tuple;
            case IS_LIST -> args[0] instanceof List<?>;
            case IS_MAP -> args[0] instanceof Map<?, ?>;

            case ADD, SUBTRACT, MULTIPLY, DIVIDE, DIV, REM -> arithmetic(op, number(op, args[0]), number(op, args[1]));
            case NEGATE -> arithmetic(Op.SUBTRACT, 0, number(op, args[0]));
            case ABS -> {
                var n = number(op, args[0]);
                yield TermOrder.INSTANCE.compare(n, 0) < 0 ? arithmetic(Op.SUBTRACT, 0, n) : n;
            }
            case MAX -> TermOrder.INSTANCE.compare(args[0], args[1]) >= 0 ? args[0] : args[1];
            case MIN -> TermOrder.INSTANCE.compare(args[0], args[1]) <= 0 ? args[0] : args[1];

            case ELEMENT -> element(args[0], args[1]);
            case TUPLE_SIZE -> tuple(op, args[0]).arity();
            case LENGTH -> list(op, args[0]).size();
            case MAP_SIZE -> map(op, args[0]).size();
            case MAP_GET -> {
                var map = map(op, args[1]);
                if (!map.containsKey(args[0])) {
                    throw new EvaluationException("map_get: no key " + args[0]);
                }
                yield map.get(args[0]);
            }
            case IS_MAP_KEY -> map(op, args[1]).containsKey(args[0]);
            case BYTE_SIZE -> {
                if (!(args[0] instanceof byte[] bytes)) {
                    throw badArgument(op, args[0]);
                }
                yield bytes.length;
            }
            case HD -> {
                var list = list(op, args[0]);
                if (list.isEmpty()) {
                    throw badArgument(op, args[0]);
                }
                yield list.get(0);
            }
            case TL -> {
                var list = list(op, args[0]);
                if (list.isEmpty()) {
                    throw badArgument(op, args[0]);
                }
                yield List.copyOf(list.subList(1, list.size()));
            }
        };
    }

    static boolean exactlyEqual(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return isIntegral(x) == isIntegral(y) && TermOrder.INSTANCE.compare(x, y) == 0;
        }
        return Objects.deepEquals(a, b);
    }

    private static Object element(Object position, Object value) {
        if (!isIntegral(position)) {
            throw badArgument(Op.ELEMENT, position);
        }
        var tuple = tuple(Op.ELEMENT, value);
        var pos = ((Number) position).longValue();
        if (pos < 1 || pos > tuple.arity()) {
            throw new EvaluationException("element: position " + pos + " outside 1.." + tuple.arity());
        }
        return tuple.element((int) pos);
    }

    private static Object arithmetic(Op op, Number a, Number b) {
        if (op == Op.DIVIDE) {
            var divisor = b.doubleValue();
            if (divisor == 0.0d) {
                throw new EvaluationException("division by zero");
            }
            return a.doubleValue() / divisor;
        }
        if (isIntegral(a) && isIntegral(b)) {
            return narrow(integerArithmetic(op, toBigInteger(a), toBigInteger(b)),
                    a instanceof Integer && b instanceof Integer);
        }
        if (op == Op.DIV || op == Op.REM) {
            throw new EvaluationException(op.symbol() + " requires integers");
        }
        if (a instanceof BigDecimal || b instanceof BigDecimal) {
            var x = toBigDecimal(a);
            var y = toBigDecimal(b);
            return switch (op) {
                case ADD -> x.add(y);
                case SUBTRACT -> x.subtract(y);
                case MULTIPLY -> x.multiply(y);
                default -> throw new IllegalStateException("not arithmetic: " + op);
            };
        }
        var x = a.doubleValue();
        var y = b.doubleValue();
        return switch (op) {
            case ADD -> x + y;
            case SUBTRACT -> x - y;
            case MULTIPLY -> x * y;
            default -> throw new IllegalStateException("not arithmetic: " + op);
        };
    }

    private static BigInteger integerArithmetic(Op op, BigInteger a, BigInteger b) {
        return switch (op) {
            case ADD -> a.add(b);
            case SUBTRACT -> a.subtract(b);
            case MULTIPLY -> a.multiply(b);
            case DIV, REM -> {
                if (b.signum() == 0) {
                    throw new EvaluationException("division by zero");
                }
                yield op == Op.DIV ? a.divide(b) : a.remainder(b);
            }
            default -> throw new IllegalStateException("not arithmetic: " + op);
        };
    }

    private static Number narrow(BigInteger value, boolean preferInt) {
        if (value.bitLength() < 32 && preferInt) {
            return value.intValue();
        }
        if (value.bitLength() < 64) {
            return value.longValue();
        }
        return value;
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
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
        return BigDecimal.valueOf(n.doubleValue());
    }

    private static boolean bool(Op op, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw badArgument(op, value);
    }

    private static Number number(Op op, Object value) {
        if (value instanceof Number n) {
            return n;
        }
        throw badArgument(op, value);
    }

    private static Tuple tuple(Op op, Object value) {
        if (value instanceof Tuple t) {
            return t;
        }
        throw badArgument(op, value);
    }

    private static List<?> list(Op op, Object value) {
        if (value instanceof List<?> l) {
            return l;
        }
        throw badArgument(op, value);
    }

    private static Map<?, ?> map(Op op, Object value) {
        if (value instanceof Map<?, ?> m) {
            return m;
        }
        throw badArgument(op, value);
    }

    private static EvaluationException badArgument(Op op, Object value) {
        return new EvaluationException(op.symbol() + ": bad argument " + value);
    }
}
