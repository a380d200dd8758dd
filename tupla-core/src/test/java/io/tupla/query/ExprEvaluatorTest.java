package io.tupla.query;

import io.tupla.kernel.Tuple;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExprEvaluatorTest {

    private static Object apply(Op op, Object... args) {
        return ExprEvaluator.apply(op, args);
    }

    @Test
    void equalityFollowsTermOrderUnlessExact() {
        assertThat(apply(Op.EQ, 1, 1.0d)).isEqualTo(true);
        assertThat(apply(Op.EXACT_EQ, 1, 1.0d)).isEqualTo(false);
        assertThat(apply(Op.EXACT_EQ, 1, 1L)).isEqualTo(true);
        assertThat(apply(Op.EXACT_NE, "a", "b")).isEqualTo(true);
        assertThat(apply(Op.LT, 1, "a")).isEqualTo(true);
    }

    @Test
    void integerArithmeticWidensOnOverflow() {
        assertThat(apply(Op.ADD, 2, 3)).isEqualTo(5);
        assertThat(apply(Op.ADD, Integer.MAX_VALUE, 1)).isEqualTo(2_147_483_648L);
        assertThat(apply(Op.MULTIPLY, Long.MAX_VALUE, 2L)).isEqualTo(BigInteger.valueOf(Long.MAX_VALUE).shiftLeft(1));
        assertThat(apply(Op.NEGATE, 4)).isEqualTo(-4);
        assertThat(apply(Op.ABS, -7L)).isEqualTo(7L);
    }

    @Test
    void divisionForms() {
        assertThat(apply(Op.DIVIDE, 7, 2)).isEqualTo(3.5d);
        assertThat(apply(Op.DIV, 7, 2)).isEqualTo(3);
        assertThat(apply(Op.REM, -7, 2)).isEqualTo(-1);
        assertThatThrownBy(() -> apply(Op.DIV, 1, 0)).isInstanceOf(ExprEvaluator.EvaluationException.class);
        assertThatThrownBy(() -> apply(Op.DIVIDE, 1, 0.0d)).isInstanceOf(ExprEvaluator.EvaluationException.class);
        assertThatThrownBy(() -> apply(Op.DIV, 1.5d, 1)).isInstanceOf(ExprEvaluator.EvaluationException.class);
    }

    @Test
    void floatingAndDecimalArithmetic() {
        assertThat(apply(Op.ADD, 1, 0.5d)).isEqualTo(1.5d);
        assertThat(apply(Op.MULTIPLY, new BigDecimal("1.10"), 2)).isEqualTo(new BigDecimal("2.20"));
    }

    @Test
    void booleanOperatorsRequireBooleans() {
        assertThat(apply(Op.XOR, true, false)).isEqualTo(true);
        assertThat(apply(Op.NOT, false)).isEqualTo(true);
        assertThatThrownBy(() -> apply(Op.AND, 1, true)).isInstanceOf(ExprEvaluator.EvaluationException.class);
    }

    @Test
    void typeTests() {
        assertThat(apply(Op.IS_INTEGER, BigInteger.TEN)).isEqualTo(true);
        assertThat(apply(Op.IS_FLOAT, 1)).isEqualTo(false);
        assertThat(apply(Op.IS_BINARY, new byte[0])).isEqualTo(true);
        assertThat(apply(Op.IS_TUPLE, Tuple.of())).isEqualTo(true);
        assertThat(apply(Op.IS_NULL, (Object) null)).isEqualTo(true);
        assertThat(apply(Op.IS_STRING, "s")).isEqualTo(true);
    }

    @Test
    void structuralOperators() {
        var tuple = Tuple.of("a", "b");
        var map = Map.of("k", 1);

        assertThat(apply(Op.ELEMENT, 2, tuple)).isEqualTo("b");
        assertThat(apply(Op.TUPLE_SIZE, tuple)).isEqualTo(2);
        assertThat(apply(Op.LENGTH, List.of(1, 2, 3))).isEqualTo(3);
        assertThat(apply(Op.HD, List.of(1, 2))).isEqualTo(1);
        assertThat(apply(Op.TL, List.of(1, 2))).isEqualTo(List.of(2));
        assertThat(apply(Op.MAP_GET, "k", map)).isEqualTo(1);
        assertThat(apply(Op.IS_MAP_KEY, "z", map)).isEqualTo(false);
        assertThat(apply(Op.BYTE_SIZE, new byte[3])).isEqualTo(3);
        assertThat(apply(Op.MAX, 1, "a")).isEqualTo("a");
        assertThat(apply(Op.MIN, 1, 2.0d)).isEqualTo(1);
    }

    @Test
    void structuralOperatorsRejectBadArguments() {
        assertThatThrownBy(() -> apply(Op.ELEMENT, 3, Tuple.of("a"))).isInstanceOf(ExprEvaluator.EvaluationException.class);
        assertThatThrownBy(() -> apply(Op.HD, List.of())).isInstanceOf(ExprEvaluator.EvaluationException.class);
        assertThatThrownBy(() -> apply(Op.MAP_GET, "z", Map.of())).isInstanceOf(ExprEvaluator.EvaluationException.class);
        assertThatThrownBy(() -> apply(Op.TUPLE_SIZE, List.of())).isInstanceOf(ExprEvaluator.EvaluationException.class);
    }
}
