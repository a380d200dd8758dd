package io.tupla.query;

import java.util.Arrays;

/**
 * Operators callable from guards and bodies.
 */
public enum Op {
    // Comparison; EQ/NE use term order (1 == 1.0), the exact forms do not
    EQ("==", 2),
    NE("/=", 2),
    EXACT_EQ("=:=", 2),
    EXACT_NE("=/=", 2),
    LT("<", 2),
    LE("=<", 2),
    GT(">", 2),
    GE(">=", 2),

    // Boolean
    AND("and", 2),
    OR("or", 2),
    XOR("xor", 2),
    NOT("not", 1),
    ANDALSO("andalso", 2),
    ORELSE("orelse", 2),

    // Type tests
    IS_NULL("is_null", 1),
    IS_NUMBER("is_number", 1),
    IS_INTEGER("is_integer", 1),
    IS_FLOAT("is_float", 1),
    IS_BOOLEAN("is_boolean", 1),
    IS_STRING("is_string", 1),
    IS_BINARY("is_binary", 1),
    IS_TUPLE("is_tuple", 1),
    IS_LIST("is_list", 1),
    IS_MAP("is_map", 1),

    // Arithmetic
    ADD("+", 2),
    SUBTRACT("-", 2),
    MULTIPLY("*", 2),
    DIVIDE("/", 2),
    DIV("div", 2),
    REM("rem", 2),
    NEGATE("-", 1),
    ABS("abs", 1),
    MAX("max", 2),
    MIN("min", 2),

    // Structure
    ELEMENT("element", 2),
    TUPLE_SIZE("tuple_size", 1),
    LENGTH("length", 1),
    MAP_SIZE("map_size", 1),
    MAP_GET("map_get", 2),
    IS_MAP_KEY("is_map_key", 2),
    BYTE_SIZE("byte_size", 1),
    HD("hd", 1),
    TL("tl", 1);

    private final String symbol;
    private final int arity;

    Op(String symbol, int arity) {
        this.symbol = symbol;
        this.arity = arity;
    }

    public String symbol() {
        return symbol;
    }

    public int arity() {
        return arity;
    }

    /**
     * Call expression applying this operator to {@code args}. The argument count is checked
     * when the match spec is compiled.
     */
    public Expr of(Expr... args) {
        return new Expr.Call(this, Arrays.asList(args));
    }
}
