package com.jpyq.ast;

/**
 * Binding strength of Python expressions, weakest first. Used by the {@link Unparser} to decide
 * where parentheses are needed.
 */
public enum Precedence {
    NAMED_EXPR,
    TUPLE,
    YIELD,
    TEST,
    OR,
    AND,
    NOT,
    CMP,
    EXPR,
    BXOR,
    BAND,
    SHIFT,
    ARITH,
    TERM,
    FACTOR,
    POWER,
    AWAIT,
    ATOM;

    public Precedence next() {
        return this == ATOM ? ATOM : values()[ordinal() + 1];
    }
}
