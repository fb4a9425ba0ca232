package com.jpyq.ast;

public enum BinaryOperator implements AstOperator {
    ADD("+", "Add", Precedence.ARITH),
    SUB("-", "Sub", Precedence.ARITH),
    MULT("*", "Mult", Precedence.TERM),
    MAT_MULT("@", "MatMult", Precedence.TERM),
    DIV("/", "Div", Precedence.TERM),
    MOD("%", "Mod", Precedence.TERM),
    FLOOR_DIV("//", "FloorDiv", Precedence.TERM),
    POW("**", "Pow", Precedence.POWER),
    LSHIFT("<<", "LShift", Precedence.SHIFT),
    RSHIFT(">>", "RShift", Precedence.SHIFT),
    BIT_OR("|", "BitOr", Precedence.EXPR),
    BIT_XOR("^", "BitXor", Precedence.BXOR),
    BIT_AND("&", "BitAnd", Precedence.BAND);

    private final String symbol;
    private final String nodeName;
    private final Precedence precedence;

    BinaryOperator(String symbol, String nodeName, Precedence precedence) {
        this.symbol = symbol;
        this.nodeName = nodeName;
        this.precedence = precedence;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public String nodeName() {
        return nodeName;
    }

    public Precedence precedence() {
        return precedence;
    }

    public static BinaryOperator fromSymbol(String symbol) {
        for (BinaryOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Not a binary operator: " + symbol);
    }

    /** Looks up the operator of an augmented assignment token such as {@code +=}. */
    public static BinaryOperator fromAugmented(String token) {
        return fromSymbol(token.substring(0, token.length() - 1));
    }
}
