package com.jpyq.ast;

public enum CompareOperator implements AstOperator {
    EQ("==", "Eq"),
    NOT_EQ("!=", "NotEq"),
    LT("<", "Lt"),
    LT_E("<=", "LtE"),
    GT(">", "Gt"),
    GT_E(">=", "GtE"),
    IS("is", "Is"),
    IS_NOT("is not", "IsNot"),
    IN("in", "In"),
    NOT_IN("not in", "NotIn");

    private final String symbol;
    private final String nodeName;

    CompareOperator(String symbol, String nodeName) {
        this.symbol = symbol;
        this.nodeName = nodeName;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public String nodeName() {
        return nodeName;
    }

    public static CompareOperator fromSymbol(String symbol) {
        for (CompareOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Not a comparison operator: " + symbol);
    }
}
