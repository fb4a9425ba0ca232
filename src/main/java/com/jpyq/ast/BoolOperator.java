package com.jpyq.ast;

public enum BoolOperator implements AstOperator {
    AND("and", "And", Precedence.AND),
    OR("or", "Or", Precedence.OR);

    private final String symbol;
    private final String nodeName;
    private final Precedence precedence;

    BoolOperator(String symbol, String nodeName, Precedence precedence) {
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
}
