package com.jpyq.ast;

public enum UnaryOperator implements AstOperator {
    INVERT("~", "Invert", Precedence.FACTOR),
    NOT("not", "Not", Precedence.NOT),
    UADD("+", "UAdd", Precedence.FACTOR),
    USUB("-", "USub", Precedence.FACTOR);

    private final String symbol;
    private final String nodeName;
    private final Precedence precedence;

    UnaryOperator(String symbol, String nodeName, Precedence precedence) {
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
