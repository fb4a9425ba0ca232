package com.jpyq.ast;

/** Operator leaf of the syntax tree. */
public interface AstOperator {
    String symbol();

    /** Class name of the operator in CPython's {@code ast} module. */
    String nodeName();
}
