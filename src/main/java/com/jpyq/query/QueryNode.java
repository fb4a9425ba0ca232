package com.jpyq.query;

public sealed interface QueryNode {
    record Identity() implements QueryNode {}
    record Index(int index) implements QueryNode {}
    record Iterator() implements QueryNode {}  // For .[] syntax
    record Pipe(QueryNode left, QueryNode right) implements QueryNode {}
    record Length() implements QueryNode {}
    record Find(Declaration kind, String name) implements QueryNode {}
    record Has(Declaration kind, String name) implements QueryNode {}
    record GetVariable(String name) implements QueryNode {}
    record IsInteger() implements QueryNode {}
    record ValueIsCall(String name) implements QueryNode {}
    record IsEquivalent(String source) implements QueryNode {}
    record Conditions() implements QueryNode {}
    record IfBodies() implements QueryNode {}
    record Ifs() implements QueryNode {}

    enum Declaration {
        FUNCTION, CLASS, VARIABLE
    }
}
