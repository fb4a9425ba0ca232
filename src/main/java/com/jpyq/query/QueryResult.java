package com.jpyq.query;

import com.jpyq.tree.Node;

/**
 * One value produced by a query: a handle, or a terminal answer that can't be queried further.
 */
public sealed interface QueryResult {
    record TreeResult(Node node) implements QueryResult {}
    record BooleanResult(boolean value) implements QueryResult {}
    record CountResult(int count) implements QueryResult {}
    // value is null when the variable holds no literal
    record ValueResult(Object value) implements QueryResult {}
}
