package com.jpyq.query;

import com.jpyq.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.IntStream;
import java.util.stream.Stream;

public class QueryExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryExecutor.class);

    public Stream<QueryResult> execute(QueryNode query, Node input) {
        LOGGER.debug("Applying {} to {}", query, input.isEmpty() ? "an empty node" : "a node");

        if (query instanceof QueryNode.Pipe p) {
            return execute(p.left(), input).flatMap(result -> execute(p.right(), treeOf(result, p.right())));
        }
        if (query instanceof QueryNode.Identity) {
            return Stream.of(tree(input));
        }
        if (query instanceof QueryNode.Index ix) {
            return Stream.of(tree(input.get(ix.index())));
        }
        if (query instanceof QueryNode.Iterator) {
            return IntStream.range(0, input.length()).mapToObj(i -> tree(input.get(i)));
        }
        if (query instanceof QueryNode.Length) {
            return Stream.of(new QueryResult.CountResult(input.length()));
        }
        if (query instanceof QueryNode.Find f) {
            Node found = switch (f.kind()) {
                case FUNCTION -> input.findFunction(f.name());
                case CLASS -> input.findClass(f.name());
                case VARIABLE -> input.findVariable(f.name());
            };
            return Stream.of(tree(found));
        }
        if (query instanceof QueryNode.Has h) {
            boolean present = switch (h.kind()) {
                case FUNCTION -> input.hasFunction(h.name());
                case CLASS -> input.hasClass(h.name());
                case VARIABLE -> input.hasVariable(h.name());
            };
            return Stream.of(new QueryResult.BooleanResult(present));
        }
        if (query instanceof QueryNode.GetVariable g) {
            return Stream.of(new QueryResult.ValueResult(input.getVariable(g.name()).orElse(null)));
        }
        if (query instanceof QueryNode.IsInteger) {
            return Stream.of(new QueryResult.BooleanResult(input.isInteger()));
        }
        if (query instanceof QueryNode.ValueIsCall v) {
            return Stream.of(new QueryResult.BooleanResult(input.valueIsCall(v.name())));
        }
        if (query instanceof QueryNode.IsEquivalent e) {
            return Stream.of(new QueryResult.BooleanResult(input.isEquivalent(e.source())));
        }
        if (query instanceof QueryNode.Conditions) {
            return input.findConditions().stream().map(QueryExecutor::tree);
        }
        if (query instanceof QueryNode.IfBodies) {
            return input.findIfBodies().stream().map(QueryExecutor::tree);
        }
        if (query instanceof QueryNode.Ifs) {
            return input.findIfs().stream().map(QueryExecutor::tree);
        }
        throw new IllegalArgumentException("Unsupported query: " + query);
    }

    private static QueryResult tree(Node node) {
        return new QueryResult.TreeResult(node);
    }

    private static Node treeOf(QueryResult result, QueryNode next) {
        if (result instanceof QueryResult.TreeResult t) {
            return t.node();
        }
        throw new IllegalArgumentException("Cannot apply " + next + " to " + result);
    }
}
