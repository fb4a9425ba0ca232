package com.jpyq.parser;

import com.jpyq.ast.PyNode.Expr;
import com.jpyq.ast.PyNode.ExprStmt;
import com.jpyq.ast.PyNode.Module;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.util.Objects;

/**
 * Parses Python 3.11 source into the tree of {@link com.jpyq.ast.PyNode}.
 * <p>
 * The tree-sitter Python grammar produces the concrete syntax tree; {@link PyTreeBuilder} turns it
 * into syntax nodes and rejects what the grammar accepts but CPython does not.
 */
public final class PyParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(PyParser.class);

    // TSParser is not thread-safe
    private static final ThreadLocal<TSParser> PARSER = ThreadLocal.withInitial(() -> {
        var parser = new TSParser();
        parser.setLanguage(new TreeSitterPython());
        return parser;
    });

    private PyParser() {
    }

    /** Parses a whole source file. */
    public static Module parse(String source) {
        TSNode root = syntaxTree(source);
        Module module = new PyTreeBuilder(source).module(root);
        LOGGER.debug("Parsed {} top-level statements from {} characters", module.body().size(), source.length());
        return module;
    }

    /** Parses a single expression; a bare comma list becomes a tuple. */
    public static Expr parseExpression(String source) {
        // parentheses let the expression span lines and admit a walrus or generator at top level;
        // the newline keeps a trailing comment from swallowing the closing one
        String wrapped = "(" + source + "\n)";
        TSNode root = syntaxTree(wrapped);
        Module module = new PyTreeBuilder(wrapped).module(root);
        if (module.body().size() != 1 || !(module.body().get(0) instanceof ExprStmt statement)) {
            throw new PySyntaxException("invalid syntax: expected a single expression", 1, 1);
        }
        return statement.value();
    }

    private static TSNode syntaxTree(String source) {
        TSTree tree = Objects.requireNonNull(PARSER.get().parseString(null, source), "tree-sitter returned no tree");
        return tree.getRootNode();
    }
}
