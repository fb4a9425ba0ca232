package com.jpyq.tree;

import com.jpyq.ast.AstDumper;
import com.jpyq.ast.Literal;
import com.jpyq.ast.PyNode;
import com.jpyq.ast.PyNode.Assign;
import com.jpyq.ast.PyNode.Call;
import com.jpyq.ast.PyNode.ClassDef;
import com.jpyq.ast.PyNode.Constant;
import com.jpyq.ast.PyNode.Expr;
import com.jpyq.ast.PyNode.FunctionDef;
import com.jpyq.ast.PyNode.If;
import com.jpyq.ast.PyNode.Module;
import com.jpyq.ast.PyNode.Name;
import com.jpyq.ast.PyNode.Stmt;
import com.jpyq.ast.Unparser;
import com.jpyq.parser.PyParser;
import com.jpyq.parser.PySyntaxException;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * A chainable handle over a parsed Python tree. A handle is either empty, wraps a single
 * syntax node, or wraps a sequence of nodes. Lookups that find nothing return the empty handle
 * instead of failing, so calls can be chained without null checks:
 *
 * <pre>{@code
 * Node.parse(source).findClass("Shape").findFunction("area").hasVariable("result")
 * }</pre>
 *
 * Handles are immutable. Two handles are equal when both are empty or both wrap structurally
 * identical trees.
 */
public final class Node {
    private static final Logger LOGGER = LoggerFactory.getLogger(Node.class);
    private static final Node EMPTY = new Node(new Contents.Empty());

    private final Contents contents;
    private final NodeView view;

    private Node(Contents contents) {
        this.contents = contents;
        this.view = NodeView.of(contents);
    }

    // ============================================================
    // Construction
    // ============================================================

    /**
     * Parses Python source into a handle wrapping its {@link Module}.
     *
     * @throws PySyntaxException if the source is not valid Python
     */
    public static Node parse(String source) {
        return new Node(new Contents.Single(PyParser.parse(source)));
    }

    public static Node of(PyNode node) {
        if (node == null) {
            return EMPTY;
        }
        return new Node(new Contents.Single(node));
    }

    public static Node of(Iterable<? extends PyNode> nodes) {
        return new Node(new Contents.Sequence(Lists.immutable.withAll(nodes)));
    }

    public static Node empty() {
        return EMPTY;
    }

    /**
     * Builds a handle from source text, a syntax node, an iterable of syntax nodes, or {@code null}
     * for the empty handle.
     *
     * @throws IllegalArgumentException for any other kind of value
     */
    public static Node from(Object value) {
        if (value == null) {
            return EMPTY;
        }
        if (value instanceof String source) {
            return parse(source);
        }
        if (value instanceof PyNode node) {
            return of(node);
        }
        if (value instanceof Iterable<?> iterable) {
            MutableList<PyNode> nodes = Lists.mutable.empty();
            for (Object element : iterable) {
                if (!(element instanceof PyNode node)) {
                    throw new IllegalArgumentException("Node sequence may only hold syntax nodes, found "
                        + (element == null ? "null" : element.getClass().getSimpleName()));
                }
                nodes.add(node);
            }
            return of(nodes);
        }
        throw new IllegalArgumentException("Node must be initialized with source text or a syntax tree, not "
            + value.getClass().getSimpleName());
    }

    // ============================================================
    // Contents
    // ============================================================

    public boolean isEmpty() {
        return contents instanceof Contents.Empty;
    }

    /** The wrapped node, when the handle wraps exactly one. */
    public Optional<PyNode> tree() {
        if (contents instanceof Contents.Single single) {
            return Optional.of(single.node());
        }
        return Optional.empty();
    }

    /** Every wrapped node: none, the single node, or the sequence. */
    public ImmutableList<PyNode> nodes() {
        if (contents instanceof Contents.Single single) {
            return Lists.immutable.of(single.node());
        }
        if (contents instanceof Contents.Sequence sequence) {
            return sequence.nodes();
        }
        return Lists.immutable.empty();
    }

    // ============================================================
    // Indexing
    // ============================================================

    /**
     * The i-th element of a sequence handle, or the i-th statement of the wrapped node's body.
     * Negative indexes count from the end.
     *
     * @throws IndexOutOfBoundsException if {@code index} is out of range
     * @throws InvalidOperationException if the handle can't be indexed
     */
    public Node get(int index) {
        if (view instanceof NodeView.SequenceView sequence) {
            return of(sequence.elements().get(normalize(index, sequence.elements().size())));
        }
        if (view instanceof NodeView.BodyView body) {
            return of(body.body().get(normalize(index, body.body().size())));
        }
        throw new InvalidOperationException("Cannot index " + describe());
    }

    /**
     * @throws InvalidOperationException if the handle is neither a sequence nor a node with a body
     */
    public int length() {
        if (view instanceof NodeView.SequenceView sequence) {
            return sequence.elements().size();
        }
        if (view instanceof NodeView.BodyView body) {
            return body.body().size();
        }
        throw new InvalidOperationException("Cannot take the length of " + describe());
    }

    private static int normalize(int index, int size) {
        int position = index < 0 ? index + size : index;
        if (position < 0 || position >= size) {
            throw new IndexOutOfBoundsException("Index " + index + " out of range for length " + size);
        }
        return position;
    }

    private String describe() {
        if (contents instanceof Contents.Single single) {
            return single.node().getClass().getSimpleName();
        }
        return "an empty node";
    }

    // ============================================================
    // Finders
    // ============================================================

    private ImmutableList<Stmt> body() {
        if (view instanceof NodeView.BodyView body) {
            return body.body();
        }
        return Lists.immutable.empty();
    }

    public Node findFunction(String name) {
        return of(body().detect(stmt -> stmt instanceof FunctionDef f && f.name().equals(name)));
    }

    public Node findClass(String name) {
        return of(body().detect(stmt -> stmt instanceof ClassDef c && c.name().equals(name)));
    }

    /** The first top-level assignment binding {@code name} as a plain name target. */
    public Node findVariable(String name) {
        return of(body().detect(stmt -> stmt instanceof Assign assign
            && assign.targets().anySatisfy(target -> target instanceof Name n && n.id().equals(name))));
    }

    public boolean hasFunction(String name) {
        return !findFunction(name).isEmpty();
    }

    public boolean hasClass(String name) {
        return !findClass(name).isEmpty();
    }

    public boolean hasVariable(String name) {
        return !findVariable(name).isEmpty();
    }

    /**
     * The value assigned to {@code name} when it is an int, float, str or bool literal: a
     * {@code Long} (a {@code BigInteger} when it does not fit), {@code Double}, {@code String} or
     * {@code Boolean}. Empty for anything else, including a missing variable.
     */
    public Optional<Object> getVariable(String name) {
        Optional<PyNode> found = findVariable(name).tree();
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Expr value = ((Assign) found.get()).value();
        if (value instanceof Constant constant) {
            Literal literal = constant.value();
            if (literal instanceof Literal.IntLiteral || literal instanceof Literal.FloatLiteral
                    || literal instanceof Literal.StringLiteral || literal instanceof Literal.BoolLiteral) {
                return Optional.of(literal.javaValue());
            }
        }
        return Optional.empty();
    }

    /**
     * Whether this wraps a single-target assignment of an int literal. {@code True} and
     * {@code False} don't count.
     */
    public boolean isInteger() {
        return assignedValue() instanceof Constant constant && constant.value() instanceof Literal.IntLiteral;
    }

    /** Whether this wraps a single-target assignment whose value calls the plain name {@code name}. */
    public boolean valueIsCall(String name) {
        return assignedValue() instanceof Call call && call.func() instanceof Name func && func.id().equals(name);
    }

    private Expr assignedValue() {
        // chained assignments such as a = b = 1 do not qualify
        if (contents instanceof Contents.Single single && single.node() instanceof Assign assign
                && assign.targets().size() == 1) {
            return assign.value();
        }
        return null;
    }

    /** Top-level {@code if} statements of the body, in order. */
    public ImmutableList<Node> findIfs() {
        return body().select(If.class::isInstance).collect(stmt -> of(stmt));
    }

    // ============================================================
    // Equivalence
    // ============================================================

    /**
     * Whether this handle and {@code source} print the same canonical source, so that a bare
     * expression matches the module that wraps it. The empty handle matches nothing.
     *
     * @throws PySyntaxException if {@code source} is not valid Python
     */
    public boolean isEquivalent(String source) {
        if (isEmpty()) {
            return false;
        }
        return toSource().equals(Unparser.unparse(PyParser.parse(source)));
    }

    // ============================================================
    // Conditional chains
    // ============================================================

    /**
     * Tests of an if/elif chain, in order. A chain ending in a plain {@code else} gets a trailing
     * empty handle for it.
     *
     * @throws InvalidOperationException unless this wraps an {@code if} statement
     */
    public ImmutableList<Node> findConditions() {
        MutableList<Node> conditions = Lists.mutable.empty();
        If branch = requireIf("findConditions");
        while (branch != null) {
            conditions.add(of(branch.test()));
            If next = elifOf(branch);
            if (next == null && !branch.orelse().isEmpty()) {
                conditions.add(EMPTY);
            }
            branch = next;
        }
        LOGGER.debug("Found {} conditions", conditions.size());
        return conditions.toImmutable();
    }

    /**
     * Bodies of an if/elif chain, in order, including a final {@code else} body. Each body is
     * wrapped in a {@link Module} so that it can be indexed.
     *
     * @throws InvalidOperationException unless this wraps an {@code if} statement
     */
    public ImmutableList<Node> findIfBodies() {
        MutableList<Node> bodies = Lists.mutable.empty();
        If branch = requireIf("findIfBodies");
        while (branch != null) {
            bodies.add(of(new Module(branch.body())));
            If next = elifOf(branch);
            if (next == null && !branch.orelse().isEmpty()) {
                bodies.add(of(new Module(branch.orelse())));
            }
            branch = next;
        }
        return bodies.toImmutable();
    }

    private If requireIf(String operation) {
        if (contents instanceof Contents.Single single && single.node() instanceof If branch) {
            return branch;
        }
        throw new InvalidOperationException(operation + " needs an if statement, not " + describe());
    }

    // The else branch continues the chain only when it holds exactly one if statement
    private static If elifOf(If branch) {
        if (branch.orelse().size() == 1 && branch.orelse().getFirst() instanceof If next) {
            return next;
        }
        return null;
    }

    // ============================================================
    // Rendering
    // ============================================================

    /** Canonical Python source for the wrapped tree; empty text for the empty handle. */
    public String toSource() {
        if (contents instanceof Contents.Single single) {
            return Unparser.unparse(single.node());
        }
        if (contents instanceof Contents.Sequence sequence) {
            return Unparser.unparse(sequence.nodes());
        }
        return "";
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Node other && contents.equals(other.contents));
    }

    @Override
    public int hashCode() {
        return contents.hashCode();
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "Node:\nNone";
        }
        return "Node:\n" + nodes().collect(node -> AstDumper.dump(node, true)).makeString("\n");
    }
}
