package com.jpyq.parser;

import com.jpyq.ast.BinaryOperator;
import com.jpyq.ast.BoolOperator;
import com.jpyq.ast.CompareOperator;
import com.jpyq.ast.Literal;
import com.jpyq.ast.PyNode.*;
import com.jpyq.ast.PyNode.Module;
import com.jpyq.ast.UnaryOperator;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;
import org.eclipse.collections.impl.tuple.Tuples;
import org.treesitter.TSNode;
import org.treesitter.TSPoint;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * Converts a tree-sitter Python syntax tree into {@link com.jpyq.ast.PyNode}s.
 * <p>
 * The grammar is more permissive than CPython: it takes Python 2 statements, later syntax such
 * as type parameters, and shapes that only the compiler rejects. Those are reported here as
 * {@link PySyntaxException}s.
 */
final class PyTreeBuilder {
    private static final ImmutableSet<String> EXTRAS = Sets.immutable.of("comment", "line_continuation");
    private static final ImmutableSet<String> STRING_PREFIXES = Sets.immutable.of(
        "", "r", "u", "b", "br", "rb", "f", "fr", "rf");

    private final byte[] source;

    PyTreeBuilder(String source) {
        this.source = source.getBytes(StandardCharsets.UTF_8);
    }

    Module module(TSNode root) {
        TSNode error = firstError(root);
        if (error != null) {
            throw error(errorReason(error), error);
        }
        return new Module(statements(root));
    }

    private String errorReason(TSNode error) {
        if (!error.isError()) {
            return error.isNamed() && error.getChildCount() > 0
                ? "invalid syntax"
                : "invalid syntax: expected '" + error.getType() + "'";
        }
        MutableList<TSNode> parts = children(error);
        if (parts.notEmpty() && parts.getFirst().getType().equals("try")) {
            return "expected 'except' or 'finally' block";
        }
        // "1 = x" stops the grammar at the '='
        if (parts.size() == 2 && parts.getFirst().isNamed() && parts.getLast().getType().equals("=")) {
            Expr target = expression(parts.getFirst());
            if (!(target instanceof Name || target instanceof Attribute || target instanceof Subscript)) {
                return "cannot assign to " + describe(target);
            }
        }
        return "invalid syntax";
    }

    // ============================================================
    // Tree helpers
    // ============================================================

    String text(TSNode node) {
        return text(node.getStartByte(), node.getEndByte());
    }

    String text(int start, int end) {
        return new String(source, start, end - start, StandardCharsets.UTF_8);
    }

    /** Children in source order, without comments and line continuations. */
    static MutableList<TSNode> children(TSNode node) {
        MutableList<TSNode> children = Lists.mutable.empty();
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (!EXTRAS.contains(child.getType())) {
                children.add(child);
            }
        }
        return children;
    }

    static MutableList<TSNode> namedChildren(TSNode node) {
        return children(node).select(TSNode::isNamed);
    }

    /** Named children labelled {@code field}; a field may repeat, as the subscripts of {@code x[a, b]} do. */
    static MutableList<TSNode> fieldChildren(TSNode node, String field) {
        MutableList<TSNode> result = Lists.mutable.empty();
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (field.equals(node.getFieldNameForChild(i)) && child.isNamed()) {
                result.add(child);
            }
        }
        return result;
    }

    static TSNode field(TSNode node, String name) {
        TSNode child = node.getChildByFieldName(name);
        return child == null || child.isNull() ? null : child;
    }

    /** Whether an anonymous token such as {@code ","} appears directly under {@code node}. */
    static boolean hasToken(TSNode node, String token) {
        return children(node).anySatisfy(child -> !child.isNamed() && child.getType().equals(token));
    }

    private static TSNode childOfType(TSNode node, String type) {
        return namedChildren(node).detect(child -> child.getType().equals(type));
    }

    /** The first ERROR node, or a zero-width token the parser had to invent. */
    private static TSNode firstError(TSNode node) {
        if (node.isError()) {
            return node;
        }
        if (!node.hasError()) {
            return null;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            boolean inserted = child.getChildCount() == 0 && child.getStartByte() == child.getEndByte()
                && !child.getType().equals("block");
            TSNode found = inserted ? child : firstError(child);
            if (found != null) {
                return found;
            }
        }
        return node;
    }

    PySyntaxException error(String reason, TSNode node) {
        TSPoint point = node.getStartPoint();
        int lineStart = node.getStartByte() - point.getColumn();
        int column = text(lineStart, node.getStartByte()).length();
        return new PySyntaxException(reason, point.getRow() + 1, column + 1);
    }

    private static boolean isName(TSNode node) {
        return node.getType().equals("identifier") || node.getType().equals("keyword_identifier");
    }

    // ============================================================
    // Statements
    // ============================================================

    private ImmutableList<Stmt> statements(TSNode container) {
        MutableList<TSNode> nodes = namedChildren(container);
        checkIndentation(container, nodes);
        MutableList<Stmt> body = Lists.mutable.empty();
        for (TSNode node : nodes) {
            body.add(statement(node));
        }
        return body.toImmutable();
    }

    /** The body of a compound statement; an empty suite is an error at {@code owner}. */
    private ImmutableList<Stmt> block(TSNode owner, TSNode block) {
        if (block == null || namedChildren(block).isEmpty()) {
            throw error("expected an indented block", owner);
        }
        return statements(block);
    }

    /** The suite of a clause that carries it without a field name, such as {@code finally:}. */
    private ImmutableList<Stmt> suite(TSNode clause) {
        TSNode body = field(clause, "body");
        return block(clause, body != null ? body : childOfType(clause, "block"));
    }

    // The grammar tracks indentation only where it opens or closes a block
    private void checkIndentation(TSNode container, MutableList<TSNode> nodes) {
        int expected = container.getType().equals("module") ? 0 : -1;
        TSNode previous = null;
        for (TSNode node : nodes) {
            int column = node.getStartPoint().getColumn();
            if (startsLine(node)) {
                if (expected < 0) {
                    expected = column;
                } else if (column != expected) {
                    boolean afterBlock = previous != null
                        && previous.getEndPoint().getRow() > previous.getStartPoint().getRow();
                    throw error(column > expected && !afterBlock
                        ? "unexpected indent"
                        : "unindent does not match any outer indentation level", node);
                }
            }
            previous = node;
        }
    }

    private boolean startsLine(TSNode node) {
        int start = node.getStartByte();
        for (int i = start - node.getStartPoint().getColumn(); i < start; i++) {
            if (source[i] != ' ' && source[i] != '\t' && source[i] != '\f') {
                return false;
            }
        }
        return true;
    }

    private Stmt statement(TSNode node) {
        return switch (node.getType()) {
            case "expression_statement" -> expressionStatement(node);
            case "return_statement" -> {
                MutableList<TSNode> value = namedChildren(node);
                yield new Return(value.isEmpty() ? null : expression(value.getFirst()));
            }
            case "pass_statement" -> new Pass();
            case "break_statement" -> new Break();
            case "continue_statement" -> new Continue();
            case "delete_statement" -> deleteStatement(node);
            case "raise_statement" -> raiseStatement(node);
            case "global_statement" -> new Global(namedChildren(node).collect(this::text).toImmutable());
            case "nonlocal_statement" -> new Nonlocal(namedChildren(node).collect(this::text).toImmutable());
            case "assert_statement" -> assertStatement(node);
            case "import_statement" -> new Import(importNames(node));
            case "import_from_statement" -> importFrom(node);
            case "future_import_statement" -> new ImportFrom("__future__", importNames(node), 0);
            case "if_statement" -> ifStatement(node);
            case "for_statement" -> forStatement(node);
            case "while_statement" -> new While(expression(field(node, "condition")),
                block(node, field(node, "body")), elseBody(field(node, "alternative")));
            case "try_statement" -> tryStatement(node);
            case "with_statement" -> withStatement(node);
            case "function_definition" -> functionDef(node, Lists.immutable.empty());
            case "class_definition" -> classDef(node, Lists.immutable.empty());
            case "decorated_definition" -> decorated(node);
            case "match_statement" -> matchStatement(node);
            case "print_statement" -> throw error("Missing parentheses in call to 'print'. Did you mean print(...)?", node);
            case "exec_statement" -> throw error("Missing parentheses in call to 'exec'. Did you mean exec(...)?", node);
            default -> throw error("invalid syntax", node);
        };
    }

    private Stmt expressionStatement(TSNode node) {
        MutableList<TSNode> parts = namedChildren(node);
        if (parts.size() > 1 || hasToken(node, ",")) {
            return new ExprStmt(new TupleExpr(expressions(parts)));
        }
        TSNode part = parts.getFirst();
        switch (part.getType()) {
            case "assignment" -> {
                return assignment(part);
            }
            case "augmented_assignment" -> {
                return augmentedAssignment(part);
            }
            case "named_expression" -> throw error("invalid syntax", part);
            default -> {
                return new ExprStmt(expression(part));
            }
        }
    }

    private Stmt assignment(TSNode node) {
        MutableList<Expr> targets = Lists.mutable.empty();
        TSNode current = node;
        while (true) {
            TSNode left = field(current, "left");
            TSNode right = field(current, "right");
            TSNode type = field(current, "type");
            if (type != null) {
                if (current != node) {
                    throw error("invalid syntax", type);
                }
                return annotatedAssignment(left, type, right);
            }
            targets.add(target(left));
            if (right.getType().equals("assignment")) {
                current = right;
            } else if (right.getType().equals("augmented_assignment")) {
                throw error("invalid syntax", right);
            } else {
                return new Assign(targets.toImmutable(), expression(right));
            }
        }
    }

    private AnnAssign annotatedAssignment(TSNode left, TSNode type, TSNode right) {
        Expr target = expression(left);
        if (target instanceof TupleExpr) {
            throw error("only single target (not tuple) can be annotated", left);
        }
        if (target instanceof ListExpr) {
            throw error("only single target (not list) can be annotated", left);
        }
        if (!(target instanceof Name || target instanceof Attribute || target instanceof Subscript)) {
            throw error("illegal target for annotation", left);
        }
        // "(x): int" is not a simple target
        boolean simple = isName(left);
        return new AnnAssign(target, annotation(type), right == null ? null : expression(right), simple);
    }

    private AugAssign augmentedAssignment(TSNode node) {
        TSNode left = field(node, "left");
        Expr target = expression(left);
        if (!(target instanceof Name || target instanceof Attribute || target instanceof Subscript)) {
            throw error("'" + describe(target) + "' is an illegal expression for augmented assignment", left);
        }
        BinaryOperator op = BinaryOperator.fromAugmented(field(node, "operator").getType());
        return new AugAssign(target, op, expression(field(node, "right")));
    }

    private Expr target(TSNode node) {
        Expr target = expression(node);
        checkTarget(target, node);
        return target;
    }

    private void checkTarget(Expr target, TSNode at) {
        if (target instanceof Name || target instanceof Attribute || target instanceof Subscript) {
            return;
        }
        if (target instanceof Starred s) {
            checkTarget(s.value(), at);
        } else if (target instanceof TupleExpr t) {
            for (Expr element : t.elts()) {
                checkTarget(element, at);
            }
        } else if (target instanceof ListExpr l) {
            for (Expr element : l.elts()) {
                checkTarget(element, at);
            }
        } else {
            throw error("cannot assign to " + describe(target), at);
        }
    }

    private void checkDeletable(Expr target, TSNode at) {
        if (target instanceof Name || target instanceof Attribute || target instanceof Subscript) {
            return;
        }
        ImmutableList<Expr> elements = target instanceof TupleExpr t ? t.elts()
            : target instanceof ListExpr l ? l.elts() : null;
        if (elements == null) {
            throw error("cannot delete " + describe(target), at);
        }
        for (Expr element : elements) {
            checkDeletable(element, at);
        }
    }

    private static String describe(Expr expr) {
        if (expr instanceof Constant) {
            return "literal";
        }
        if (expr instanceof Call) {
            return "function call";
        }
        if (expr instanceof Compare) {
            return "comparison";
        }
        if (expr instanceof TupleExpr) {
            return "tuple";
        }
        if (expr instanceof ListExpr) {
            return "list";
        }
        return "expression";
    }

    private Delete deleteStatement(TSNode node) {
        TSNode value = namedChildren(node).getFirst();
        MutableList<TSNode> targets = value.getType().equals("expression_list")
            ? namedChildren(value)
            : Lists.mutable.with(value);
        MutableList<Expr> result = Lists.mutable.empty();
        for (TSNode target : targets) {
            Expr expr = expression(target);
            checkDeletable(expr, target);
            result.add(expr);
        }
        return new Delete(result.toImmutable());
    }

    private Raise raiseStatement(TSNode node) {
        TSNode cause = field(node, "cause");
        TSNode exc = namedChildren(node)
            .detect(child -> cause == null || child.getStartByte() != cause.getStartByte());
        if (exc != null && exc.getType().equals("expression_list")) {
            throw error("invalid syntax", exc);
        }
        return new Raise(exc == null ? null : expression(exc), cause == null ? null : expression(cause));
    }

    private Assert assertStatement(TSNode node) {
        MutableList<TSNode> parts = namedChildren(node);
        if (parts.size() > 2) {
            throw error("invalid syntax", parts.get(2));
        }
        return new Assert(expression(parts.get(0)), parts.size() > 1 ? expression(parts.get(1)) : null);
    }

    // ============================================================
    // Imports
    // ============================================================

    private ImmutableList<Alias> importNames(TSNode node) {
        MutableList<Alias> names = Lists.mutable.empty();
        for (TSNode name : fieldChildren(node, "name")) {
            if (name.getType().equals("aliased_import")) {
                names.add(new Alias(dottedName(field(name, "name")), text(field(name, "alias"))));
            } else {
                names.add(new Alias(dottedName(name), null));
            }
        }
        return names.toImmutable();
    }

    private String dottedName(TSNode node) {
        return namedChildren(node).collect(this::text).makeString(".");
    }

    private ImportFrom importFrom(TSNode node) {
        TSNode moduleName = field(node, "module_name");
        String module;
        int level = 0;
        if (moduleName.getType().equals("relative_import")) {
            TSNode prefix = childOfType(moduleName, "import_prefix");
            level = (int) text(prefix).chars().filter(c -> c == '.').count();
            TSNode dotted = childOfType(moduleName, "dotted_name");
            module = dotted == null ? null : dottedName(dotted);
        } else {
            module = dottedName(moduleName);
        }
        ImmutableList<Alias> names = childOfType(node, "wildcard_import") != null
            ? Lists.immutable.of(new Alias("*", null))
            : importNames(node);
        return new ImportFrom(module, names, level);
    }

    // ============================================================
    // Compound statements
    // ============================================================

    private If ifStatement(TSNode node) {
        MutableList<TSNode> alternatives = fieldChildren(node, "alternative");
        ImmutableList<Stmt> orelse = Lists.immutable.empty();
        // elif clauses nest from the last one outwards
        for (TSNode alternative : alternatives.asReversed()) {
            if (alternative.getType().equals("else_clause")) {
                orelse = block(alternative, field(alternative, "body"));
            } else {
                orelse = Lists.immutable.of(new If(expression(field(alternative, "condition")),
                    block(alternative, field(alternative, "consequence")), orelse));
            }
        }
        return new If(expression(field(node, "condition")), block(node, field(node, "consequence")), orelse);
    }

    private ImmutableList<Stmt> elseBody(TSNode elseClause) {
        return elseClause == null ? Lists.immutable.empty() : block(elseClause, field(elseClause, "body"));
    }

    private For forStatement(TSNode node) {
        return new For(target(field(node, "left")), expression(field(node, "right")),
            block(node, field(node, "body")), elseBody(field(node, "alternative")), hasToken(node, "async"));
    }

    private Stmt tryStatement(TSNode node) {
        ImmutableList<Stmt> body = block(node, field(node, "body"));
        MutableList<ExceptHandler> handlers = Lists.mutable.empty();
        ImmutableList<Stmt> orelse = Lists.immutable.empty();
        ImmutableList<Stmt> finalbody = Lists.immutable.empty();
        boolean star = false;
        for (TSNode clause : namedChildren(node)) {
            switch (clause.getType()) {
                case "except_clause" -> handlers.add(exceptHandler(clause));
                case "except_group_clause" -> {
                    star = true;
                    ExceptHandler handler = exceptHandler(clause);
                    if (handler.type() == null) {
                        throw error("expected one or more exception types", clause);
                    }
                    handlers.add(handler);
                }
                case "else_clause" -> orelse = suite(clause);
                case "finally_clause" -> finalbody = suite(clause);
                default -> {
                }
            }
        }
        if (star) {
            return new TryStar(body, handlers.toImmutable(), orelse, finalbody);
        }
        return new Try(body, handlers.toImmutable(), orelse, finalbody);
    }

    private ExceptHandler exceptHandler(TSNode clause) {
        if (hasToken(clause, ",")) {
            throw error("multiple exception types must be parenthesized", clause);
        }
        MutableList<TSNode> parts = namedChildren(clause).reject(child -> child.getType().equals("block"));
        Expr type = null;
        String name = null;
        if (parts.size() == 1 && parts.getFirst().getType().equals("as_pattern")) {
            TSNode as = parts.getFirst();
            type = expression(namedChildren(as).getFirst());
            name = captureName(field(as, "alias"));
        } else if (!parts.isEmpty()) {
            type = expression(parts.getFirst());
            if (parts.size() > 1) {
                name = captureName(parts.get(1));
            }
        }
        return new ExceptHandler(type, name, suite(clause));
    }

    /** The identifier bound by {@code as}. */
    private String captureName(TSNode node) {
        TSNode name = node.getType().equals("as_pattern_target") ? namedChildren(node).getFirst() : node;
        if (name == null || !isName(name)) {
            throw error("invalid syntax", node);
        }
        return text(name);
    }

    private With withStatement(TSNode node) {
        TSNode clause = childOfType(node, "with_clause");
        MutableList<TSNode> itemNodes = namedChildren(clause).select(child -> child.getType().equals("with_item"));
        MutableList<WithItem> items = Lists.mutable.empty();
        TSNode single = itemNodes.size() == 1 ? field(itemNodes.getFirst(), "value") : null;
        if (single != null && single.getType().equals("tuple") && !hasToken(clause, "(")
                && !namedChildren(single).isEmpty()) {
            // "with (a, b):" holds two context managers, not one tuple
            for (TSNode element : namedChildren(single)) {
                items.add(withItem(element));
            }
        } else {
            for (TSNode item : itemNodes) {
                items.add(withItem(field(item, "value")));
            }
        }
        return new With(items.toImmutable(), block(node, field(node, "body")), hasToken(node, "async"));
    }

    private WithItem withItem(TSNode value) {
        if (!value.getType().equals("as_pattern")) {
            return new WithItem(expression(value), null);
        }
        Expr context = expression(namedChildren(value).getFirst());
        TSNode alias = field(value, "alias");
        TSNode target = alias.getType().equals("as_pattern_target") ? namedChildren(alias).getFirst() : alias;
        return new WithItem(context, target(target));
    }

    private Stmt decorated(TSNode node) {
        ImmutableList<Expr> decorators = namedChildren(node)
            .select(child -> child.getType().equals("decorator"))
            .collect(decorator -> expression(namedChildren(decorator).getFirst()))
            .toImmutable();
        TSNode definition = field(node, "definition");
        if (definition.getType().equals("class_definition")) {
            return classDef(definition, decorators);
        }
        return functionDef(definition, decorators);
    }

    private FunctionDef functionDef(TSNode node, ImmutableList<Expr> decorators) {
        rejectTypeParameters(node);
        TSNode returns = field(node, "return_type");
        return new FunctionDef(text(field(node, "name")), parameters(field(node, "parameters")),
            block(node, field(node, "body")), decorators, returns == null ? null : annotation(returns),
            hasToken(node, "async"));
    }

    private ClassDef classDef(TSNode node, ImmutableList<Expr> decorators) {
        rejectTypeParameters(node);
        TSNode superclasses = field(node, "superclasses");
        Pair<ImmutableList<Expr>, ImmutableList<Keyword>> arguments = superclasses == null
            ? Tuples.pair(Lists.immutable.empty(), Lists.immutable.empty())
            : callArguments(superclasses);
        return new ClassDef(text(field(node, "name")), arguments.getOne(), arguments.getTwo(),
            block(node, field(node, "body")), decorators);
    }

    // Type parameter lists arrived in Python 3.12
    private void rejectTypeParameters(TSNode node) {
        TSNode typeParameters = childOfType(node, "type_parameter");
        if (typeParameters != null) {
            throw error("invalid syntax", typeParameters);
        }
    }

    // ============================================================
    // Parameters
    // ============================================================

    private Arguments parameters(TSNode node) {
        ParameterList parameters = new ParameterList();
        if (node == null) {
            return parameters.build(null);
        }
        for (TSNode parameter : namedChildren(node)) {
            parameters.add(parameter);
        }
        return parameters.build(node);
    }

    /** Sorts parameters into their {@link Arguments} slots in declaration order. */
    private final class ParameterList {
        private final MutableList<Arg> posonly = Lists.mutable.empty();
        private final MutableList<Arg> args = Lists.mutable.empty();
        private final MutableList<Expr> defaults = Lists.mutable.empty();
        private final MutableList<Arg> kwonly = Lists.mutable.empty();
        private final MutableList<Expr> kwDefaults = Lists.mutable.empty();
        private Arg vararg;
        private Arg kwarg;
        private boolean star;

        void add(TSNode parameter) {
            if (kwarg != null) {
                throw error("arguments cannot follow var-keyword argument", parameter);
            }
            switch (parameter.getType()) {
                case "identifier" -> named(new Arg(text(parameter), null), null, parameter);
                case "default_parameter" -> {
                    TSNode name = field(parameter, "name");
                    if (!isName(name)) {
                        throw error("invalid syntax", name);
                    }
                    named(new Arg(text(name), null), expression(field(parameter, "value")), parameter);
                }
                case "typed_default_parameter" -> named(
                    new Arg(text(field(parameter, "name")), annotation(field(parameter, "type"))),
                    expression(field(parameter, "value")), parameter);
                case "typed_parameter" -> {
                    TSNode inner = namedChildren(parameter).getFirst();
                    Expr annotation = annotation(field(parameter, "type"));
                    switch (inner.getType()) {
                        case "list_splat_pattern" -> star(new Arg(splatName(inner), annotation), parameter);
                        case "dictionary_splat_pattern" -> kwarg = new Arg(splatName(inner), annotation);
                        default -> named(new Arg(text(inner), annotation), null, parameter);
                    }
                }
                case "list_splat_pattern" -> star(new Arg(splatName(parameter), null), parameter);
                case "keyword_separator" -> star(null, parameter);
                case "dictionary_splat_pattern" -> kwarg = new Arg(splatName(parameter), null);
                case "positional_separator" -> {
                    if (star || !posonly.isEmpty() || args.isEmpty()) {
                        throw error("invalid syntax: '/' must follow positional parameters", parameter);
                    }
                    posonly.addAll(args);
                    args.clear();
                }
                default -> throw error("invalid syntax", parameter);
            }
        }

        private void named(Arg arg, Expr defaultValue, TSNode at) {
            if (star) {
                kwonly.add(arg);
                kwDefaults.add(defaultValue);
            } else {
                args.add(arg);
                if (defaultValue != null) {
                    defaults.add(defaultValue);
                } else if (!defaults.isEmpty()) {
                    throw error("non-default argument follows default argument", at);
                }
            }
        }

        private void star(Arg arg, TSNode at) {
            if (star) {
                throw error("* argument may appear only once", at);
            }
            star = true;
            vararg = arg;
        }

        Arguments build(TSNode at) {
            if (star && vararg == null && kwonly.isEmpty()) {
                throw error("named arguments must follow bare *", at);
            }
            return new Arguments(posonly.toImmutable(), args.toImmutable(), vararg, kwonly.toImmutable(),
                kwDefaults.toImmutable(), kwarg, defaults.toImmutable());
        }
    }

    private String splatName(TSNode pattern) {
        return text(namedChildren(pattern).getFirst());
    }

    // ============================================================
    // Annotations
    // ============================================================

    /** A {@code type} node; the grammar's generic, union and member forms map to ordinary expressions. */
    private Expr annotation(TSNode node) {
        switch (node.getType()) {
            case "type" -> {
                return annotation(namedChildren(node).getFirst());
            }
            case "generic_type" -> {
                MutableList<TSNode> parts = namedChildren(node);
                TSNode parameters = parts.get(1);
                MutableList<TSNode> types = namedChildren(parameters);
                Expr slice = types.size() == 1 && !hasToken(parameters, ",")
                    ? annotation(types.getFirst())
                    : new TupleExpr(types.collect(this::annotation).toImmutable());
                return new Subscript(new Name(text(parts.getFirst())), slice);
            }
            case "union_type" -> {
                MutableList<TSNode> parts = namedChildren(node);
                return new BinOp(annotation(parts.get(0)), BinaryOperator.BIT_OR, annotation(parts.get(1)));
            }
            case "member_type" -> {
                MutableList<TSNode> parts = namedChildren(node);
                return new Attribute(annotation(parts.get(0)), text(parts.get(1)));
            }
            case "splat_type" -> {
                if (hasToken(node, "**")) {
                    throw error("invalid syntax", node);
                }
                return new Starred(new Name(text(namedChildren(node).getFirst())));
            }
            case "constrained_type" -> throw error("invalid syntax", node);
            default -> {
                return expression(node);
            }
        }
    }

    // ============================================================
    // Match statements
    // ============================================================

    private Match matchStatement(TSNode node) {
        MutableList<TSNode> subjects = fieldChildren(node, "subject");
        Expr subject = subjects.size() == 1 && !hasToken(node, ",")
            ? expression(subjects.getFirst())
            : new TupleExpr(expressions(subjects));
        TSNode body = field(node, "body");
        MutableList<TSNode> clauses = body == null ? Lists.mutable.empty()
            : namedChildren(body).select(child -> child.getType().equals("case_clause"));
        if (clauses.isEmpty()) {
            throw error("expected an indented block", node);
        }
        return new Match(subject, clauses.collect(this::matchCase).toImmutable());
    }

    private MatchCase matchCase(TSNode clause) {
        MutableList<TSNode> patterns = namedChildren(clause).select(child -> child.getType().equals("case_pattern"));
        Pattern pattern = patterns.size() == 1 && !hasToken(clause, ",")
            ? pattern(patterns.getFirst())
            : new MatchSequence(patterns.collect(this::pattern).toImmutable());
        TSNode guard = field(clause, "guard");
        return new MatchCase(pattern, guard == null ? null : expression(namedChildren(guard).getFirst()),
            block(clause, field(clause, "consequence")));
    }

    private Pattern pattern(TSNode node) {
        if (!node.getType().equals("case_pattern")) {
            return simplePattern(Lists.mutable.with(node), node);
        }
        MutableList<TSNode> parts = children(node);
        TSNode first = parts.getFirst();
        if (parts.size() == 1 && first.getType().equals("as_pattern")) {
            MutableList<TSNode> named = namedChildren(first);
            String name = captureName(named.getLast());
            return new MatchAs(pattern(named.getFirst()), name);
        }
        if (parts.size() == 1 && first.getType().equals("keyword_pattern")) {
            throw error("invalid syntax", first);
        }
        return simplePattern(parts, node);
    }

    /** One alternative of a pattern, given as the tokens and nodes that spell it. */
    private Pattern simplePattern(MutableList<TSNode> parts, TSNode at) {
        TSNode first = parts.getFirst();
        if (parts.size() == 2 && first.getType().equals("-")) {
            return new MatchValue(new UnaryOp(UnaryOperator.USUB, new Constant(number(parts.get(1)))));
        }
        if (parts.size() != 1) {
            throw error("invalid syntax", at);
        }
        switch (first.getType()) {
            case "_" -> {
                return new MatchAs(null, null);
            }
            case "case_pattern" -> {
                return pattern(first);
            }
            case "dotted_name" -> {
                MutableList<TSNode> names = namedChildren(first);
                if (names.size() > 1) {
                    return new MatchValue(dottedExpression(first));
                }
                String name = text(names.getFirst());
                return name.equals("_") ? new MatchAs(null, null) : new MatchAs(null, name);
            }
            case "integer", "float" -> {
                return new MatchValue(new Constant(number(first)));
            }
            case "string", "concatenated_string" -> {
                Expr value = strings(first);
                if (value instanceof JoinedStr) {
                    throw error("patterns may only match literals and attribute lookups", first);
                }
                return new MatchValue(value);
            }
            case "true", "false", "none" -> {
                return new MatchSingleton(((Constant) expression(first)).value());
            }
            case "complex_pattern" -> {
                return complexPattern(first);
            }
            case "union_pattern" -> {
                return new MatchOr(alternatives(first));
            }
            case "list_pattern" -> {
                return new MatchSequence(namedChildren(first).collect(this::pattern).toImmutable());
            }
            case "tuple_pattern" -> {
                MutableList<TSNode> elements = namedChildren(first);
                if (elements.size() == 1 && !hasToken(first, ",")) {
                    return pattern(elements.getFirst());
                }
                return new MatchSequence(elements.collect(this::pattern).toImmutable());
            }
            case "splat_pattern" -> {
                if (hasToken(first, "**")) {
                    throw error("invalid syntax", first);
                }
                return new MatchStar(starName(first));
            }
            case "dict_pattern" -> {
                return mappingPattern(first);
            }
            case "class_pattern" -> {
                return classPattern(first);
            }
            default -> throw error("invalid syntax", first);
        }
    }

    private ImmutableList<Pattern> alternatives(TSNode union) {
        MutableList<Pattern> alternatives = Lists.mutable.empty();
        MutableList<TSNode> group = Lists.mutable.empty();
        for (TSNode child : children(union).with(null)) {
            if (child != null && !child.getType().equals("|")) {
                group.add(child);
                continue;
            }
            if (group.size() == 1 && group.getFirst().getType().equals("union_pattern")) {
                alternatives.addAllIterable(alternatives(group.getFirst()));
            } else {
                alternatives.add(simplePattern(group, union));
            }
            group = Lists.mutable.empty();
        }
        return alternatives.toImmutable();
    }

    private String starName(TSNode splat) {
        MutableList<TSNode> named = namedChildren(splat);
        return named.isEmpty() || text(named.getFirst()).equals("_") ? null : text(named.getFirst());
    }

    private MatchValue complexPattern(TSNode node) {
        MutableList<TSNode> parts = children(node);
        int index = 0;
        Expr real;
        if (parts.getFirst().getType().equals("-")) {
            real = new UnaryOp(UnaryOperator.USUB, new Constant(number(parts.get(1))));
            index = 2;
        } else {
            real = new Constant(number(parts.getFirst()));
            index = 1;
        }
        BinaryOperator op = parts.get(index).getType().equals("+") ? BinaryOperator.ADD : BinaryOperator.SUB;
        return new MatchValue(new BinOp(real, op, new Constant(number(parts.get(index + 1)))));
    }

    private MatchMapping mappingPattern(TSNode node) {
        MutableList<Expr> keys = Lists.mutable.empty();
        MutableList<Pattern> patterns = Lists.mutable.empty();
        MutableList<TSNode> key = Lists.mutable.empty();
        String rest = null;
        boolean value = false;
        for (TSNode child : children(node)) {
            switch (child.getType()) {
                case "{", "}", "," -> {
                }
                case ":" -> value = true;
                default -> {
                    if (value) {
                        keys.add(mappingKey(key, node));
                        patterns.add(pattern(child));
                        key = Lists.mutable.empty();
                        value = false;
                    } else if (child.getType().equals("splat_pattern")) {
                        rest = starName(child);
                    } else {
                        key.add(child);
                    }
                }
            }
        }
        return new MatchMapping(keys.toImmutable(), patterns.toImmutable(), rest);
    }

    private Expr mappingKey(MutableList<TSNode> key, TSNode at) {
        Pattern pattern = simplePattern(key, at);
        if (pattern instanceof MatchValue v) {
            return v.value();
        }
        if (pattern instanceof MatchSingleton s) {
            return new Constant(s.value());
        }
        throw error("mapping pattern keys may only match literals and attribute lookups", key.getFirst());
    }

    private MatchClass classPattern(TSNode node) {
        MutableList<Pattern> patterns = Lists.mutable.empty();
        MutableList<String> kwdAttrs = Lists.mutable.empty();
        MutableList<Pattern> kwdPatterns = Lists.mutable.empty();
        for (TSNode argument : namedChildren(node).select(child -> child.getType().equals("case_pattern"))) {
            MutableList<TSNode> parts = children(argument);
            if (parts.size() == 1 && parts.getFirst().getType().equals("keyword_pattern")) {
                MutableList<TSNode> keyword = children(parts.getFirst());
                kwdAttrs.add(text(keyword.getFirst()));
                kwdPatterns.add(simplePattern(keyword.subList(2, keyword.size()), argument));
            } else if (!kwdAttrs.isEmpty()) {
                throw error("positional patterns follow keyword patterns", argument);
            } else {
                patterns.add(pattern(argument));
            }
        }
        return new MatchClass(dottedExpression(childOfType(node, "dotted_name")), patterns.toImmutable(),
            kwdAttrs.toImmutable(), kwdPatterns.toImmutable());
    }

    private Expr dottedExpression(TSNode dottedName) {
        MutableList<TSNode> names = namedChildren(dottedName);
        Expr result = new Name(text(names.getFirst()));
        for (TSNode name : names.subList(1, names.size())) {
            result = new Attribute(result, text(name));
        }
        return result;
    }

    // ============================================================
    // Expressions
    // ============================================================

    private ImmutableList<Expr> expressions(MutableList<TSNode> nodes) {
        return nodes.collect(this::expression).toImmutable();
    }

    Expr expression(TSNode node) {
        return switch (node.getType()) {
            case "identifier", "keyword_identifier" -> new Name(text(node));
            case "integer", "float" -> new Constant(number(node));
            case "true" -> new Constant(Literal.of(true));
            case "false" -> new Constant(Literal.of(false));
            case "none" -> new Constant(new Literal.NoneLiteral());
            case "ellipsis" -> new Constant(new Literal.EllipsisLiteral());
            case "string", "concatenated_string" -> strings(node);
            case "parenthesized_expression" -> expression(namedChildren(node).getFirst());
            case "tuple", "expression_list", "pattern_list" -> new TupleExpr(expressions(namedChildren(node)));
            case "tuple_pattern" -> {
                MutableList<TSNode> elements = namedChildren(node);
                yield elements.size() == 1 && !hasToken(node, ",")
                    ? expression(elements.getFirst())
                    : new TupleExpr(expressions(elements));
            }
            case "list", "list_pattern" -> new ListExpr(expressions(namedChildren(node)));
            case "set" -> new SetExpr(expressions(namedChildren(node)));
            case "dictionary" -> dictionary(node);
            case "list_comprehension" -> new ListComp(expression(field(node, "body")), comprehensions(node));
            case "set_comprehension" -> new SetComp(expression(field(node, "body")), comprehensions(node));
            case "generator_expression" -> new GeneratorExp(expression(field(node, "body")), comprehensions(node));
            case "dictionary_comprehension" -> {
                TSNode pair = field(node, "body");
                yield new DictComp(expression(field(pair, "key")), expression(field(pair, "value")),
                    comprehensions(node));
            }
            case "attribute" -> new Attribute(expression(field(node, "object")), text(field(node, "attribute")));
            case "subscript" -> subscript(node);
            case "slice" -> slice(node);
            case "call" -> call(node);
            case "binary_operator" -> new BinOp(expression(field(node, "left")),
                BinaryOperator.fromSymbol(field(node, "operator").getType()), expression(field(node, "right")));
            case "unary_operator" -> new UnaryOp(unaryOperator(field(node, "operator")),
                expression(field(node, "argument")));
            case "not_operator" -> new UnaryOp(UnaryOperator.NOT, expression(field(node, "argument")));
            case "boolean_operator" -> boolOp(node);
            case "comparison_operator" -> comparison(node);
            case "conditional_expression" -> {
                MutableList<TSNode> parts = namedChildren(node);
                yield new IfExp(expression(parts.get(1)), expression(parts.get(0)), expression(parts.get(2)));
            }
            case "named_expression" -> new NamedExpr(new Name(text(field(node, "name"))),
                expression(field(node, "value")));
            case "lambda" -> {
                TSNode parameters = field(node, "parameters");
                yield new Lambda(parameters == null ? Arguments.empty() : parameters(parameters),
                    expression(field(node, "body")));
            }
            case "await" -> new Await(expression(namedChildren(node).getFirst()));
            case "yield" -> {
                MutableList<TSNode> value = namedChildren(node);
                if (hasToken(node, "from")) {
                    yield new YieldFrom(expression(value.getFirst()));
                }
                yield new Yield(value.isEmpty() ? null : expression(value.getFirst()));
            }
            case "list_splat", "list_splat_pattern" -> new Starred(expression(namedChildren(node).getFirst()));
            default -> throw error("invalid syntax", node);
        };
    }

    private UnaryOperator unaryOperator(TSNode operator) {
        return switch (operator.getType()) {
            case "-" -> UnaryOperator.USUB;
            case "+" -> UnaryOperator.UADD;
            case "~" -> UnaryOperator.INVERT;
            default -> throw error("invalid syntax", operator);
        };
    }

    /** {@code a and b and c} arrives nested to the left; CPython keeps it as one {@link BoolOp}. */
    private BoolOp boolOp(TSNode node) {
        String operator = field(node, "operator").getType();
        BoolOperator op = operator.equals("and") ? BoolOperator.AND : BoolOperator.OR;
        MutableList<Expr> values = Lists.mutable.empty();
        TSNode left = field(node, "left");
        if (left.getType().equals("boolean_operator") && field(left, "operator").getType().equals(operator)) {
            values.addAllIterable(boolOp(left).values());
        } else {
            values.add(expression(left));
        }
        values.add(expression(field(node, "right")));
        return new BoolOp(op, values.toImmutable());
    }

    private Compare comparison(TSNode node) {
        Expr left = null;
        MutableList<CompareOperator> ops = Lists.mutable.empty();
        MutableList<Expr> comparators = Lists.mutable.empty();
        for (TSNode child : children(node)) {
            if (!child.isNamed()) {
                if (child.getType().equals("<>")) {
                    throw error("invalid syntax", child);
                }
                ops.add(CompareOperator.fromSymbol(child.getType()));
            } else if (left == null) {
                left = expression(child);
            } else {
                comparators.add(expression(child));
            }
        }
        return new Compare(left, ops.toImmutable(), comparators.toImmutable());
    }

    private DictExpr dictionary(TSNode node) {
        MutableList<Expr> keys = Lists.mutable.empty();
        MutableList<Expr> values = Lists.mutable.empty();
        for (TSNode entry : namedChildren(node)) {
            if (entry.getType().equals("pair")) {
                keys.add(expression(field(entry, "key")));
                values.add(expression(field(entry, "value")));
            } else {
                keys.add(null);
                values.add(expression(namedChildren(entry).getFirst()));
            }
        }
        return new DictExpr(keys.toImmutable(), values.toImmutable());
    }

    private ImmutableList<Comprehension> comprehensions(TSNode node) {
        MutableList<Comprehension> generators = Lists.mutable.empty();
        MutableList<Expr> ifs = Lists.mutable.empty();
        TSNode current = null;
        for (TSNode clause : namedChildren(node).with(null)) {
            if (clause != null && clause.getType().equals("if_clause")) {
                ifs.add(expression(namedChildren(clause).getFirst()));
                continue;
            }
            if (clause != null && !clause.getType().equals("for_in_clause")) {
                continue;
            }
            if (current != null) {
                generators.add(new Comprehension(target(field(current, "left")), comprehensionIter(current, node),
                    ifs.toImmutable(), hasToken(current, "async")));
                ifs = Lists.mutable.empty();
            }
            current = clause;
        }
        return generators.toImmutable();
    }

    private Expr comprehensionIter(TSNode clause, TSNode comprehension) {
        MutableList<TSNode> iterables = fieldChildren(clause, "right");
        if (iterables.size() > 1 || hasToken(clause, ",")) {
            // f(x for x in y, 1): the grammar folds the trailing arguments into the iterable
            boolean soleArgument = comprehension.getType().equals("generator_expression")
                && comprehension.getParent() != null && comprehension.getParent().getType().equals("call");
            throw error(soleArgument ? "Generator expression must be parenthesized" : "invalid syntax", clause);
        }
        return expression(iterables.getFirst());
    }

    private Subscript subscript(TSNode node) {
        MutableList<TSNode> parts = fieldChildren(node, "subscript");
        Expr slice = parts.size() == 1 && !hasToken(node, ",")
            ? expression(parts.getFirst())
            : new TupleExpr(expressions(parts));
        return new Subscript(expression(field(node, "value")), slice);
    }

    private Slice slice(TSNode node) {
        Expr[] parts = new Expr[3];
        int index = 0;
        for (TSNode child : children(node)) {
            if (child.getType().equals(":")) {
                index++;
            } else {
                parts[index] = expression(child);
            }
        }
        return new Slice(parts[0], parts[1], parts[2]);
    }

    private Call call(TSNode node) {
        Expr func = expression(field(node, "function"));
        TSNode arguments = field(node, "arguments");
        if (arguments.getType().equals("generator_expression")) {
            return new Call(func, Lists.immutable.of(expression(arguments)), Lists.immutable.empty());
        }
        Pair<ImmutableList<Expr>, ImmutableList<Keyword>> parts = callArguments(arguments);
        return new Call(func, parts.getOne(), parts.getTwo());
    }

    private Pair<ImmutableList<Expr>, ImmutableList<Keyword>> callArguments(TSNode argumentList) {
        MutableList<Expr> args = Lists.mutable.empty();
        MutableList<Keyword> keywords = Lists.mutable.empty();
        boolean keywordUnpacking = false;
        for (TSNode argument : namedChildren(argumentList)) {
            switch (argument.getType()) {
                case "keyword_argument" -> keywords.add(
                    new Keyword(text(field(argument, "name")), expression(field(argument, "value"))));
                case "dictionary_splat" -> {
                    keywords.add(new Keyword(null, expression(namedChildren(argument).getFirst())));
                    keywordUnpacking = true;
                }
                case "list_splat" -> {
                    if (keywordUnpacking) {
                        throw error("iterable argument unpacking follows keyword argument unpacking", argument);
                    }
                    args.add(expression(argument));
                }
                default -> {
                    if (keywordUnpacking) {
                        throw error("positional argument follows keyword argument unpacking", argument);
                    }
                    if (!keywords.isEmpty()) {
                        throw error("positional argument follows keyword argument", argument);
                    }
                    args.add(expression(argument));
                }
            }
        }
        return Tuples.pair(args.toImmutable(), keywords.toImmutable());
    }

    // ============================================================
    // Literals
    // ============================================================

    private Literal number(TSNode node) {
        String raw = text(node);
        if (raw.contains("__") || raw.endsWith("_") || raw.contains("_.") || raw.contains("._")) {
            throw error("invalid decimal literal", node);
        }
        String text = raw.replace("_", "");
        String lower = text.toLowerCase();
        try {
            if (lower.startsWith("0x")) {
                return new Literal.IntLiteral(new BigInteger(text.substring(2), 16));
            }
            if (lower.startsWith("0o")) {
                return new Literal.IntLiteral(new BigInteger(text.substring(2), 8));
            }
            if (lower.startsWith("0b")) {
                return new Literal.IntLiteral(new BigInteger(text.substring(2), 2));
            }
            if (lower.endsWith("l")) {
                throw error("invalid decimal literal", node);
            }
            if (lower.endsWith("j")) {
                return new Literal.ImaginaryLiteral(Double.parseDouble(text.substring(0, text.length() - 1)));
            }
            if (lower.indexOf('.') >= 0 || lower.indexOf('e') >= 0) {
                return new Literal.FloatLiteral(Double.parseDouble(text));
            }
            if (text.length() > 1 && text.charAt(0) == '0' && !text.chars().allMatch(c -> c == '0')) {
                throw error("leading zeros in decimal integer literals are not permitted", node);
            }
            return new Literal.IntLiteral(new BigInteger(text));
        } catch (NumberFormatException e) {
            throw error("invalid number literal '" + raw + "'", node);
        }
    }

    /** Adjacent strings concatenate; any f-string among them makes the result a {@link JoinedStr}. */
    private Expr strings(TSNode node) {
        MutableList<TSNode> strings = node.getType().equals("string") ? Lists.mutable.with(node) : namedChildren(node);
        MutableList<Expr> parts = Lists.mutable.empty();
        StringBuilder pending = new StringBuilder();
        boolean formatted = false;
        boolean unicodePrefix = false;
        Boolean bytes = null;
        for (TSNode string : strings) {
            MutableList<TSNode> children = children(string);
            TSNode start = children.getFirst();
            TSNode end = children.getLast();
            String opener = text(start);
            int quoteIndex = Math.max(0, Math.min(indexOrLength(opener, '\''), indexOrLength(opener, '"')));
            String prefix = opener.substring(0, quoteIndex).toLowerCase();
            if (!STRING_PREFIXES.contains(prefix)) {
                throw error("invalid syntax", string);
            }
            boolean isBytes = prefix.indexOf('b') >= 0;
            if (bytes != null && bytes != isBytes) {
                throw error("cannot mix bytes and nonbytes literals", string);
            }
            if (bytes == null) {
                unicodePrefix = prefix.equals("u");
            }
            bytes = isBytes;
            boolean raw = prefix.indexOf('r') >= 0;
            int bodyStart = start.getEndByte();
            int bodyEnd = end.getStartByte();
            if (prefix.indexOf('f') < 0) {
                TSPoint point = string.getStartPoint();
                pending.append(StringLiterals.decode(text(bodyStart, bodyEnd), raw, isBytes,
                    point.getRow() + 1, point.getColumn() + 1));
                continue;
            }
            formatted = true;
            String quote = opener.substring(quoteIndex);
            for (Expr part : new FStringParser(this, raw, quote).parse(string, bodyStart, bodyEnd)) {
                if (part instanceof Constant c && c.value() instanceof Literal.StringLiteral s) {
                    pending.append(s.value());
                } else {
                    flushPending(pending, parts);
                    parts.add(part);
                }
            }
        }
        if (Boolean.TRUE.equals(bytes)) {
            return new Constant(new Literal.BytesLiteral(pending.toString()));
        }
        if (!formatted) {
            return new Constant(new Literal.StringLiteral(pending.toString(), unicodePrefix));
        }
        flushPending(pending, parts);
        return new JoinedStr(parts.toImmutable());
    }

    private static int indexOrLength(String text, char c) {
        int index = text.indexOf(c);
        return index < 0 ? text.length() : index;
    }

    private static void flushPending(StringBuilder pending, MutableList<Expr> parts) {
        if (pending.length() > 0) {
            parts.add(new Constant(Literal.of(pending.toString())));
            pending.setLength(0);
        }
    }
}
