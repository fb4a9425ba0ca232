package com.jpyq.ast;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Python syntax tree, modelled on the node classes of CPython's {@code ast} module.
 * <p>
 * Optional children are {@code null}. Source positions and expression contexts are not
 * kept, so two trees are equal exactly when their structure is.
 */
public sealed interface PyNode {

    /** Nodes holding a statement body. */
    interface WithBody {
        ImmutableList<Stmt> body();
    }

    record Module(ImmutableList<Stmt> body) implements PyNode, WithBody {
        public static Module of(Iterable<? extends Stmt> body) {
            return new Module(Lists.immutable.ofAll(body));
        }
    }

    // ============================================================
    // Statements
    // ============================================================

    sealed interface Stmt extends PyNode {}

    record FunctionDef(String name, Arguments args, ImmutableList<Stmt> body,
                       ImmutableList<Expr> decoratorList, Expr returns, boolean isAsync)
            implements Stmt, WithBody {}

    record ClassDef(String name, ImmutableList<Expr> bases, ImmutableList<Keyword> keywords,
                    ImmutableList<Stmt> body, ImmutableList<Expr> decoratorList)
            implements Stmt, WithBody {}

    record Return(Expr value) implements Stmt {}

    record Delete(ImmutableList<Expr> targets) implements Stmt {}

    record Assign(ImmutableList<Expr> targets, Expr value) implements Stmt {}

    record AugAssign(Expr target, BinaryOperator op, Expr value) implements Stmt {}

    /** {@code simple} is false when a plain name target was written in parentheses. */
    record AnnAssign(Expr target, Expr annotation, Expr value, boolean simple) implements Stmt {}

    record For(Expr target, Expr iter, ImmutableList<Stmt> body, ImmutableList<Stmt> orelse,
               boolean isAsync) implements Stmt, WithBody {}

    record While(Expr test, ImmutableList<Stmt> body, ImmutableList<Stmt> orelse)
            implements Stmt, WithBody {}

    /** An {@code elif} is an {@code If} that is the only statement of the enclosing orelse. */
    record If(Expr test, ImmutableList<Stmt> body, ImmutableList<Stmt> orelse)
            implements Stmt, WithBody {}

    record With(ImmutableList<WithItem> items, ImmutableList<Stmt> body, boolean isAsync)
            implements Stmt, WithBody {}

    record Raise(Expr exc, Expr cause) implements Stmt {}

    record Try(ImmutableList<Stmt> body, ImmutableList<ExceptHandler> handlers,
               ImmutableList<Stmt> orelse, ImmutableList<Stmt> finalbody)
            implements Stmt, WithBody {}

    /** {@code try} whose handlers are {@code except*} clauses. */
    record TryStar(ImmutableList<Stmt> body, ImmutableList<ExceptHandler> handlers,
                   ImmutableList<Stmt> orelse, ImmutableList<Stmt> finalbody)
            implements Stmt, WithBody {}

    record Assert(Expr test, Expr msg) implements Stmt {}

    record Import(ImmutableList<Alias> names) implements Stmt {}

    record ImportFrom(String module, ImmutableList<Alias> names, int level) implements Stmt {}

    record Global(ImmutableList<String> names) implements Stmt {}

    record Nonlocal(ImmutableList<String> names) implements Stmt {}

    /** An expression used as a statement ({@code Expr} in CPython). */
    record ExprStmt(Expr value) implements Stmt {}

    record Match(Expr subject, ImmutableList<MatchCase> cases) implements Stmt {}

    record Pass() implements Stmt {}

    record Break() implements Stmt {}

    record Continue() implements Stmt {}

    // ============================================================
    // Expressions
    // ============================================================

    sealed interface Expr extends PyNode {}

    record BoolOp(BoolOperator op, ImmutableList<Expr> values) implements Expr {}

    record NamedExpr(Name target, Expr value) implements Expr {}

    record BinOp(Expr left, BinaryOperator op, Expr right) implements Expr {}

    record UnaryOp(UnaryOperator op, Expr operand) implements Expr {}

    record Lambda(Arguments args, Expr body) implements Expr {}

    record IfExp(Expr test, Expr body, Expr orelse) implements Expr {}

    /** A {@code null} key marks a {@code **mapping} entry. */
    record DictExpr(ImmutableList<Expr> keys, ImmutableList<Expr> values) implements Expr {}

    record SetExpr(ImmutableList<Expr> elts) implements Expr {}

    record ListComp(Expr elt, ImmutableList<Comprehension> generators) implements Expr {}

    record SetComp(Expr elt, ImmutableList<Comprehension> generators) implements Expr {}

    record DictComp(Expr key, Expr value, ImmutableList<Comprehension> generators) implements Expr {}

    record GeneratorExp(Expr elt, ImmutableList<Comprehension> generators) implements Expr {}

    record Await(Expr value) implements Expr {}

    record Yield(Expr value) implements Expr {}

    record YieldFrom(Expr value) implements Expr {}

    record Compare(Expr left, ImmutableList<CompareOperator> ops, ImmutableList<Expr> comparators)
            implements Expr {}

    record Call(Expr func, ImmutableList<Expr> args, ImmutableList<Keyword> keywords) implements Expr {}

    /**
     * A replacement field of an f-string. {@code conversion} is {@code 's'}, {@code 'r'},
     * {@code 'a'} or {@link #NO_CONVERSION}.
     */
    record FormattedValue(Expr value, int conversion, JoinedStr formatSpec) implements Expr {
        public static final int NO_CONVERSION = -1;
    }

    record JoinedStr(ImmutableList<Expr> values) implements Expr {}

    record Constant(Literal value) implements Expr {}

    record Attribute(Expr value, String attr) implements Expr {}

    record Subscript(Expr value, Expr slice) implements Expr {}

    record Starred(Expr value) implements Expr {}

    record Name(String id) implements Expr {}

    record ListExpr(ImmutableList<Expr> elts) implements Expr {}

    record TupleExpr(ImmutableList<Expr> elts) implements Expr {}

    record Slice(Expr lower, Expr upper, Expr step) implements Expr {}

    // ============================================================
    // Auxiliary nodes
    // ============================================================

    /** {@code kwDefaults} is parallel to {@code kwonlyargs} and may hold nulls. */
    record Arguments(ImmutableList<Arg> posonlyargs, ImmutableList<Arg> args, Arg vararg,
                     ImmutableList<Arg> kwonlyargs, ImmutableList<Expr> kwDefaults, Arg kwarg,
                     ImmutableList<Expr> defaults) implements PyNode {

        public static Arguments empty() {
            return new Arguments(Lists.immutable.empty(), Lists.immutable.empty(), null,
                    Lists.immutable.empty(), Lists.immutable.empty(), null, Lists.immutable.empty());
        }

        public boolean isEmpty() {
            return posonlyargs.isEmpty() && args.isEmpty() && vararg == null
                    && kwonlyargs.isEmpty() && kwarg == null;
        }
    }

    record Arg(String arg, Expr annotation) implements PyNode {}

    /** {@code arg} is {@code null} for {@code **kwargs}. */
    record Keyword(String arg, Expr value) implements PyNode {}

    record Alias(String name, String asname) implements PyNode {}

    record ExceptHandler(Expr type, String name, ImmutableList<Stmt> body) implements PyNode, WithBody {}

    record WithItem(Expr contextExpr, Expr optionalVars) implements PyNode {}

    record Comprehension(Expr target, Expr iter, ImmutableList<Expr> ifs, boolean isAsync)
            implements PyNode {}

    /** One {@code case} of a {@link Match}; {@code guard} is {@code null} without an {@code if}. */
    record MatchCase(Pattern pattern, Expr guard, ImmutableList<Stmt> body) implements PyNode, WithBody {}

    // ============================================================
    // Match patterns
    // ============================================================

    sealed interface Pattern extends PyNode {}

    record MatchValue(Expr value) implements Pattern {}

    /** {@code None}, {@code True} or {@code False}. */
    record MatchSingleton(Literal value) implements Pattern {}

    record MatchSequence(ImmutableList<Pattern> patterns) implements Pattern {}

    /** {@code rest} is the name bound by {@code **rest}, or {@code null}. */
    record MatchMapping(ImmutableList<Expr> keys, ImmutableList<Pattern> patterns, String rest)
            implements Pattern {}

    record MatchClass(Expr cls, ImmutableList<Pattern> patterns, ImmutableList<String> kwdAttrs,
                      ImmutableList<Pattern> kwdPatterns) implements Pattern {}

    /** {@code name} is {@code null} for {@code *_}. */
    record MatchStar(String name) implements Pattern {}

    /** Capture ({@code x}), alias ({@code p as x}) or wildcard ({@code _}, both parts null). */
    record MatchAs(Pattern pattern, String name) implements Pattern {}

    record MatchOr(ImmutableList<Pattern> patterns) implements Pattern {}
}
