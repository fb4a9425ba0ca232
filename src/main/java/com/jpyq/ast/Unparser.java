package com.jpyq.ast;

import com.jpyq.ast.PyNode.*;
import com.jpyq.ast.PyNode.Module;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.tuple.Tuples;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Serializes a syntax tree back to canonical Python source, in the manner of {@code ast.unparse}.
 * <p>
 * Output uses four-space indentation, parentheses only where precedence requires them and
 * Python's {@code repr} for literals. Two trees produce the same text exactly when they are
 * structurally equal, up to the wrapper that holds them.
 */
public final class Unparser {
    private static final String INDENT = "    ";
    // repr of float('inf') is not valid source; CPython writes an overflowing literal instead
    private static final String INFINITY = "1e309";
    private static final int MAX_FLOAT_DIGITS = 17;
    private static final ImmutableList<String> ALL_QUOTES = Lists.immutable.of("'", "\"", "\"\"\"", "'''");
    private static final ImmutableList<String> MULTI_QUOTES = Lists.immutable.of("\"\"\"", "'''");

    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    private final StringBuilder sb;
    // strings inside f-string replacement fields are written without backslashes
    private final boolean insideFString;
    private int indent;

    private Unparser(StringBuilder sb, boolean insideFString) {
        this.sb = sb;
        this.insideFString = insideFString;
    }

    public static String unparse(PyNode node) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);
        new Unparser(sb, false).node(node);
        return sb.toString();
    }

    /** Statements are laid out as a block; any other nodes are written one per line. */
    public static String unparse(Iterable<? extends PyNode> nodes) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);
        Unparser unparser = new Unparser(sb, false);
        for (PyNode node : nodes) {
            if (!(node instanceof Stmt) && sb.length() > 0) {
                sb.append('\n');
            }
            unparser.node(node);
        }
        return sb.toString();
    }

    // ============================================================
    // Dispatch
    // ============================================================

    private void node(PyNode node) {
        if (node instanceof Module m) {
            bodyWithDocstring(m.body());
        } else if (node instanceof Stmt s) {
            statement(s);
        } else if (node instanceof Expr e) {
            expr(e, Precedence.TEST);
        } else if (node instanceof Arguments a) {
            arguments(a);
        } else if (node instanceof Arg a) {
            arg(a);
        } else if (node instanceof Keyword k) {
            keyword(k);
        } else if (node instanceof Alias a) {
            alias(a);
        } else if (node instanceof ExceptHandler h) {
            exceptHandler(h, false);
        } else if (node instanceof WithItem w) {
            withItem(w);
        } else if (node instanceof Comprehension c) {
            comprehension(c);
        } else if (node instanceof MatchCase c) {
            matchCase(c);
        } else if (node instanceof Pattern p) {
            pattern(p, Precedence.TEST);
        } else {
            throw new IllegalArgumentException("Unsupported node: " + node);
        }
    }

    // ============================================================
    // Statements
    // ============================================================

    private void statements(ImmutableList<? extends Stmt> body) {
        for (Stmt stmt : body) {
            statement(stmt);
        }
    }

    private void fill(String text) {
        if (sb.length() > 0) {
            sb.append('\n');
        }
        sb.append(INDENT.repeat(indent)).append(text);
    }

    private void maybeNewline() {
        if (sb.length() > 0) {
            sb.append('\n');
        }
    }

    private void block(ImmutableList<Stmt> body) {
        sb.append(':');
        indent++;
        statements(body);
        indent--;
    }

    /** Body of a module, class or function, whose leading string is written as a docstring. */
    private void bodyWithDocstring(ImmutableList<Stmt> body) {
        if (!body.isEmpty() && body.get(0) instanceof ExprStmt e
                && e.value() instanceof Constant c && c.value() instanceof Literal.StringLiteral docstring) {
            fill("");
            if (docstring.unicodePrefix()) {
                sb.append('u');
            }
            writeStrAvoidingBackslashes(docstring.value(), MULTI_QUOTES);
            statements(body.drop(1));
        } else {
            statements(body);
        }
    }

    private void statement(Stmt stmt) {
        if (stmt instanceof ExprStmt s) {
            fill("");
            expr(s.value(), Precedence.YIELD);
        } else if (stmt instanceof Assign a) {
            fill("");
            for (Expr target : a.targets()) {
                expr(target, Precedence.TUPLE);
                sb.append(" = ");
            }
            expr(a.value(), Precedence.TEST);
        } else if (stmt instanceof AugAssign a) {
            fill("");
            expr(a.target(), Precedence.TEST);
            sb.append(' ').append(a.op().symbol()).append("= ");
            expr(a.value(), Precedence.TEST);
        } else if (stmt instanceof AnnAssign a) {
            fill("");
            boolean parens = !a.simple() && a.target() instanceof Name;
            if (parens) {
                sb.append('(');
            }
            expr(a.target(), Precedence.TEST);
            if (parens) {
                sb.append(')');
            }
            sb.append(": ");
            expr(a.annotation(), Precedence.TEST);
            if (a.value() != null) {
                sb.append(" = ");
                expr(a.value(), Precedence.TEST);
            }
        } else if (stmt instanceof Return r) {
            fill("return");
            if (r.value() != null) {
                sb.append(' ');
                expr(r.value(), Precedence.TEST);
            }
        } else if (stmt instanceof Pass) {
            fill("pass");
        } else if (stmt instanceof Break) {
            fill("break");
        } else if (stmt instanceof Continue) {
            fill("continue");
        } else if (stmt instanceof Delete d) {
            fill("del ");
            exprList(d.targets(), Precedence.TEST);
        } else if (stmt instanceof Assert a) {
            fill("assert ");
            expr(a.test(), Precedence.TEST);
            if (a.msg() != null) {
                sb.append(", ");
                expr(a.msg(), Precedence.TEST);
            }
        } else if (stmt instanceof Global g) {
            fill("global " + String.join(", ", g.names().castToList()));
        } else if (stmt instanceof Nonlocal n) {
            fill("nonlocal " + String.join(", ", n.names().castToList()));
        } else if (stmt instanceof Import i) {
            fill("import ");
            aliases(i.names());
        } else if (stmt instanceof ImportFrom i) {
            fill("from " + ".".repeat(i.level()) + (i.module() == null ? "" : i.module()) + " import ");
            aliases(i.names());
        } else if (stmt instanceof Raise r) {
            fill("raise");
            if (r.exc() != null) {
                sb.append(' ');
                expr(r.exc(), Precedence.TEST);
            }
            if (r.cause() != null) {
                sb.append(" from ");
                expr(r.cause(), Precedence.TEST);
            }
        } else if (stmt instanceof If i) {
            ifStatement(i);
        } else if (stmt instanceof While w) {
            fill("while ");
            expr(w.test(), Precedence.TEST);
            block(w.body());
            orelse(w.orelse());
        } else if (stmt instanceof For f) {
            fill(f.isAsync() ? "async for " : "for ");
            expr(f.target(), Precedence.TUPLE);
            sb.append(" in ");
            expr(f.iter(), Precedence.TEST);
            block(f.body());
            orelse(f.orelse());
        } else if (stmt instanceof With w) {
            fill(w.isAsync() ? "async with " : "with ");
            for (int i = 0; i < w.items().size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                withItem(w.items().get(i));
            }
            block(w.body());
        } else if (stmt instanceof Try t) {
            fill("try");
            block(t.body());
            for (ExceptHandler handler : t.handlers()) {
                exceptHandler(handler, false);
            }
            orelse(t.orelse());
            if (!t.finalbody().isEmpty()) {
                fill("finally");
                block(t.finalbody());
            }
        } else if (stmt instanceof TryStar t) {
            fill("try");
            block(t.body());
            for (ExceptHandler handler : t.handlers()) {
                exceptHandler(handler, true);
            }
            orelse(t.orelse());
            if (!t.finalbody().isEmpty()) {
                fill("finally");
                block(t.finalbody());
            }
        } else if (stmt instanceof Match m) {
            fill("match ");
            expr(m.subject(), Precedence.TEST);
            sb.append(':');
            indent++;
            for (MatchCase matchCase : m.cases()) {
                matchCase(matchCase);
            }
            indent--;
        } else if (stmt instanceof FunctionDef f) {
            maybeNewline();
            decorators(f.decoratorList());
            fill((f.isAsync() ? "async def " : "def ") + f.name() + "(");
            arguments(f.args());
            sb.append(')');
            if (f.returns() != null) {
                sb.append(" -> ");
                expr(f.returns(), Precedence.TEST);
            }
            sb.append(':');
            indent++;
            bodyWithDocstring(f.body());
            indent--;
        } else if (stmt instanceof ClassDef c) {
            maybeNewline();
            decorators(c.decoratorList());
            fill("class " + c.name());
            if (!c.bases().isEmpty() || !c.keywords().isEmpty()) {
                sb.append('(');
                exprList(c.bases(), Precedence.TEST);
                for (int i = 0; i < c.keywords().size(); i++) {
                    if (i > 0 || !c.bases().isEmpty()) {
                        sb.append(", ");
                    }
                    keyword(c.keywords().get(i));
                }
                sb.append(')');
            }
            sb.append(':');
            indent++;
            bodyWithDocstring(c.body());
            indent--;
        } else {
            throw new IllegalArgumentException("Unsupported statement: " + stmt);
        }
    }

    private void ifStatement(If node) {
        fill("if ");
        expr(node.test(), Precedence.TEST);
        block(node.body());
        ImmutableList<Stmt> orelse = node.orelse();
        while (orelse.size() == 1 && orelse.get(0) instanceof If elif) {
            fill("elif ");
            expr(elif.test(), Precedence.TEST);
            block(elif.body());
            orelse = elif.orelse();
        }
        orelse(orelse);
    }

    private void orelse(ImmutableList<Stmt> orelse) {
        if (!orelse.isEmpty()) {
            fill("else");
            block(orelse);
        }
    }

    private void decorators(ImmutableList<Expr> decorators) {
        for (Expr decorator : decorators) {
            fill("@");
            expr(decorator, Precedence.TEST);
        }
    }

    private void exceptHandler(ExceptHandler handler, boolean star) {
        fill(star ? "except*" : "except");
        if (handler.type() != null) {
            sb.append(' ');
            expr(handler.type(), Precedence.TEST);
        }
        if (handler.name() != null) {
            sb.append(" as ").append(handler.name());
        }
        block(handler.body());
    }

    private void withItem(WithItem item) {
        expr(item.contextExpr(), Precedence.TEST);
        if (item.optionalVars() != null) {
            sb.append(" as ");
            expr(item.optionalVars(), Precedence.TEST);
        }
    }

    private void aliases(ImmutableList<Alias> names) {
        for (int i = 0; i < names.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            alias(names.get(i));
        }
    }

    private void alias(Alias alias) {
        sb.append(alias.name());
        if (alias.asname() != null) {
            sb.append(" as ").append(alias.asname());
        }
    }

    private void arguments(Arguments args) {
        boolean first = true;
        int positional = args.posonlyargs().size() + args.args().size();
        int firstDefault = positional - args.defaults().size();
        for (int index = 0; index < positional; index++) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            Arg a = index < args.posonlyargs().size()
                ? args.posonlyargs().get(index)
                : args.args().get(index - args.posonlyargs().size());
            arg(a);
            if (index >= firstDefault) {
                sb.append('=');
                expr(args.defaults().get(index - firstDefault), Precedence.TEST);
            }
            if (index == args.posonlyargs().size() - 1) {
                sb.append(", /");
            }
        }
        if (args.vararg() != null || !args.kwonlyargs().isEmpty()) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append('*');
            if (args.vararg() != null) {
                arg(args.vararg());
            }
        }
        for (int i = 0; i < args.kwonlyargs().size(); i++) {
            sb.append(", ");
            arg(args.kwonlyargs().get(i));
            Expr kwDefault = args.kwDefaults().get(i);
            if (kwDefault != null) {
                sb.append('=');
                expr(kwDefault, Precedence.TEST);
            }
        }
        if (args.kwarg() != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("**");
            arg(args.kwarg());
        }
    }

    private void arg(Arg arg) {
        sb.append(arg.arg());
        if (arg.annotation() != null) {
            sb.append(": ");
            expr(arg.annotation(), Precedence.TEST);
        }
    }

    private void keyword(Keyword keyword) {
        if (keyword.arg() == null) {
            sb.append("**");
            expr(keyword.value(), Precedence.EXPR);
        } else {
            sb.append(keyword.arg()).append('=');
            expr(keyword.value(), Precedence.TEST);
        }
    }

    // ============================================================
    // Expressions
    // ============================================================

    private void exprList(ImmutableList<Expr> exprs, Precedence precedence) {
        for (int i = 0; i < exprs.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            expr(exprs.get(i), precedence);
        }
    }

    private boolean open(Precedence context, Precedence own) {
        boolean parens = context.compareTo(own) > 0;
        if (parens) {
            sb.append('(');
        }
        return parens;
    }

    private void close(boolean parens) {
        if (parens) {
            sb.append(')');
        }
    }

    private void expr(Expr expr, Precedence context) {
        if (expr instanceof Constant c) {
            constant(c.value());
        } else if (expr instanceof Name n) {
            sb.append(n.id());
        } else if (expr instanceof BinOp b) {
            Precedence own = b.op().precedence();
            boolean parens = open(context, own);
            boolean rightAssociative = b.op() == BinaryOperator.POW;
            expr(b.left(), rightAssociative ? own.next() : own);
            sb.append(' ').append(b.op().symbol()).append(' ');
            expr(b.right(), rightAssociative ? own : own.next());
            close(parens);
        } else if (expr instanceof UnaryOp u) {
            Precedence own = u.op().precedence();
            boolean parens = open(context, own);
            sb.append(u.op().symbol());
            if (own != Precedence.FACTOR) {
                sb.append(' ');
            }
            expr(u.operand(), own);
            close(parens);
        } else if (expr instanceof BoolOp b) {
            Precedence own = b.op().precedence();
            boolean parens = open(context, own);
            // each operand binds one level tighter than the one before it
            Precedence level = own;
            for (int i = 0; i < b.values().size(); i++) {
                if (i > 0) {
                    sb.append(' ').append(b.op().symbol()).append(' ');
                }
                level = level.next();
                expr(b.values().get(i), level);
            }
            close(parens);
        } else if (expr instanceof Compare c) {
            boolean parens = open(context, Precedence.CMP);
            expr(c.left(), Precedence.CMP.next());
            for (int i = 0; i < c.ops().size(); i++) {
                sb.append(' ').append(c.ops().get(i).symbol()).append(' ');
                expr(c.comparators().get(i), Precedence.CMP.next());
            }
            close(parens);
        } else if (expr instanceof NamedExpr n) {
            boolean parens = open(context, Precedence.NAMED_EXPR);
            sb.append(n.target().id()).append(" := ");
            expr(n.value(), Precedence.TEST);
            close(parens);
        } else if (expr instanceof IfExp i) {
            boolean parens = open(context, Precedence.TEST);
            expr(i.body(), Precedence.TEST.next());
            sb.append(" if ");
            expr(i.test(), Precedence.TEST.next());
            sb.append(" else ");
            expr(i.orelse(), Precedence.TEST);
            close(parens);
        } else if (expr instanceof Lambda l) {
            boolean parens = open(context, Precedence.TEST);
            sb.append("lambda");
            if (!l.args().isEmpty()) {
                sb.append(' ');
                arguments(l.args());
            }
            sb.append(": ");
            expr(l.body(), Precedence.TEST);
            close(parens);
        } else if (expr instanceof Await a) {
            boolean parens = open(context, Precedence.AWAIT);
            sb.append("await ");
            expr(a.value(), Precedence.ATOM);
            close(parens);
        } else if (expr instanceof Yield y) {
            boolean parens = open(context, Precedence.YIELD);
            sb.append("yield");
            if (y.value() != null) {
                sb.append(' ');
                expr(y.value(), Precedence.TEST);
            }
            close(parens);
        } else if (expr instanceof YieldFrom y) {
            boolean parens = open(context, Precedence.YIELD);
            sb.append("yield from ");
            expr(y.value(), Precedence.TEST);
            close(parens);
        } else if (expr instanceof Starred s) {
            sb.append('*');
            expr(s.value(), Precedence.EXPR);
        } else if (expr instanceof Attribute a) {
            expr(a.value(), Precedence.ATOM);
            // "1.real" would lex as a float
            if (a.value() instanceof Constant c && c.value() instanceof Literal.IntLiteral) {
                sb.append(' ');
            }
            sb.append('.').append(a.attr());
        } else if (expr instanceof Call c) {
            expr(c.func(), Precedence.ATOM);
            sb.append('(');
            exprList(c.args(), Precedence.TEST);
            for (int i = 0; i < c.keywords().size(); i++) {
                if (i > 0 || !c.args().isEmpty()) {
                    sb.append(", ");
                }
                keyword(c.keywords().get(i));
            }
            sb.append(')');
        } else if (expr instanceof Subscript s) {
            expr(s.value(), Precedence.ATOM);
            sb.append('[');
            if (s.slice() instanceof TupleExpr t && !t.elts().isEmpty()) {
                exprList(t.elts(), Precedence.TEST);
                if (t.elts().size() == 1) {
                    sb.append(',');
                }
            } else {
                expr(s.slice(), Precedence.TEST);
            }
            sb.append(']');
        } else if (expr instanceof Slice s) {
            if (s.lower() != null) {
                expr(s.lower(), Precedence.TEST);
            }
            sb.append(':');
            if (s.upper() != null) {
                expr(s.upper(), Precedence.TEST);
            }
            if (s.step() != null) {
                sb.append(':');
                expr(s.step(), Precedence.TEST);
            }
        } else if (expr instanceof ListExpr l) {
            sb.append('[');
            exprList(l.elts(), Precedence.TEST);
            sb.append(']');
        } else if (expr instanceof TupleExpr t) {
            boolean parens = t.elts().isEmpty() || context.compareTo(Precedence.TUPLE) > 0;
            if (parens) {
                sb.append('(');
            }
            exprList(t.elts(), Precedence.TEST);
            if (t.elts().size() == 1) {
                sb.append(',');
            }
            close(parens);
        } else if (expr instanceof SetExpr s) {
            if (s.elts().isEmpty()) {
                sb.append("{*()}");
            } else {
                sb.append('{');
                exprList(s.elts(), Precedence.TEST);
                sb.append('}');
            }
        } else if (expr instanceof DictExpr d) {
            sb.append('{');
            for (int i = 0; i < d.keys().size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                Expr key = d.keys().get(i);
                if (key == null) {
                    sb.append("**");
                    expr(d.values().get(i), Precedence.EXPR);
                } else {
                    expr(key, Precedence.TEST);
                    sb.append(": ");
                    expr(d.values().get(i), Precedence.TEST);
                }
            }
            sb.append('}');
        } else if (expr instanceof ListComp c) {
            sb.append('[');
            expr(c.elt(), Precedence.TEST);
            generators(c.generators());
            sb.append(']');
        } else if (expr instanceof SetComp c) {
            sb.append('{');
            expr(c.elt(), Precedence.TEST);
            generators(c.generators());
            sb.append('}');
        } else if (expr instanceof DictComp c) {
            sb.append('{');
            expr(c.key(), Precedence.TEST);
            sb.append(": ");
            expr(c.value(), Precedence.TEST);
            generators(c.generators());
            sb.append('}');
        } else if (expr instanceof GeneratorExp g) {
            sb.append('(');
            expr(g.elt(), Precedence.TEST);
            generators(g.generators());
            sb.append(')');
        } else if (expr instanceof JoinedStr j) {
            joinedStr(j);
        } else if (expr instanceof FormattedValue f) {
            joinedStr(new JoinedStr(Lists.immutable.of(f)));
        } else {
            throw new IllegalArgumentException("Unsupported expression: " + expr);
        }
    }

    private void generators(ImmutableList<Comprehension> generators) {
        for (Comprehension generator : generators) {
            comprehension(generator);
        }
    }

    private void comprehension(Comprehension generator) {
        sb.append(generator.isAsync() ? " async for " : " for ");
        expr(generator.target(), Precedence.TUPLE);
        sb.append(" in ");
        expr(generator.iter(), Precedence.TEST.next());
        for (Expr condition : generator.ifs()) {
            sb.append(" if ");
            expr(condition, Precedence.TEST.next());
        }
    }

    // ============================================================
    // f-strings
    // ============================================================

    private void joinedStr(JoinedStr node) {
        sb.append('f');
        if (insideFString) {
            StringBuilder buffer = new StringBuilder();
            fstringInner(node, buffer);
            writeStrAvoidingBackslashes(buffer.toString(), ALL_QUOTES);
            return;
        }
        // literal parts may use escapes; replacement fields may not
        StringBuilder text = new StringBuilder();
        ImmutableList<String> quoteTypes = ALL_QUOTES;
        for (Expr value : node.values()) {
            StringBuilder buffer = new StringBuilder();
            fstringInner(value, buffer);
            Pair<String, ImmutableList<String>> part = strLiteralHelper(buffer.toString(), quoteTypes, value instanceof Constant);
            text.append(part.getOne());
            quoteTypes = part.getTwo();
        }
        String quote = quoteTypes.getFirst();
        sb.append(quote).append(text).append(quote);
    }

    private static void fstringInner(Expr node, StringBuilder buffer) {
        if (node instanceof JoinedStr j) {
            for (Expr value : j.values()) {
                fstringInner(value, buffer);
            }
        } else if (node instanceof Constant c && c.value() instanceof Literal.StringLiteral s) {
            buffer.append(s.value().replace("{", "{{").replace("}", "}}"));
        } else if (node instanceof FormattedValue f) {
            StringBuilder inner = new StringBuilder();
            new Unparser(inner, true).expr(f.value(), Precedence.TEST.next());
            if (inner.indexOf("\\") >= 0) {
                throw new IllegalArgumentException("Unable to avoid backslash in f-string expression part");
            }
            buffer.append('{');
            if (inner.length() > 0 && inner.charAt(0) == '{') {
                buffer.append(' ');
            }
            buffer.append(inner);
            if (f.conversion() != FormattedValue.NO_CONVERSION) {
                buffer.append('!').append((char) f.conversion());
            }
            if (f.formatSpec() != null) {
                buffer.append(':');
                fstringInner(f.formatSpec(), buffer);
            }
            buffer.append('}');
        } else {
            throw new IllegalArgumentException("Unexpected f-string part: " + node);
        }
    }

    private void writeStrAvoidingBackslashes(String value, ImmutableList<String> quoteTypes) {
        Pair<String, ImmutableList<String>> literal = strLiteralHelper(value, quoteTypes, false);
        String quote = literal.getTwo().getFirst();
        sb.append(quote).append(literal.getOne()).append(quote);
    }

    /**
     * Escapes {@code value} and narrows {@code quoteTypes} to the quotes that can still delimit it,
     * best first. Newlines and tabs stay literal unless {@code escapeSpecialWhitespace} is set.
     */
    private static Pair<String, ImmutableList<String>> strLiteralHelper(
            String value, ImmutableList<String> quoteTypes, boolean escapeSpecialWhitespace) {
        StringBuilder escaped = new StringBuilder(value.length());
        value.codePoints().forEach(c -> {
            if (!escapeSpecialWhitespace && (c == '\n' || c == '\t')) {
                escaped.appendCodePoint(c);
            } else if (c == '\\' || !isPrintable(c)) {
                escaped.append(unicodeEscape(c));
            } else {
                escaped.appendCodePoint(c);
            }
        });
        String text = escaped.toString();
        ImmutableList<String> possible = quoteTypes;
        if (text.indexOf('\n') >= 0) {
            possible = possible.select(MULTI_QUOTES::contains);
        }
        possible = possible.reject(text::contains);
        if (possible.isEmpty()) {
            String repr = stringRepr(value);
            char quote = repr.charAt(0);
            String fallback = quoteTypes.detectIfNone(q -> q.charAt(0) == quote, () -> String.valueOf(quote));
            return Tuples.pair(repr.substring(1, repr.length() - 1), Lists.immutable.of(fallback));
        }
        if (!text.isEmpty()) {
            char last = text.charAt(text.length() - 1);
            possible = possible.toSortedListBy(q -> q.charAt(0) == last).toImmutable();
            // a triple-quoted string cannot end with its own quote character
            if (possible.getFirst().charAt(0) == last) {
                text = text.substring(0, text.length() - 1) + "\\" + last;
            }
        }
        return Tuples.pair(text, possible);
    }

    /** Python's {@code str.isprintable} for one code point. */
    private static boolean isPrintable(int c) {
        if (c == ' ') {
            return true;
        }
        switch (Character.getType(c)) {
            case Character.CONTROL, Character.FORMAT, Character.SURROGATE, Character.PRIVATE_USE,
                 Character.UNASSIGNED, Character.LINE_SEPARATOR, Character.PARAGRAPH_SEPARATOR,
                 Character.SPACE_SEPARATOR -> {
                return false;
            }
            default -> {
                return true;
            }
        }
    }

    /** The {@code unicode_escape} spelling of one code point. */
    private static String unicodeEscape(int c) {
        switch (c) {
            case '\\' -> {
                return "\\\\";
            }
            case '\n' -> {
                return "\\n";
            }
            case '\r' -> {
                return "\\r";
            }
            case '\t' -> {
                return "\\t";
            }
            default -> {
                if (c < 0x100) {
                    return String.format("\\x%02x", c);
                }
                return c < 0x10000 ? String.format("\\u%04x", c) : String.format("\\U%08x", c);
            }
        }
    }

    // ============================================================
    // Match patterns
    // ============================================================

    private void matchCase(MatchCase matchCase) {
        fill("case ");
        pattern(matchCase.pattern(), Precedence.TEST);
        if (matchCase.guard() != null) {
            sb.append(" if ");
            expr(matchCase.guard(), Precedence.TEST);
        }
        block(matchCase.body());
    }

    private void patterns(ImmutableList<Pattern> patterns) {
        for (int i = 0; i < patterns.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            pattern(patterns.get(i), Precedence.TEST);
        }
    }

    private void pattern(Pattern pattern, Precedence context) {
        if (pattern instanceof MatchValue v) {
            expr(v.value(), Precedence.TEST);
        } else if (pattern instanceof MatchSingleton s) {
            sb.append(repr(s.value()));
        } else if (pattern instanceof MatchSequence s) {
            sb.append('[');
            patterns(s.patterns());
            sb.append(']');
        } else if (pattern instanceof MatchStar s) {
            sb.append('*').append(s.name() == null ? "_" : s.name());
        } else if (pattern instanceof MatchMapping m) {
            sb.append('{');
            for (int i = 0; i < m.keys().size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                expr(m.keys().get(i), Precedence.TEST);
                sb.append(": ");
                pattern(m.patterns().get(i), Precedence.TEST);
            }
            if (m.rest() != null) {
                if (!m.keys().isEmpty()) {
                    sb.append(", ");
                }
                sb.append("**").append(m.rest());
            }
            sb.append('}');
        } else if (pattern instanceof MatchClass c) {
            expr(c.cls(), Precedence.ATOM);
            sb.append('(');
            patterns(c.patterns());
            for (int i = 0; i < c.kwdAttrs().size(); i++) {
                if (i > 0 || !c.patterns().isEmpty()) {
                    sb.append(", ");
                }
                sb.append(c.kwdAttrs().get(i)).append('=');
                pattern(c.kwdPatterns().get(i), Precedence.TEST);
            }
            sb.append(')');
        } else if (pattern instanceof MatchAs a) {
            if (a.name() == null) {
                sb.append('_');
            } else if (a.pattern() == null) {
                sb.append(a.name());
            } else {
                boolean parens = open(context, Precedence.TEST);
                pattern(a.pattern(), Precedence.EXPR);
                sb.append(" as ").append(a.name());
                close(parens);
            }
        } else if (pattern instanceof MatchOr o) {
            boolean parens = open(context, Precedence.EXPR);
            for (int i = 0; i < o.patterns().size(); i++) {
                if (i > 0) {
                    sb.append(" | ");
                }
                pattern(o.patterns().get(i), Precedence.EXPR.next());
            }
            close(parens);
        } else {
            throw new IllegalArgumentException("Unsupported pattern: " + pattern);
        }
    }

    // ============================================================
    // Literals
    // ============================================================

    private void constant(Literal literal) {
        if (literal instanceof Literal.StringLiteral s) {
            if (s.unicodePrefix()) {
                sb.append('u');
            }
            if (insideFString) {
                writeStrAvoidingBackslashes(s.value(), ALL_QUOTES);
                return;
            }
        }
        sb.append(repr(literal));
    }

    /** Python {@code repr} of a literal. */
    public static String repr(Literal literal) {
        if (literal instanceof Literal.IntLiteral i) {
            return i.value().toString();
        } else if (literal instanceof Literal.FloatLiteral f) {
            return floatRepr(f.value());
        } else if (literal instanceof Literal.ImaginaryLiteral i) {
            String repr = floatRepr(i.value());
            return (repr.endsWith(".0") ? repr.substring(0, repr.length() - 2) : repr) + "j";
        } else if (literal instanceof Literal.StringLiteral s) {
            return stringRepr(s.value());
        } else if (literal instanceof Literal.BytesLiteral b) {
            return "b" + bytesRepr(b.value());
        } else if (literal instanceof Literal.BoolLiteral b) {
            return b.value() ? "True" : "False";
        } else if (literal instanceof Literal.NoneLiteral) {
            return "None";
        } else if (literal instanceof Literal.EllipsisLiteral) {
            return "...";
        }
        throw new IllegalArgumentException("Unsupported literal: " + literal);
    }

    public static String stringRepr(String value) {
        char quote = chooseQuote(value);
        return quote + escapeString(value, quote) + quote;
    }

    private static char chooseQuote(String value) {
        if (value.indexOf('\'') >= 0 && value.indexOf('"') < 0) {
            return '"';
        }
        return '\'';
    }

    private static String escapeString(String s, char quote) {
        // Fast path: nothing to escape
        boolean needsEscaping = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' || c == quote || Character.isISOControl(c)) {
                needsEscaping = true;
                break;
            }
        }

        if (!needsEscaping) {
            return s;
        }

        StringBuilder result = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> result.append("\\\\");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                default -> {
                    if (c == quote) {
                        result.append('\\').append(c);
                    } else if (Character.isISOControl(c)) {
                        result.append(c < 0x100 ? String.format("\\x%02x", (int) c) : String.format("\\u%04x", (int) c));
                    } else {
                        result.append(c);
                    }
                }
            }
        }
        return result.toString();
    }

    private static String bytesRepr(String value) {
        char quote = chooseQuote(value);
        StringBuilder result = new StringBuilder(value.length() + 2).append(quote);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> result.append("\\\\");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                default -> {
                    if (c == quote) {
                        result.append('\\').append(c);
                    } else if (c < 0x20 || c >= 0x7f) {
                        result.append(String.format("\\x%02x", (int) c));
                    } else {
                        result.append(c);
                    }
                }
            }
        }
        return result.append(quote).toString();
    }

    /** Python {@code repr} of a float: shortest digits, exponent form outside 1e-4 to 1e16. */
    public static String floatRepr(double value) {
        if (Double.isInfinite(value)) {
            return value > 0 ? INFINITY : "-" + INFINITY;
        }
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (value == 0) {
            return 1 / value < 0 ? "-0.0" : "0.0";
        }
        String sign = value < 0 ? "-" : "";
        BigDecimal decimal = shortestDecimal(Math.abs(value)).stripTrailingZeros();
        int exponent = decimal.precision() - decimal.scale() - 1;
        if (exponent >= -4 && exponent < 16) {
            String plain = decimal.toPlainString();
            return sign + (plain.indexOf('.') < 0 ? plain + ".0" : plain);
        }
        String digits = decimal.unscaledValue().toString();
        String mantissa = digits.length() == 1 ? digits : digits.charAt(0) + "." + digits.substring(1);
        int magnitude = Math.abs(exponent);
        return sign + mantissa + "e" + (exponent < 0 ? "-" : "+") + (magnitude < 10 ? "0" : "") + magnitude;
    }

    /** Fewest significant digits that read back as {@code value}. */
    private static BigDecimal shortestDecimal(double value) {
        BigDecimal exact = new BigDecimal(value);
        for (int digits = 1; digits < MAX_FLOAT_DIGITS; digits++) {
            BigDecimal candidate = exact.round(new MathContext(digits, RoundingMode.HALF_EVEN));
            if (Double.parseDouble(candidate.toString()) == value) {
                return candidate;
            }
        }
        return exact.round(new MathContext(MAX_FLOAT_DIGITS, RoundingMode.HALF_EVEN));
    }
}
