package com.jpyq.parser;

import com.jpyq.ast.BinaryOperator;
import com.jpyq.ast.BoolOperator;
import com.jpyq.ast.CompareOperator;
import com.jpyq.ast.Literal;
import com.jpyq.ast.PyNode.*;
import com.jpyq.ast.PyNode.Module;
import com.jpyq.ast.UnaryOperator;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class PyParserTest {

    // ============================================================
    // Test Infrastructure
    // ============================================================

    private static Name name(String id) {
        return new Name(id);
    }

    private static Constant integer(long value) {
        return new Constant(Literal.of(value));
    }

    private static Constant string(String value) {
        return new Constant(Literal.of(value));
    }

    private static Stmt only(String source) {
        Module module = PyParser.parse(source);
        assertEquals(1, module.body().size(), "Expected a single statement in " + source);
        return module.body().get(0);
    }

    // ============================================================
    // Statements
    // ============================================================

    @Test
    public void testAssignment() {
        Module expected = Module.of(Lists.immutable.of(
            new Assign(Lists.immutable.of(name("x")), integer(1))));
        assertEquals(expected, PyParser.parse("x = 1"));
    }

    @Test
    public void testChainedAssignment() {
        Assign assign = (Assign) only("a = b = 1");
        assertEquals(Lists.immutable.of(name("a"), name("b")), assign.targets());
        assertEquals(integer(1), assign.value());
    }

    @Test
    public void testTupleAssignment() {
        Assign assign = (Assign) only("a, b = b, a");
        assertEquals(new TupleExpr(Lists.immutable.of(name("a"), name("b"))), assign.targets().get(0));
        assertEquals(new TupleExpr(Lists.immutable.of(name("b"), name("a"))), assign.value());
    }

    @Test
    public void testAugmentedAndAnnotatedAssignment() {
        assertEquals(new AugAssign(name("x"), BinaryOperator.FLOOR_DIV, integer(2)), only("x //= 2"));
        assertEquals(new AnnAssign(name("x"), name("int"), integer(5), true), only("x: int = 5"));
        assertEquals(new AnnAssign(name("x"), name("int"), null, false), only("(x): int"));
    }

    @Test
    public void testEmptyModule() {
        assertTrue(PyParser.parse("").body().isEmpty());
        assertTrue(PyParser.parse("# only a comment\n\n").body().isEmpty());
    }

    @Test
    public void testElifNestsInOrelse() {
        If top = (If) only("if a:\n    x = 1\nelif b:\n    x = 2\nelse:\n    x = 3\n");
        assertEquals(name("a"), top.test());
        assertEquals(1, top.orelse().size());
        If elif = (If) top.orelse().get(0);
        assertEquals(name("b"), elif.test());
        assertEquals(1, elif.orelse().size());
        assertTrue(elif.orelse().get(0) instanceof Assign);
    }

    @Test
    public void testFunctionParameters() {
        FunctionDef f = (FunctionDef) only("def f(p, /, a, b=1, *args, c, d=2, **kw) -> int:\n    return a\n");
        Arguments args = f.args();
        assertEquals("f", f.name());
        assertEquals(Lists.immutable.of(new Arg("p", null)), args.posonlyargs());
        assertEquals(Lists.immutable.of(new Arg("a", null), new Arg("b", null)), args.args());
        assertEquals(Lists.immutable.of(integer(1)), args.defaults());
        assertEquals(new Arg("args", null), args.vararg());
        assertEquals(Lists.immutable.of(new Arg("c", null), new Arg("d", null)), args.kwonlyargs());
        assertNull(args.kwDefaults().get(0));
        assertEquals(integer(2), args.kwDefaults().get(1));
        assertEquals(new Arg("kw", null), args.kwarg());
        assertEquals(name("int"), f.returns());
        assertFalse(f.isAsync());
    }

    @Test
    public void testAsyncFunctionAndDecorators() {
        FunctionDef f = (FunctionDef) only("@cache\n@route('/')\nasync def handler(request: Request):\n    await reply()\n");
        assertTrue(f.isAsync());
        assertEquals(2, f.decoratorList().size());
        assertEquals(new Arg("request", name("Request")), f.args().args().get(0));
        ExprStmt body = (ExprStmt) f.body().get(0);
        assertTrue(body.value() instanceof Await);
    }

    @Test
    public void testClassDefinition() {
        ClassDef c = (ClassDef) only("class Shape(Base, metaclass=Meta):\n    sides = 0\n\n    def area(self):\n        pass\n");
        assertEquals("Shape", c.name());
        assertEquals(Lists.immutable.of(name("Base")), c.bases());
        assertEquals(Lists.immutable.of(new Keyword("metaclass", name("Meta"))), c.keywords());
        assertEquals(2, c.body().size());
    }

    @Test
    public void testTryStatement() {
        Try t = (Try) only("try:\n    run()\nexcept (A, B) as e:\n    pass\nexcept:\n    raise\nelse:\n    ok()\nfinally:\n    done()\n");
        assertEquals(2, t.handlers().size());
        assertEquals("e", t.handlers().get(0).name());
        assertNull(t.handlers().get(1).type());
        assertEquals(1, t.orelse().size());
        assertEquals(1, t.finalbody().size());
    }

    @Test
    public void testImports() {
        assertEquals(new Import(Lists.immutable.of(new Alias("os.path", "p"), new Alias("sys", null))),
            only("import os.path as p, sys"));
        assertEquals(new ImportFrom("pkg", Lists.immutable.of(new Alias("a", null), new Alias("b", "c")), 2),
            only("from ..pkg import (a,\n    b as c,)"));
        assertEquals(new ImportFrom(null, Lists.immutable.of(new Alias("*", null)), 1), only("from . import *"));
    }

    @Test
    public void testSimpleStatementsOnOneLine() {
        Module module = PyParser.parse("x = 1; y = 2;\nif x: pass\n");
        assertEquals(3, module.body().size());
        assertEquals(Lists.immutable.of(new Pass()), ((If) module.body().get(2)).body());
    }

    @Test
    public void testWithStatement() {
        With with = (With) only("with open(p) as f, lock:\n    data = f.read()\n");
        assertEquals(2, with.items().size());
        assertEquals(name("f"), with.items().get(0).optionalVars());
        assertNull(with.items().get(1).optionalVars());
    }

    @Test
    public void testParenthesizedWithItems() {
        With with = (With) only("with (open(a) as f, open(b) as g):\n    pass\n");
        assertEquals(2, with.items().size());
        assertEquals(name("f"), with.items().get(0).optionalVars());
        assertEquals(name("g"), with.items().get(1).optionalVars());

        With bare = (With) only("with (a, b):\n    pass\n");
        assertEquals(Lists.immutable.of(new WithItem(name("a"), null), new WithItem(name("b"), null)), bare.items());
        assertEquals(only("with a, b:\n    pass\n"), bare);
    }

    @Test
    public void testParenthesizedContextManagerIsOneItem() {
        With with = (With) only("with (a, b) as c:\n    pass\n");
        assertEquals(1, with.items().size());
        assertEquals(new TupleExpr(Lists.immutable.of(name("a"), name("b"))), with.items().get(0).contextExpr());
    }

    @Test
    public void testExceptStar() {
        TryStar t = (TryStar) only("try:\n    run()\nexcept* ValueError as e:\n    pass\n");
        assertEquals(name("ValueError"), t.handlers().get(0).type());
        assertEquals("e", t.handlers().get(0).name());
    }

    @Test
    public void testMatchStatement() {
        Match match = (Match) only("""
            match command:
                case Point(x=0, y=[1, *rest]) | {"k": v, **kw} if v:
                    pass
                case -1 | 1+2j | color.RED | (c as d) | None:
                    pass
                case 1, *_:
                    pass
                case _:
                    pass
            """);
        assertEquals(name("command"), match.subject());
        assertEquals(4, match.cases().size());

        MatchCase first = match.cases().get(0);
        assertEquals(name("v"), first.guard());
        MatchOr or = (MatchOr) first.pattern();
        MatchClass point = (MatchClass) or.patterns().get(0);
        assertEquals(name("Point"), point.cls());
        assertEquals(Lists.immutable.of("x", "y"), point.kwdAttrs());
        assertEquals(new MatchValue(integer(0)), point.kwdPatterns().get(0));
        assertEquals(new MatchSequence(Lists.immutable.of(new MatchValue(integer(1)), new MatchStar("rest"))),
            point.kwdPatterns().get(1));
        assertEquals(new MatchMapping(Lists.immutable.of(string("k")), Lists.immutable.of(new MatchAs(null, "v")), "kw"),
            or.patterns().get(1));

        MatchOr values = (MatchOr) match.cases().get(1).pattern();
        assertEquals(new MatchValue(new UnaryOp(UnaryOperator.USUB, integer(1))), values.patterns().get(0));
        assertEquals(new MatchValue(new BinOp(integer(1), BinaryOperator.ADD,
            new Constant(new Literal.ImaginaryLiteral(2.0)))), values.patterns().get(1));
        assertEquals(new MatchValue(new Attribute(name("color"), "RED")), values.patterns().get(2));
        assertEquals(new MatchAs(new MatchAs(null, "c"), "d"), values.patterns().get(3));
        assertEquals(new MatchSingleton(new Literal.NoneLiteral()), values.patterns().get(4));

        assertEquals(new MatchSequence(Lists.immutable.of(new MatchValue(integer(1)), new MatchStar(null))),
            match.cases().get(2).pattern());
        assertEquals(new MatchAs(null, null), match.cases().get(3).pattern());
    }

    @Test
    public void testMatchRemainsAName() {
        assertEquals(new Assign(Lists.immutable.of(name("match")), integer(1)), only("match = 1"));
    }

    // ============================================================
    // Expressions
    // ============================================================

    @Test
    public void testArithmeticPrecedence() {
        Expr expected = new BinOp(integer(1), BinaryOperator.ADD, new BinOp(integer(2), BinaryOperator.MULT, integer(3)));
        assertEquals(expected, PyParser.parseExpression("1 + 2 * 3"));
    }

    @Test
    public void testLeftAssociativity() {
        Expr expected = new BinOp(new BinOp(name("a"), BinaryOperator.SUB, name("b")), BinaryOperator.SUB, name("c"));
        assertEquals(expected, PyParser.parseExpression("a - b - c"));
    }

    @Test
    public void testPowerIsRightAssociativeAndBindsTighterThanUnaryMinus() {
        assertEquals(new BinOp(integer(2), BinaryOperator.POW, new BinOp(integer(3), BinaryOperator.POW, integer(2))),
            PyParser.parseExpression("2 ** 3 ** 2"));
        assertEquals(new UnaryOp(UnaryOperator.USUB, new BinOp(integer(2), BinaryOperator.POW, integer(2))),
            PyParser.parseExpression("-2 ** 2"));
    }

    @Test
    public void testBooleanOperators() {
        Expr expected = new BoolOp(BoolOperator.OR, Lists.immutable.of(
            name("a"), new BoolOp(BoolOperator.AND, Lists.immutable.of(name("b"), name("c")))));
        assertEquals(expected, PyParser.parseExpression("a or b and c"));
        assertEquals(new BoolOp(BoolOperator.AND, Lists.immutable.of(name("a"), name("b"), name("c"))),
            PyParser.parseExpression("a and b and c"));
    }

    @Test
    public void testConditionalAfterNumberWithoutSpace() {
        assertEquals(new Assign(Lists.immutable.of(name("x")), new IfExp(name("y"), integer(1), integer(2))),
            only("x = 1if y else 2"));
    }

    @Test
    public void testNotBindsLooserThanComparison() {
        Expr expected = new UnaryOp(UnaryOperator.NOT,
            new Compare(name("a"), Lists.immutable.of(CompareOperator.EQ), Lists.immutable.of(name("b"))));
        assertEquals(expected, PyParser.parseExpression("not a == b"));
    }

    @Test
    public void testComparisonChains() {
        assertEquals(new Compare(name("a"), Lists.immutable.of(CompareOperator.LT, CompareOperator.LT_E),
                Lists.immutable.of(name("b"), name("c"))),
            PyParser.parseExpression("a < b <= c"));
        assertEquals(new Compare(name("x"), Lists.immutable.of(CompareOperator.NOT_IN), Lists.immutable.of(name("y"))),
            PyParser.parseExpression("x not in y"));
        assertEquals(new Compare(name("x"), Lists.immutable.of(CompareOperator.IS_NOT), Lists.immutable.of(name("y"))),
            PyParser.parseExpression("x is not y"));
    }

    @Test
    public void testConditionalExpressionAndLambda() {
        assertEquals(new IfExp(name("b"), name("a"), name("c")), PyParser.parseExpression("a if b else c"));
        Lambda lambda = (Lambda) PyParser.parseExpression("lambda x, y=1: x + y");
        assertEquals(2, lambda.args().args().size());
        assertEquals(Lists.immutable.of(integer(1)), lambda.args().defaults());
    }

    @Test
    public void testCallArguments() {
        Call call = (Call) PyParser.parseExpression("f(a, *rest, key=1, **opts)");
        assertEquals(Lists.immutable.of(name("a"), new Starred(name("rest"))), call.args());
        assertEquals(Lists.immutable.of(new Keyword("key", integer(1)), new Keyword(null, name("opts"))), call.keywords());
    }

    @Test
    public void testTrailersAndSlices() {
        Expr expected = new Subscript(new Attribute(name("obj"), "items"),
            new TupleExpr(Lists.immutable.of(
                new Slice(integer(1), integer(2), null),
                new Slice(null, null, integer(3)))));
        assertEquals(expected, PyParser.parseExpression("obj.items[1:2, ::3]"));
    }

    @Test
    public void testDisplaysAndComprehensions() {
        assertEquals(new TupleExpr(Lists.immutable.empty()), PyParser.parseExpression("()"));
        assertEquals(new TupleExpr(Lists.immutable.of(integer(1))), PyParser.parseExpression("(1,)"));
        assertEquals(integer(1), PyParser.parseExpression("(1)"));
        assertEquals(new SetExpr(Lists.immutable.of(integer(1), integer(2))), PyParser.parseExpression("{1, 2}"));
        assertEquals(new DictExpr(Lists.immutable.of(string("a"), null), Lists.immutable.of(integer(1), name("rest"))),
            PyParser.parseExpression("{'a': 1, **rest}"));

        ListComp comp = (ListComp) PyParser.parseExpression("[i * 2 for i in range(10) if i % 2]");
        assertEquals(1, comp.generators().size());
        assertEquals(name("i"), comp.generators().get(0).target());
        assertEquals(1, comp.generators().get(0).ifs().size());

        assertTrue(PyParser.parseExpression("{k: v for k, v in pairs}") instanceof DictComp);
        assertTrue(PyParser.parseExpression("(x for x in xs)") instanceof GeneratorExp);
        Call call = (Call) PyParser.parseExpression("sum(x for x in xs)");
        assertTrue(call.args().get(0) instanceof GeneratorExp);
    }

    @Test
    public void testWalrus() {
        assertEquals(new NamedExpr(name("n"), new Call(name("len"), Lists.immutable.of(name("a")), Lists.immutable.empty())),
            PyParser.parseExpression("(n := len(a))"));
    }

    // ============================================================
    // Literals
    // ============================================================

    @ParameterizedTest
    @CsvSource({
        "42, 42",
        "1_000, 1000",
        "0xFF, 255",
        "0o17, 15",
        "0b101, 5",
        "0, 0",
        "00, 0"
    })
    public void testIntegerLiterals(String source, long expected) {
        assertEquals(integer(expected), PyParser.parseExpression(source));
    }

    @Test
    public void testBigIntegerLiteral() {
        Constant c = (Constant) PyParser.parseExpression("123456789012345678901234567890");
        assertEquals(new Literal.IntLiteral(new BigInteger("123456789012345678901234567890")), c.value());
        assertEquals(new BigInteger("123456789012345678901234567890"), c.value().javaValue());
    }

    @Test
    public void testFloatAndImaginaryLiterals() {
        assertEquals(new Constant(Literal.of(1500.0)), PyParser.parseExpression("1.5e3"));
        assertEquals(new Constant(Literal.of(0.5)), PyParser.parseExpression(".5"));
        assertEquals(new Constant(new Literal.ImaginaryLiteral(2.0)), PyParser.parseExpression("2j"));
    }

    @Test
    public void testKeywordConstants() {
        assertEquals(new Constant(Literal.of(true)), PyParser.parseExpression("True"));
        assertEquals(new Constant(new Literal.NoneLiteral()), PyParser.parseExpression("None"));
        assertEquals(new Constant(new Literal.EllipsisLiteral()), PyParser.parseExpression("..."));
    }

    @Test
    public void testStringLiterals() {
        assertEquals(string("ab"), PyParser.parseExpression("'a' \"b\""));
        assertEquals(string("tab\there\n"), PyParser.parseExpression("'tab\\there\\n'"));
        assertEquals(string("raw\\n"), PyParser.parseExpression("r'raw\\n'"));
        assertEquals(string("\u00e9A"), PyParser.parseExpression("'\\xe9\\u0041'"));
        assertEquals(string("two\nlines"), PyParser.parseExpression("'''two\nlines'''"));
        assertEquals(new Constant(new Literal.BytesLiteral("\u00ff")), PyParser.parseExpression("b'\\xff'"));
    }

    @Test
    public void testUnicodePrefixIsKept() {
        assertEquals(new Constant(new Literal.StringLiteral("x", true)), PyParser.parseExpression("u'x'"));
        assertEquals(new Constant(new Literal.StringLiteral("xy", true)), PyParser.parseExpression("u'x' 'y'"));
        assertEquals(string("xy"), PyParser.parseExpression("'x' u'y'"));
    }

    @Test
    public void testFStringSubscriptWithOtherQuote() {
        JoinedStr expected = new JoinedStr(Lists.immutable.of(
            new FormattedValue(new Subscript(name("x"), string("k")), FormattedValue.NO_CONVERSION, null)));
        assertEquals(expected, PyParser.parseExpression("f\"{x['k']}\""));
    }

    @Test
    public void testFStrings() {
        JoinedStr expected = new JoinedStr(Lists.immutable.of(
            string("a"),
            new FormattedValue(name("x"), 'r', new JoinedStr(Lists.immutable.of(
                string(">"),
                new FormattedValue(name("w"), FormattedValue.NO_CONVERSION, null)))),
            string("b")));
        assertEquals(expected, PyParser.parseExpression("f'a{x!r:>{w}}b'"));
    }

    @Test
    public void testFStringEscapedBracesAndConcatenation() {
        JoinedStr expected = new JoinedStr(Lists.immutable.of(
            string("{lit} "),
            new FormattedValue(name("x"), FormattedValue.NO_CONVERSION, null),
            string("!")));
        assertEquals(expected, PyParser.parseExpression("f'{{lit}} {x}' '!'"));
    }

    @Test
    public void testSelfDocumentingFString() {
        JoinedStr expected = new JoinedStr(Lists.immutable.of(
            string("x="),
            new FormattedValue(name("x"), 'r', null)));
        assertEquals(expected, PyParser.parseExpression("f'{x=}'"));
    }

    // ============================================================
    // Errors
    // ============================================================

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
        "1 = x|cannot assign to literal",
        "f() = 1|cannot assign to function call",
        "a + b = 1|cannot assign to expression",
        "def f(a=1, b): pass|non-default argument follows default argument",
        "f(a=1, b)|positional argument follows keyword argument",
        "x = 'a' b'b'|cannot mix bytes and nonbytes literals",
        "x = 012|leading zeros in decimal integer literals are not permitted",
        "x = f'{}'|invalid syntax: expected 'identifier'",
        "x = f'{x!z}'|f-string: invalid conversion character",
        "x = f'a } b'|invalid syntax",
        "x = f'{a['k']}'|f-string: expecting '}'",
        "x = 10L|invalid decimal literal",
        "n := 10|invalid syntax",
        "x, y += 1|'tuple' is an illegal expression for augmented assignment",
        "del f()|cannot delete function call",
        "def f[T](a): pass|invalid syntax",
        "def f(*, **kw): pass|named arguments must follow bare *",
        "print 'hello'|Missing parentheses in call to 'print'. Did you mean print(...)?",
        "try:\\n    pass|expected 'except' or 'finally' block",
        "if x:\\npass|expected an indented block",
        "f(x for x in y, 1)|Generator expression must be parenthesized",
        "x = (x for x in y, 1)|invalid syntax"
    })
    public void testSyntaxErrors(String source, String reason) {
        PySyntaxException e = assertThrows(PySyntaxException.class, () -> PyParser.parse(source.replace("\\n", "\n")));
        assertEquals(reason, e.getReason());
    }

    @Test
    public void testUnexpectedIndent() {
        PySyntaxException e = assertThrows(PySyntaxException.class, () -> PyParser.parse("  x = 1"));
        assertEquals("unexpected indent", e.getReason());
    }

    @Test
    public void testErrorPosition() {
        PySyntaxException e = assertThrows(PySyntaxException.class, () -> PyParser.parse("x = 1\ny = (\n"));
        assertEquals(2, e.getLine());
        assertEquals(1, e.getColumn());
    }

    @Test
    public void testIncompleteStatement() {
        PySyntaxException e = assertThrows(PySyntaxException.class, () -> PyParser.parse("x = "));
        assertEquals("invalid syntax", e.getReason());
    }

    @Test
    public void testMissingTokenIsReportedOnItsLine() {
        PySyntaxException e = assertThrows(PySyntaxException.class, () -> PyParser.parse("def broken(:\n    pass\n"));
        assertEquals(1, e.getLine());
    }

    @Test
    public void testErrorColumnCountsCharactersNotBytes() {
        PySyntaxException e = assertThrows(PySyntaxException.class, () -> PyParser.parse("s = '\u00e9'; 1 = x"));
        assertEquals("cannot assign to literal", e.getReason());
        assertEquals(10, e.getColumn());
    }
}
