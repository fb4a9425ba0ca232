package com.jpyq.tree;

import com.jpyq.ast.Literal;
import com.jpyq.ast.PyNode;
import com.jpyq.ast.PyNode.Constant;
import com.jpyq.ast.PyNode.If;
import com.jpyq.ast.PyNode.Module;
import com.jpyq.ast.PyNode.Name;
import com.jpyq.parser.PySyntaxException;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class NodeTest {

    private static final String CASCADE = """
        if a:
            x = 1
        elif b:
            x = 2
        else:
            x = 3
        """;

    private static final String PROGRAM = """
        import math

        PI = 3.14
        count = 0
        name = "shape"

        class Shape:
            sides = 4

            def area(self):
                result = self.width * self.height
                return result

        def main():
            pass

        async def fetch():
            pass

        if count > 0:
            print(count)
        """;

    static Stream<String> sources() {
        return Stream.of(
            "x = 1",
            PROGRAM,
            CASCADE,
            "def f(a, *, b=2):\n    return [i for i in range(a) if i % b]\n",
            "print(f'{x!r} and {y:>{w}}')",
            "while True:\n    try:\n        break\n    except (A, B) as e:\n        raise\n"
        );
    }

    // ============================================================
    // Construction and equality
    // ============================================================

    @ParameterizedTest
    @MethodSource("sources")
    public void testReparsingSerializedSourceGivesEqualHandle(String source) {
        Node node = Node.parse(source);
        assertEquals(node, Node.parse(node.toSource()));
    }

    @ParameterizedTest
    @MethodSource("sources")
    public void testPopulatedHandleIsEquivalentToItsOwnSource(String source) {
        Node node = Node.parse(source);
        assertTrue(node.isEquivalent(node.toSource()));
        for (int i = 0; i < node.length(); i++) {
            assertTrue(node.get(i).isEquivalent(node.get(i).toSource()));
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"None", "", "x", "pass"})
    public void testEmptyHandleIsNeverEquivalent(String target) {
        assertFalse(Node.empty().isEquivalent(target));
    }

    @Test
    public void testEmptyHandleDoesNotParseTarget() {
        assertFalse(Node.empty().isEquivalent("this is not python ("));
    }

    @Test
    public void testEmptyHandlesAreEqual() {
        assertEquals(Node.empty(), Node.empty());
        assertEquals(Node.empty(), Node.from(null));
        assertEquals(Node.empty(), Node.of((PyNode) null));
        assertEquals(Node.empty().hashCode(), Node.from(null).hashCode());
        assertNotEquals(Node.empty(), Node.parse(""));
    }

    @Test
    public void testEmptyHandleHasNothing() {
        Node empty = Node.empty();
        assertTrue(empty.isEmpty());
        assertFalse(empty.hasFunction("f"));
        assertFalse(empty.hasClass("C"));
        assertFalse(empty.hasVariable("x"));
        assertFalse(empty.isInteger());
        assertFalse(empty.valueIsCall("f"));
        assertEquals(Optional.empty(), empty.getVariable("x"));
        assertTrue(empty.findIfs().isEmpty());
        assertEquals("", empty.toSource());
    }

    @Test
    public void testStrictEqualityKeepsModuleWrapper() {
        Node module = Node.parse("x = 1");
        Node statement = module.get(0);
        assertNotEquals(module, statement);
        assertTrue(statement.isEquivalent("x = 1"));
        assertTrue(module.isEquivalent("x = 1"));
        assertEquals(statement, Node.parse("x = 1").get(0));
    }

    @Test
    public void testExpressionIsEquivalentToModuleWrappingIt() {
        Node condition = Node.parse("if True:\n    pass").get(0).findConditions().get(0);
        assertTrue(condition.isEquivalent("True"));
        assertTrue(condition.isEquivalent("(True)"));
        assertFalse(condition.isEquivalent("False"));
    }

    @Test
    public void testEquivalenceIgnoresFormatting() {
        Node node = Node.parse("def add(a,b):\n  return (a+b)");
        assertTrue(node.isEquivalent("def add(a, b):\n    return a + b"));
        assertFalse(node.isEquivalent("def add(a, b):\n    return b + a"));
    }

    @Test
    public void testParenthesizedWithItemsAreEquivalentToBareOnes() {
        assertTrue(Node.parse("with (a, b):\n    pass").isEquivalent("with a, b:\n    pass"));
        assertFalse(Node.parse("with (a, b) as c:\n    pass").isEquivalent("with a, b as c:\n    pass"));
    }

    @Test
    public void testEquivalenceWithInvalidTargetFails() {
        Node node = Node.parse("x = 1");
        assertThrows(PySyntaxException.class, () -> node.isEquivalent("x = ("));
    }

    @Test
    public void testFromDispatchesOnType() {
        assertEquals(Node.parse("x = 1"), Node.from("x = 1"));
        Name name = new Name("x");
        assertEquals(Node.of(name), Node.from(name));
        assertEquals(Node.of(List.of(name)), Node.from(List.of(name)));
        assertThrows(IllegalArgumentException.class, () -> Node.from(42));
        assertThrows(IllegalArgumentException.class, () -> Node.from(List.of("x = 1")));
    }

    @Test
    public void testParseFailure() {
        PySyntaxException e = assertThrows(PySyntaxException.class, () -> Node.parse("def f(:\n    pass"));
        assertEquals(1, e.getLine());
    }

    // ============================================================
    // Indexing
    // ============================================================

    @Test
    public void testIndexIntoBody() {
        Node node = Node.parse("a = 1\nb = 2\nc = 3");
        assertEquals(3, node.length());
        assertTrue(node.get(0).isEquivalent("a = 1"));
        assertTrue(node.get(-1).isEquivalent("c = 3"));
        assertThrows(IndexOutOfBoundsException.class, () -> node.get(3));
        assertThrows(IndexOutOfBoundsException.class, () -> node.get(-4));
    }

    @Test
    public void testIndexIntoNestedBodies() {
        Node node = Node.parse(PROGRAM);
        Node area = node.findClass("Shape").get(1);
        assertTrue(area.get(0).isEquivalent("result = self.width * self.height"));
        assertEquals(2, area.length());
    }

    @Test
    public void testIndexIntoSequence() {
        ImmutableList<PyNode> nodes = Lists.immutable.of(new Name("a"), new Name("b"));
        Node sequence = Node.of(nodes);
        assertEquals(2, sequence.length());
        assertEquals(Node.of(new Name("b")), sequence.get(1));
        assertEquals(Node.of(new Name("a")), sequence.get(-2));
        assertEquals("a\nb", sequence.toSource());
    }

    @Test
    public void testIndexWithoutBodyFails() {
        Node name = Node.parse("x").get(0).tree()
            .map(stmt -> Node.of(((PyNode.ExprStmt) stmt).value()))
            .orElseThrow();
        assertThrows(InvalidOperationException.class, () -> name.get(0));
        assertThrows(InvalidOperationException.class, name::length);
        assertThrows(InvalidOperationException.class, () -> Node.empty().get(0));
        assertThrows(InvalidOperationException.class, () -> Node.empty().length());
    }

    // ============================================================
    // Finders
    // ============================================================

    @Test
    public void testFindFunction() {
        Node node = Node.parse(PROGRAM);
        assertTrue(node.hasFunction("main"));
        assertTrue(node.hasFunction("fetch"));
        assertFalse(node.hasFunction("area"));
        assertTrue(node.findFunction("main").isEquivalent("def main():\n    pass"));
        assertTrue(node.findFunction("missing").isEmpty());
    }

    @Test
    public void testFindClassAndChain() {
        Node node = Node.parse(PROGRAM);
        assertTrue(node.hasClass("Shape"));
        assertFalse(node.hasClass("main"));
        Node area = node.findClass("Shape").findFunction("area");
        assertFalse(area.isEmpty());
        assertTrue(area.hasVariable("result"));
        assertTrue(node.findClass("Missing").findFunction("area").isEmpty());
    }

    @Test
    public void testFindVariable() {
        Node node = Node.parse(PROGRAM);
        assertTrue(node.findVariable("PI").isEquivalent("PI = 3.14"));
        assertFalse(node.hasVariable("sides"));
        assertFalse(node.hasVariable("math"));
    }

    @Test
    public void testFindVariableTargets() {
        assertTrue(Node.parse("a = b = 1").hasVariable("b"));
        assertFalse(Node.parse("a, b = 1, 2").hasVariable("a"));
        assertFalse(Node.parse("self.a = 1").hasVariable("a"));
        assertFalse(Node.parse("a: int = 1").hasVariable("a"));
        assertFalse(Node.parse("a += 1").hasVariable("a"));
    }

    @Test
    public void testFirstMatchWins() {
        Node node = Node.parse("x = 1\nx = 2");
        assertEquals(Optional.of(1L), node.getVariable("x"));
    }

    @Test
    public void testFindersOnSequenceFindNothing() {
        Node sequence = Node.of(Node.parse("def f():\n    pass").nodes());
        assertFalse(sequence.hasFunction("f"));
    }

    @Test
    public void testGetVariable() {
        assertEquals(Optional.of(42L), Node.parse("x = 42").getVariable("x"));
        assertEquals(Optional.of("a"), Node.parse("x = 'a'").getVariable("x"));
        assertEquals(Optional.of(1.5), Node.parse("x = 1.5").getVariable("x"));
        assertEquals(Optional.of(true), Node.parse("x = True").getVariable("x"));
        assertEquals(Optional.of(new BigInteger("99999999999999999999")),
            Node.parse("x = 99999999999999999999").getVariable("x"));
        assertEquals(Optional.empty(), Node.parse("x = foo()").getVariable("x"));
        assertEquals(Optional.empty(), Node.parse("x = None").getVariable("x"));
        assertEquals(Optional.empty(), Node.parse("x = -1").getVariable("x"));
        assertEquals(Optional.empty(), Node.parse("y = 1").getVariable("x"));
    }

    @Test
    public void testIsInteger() {
        assertTrue(Node.parse("x = 5").findVariable("x").isInteger());
        assertFalse(Node.parse("x = True").findVariable("x").isInteger());
        assertFalse(Node.parse("x = 5.0").findVariable("x").isInteger());
        assertFalse(Node.parse("x = 5").isInteger());
    }

    @Test
    public void testValueIsCall() {
        assertTrue(Node.parse("x = foo()").findVariable("x").valueIsCall("foo"));
        assertFalse(Node.parse("x = foo()").findVariable("x").valueIsCall("bar"));
        assertFalse(Node.parse("x = obj.foo()").findVariable("x").valueIsCall("foo"));
        assertFalse(Node.parse("x = 5").findVariable("x").valueIsCall("foo"));
        assertFalse(Node.parse("x = foo()").valueIsCall("foo"));
    }

    @Test
    public void testChainedAssignmentIsNeitherIntegerNorCall() {
        assertFalse(Node.parse("a = b = 1").findVariable("a").isInteger());
        assertFalse(Node.parse("a = b = foo()").findVariable("b").valueIsCall("foo"));
    }

    // ============================================================
    // Conditional chains
    // ============================================================

    @Test
    public void testConditionsOfCascadeWithElse() {
        ImmutableList<Node> conditions = Node.parse(CASCADE).get(0).findConditions();
        assertEquals(3, conditions.size());
        assertTrue(conditions.get(0).isEquivalent("a"));
        assertTrue(conditions.get(1).isEquivalent("b"));
        assertTrue(conditions.get(2).isEmpty());
    }

    @Test
    public void testBodiesOfCascadeWithElse() {
        ImmutableList<Node> bodies = Node.parse(CASCADE).get(0).findIfBodies();
        assertEquals(3, bodies.size());
        assertTrue(bodies.get(0).get(0).isEquivalent("x = 1"));
        assertTrue(bodies.get(1).get(0).isEquivalent("x = 2"));
        assertTrue(bodies.get(2).get(0).isEquivalent("x = 3"));
        assertTrue(bodies.get(2).tree().orElseThrow() instanceof Module);
    }

    @Test
    public void testCascadeWithoutElse() {
        Node chain = Node.parse("if a:\n    pass\nelif b:\n    pass").get(0);
        ImmutableList<Node> conditions = chain.findConditions();
        assertEquals(2, conditions.size());
        assertFalse(conditions.anySatisfy(Node::isEmpty));
        assertEquals(2, chain.findIfBodies().size());
    }

    @Test
    public void testSingleIf() {
        Node chain = Node.parse("if a:\n    x = 1\n    y = 2").get(0);
        assertEquals(1, chain.findConditions().size());
        assertEquals(2, chain.findIfBodies().get(0).length());
    }

    @Test
    public void testElseHoldingMoreThanAnIfEndsTheChain() {
        Node chain = Node.parse("if a:\n    pass\nelse:\n    if b:\n        pass\n    y = 1").get(0);
        ImmutableList<Node> conditions = chain.findConditions();
        assertEquals(2, conditions.size());
        assertTrue(conditions.get(1).isEmpty());
        ImmutableList<Node> bodies = chain.findIfBodies();
        assertEquals(2, bodies.size());
        assertEquals(2, bodies.get(1).length());
    }

    @Test
    public void testLongCascade() {
        StringBuilder source = new StringBuilder("if x == 0:\n    pass\n");
        for (int i = 1; i < 500; i++) {
            source.append("elif x == ").append(i).append(":\n    pass\n");
        }
        Node chain = Node.parse(source.toString()).get(0);
        assertEquals(500, chain.findConditions().size());
        assertTrue(chain.findConditions().get(499).isEquivalent("x == 499"));
    }

    @Test
    public void testConditionsNeedAnIf() {
        assertThrows(InvalidOperationException.class, () -> Node.parse(CASCADE).findConditions());
        assertThrows(InvalidOperationException.class, () -> Node.parse(CASCADE).findIfBodies());
        assertThrows(InvalidOperationException.class, () -> Node.empty().findConditions());
        assertThrows(InvalidOperationException.class, () -> Node.parse("x = 1").get(0).findIfBodies());
    }

    @Test
    public void testFindIfs() {
        ImmutableList<Node> ifs = Node.parse("if a:\n    pass\nx = 1\nif b:\n    pass\nelse:\n    pass").findIfs();
        assertEquals(2, ifs.size());
        assertTrue(ifs.get(1).tree().orElseThrow() instanceof If);
        assertEquals(2, ifs.get(1).findConditions().size());
        assertTrue(Node.parse("x = 1").get(0).findIfs().isEmpty());
    }

    // ============================================================
    // Rendering
    // ============================================================

    @Test
    public void testToString() {
        assertEquals("Node:\nNone", Node.empty().toString());
        assertEquals("Node:\nExprStmt(\n  value=Name(id='x'))", Node.parse("x").get(0).toString());
    }

    @Test
    public void testToSource() {
        assertEquals("x = 1", Node.parse("x=1").toSource());
        assertEquals("'a'", Node.of(new Constant(Literal.of("a"))).toSource());
    }
}
