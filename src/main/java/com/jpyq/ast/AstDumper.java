package com.jpyq.ast;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.tuple.Tuples;

import java.lang.reflect.RecordComponent;

/**
 * Renders a syntax tree as {@code Type(field=value, ...)}, like {@code ast.dump}.
 */
public final class AstDumper {
    private static final String INDENT = "  ";
    private static final int MAX_INLINE_FIELDS = 3;

    private final boolean indent;

    private AstDumper(boolean indent) {
        this.indent = indent;
    }

    public static String dump(PyNode node) {
        return dump(node, false);
    }

    /** With {@code indent}, nested nodes go on their own lines, two spaces per level. */
    public static String dump(PyNode node, boolean indent) {
        return new AstDumper(indent).format(node, 0).getOne();
    }

    /** Record components of a node paired with their values, in declaration order. */
    public static ImmutableList<Pair<String, Object>> fields(PyNode node) {
        MutableList<Pair<String, Object>> fields = Lists.mutable.empty();
        for (RecordComponent component : node.getClass().getRecordComponents()) {
            try {
                fields.add(Tuples.pair(component.getName(), component.getAccessor().invoke(node)));
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Cannot read field " + component.getName() + " of " + node.getClass(), e);
            }
        }
        return fields.toImmutable();
    }

    /** The rendered text, and whether it is simple enough to keep on one line. */
    private Pair<String, Boolean> format(Object value, int level) {
        String prefix = "";
        String separator = ", ";
        if (indent) {
            level++;
            prefix = "\n" + INDENT.repeat(level);
            separator = ",\n" + INDENT.repeat(level);
        }

        if (value instanceof PyNode node) {
            MutableList<String> args = Lists.mutable.empty();
            boolean allSimple = true;
            for (Pair<String, Object> field : fields(node)) {
                Pair<String, Boolean> formatted = format(field.getTwo(), level);
                allSimple &= formatted.getTwo();
                args.add(field.getOne() + "=" + formatted.getOne());
            }
            if (node instanceof PyNode.Constant constant
                    && constant.value() instanceof Literal.StringLiteral s && s.unicodePrefix()) {
                args.add("kind='u'");
            }
            String name = node.getClass().getSimpleName();
            if (allSimple && args.size() <= MAX_INLINE_FIELDS) {
                return Tuples.pair(name + "(" + args.makeString(", ") + ")", args.isEmpty());
            }
            return Tuples.pair(name + "(" + prefix + args.makeString(separator) + ")", false);
        }
        if (value instanceof ImmutableList<?> list) {
            if (list.isEmpty()) {
                return Tuples.pair("[]", true);
            }
            final int itemLevel = level;
            String items = list.collect(item -> format(item, itemLevel).getOne()).makeString(separator);
            return Tuples.pair("[" + prefix + items + "]", false);
        }
        return Tuples.pair(leaf(value), true);
    }

    private static String leaf(Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof Literal literal) {
            return Unparser.repr(literal);
        }
        if (value instanceof AstOperator op) {
            return op.nodeName() + "()";
        }
        if (value instanceof String s) {
            return Unparser.stringRepr(s);
        }
        if (value instanceof Boolean b) {
            return b ? "True" : "False";
        }
        return String.valueOf(value);
    }
}
