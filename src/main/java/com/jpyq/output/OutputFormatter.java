package com.jpyq.output;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.jpyq.ast.AstDumper;
import com.jpyq.ast.AstOperator;
import com.jpyq.ast.Literal;
import com.jpyq.ast.PyNode;
import com.jpyq.ast.Unparser;
import com.jpyq.query.QueryResult;
import com.jpyq.tree.Node;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.tuple.Pair;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigInteger;

public class OutputFormatter {
    private final boolean astOutput;
    private final boolean compact;
    private final boolean json;
    private final JsonFactory factory = new JsonFactory();

    // StringBuilder pool for performance
    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public OutputFormatter() {
        this(false, false, false);
    }

    public OutputFormatter(boolean astOutput, boolean compact, boolean json) {
        this.astOutput = astOutput;
        this.compact = compact;
        this.json = json;
    }

    public String format(QueryResult result) {
        if (json) {
            return formatJson(result);
        }
        if (result instanceof QueryResult.TreeResult t) {
            return formatTree(t.node());
        }
        if (result instanceof QueryResult.BooleanResult b) {
            return b.value() ? "True" : "False";
        }
        if (result instanceof QueryResult.CountResult c) {
            return Integer.toString(c.count());
        }
        return repr(((QueryResult.ValueResult) result).value());
    }

    private String formatTree(Node node) {
        if (node.isEmpty()) {
            return "None";
        }
        if (!astOutput) {
            return node.toSource();
        }
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);
        for (PyNode tree : node.nodes()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(AstDumper.dump(tree, !compact));
        }
        return sb.toString();
    }

    /**
     * Python spelling of a value returned by {@code get_variable}.
     */
    static String repr(Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof Boolean b) {
            return b ? "True" : "False";
        }
        if (value instanceof String s) {
            return Unparser.stringRepr(s);
        }
        if (value instanceof Double d) {
            return Unparser.floatRepr(d);
        }
        return value.toString();
    }

    // ============================================================
    // JSON
    // ============================================================

    private String formatJson(QueryResult result) {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = factory.createGenerator(out)) {
            if (!compact) {
                generator.useDefaultPrettyPrinter();
            }
            if (result instanceof QueryResult.TreeResult t) {
                writeHandle(t.node(), generator);
            } else if (result instanceof QueryResult.BooleanResult b) {
                generator.writeBoolean(b.value());
            } else if (result instanceof QueryResult.CountResult c) {
                generator.writeNumber(c.count());
            } else {
                writeValue(((QueryResult.ValueResult) result).value(), generator);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write JSON output", e);
        }
        return out.toString();
    }

    private void writeHandle(Node node, JsonGenerator generator) throws IOException {
        if (node.isEmpty()) {
            generator.writeNull();
        } else if (node.tree().isPresent()) {
            writeNode(node.tree().get(), generator);
        } else {
            generator.writeStartArray();
            for (PyNode tree : node.nodes()) {
                writeNode(tree, generator);
            }
            generator.writeEndArray();
        }
    }

    private void writeNode(PyNode node, JsonGenerator generator) throws IOException {
        generator.writeStartObject();
        generator.writeStringField("_type", node.getClass().getSimpleName());
        for (Pair<String, Object> field : AstDumper.fields(node)) {
            generator.writeFieldName(field.getOne());
            writeValue(field.getTwo(), generator);
        }
        generator.writeEndObject();
    }

    private void writeValue(Object value, JsonGenerator generator) throws IOException {
        if (value == null) {
            generator.writeNull();
        } else if (value instanceof PyNode node) {
            writeNode(node, generator);
        } else if (value instanceof ImmutableList<?> list) {
            generator.writeStartArray();
            for (Object item : list) {
                writeValue(item, generator);
            }
            generator.writeEndArray();
        } else if (value instanceof Literal literal) {
            writeLiteral(literal, generator);
        } else if (value instanceof AstOperator op) {
            generator.writeString(op.nodeName());
        } else if (value instanceof Boolean b) {
            generator.writeBoolean(b);
        } else if (value instanceof Integer i) {
            generator.writeNumber(i);
        } else if (value instanceof Long l) {
            generator.writeNumber(l);
        } else if (value instanceof BigInteger big) {
            generator.writeNumber(big);
        } else if (value instanceof Double d) {
            writeDouble(d, generator);
        } else {
            generator.writeString(value.toString());
        }
    }

    private void writeLiteral(Literal literal, JsonGenerator generator) throws IOException {
        if (literal instanceof Literal.IntLiteral i) {
            generator.writeNumber(i.value());
        } else if (literal instanceof Literal.FloatLiteral f) {
            writeDouble(f.value(), generator);
        } else if (literal instanceof Literal.StringLiteral s) {
            generator.writeString(s.value());
        } else if (literal instanceof Literal.BoolLiteral b) {
            generator.writeBoolean(b.value());
        } else if (literal instanceof Literal.NoneLiteral) {
            generator.writeNull();
        } else {
            // bytes, imaginary numbers and the ellipsis have no JSON form
            generator.writeString(Unparser.repr(literal));
        }
    }

    private static void writeDouble(double value, JsonGenerator generator) throws IOException {
        if (Double.isFinite(value)) {
            generator.writeNumber(value);
        } else {
            generator.writeString(Unparser.floatRepr(value));
        }
    }
}
