package com.jpyq.parser;

import com.jpyq.ast.Literal;
import com.jpyq.ast.PyNode.Constant;
import com.jpyq.ast.PyNode.Expr;
import com.jpyq.ast.PyNode.FormattedValue;
import com.jpyq.ast.PyNode.JoinedStr;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.treesitter.TSNode;
import org.treesitter.TSPoint;

/**
 * Splits one f-string node into literal text and replacement fields.
 * <p>
 * The grammar marks each {@code interpolation}; the text between them is still raw source, so
 * doubled braces and escapes are resolved here.
 */
final class FStringParser {
    private final PyTreeBuilder builder;
    private final boolean raw;
    private final String quote;

    FStringParser(PyTreeBuilder builder, boolean raw, String quote) {
        this.builder = builder;
        this.raw = raw;
        this.quote = quote;
    }

    /** Literal parts come back as string {@link Constant}s, fields as {@link FormattedValue}s. */
    ImmutableList<Expr> parse(TSNode string, int bodyStart, int bodyEnd) {
        MutableList<Expr> parts = Lists.mutable.empty();
        parts(string, "interpolation", bodyStart, bodyEnd, parts);
        return parts.toImmutable();
    }

    private void parts(TSNode parent, String fieldType, int start, int end, MutableList<Expr> out) {
        StringBuilder literal = new StringBuilder();
        int gap = start;
        for (TSNode child : PyTreeBuilder.children(parent)) {
            if (!child.getType().equals(fieldType)) {
                continue;
            }
            literal.append(literalText(gap, child.getStartByte(), parent));
            FormattedValue value = replacementField(child, literal);
            flush(literal, out, parent);
            out.add(value);
            gap = child.getEndByte();
        }
        literal.append(literalText(gap, end, parent));
        flush(literal, out, parent);
    }

    /** Source text between fields with doubled braces collapsed. */
    private String literalText(int start, int end, TSNode at) {
        String text = builder.text(start, end);
        StringBuilder result = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if ((c == '{' || c == '}') && i + 1 < text.length() && text.charAt(i + 1) == c) {
                result.append(c);
                i++;
            } else if (c == '}') {
                throw builder.error("f-string: single '}' is not allowed", at);
            } else if (c == '\\' && !raw && text.startsWith("\\N{", i)) {
                // \N{...} names a character; its braces are not doubled
                int close = text.indexOf('}', i);
                if (close < 0) {
                    throw builder.error("malformed \\N character escape", at);
                }
                result.append(text, i, close + 1);
                i = close;
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }

    private void flush(StringBuilder literal, MutableList<Expr> out, TSNode at) {
        if (literal.length() == 0) {
            return;
        }
        TSPoint point = at.getStartPoint();
        String text = StringLiterals.decode(literal.toString(), raw, false, point.getRow() + 1, point.getColumn() + 1);
        literal.setLength(0);
        if (!text.isEmpty()) {
            out.add(new Constant(new Literal.StringLiteral(text)));
        }
    }

    /** Converts an {@code interpolation}. A {@code =} specifier appends its source text to {@code literal}. */
    private FormattedValue replacementField(TSNode field, StringBuilder literal) {
        TSNode expression = PyTreeBuilder.field(field, "expression");
        if (expression == null) {
            throw builder.error("f-string: valid expression required before '}'", field);
        }
        String text = builder.text(expression);
        if (text.contains("\\")) {
            throw builder.error("f-string expression part cannot include a backslash", expression);
        }
        if (text.contains(quote)) {
            throw builder.error("f-string: expecting '}'", expression);
        }
        Expr value = builder.expression(expression);

        TSNode conversionNode = PyTreeBuilder.field(field, "type_conversion");
        TSNode specNode = PyTreeBuilder.field(field, "format_specifier");
        boolean selfDocumenting = PyTreeBuilder.hasToken(field, "=");
        if (selfDocumenting) {
            int end = conversionNode != null ? conversionNode.getStartByte()
                : specNode != null ? specNode.getStartByte()
                : field.getEndByte() - 1;
            literal.append(builder.text(field.getStartByte() + 1, end));
        }

        int conversion = FormattedValue.NO_CONVERSION;
        if (conversionNode != null) {
            String spelled = builder.text(conversionNode);
            if (spelled.length() != 2 || "sra".indexOf(spelled.charAt(1)) < 0) {
                throw builder.error("f-string: invalid conversion character", conversionNode);
            }
            conversion = spelled.charAt(1);
        }

        JoinedStr formatSpec = null;
        if (specNode != null) {
            MutableList<Expr> spec = Lists.mutable.empty();
            // skip the ':' that opens the format spec
            parts(specNode, "format_expression", specNode.getStartByte() + 1, specNode.getEndByte(), spec);
            formatSpec = new JoinedStr(spec.toImmutable());
        }
        if (selfDocumenting && conversion == FormattedValue.NO_CONVERSION && formatSpec == null) {
            conversion = 'r';
        }
        return new FormattedValue(value, conversion, formatSpec);
    }
}
