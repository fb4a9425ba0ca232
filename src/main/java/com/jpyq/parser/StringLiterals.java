package com.jpyq.parser;

/**
 * Resolves backslash escapes in the body of a string literal. Line and column locate the literal
 * for error reports.
 */
final class StringLiterals {

    private StringLiterals() {
    }

    static String decode(String body, boolean raw, boolean bytes, int line, int column) {
        if (bytes) {
            for (int i = 0; i < body.length(); i++) {
                if (body.charAt(i) > 0x7f) {
                    throw new PySyntaxException("bytes can only contain ASCII literal characters", line, column);
                }
            }
        }
        if (raw || body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder result = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i++);
            if (c != '\\' || i >= body.length()) {
                result.append(c);
                continue;
            }
            char escape = body.charAt(i++);
            switch (escape) {
                case '\n' -> {
                }
                case '\r' -> {
                    if (i < body.length() && body.charAt(i) == '\n') {
                        i++;
                    }
                }
                case '\\', '\'', '"' -> result.append(escape);
                case 'a' -> result.append('\u0007');
                case 'b' -> result.append('\b');
                case 'f' -> result.append('\f');
                case 'n' -> result.append('\n');
                case 'r' -> result.append('\r');
                case 't' -> result.append('\t');
                case 'v' -> result.append('\u000b');
                case '0', '1', '2', '3', '4', '5', '6', '7' -> {
                    int end = i - 1;
                    while (end < body.length() && end < i + 2 && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
                        end++;
                    }
                    result.append((char) Integer.parseInt(body.substring(i - 1, end), 8));
                    i = end;
                }
                case 'x' -> {
                    result.append((char) hex(body, i, 2, "\\xXX", line, column));
                    i += 2;
                }
                case 'u', 'U' -> {
                    if (bytes) {
                        result.append('\\').append(escape);
                    } else {
                        int digits = escape == 'u' ? 4 : 8;
                        result.appendCodePoint(hex(body, i, digits, escape == 'u' ? "\\uXXXX" : "\\UXXXXXXXX", line, column));
                        i += digits;
                    }
                }
                case 'N' -> {
                    if (bytes) {
                        result.append("\\N");
                    } else {
                        int close = body.indexOf('}', i);
                        if (i >= body.length() || body.charAt(i) != '{' || close < 0) {
                            throw new PySyntaxException("malformed \\N character escape", line, column);
                        }
                        String name = body.substring(i + 1, close);
                        try {
                            result.appendCodePoint(Character.codePointOf(name));
                        } catch (IllegalArgumentException e) {
                            throw new PySyntaxException("unknown Unicode character name '" + name + "'", line, column);
                        }
                        i = close + 1;
                    }
                }
                default -> result.append('\\').append(escape);
            }
        }
        return result.toString();
    }

    private static int hex(String body, int start, int digits, String form, int line, int column) {
        if (start + digits > body.length()) {
            throw new PySyntaxException("truncated " + form + " escape", line, column);
        }
        try {
            return Integer.parseUnsignedInt(body.substring(start, start + digits), 16);
        } catch (NumberFormatException e) {
            throw new PySyntaxException("truncated " + form + " escape", line, column);
        }
    }
}
