package com.jpyq.query;

import com.jpyq.query.QueryNode.Declaration;

public class QueryParser {
    public QueryNode parse(String queryString) {
        if (queryString == null || queryString.isBlank()) {
            return new QueryNode.Identity();
        }

        String trimmed = queryString.trim();

        // Handle pipe operator (but not inside parentheses or quotes)
        int pipeIndex = findTopLevelPipe(trimmed);
        if (pipeIndex != -1) {
            QueryNode left = parse(trimmed.substring(0, pipeIndex));
            QueryNode right = parse(trimmed.substring(pipeIndex + 1));
            return new QueryNode.Pipe(left, right);
        }

        if (trimmed.equals(".")) {
            return new QueryNode.Identity();
        }

        // Handle .[] and .[n], and chaining like .[].[0]
        if (trimmed.startsWith(".[")) {
            int close = trimmed.indexOf(']');
            if (close == -1) {
                throw new IllegalArgumentException("Unclosed index in query: " + trimmed);
            }
            QueryNode head = index(trimmed.substring(2, close).trim());
            String rest = trimmed.substring(close + 1);
            if (rest.isEmpty()) {
                return head;
            }
            if (rest.startsWith(".")) {
                return new QueryNode.Pipe(head, parse(rest));
            }
            throw new IllegalArgumentException("Unsupported query after " + trimmed.substring(0, close + 1) + ": " + rest);
        }

        int open = trimmed.indexOf('(');
        if (open == -1) {
            return function(trimmed, null);
        }
        if (!trimmed.endsWith(")")) {
            throw new IllegalArgumentException("Unsupported query: " + queryString);
        }
        String name = trimmed.substring(0, open).trim();
        String argument = argument(trimmed.substring(open + 1, trimmed.length() - 1).trim());
        return function(name, argument);
    }

    private QueryNode index(String indexStr) {
        if (indexStr.isEmpty()) {
            return new QueryNode.Iterator();
        }
        try {
            return new QueryNode.Index(Integer.parseInt(indexStr));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid index: " + indexStr);
        }
    }

    private QueryNode function(String name, String argument) {
        switch (name) {
            case "length" -> {
                noArgument(name, argument);
                return new QueryNode.Length();
            }
            case "is_integer" -> {
                noArgument(name, argument);
                return new QueryNode.IsInteger();
            }
            case "find_conditions" -> {
                noArgument(name, argument);
                return new QueryNode.Conditions();
            }
            case "find_if_bodies" -> {
                noArgument(name, argument);
                return new QueryNode.IfBodies();
            }
            case "find_ifs" -> {
                noArgument(name, argument);
                return new QueryNode.Ifs();
            }
            case "find_function" -> {
                return new QueryNode.Find(Declaration.FUNCTION, required(name, argument));
            }
            case "find_class" -> {
                return new QueryNode.Find(Declaration.CLASS, required(name, argument));
            }
            case "find_variable" -> {
                return new QueryNode.Find(Declaration.VARIABLE, required(name, argument));
            }
            case "has_function" -> {
                return new QueryNode.Has(Declaration.FUNCTION, required(name, argument));
            }
            case "has_class" -> {
                return new QueryNode.Has(Declaration.CLASS, required(name, argument));
            }
            case "has_variable" -> {
                return new QueryNode.Has(Declaration.VARIABLE, required(name, argument));
            }
            case "get_variable" -> {
                return new QueryNode.GetVariable(required(name, argument));
            }
            case "value_is_call" -> {
                return new QueryNode.ValueIsCall(required(name, argument));
            }
            case "is_equivalent" -> {
                return new QueryNode.IsEquivalent(required(name, argument));
            }
            default -> throw new IllegalArgumentException("Unsupported query: " + name);
        }
    }

    private static void noArgument(String name, String argument) {
        if (argument != null && !argument.isEmpty()) {
            throw new IllegalArgumentException(name + " takes no argument");
        }
    }

    private static String required(String name, String argument) {
        if (argument == null) {
            throw new IllegalArgumentException(name + " needs an argument");
        }
        return argument;
    }

    /**
     * A quoted string with its escapes resolved, or a bare word as written.
     */
    private String argument(String text) {
        if (text.isEmpty() || (text.charAt(0) != '"' && text.charAt(0) != '\'')) {
            return text;
        }
        char quote = text.charAt(0);
        if (text.length() < 2 || text.charAt(text.length() - 1) != quote) {
            throw new IllegalArgumentException("Unterminated string in query: " + text);
        }
        StringBuilder value = new StringBuilder();
        for (int i = 1; i < text.length() - 1; i++) {
            char c = text.charAt(i);
            if (c != '\\' || i + 1 == text.length() - 1) {
                value.append(c);
                continue;
            }
            char escaped = text.charAt(++i);
            switch (escaped) {
                case 'n' -> value.append('\n');
                case 't' -> value.append('\t');
                case '\\', '"', '\'' -> value.append(escaped);
                default -> value.append('\\').append(escaped);
            }
        }
        return value.toString();
    }

    /**
     * Find the index of a pipe character that's not inside parentheses or a quoted string
     */
    private int findTopLevelPipe(String query) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < query.length(); i++) {
            char c = query.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == '|' && depth == 0) {
                return i;
            }
        }
        return -1;
    }
}
