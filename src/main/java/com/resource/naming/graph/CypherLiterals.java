package com.resource.naming.graph;

import java.util.Collection;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The one place where values are turned into Cypher literals.
 * Every caller-derived value reaches the store through {@link #bind(String, Map)}.
 */
public final class CypherLiterals {

    private static final Pattern PARAMETER = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)");
    private static final Pattern MAP_KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private CypherLiterals() {
    }

    /**
     * Substitutes {@code $name} references in a single pass. Text produced by a substitution
     * is never scanned again, and references without a matching parameter are left as they are.
     */
    public static String bind(String query, Map<String, Object> params) {
        if (params == null || params.isEmpty()) {
            return query;
        }
        Matcher matcher = PARAMETER.matcher(query);
        StringBuilder out = new StringBuilder(query.length() + 32);
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = params.containsKey(name)
                    ? literal(params.get(name))
                    : matcher.group();
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Formats a value as a Cypher literal. Strings are single-quoted with backslash escapes;
     * collections become list literals and maps become map literals, element by element.
     *
     * @throws IllegalArgumentException for non-finite numbers and map keys that are not plain identifiers
     */
    public static String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Boolean || value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte) {
            return value.toString();
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("Non-finite numbers cannot be bound as Cypher literals");
            }
            return value.toString();
        }
        if (value instanceof Collection<?> items) {
            StringJoiner list = new StringJoiner(", ", "[", "]");
            for (Object item : items) {
                list.add(literal(item));
            }
            return list.toString();
        }
        if (value instanceof Map<?, ?> entries) {
            StringJoiner map = new StringJoiner(", ", "{", "}");
            for (Map.Entry<?, ?> entry : entries.entrySet()) {
                String key = String.valueOf(entry.getKey());
                if (!MAP_KEY.matcher(key).matches()) {
                    throw new IllegalArgumentException("Map keys must be plain identifiers to be bound as Cypher literals");
                }
                map.add(key + ": " + literal(entry.getValue()));
            }
            return map.toString();
        }
        return quote(value.toString());
    }

    /**
     * Escapes a string using the store's literal rule and wraps it in single quotes.
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('\'');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7F) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('\'');
        return sb.toString();
    }
}
