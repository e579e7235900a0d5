package com.resource.naming.rules;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Minimal {@code {placeholder}} template support shared by name and summary templates.
 * {@code {{} and {@code }}} render literal braces.
 */
public final class Templates {

    private Templates() {
    }

    /**
     * Returns the distinct placeholder names in order of first appearance.
     *
     * @throws IllegalArgumentException if a brace is left unclosed
     */
    public static List<String> placeholders(String template) {
        Set<String> names = new LinkedHashSet<>();
        scan(template, name -> {
            names.add(name);
            return "";
        });
        return new ArrayList<>(names);
    }

    /**
     * Renders the template, asking the resolver for each placeholder value.
     * The resolver may throw to reject a placeholder.
     */
    public static String render(String template, Function<String, String> resolver) {
        return scan(template, resolver);
    }

    private static String scan(String template, Function<String, String> resolver) {
        StringBuilder out = new StringBuilder(template.length());
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '{') {
                if (i + 1 < template.length() && template.charAt(i + 1) == '{') {
                    out.append('{');
                    i += 2;
                    continue;
                }
                int close = template.indexOf('}', i);
                if (close < 0) {
                    throw new IllegalArgumentException("Unclosed placeholder at position " + i);
                }
                String name = template.substring(i + 1, close).trim();
                if (name.isEmpty()) {
                    throw new IllegalArgumentException("Empty placeholder at position " + i);
                }
                String value = resolver.apply(name);
                out.append(value != null ? value : "");
                i = close + 1;
            } else if (c == '}') {
                if (i + 1 < template.length() && template.charAt(i + 1) == '}') {
                    i += 2;
                } else {
                    i++;
                }
                out.append('}');
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }
}
