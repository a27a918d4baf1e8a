package com.localization.catalog.interpolation;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code %{name}} interpolation for translated messages.
 *
 * <h3>Syntax:</h3>
 * <ul>
 *     <li>{@code %{name}} is a placeholder; names are case-sensitive</li>
 *     <li>{@code %{}} and a {@code %} not followed by an opening brace are literal text</li>
 *     <li>an opening {@code %} and brace without a closing brace makes the rest of the template literal</li>
 * </ul>
 */
@UtilityClass
public class Interpolation {

    private static final String OPEN = "%{";

    public InterpolatedMessage compile(String template) {
        List<String> parts = new ArrayList<>();
        List<String> placeholders = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int pos = 0;

        while (true) {
            int start = template.indexOf(OPEN, pos);
            int end = start < 0 ? -1 : template.indexOf('}', start + OPEN.length());
            if (end < 0) {
                literal.append(template, pos, template.length());
                break;
            }
            if (end == start + OPEN.length()) {
                // "%{}" stays as written
                literal.append(template, pos, end + 1);
            } else {
                literal.append(template, pos, start);
                parts.add(literal.toString());
                literal.setLength(0);
                placeholders.add(template.substring(start + OPEN.length(), end));
            }
            pos = end + 1;
        }

        parts.add(literal.toString());
        return new InterpolatedMessage(template, parts, placeholders);
    }

    /**
     * Placeholder names of a template in order of first appearance.
     */
    public Set<String> placeholders(String template) {
        return compile(template).placeholderNames();
    }

    /**
     * Compiles and renders a template in one step.
     *
     * @throws MissingBindingsException if any placeholder has no binding
     */
    public String render(String template, Map<String, ?> bindings) {
        return compile(template).render(bindings);
    }
}
