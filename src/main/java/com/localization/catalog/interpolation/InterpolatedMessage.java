package com.localization.catalog.interpolation;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A template split into literal parts and placeholder names, ready to be
 * rendered repeatedly.
 *
 * <p>Structure: {@code parts.size() == placeholders.size() + 1}. Rendering
 * emits {@code parts[0] + value(placeholders[0]) + parts[1] + ...}.</p>
 */
@Getter
public class InterpolatedMessage {

    private final String template;
    private final List<String> parts;
    private final List<String> placeholders;

    InterpolatedMessage(String template, List<String> parts, List<String> placeholders) {
        if (parts.size() != placeholders.size() + 1) {
            throw new IllegalArgumentException(
                    "Invalid structure: parts.size()=" + parts.size() + ", placeholders.size()=" + placeholders.size());
        }
        this.template = template;
        this.parts = List.copyOf(parts);
        this.placeholders = List.copyOf(placeholders);
    }

    /**
     * Placeholder names in order of first appearance, without duplicates.
     */
    public Set<String> placeholderNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(placeholders));
    }

    public boolean hasPlaceholders() {
        return !placeholders.isEmpty();
    }

    /**
     * Substitutes every placeholder with {@code String.valueOf} of its binding.
     *
     * @throws MissingBindingsException if any placeholder has no binding; the
     *         exception carries the text with the unbound placeholders left in place
     */
    public String render(Map<String, ?> bindings) {
        StringBuilder sb = new StringBuilder(template.length() + 16);
        Set<String> missing = new LinkedHashSet<>();

        for (int i = 0; i < placeholders.size(); i++) {
            sb.append(parts.get(i));
            String name = placeholders.get(i);
            if (bindings != null && bindings.containsKey(name)) {
                sb.append(String.valueOf(bindings.get(name)));
            } else {
                missing.add(name);
                sb.append("%{").append(name).append('}');
            }
        }
        sb.append(parts.get(parts.size() - 1));

        if (!missing.isEmpty()) {
            throw new MissingBindingsException(template, sb.toString(), missing);
        }
        return sb.toString();
    }
}
