package com.localization.catalog.model;

import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Helpers for the fragment lists that back msgid/msgstr values. A value written
 * over several quoted lines keeps one fragment per line.
 */
@UtilityClass
public class TextFragments {

    public String join(List<String> fragments) {
        if (fragments == null) {
            return null;
        }
        if (fragments.size() == 1) {
            return fragments.get(0);
        }
        return String.join("", fragments);
    }

    /**
     * Immutable copy; a missing or empty list becomes a single empty fragment.
     */
    public List<String> normalize(List<String> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            return List.of("");
        }
        return List.copyOf(fragments);
    }

    /**
     * Like {@link #normalize(List)} but keeps {@code null}, which marks an absent value.
     */
    public List<String> normalizeOptional(List<String> fragments) {
        return fragments == null ? null : normalize(fragments);
    }

    public boolean isBlank(List<String> fragments) {
        return fragments == null || join(fragments).isEmpty();
    }
}
