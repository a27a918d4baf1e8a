package com.localization.catalog.merge;

import java.util.Locale;

/**
 * What happens to translated entries that no longer appear in the template.
 */
public enum ObsoletePolicy {
    /** Keep them at the end of the catalog as {@code #~} entries. */
    MARK_AS_OBSOLETE,
    /** Drop them from the merged catalog. */
    DELETE;

    /**
     * Parses {@code mark_as_obsolete} or {@code delete}, case-insensitively;
     * hyphens are accepted in place of underscores.
     */
    public static ObsoletePolicy fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
            for (ObsoletePolicy policy : values()) {
                if (policy.name().equals(normalized)) {
                    return policy;
                }
            }
        }
        throw new PolicyException("Unknown obsolete policy '" + value + "', expected mark_as_obsolete or delete");
    }

    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
