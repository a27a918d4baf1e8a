package com.localization.catalog.merge;

import lombok.Builder;
import lombok.Value;

/**
 * Counts of what a merge did to each entry.
 */
@Value
@Builder
public class ChangeSummary {
    /** Template entries with no counterpart in the old catalog. */
    int newEntries;
    /** Entries matched exactly on context and msgid. */
    int unchanged;
    /** Entries matched by similarity and flagged fuzzy. */
    int fuzzy;
    /** Old entries marked obsolete by this merge. */
    int obsolete;
    /** Old entries dropped from the result. */
    int removed;

    public int mergedActiveCount() {
        return newEntries + unchanged + fuzzy;
    }
}
