package com.localization.catalog.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Snapshot of the identifiers an entry had before a fuzzy match replaced them
 * ({@code #| msgctxt}, {@code #| msgid}, {@code #| msgid_plural}).
 */
@Value
public class PreviousMessage {
    List<String> msgctxt;
    List<String> msgid;
    List<String> msgidPlural;

    @Builder
    public PreviousMessage(List<String> msgctxt, List<String> msgid, List<String> msgidPlural) {
        this.msgctxt = TextFragments.normalizeOptional(msgctxt);
        this.msgid = TextFragments.normalize(msgid);
        this.msgidPlural = TextFragments.normalizeOptional(msgidPlural);
    }

    /**
     * Captures the identifiers of an existing entry.
     */
    public static PreviousMessage of(Entry entry) {
        List<String> plural = entry instanceof PluralEntry pluralEntry ? pluralEntry.getMsgidPlural() : null;
        return new PreviousMessage(entry.getMsgctxt(), entry.getMsgid(), plural);
    }

    public String msgidText() {
        return TextFragments.join(msgid);
    }
}
