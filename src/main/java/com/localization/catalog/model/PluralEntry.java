package com.localization.catalog.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Entry with a {@code msgid_plural} and one {@code msgstr[N]} per plural form.
 * Form indices are kept in ascending order; gaps are allowed.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class PluralEntry extends Entry {

    private final List<String> msgidPlural;
    private final SortedMap<Integer, List<String>> msgstr;

    @Builder
    public PluralEntry(List<String> msgctxt, List<String> msgid, List<String> msgidPlural,
                       Map<Integer, List<String>> msgstr, List<String> comments,
                       List<String> extractedComments, List<Reference> references,
                       Collection<String> flags, boolean obsolete,
                       PreviousMessage previousMessage, int line) {
        super(msgctxt, msgid, comments, extractedComments, references, flags, obsolete, previousMessage, line);
        this.msgidPlural = TextFragments.normalize(msgidPlural);
        SortedMap<Integer, List<String>> forms = new TreeMap<>();
        if (msgstr != null) {
            msgstr.forEach((index, fragments) -> forms.put(index, TextFragments.normalize(fragments)));
        }
        this.msgstr = Collections.unmodifiableSortedMap(forms);
    }

    public String msgidPluralText() {
        return TextFragments.join(msgidPlural);
    }

    /**
     * Text of plural form {@code index}, or {@code null} when the form is absent.
     */
    public String msgstrText(int index) {
        return TextFragments.join(msgstr.get(index));
    }

    public boolean hasForm(int index) {
        return msgstr.containsKey(index);
    }

    @Override
    public boolean isTranslated() {
        return !msgstr.isEmpty() && msgstr.values().stream().noneMatch(TextFragments::isBlank);
    }

    @Override
    public PluralEntry asObsolete() {
        return new PluralEntry(getMsgctxt(), getMsgid(), msgidPlural, msgstr, getComments(),
                getExtractedComments(), getReferences(), getFlags(), true, getPreviousMessage(), getLine());
    }
}
