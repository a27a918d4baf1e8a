package com.localization.catalog.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collection;
import java.util.List;

/**
 * Entry with a single {@code msgstr}.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class SingularEntry extends Entry {

    private final List<String> msgstr;

    @Builder
    public SingularEntry(List<String> msgctxt, List<String> msgid, List<String> msgstr,
                         List<String> comments, List<String> extractedComments,
                         List<Reference> references, Collection<String> flags,
                         boolean obsolete, PreviousMessage previousMessage, int line) {
        super(msgctxt, msgid, comments, extractedComments, references, flags, obsolete, previousMessage, line);
        this.msgstr = TextFragments.normalize(msgstr);
    }

    public String msgstrText() {
        return TextFragments.join(msgstr);
    }

    @Override
    public boolean isTranslated() {
        return !msgstrText().isEmpty();
    }

    @Override
    public boolean isHeaderCandidate() {
        return !isObsolete() && getMsgctxt() == null && msgidText().isEmpty();
    }

    @Override
    public SingularEntry asObsolete() {
        return new SingularEntry(getMsgctxt(), getMsgid(), msgstr, getComments(), getExtractedComments(),
                getReferences(), getFlags(), true, getPreviousMessage(), getLine());
    }
}
