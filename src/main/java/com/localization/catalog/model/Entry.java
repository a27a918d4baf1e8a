package com.localization.catalog.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A single translatable message of a catalog, either {@link SingularEntry} or
 * {@link PluralEntry}.
 *
 * <p>Values are kept as the list of quoted fragments they were written with so
 * that a catalog can be written back in its original layout. The source line
 * is informational and does not take part in equality.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class Entry {

    public static final String FUZZY_FLAG = "fuzzy";

    private final List<String> msgctxt;
    private final List<String> msgid;
    private final List<String> comments;
    private final List<String> extractedComments;
    private final List<Reference> references;
    private final SortedSet<String> flags;
    private final boolean obsolete;
    private final PreviousMessage previousMessage;
    @EqualsAndHashCode.Exclude
    private final int line;

    protected Entry(List<String> msgctxt, List<String> msgid, List<String> comments,
                    List<String> extractedComments, List<Reference> references,
                    Collection<String> flags, boolean obsolete,
                    PreviousMessage previousMessage, int line) {
        this.msgctxt = TextFragments.normalizeOptional(msgctxt);
        this.msgid = TextFragments.normalize(msgid);
        this.comments = comments == null ? List.of() : List.copyOf(comments);
        this.extractedComments = extractedComments == null ? List.of() : List.copyOf(extractedComments);
        this.references = references == null ? List.of() : List.copyOf(references);
        this.flags = Collections.unmodifiableSortedSet(flags == null ? new TreeSet<>() : new TreeSet<>(flags));
        this.obsolete = obsolete;
        this.previousMessage = previousMessage;
        this.line = line;
    }

    public EntryKey key() {
        return EntryKey.of(msgctxtText(), msgidText());
    }

    public String msgctxtText() {
        return TextFragments.join(msgctxt);
    }

    public String msgidText() {
        return TextFragments.join(msgid);
    }

    public boolean hasFlag(String flag) {
        return flags.contains(flag);
    }

    public boolean isFuzzy() {
        return hasFlag(FUZZY_FLAG);
    }

    /**
     * True when every translation slot of this entry holds non-empty text.
     */
    public abstract boolean isTranslated();

    /**
     * Whether this entry, placed first in a file, would be read as the header entry.
     */
    public boolean isHeaderCandidate() {
        return false;
    }

    /**
     * Copy of this entry with the obsolete marker set.
     */
    public abstract Entry asObsolete();
}
