package com.localization.catalog.model;

/**
 * Kinds of comment lines that can precede a catalog entry, keyed by their sigil.
 */
public enum CommentKind {
    /** {@code #: path:line ...} source references. */
    REFERENCE("#:"),
    /** {@code #. text} comments written by the extraction tool. */
    EXTRACTED("#."),
    /** {@code #, fuzzy, format} flags. */
    FLAG("#,"),
    /** {@code #| msgid "..."} the msgid this entry had before a fuzzy match. */
    PREVIOUS("#|"),
    /** {@code # text} translator comments. */
    TRANSLATOR("#");

    private final String sigil;

    CommentKind(String sigil) {
        this.sigil = sigil;
    }

    public String getSigil() {
        return sigil;
    }

    /**
     * Classifies a raw comment line (including its sigil).
     */
    public static CommentKind of(String raw) {
        if (raw == null || !raw.startsWith("#")) {
            throw new IllegalArgumentException("Not a comment line: " + raw);
        }
        for (CommentKind kind : values()) {
            if (raw.startsWith(kind.sigil)) {
                return kind;
            }
        }
        return TRANSLATOR;
    }

    /**
     * Returns the text after the sigil. Translator comments keep everything after
     * {@code #} verbatim; the other kinds drop a single separating space.
     */
    public String body(String raw) {
        String rest = raw.substring(sigil.length());
        if (this != TRANSLATOR && rest.startsWith(" ")) {
            return rest.substring(1);
        }
        return rest;
    }

    /**
     * Inverse of {@link #body(String)}.
     */
    public String render(String body) {
        if (this == TRANSLATOR || body.isEmpty()) {
            return sigil + body;
        }
        return sigil + " " + body;
    }
}
