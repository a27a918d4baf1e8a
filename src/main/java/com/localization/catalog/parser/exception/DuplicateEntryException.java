package com.localization.catalog.parser.exception;

/**
 * Two active entries share the same context and msgid. Reported at the line of
 * the later entry.
 */
public class DuplicateEntryException extends CatalogParseException {

    private static final long serialVersionUID = 1L;
    private final int originalLine;
    private final String msgid;
    private final String msgidPlural;

    public DuplicateEntryException(int line, int originalLine, String msgid, String msgidPlural) {
        super(line, describe(originalLine, msgid, msgidPlural));
        this.originalLine = originalLine;
        this.msgid = msgid;
        this.msgidPlural = msgidPlural;
    }

    private static String describe(int originalLine, String msgid, String msgidPlural) {
        String reason = "found duplicate on line " + originalLine + " for msgid: '" + msgid + "'";
        if (msgidPlural != null) {
            reason += " and msgid_plural: '" + msgidPlural + "'";
        }
        return reason;
    }

    public int getOriginalLine() {
        return originalLine;
    }

    public String getMsgid() {
        return msgid;
    }

    /**
     * The plural msgid of the colliding entry, or {@code null} for a singular entry.
     */
    public String getMsgidPlural() {
        return msgidPlural;
    }
}
