package com.localization.catalog.lookup;

/**
 * A translated plural entry lacks the form that the locale's plural rules
 * select for a count.
 */
public class PluralFormException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final int form;
    private final String locale;
    private final String msgid;
    private final int line;

    public PluralFormException(int form, String locale, String msgid, int line) {
        super("plural form " + form + " is required for locale '" + locale
                + "' but is missing for translation compiled from line " + line + " (msgid: '" + msgid + "')");
        this.form = form;
        this.locale = locale;
        this.msgid = msgid;
        this.line = line;
    }

    public int getForm() {
        return form;
    }

    public String getLocale() {
        return locale;
    }

    public String getMsgid() {
        return msgid;
    }

    public int getLine() {
        return line;
    }
}
