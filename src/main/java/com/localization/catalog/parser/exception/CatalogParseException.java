package com.localization.catalog.parser.exception;

/**
 * Base class for errors raised while reading catalog text. Every error carries
 * the line it was detected on and a short reason; the message is
 * {@code "<line>: <reason>"}.
 */
public abstract class CatalogParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final int line;
    private final String reason;

    protected CatalogParseException(int line, String reason) {
        super(line + ": " + reason);
        this.line = line;
        this.reason = reason;
    }

    public int getLine() {
        return line;
    }

    public String getReason() {
        return reason;
    }
}
