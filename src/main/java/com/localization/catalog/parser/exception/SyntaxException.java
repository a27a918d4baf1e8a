package com.localization.catalog.parser.exception;

/**
 * Token sequence that does not form a valid catalog.
 */
public class SyntaxException extends CatalogParseException {

    private static final long serialVersionUID = 1L;

    public SyntaxException(int line, String reason) {
        super(line, reason);
    }

    public static SyntaxException before(int line, String literal) {
        return new SyntaxException(line, "syntax error before: " + literal);
    }
}
