package com.localization.catalog.parser.exception;

/**
 * Malformed input found by the tokenizer (bad keyword, bad escape, unterminated string).
 */
public class LexException extends CatalogParseException {

    private static final long serialVersionUID = 1L;

    public LexException(int line, String reason) {
        super(line, reason);
    }
}
