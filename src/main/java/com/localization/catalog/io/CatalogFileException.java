package com.localization.catalog.io;

import com.localization.catalog.parser.exception.CatalogParseException;

import java.nio.file.Path;

/**
 * A catalog file could not be parsed. The message is {@code <path>:<line>: <reason>}.
 */
public class CatalogFileException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final transient Path path;
    private final int line;
    private final String reason;

    public CatalogFileException(Path path, CatalogParseException cause) {
        super(path + ":" + cause.getLine() + ": " + cause.getReason(), cause);
        this.path = path;
        this.line = cause.getLine();
        this.reason = cause.getReason();
    }

    public Path getPath() {
        return path;
    }

    public int getLine() {
        return line;
    }

    public String getReason() {
        return reason;
    }
}
