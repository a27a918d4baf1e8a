package com.localization.catalog.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A source location listed in a {@code #:} comment. The line is {@code null}
 * for references written without a {@code :line} suffix.
 */
@Value
public class Reference {
    @NonNull
    String path;
    Integer line;

    public static Reference of(String path, int line) {
        return new Reference(path, line);
    }

    public static Reference of(String path) {
        return new Reference(path, null);
    }

    public boolean hasLine() {
        return line != null;
    }

    /**
     * Renders the reference the way it appears in a catalog file.
     */
    public String render() {
        return line == null ? path : path + ":" + line;
    }
}
