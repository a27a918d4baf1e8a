package com.localization.catalog.serializer;

import com.localization.catalog.model.Reference;

import java.util.ArrayList;
import java.util.List;

/**
 * Packs references greedily onto {@code #:} lines no wider than the given
 * width. A reference longer than the width gets a line of its own, and a
 * reference without a line number always ends its line.
 */
public class ReferenceWrapper {

    public static final int DEFAULT_WIDTH = 80;
    private static final String PREFIX = "#:";

    private final int width;

    public ReferenceWrapper() {
        this(DEFAULT_WIDTH);
    }

    public ReferenceWrapper(int width) {
        this.width = width;
    }

    public List<String> wrap(List<Reference> references) {
        List<String> lines = new ArrayList<>();
        StringBuilder current = null;

        for (Reference reference : references) {
            String text = reference.render();
            if (current != null && current.length() + 1 + text.length() > width) {
                lines.add(current.toString());
                current = null;
            }
            if (current == null) {
                current = new StringBuilder(PREFIX);
            }
            current.append(' ').append(text);
            if (!reference.hasLine()) {
                lines.add(current.toString());
                current = null;
            }
        }

        if (current != null) {
            lines.add(current.toString());
        }
        return lines;
    }
}
