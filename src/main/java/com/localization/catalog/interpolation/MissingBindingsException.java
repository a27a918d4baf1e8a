package com.localization.catalog.interpolation;

import java.util.List;
import java.util.Set;

/**
 * Raised when a template references placeholders that have no binding.
 */
public class MissingBindingsException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final String template;
    private final String partialResult;
    private final List<String> missingBindings;

    public MissingBindingsException(String template, String partialResult, Set<String> missingBindings) {
        super("missing interpolation keys " + missingBindings + " for '" + template + "'");
        this.template = template;
        this.partialResult = partialResult;
        this.missingBindings = List.copyOf(missingBindings);
    }

    public String getTemplate() {
        return template;
    }

    /**
     * The rendered text with every unbound placeholder left as {@code %{name}}.
     */
    public String getPartialResult() {
        return partialResult;
    }

    public List<String> getMissingBindings() {
        return missingBindings;
    }
}
