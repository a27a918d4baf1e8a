package com.localization.catalog.merge;

/**
 * Invalid merge configuration.
 */
public class PolicyException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PolicyException(String message) {
        super(message);
    }
}
