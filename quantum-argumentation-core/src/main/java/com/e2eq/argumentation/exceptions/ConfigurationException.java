package com.e2eq.argumentation.exceptions;

/**
 * Thrown when a reasoning option carries an invalid value. Always raised before any
 * computation starts.
 */
public class ConfigurationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String option;
    private final Object value;

    public ConfigurationException(String message) {
        super(message);
        this.option = null;
        this.value = null;
    }

    public ConfigurationException(String option, Object value, String constraint) {
        super(String.format("Invalid value '%s' for option '%s': %s", value, option, constraint));
        this.option = option;
        this.value = value;
    }

    /**
     * The option name as it appears in configuration, e.g. {@code max-iterations}.
     */
    public String getOption() {
        return option;
    }

    /**
     * The rejected value.
     */
    public Object getValue() {
        return value;
    }
}
