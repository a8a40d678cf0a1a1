package com.stacker.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised for requests the Stacker cannot execute as given: unknown index names, filter keys
 * or query fields, malformed values, and ids that cannot be located.
 *
 * <p>Carries per-field messages when the problem can be attributed to a request field.</p>
 */
public class StackerValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final Map<String, String> fieldErrors;

    public StackerValidationException(String message) {
        super(message);
        this.fieldErrors = Collections.emptyMap();
    }

    public StackerValidationException(String field, String message) {
        super(field + ": " + message);
        Map<String, String> errors = new LinkedHashMap<>();
        errors.put(field, message);
        this.fieldErrors = Collections.unmodifiableMap(errors);
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }
}
