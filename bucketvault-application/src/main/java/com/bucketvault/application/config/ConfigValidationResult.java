package com.bucketvault.application.config;

import java.util.ArrayList;
import java.util.List;

/** Every problem {@link ConfigValidator} found in one pass, in the order they were found. */
public final class ConfigValidationResult {

    private final List<String> errors = new ArrayList<>();

    void addError(String error) {
        if (error != null && !error.isBlank()) errors.add(error);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> errors() {
        return List.copyOf(errors);
    }

    /** One line for a startup failure message. */
    public String summary() {
        return isValid() ? "ok" : String.join("; ", errors);
    }
}
