package com.mediai.mediai_agents.model.result;

import java.util.List;

/**
 * Result of checking an agent's input context before any work is done.
 * A valid outcome never carries errors.
 */
public record ValidationOutcome(boolean valid, List<String> errors) {

    public ValidationOutcome {
        errors = errors == null ? List.of() : List.copyOf(errors);
        if (valid && !errors.isEmpty()) {
            throw new IllegalArgumentException("A valid outcome cannot carry errors");
        }
    }

    public static ValidationOutcome success() {
        return new ValidationOutcome(true, List.of());
    }

    /** Empty error list means the input was valid. */
    public static ValidationOutcome of(List<String> errors) {
        return errors == null || errors.isEmpty() ? success() : new ValidationOutcome(false, errors);
    }

    public static ValidationOutcome failure(String... errors) {
        return new ValidationOutcome(false, List.of(errors));
    }
}
