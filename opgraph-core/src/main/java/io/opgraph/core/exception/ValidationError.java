package io.opgraph.core.exception;

import java.util.Objects;

/// A single field-level validation failure.
///
/// @param field dotted name of the offending field (e.g. `params.maxIterations`), not null
/// @param message human-readable description, not null
public record ValidationError(String field, String message) {

    public ValidationError {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
