package io.opgraph.core.exception;

import java.io.Serial;
import java.util.List;
import java.util.stream.Collectors;

/// Thrown when node params or a request are malformed.
///
/// Collects every detected problem instead of stopping at the first one, so a single
/// response can list all of them.
public class ValidationException extends OpgraphException {

    @Serial private static final long serialVersionUID = -6009185830542417190L;

    private final transient List<ValidationError> errors;

    public ValidationException(List<ValidationError> errors) {
        super(
                "Validation failed: "
                        + errors.stream()
                                .map(ValidationError::toString)
                                .collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
    }

    public ValidationException(String field, String message) {
        this(List.of(new ValidationError(field, message)));
    }

    public List<ValidationError> getErrors() {
        return errors;
    }
}
