package io.opgraph.core.edit;

import static io.opgraph.core.workflow.node.NodeParams.BODY;
import static io.opgraph.core.workflow.node.NodeParams.KEY;
import static io.opgraph.core.workflow.node.NodeParams.OPERATION;

import io.opgraph.core.exception.ValidationError;
import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.store.NodeSnapshot;
import io.opgraph.core.util.Values;
import io.opgraph.core.workflow.params.IterateParams;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/// Checks node drafts before they reach the store. Collects every problem, then throws once.
public final class NodeDraftValidator {

    public static final Pattern ALIAS_PATTERN = Pattern.compile("^[a-z][a-z0-9_]*$");

    private static final Set<String> CONTEXT_OPERATIONS =
            Set.of("set", "get", "update", "merge", "delete", "clear");

    private NodeDraftValidator() {}

    /// @throws ValidationException if the draft is malformed or its alias is taken
    public static void validate(NodeDraft draft, NodeSnapshot snapshot) {
        List<ValidationError> errors = new ArrayList<>();
        validateAlias(draft.alias(), snapshot, errors);

        Map<String, Object> params = Values.asMap(draft.params());
        switch (draft.type()) {
            case ROUTE -> {
                if (!(draft.params() instanceof List<?>) && params == null) {
                    errors.add(new ValidationError("params", "route params must be an array or an object"));
                }
            }
            case ITERATE -> {
                IterateParams iterate = IterateParams.of(draft.params());
                if (iterate.listVariable() == null
                        && !iterate.isRecordIteration()
                        && (params == null || params.get(BODY) == null)
                        && iterate.bodySpec() == null) {
                    errors.add(
                            new ValidationError(
                                    "params",
                                    "iterate needs listVariable, over, records or a body"));
                }
                errors.addAll(iterate.validate());
            }
            case CONTEXT -> {
                Object operation = params != null ? params.get(OPERATION) : null;
                if (Values.isBlank(operation)
                        || !CONTEXT_OPERATIONS.contains(String.valueOf(operation))) {
                    errors.add(
                            new ValidationError(
                                    "params.operation",
                                    "must be one of " + CONTEXT_OPERATIONS));
                } else if (!"clear".equals(operation) && Values.isBlank(params.get(KEY))) {
                    errors.add(new ValidationError("params.key", "required unless operation is clear"));
                }
            }
            default -> {
                // no type-specific requirements
            }
        }
        if (draft.position() != null && draft.position() < 1) {
            errors.add(new ValidationError("position", "must be 1 or greater"));
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    static void validateAlias(String alias, NodeSnapshot snapshot, List<ValidationError> errors) {
        if (alias == null || alias.isBlank()) {
            errors.add(new ValidationError("alias", "alias is required"));
        } else if (!ALIAS_PATTERN.matcher(alias).matches()) {
            errors.add(
                    new ValidationError(
                            "alias",
                            "'" + alias + "' must be snake_case: start with a lowercase letter, "
                                    + "then lowercase letters, digits or underscores"));
        } else if (snapshot.byAlias(alias).isPresent()) {
            errors.add(
                    new ValidationError(
                            "alias",
                            "'" + alias + "' is already used by node at position "
                                    + snapshot.byAlias(alias).get().getPosition()));
        }
    }
}
