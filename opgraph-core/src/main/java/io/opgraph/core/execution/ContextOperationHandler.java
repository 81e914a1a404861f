package io.opgraph.core.execution;

import static io.opgraph.core.workflow.node.NodeParams.KEY;
import static io.opgraph.core.workflow.node.NodeParams.OPERATION;
import static io.opgraph.core.workflow.node.NodeParams.VALUE;

import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.state.VariableStore;
import io.opgraph.core.util.Values;
import io.opgraph.core.workflow.node.Node;
import java.util.Locale;
import java.util.Map;

/// Applies a `context` node to the variable store instead of calling the driver.
///
/// Supported operations: `set`, `get`, `update` (merge into an existing object, set
/// otherwise), `merge`, `delete` and `clear`. The node's params must already be resolved.
public final class ContextOperationHandler {

    private ContextOperationHandler() {}

    /// @param node resolved context node, not null
    /// @param variables target store, not null
    /// @return success result; `get` returns the value read as output
    /// @throws ValidationException if the operation is unknown or a write is rejected
    public static NodeResult apply(Node node, VariableStore variables) {
        Map<String, Object> params = node.getParamsMap();
        String operation = String.valueOf(params.get(OPERATION)).toLowerCase(Locale.ROOT);
        Object key = params.get(KEY);
        Object value = params.get(VALUE);
        String path = key != null ? String.valueOf(key) : null;

        boolean changed =
                switch (operation) {
                    case "set" -> requireWritten(variables.set(requirePath(path), value), path);
                    case "merge" -> requireWritten(variables.merge(requirePath(path), value), path);
                    case "update" -> {
                        String target = requirePath(path);
                        boolean merge =
                                value instanceof Map<?, ?>
                                        && variables.get(target).map(v -> v instanceof Map<?, ?>).orElse(false);
                        yield requireWritten(
                                merge ? variables.merge(target, value) : variables.set(target, value),
                                path);
                    }
                    case "delete" -> variables.delete(requirePath(path));
                    case "clear" -> {
                        variables.clear();
                        yield true;
                    }
                    case "get" -> false;
                    default ->
                            throw new ValidationException(
                                    "params.operation", "unknown context operation '" + operation + "'");
                };

        if ("get".equals(operation)) {
            return NodeResult.success(variables.get(requirePath(path)).orElse(null));
        }
        return NodeResult.success(
                Values.deepCopy(value), Map.of("operation", operation, "changed", changed));
    }

    private static String requirePath(String path) {
        if (path == null || path.isBlank()) {
            throw new ValidationException("params.key", "context operation needs a key");
        }
        return path;
    }

    private static boolean requireWritten(boolean written, String path) {
        if (!written) {
            throw new ValidationException("params.key", "cannot write variable '" + path + "'");
        }
        return true;
    }
}
