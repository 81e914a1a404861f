package io.opgraph.core.context;

import io.opgraph.core.state.VariablePath;
import io.opgraph.core.state.VariableStore;
import io.opgraph.core.template.VariableLookup;
import java.util.Objects;
import java.util.Optional;

/// Variable lookup that consults a context stack before the variable store.
///
/// A name bound by a frame shadows the store even when the frame's value is missing, so an
/// inner loop never sees an outer variable of the same name by accident.
public final class ScopedVariables implements VariableLookup {

    private final ContextStack stack;
    private final VariableStore store;

    public ScopedVariables(ContextStack stack, VariableStore store) {
        this.stack = Objects.requireNonNull(stack, "stack must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    @Override
    public Optional<Object> lookup(String path) {
        ContextStack.FrameMatch match = stack.resolve(path);
        if (!match.bound()) {
            return store.get(path);
        }
        if (match.storageKey() != null) {
            return store.get(match.storageKey())
                    .flatMap(value -> VariablePath.navigate(value, match.rest()));
        }
        return match.value();
    }
}
