package io.opgraph.core.state;

import io.opgraph.core.util.Values;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/// Deep-copied checkpoint of a variable store.
///
/// @param timestamp when the snapshot was taken, not null
/// @param state frozen copy of the whole variable tree, not null
/// @param mutationCount number of history entries at snapshot time
public record VariableSnapshot(Instant timestamp, Map<String, Object> state, int mutationCount) {

    @SuppressWarnings("unchecked")
    public VariableSnapshot {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(state, "state must not be null");
        state = (Map<String, Object>) Values.freeze(state);
    }
}
