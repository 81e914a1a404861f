package io.opgraph.core.state;

import java.time.Instant;

/// One entry of the variable store's mutation history.
///
/// @param timestamp when the mutation happened, never null
/// @param operation kind of mutation, never null
/// @param path affected path, empty for root-level operations
/// @param oldValue previous value, deep copy, may be null
/// @param newValue new value, deep copy, may be null
public record Mutation(
        Instant timestamp,
        MutationOperation operation,
        String path,
        Object oldValue,
        Object newValue) {}
