package io.opgraph.core.workflow.params;

import java.util.List;
import java.util.Objects;

/// Canonical in-memory view of one route branch, independent of the stored shape.
///
/// @param index zero-based declaration order, used to disambiguate duplicate names
/// @param name branch name, never null
/// @param condition branch condition expression, may be null
/// @param positions concrete positions currently stored for the branch, never null
/// @param symbolic a flexible reference still needing resolution (alias, range, mixed list),
///     may be null
/// @param spec a selector spec (`branch_spec` or `paths_spec.<name>`), may be null
public record Branch(
        int index,
        String name,
        String condition,
        List<Integer> positions,
        Object symbolic,
        Object spec) {

    public Branch {
        Objects.requireNonNull(name, "name must not be null");
        positions = List.copyOf(positions);
    }

    /// Whether anything beyond already-concrete positions is declared.
    public boolean isSymbolic() {
        return spec != null || symbolic != null;
    }
}
