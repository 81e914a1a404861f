package io.opgraph.core.resolve;

import java.util.List;

/// Resolution outcome of one route branch, or of an iterate body (named `body`).
///
/// @param index declaration index of the branch
/// @param name branch name
/// @param positions resolved positions after dropping dangling ones
/// @param error message when this branch could not be resolved and was left untouched, else
///     null
public record BranchResolution(int index, String name, List<Integer> positions, String error) {

    public BranchResolution {
        positions = List.copyOf(positions);
    }

    public int resolvedCount() {
        return positions.size();
    }

    public boolean failed() {
        return error != null;
    }
}
