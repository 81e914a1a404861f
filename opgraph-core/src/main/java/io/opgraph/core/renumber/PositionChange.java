package io.opgraph.core.renumber;

import java.util.Objects;

/// One node's move to a new position.
///
/// @param id uuid of the moved node, not null
/// @param oldPosition position before the move
/// @param newPosition position after the move
public record PositionChange(String id, int oldPosition, int newPosition) {

    public PositionChange {
        Objects.requireNonNull(id, "id must not be null");
    }
}
