package io.opgraph.core.context;

import io.opgraph.core.util.Values;
import java.util.Objects;

/// Scope of one pass through a loop body.
///
/// @param nodePosition position of the iterate node
/// @param currentIndex zero-based iteration index
/// @param itemVariable name under which the current item is visible, not null
/// @param total number of iterations planned
/// @param item current item, deep-frozen; null when the item lives in the variable store
/// @param indexVariable optional extra name bound to the index, may be null
public record IterationFrame(
        int nodePosition,
        int currentIndex,
        String itemVariable,
        int total,
        Object item,
        String indexVariable) {

    public IterationFrame {
        Objects.requireNonNull(itemVariable, "itemVariable must not be null");
        item = Values.freeze(item);
    }

    public boolean isFirst() {
        return currentIndex == 0;
    }

    public boolean isLast() {
        return currentIndex == total - 1;
    }
}
