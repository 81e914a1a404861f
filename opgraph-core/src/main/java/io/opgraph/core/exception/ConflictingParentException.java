package io.opgraph.core.exception;

import java.io.Serial;
import java.util.List;

/// Thrown when a node is claimed by more than one parent, or when parent links form a cycle.
///
/// Fatal to the tree build that detected it.
public class ConflictingParentException extends OpgraphException {

    @Serial private static final long serialVersionUID = 1833962089516604927L;

    private final int childPosition;
    private final List<Integer> claimingParents;

    public ConflictingParentException(int childPosition, List<Integer> claimingParents) {
        super(
                "Node at position "
                        + childPosition
                        + " is claimed by conflicting parents "
                        + claimingParents);
        this.childPosition = childPosition;
        this.claimingParents = List.copyOf(claimingParents);
    }

    public ConflictingParentException(int childPosition, String message) {
        super(message);
        this.childPosition = childPosition;
        this.claimingParents = List.of();
    }

    public int getChildPosition() {
        return childPosition;
    }

    public List<Integer> getClaimingParents() {
        return claimingParents;
    }
}
