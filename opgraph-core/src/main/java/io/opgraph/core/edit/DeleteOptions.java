package io.opgraph.core.edit;

/// Options for {@link WorkflowEditor#deleteNodes}.
///
/// @param handleDependencies strip references to deleted nodes from surviving containers;
///     when false, deleting a referenced node is rejected
/// @param deleteChildren also delete every control-flow descendant of the deleted nodes
/// @param dryRun compute the outcome without writing
public record DeleteOptions(boolean handleDependencies, boolean deleteChildren, boolean dryRun) {

    public static DeleteOptions defaults() {
        return new DeleteOptions(true, false, false);
    }
}
