package io.opgraph.core.tree;

/// The way a parent claims a child.
public enum LinkKind {
    ROUTE_BRANCH,
    ITERATE_BODY,
    HANDLE_SECTION,
    EXPLICIT_PARENT
}
