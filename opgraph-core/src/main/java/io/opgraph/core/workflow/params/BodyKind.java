package io.opgraph.core.workflow.params;

/// How an iterate node declares its body.
public enum BodyKind {
    /// A `body_spec` selector.
    SPEC,
    /// An explicit list of positions, or a single position.
    POSITIONS,
    /// A `{start, end}` object.
    RANGE,
    /// Aliases, alias ranges (`a..b`), numeric ranges (`3-7`) or a mix.
    SYMBOLIC,
    /// Only a previously resolved `body_positions` list.
    RESOLVED,
    /// Nothing declared.
    NONE,
    /// An object that is neither a list nor a range.
    INVALID
}
