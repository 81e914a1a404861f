package io.opgraph.core.template;

import java.util.Optional;

/// Read access to variables by dotted path, as consumed by template resolution.
///
/// Implemented by the variable store and by the context-stack scope layered over it.
@FunctionalInterface
public interface VariableLookup {

    /// Resolves a path such as `items[0].name` or `email.subject`.
    ///
    /// @param path dotted path, not null
    /// @return the value, or empty when the path is absent or holds null
    Optional<Object> lookup(String path);
}
