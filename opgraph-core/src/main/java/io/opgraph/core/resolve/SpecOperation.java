package io.opgraph.core.resolve;

import io.opgraph.core.exception.ValidationException;
import java.util.Locale;

/// How a selector spec patch combines with what a node already declares.
public enum SpecOperation {
    /// Overwrite the spec of existing branches, or the whole body spec.
    REPLACE,
    /// Append new branches, or union selector keys into the body spec.
    ADD,
    /// Drop named branches, or clear the body spec.
    REMOVE;

    public static SpecOperation fromWireName(String name) {
        if (name == null || name.isBlank()) {
            return REPLACE;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("op", "unsupported operation '" + name + "'");
        }
    }
}
