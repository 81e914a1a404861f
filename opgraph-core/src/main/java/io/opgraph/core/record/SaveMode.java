package io.opgraph.core.record;

import io.opgraph.core.exception.ValidationException;
import java.util.Locale;

/// How {@link RecordStore#save} treats an existing or missing record.
public enum SaveMode {
    /// Fails if the record already exists.
    CREATE,
    /// Fails if the record does not exist.
    UPDATE,
    /// Creates or replaces.
    UPSERT;

    public static SaveMode fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return UPSERT;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("mode", "unknown save mode '" + value + "'");
        }
    }
}
