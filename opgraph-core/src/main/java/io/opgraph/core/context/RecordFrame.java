package io.opgraph.core.context;

import io.opgraph.core.util.Values;
import java.util.Map;
import java.util.Objects;

/// Scope of the record currently being processed.
///
/// @param recordId record identifier, not null
/// @param recordData record data (`fields`, `vars`, `targets`, `history`), deep-frozen, not null
public record RecordFrame(String recordId, Map<String, Object> recordData) {

    @SuppressWarnings("unchecked")
    public RecordFrame {
        Objects.requireNonNull(recordId, "recordId must not be null");
        Objects.requireNonNull(recordData, "recordData must not be null");
        recordData = (Map<String, Object>) Values.freeze(recordData);
    }
}
