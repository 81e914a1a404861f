package io.opgraph.core.record;

import java.util.Locale;

/// Processing state of a {@link WorkflowRecord}. `COMPLETE` and `FAILED` are terminal.
public enum RecordStatus {
    DISCOVERED,
    PROCESSING,
    COMPLETE,
    FAILED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }

    /// Parses a wire name, falling back to `DISCOVERED` for null or unknown values.
    public static RecordStatus fromWireName(String value) {
        if (value == null) {
            return DISCOVERED;
        }
        for (RecordStatus status : values()) {
            if (status.wireName().equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        return DISCOVERED;
    }
}
