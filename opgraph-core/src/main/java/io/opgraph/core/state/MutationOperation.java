package io.opgraph.core.state;

import java.util.Locale;

public enum MutationOperation {
    SET,
    DELETE,
    MERGE,
    CLEAR,
    RESTORE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
