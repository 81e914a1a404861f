package io.opgraph.core.workflow.node;

import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.util.Values;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/// Reference to a node by position, alias or uuid.
///
/// ### Parsing rules
/// - integral numbers and all-digit strings are positions
/// - strings shaped like a UUID are uuids
/// - any other string is an alias
/// - maps are read as `{uuid}`, `{position}` or `{alias}`, in that order of preference
public sealed interface NodeRef {

    Pattern UUID_PATTERN =
            Pattern.compile(
                    "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    /// Returns the reference rendered for diagnostics, e.g. `position 3`.
    String describe();

    record ByPosition(int position) implements NodeRef {
        @Override
        public String describe() {
            return "position " + position;
        }
    }

    record ByAlias(String alias) implements NodeRef {
        public ByAlias {
            Objects.requireNonNull(alias, "alias must not be null");
        }

        @Override
        public String describe() {
            return "alias '" + alias + "'";
        }
    }

    record ByUuid(String uuid) implements NodeRef {
        public ByUuid {
            Objects.requireNonNull(uuid, "uuid must not be null");
        }

        @Override
        public String describe() {
            return "uuid " + uuid;
        }
    }

    static NodeRef position(int position) {
        return new ByPosition(position);
    }

    static NodeRef alias(String alias) {
        return new ByAlias(alias);
    }

    static NodeRef uuid(String uuid) {
        return new ByUuid(uuid);
    }

    /// Parses a loosely typed reference as received from a request body.
    ///
    /// @param raw number, string or map, not null
    /// @return parsed reference, never null
    /// @throws ValidationException if the value cannot be interpreted
    static NodeRef parse(Object raw) {
        if (raw instanceof Map<?, ?> map) {
            Object uuid = map.get("uuid");
            if (uuid instanceof String s && !s.isBlank()) {
                return new ByUuid(s.trim());
            }
            Integer position = Values.toInteger(map.get("position"));
            if (position != null) {
                return new ByPosition(position);
            }
            Object alias = map.get("alias");
            if (alias instanceof String s && !s.isBlank()) {
                return new ByAlias(s.trim());
            }
            throw new ValidationException("ref", "reference object needs uuid, position or alias");
        }
        Integer position = Values.toInteger(raw);
        if (position != null) {
            return new ByPosition(position);
        }
        if (raw instanceof String s && !s.isBlank()) {
            String trimmed = s.trim();
            return UUID_PATTERN.matcher(trimmed).matches()
                    ? new ByUuid(trimmed)
                    : new ByAlias(trimmed);
        }
        throw new ValidationException("ref", "unsupported node reference: " + raw);
    }
}
