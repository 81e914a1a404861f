package io.opgraph.core.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/// Helpers for the loosely typed JSON-like values carried in node params, variables and
/// record data.
///
/// Values are one of: `null`, {@link String}, {@link Number}, {@link Boolean},
/// `Map<String, Object>` or `List<Object>`, nested arbitrarily. Maps keep insertion order.
public final class Values {

    private static final Pattern DIGITS = Pattern.compile("-?\\d+");

    private Values() {}

    /// Returns a deep, mutable copy of the value. Maps become {@link LinkedHashMap}, lists
    /// become {@link ArrayList}; scalars are returned as is.
    public static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), deepCopy(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(deepCopy(v)));
            return copy;
        }
        return value;
    }

    /// Returns a deep, unmodifiable copy of the value. Unlike `Map.copyOf` this tolerates
    /// `null` entries, which are legal in params.
    public static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), freeze(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(freeze(v)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    /// Deep mutable copy of a map value, or an empty map when the value is not a map.
    @SuppressWarnings("unchecked")
    public static Map<String, Object> mutableMap(Object value) {
        if (value instanceof Map<?, ?>) {
            return (Map<String, Object>) deepCopy(value);
        }
        return new LinkedHashMap<>();
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : null;
    }

    @SuppressWarnings("unchecked")
    public static List<Object> asList(Object value) {
        return value instanceof List<?> ? (List<Object>) value : null;
    }

    /// Interprets an integral number or a numeric string as an integer.
    ///
    /// @return the integer, or null when the value is not integral or does not fit in an int
    public static Integer toInteger(Object value) {
        if (value instanceof Integer i) {
            return i;
        }
        if (value instanceof Long || value instanceof Short || value instanceof Byte) {
            long l = ((Number) value).longValue();
            return l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE ? (int) l : null;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            boolean fits = d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE;
            return fits && d == Math.rint(d) ? (int) d : null;
        }
        if (value instanceof String s && DIGITS.matcher(s.trim()).matches()) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /// Converts a list of numbers or numeric strings into positions, dropping entries that
    /// are not integral. Non-list input yields an empty list.
    public static List<Integer> toPositions(Object value) {
        List<Object> list = asList(value);
        if (list == null) {
            return List.of();
        }
        List<Integer> positions = new ArrayList<>(list.size());
        for (Object entry : list) {
            Integer position = toInteger(entry);
            if (position != null) {
                positions.add(position);
            }
        }
        return positions;
    }

    /// Whether every entry of the value is an integral number or numeric string.
    public static boolean isPositionList(Object value) {
        List<Object> list = asList(value);
        return list != null && list.stream().allMatch(v -> toInteger(v) != null);
    }

    public static boolean isBlank(Object value) {
        return value == null || (value instanceof String s && s.isBlank());
    }

    /// Reads a boolean flag that may be a {@link Boolean} or a `"true"`/`"false"` string.
    public static boolean isTrue(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        return value instanceof String s && "true".equalsIgnoreCase(s.trim());
    }

    /// Renders a value for template substitution: strings verbatim, containers as JSON.
    public static String stringify(Object value) {
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            StringBuilder sb = new StringBuilder();
            writeJson(sb, value);
            return sb.toString();
        }
        return String.valueOf(value);
    }

    private static void writeJson(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof String s) {
            sb.append('"').append(escape(s)).append('"');
        } else if (value instanceof Number || value instanceof Boolean) {
            sb.append(value);
        } else if (value instanceof Map<?, ?> map) {
            sb.append('{');
            boolean first = true;
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                sb.append('"').append(escape(String.valueOf(entry.getKey()))).append("\":");
                writeJson(sb, entry.getValue());
            }
            sb.append('}');
        } else if (value instanceof List<?> list) {
            sb.append('[');
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                writeJson(sb, list.get(i));
            }
            sb.append(']');
        } else {
            sb.append('"').append(escape(value.toString())).append('"');
        }
    }

    private static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.toString();
    }
}
