package io.opgraph.core.state;

import io.opgraph.core.util.Values;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/// Dotted path with optional bracket indices: `items[0].name` is read as `items.0.name`.
public final class VariablePath {

    private static final Pattern BRACKET = Pattern.compile("\\[([^\\]]*)]");
    private static final Pattern INDEX = Pattern.compile("\\d+");
    private static final Object MISSING = new Object();

    private VariablePath() {}

    /// Splits a path into segments, dropping empty ones.
    ///
    /// @param path raw path, may be null
    /// @return segments, empty for a null or blank path
    public static List<String> parse(String path) {
        if (path == null || path.isBlank()) {
            return List.of();
        }
        String normalized = BRACKET.matcher(path.trim()).replaceAll(".$1");
        List<String> segments = new ArrayList<>();
        Arrays.stream(normalized.split("\\."))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(segments::add);
        return segments;
    }

    public static boolean isIndex(String segment) {
        return INDEX.matcher(segment).matches();
    }

    /// Reads a list index segment.
    ///
    /// @return the index, or -1 when the segment is not an index or does not fit in an int
    static int indexOf(String segment) {
        if (!isIndex(segment)) {
            return -1;
        }
        try {
            return Integer.parseInt(segment);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /// Walks a value along the given segments.
    ///
    /// @return the value found, or empty when any step is missing or the value is null
    public static Optional<Object> navigate(Object root, List<String> segments) {
        Object found = walk(root, segments);
        return found == MISSING ? Optional.empty() : Optional.ofNullable(found);
    }

    /// Whether the path exists, even if it holds null.
    public static boolean exists(Object root, List<String> segments) {
        return walk(root, segments) != MISSING;
    }

    private static Object walk(Object root, List<String> segments) {
        Object current = root;
        for (String segment : segments) {
            current = child(current, segment);
            if (current == MISSING) {
                return MISSING;
            }
        }
        return current;
    }

    private static Object child(Object container, String segment) {
        if (container instanceof Map<?, ?> map) {
            return map.containsKey(segment) ? map.get(segment) : MISSING;
        }
        if (container instanceof List<?> list) {
            int index = indexOf(segment);
            return index >= 0 && index < list.size() ? list.get(index) : MISSING;
        }
        return MISSING;
    }

    /// Writes a value into a mutable tree, creating intermediate containers: a list when the
    /// following segment is an index, otherwise a map. Scalars in the way are replaced.
    /// A list index may replace an element or append at `size()`, never leave a gap.
    ///
    /// @return false when a list is addressed with a non-index segment or past its end
    public static boolean write(Map<String, Object> root, List<String> segments, Object value) {
        Object container = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            String segment = segments.get(i);
            Object next = child(container, segment);
            if (!(next instanceof Map<?, ?>) && !(next instanceof List<?>)) {
                next = isIndex(segments.get(i + 1)) ? new ArrayList<>() : new LinkedHashMap<>();
                if (!put(container, segment, next)) {
                    return false;
                }
            }
            container = next;
        }
        return put(container, segments.get(segments.size() - 1), value);
    }

    /// Removes the value at the path. List elements are removed, shifting later ones.
    ///
    /// @return true if something was removed
    public static boolean remove(Map<String, Object> root, List<String> segments) {
        Object parent = walk(root, segments.subList(0, segments.size() - 1));
        String last = segments.get(segments.size() - 1);
        if (parent instanceof Map<?, ?> map && map.containsKey(last)) {
            Values.asMap(map).remove(last);
            return true;
        }
        if (parent instanceof List<?> list) {
            int index = indexOf(last);
            if (index >= 0 && index < list.size()) {
                Values.asList(list).remove(index);
                return true;
            }
        }
        return false;
    }

    private static boolean put(Object container, String segment, Object value) {
        if (container instanceof Map<?, ?> map) {
            Values.asMap(map).put(segment, value);
            return true;
        }
        if (container instanceof List<?> list) {
            List<Object> target = Values.asList(list);
            int index = indexOf(segment);
            if (index < 0 || index > target.size()) {
                return false;
            }
            if (index == target.size()) {
                target.add(value);
            } else {
                target.set(index, value);
            }
            return true;
        }
        return false;
    }
}
