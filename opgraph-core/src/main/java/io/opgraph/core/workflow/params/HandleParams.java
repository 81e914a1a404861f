package io.opgraph.core.workflow.params;

import static io.opgraph.core.workflow.node.NodeParams.CATCH;
import static io.opgraph.core.workflow.node.NodeParams.FINALLY;
import static io.opgraph.core.workflow.node.NodeParams.TRY;

import io.opgraph.core.util.Values;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Sections of a `handle` node: `try`, `catch` and `finally` position lists.
public final class HandleParams {

    public static final List<String> SECTIONS = List.of(TRY, CATCH, FINALLY);

    private HandleParams() {}

    /// Returns the section positions in `try`, `catch`, `finally` order, omitting absent
    /// sections.
    public static Map<String, List<Integer>> sections(Object params) {
        Map<String, Object> map = Values.asMap(params);
        Map<String, List<Integer>> sections = new LinkedHashMap<>();
        if (map == null) {
            return sections;
        }
        for (String section : SECTIONS) {
            Object value = map.get(section);
            Integer single = Values.toInteger(value);
            if (single != null) {
                sections.put(section, List.of(single));
            } else if (value instanceof List<?>) {
                sections.put(section, Values.toPositions(value));
            }
        }
        return sections;
    }
}
