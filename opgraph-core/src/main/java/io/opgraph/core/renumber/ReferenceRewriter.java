package io.opgraph.core.renumber;

import static io.opgraph.core.workflow.node.NodeParams.BODY;
import static io.opgraph.core.workflow.node.NodeParams.BODY_POSITIONS;
import static io.opgraph.core.workflow.node.NodeParams.BRANCH;
import static io.opgraph.core.workflow.node.NodeParams.BRANCH_POSITIONS;
import static io.opgraph.core.workflow.node.NodeParams.PARENT_POSITION;
import static io.opgraph.core.workflow.node.NodeParams.PATHS;

import io.opgraph.core.util.Values;
import io.opgraph.core.workflow.node.Node;
import io.opgraph.core.workflow.params.HandleParams;
import io.opgraph.core.workflow.params.IterateParams;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.IntFunction;

/// Rewrites the positions a node's params point at.
///
/// Covers route `branch_positions`, numeric `branch` lists and legacy `paths`; iterate
/// `body_positions` and `body` (list, single number or `{start,end}` range); handle
/// `try`/`catch`/`finally`; and `_parent_position` on any node.
///
/// The mapper returns the new position for an old one, or null to drop the reference.
/// A range only covers the existing positions inside it; once those no longer map onto
/// themselves the range is replaced by the explicit list of mapped positions.
public final class ReferenceRewriter {

    private ReferenceRewriter() {}

    /// Computes rewritten params for a node.
    ///
    /// @param node node whose references are rewritten, not null
    /// @param mapper old position to new position, or null to drop, not null
    /// @param existing positions in use before the change, not null
    /// @return new params if anything changed, empty otherwise
    public static Optional<Object> rewrite(
            Node node, IntFunction<Integer> mapper, Collection<Integer> existing) {
        Object original = node.getParams();
        Object params = Values.deepCopy(original);

        switch (node.getType()) {
            case ROUTE -> rewriteRoute(params, mapper);
            case ITERATE -> rewriteIterate(Values.asMap(params), mapper, existing);
            case HANDLE -> rewriteHandle(Values.asMap(params), mapper);
            default -> {
                // only the parent link below
            }
        }

        Map<String, Object> map = Values.asMap(params);
        if (map != null && map.containsKey(PARENT_POSITION)) {
            Integer parent = Values.toInteger(map.get(PARENT_POSITION));
            if (parent != null) {
                Integer mapped = mapper.apply(parent);
                if (mapped == null) {
                    map.remove(PARENT_POSITION);
                } else {
                    map.put(PARENT_POSITION, mapped);
                }
            }
        }

        return params.equals(original) ? Optional.empty() : Optional.of(params);
    }

    private static void rewriteRoute(Object params, IntFunction<Integer> mapper) {
        List<Object> branches = Values.asList(params);
        if (branches != null) {
            for (Object entry : branches) {
                Map<String, Object> branch = Values.asMap(entry);
                if (branch == null) {
                    continue;
                }
                rewriteListEntry(branch, BRANCH_POSITIONS, mapper);
                if (Values.isPositionList(branch.get(BRANCH))) {
                    rewriteListEntry(branch, BRANCH, mapper);
                }
            }
            return;
        }
        Map<String, Object> map = Values.asMap(params);
        Map<String, Object> paths = map != null ? Values.asMap(map.get(PATHS)) : null;
        if (paths == null) {
            return;
        }
        for (Map.Entry<String, Object> entry : paths.entrySet()) {
            Object value = entry.getValue();
            Integer single = Values.toInteger(value);
            if (single != null) {
                Integer mapped = mapper.apply(single);
                entry.setValue(mapped != null ? List.of(mapped) : new ArrayList<>());
            } else if (Values.isPositionList(value)) {
                entry.setValue(mapAll(value, mapper));
            }
        }
    }

    private static void rewriteIterate(
            Map<String, Object> params, IntFunction<Integer> mapper, Collection<Integer> existing) {
        if (params == null) {
            return;
        }
        rewriteListEntry(params, BODY_POSITIONS, mapper);
        Object body = params.get(BODY);
        Integer single = Values.toInteger(body);
        if (single != null) {
            Integer mapped = mapper.apply(single);
            if (mapped == null) {
                params.put(BODY, new ArrayList<>());
            } else if (!mapped.equals(single)) {
                params.put(BODY, mapped);
            }
        } else if (Values.isPositionList(body)) {
            params.put(BODY, mapAll(body, mapper));
        } else if (body instanceof Map<?, ?>) {
            List<Integer> range = IterateParams.rangeMembers(body, existing);
            List<Integer> mapped = mapAll(range, mapper);
            if (!mapped.equals(range)) {
                params.put(BODY, mapped);
            }
        }
    }

    private static void rewriteHandle(Map<String, Object> params, IntFunction<Integer> mapper) {
        if (params == null) {
            return;
        }
        for (String section : HandleParams.SECTIONS) {
            Object value = params.get(section);
            Integer single = Values.toInteger(value);
            if (single != null) {
                Integer mapped = mapper.apply(single);
                params.put(section, mapped != null ? List.of(mapped) : new ArrayList<>());
            } else if (value instanceof List<?>) {
                params.put(section, mapAll(value, mapper));
            }
        }
    }

    private static void rewriteListEntry(
            Map<String, Object> map, String key, IntFunction<Integer> mapper) {
        if (map.get(key) instanceof List<?> list) {
            map.put(key, mapAll(list, mapper));
        }
    }

    private static List<Integer> mapAll(Object positions, IntFunction<Integer> mapper) {
        List<Integer> mapped = new ArrayList<>();
        for (Integer position : Values.toPositions(positions)) {
            Integer target = mapper.apply(position);
            if (target != null) {
                mapped.add(target);
            }
        }
        return mapped;
    }
}
