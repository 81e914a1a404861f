package io.opgraph.core.edit;

import static io.opgraph.core.workflow.node.NodeParams.BODY;
import static io.opgraph.core.workflow.node.NodeParams.PARENT_POSITION;
import static io.opgraph.core.workflow.node.NodeParams.PATHS;

import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.util.Values;
import io.opgraph.core.workflow.node.NodeType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Flattens a nested workflow definition into positioned drafts.
///
/// A route entry may nest its branch members under `paths: {name: [entries]}` and an
/// iterate entry its body under `body: [entries]`. Members are laid out in preorder right
/// after their container; the container's params receive the member positions and every
/// member receives `_parent_position`.
///
/// {@snippet :
/// [{"type": "iterate", "alias": "each_mail", "params": {"listVariable": "mails"},
///   "body": [{"type": "action", "alias": "open_mail"}]}]
/// }
public final class SequenceFlattener {

    private SequenceFlattener() {}

    /// @param definition top-level entries, not null
    /// @param firstPosition position given to the first entry
    /// @return drafts with positions assigned, in position order
    public static List<NodeDraft> flatten(List<Map<String, Object>> definition, int firstPosition) {
        List<NodeDraft> drafts = new ArrayList<>();
        int[] next = {firstPosition};
        for (Map<String, Object> entry : definition) {
            flattenEntry(entry, null, drafts, next);
        }
        return drafts;
    }

    private static int flattenEntry(
            Map<String, Object> entry, Integer parent, List<NodeDraft> drafts, int[] next) {
        if (entry == null) {
            throw new ValidationException("sequence", "entries must be objects");
        }
        NodeDraft draft = NodeDraft.fromMap(entry);
        int position = next[0]++;
        int slot = drafts.size();
        drafts.add(null);

        if (draft.params() instanceof List<?>) {
            drafts.set(slot, draft.withPosition(position));
            return position;
        }
        Map<String, Object> params = Values.mutableMap(draft.params());
        if (parent != null && !draft.type().isContainer()) {
            params.put(PARENT_POSITION, parent);
        }

        Map<String, Object> nestedPaths = Values.asMap(entry.get(PATHS));
        if (draft.type() == NodeType.ROUTE && nestedPaths != null) {
            Map<String, Object> paths = new LinkedHashMap<>();
            nestedPaths.forEach(
                    (name, members) ->
                            paths.put(name, flattenMembers(members, position, drafts, next)));
            params.put(PATHS, paths);
        }
        Object nestedBody = entry.get(BODY);
        if (draft.type() == NodeType.ITERATE && nestedBody instanceof List<?> list
                && !Values.isPositionList(list)) {
            params.put(BODY, flattenMembers(nestedBody, position, drafts, next));
        }

        drafts.set(slot, draft.withParams(params).withPosition(position));
        return position;
    }

    @SuppressWarnings("unchecked")
    private static List<Integer> flattenMembers(
            Object members, int parent, List<NodeDraft> drafts, int[] next) {
        List<Object> list = Values.asList(members);
        if (list == null) {
            throw new ValidationException("sequence", "nested members must be a list");
        }
        List<Integer> positions = new ArrayList<>();
        for (Object member : list) {
            if (!(member instanceof Map<?, ?>)) {
                throw new ValidationException("sequence", "nested members must be objects");
            }
            positions.add(flattenEntry((Map<String, Object>) member, parent, drafts, next));
        }
        return positions;
    }
}
