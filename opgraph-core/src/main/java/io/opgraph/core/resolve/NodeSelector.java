package io.opgraph.core.resolve;

import io.opgraph.core.edit.NodeDraft;
import io.opgraph.core.edit.NodeDraftValidator;
import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.state.VariableStore;
import io.opgraph.core.store.NodeSnapshot;
import io.opgraph.core.util.Values;
import io.opgraph.core.workflow.node.Node;
import io.opgraph.core.workflow.node.NodeParams;
import io.opgraph.core.workflow.node.NodeRef;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Turns symbolic node references and selector specs into concrete positions.
///
/// ### Flexible references
/// - `7` or `"7"`: a position, kept even if nothing lives there (reported as dangling later)
/// - `"fetch_inbox"`: an alias
/// - `"open_mail..archive"`: every existing position between two aliases, inclusive
/// - `"3-7"`: every existing position in a numeric range, inclusive
/// - a list of any of the above
///
/// ### Selector keys
/// `by_aliases`, `by_positions`, `by_range`, `by_between_markers`, `by_recent`, `by_query`,
/// `by_group` and `inline_nodes`. Keys combine by union.
///
/// @implNote Holds the snapshot of one resolution call. Not reusable across calls.
final class NodeSelector {

    static final Set<String> SELECTOR_KEYS =
            Set.of(
                    "by_aliases",
                    "by_positions",
                    "by_range",
                    "by_between_markers",
                    "by_recent",
                    "by_query",
                    "by_group",
                    "inline_nodes");

    private static final Pattern ALIAS_RANGE = Pattern.compile("^\\s*([^.\\s]+)\\s*\\.\\.\\s*([^.\\s]+)\\s*$");
    private static final Pattern NUMERIC_RANGE = Pattern.compile("^\\s*(\\d+)\\s*-\\s*(\\d+)\\s*$");
    private static final String GROUP_PREFIX = "group_def_";

    private final NodeSnapshot snapshot;
    private final VariableStore variables;
    private final InlineNodeCreator inlineCreator;
    private final List<Node> created = new ArrayList<>();

    NodeSelector(NodeSnapshot snapshot, VariableStore variables, InlineNodeCreator inlineCreator) {
        this.snapshot = snapshot;
        this.variables = variables;
        this.inlineCreator = inlineCreator;
    }

    /// Nodes created by `inline_nodes` during this call, across all branches.
    List<Node> createdNodes() {
        return created;
    }

    /// Whether a position exists, counting nodes created during this call.
    boolean exists(int position) {
        return snapshot.hasPosition(position)
                || created.stream().anyMatch(n -> n.getPosition() == position);
    }

    Optional<Node> node(int position) {
        Optional<Node> found = snapshot.atPosition(position);
        return found.isPresent()
                ? found
                : created.stream().filter(n -> n.getPosition() == position).findFirst();
    }

    /// Resolves a flexible reference.
    void selectReference(Object reference, Selection selection) {
        if (reference == null) {
            return;
        }
        if (reference instanceof List<?> list) {
            list.forEach(entry -> selectReference(entry, selection));
            return;
        }
        Integer position = Values.toInteger(reference);
        if (position != null) {
            selection.add(position);
            return;
        }
        if (!(reference instanceof String text) || text.isBlank()) {
            throw new ValidationException("reference", "unsupported reference: " + reference);
        }
        Matcher numeric = NUMERIC_RANGE.matcher(text);
        if (numeric.matches()) {
            selectRange(rangeBound(numeric.group(1), text), rangeBound(numeric.group(2), text), true, selection);
            return;
        }
        Matcher aliasRange = ALIAS_RANGE.matcher(text);
        if (aliasRange.matches()) {
            Optional<Node> from = aliasLookup(aliasRange.group(1), selection);
            Optional<Node> to = aliasLookup(aliasRange.group(2), selection);
            if (from.isPresent() && to.isPresent()) {
                selectRange(from.get().getPosition(), to.get().getPosition(), true, selection);
            }
            return;
        }
        if (NodeRef.UUID_PATTERN.matcher(text.trim()).matches()) {
            snapshot.byUuid(text.trim()).ifPresentOrElse(
                    n -> selection.add(n.getPosition()),
                    () -> selection.warn("no node with uuid " + text.trim()));
            return;
        }
        aliasLookup(text.trim(), selection).ifPresent(n -> selection.add(n.getPosition()));
    }

    /// Evaluates a selector spec.
    ///
    /// @throws ValidationException if the spec is not an object or a key is malformed
    void selectSpec(String workflowId, Object spec, int containerPosition, Selection selection) {
        if (spec instanceof List<?> || spec instanceof String || spec instanceof Number) {
            selectReference(spec, selection);
            return;
        }
        Map<String, Object> map = Values.asMap(spec);
        if (map == null) {
            throw new ValidationException("spec", "selector spec must be an object");
        }
        for (String key : map.keySet()) {
            if (!SELECTOR_KEYS.contains(key)) {
                selection.warn("unknown selector key '" + key + "' ignored");
            }
        }

        Object aliases = map.get("by_aliases");
        if (aliases != null) {
            listOf(aliases)
                    .forEach(
                            a ->
                                    aliasLookup(String.valueOf(a), selection)
                                            .ifPresent(n -> selection.add(n.getPosition())));
        }
        Object positions = map.get("by_positions");
        if (positions != null) {
            listOf(positions).forEach(p -> selectReference(p, selection));
        }
        Map<String, Object> range = Values.asMap(map.get("by_range"));
        if (range != null) {
            Integer start = Values.toInteger(range.get("start"));
            Integer end = Values.toInteger(range.get("end"));
            if (start == null || end == null) {
                throw new ValidationException("by_range", "start and end must be integers");
            }
            selectRange(start, end, true, selection);
        }
        Map<String, Object> markers = Values.asMap(map.get("by_between_markers"));
        if (markers != null) {
            Optional<Node> from = aliasLookup(String.valueOf(markers.get("start_alias")), selection);
            Optional<Node> to = aliasLookup(String.valueOf(markers.get("end_alias")), selection);
            if (from.isPresent() && to.isPresent()) {
                selectRange(from.get().getPosition(), to.get().getPosition(), false, selection);
            }
        }
        Map<String, Object> recent = Values.asMap(map.get("by_recent"));
        if (recent != null) {
            selectRecent(recent, selection);
        }
        Map<String, Object> query = Values.asMap(map.get("by_query"));
        if (query != null) {
            snapshot.nodes().stream()
                    .filter(n -> matchesQuery(n, query))
                    .forEach(n -> selection.add(n.getPosition()));
        }
        Object group = map.get("by_group");
        if (group != null) {
            selectGroup(String.valueOf(group), selection);
        }
        Object inline = map.get("inline_nodes");
        if (inline != null) {
            createInline(workflowId, inline, containerPosition, selection);
        }
    }

    private static int rangeBound(String digits, String reference) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new ValidationException(
                    "reference", "position out of range in '" + reference.trim() + "'");
        }
    }

    private static List<Object> listOf(Object value) {
        List<Object> list = Values.asList(value);
        return list != null ? list : List.of(value);
    }

    private Optional<Node> aliasLookup(String alias, Selection selection) {
        Optional<Node> found = snapshot.byAlias(alias);
        if (found.isEmpty()) {
            found = created.stream().filter(n -> alias.equals(n.getAlias())).findFirst();
        }
        if (found.isEmpty()) {
            selection.missingAlias(alias);
        }
        return found;
    }

    private void selectRange(int from, int to, boolean inclusive, Selection selection) {
        int low = Math.min(from, to);
        int high = Math.max(from, to);
        for (Node node : snapshot.nodes()) {
            int p = node.getPosition();
            boolean inside = inclusive ? p >= low && p <= high : p > low && p < high;
            if (inside) {
                selection.add(p);
            }
        }
    }

    private void selectRecent(Map<String, Object> recent, Selection selection) {
        Integer count = Values.toInteger(recent.get("count"));
        if (count == null || count < 0) {
            throw new ValidationException("by_recent.count", "must be a non-negative integer");
        }
        Map<String, Object> filter = Values.asMap(recent.get("filter"));
        snapshot.nodes().stream()
                .filter(n -> filter == null || matchesQuery(n, filter))
                .sorted(
                        Comparator.comparing(Node::getCreatedAt)
                                .thenComparingInt(Node::getPosition)
                                .reversed())
                .limit(count)
                .forEach(n -> selection.add(n.getPosition()));
    }

    private static boolean matchesQuery(Node node, Map<String, Object> query) {
        Object type = query.get("type");
        if (type != null && !node.getType().wireName().equalsIgnoreCase(String.valueOf(type))) {
            return false;
        }
        Object tag = query.get("tag");
        if (tag != null && !hasTag(node, String.valueOf(tag))) {
            return false;
        }
        Object text = query.get("text_match");
        if (text != null) {
            String needle = String.valueOf(text).toLowerCase(Locale.ROOT);
            String haystack =
                    ((node.getDescription() != null ? node.getDescription() : "")
                                    + " "
                                    + (node.getAlias() != null ? node.getAlias() : ""))
                            .toLowerCase(Locale.ROOT);
            return haystack.contains(needle);
        }
        return true;
    }

    private static boolean hasTag(Node node, String tag) {
        Map<String, Object> params = node.getParamsMap();
        Object single = params.get("tag");
        if (single != null && tag.equals(String.valueOf(single))) {
            return true;
        }
        List<Object> tags = Values.asList(params.get("tags"));
        return tags != null && tags.stream().anyMatch(t -> tag.equals(String.valueOf(t)));
    }

    private void selectGroup(String name, Selection selection) {
        if (variables == null) {
            selection.warn("group '" + name + "' cannot be resolved without a variable store");
            return;
        }
        Optional<Object> definition = variables.get(GROUP_PREFIX + name);
        Map<String, Object> group = definition.map(Values::asMap).orElse(null);
        if (group == null) {
            selection.warn("group '" + name + "' is not defined");
            return;
        }
        Object positions = group.get("positions");
        if (positions != null) {
            selectReference(positions, selection);
        }
        Object aliases = group.get("aliases");
        if (aliases != null) {
            listOf(aliases)
                    .forEach(
                            a ->
                                    aliasLookup(String.valueOf(a), selection)
                                            .ifPresent(n -> selection.add(n.getPosition())));
        }
    }

    private void createInline(
            String workflowId, Object inline, int containerPosition, Selection selection) {
        List<Object> drafts = Values.asList(inline);
        if (drafts == null) {
            throw new ValidationException("inline_nodes", "must be a list of node definitions");
        }
        if (inlineCreator == null) {
            selection.warn("inline node creation is not available");
            return;
        }
        for (Object entry : drafts) {
            Map<String, Object> raw = Values.asMap(entry);
            if (raw == null) {
                throw new ValidationException("inline_nodes", "entries must be objects");
            }
            NodeDraft draft = NodeDraft.fromMap(raw);
            if (draft.alias() == null
                    || !NodeDraftValidator.ALIAS_PATTERN.matcher(draft.alias()).matches()) {
                throw new ValidationException(
                        "inline_nodes.alias", "invalid alias '" + draft.alias() + "'");
            }
            Optional<Node> existing = snapshot.byAlias(draft.alias());
            if (existing.isEmpty()) {
                existing = created.stream().filter(n -> draft.alias().equals(n.getAlias())).findFirst();
            }
            if (existing.isPresent()) {
                // created by an earlier resolution of the same spec
                selection.add(existing.get().getPosition());
                continue;
            }
            Map<String, Object> params = Values.mutableMap(draft.params());
            if (!draft.type().isContainer()) {
                params.put(NodeParams.PARENT_POSITION, containerPosition);
            }
            Node node = inlineCreator.create(workflowId, draft.withParams(params).withPosition(null));
            created.add(node);
            selection.created(node);
        }
    }
}
