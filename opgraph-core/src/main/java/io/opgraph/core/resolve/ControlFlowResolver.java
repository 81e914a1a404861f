package io.opgraph.core.resolve;

import static io.opgraph.core.workflow.node.NodeParams.BODY_POSITIONS;
import static io.opgraph.core.workflow.node.NodeParams.BODY_SPEC;
import static io.opgraph.core.workflow.node.NodeParams.BRANCH_CONDITION;
import static io.opgraph.core.workflow.node.NodeParams.BRANCH_NAME;
import static io.opgraph.core.workflow.node.NodeParams.BRANCH_SPEC;
import static io.opgraph.core.workflow.node.NodeParams.PARENT_POSITION;
import static io.opgraph.core.workflow.node.NodeParams.PATHS;
import static io.opgraph.core.workflow.node.NodeParams.PATHS_SPEC;

import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.state.VariableStore;
import io.opgraph.core.state.VariableStoreRegistry;
import io.opgraph.core.store.NodePatch;
import io.opgraph.core.store.NodeSnapshot;
import io.opgraph.core.store.NodeStore;
import io.opgraph.core.tree.DanglingReference;
import io.opgraph.core.tree.LinkKind;
import io.opgraph.core.util.Values;
import io.opgraph.core.workflow.node.Node;
import io.opgraph.core.workflow.node.NodeRef;
import io.opgraph.core.workflow.node.NodeType;
import io.opgraph.core.workflow.params.Branch;
import io.opgraph.core.workflow.params.HandleParams;
import io.opgraph.core.workflow.params.IterateParams;
import io.opgraph.core.workflow.params.RouteParams;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Resolves symbolic route branches and iterate bodies into concrete positions and
/// persists them.
///
/// ### Per-branch precedence
/// selector spec (`branch_spec`, `paths_spec.<name>`, `body_spec`) over a flexible
/// reference (`branch`, legacy `paths.<name>`, `body`) over stored positions
/// (`branch_positions`, `body_positions`). Stored positions pass through unchanged.
///
/// ### Write-back
/// - resolved lists go back in the node's own shape; params are written only when they
///   differ from what is stored
/// - each resolved child gets `_parent_position` unless it is a group, already carries the
///   right value, or is claimed by another container (reported as a conflict)
///
/// ### Failure isolation
/// A branch whose spec is malformed is reported in its {@link BranchResolution} and left as
/// stored; the other branches still resolve. Invalid iterate settings reject the whole call.
///
/// @implNote Stateless; callers serialize structural edits per workflow.
public class ControlFlowResolver {

    private static final Logger logger = Logger.getLogger(ControlFlowResolver.class.getName());

    private final NodeStore store;
    private final VariableStoreRegistry variables;
    private final InlineNodeCreator inlineCreator;
    private final Clock clock;

    /// @param store node persistence, not null
    /// @param variables per-workflow variable stores for `by_group`, may be null
    /// @param inlineCreator creator for `inline_nodes`, may be null to disable them
    /// @param clock report timestamps, not null
    public ControlFlowResolver(
            NodeStore store,
            VariableStoreRegistry variables,
            InlineNodeCreator inlineCreator,
            Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.variables = variables;
        this.inlineCreator = inlineCreator;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Resolves every branch of a route node.
    ///
    /// @param workflowId workflow identifier, not null
    /// @param ref the route node, not null
    /// @return what was resolved and written, never null
    /// @throws io.opgraph.core.exception.NodeNotFoundException if the reference does not resolve
    /// @throws ValidationException if the node is not a route or its params have no usable shape
    public ResolutionReport resolveRoute(String workflowId, NodeRef ref) {
        NodeSnapshot snapshot = NodeSnapshot.of(store, workflowId);
        Node route = requireType(snapshot.get(ref), NodeType.ROUTE);
        RouteParams params = RouteParams.of(route.getParams());

        Accumulator acc = new Accumulator(snapshot, selectorFor(snapshot, workflowId));
        Map<Integer, List<Integer>> resolved = new LinkedHashMap<>();
        for (Branch branch : params.branches()) {
            try {
                Selection selection = new Selection();
                if (branch.spec() != null) {
                    acc.selector.selectSpec(workflowId, branch.spec(), route.getPosition(), selection);
                } else if (branch.symbolic() != null) {
                    acc.selector.selectReference(branch.symbolic(), selection);
                } else {
                    branch.positions().forEach(selection::add);
                }
                List<Integer> positions =
                        branch.isSymbolic()
                                ? selection.positions()
                                : new ArrayList<>(branch.positions());
                positions = acc.dropDangling(route, LinkKind.ROUTE_BRANCH, branch.name(), positions);
                acc.absorb(selection);
                resolved.put(branch.index(), positions);
                acc.branches.add(new BranchResolution(branch.index(), branch.name(), positions, null));
            } catch (ValidationException e) {
                logger.warning(
                        "Branch '"
                                + branch.name()
                                + "' of route "
                                + route.getPosition()
                                + " in workflow "
                                + workflowId
                                + " not resolved: "
                                + e.getMessage());
                acc.branches.add(
                        new BranchResolution(
                                branch.index(), branch.name(), branch.positions(), e.getMessage()));
            }
        }

        Object newParams = params.withPositions(resolved);
        boolean changed = writeParamsIfChanged(workflowId, route, newParams);
        Set<Integer> children = new LinkedHashSet<>();
        resolved.values().forEach(children::addAll);
        tagChildren(workflowId, route, children, acc);
        return acc.report(workflowId, route, changed);
    }

    /// Resolves the body of an iterate node.
    ///
    /// @throws ValidationException if the node is not an iterate node or its settings are
    ///     invalid (non-positive `maxIterations`, blank variable names, malformed `body`)
    public ResolutionReport resolveIterate(String workflowId, NodeRef ref) {
        NodeSnapshot snapshot = NodeSnapshot.of(store, workflowId);
        Node iterate = requireType(snapshot.get(ref), NodeType.ITERATE);
        IterateParams params = IterateParams.of(iterate.getParams());
        params.requireValid();

        Accumulator acc = new Accumulator(snapshot, selectorFor(snapshot, workflowId));
        Selection selection = new Selection();
        List<Integer> positions;
        switch (params.bodyKind()) {
            case SPEC -> {
                acc.selector.selectSpec(
                        workflowId, params.bodySpec(), iterate.getPosition(), selection);
                positions = selection.positions();
            }
            case SYMBOLIC -> {
                acc.selector.selectReference(params.body(), selection);
                positions = selection.positions();
            }
            case RANGE -> positions =
                    IterateParams.rangePositions(params.body(), snapshot.positions());
            case POSITIONS -> positions =
                    Values.toInteger(params.body()) != null
                            ? List.of(Values.toInteger(params.body()))
                            : Values.toPositions(params.body());
            case RESOLVED -> positions = params.bodyPositions(snapshot.positions());
            default -> {
                selection.warn("iterate node declares no body");
                positions = List.of();
            }
        }
        positions = acc.dropDangling(iterate, LinkKind.ITERATE_BODY, null, positions);
        acc.absorb(selection);
        acc.branches.add(new BranchResolution(0, "body", positions, null));

        Map<String, Object> newParams = Values.mutableMap(iterate.getParams());
        newParams.put(BODY_POSITIONS, new ArrayList<>(positions));
        boolean changed = writeParamsIfChanged(workflowId, iterate, newParams);
        tagChildren(workflowId, iterate, new LinkedHashSet<>(positions), acc);
        return acc.report(workflowId, iterate, changed);
    }

    /// Patches the selector specs of a route, then resolves it.
    ///
    /// @param pathsSpec branch name to selector spec, not null
    /// @throws ValidationException if `REPLACE` names an unknown branch or `ADD` an existing one
    public ResolutionReport applyRouteSpec(
            String workflowId, NodeRef ref, SpecOperation operation, Map<String, Object> pathsSpec) {
        Objects.requireNonNull(pathsSpec, "pathsSpec must not be null");
        Node route = requireType(store.get(workflowId, ref), NodeType.ROUTE);
        RouteParams params = RouteParams.of(route.getParams());
        Set<String> existing = new LinkedHashSet<>();
        params.branches().forEach(b -> existing.add(b.name()));

        Object patched;
        if (params instanceof RouteParams.BranchArray array) {
            patched = patchBranchArray(array, existing, operation, pathsSpec);
        } else {
            patched = patchLegacyPaths((RouteParams.LegacyPaths) params, existing, operation, pathsSpec);
        }
        store.update(workflowId, route.getUuid(), NodePatch.params(patched));
        return resolveRoute(workflowId, NodeRef.uuid(route.getUuid()));
    }

    private static Object patchBranchArray(
            RouteParams.BranchArray array,
            Set<String> existing,
            SpecOperation operation,
            Map<String, Object> pathsSpec) {
        List<Object> branches = Values.asList(Values.deepCopy(array.raw()));
        List<Branch> declared = array.branches();
        switch (operation) {
            case REPLACE -> {
                requireKnown(existing, pathsSpec.keySet());
                for (Branch branch : declared) {
                    if (pathsSpec.containsKey(branch.name())) {
                        Values.asMap(branches.get(branch.index()))
                                .put(BRANCH_SPEC, Values.deepCopy(pathsSpec.get(branch.name())));
                    }
                }
            }
            case ADD -> {
                requireUnknown(existing, pathsSpec.keySet());
                pathsSpec.forEach(
                        (name, spec) -> {
                            Map<String, Object> branch = new LinkedHashMap<>();
                            branch.put(BRANCH_NAME, name);
                            branch.put(BRANCH_CONDITION, "true");
                            branch.put(BRANCH_SPEC, Values.deepCopy(spec));
                            branches.add(branch);
                        });
            }
            case REMOVE -> {
                requireKnown(existing, pathsSpec.keySet());
                Set<Integer> drop = new LinkedHashSet<>();
                declared.stream()
                        .filter(b -> pathsSpec.containsKey(b.name()))
                        .forEach(b -> drop.add(b.index()));
                List<Object> kept = new ArrayList<>();
                for (int i = 0; i < branches.size(); i++) {
                    if (!drop.contains(i)) {
                        kept.add(branches.get(i));
                    }
                }
                return kept;
            }
        }
        return branches;
    }

    private static Object patchLegacyPaths(
            RouteParams.LegacyPaths legacy,
            Set<String> existing,
            SpecOperation operation,
            Map<String, Object> pathsSpec) {
        Map<String, Object> params = Values.mutableMap(legacy.raw());
        Map<String, Object> specs = Values.mutableMap(params.get(PATHS_SPEC));
        switch (operation) {
            case REPLACE -> {
                requireKnown(existing, pathsSpec.keySet());
                specs.putAll(Values.mutableMap(pathsSpec));
            }
            case ADD -> {
                requireUnknown(existing, pathsSpec.keySet());
                specs.putAll(Values.mutableMap(pathsSpec));
            }
            case REMOVE -> {
                requireKnown(existing, pathsSpec.keySet());
                Map<String, Object> paths = Values.mutableMap(params.get(PATHS));
                pathsSpec.keySet().forEach(specs::remove);
                pathsSpec.keySet().forEach(paths::remove);
                params.put(PATHS, paths);
            }
        }
        params.put(PATHS_SPEC, specs);
        return params;
    }

    private static void requireKnown(Set<String> existing, Set<String> names) {
        for (String name : names) {
            if (!existing.contains(name)) {
                throw new ValidationException("paths_spec", "unknown branch '" + name + "'");
            }
        }
    }

    private static void requireUnknown(Set<String> existing, Set<String> names) {
        for (String name : names) {
            if (existing.contains(name)) {
                throw new ValidationException("paths_spec", "branch '" + name + "' already exists");
            }
        }
    }

    /// Patches the body selector of an iterate node, then resolves it.
    ///
    /// `ADD` unions list-valued selector keys and overwrites the others.
    public ResolutionReport applyIterateSpec(
            String workflowId, NodeRef ref, SpecOperation operation, Object bodySpec) {
        Node iterate = requireType(store.get(workflowId, ref), NodeType.ITERATE);
        Map<String, Object> params = Values.mutableMap(iterate.getParams());
        switch (operation) {
            case REPLACE -> params.put(BODY_SPEC, Values.deepCopy(bodySpec));
            case ADD -> params.put(BODY_SPEC, unionSpecs(params.get(BODY_SPEC), bodySpec));
            case REMOVE -> params.remove(BODY_SPEC);
        }
        store.update(workflowId, iterate.getUuid(), NodePatch.params(params));
        return resolveIterate(workflowId, NodeRef.uuid(iterate.getUuid()));
    }

    private static Object unionSpecs(Object current, Object addition) {
        Map<String, Object> base = Values.asMap(current);
        Map<String, Object> extra = Values.asMap(addition);
        if (base == null || extra == null) {
            return Values.deepCopy(addition);
        }
        Map<String, Object> merged = Values.mutableMap(base);
        extra.forEach(
                (key, value) -> {
                    List<Object> existing = Values.asList(merged.get(key));
                    List<Object> more = Values.asList(value);
                    if (existing != null && more != null) {
                        List<Object> union = new ArrayList<>(existing);
                        more.stream().filter(v -> !union.contains(v)).forEach(union::add);
                        merged.put(key, union);
                    } else {
                        merged.put(key, Values.deepCopy(value));
                    }
                });
        return merged;
    }

    private NodeSelector selectorFor(NodeSnapshot snapshot, String workflowId) {
        VariableStore variableStore = variables != null ? variables.forWorkflow(workflowId) : null;
        return new NodeSelector(snapshot, variableStore, inlineCreator);
    }

    private static Node requireType(Node node, NodeType expected) {
        if (node.getType() != expected) {
            throw new ValidationException(
                    "type",
                    "node at position "
                            + node.getPosition()
                            + " is a "
                            + node.getType().wireName()
                            + ", not a "
                            + expected.wireName());
        }
        return node;
    }

    private boolean writeParamsIfChanged(String workflowId, Node node, Object newParams) {
        if (Values.freeze(newParams).equals(node.getParams())) {
            return false;
        }
        store.update(workflowId, node.getUuid(), NodePatch.params(newParams));
        return true;
    }

    private void tagChildren(String workflowId, Node container, Set<Integer> children, Accumulator acc) {
        for (Integer position : children) {
            Optional<Node> found = acc.selector.node(position);
            if (found.isEmpty()) {
                continue;
            }
            Node child = found.get();
            if (child.getType().isContainer() || child.getPosition() == container.getPosition()) {
                continue;
            }
            Optional<Integer> current = child.getParentPosition();
            if (current.isPresent() && current.get() == container.getPosition()) {
                continue;
            }
            if (current.isPresent() && claimsMember(acc.snapshot, current.get(), position)) {
                acc.conflicts.add(
                        "node "
                                + position
                                + " is already a member of container "
                                + current.get()
                                + "; not re-parented to "
                                + container.getPosition());
                continue;
            }
            Map<String, Object> params = Values.asMap(Values.deepCopy(child.getParams()));
            if (params == null) {
                acc.warnings.add(
                        "node " + position + " stores params as a list and cannot carry a parent tag");
                continue;
            }
            params.put(PARENT_POSITION, container.getPosition());
            store.update(workflowId, child.getUuid(), NodePatch.params(params));
            acc.tagged.add(position);
        }
    }

    /// Whether another container lists the child among its concrete members.
    private static boolean claimsMember(NodeSnapshot snapshot, int containerPosition, int child) {
        Optional<Node> other = snapshot.atPosition(containerPosition);
        if (other.isEmpty()) {
            return false;
        }
        Node node = other.get();
        return switch (node.getType()) {
            case ROUTE -> {
                try {
                    yield RouteParams.of(node.getParams()).allPositions().contains(child);
                } catch (ValidationException e) {
                    yield false;
                }
            }
            case ITERATE -> IterateParams.of(node.getParams())
                    .bodyPositions(snapshot.positions())
                    .contains(child);
            case HANDLE -> HandleParams.sections(node.getParams()).values().stream()
                    .anyMatch(p -> p.contains(child));
            default -> false;
        };
    }

    /// Collects report contents across branches of one call.
    private final class Accumulator {
        private final NodeSnapshot snapshot;
        private final NodeSelector selector;
        private final List<BranchResolution> branches = new ArrayList<>();
        private final List<DanglingReference> dangling = new ArrayList<>();
        private final Set<String> missingAliases = new LinkedHashSet<>();
        private final List<Integer> tagged = new ArrayList<>();
        private final List<String> conflicts = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();

        private Accumulator(NodeSnapshot snapshot, NodeSelector selector) {
            this.snapshot = snapshot;
            this.selector = selector;
        }

        private List<Integer> dropDangling(
                Node source, LinkKind kind, String branch, List<Integer> positions) {
            List<Integer> kept = new ArrayList<>(positions.size());
            for (Integer position : positions) {
                if (position == source.getPosition()) {
                    warnings.add(
                            "node "
                                    + position
                                    + " cannot contain itself"
                                    + (branch != null ? " (branch '" + branch + "')" : ""));
                } else if (selector.exists(position)) {
                    kept.add(position);
                } else {
                    DanglingReference reference =
                            new DanglingReference(
                                    source.getPosition(), source.getAlias(), kind, branch, position);
                    logger.warning("Dropping dangling reference: " + reference.describe());
                    dangling.add(reference);
                }
            }
            return kept;
        }

        private void absorb(Selection selection) {
            missingAliases.addAll(selection.missingAliases());
            warnings.addAll(selection.warnings());
        }

        private ResolutionReport report(String workflowId, Node node, boolean changed) {
            List<Integer> created = new ArrayList<>();
            selector.createdNodes().forEach(n -> created.add(n.getPosition()));
            logger.info(
                    "Resolved "
                            + node.getType().wireName()
                            + " node "
                            + node.getPosition()
                            + " in workflow "
                            + workflowId
                            + ": "
                            + branches.size()
                            + " branch(es), "
                            + tagged.size()
                            + " child tag(s) written, "
                            + dangling.size()
                            + " dangling");
            return new ResolutionReport(
                    workflowId,
                    node.getPosition(),
                    node.getAlias(),
                    branches,
                    dangling,
                    new ArrayList<>(missingAliases),
                    created,
                    tagged,
                    conflicts,
                    warnings,
                    changed,
                    clock.instant());
        }
    }
}
