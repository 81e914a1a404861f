package io.opgraph.core.workflow.params;

import static io.opgraph.core.workflow.node.NodeParams.BRANCH;
import static io.opgraph.core.workflow.node.NodeParams.BRANCH_CONDITION;
import static io.opgraph.core.workflow.node.NodeParams.BRANCH_NAME;
import static io.opgraph.core.workflow.node.NodeParams.BRANCH_POSITIONS;
import static io.opgraph.core.workflow.node.NodeParams.BRANCH_SPEC;
import static io.opgraph.core.workflow.node.NodeParams.PATHS;
import static io.opgraph.core.workflow.node.NodeParams.PATHS_SPEC;

import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.util.Values;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Route params in one of their two stored shapes.
///
/// - {@link BranchArray}: params is a list of branch descriptors
///   `{name, condition, branch_positions | branch | branch_spec}`
/// - {@link LegacyPaths}: params is an object `{paths: {name: positions}, paths_spec: {...}}`
///
/// Both normalize to a list of {@link Branch}es. Write-back goes through
/// {@link #withPositions(Map)}, which keeps the original shape.
public sealed interface RouteParams {

    /// Returns the branches in declaration order.
    List<Branch> branches();

    /// Returns a new raw params value with resolved positions stored per branch index, in
    /// the same shape this instance was read from. Branches absent from the map are left
    /// untouched.
    ///
    /// @param positionsByIndex branch index to resolved positions, not null
    /// @return new raw params, never null
    Object withPositions(Map<Integer, List<Integer>> positionsByIndex);

    /// Reads route params, dispatching on the stored shape.
    ///
    /// @param raw node params, may be null
    /// @return typed view, never null
    /// @throws ValidationException if params are neither a list nor an object
    static RouteParams of(Object raw) {
        if (raw == null) {
            return new LegacyPaths(Map.of());
        }
        if (raw instanceof List<?> list) {
            return new BranchArray(Values.asList(list));
        }
        if (raw instanceof Map<?, ?>) {
            return new LegacyPaths(Values.asMap(raw));
        }
        throw new ValidationException("params", "route params must be an array or an object");
    }

    /// Collects every concrete position referenced by any branch, in declaration order.
    default List<Integer> allPositions() {
        Set<Integer> positions = new LinkedHashSet<>();
        branches().forEach(b -> positions.addAll(b.positions()));
        return new ArrayList<>(positions);
    }

    /// Array-of-branches shape.
    record BranchArray(List<Object> raw) implements RouteParams {

        public BranchArray {
            Objects.requireNonNull(raw, "raw must not be null");
        }

        @Override
        public List<Branch> branches() {
            List<Branch> branches = new ArrayList<>();
            for (int i = 0; i < raw.size(); i++) {
                Map<String, Object> descriptor = Values.asMap(raw.get(i));
                if (descriptor == null) {
                    continue;
                }
                Object name = descriptor.get(BRANCH_NAME);
                Object condition = descriptor.get(BRANCH_CONDITION);
                Object branch = descriptor.get(BRANCH);
                Object stored = descriptor.get(BRANCH_POSITIONS);

                List<Integer> positions;
                if (stored instanceof List<?>) {
                    positions = Values.toPositions(stored);
                } else if (Values.isPositionList(branch)) {
                    positions = Values.toPositions(branch);
                } else {
                    positions = List.of();
                }
                Object symbolic =
                        branch != null && !Values.isPositionList(branch) ? branch : null;

                branches.add(
                        new Branch(
                                i,
                                name instanceof String s && !s.isBlank()
                                        ? s
                                        : "branch_" + (i + 1),
                                condition != null ? String.valueOf(condition) : null,
                                positions,
                                symbolic,
                                descriptor.get(BRANCH_SPEC)));
            }
            return branches;
        }

        @Override
        public Object withPositions(Map<Integer, List<Integer>> positionsByIndex) {
            List<Object> copy = new ArrayList<>(raw.size());
            for (int i = 0; i < raw.size(); i++) {
                Object entry = Values.deepCopy(raw.get(i));
                List<Integer> resolved = positionsByIndex.get(i);
                if (resolved != null && entry instanceof Map<?, ?>) {
                    Values.asMap(entry).put(BRANCH_POSITIONS, new ArrayList<>(resolved));
                }
                copy.add(entry);
            }
            return copy;
        }
    }

    /// Legacy object shape with a `paths` map.
    record LegacyPaths(Map<String, Object> raw) implements RouteParams {

        public LegacyPaths {
            Objects.requireNonNull(raw, "raw must not be null");
        }

        /// Branch names in declaration order: `paths` keys first, then `paths_spec` keys not
        /// already present.
        private List<String> names() {
            Set<String> names = new LinkedHashSet<>();
            Map<String, Object> paths = Values.asMap(raw.get(PATHS));
            if (paths != null) {
                names.addAll(paths.keySet());
            }
            Map<String, Object> specs = Values.asMap(raw.get(PATHS_SPEC));
            if (specs != null) {
                names.addAll(specs.keySet());
            }
            return new ArrayList<>(names);
        }

        @Override
        public List<Branch> branches() {
            Map<String, Object> paths = Values.asMap(raw.get(PATHS));
            Map<String, Object> specs = Values.asMap(raw.get(PATHS_SPEC));
            List<String> names = names();
            List<Branch> branches = new ArrayList<>(names.size());
            for (int i = 0; i < names.size(); i++) {
                String name = names.get(i);
                Object value = paths != null ? paths.get(name) : null;
                List<Integer> positions;
                Object symbolic = null;
                Integer single = Values.toInteger(value);
                if (single != null) {
                    positions = List.of(single);
                } else if (Values.isPositionList(value)) {
                    positions = Values.toPositions(value);
                } else {
                    positions = List.of();
                    symbolic = value;
                }
                branches.add(
                        new Branch(
                                i,
                                name,
                                null,
                                positions,
                                symbolic,
                                specs != null ? specs.get(name) : null));
            }
            return branches;
        }

        @Override
        public Object withPositions(Map<Integer, List<Integer>> positionsByIndex) {
            Map<String, Object> copy = Values.mutableMap(raw);
            Map<String, Object> paths = Values.mutableMap(copy.get(PATHS));
            List<String> names = names();
            for (int i = 0; i < names.size(); i++) {
                List<Integer> resolved = positionsByIndex.get(i);
                if (resolved != null) {
                    paths.put(names.get(i), new ArrayList<>(resolved));
                }
            }
            copy.put(PATHS, paths);
            return copy;
        }
    }

    /// Returns branch positions keyed by branch name, merging duplicate names.
    default Map<String, List<Integer>> positionsByName() {
        Map<String, List<Integer>> byName = new LinkedHashMap<>();
        for (Branch branch : branches()) {
            byName.computeIfAbsent(branch.name(), k -> new ArrayList<>()).addAll(branch.positions());
        }
        return byName;
    }
}
