package io.opgraph.core.workflow.params;

import static io.opgraph.core.workflow.node.NodeParams.BODY;
import static io.opgraph.core.workflow.node.NodeParams.BODY_POSITIONS;
import static io.opgraph.core.workflow.node.NodeParams.BODY_SPEC;
import static io.opgraph.core.workflow.node.NodeParams.CONTINUE_ON_ERROR;
import static io.opgraph.core.workflow.node.NodeParams.INDEX_VARIABLE;
import static io.opgraph.core.workflow.node.NodeParams.ITEM_VARIABLE;
import static io.opgraph.core.workflow.node.NodeParams.LIMIT;
import static io.opgraph.core.workflow.node.NodeParams.LIST_VARIABLE;
import static io.opgraph.core.workflow.node.NodeParams.MAX_ITERATIONS;
import static io.opgraph.core.workflow.node.NodeParams.ON_ERROR;
import static io.opgraph.core.workflow.node.NodeParams.OVER;
import static io.opgraph.core.workflow.node.NodeParams.RECORDS;
import static io.opgraph.core.workflow.node.NodeParams.STORE;

import io.opgraph.core.exception.ValidationError;
import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.util.Values;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Typed view over iterate node params.
///
/// ### Body precedence
/// `body_spec` over `body` over `body_positions`. For tree building only concrete forms
/// count: `body_positions`, then a numeric `body` list or number, then a `{start,end}` range.
///
/// @param raw the params map, never null
public record IterateParams(Map<String, Object> raw) {

    public static final String DEFAULT_ITEM_VARIABLE = "item";

    public IterateParams {
        Objects.requireNonNull(raw, "raw must not be null");
    }

    public static IterateParams of(Object params) {
        Map<String, Object> map = Values.asMap(params);
        return new IterateParams(map != null ? map : Map.of());
    }

    /// Classifies the declared body source, following the precedence order.
    public BodyKind bodyKind() {
        if (raw.get(BODY_SPEC) != null) {
            return BodyKind.SPEC;
        }
        Object body = raw.get(BODY);
        if (body != null) {
            if (Values.toInteger(body) != null || Values.isPositionList(body)) {
                return BodyKind.POSITIONS;
            }
            if (body instanceof Map<?, ?> map) {
                return map.containsKey("start") && map.containsKey("end")
                        ? BodyKind.RANGE
                        : BodyKind.INVALID;
            }
            return BodyKind.SYMBOLIC;
        }
        return raw.get(BODY_POSITIONS) instanceof List<?> ? BodyKind.RESOLVED : BodyKind.NONE;
    }

    /// Concrete body positions as currently stored, without resolving anything symbolic.
    ///
    /// A range whose end precedes its start yields no positions.
    ///
    /// @param existing positions present in the workflow, used to enumerate a range
    public List<Integer> bodyPositions(Collection<Integer> existing) {
        Object stored = raw.get(BODY_POSITIONS);
        if (stored instanceof List<?>) {
            return Values.toPositions(stored);
        }
        Object body = raw.get(BODY);
        Integer single = Values.toInteger(body);
        if (single != null) {
            return List.of(single);
        }
        if (Values.isPositionList(body)) {
            return Values.toPositions(body);
        }
        return rangePositions(body, existing);
    }

    /// Positions a `{start, end}` range covers: the existing ones inside it, in order, with
    /// each endpoint that does not exist kept so it can be reported as dangling.
    public static List<Integer> rangePositions(Object body, Collection<Integer> existing) {
        Range range = Range.of(body);
        if (range == null) {
            return List.of();
        }
        List<Integer> members = range.members(existing);
        List<Integer> positions = new ArrayList<>(members.size() + 2);
        if (!members.contains(range.start())) {
            positions.add(range.start());
        }
        positions.addAll(members);
        if (range.end() != range.start() && !members.contains(range.end())) {
            positions.add(range.end());
        }
        return positions;
    }

    /// Existing positions inside a `{start, end}` range, in order. Endpoints that do not
    /// exist are left out.
    public static List<Integer> rangeMembers(Object body, Collection<Integer> existing) {
        Range range = Range.of(body);
        return range == null ? List.of() : range.members(existing);
    }

    private record Range(int start, int end) {

        static Range of(Object body) {
            Map<String, Object> range = Values.asMap(body);
            if (range == null) {
                return null;
            }
            Integer start = Values.toInteger(range.get("start"));
            Integer end = Values.toInteger(range.get("end"));
            if (start == null || end == null || end < start) {
                return null;
            }
            return new Range(start, end);
        }

        List<Integer> members(Collection<Integer> existing) {
            return existing.stream()
                    .filter(p -> p != null && p >= start && p <= end)
                    .distinct()
                    .sorted()
                    .toList();
        }
    }

    public Object body() {
        return raw.get(BODY);
    }

    public Object bodySpec() {
        return raw.get(BODY_SPEC);
    }

    /// Variable path holding the list to iterate: `listVariable`, falling back to `over`.
    public String listVariable() {
        Object value = raw.get(LIST_VARIABLE);
        if (Values.isBlank(value)) {
            value = raw.get(OVER);
        }
        return Values.isBlank(value) ? null : String.valueOf(value).trim();
    }

    /// Record id glob for record-centric iteration, e.g. `email_*`.
    public String recordPattern() {
        Object value = raw.get(RECORDS);
        return Values.isBlank(value) ? null : String.valueOf(value).trim();
    }

    public boolean isRecordIteration() {
        return recordPattern() != null;
    }

    public String itemVariable() {
        Object value = raw.get(ITEM_VARIABLE);
        return Values.isBlank(value) ? DEFAULT_ITEM_VARIABLE : String.valueOf(value);
    }

    public String indexVariable() {
        Object value = raw.get(INDEX_VARIABLE);
        return Values.isBlank(value) ? null : String.valueOf(value);
    }

    /// Iteration ceiling from `maxIterations`, or `limit` for record loops.
    ///
    /// @return the ceiling, or null when unbounded
    public Integer maxIterations() {
        Integer max = Values.toInteger(raw.get(MAX_ITERATIONS));
        return max != null ? max : Values.toInteger(raw.get(LIMIT));
    }

    /// Whether a failing iteration is recorded and skipped rather than aborting the loop.
    ///
    /// `continueOnError` wins when present. Otherwise `on_error: stop|continue` applies;
    /// record loops default to continuing and list loops to stopping.
    public boolean continueOnError() {
        if (raw.containsKey(CONTINUE_ON_ERROR)) {
            return Values.isTrue(raw.get(CONTINUE_ON_ERROR));
        }
        Object onError = raw.get(ON_ERROR);
        if (onError != null) {
            return !"stop".equalsIgnoreCase(String.valueOf(onError).trim());
        }
        return isRecordIteration();
    }

    public Object store() {
        return raw.get(STORE);
    }

    /// Checks the loop settings.
    ///
    /// ### Contracts
    /// - `maxIterations` / `limit`, when present, are positive integers
    /// - `itemVariable` / `indexVariable`, when present, are non-blank strings
    /// - `body` is not an object other than a `{start,end}` range
    ///
    /// @return all problems found, empty when valid
    public List<ValidationError> validate() {
        List<ValidationError> errors = new ArrayList<>();
        for (String key : List.of(MAX_ITERATIONS, LIMIT)) {
            if (raw.containsKey(key)) {
                Integer value = Values.toInteger(raw.get(key));
                if (value == null || value <= 0) {
                    errors.add(
                            new ValidationError(
                                    "params." + key,
                                    "must be a positive integer, got " + raw.get(key)));
                }
            }
        }
        for (String key : List.of(ITEM_VARIABLE, INDEX_VARIABLE)) {
            if (raw.containsKey(key)) {
                Object value = raw.get(key);
                if (!(value instanceof String s) || s.isBlank()) {
                    errors.add(new ValidationError("params." + key, "must be a non-empty name"));
                }
            }
        }
        if (bodyKind() == BodyKind.INVALID) {
            errors.add(
                    new ValidationError(
                            "params.body",
                            "must be a position list, a reference string or a {start,end} range"));
        }
        return errors;
    }

    /// Validates and throws when anything is wrong.
    ///
    /// @throws ValidationException listing every problem
    public void requireValid() {
        List<ValidationError> errors = validate();
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }
}
