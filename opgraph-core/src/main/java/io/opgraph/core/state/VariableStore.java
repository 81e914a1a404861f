package io.opgraph.core.state;

import io.opgraph.core.template.PathTemplateResolver;
import io.opgraph.core.template.TemplateResolver;
import io.opgraph.core.template.VariableLookup;
import io.opgraph.core.util.Values;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Tree-shaped variable store of one workflow, addressed by dotted paths.
///
/// Values are JSON-like (maps, lists, scalars). Reads return deep copies, so callers can
/// never change stored state behind the store's back.
///
/// ### Contracts
/// - missing paths never throw: {@link #get} returns empty, {@link #has} false,
///   templates keep their placeholder
/// - an empty path on {@link #set}, {@link #delete} or {@link #merge} is logged and
///   answered with `false`
/// - every successful mutation is appended to a bounded history; the oldest entries are
///   dropped when the capacity is reached
///
/// @implNote Thread-safe. Each mutation works on a copy of the tree and swaps it in, so a
/// failed write leaves the previous state intact.
public class VariableStore implements VariableLookup {

    private static final Logger logger = Logger.getLogger(VariableStore.class.getName());

    public static final int DEFAULT_HISTORY_CAPACITY = 1000;
    public static final int DEFAULT_HISTORY_LIMIT = 50;

    private final int historyCapacity;
    private final TemplateResolver templateResolver;
    private final Clock clock;
    private final Deque<Mutation> history = new ArrayDeque<>();
    private Map<String, Object> state = new LinkedHashMap<>();

    public VariableStore() {
        this(DEFAULT_HISTORY_CAPACITY, new PathTemplateResolver(), Clock.systemUTC());
    }

    /// @param historyCapacity maximum retained mutations, must be positive
    /// @param templateResolver resolver for `{{path}}` placeholders, not null
    /// @param clock source of mutation timestamps, not null
    public VariableStore(int historyCapacity, TemplateResolver templateResolver, Clock clock) {
        if (historyCapacity <= 0) {
            throw new IllegalArgumentException("historyCapacity must be positive");
        }
        this.historyCapacity = historyCapacity;
        this.templateResolver =
                Objects.requireNonNull(templateResolver, "templateResolver must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Reads a value. An empty path returns the whole state.
    ///
    /// @param path dotted path, may be empty
    /// @return deep copy of the value, or empty when absent or null
    public synchronized Optional<Object> get(String path) {
        List<String> segments = VariablePath.parse(path);
        if (segments.isEmpty()) {
            return Optional.of(Values.deepCopy(state));
        }
        return VariablePath.navigate(state, segments).map(Values::deepCopy);
    }

    @Override
    public Optional<Object> lookup(String path) {
        return get(path);
    }

    /// Whether a value exists at the path. The empty path always exists.
    public synchronized boolean has(String path) {
        return VariablePath.exists(state, VariablePath.parse(path));
    }

    /// Writes a value, creating intermediate containers.
    ///
    /// @param path dotted path, must not be empty
    /// @param value value to store; copied, may be null
    /// @return true if written
    public synchronized boolean set(String path, Object value) {
        List<String> segments = VariablePath.parse(path);
        if (segments.isEmpty()) {
            logger.warning("Rejected variable set with empty path");
            return false;
        }
        Object oldValue = VariablePath.navigate(state, segments).orElse(null);
        Map<String, Object> working = Values.mutableMap(state);
        if (!VariablePath.write(working, segments, Values.deepCopy(value))) {
            logger.warning("Cannot set '" + path + "': a list cannot hold a named key");
            return false;
        }
        state = working;
        record(MutationOperation.SET, path, oldValue, value);
        return true;
    }

    /// Removes the value at the path; list elements are spliced out.
    ///
    /// @return true if something was removed
    public synchronized boolean delete(String path) {
        List<String> segments = VariablePath.parse(path);
        if (segments.isEmpty()) {
            logger.warning("Rejected variable delete with empty path");
            return false;
        }
        if (!VariablePath.exists(state, segments)) {
            return false;
        }
        Object oldValue = VariablePath.navigate(state, segments).orElse(null);
        Map<String, Object> working = Values.mutableMap(state);
        VariablePath.remove(working, segments);
        state = working;
        record(MutationOperation.DELETE, path, oldValue, null);
        return true;
    }

    /// Shallow-merges an object into the map at the path. An empty path merges into the root.
    /// A missing or non-map target is replaced by the partial object.
    ///
    /// @param path dotted path, may be empty
    /// @param partial entries to merge, must be a map
    /// @return true if merged
    public synchronized boolean merge(String path, Object partial) {
        if (!(partial instanceof Map<?, ?>)) {
            logger.warning("Rejected merge into '" + path + "': value is not an object");
            return false;
        }
        List<String> segments = VariablePath.parse(path);
        Map<String, Object> working = Values.mutableMap(state);
        Map<String, Object> incoming = Values.mutableMap(partial);
        Object oldValue;
        if (segments.isEmpty()) {
            oldValue = Values.deepCopy(state);
            working.putAll(incoming);
        } else {
            oldValue = VariablePath.navigate(state, segments).orElse(null);
            Map<String, Object> merged = Values.mutableMap(oldValue);
            merged.putAll(incoming);
            if (!VariablePath.write(working, segments, merged)) {
                logger.warning("Cannot merge into '" + path + "': a list cannot hold a named key");
                return false;
            }
        }
        state = working;
        record(
                MutationOperation.MERGE,
                path == null ? "" : path,
                oldValue,
                VariablePath.navigate(state, segments).orElse(null));
        return true;
    }

    /// Removes every variable.
    public synchronized void clear() {
        Map<String, Object> oldValue = state;
        state = new LinkedHashMap<>();
        record(MutationOperation.CLEAR, "", oldValue, null);
    }

    /// Returns a deep copy of the whole variable tree.
    public synchronized Map<String, Object> asMap() {
        return Values.mutableMap(state);
    }

    /// Replaces placeholders using this store as the only scope.
    public String resolveTemplate(String template) {
        return templateResolver.resolve(template, this);
    }

    /// Resolves placeholders in every string of a nested value, returning a new value.
    public Object resolveTemplates(Object value) {
        return templateResolver.resolveAll(value, this);
    }

    /// Returns the most recent mutations, oldest first.
    ///
    /// @param limit maximum entries to return; non-positive values use the default of 50
    public synchronized List<Mutation> getMutationHistory(int limit) {
        int effective = limit > 0 ? limit : DEFAULT_HISTORY_LIMIT;
        List<Mutation> all = new ArrayList<>(history);
        return List.copyOf(all.subList(Math.max(0, all.size() - effective), all.size()));
    }

    public List<Mutation> getMutationHistory() {
        return getMutationHistory(DEFAULT_HISTORY_LIMIT);
    }

    public synchronized VariableSnapshot createSnapshot() {
        return new VariableSnapshot(clock.instant(), state, history.size());
    }

    /// Rolls the store back to a snapshot. The rollback itself is recorded in the history.
    ///
    /// @param snapshot checkpoint to restore, may be null
    /// @return false if the snapshot is null
    public synchronized boolean restoreSnapshot(VariableSnapshot snapshot) {
        if (snapshot == null) {
            logger.warning("Rejected restore of a null snapshot");
            return false;
        }
        Map<String, Object> oldValue = state;
        state = Values.mutableMap(snapshot.state());
        record(MutationOperation.RESTORE, "", oldValue, snapshot.state());
        return true;
    }

    private void record(MutationOperation operation, String path, Object oldValue, Object newValue) {
        if (history.size() >= historyCapacity) {
            history.removeFirst();
        }
        history.addLast(
                new Mutation(
                        clock.instant(),
                        operation,
                        path,
                        Values.freeze(oldValue),
                        Values.freeze(newValue)));
    }
}
