package io.opgraph.core.state;

import io.opgraph.core.template.TemplateResolver;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Holds one {@link VariableStore} per workflow, created on first access.
public final class VariableStoreRegistry {

    private final Map<String, VariableStore> stores = new ConcurrentHashMap<>();
    private final int historyCapacity;
    private final TemplateResolver templateResolver;
    private final Clock clock;

    public VariableStoreRegistry(int historyCapacity, TemplateResolver templateResolver, Clock clock) {
        this.historyCapacity = historyCapacity;
        this.templateResolver = Objects.requireNonNull(templateResolver, "templateResolver must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Returns the workflow's store, creating an empty one if needed.
    public VariableStore forWorkflow(String workflowId) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        return stores.computeIfAbsent(
                workflowId, k -> new VariableStore(historyCapacity, templateResolver, clock));
    }

    public Optional<VariableStore> find(String workflowId) {
        return Optional.ofNullable(stores.get(workflowId));
    }

    public boolean remove(String workflowId) {
        return stores.remove(workflowId) != null;
    }
}
