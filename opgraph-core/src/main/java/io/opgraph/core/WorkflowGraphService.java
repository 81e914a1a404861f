package io.opgraph.core;

import io.opgraph.core.edit.DeleteOptions;
import io.opgraph.core.edit.DeletionResult;
import io.opgraph.core.edit.NodeDraft;
import io.opgraph.core.edit.WorkflowEditor;
import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.execution.IterationExecutor;
import io.opgraph.core.execution.IterationOutcome;
import io.opgraph.core.record.RecordFactory;
import io.opgraph.core.record.RecordStore;
import io.opgraph.core.record.SaveMode;
import io.opgraph.core.record.WorkflowRecord;
import io.opgraph.core.renumber.RenumberResult;
import io.opgraph.core.renumber.RenumberingService;
import io.opgraph.core.resolve.ControlFlowResolver;
import io.opgraph.core.resolve.ResolutionReport;
import io.opgraph.core.resolve.SpecOperation;
import io.opgraph.core.state.Mutation;
import io.opgraph.core.state.VariableStoreRegistry;
import io.opgraph.core.store.NodePatch;
import io.opgraph.core.store.NodeSnapshot;
import io.opgraph.core.store.NodeStore;
import io.opgraph.core.tree.TreeBuilder;
import io.opgraph.core.workflow.node.Node;
import io.opgraph.core.workflow.node.NodeRef;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/// Entry point grouping the graph operations of a workflow.
///
/// Every operation that writes nodes (edits, resolution, renumbering, iteration) runs under a
/// per-workflow lock, so structural changes to one workflow never interleave. Reads take a
/// snapshot and need no lock.
///
/// {@snippet :
/// WorkflowGraphService graph = env.getGraphService();
/// graph.createNode("wf-1", new NodeDraft(NodeType.ACTION, "open_inbox", null, Map.of(), null));
/// ResolutionReport report = graph.resolveRoute("wf-1", NodeRef.alias("check_mail"));
/// RenumberResult renumbered = graph.renumber("wf-1");
/// }
///
/// @implNote Thread-safe. Locks are reentrant, created on first use per workflow and dropped
/// again once no caller holds or waits for them.
public class WorkflowGraphService {

    private final NodeStore nodeStore;
    private final RecordStore recordStore;
    private final VariableStoreRegistry variables;
    private final TreeBuilder treeBuilder;
    private final ControlFlowResolver resolver;
    private final RenumberingService renumberingService;
    private final WorkflowEditor editor;
    private final IterationExecutor iterationExecutor;
    private final RecordFactory recordFactory;
    private final int historyReadLimit;
    private final Map<String, WorkflowLock> locks = new ConcurrentHashMap<>();

    public WorkflowGraphService(
            NodeStore nodeStore,
            RecordStore recordStore,
            VariableStoreRegistry variables,
            TreeBuilder treeBuilder,
            ControlFlowResolver resolver,
            RenumberingService renumberingService,
            WorkflowEditor editor,
            IterationExecutor iterationExecutor,
            RecordFactory recordFactory,
            int historyReadLimit) {
        this.nodeStore = Objects.requireNonNull(nodeStore, "nodeStore must not be null");
        this.recordStore = Objects.requireNonNull(recordStore, "recordStore must not be null");
        this.variables = Objects.requireNonNull(variables, "variables must not be null");
        this.treeBuilder = Objects.requireNonNull(treeBuilder, "treeBuilder must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.renumberingService =
                Objects.requireNonNull(renumberingService, "renumberingService must not be null");
        this.editor = Objects.requireNonNull(editor, "editor must not be null");
        this.iterationExecutor =
                Objects.requireNonNull(iterationExecutor, "iterationExecutor must not be null");
        this.recordFactory = Objects.requireNonNull(recordFactory, "recordFactory must not be null");
        this.historyReadLimit = historyReadLimit;
    }

    // -- Nodes and tree --

    /// Lists the workflow's nodes and builds its tree.
    ///
    /// @throws io.opgraph.core.exception.ConflictingParentException if the parent links are
    ///     inconsistent
    public WorkflowView describe(String workflowId) {
        NodeSnapshot snapshot = NodeSnapshot.of(nodeStore, workflowId);
        return new WorkflowView(workflowId, snapshot.nodes(), treeBuilder.build(snapshot));
    }

    public Node getNode(String workflowId, NodeRef ref) {
        return nodeStore.get(workflowId, ref);
    }

    public Node createNode(String workflowId, NodeDraft draft) {
        return locked(workflowId, () -> editor.createNode(workflowId, draft));
    }

    public Node insertNodeAt(String workflowId, int position, NodeDraft draft) {
        return locked(workflowId, () -> editor.insertNodeAt(workflowId, position, draft));
    }

    public Node updateNode(String workflowId, NodeRef ref, NodePatch patch) {
        return locked(workflowId, () -> editor.updateNode(workflowId, ref, patch));
    }

    public DeletionResult deleteNodes(String workflowId, List<NodeRef> refs, DeleteOptions options) {
        return locked(workflowId, () -> editor.deleteNodes(workflowId, refs, options));
    }

    public List<Node> importSequence(String workflowId, List<Map<String, Object>> definition) {
        return locked(workflowId, () -> editor.importSequence(workflowId, definition));
    }

    // -- Resolution and renumbering --

    public ResolutionReport resolveRoute(String workflowId, NodeRef ref) {
        return locked(workflowId, () -> resolver.resolveRoute(workflowId, ref));
    }

    public ResolutionReport resolveIterate(String workflowId, NodeRef ref) {
        return locked(workflowId, () -> resolver.resolveIterate(workflowId, ref));
    }

    public ResolutionReport applyRouteSpec(
            String workflowId, NodeRef ref, SpecOperation operation, Map<String, Object> pathsSpec) {
        return locked(
                workflowId, () -> resolver.applyRouteSpec(workflowId, ref, operation, pathsSpec));
    }

    public ResolutionReport applyIterateSpec(
            String workflowId, NodeRef ref, SpecOperation operation, Object bodySpec) {
        return locked(
                workflowId, () -> resolver.applyIterateSpec(workflowId, ref, operation, bodySpec));
    }

    public RenumberResult renumber(String workflowId) {
        return locked(workflowId, () -> renumberingService.renumber(workflowId));
    }

    /// Runs an iterate node to completion while holding the workflow lock.
    public IterationOutcome executeIterate(String executionId, String workflowId, NodeRef ref) {
        return locked(workflowId, () -> iterationExecutor.execute(executionId, workflowId, ref));
    }

    // -- Variables --

    public Map<String, Object> getVariables(String workflowId) {
        return variables.forWorkflow(workflowId).asMap();
    }

    public Optional<Object> getVariable(String workflowId, String path) {
        return variables.forWorkflow(workflowId).get(path);
    }

    /// @throws ValidationException if the path cannot hold the value
    public void setVariable(String workflowId, String path, Object value) {
        if (!variables.forWorkflow(workflowId).set(path, value)) {
            throw new ValidationException("path", "cannot write variable '" + path + "'");
        }
    }

    /// @return true if something was removed
    public boolean deleteVariable(String workflowId, String path) {
        return variables.forWorkflow(workflowId).delete(path);
    }

    /// @param limit newest entries to return, null for the configured default
    public List<Mutation> getVariableHistory(String workflowId, Integer limit) {
        return variables
                .forWorkflow(workflowId)
                .getMutationHistory(limit != null ? limit : historyReadLimit);
    }

    // -- Records --

    public List<WorkflowRecord> queryRecords(String workflowId, String pattern) {
        return recordStore.queryRecords(workflowId, pattern);
    }

    public WorkflowRecord getRecord(String workflowId, String recordId) {
        return recordStore.get(workflowId, recordId);
    }

    public WorkflowRecord saveRecord(WorkflowRecord record, SaveMode mode) {
        return recordStore.save(record, mode);
    }

    public boolean deleteRecord(String workflowId, String recordId) {
        return recordStore.delete(workflowId, recordId);
    }

    /// Creates or refreshes one record per extracted item.
    ///
    /// @param spec record type, or `{type, id_pattern}`
    /// @see RecordFactory#createRecords
    public List<WorkflowRecord> createRecords(
            String workflowId, Object spec, List<?> items, String iterationNodeAlias) {
        return recordFactory.createRecords(workflowId, spec, items, iterationNodeAlias);
    }

    /// Removes records whose id matches the glob; a blank pattern removes all of them.
    ///
    /// @return number of records removed
    public int clearRecords(String workflowId, String pattern) {
        return recordStore.clearAll(workflowId, pattern);
    }

    /// Number of workflows that currently have a lock in use.
    int activeLockCount() {
        return locks.size();
    }

    private <T> T locked(String workflowId, Supplier<T> action) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        WorkflowLock lock = locks.compute(workflowId, (id, held) -> {
            WorkflowLock acquired = held != null ? held : new WorkflowLock();
            acquired.users++;
            return acquired;
        });
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
            locks.computeIfPresent(workflowId, (id, held) -> --held.users == 0 ? null : held);
        }
    }

    /// Users are counted inside the map's atomic compute calls only.
    private static final class WorkflowLock extends ReentrantLock {
        private int users;
    }
}
