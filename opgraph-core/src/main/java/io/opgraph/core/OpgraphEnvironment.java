package io.opgraph.core;

import io.opgraph.core.edit.WorkflowEditor;
import io.opgraph.core.execution.IterationExecutor;
import io.opgraph.core.record.RecordFactory;
import io.opgraph.core.record.RecordStore;
import io.opgraph.core.renumber.RenumberingService;
import io.opgraph.core.resolve.ControlFlowResolver;
import io.opgraph.core.state.VariableStoreRegistry;
import io.opgraph.core.store.NodeStore;
import io.opgraph.core.template.TemplateResolver;
import io.opgraph.core.tree.TreeBuilder;
import java.util.concurrent.ExecutorService;

/// Container holding the wired engine components.
///
/// Implements {@link AutoCloseable} to release the iteration thread pool.
///
/// ### Contracts
/// - **Postcondition**: All getters return the instances wired by the factory
/// - **Invariant**: Component references are immutable after construction
///
/// @apiNote Create instances via {@link OpgraphFactory#createEnvironment()} or
/// {@link OpgraphFactory.Builder} rather than direct construction.
public final class OpgraphEnvironment implements AutoCloseable {

    private final OpgraphConfig config;
    private final NodeStore nodeStore;
    private final RecordStore recordStore;
    private final VariableStoreRegistry variables;
    private final TemplateResolver templateResolver;
    private final TreeBuilder treeBuilder;
    private final ControlFlowResolver resolver;
    private final RenumberingService renumberingService;
    private final WorkflowEditor editor;
    private final RecordFactory recordFactory;
    private final IterationExecutor iterationExecutor;
    private final WorkflowGraphService graphService;
    private final ExecutorService executorService;

    OpgraphEnvironment(
            OpgraphConfig config,
            NodeStore nodeStore,
            RecordStore recordStore,
            VariableStoreRegistry variables,
            TemplateResolver templateResolver,
            TreeBuilder treeBuilder,
            ControlFlowResolver resolver,
            RenumberingService renumberingService,
            WorkflowEditor editor,
            RecordFactory recordFactory,
            IterationExecutor iterationExecutor,
            WorkflowGraphService graphService,
            ExecutorService executorService) {
        this.config = config;
        this.nodeStore = nodeStore;
        this.recordStore = recordStore;
        this.variables = variables;
        this.templateResolver = templateResolver;
        this.treeBuilder = treeBuilder;
        this.resolver = resolver;
        this.renumberingService = renumberingService;
        this.editor = editor;
        this.recordFactory = recordFactory;
        this.iterationExecutor = iterationExecutor;
        this.graphService = graphService;
        this.executorService = executorService;
    }

    public OpgraphConfig getConfig() {
        return config;
    }

    public NodeStore getNodeStore() {
        return nodeStore;
    }

    public RecordStore getRecordStore() {
        return recordStore;
    }

    /// Returns the per-workflow variable stores.
    ///
    /// @return the registry, never null
    public VariableStoreRegistry getVariables() {
        return variables;
    }

    public TemplateResolver getTemplateResolver() {
        return templateResolver;
    }

    public TreeBuilder getTreeBuilder() {
        return treeBuilder;
    }

    public ControlFlowResolver getResolver() {
        return resolver;
    }

    public RenumberingService getRenumberingService() {
        return renumberingService;
    }

    public WorkflowEditor getEditor() {
        return editor;
    }

    public RecordFactory getRecordFactory() {
        return recordFactory;
    }

    public IterationExecutor getIterationExecutor() {
        return iterationExecutor;
    }

    /// Returns the locked facade over all operations; prefer it over the individual services
    /// when several callers share a workflow.
    ///
    /// @return the facade, never null
    public WorkflowGraphService getGraphService() {
        return graphService;
    }

    /// Shuts down the iteration thread pool, if one was created.
    ///
    /// @implNote Calls `ExecutorService.shutdown()` which does not block.
    @Override
    public void close() {
        if (executorService != null) {
            executorService.shutdown();
        }
    }
}
