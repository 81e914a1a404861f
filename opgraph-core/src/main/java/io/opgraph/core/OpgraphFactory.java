package io.opgraph.core;

import io.opgraph.core.edit.WorkflowEditor;
import io.opgraph.core.execution.IterationExecutor;
import io.opgraph.core.execution.NodeActionExecutor;
import io.opgraph.core.execution.NodeResult;
import io.opgraph.core.execution.RetryPolicy;
import io.opgraph.core.record.InMemoryRecordStore;
import io.opgraph.core.record.RecordFactory;
import io.opgraph.core.record.RecordStore;
import io.opgraph.core.renumber.RenumberingService;
import io.opgraph.core.resolve.ControlFlowResolver;
import io.opgraph.core.state.VariableStoreRegistry;
import io.opgraph.core.store.InMemoryNodeStore;
import io.opgraph.core.store.NodeStore;
import io.opgraph.core.template.PathTemplateResolver;
import io.opgraph.core.template.TemplateResolver;
import io.opgraph.core.tree.TreeBuilder;
import java.time.Clock;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/// Factory for creating and wiring {@link OpgraphEnvironment} instances.
///
/// ### Usage Patterns
///
/// **Builder with explicit components**:
/// {@snippet :
/// var env = OpgraphFactory.builder()
///     .config(OpgraphConfig.builder().iterationParallelism(4).build())
///     .actionExecutor((executionId, node) -> driver.run(node))
///     .build();
/// }
///
/// **Quick start** (in-memory stores, no action driver):
/// {@snippet :
/// var env = OpgraphFactory.createEnvironment();
/// }
///
/// @see OpgraphEnvironment
/// @see OpgraphConfig
public final class OpgraphFactory {

    private static final Logger logger = Logger.getLogger(OpgraphFactory.class.getName());

    private OpgraphFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an environment with default configuration and in-memory stores.
    ///
    /// @return a fully-configured environment, never null
    public static OpgraphEnvironment createEnvironment() {
        return createEnvironment(new OpgraphConfig());
    }

    /// Creates an environment with custom configuration and in-memory stores.
    ///
    /// @apiNote **Side effects**:
    /// - Creates a fixed thread pool when iteration parallelism is above 1
    ///
    /// @param config engine settings, not null
    /// @return a fully-configured environment, never null
    public static OpgraphEnvironment createEnvironment(OpgraphConfig config) {
        return builder().config(config).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Driver used when none is configured: logs and skips every action node.
    static NodeActionExecutor loggingOnly() {
        return (executionId, node) -> {
            logger.info(
                    "No action driver configured, skipping node "
                            + node.getPosition()
                            + " ("
                            + node.getAlias()
                            + ") of execution "
                            + executionId);
            return NodeResult.skipped("no action driver configured");
        };
    }

    /// Fluent builder for custom environment configuration.
    public static class Builder {
        private OpgraphConfig config = new OpgraphConfig();
        private NodeStore nodeStore;
        private RecordStore recordStore;
        private NodeActionExecutor actionExecutor;
        private TemplateResolver templateResolver;
        private ExecutorService executorService;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        /// Sets the configuration options.
        ///
        /// @param config the configuration, not null
        /// @return this builder for chaining, never null
        public Builder config(OpgraphConfig config) {
            this.config = config;
            return this;
        }

        /// Sets the node store. Defaults to {@link InMemoryNodeStore}.
        public Builder nodeStore(NodeStore nodeStore) {
            this.nodeStore = nodeStore;
            return this;
        }

        /// Sets the record store. Defaults to {@link InMemoryRecordStore}.
        public Builder recordStore(RecordStore recordStore) {
            this.recordStore = recordStore;
            return this;
        }

        /// Sets the driver that performs action and query nodes.
        ///
        /// @param actionExecutor the driver, may be null for logging-only mode
        /// @return this builder for chaining, never null
        public Builder actionExecutor(NodeActionExecutor actionExecutor) {
            this.actionExecutor = actionExecutor;
            return this;
        }

        public Builder templateResolver(TemplateResolver templateResolver) {
            this.templateResolver = templateResolver;
            return this;
        }

        /// Sets the thread pool for parallel iteration. When unset and parallelism is above 1,
        /// a fixed pool of that size is created and owned by the environment.
        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /// Wires all components.
        ///
        /// @return a new environment, never null
        /// @throws IllegalArgumentException if the configuration holds invalid values
        public OpgraphEnvironment build() {
            NodeStore nodes = nodeStore != null ? nodeStore : new InMemoryNodeStore(clock);
            RecordStore records = recordStore != null ? recordStore : new InMemoryRecordStore(clock);
            TemplateResolver templates =
                    templateResolver != null ? templateResolver : new PathTemplateResolver();
            VariableStoreRegistry variables =
                    new VariableStoreRegistry(config.getHistoryCapacity(), templates, clock);

            TreeBuilder treeBuilder = new TreeBuilder();
            WorkflowEditor editor =
                    new WorkflowEditor(nodes, treeBuilder, () -> UUID.randomUUID().toString(), clock);
            ControlFlowResolver resolver =
                    new ControlFlowResolver(nodes, variables, editor::appendNode, clock);
            RenumberingService renumbering =
                    new RenumberingService(
                            nodes,
                            treeBuilder,
                            RetryPolicy.of(config.getRenumberUpdateAttempts(), Duration.ofMillis(50)),
                            clock);

            int parallelism = config.getIterationParallelism();
            ExecutorService executor = executorService;
            if (executor == null && parallelism > 1) {
                executor = Executors.newFixedThreadPool(parallelism);
            }
            RetryPolicy nodeRetry =
                    new RetryPolicy(
                            config.getRetryAttempts(),
                            config.getRetryBackoff(),
                            config.getRetryMultiplier());
            IterationExecutor iterationExecutor =
                    new IterationExecutor(
                            nodes,
                            records,
                            variables,
                            resolver,
                            templates,
                            actionExecutor != null ? actionExecutor : loggingOnly(),
                            nodeRetry,
                            parallelism,
                            executor);

            RecordFactory recordFactory = new RecordFactory(records, templates);
            WorkflowGraphService graphService =
                    new WorkflowGraphService(
                            nodes,
                            records,
                            variables,
                            treeBuilder,
                            resolver,
                            renumbering,
                            editor,
                            iterationExecutor,
                            recordFactory,
                            config.getHistoryReadLimit());

            return new OpgraphEnvironment(
                    config,
                    nodes,
                    records,
                    variables,
                    templates,
                    treeBuilder,
                    resolver,
                    renumbering,
                    editor,
                    recordFactory,
                    iterationExecutor,
                    graphService,
                    executorService == null ? executor : null);
        }
    }
}
