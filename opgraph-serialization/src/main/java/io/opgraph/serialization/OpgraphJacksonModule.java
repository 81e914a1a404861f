package io.opgraph.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.opgraph.core.execution.NodeResult;
import io.opgraph.core.record.RecordStatus;
import io.opgraph.core.record.WorkflowRecord;
import io.opgraph.core.state.MutationOperation;
import io.opgraph.core.tree.WorkflowTree;
import io.opgraph.core.workflow.node.Node;
import io.opgraph.core.workflow.node.NodeStatus;
import io.opgraph.core.workflow.node.NodeType;
import io.opgraph.serialization.mixin.NodeResultBuilderMixin;
import io.opgraph.serialization.mixin.NodeResultMixin;
import io.opgraph.serialization.mixin.WorkflowRecordBuilderMixin;
import io.opgraph.serialization.mixin.WorkflowRecordMixin;
import java.io.Serial;
import java.util.Locale;

/// Jackson `SimpleModule` that registers all opgraph serialization configuration in one place.
///
/// **Custom serializers and deserializers:**
/// - `Node`: `NodeSerializer` / `NodeDeserializer`, flat object with wire-name `type` and
/// `status`
/// - `WorkflowTree`: `WorkflowTreeSerializer`, write-only nested forest with diagnostics
/// - `NodeType`, `NodeStatus`, `RecordStatus`, `MutationOperation`: lowercase wire names
///
/// **Mixin/builder pairs:**
/// - `WorkflowRecord` + `WorkflowRecord.Builder`
/// - `NodeResult` + `NodeResult.Builder`
///
/// Java records (`ResolutionReport`, `RenumberResult`, `PositionChange`, `Mutation`,
/// `VariableSnapshot`, `DeletionResult`, `IterationOutcome`) need no registration.
///
/// @see GraphSerializer for the convenience factory API
public class OpgraphJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3391527406417258310L;

    public OpgraphJacksonModule() {
        super("OpgraphJacksonModule");

        addSerializer(Node.class, new NodeSerializer());
        addDeserializer(Node.class, new NodeDeserializer());

        addSerializer(WorkflowTree.class, new WorkflowTreeSerializer());

        addSerializer(NodeType.class, new WireNameSerializer<>(NodeType.class, NodeType::wireName));
        addDeserializer(
                NodeType.class, new WireNameDeserializer<>(NodeType.class, NodeType::fromWireName));

        addSerializer(
                NodeStatus.class, new WireNameSerializer<>(NodeStatus.class, NodeStatus::wireName));
        addDeserializer(
                NodeStatus.class,
                new WireNameDeserializer<>(NodeStatus.class, NodeStatus::fromWireName));

        addSerializer(
                RecordStatus.class,
                new WireNameSerializer<>(RecordStatus.class, RecordStatus::wireName));
        addDeserializer(
                RecordStatus.class,
                new WireNameDeserializer<>(RecordStatus.class, RecordStatus::fromWireName));

        addSerializer(
                MutationOperation.class,
                new WireNameSerializer<>(MutationOperation.class, MutationOperation::wireName));
        addDeserializer(
                MutationOperation.class,
                new WireNameDeserializer<>(
                        MutationOperation.class,
                        name -> MutationOperation.valueOf(name.trim().toUpperCase(Locale.ROOT))));
    }

    /// Applies mixin annotations to the builder-pattern domain types.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(WorkflowRecord.class, WorkflowRecordMixin.class);
        context.setMixInAnnotations(WorkflowRecord.Builder.class, WorkflowRecordBuilderMixin.class);

        context.setMixInAnnotations(NodeResult.class, NodeResultMixin.class);
        context.setMixInAnnotations(NodeResult.Builder.class, NodeResultBuilderMixin.class);
    }
}
