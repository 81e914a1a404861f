package io.opgraph.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opgraph.core.record.RecordStatus;
import io.opgraph.core.record.WorkflowRecord;
import io.opgraph.core.renumber.PositionChange;
import io.opgraph.core.renumber.RenumberResult;
import io.opgraph.core.resolve.BranchResolution;
import io.opgraph.core.resolve.ResolutionReport;
import io.opgraph.core.state.Mutation;
import io.opgraph.core.state.MutationOperation;
import io.opgraph.core.store.InMemoryNodeStore;
import io.opgraph.core.tree.TreeBuilder;
import io.opgraph.core.tree.WorkflowTree;
import io.opgraph.core.workflow.node.Node;
import io.opgraph.core.workflow.node.NodeStatus;
import io.opgraph.core.workflow.node.NodeType;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("GraphSerializer")
class GraphSerializerTest {

    private static final Instant CREATED = Instant.parse("2024-01-01T00:00:00Z");

    private final ObjectMapper mapper = GraphSerializer.createMapper();

    @Nested
    @DisplayName("Nodes")
    class Nodes {

        @Test
        void shouldRoundTripIterateNode() {
            Node original =
                    node(3, "each_mail", NodeType.ITERATE)
                            .params(Map.of("listVariable", "mails", "body", List.of(4, 5)))
                            .description("Loop over mails")
                            .status(NodeStatus.RUNNING)
                            .build();

            Node restored = GraphSerializer.nodeFromJson(GraphSerializer.toJson(original));

            assertThat(restored).isEqualTo(original);
            assertThat(restored.getCreatedAt()).isEqualTo(CREATED);
            assertThat(restored.getParamsMap()).containsEntry("body", List.of(4, 5));
        }

        @Test
        void shouldWriteWireNamesAndOmitNulls() throws Exception {
            Node node = node(1, "open_inbox", NodeType.ACTION).build();

            JsonNode json = mapper.readTree(GraphSerializer.toJson(node));

            assertThat(json.get("id").asText()).isEqualTo("uuid-open_inbox");
            assertThat(json.get("type").asText()).isEqualTo("action");
            assertThat(json.get("status").asText()).isEqualTo("pending");
            assertThat(json.get("createdAt").asText()).isEqualTo("2024-01-01T00:00:00Z");
            assertThat(json.has("description")).isFalse();
            assertThat(json.has("result")).isFalse();
        }

        @Test
        void shouldKeepArrayFormRouteParams() {
            List<Object> branches =
                    List.of(
                            Map.of("name", "urgent", "condition", "x > 1", "branch", List.of(5)),
                            Map.of("name", "other", "condition", "true", "branch", List.of(6)));
            Node route = node(4, "triage", NodeType.ROUTE).params(branches).build();

            Node restored = GraphSerializer.nodeFromJson(GraphSerializer.toJson(route));

            assertThat(restored.getParams()).isEqualTo(branches);
            assertThat(restored.getParamsMap()).isEmpty();
        }

        @Test
        void shouldReadStoredRowWithLegacySpellings() {
            String row =
                    """
                    {"uuid": "abc", "workflow_id": "wf-1", "position": 7,
                     "type": "browser_action", "status": "completed",
                     "params": {"_parent_position": 3},
                     "created_at": "2024-05-01T10:00:00Z"}
                    """;

            Node node = GraphSerializer.nodeFromJson(row);

            assertThat(node.getUuid()).isEqualTo("abc");
            assertThat(node.getWorkflowId()).isEqualTo("wf-1");
            assertThat(node.getType()).isEqualTo(NodeType.ACTION);
            assertThat(node.getStatus()).isEqualTo(NodeStatus.SUCCESS);
            assertThat(node.getParentPosition()).contains(3);
            assertThat(node.getUpdatedAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        }

        @Test
        void shouldRejectUnknownType() {
            String json = "{\"id\": \"a\", \"workflowId\": \"wf\", \"type\": \"teleport\"}";

            assertThatThrownBy(() -> GraphSerializer.nodeFromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("teleport");
        }

        @Test
        void shouldRejectNodeWithoutIdentity() {
            assertThatThrownBy(() -> GraphSerializer.nodeFromJson("{\"type\": \"action\"}"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("requires id");
        }

        @Test
        void shouldReadNodeArray() {
            String json =
                    GraphSerializer.toJson(
                            List.of(
                                    node(1, "a", NodeType.ACTION).build(),
                                    node(2, "b", NodeType.QUERY).build()));

            List<Node> nodes = GraphSerializer.nodesFromJson(json);

            assertThat(nodes).extracting(Node::getAlias).containsExactly("a", "b");
        }
    }

    @Nested
    @DisplayName("Trees")
    class Trees {

        @Test
        void shouldNestChildrenAndReportDanglingReferences() throws Exception {
            InMemoryNodeStore store = new InMemoryNodeStore();
            store.create(
                    node(1, "each_mail", NodeType.ITERATE)
                            .params(Map.of("listVariable", "mails", "body", List.of(2, 3, 9)))
                            .build());
            store.create(node(2, "open_mail", NodeType.ACTION).build());
            store.create(node(3, "read_mail", NodeType.QUERY).build());
            store.create(node(4, "archive", NodeType.ACTION).build());
            WorkflowTree tree = new TreeBuilder().build(store, "wf-1");

            JsonNode json = mapper.readTree(GraphSerializer.toJson(tree));

            assertThat(json.get("size").asInt()).isEqualTo(4);
            assertThat(json.get("flatFallback").asBoolean()).isFalse();
            JsonNode roots = json.get("roots");
            assertThat(roots).hasSize(2);
            assertThat(roots.get(0).get("alias").asText()).isEqualTo("each_mail");
            assertThat(roots.get(0).get("children")).hasSize(2);
            assertThat(roots.get(0).get("children").get(1).get("type").asText())
                    .isEqualTo("query");
            assertThat(roots.get(1).get("children")).isEmpty();
            JsonNode dangling = json.get("danglingReferences");
            assertThat(dangling).hasSize(1);
            assertThat(dangling.get(0).get("missingPosition").asInt()).isEqualTo(9);
            assertThat(dangling.get(0).get("message").asText()).contains("missing position 9");
        }
    }

    @Nested
    @DisplayName("Reports and state")
    class ReportsAndState {

        @Test
        void shouldRoundTripResolutionReport() {
            ResolutionReport report =
                    new ResolutionReport(
                            "wf-1",
                            4,
                            "triage",
                            List.of(new BranchResolution(0, "urgent", List.of(5, 6), null)),
                            List.of(),
                            List.of("ghost"),
                            List.of(),
                            List.of(5, 6),
                            List.of(),
                            List.of(),
                            true,
                            CREATED);

            String json = GraphSerializer.toJson(report);
            ResolutionReport restored = GraphSerializer.fromJson(json, ResolutionReport.class);

            assertThat(restored).isEqualTo(report);
        }

        @Test
        void shouldRoundTripRenumberResult() {
            RenumberResult result =
                    new RenumberResult(
                            "wf-1",
                            List.of(new PositionChange("uuid-a", 5, 1)),
                            List.of("uuid-r"),
                            CREATED);

            RenumberResult restored =
                    GraphSerializer.fromJson(GraphSerializer.toJson(result), RenumberResult.class);

            assertThat(restored.changes()).containsExactly(new PositionChange("uuid-a", 5, 1));
            assertThat(restored.isNoop()).isFalse();
        }

        @Test
        void shouldWriteMutationOperationAsWireName() throws Exception {
            Mutation mutation =
                    new Mutation(CREATED, MutationOperation.SET, "user.name", null, "Ada");

            JsonNode json = mapper.readTree(GraphSerializer.toJson(mutation));

            assertThat(json.get("operation").asText()).isEqualTo("set");
            assertThat(GraphSerializer.fromJson(json.toString(), Mutation.class))
                    .isEqualTo(mutation);
        }

        @Test
        void shouldRoundTripRecordThroughBuilder() throws Exception {
            WorkflowRecord record =
                    WorkflowRecord.builder()
                            .workflowId("wf-1")
                            .recordId("email_001")
                            .data(Map.of("fields", Map.of("subject", "Hello")))
                            .status(RecordStatus.COMPLETE)
                            .retryCount(1)
                            .createdAt(CREATED)
                            .build();

            String json = GraphSerializer.toJson(record);
            WorkflowRecord restored = GraphSerializer.fromJson(json, WorkflowRecord.class);

            JsonNode tree = mapper.readTree(json);
            assertThat(tree.get("status").asText()).isEqualTo("complete");
            assertThat(tree.has("fields")).isFalse();
            assertThat(restored.getRecordType()).isEqualTo("email");
            assertThat(restored.getStatus()).isEqualTo(RecordStatus.COMPLETE);
            assertThat(restored.getRetryCount()).isEqualTo(1);
            assertThat(restored.getFields()).containsEntry("subject", "Hello");
            assertThat(restored.getHistory()).isEmpty();
        }
    }

    private static Node.Builder node(int position, String alias, NodeType type) {
        return Node.builder()
                .workflowId("wf-1")
                .uuid("uuid-" + alias)
                .position(position)
                .alias(alias)
                .type(type)
                .createdAt(CREATED);
    }
}
