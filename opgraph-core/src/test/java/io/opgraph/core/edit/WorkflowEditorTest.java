package io.opgraph.core.edit;

import static io.opgraph.core.NodeFixtures.WORKFLOW;
import static io.opgraph.core.NodeFixtures.action;
import static io.opgraph.core.NodeFixtures.node;
import static io.opgraph.core.NodeFixtures.storeWith;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.store.InMemoryNodeStore;
import io.opgraph.core.store.NodePatch;
import io.opgraph.core.tree.TreeBuilder;
import io.opgraph.core.workflow.node.Node;
import io.opgraph.core.workflow.node.NodeParams;
import io.opgraph.core.workflow.node.NodeRef;
import io.opgraph.core.workflow.node.NodeType;
import io.opgraph.core.workflow.params.IterateParams;
import io.opgraph.core.workflow.params.RouteParams;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("WorkflowEditor")
class WorkflowEditorTest {

    private InMemoryNodeStore store;
    private WorkflowEditor editor;

    @BeforeEach
    void setUp() {
        store =
                storeWith(
                        node(1, "check", NodeType.ROUTE, Map.of("paths", Map.of("yes", List.of(2), "no", List.of(3)))),
                        node(2, "reply", NodeType.ACTION, Map.of("_parent_position", 1)),
                        node(3, "archive", NodeType.ACTION, Map.of("_parent_position", 1)),
                        action(4, "done"));
        AtomicInteger ids = new AtomicInteger();
        editor = new WorkflowEditor(store, new TreeBuilder(), () -> "gen-" + ids.incrementAndGet(), Clock.systemUTC());
    }

    private Node nodeAt(String alias) {
        return store.get(WORKFLOW, NodeRef.alias(alias));
    }

    private static NodeDraft draft(NodeType type, String alias) {
        return new NodeDraft(type, alias, null, Map.of(), null);
    }

    @Nested
    @DisplayName("create and insert")
    class CreateAndInsert {

        @Test
        void shouldAppendAfterLastPosition() {
            Node created = editor.createNode(WORKFLOW, draft(NodeType.ACTION, "notify"));

            assertThat(created.getPosition()).isEqualTo(5);
            assertThat(created.getUuid()).isEqualTo("gen-1");
        }

        @Test
        void shouldRejectDuplicateAlias() {
            assertThatThrownBy(() -> editor.createNode(WORKFLOW, draft(NodeType.ACTION, "reply")))
                    .isInstanceOf(ValidationException.class);
            assertThat(store.list(WORKFLOW)).hasSize(4);
        }

        @Test
        void shouldRejectMalformedAlias() {
            assertThatThrownBy(() -> editor.createNode(WORKFLOW, draft(NodeType.ACTION, "Not Valid")))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        void shouldRejectContextNodeWithoutKey() {
            NodeDraft context = new NodeDraft(NodeType.CONTEXT, "remember", null, Map.of("operation", "set"), null);

            assertThatThrownBy(() -> editor.createNode(WORKFLOW, context))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("params.key");
        }

        @Test
        void shouldShiftNodesAndReferencesOnInsert() {
            Node inserted = editor.insertNodeAt(WORKFLOW, 2, draft(NodeType.ACTION, "log"));

            assertThat(inserted.getPosition()).isEqualTo(2);
            assertThat(nodeAt("reply").getPosition()).isEqualTo(3);
            assertThat(nodeAt("done").getPosition()).isEqualTo(5);
            assertThat(RouteParams.of(nodeAt("check").getParams()).allPositions()).containsExactlyInAnyOrder(3, 4);
            assertThat(nodeAt("archive").getParentPosition()).contains(1);
        }

        @Test
        void shouldInsertWhenRequestedPositionIsTaken() {
            Node created = editor.createNode(WORKFLOW, draft(NodeType.ACTION, "log").withPosition(4));

            assertThat(created.getPosition()).isEqualTo(4);
            assertThat(nodeAt("done").getPosition()).isEqualTo(5);
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        void shouldPatchDescriptionAndAlias() {
            Node updated =
                    editor.updateNode(
                            WORKFLOW, NodeRef.alias("done"), NodePatch.builder().alias("finish").description("last step").build());

            assertThat(updated.getAlias()).isEqualTo("finish");
            assertThat(updated.getDescription()).isEqualTo("last step");
            assertThat(updated.getPosition()).isEqualTo(4);
        }

        @Test
        void shouldRejectPositionChange() {
            assertThatThrownBy(() -> editor.updateNode(WORKFLOW, NodeRef.alias("done"), NodePatch.position(9)))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        void shouldRejectAliasTakenByAnotherNode() {
            assertThatThrownBy(
                            () -> editor.updateNode(WORKFLOW, NodeRef.alias("done"), NodePatch.builder().alias("reply").build()))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("delete")
    class Delete {

        @Test
        void shouldDeleteAndCompactPositions() {
            DeletionResult result =
                    editor.deleteNodes(WORKFLOW, List.of(NodeRef.alias("reply")), DeleteOptions.defaults());

            assertThat(result.deletedPositions()).containsExactly(2);
            assertThat(store.list(WORKFLOW)).extracting(Node::getPosition).containsExactly(1, 2, 3);
            assertThat(nodeAt("archive").getPosition()).isEqualTo(2);
            assertThat(RouteParams.of(nodeAt("check").getParams()).allPositions()).containsExactly(2);
        }

        @Test
        void shouldRejectReferencedNodeWithoutDependencyHandling() {
            assertThatThrownBy(
                            () ->
                                    editor.deleteNodes(
                                            WORKFLOW, List.of(NodeRef.position(3)), new DeleteOptions(false, false, false)))
                    .isInstanceOf(ValidationException.class);
            assertThat(store.list(WORKFLOW)).hasSize(4);
        }

        @Test
        void shouldCascadeToDescendants() {
            DeletionResult result =
                    editor.deleteNodes(WORKFLOW, List.of(NodeRef.alias("check")), new DeleteOptions(true, true, false));

            assertThat(result.deletedPositions()).containsExactly(1, 2, 3);
            assertThat(store.list(WORKFLOW)).singleElement().satisfies(n -> {
                assertThat(n.getAlias()).isEqualTo("done");
                assertThat(n.getPosition()).isEqualTo(1);
            });
        }

        @Test
        void shouldNotWriteOnDryRun() {
            DeletionResult result =
                    editor.deleteNodes(WORKFLOW, List.of(NodeRef.alias("reply")), new DeleteOptions(true, false, true));

            assertThat(result.dryRun()).isTrue();
            assertThat(result.compaction()).hasSize(2);
            assertThat(store.list(WORKFLOW)).hasSize(4);
        }
    }

    @Nested
    @DisplayName("sequence import")
    class SequenceImport {

        @Test
        void shouldFlattenNestedDefinition() {
            List<Map<String, Object>> definition =
                    List.of(
                            Map.of(
                                    "type", "iterate",
                                    "alias", "each_mail",
                                    "params", Map.of("listVariable", "mails"),
                                    "body",
                                    List.of(
                                            Map.of("type", "action", "alias", "open_mail"),
                                            Map.of("type", "action", "alias", "label_mail"))),
                            Map.of("type", "action", "alias", "wrap_up"));

            List<Node> created = editor.importSequence(WORKFLOW, definition);

            assertThat(created).extracting(Node::getPosition).containsExactly(5, 6, 7, 8);
            assertThat(IterateParams.of(nodeAt("each_mail").getParams()).body()).isEqualTo(List.of(6, 7));
            assertThat(nodeAt("label_mail").getParamsMap()).containsEntry(NodeParams.PARENT_POSITION, 5);
            assertThat(nodeAt("wrap_up").getParentPosition()).isEmpty();
        }

        @Test
        void shouldCreateNothingWhenAnyEntryIsInvalid() {
            List<Map<String, Object>> definition =
                    List.of(
                            Map.of("type", "action", "alias", "fine_step"),
                            Map.of("type", "action", "alias", "fine_step"));

            assertThatThrownBy(() -> editor.importSequence(WORKFLOW, definition))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("duplicate alias");
            assertThat(store.list(WORKFLOW)).hasSize(4);
        }
    }
}
