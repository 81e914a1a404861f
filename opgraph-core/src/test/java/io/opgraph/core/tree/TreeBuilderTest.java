package io.opgraph.core.tree;

import static io.opgraph.core.NodeFixtures.WORKFLOW;
import static io.opgraph.core.NodeFixtures.action;
import static io.opgraph.core.NodeFixtures.node;
import static io.opgraph.core.NodeFixtures.storeWith;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.opgraph.core.exception.ConflictingParentException;
import io.opgraph.core.store.InMemoryNodeStore;
import io.opgraph.core.workflow.node.Node;
import io.opgraph.core.workflow.node.NodeType;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TreeBuilder")
class TreeBuilderTest {

    private final TreeBuilder builder = new TreeBuilder();

    private static List<Integer> positions(List<TreeNode> nodes) {
        return nodes.stream().map(TreeNode::getPosition).toList();
    }

    @Nested
    @DisplayName("linking")
    class Linking {

        @Test
        void shouldLinkLegacyRouteBranches() {
            InMemoryNodeStore store =
                    storeWith(
                            node(1, "check", NodeType.ROUTE,
                                    Map.of("paths", Map.of("yes", List.of(2), "no", List.of(3)))),
                            action(2, "reply"),
                            action(3, "archive"),
                            action(4, "done"));

            WorkflowTree tree = builder.build(store, WORKFLOW);

            assertThat(positions(tree.getRoots())).containsExactly(1, 4);
            TreeNode route = tree.find(1).orElseThrow();
            assertThat(positions(route.getChildren())).containsExactly(2, 3);
            assertThat(route.getPathPositions())
                    .containsEntry("yes", List.of(2))
                    .containsEntry("no", List.of(3));
            assertThat(tree.parentOf(3)).contains(1);
            assertThat(tree.getDanglingReferences()).isEmpty();
        }

        @Test
        void shouldLinkBranchArrayAndIterateBody() {
            InMemoryNodeStore store =
                    storeWith(
                            node(1, "each_mail", NodeType.ITERATE,
                                    Map.of("listVariable", "mails", "body_positions", List.of(2, 3))),
                            action(2, "open_mail"),
                            node(3, "is_spam", NodeType.ROUTE,
                                    List.of(Map.of("name", "spam", "branch_positions", List.of(4)))),
                            action(4, "delete_mail"));

            WorkflowTree tree = builder.build(store, WORKFLOW);

            assertThat(positions(tree.getRoots())).containsExactly(1);
            assertThat(positions(tree.find(1).orElseThrow().getChildren())).containsExactly(2, 3);
            assertThat(positions(tree.find(3).orElseThrow().getChildren())).containsExactly(4);
        }

        @Test
        void shouldLinkHandleSectionsAndExplicitParents() {
            InMemoryNodeStore store =
                    storeWith(
                            node(1, "guard", NodeType.HANDLE,
                                    Map.of("try", List.of(2), "catch", List.of(3))),
                            action(2, "risky"),
                            action(3, "recover"),
                            node(4, "note", NodeType.ACTION, Map.of("_parent_position", 1)));

            WorkflowTree tree = builder.build(store, WORKFLOW);

            assertThat(positions(tree.find(1).orElseThrow().getChildren())).containsExactly(2, 3, 4);
            assertThat(tree.getParentTable()).containsEntry(4, 1);
        }

        @Test
        void shouldIgnoreParentTagOnGroupNodes() {
            InMemoryNodeStore store =
                    storeWith(
                            action(1, "start"),
                            node(2, "cluster", NodeType.GROUP, Map.of("_parent_position", 1)));

            WorkflowTree tree = builder.build(store, WORKFLOW);

            assertThat(positions(tree.getRoots())).containsExactly(1, 2);
        }
    }

    @Nested
    @DisplayName("diagnostics")
    class Diagnostics {

        @Test
        void shouldReportAndSkipDanglingReferences() {
            InMemoryNodeStore store =
                    storeWith(
                            node(1, "check", NodeType.ROUTE, Map.of("paths", Map.of("yes", List.of(2, 9)))),
                            action(2, "reply"));

            WorkflowTree tree = builder.build(store, WORKFLOW);

            assertThat(tree.getDanglingReferences()).hasSize(1);
            DanglingReference dangling = tree.getDanglingReferences().get(0);
            assertThat(dangling.sourcePosition()).isEqualTo(1);
            assertThat(dangling.missingPosition()).isEqualTo(9);
            assertThat(dangling.kind()).isEqualTo(LinkKind.ROUTE_BRANCH);
            assertThat(positions(tree.find(1).orElseThrow().getChildren())).containsExactly(2);
        }

        @Test
        void shouldLinkExistingMembersOfWideRangeBody() {
            InMemoryNodeStore store =
                    storeWith(
                            action(2, "open_mail"),
                            action(3, "read_mail"),
                            node(20, "each_mail", NodeType.ITERATE,
                                    Map.of("body", Map.of("start", Integer.MIN_VALUE, "end", 10))));

            WorkflowTree tree = builder.build(store, WORKFLOW);

            assertThat(positions(tree.find(20).orElseThrow().getChildren())).containsExactly(2, 3);
            assertThat(tree.getDanglingReferences())
                    .extracting(DanglingReference::missingPosition)
                    .containsExactly(Integer.MIN_VALUE, 10);
        }

        @Test
        void shouldReportOnlyMissingEndOfOpenEndedRange() {
            InMemoryNodeStore store =
                    storeWith(
                            node(1, "each_mail", NodeType.ITERATE,
                                    Map.of("body", Map.of("start", 2, "end", Integer.MAX_VALUE))),
                            action(2, "open_mail"),
                            action(3, "read_mail"));

            WorkflowTree tree = builder.build(store, WORKFLOW);

            assertThat(positions(tree.getRoots())).containsExactly(1);
            assertThat(positions(tree.find(1).orElseThrow().getChildren())).containsExactly(2, 3);
            assertThat(tree.getDanglingReferences())
                    .singleElement()
                    .satisfies(d -> assertThat(d.missingPosition()).isEqualTo(Integer.MAX_VALUE));
        }

        @Test
        void shouldKeepNodeWithMissingExplicitParentAtRoot() {
            InMemoryNodeStore store =
                    storeWith(action(1, "start"), node(2, "orphan", NodeType.ACTION, Map.of("_parent_position", 7)));

            WorkflowTree tree = builder.build(store, WORKFLOW);

            assertThat(positions(tree.getRoots())).containsExactly(1, 2);
            assertThat(tree.getDanglingReferences())
                    .singleElement()
                    .satisfies(d -> assertThat(d.kind()).isEqualTo(LinkKind.EXPLICIT_PARENT));
        }

        @Test
        void shouldRejectNodeClaimedByTwoParents() {
            InMemoryNodeStore store =
                    storeWith(
                            node(1, "first", NodeType.ROUTE, Map.of("paths", Map.of("a", List.of(3)))),
                            node(2, "second", NodeType.ROUTE, Map.of("paths", Map.of("b", List.of(3)))),
                            action(3, "shared"));

            assertThatThrownBy(() -> builder.build(store, WORKFLOW))
                    .isInstanceOf(ConflictingParentException.class)
                    .satisfies(
                            e -> {
                                ConflictingParentException conflict = (ConflictingParentException) e;
                                assertThat(conflict.getChildPosition()).isEqualTo(3);
                                assertThat(conflict.getClaimingParents()).containsExactly(1, 2);
                            });
        }

        @Test
        void shouldRejectSelfClaim() {
            InMemoryNodeStore store =
                    storeWith(action(1, "start"), node(2, "loop", NodeType.ITERATE, Map.of("body_positions", List.of(2))));

            assertThatThrownBy(() -> builder.build(store, WORKFLOW))
                    .isInstanceOf(ConflictingParentException.class);
        }

        @Test
        void shouldRejectParentCycleBesideRoots() {
            InMemoryNodeStore store =
                    storeWith(
                            node(1, "a", NodeType.ROUTE, Map.of("paths", Map.of("x", List.of(2)))),
                            node(2, "b", NodeType.ROUTE, Map.of("paths", Map.of("y", List.of(1)))),
                            action(3, "root"));

            assertThatThrownBy(() -> builder.build(store, WORKFLOW))
                    .isInstanceOf(ConflictingParentException.class)
                    .hasMessageContaining("cycle");
        }

        @Test
        void shouldFallBackToFlatListWhenNoRootExists() {
            InMemoryNodeStore store =
                    storeWith(
                            node(1, "a", NodeType.ROUTE, Map.of("paths", Map.of("x", List.of(2)))),
                            node(2, "b", NodeType.ROUTE, Map.of("paths", Map.of("y", List.of(1)))));

            WorkflowTree tree = builder.build(store, WORKFLOW);

            assertThat(tree.isFlatFallback()).isTrue();
            assertThat(positions(tree.getRoots())).containsExactly(1, 2);
            assertThat(tree.getWarnings()).isNotEmpty();
        }

        @Test
        void shouldBuildEmptyForestForEmptyWorkflow() {
            WorkflowTree tree = builder.build(new InMemoryNodeStore(), WORKFLOW);

            assertThat(tree.getRoots()).isEmpty();
            assertThat(tree.isFlatFallback()).isFalse();
            assertThat(tree.size()).isZero();
        }
    }

    @Nested
    @DisplayName("preorder")
    class Preorder {

        @Test
        void shouldVisitBranchesInDeclaredOrder() {
            InMemoryNodeStore store =
                    storeWith(
                            node(5, "check", NodeType.ROUTE,
                                    List.of(
                                            Map.of("name", "a", "branch_positions", List.of(9)),
                                            Map.of("name", "b", "branch_positions", List.of(7)))),
                            action(7, "second"),
                            action(9, "first"),
                            action(12, "last"));

            List<Integer> order =
                    builder.build(store, WORKFLOW).preorder().stream().map(Node::getPosition).toList();

            assertThat(order).containsExactly(5, 9, 7, 12);
        }
    }
}
