package io.opgraph.core.resolve;

import static io.opgraph.core.NodeFixtures.WORKFLOW;
import static io.opgraph.core.NodeFixtures.action;
import static io.opgraph.core.NodeFixtures.node;
import static io.opgraph.core.NodeFixtures.storeWith;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.opgraph.core.edit.WorkflowEditor;
import io.opgraph.core.exception.NodeNotFoundException;
import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.state.VariableStoreRegistry;
import io.opgraph.core.store.InMemoryNodeStore;
import io.opgraph.core.store.NodePatch;
import io.opgraph.core.template.PathTemplateResolver;
import io.opgraph.core.tree.TreeBuilder;
import io.opgraph.core.workflow.node.Node;
import io.opgraph.core.workflow.node.NodeParams;
import io.opgraph.core.workflow.node.NodeRef;
import io.opgraph.core.workflow.node.NodeType;
import io.opgraph.core.workflow.params.Branch;
import io.opgraph.core.workflow.params.IterateParams;
import io.opgraph.core.workflow.params.RouteParams;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ControlFlowResolver")
class ControlFlowResolverTest {

    private InMemoryNodeStore store;
    private VariableStoreRegistry variables;
    private ControlFlowResolver resolver;

    @BeforeEach
    void setUp() {
        store =
                storeWith(
                        node(1, "triage", NodeType.ROUTE,
                                List.of(
                                        Map.of("name", "urgent", "condition", "{{priority}} == 'high'",
                                                "branch", List.of("notify_team", "open_ticket")),
                                        Map.of("name", "other", "condition", "true", "branch", "archive"))),
                        action(2, "notify_team"),
                        action(3, "open_ticket"),
                        action(4, "archive"),
                        node(5, "each_mail", NodeType.ITERATE,
                                Map.of("listVariable", "mails", "body", Map.of("start", 6, "end", 8))),
                        action(6, "read_mail"),
                        node(7, "label_mail", NodeType.ACTION, Map.of("tag", "mail")),
                        node(8, "reply_mail", NodeType.ACTION, Map.of("tags", List.of("mail", "outbound"))));
        variables = new VariableStoreRegistry(100, new PathTemplateResolver(), Clock.systemUTC());
        WorkflowEditor editor = new WorkflowEditor(store, new TreeBuilder());
        resolver = new ControlFlowResolver(store, variables, editor::appendNode, Clock.systemUTC());
    }

    private List<Branch> branchesOf(String alias) {
        return RouteParams.of(store.get(WORKFLOW, NodeRef.alias(alias)).getParams()).branches();
    }

    private Integer parentOf(String alias) {
        return store.get(WORKFLOW, NodeRef.alias(alias)).getParentPosition().orElse(null);
    }

    @Nested
    @DisplayName("route resolution")
    class RouteResolution {

        @Test
        void shouldResolveAliasesIntoBranchPositions() {
            ResolutionReport report = resolver.resolveRoute(WORKFLOW, NodeRef.alias("triage"));

            assertThat(report.branches())
                    .extracting(BranchResolution::positions)
                    .containsExactly(List.of(2, 3), List.of(4));
            assertThat(report.paramsChanged()).isTrue();
            assertThat(branchesOf("triage"))
                    .extracting(Branch::positions)
                    .containsExactly(List.of(2, 3), List.of(4));
        }

        @Test
        void shouldTagResolvedChildrenWithParent() {
            ResolutionReport report = resolver.resolveRoute(WORKFLOW, NodeRef.position(1));

            assertThat(report.taggedChildren()).containsExactly(2, 3, 4);
            assertThat(parentOf("open_ticket")).isEqualTo(1);
        }

        @Test
        void shouldWriteNothingOnSecondResolution() {
            resolver.resolveRoute(WORKFLOW, NodeRef.alias("triage"));

            ResolutionReport second = resolver.resolveRoute(WORKFLOW, NodeRef.alias("triage"));

            assertThat(second.paramsChanged()).isFalse();
            assertThat(second.taggedChildren()).isEmpty();
        }

        @Test
        void shouldReportMissingAliasesWithoutFailing() {
            store.update(
                    WORKFLOW,
                    "uuid-triage",
                    NodePatch.params(
                            Map.of("paths", Map.of("yes", List.of("notify_team", "ghost")))));

            ResolutionReport report = resolver.resolveRoute(WORKFLOW, NodeRef.alias("triage"));

            assertThat(report.missingAliases()).containsExactly("ghost");
            assertThat(report.bodyPositions()).containsExactly(2);
        }

        @Test
        void shouldDropDanglingPositions() {
            store.update(
                    WORKFLOW,
                    "uuid-triage",
                    NodePatch.params(
                            List.of(Map.of("name", "a", "branch", List.of(2, 42)))));

            ResolutionReport report = resolver.resolveRoute(WORKFLOW, NodeRef.alias("triage"));

            assertThat(report.bodyPositions()).containsExactly(2);
            assertThat(report.danglingReferences())
                    .singleElement()
                    .satisfies(d -> assertThat(d.missingPosition()).isEqualTo(42));
        }

        @Test
        void shouldIsolateBranchWithOversizedNumericRange() {
            store.update(
                    WORKFLOW,
                    "uuid-triage",
                    NodePatch.params(
                            List.of(
                                    Map.of("name", "broken", "branch", "1-99999999999"),
                                    Map.of("name", "later", "branch", "archive"))));

            ResolutionReport report = resolver.resolveRoute(WORKFLOW, NodeRef.alias("triage"));

            assertThat(report.branches()).hasSize(2);
            assertThat(report.branches().get(0).error()).contains("out of range");
            assertThat(report.branches().get(1).failed()).isFalse();
            assertThat(report.branches().get(1).positions()).containsExactly(4);
        }

        @Test
        void shouldPreferSelectorSpecOverSymbolicBranch() {
            store.update(
                    WORKFLOW,
                    "uuid-triage",
                    NodePatch.params(
                            List.of(
                                    Map.of("name", "a", "branch", "archive",
                                            "branch_spec", Map.of("by_range", Map.of("start", 2, "end", 3))))));

            ResolutionReport report = resolver.resolveRoute(WORKFLOW, NodeRef.alias("triage"));

            assertThat(report.bodyPositions()).containsExactly(2, 3);
        }

        @Test
        void shouldReportConflictInsteadOfReparenting() {
            resolver.resolveIterate(WORKFLOW, NodeRef.alias("each_mail"));
            store.update(
                    WORKFLOW,
                    "uuid-triage",
                    NodePatch.params(
                            List.of(Map.of("name", "a", "branch", "read_mail"))));

            ResolutionReport report = resolver.resolveRoute(WORKFLOW, NodeRef.alias("triage"));

            assertThat(report.conflicts()).hasSize(1);
            assertThat(parentOf("read_mail")).isEqualTo(5);
        }

        @Test
        void shouldRejectNonRouteNode() {
            assertThatThrownBy(() -> resolver.resolveRoute(WORKFLOW, NodeRef.alias("archive")))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        void shouldRejectUnknownNode() {
            assertThatThrownBy(() -> resolver.resolveRoute(WORKFLOW, NodeRef.alias("nope")))
                    .isInstanceOf(NodeNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("iterate resolution")
    class IterateResolution {

        @Test
        void shouldResolveRangeBody() {
            ResolutionReport report = resolver.resolveIterate(WORKFLOW, NodeRef.alias("each_mail"));

            assertThat(report.bodyPositions()).containsExactly(6, 7, 8);
            Node iterate = store.get(WORKFLOW, NodeRef.alias("each_mail"));
            assertThat(IterateParams.of(iterate.getParams()).bodyPositions(List.of()))
                    .containsExactly(6, 7, 8);
            assertThat(parentOf("reply_mail")).isEqualTo(5);
        }

        @Test
        void shouldResolveOpenEndedRangeWithoutExpandingIt() {
            store.update(
                    WORKFLOW,
                    "uuid-each_mail",
                    NodePatch.params(
                            Map.of("listVariable", "mails",
                                    "body", Map.of("start", 6, "end", Integer.MAX_VALUE))));

            ResolutionReport report = resolver.resolveIterate(WORKFLOW, NodeRef.alias("each_mail"));

            assertThat(report.bodyPositions()).containsExactly(6, 7, 8);
            assertThat(report.danglingReferences())
                    .singleElement()
                    .satisfies(d -> assertThat(d.missingPosition()).isEqualTo(Integer.MAX_VALUE));
        }

        @Test
        void shouldResolveQuerySpec() {
            ResolutionReport report =
                    resolver.applyIterateSpec(
                            WORKFLOW,
                            NodeRef.alias("each_mail"),
                            SpecOperation.REPLACE,
                            Map.of("by_query", Map.of("type", "action", "tag", "mail")));

            assertThat(report.bodyPositions()).containsExactly(7, 8);
        }

        @Test
        void shouldResolveGroupDefinedInVariables() {
            variables.forWorkflow(WORKFLOW)
                    .set("group_def_outbound", Map.of("aliases", List.of("reply_mail"), "positions", List.of(6)));

            ResolutionReport report =
                    resolver.applyIterateSpec(
                            WORKFLOW, NodeRef.alias("each_mail"), SpecOperation.REPLACE, Map.of("by_group", "outbound"));

            assertThat(report.bodyPositions()).containsExactly(6, 8);
        }

        @Test
        void shouldCreateInlineNodesOnce() {
            Map<String, Object> spec =
                    Map.of("inline_nodes", List.of(Map.of("type", "action", "alias", "summarize")));

            ResolutionReport first =
                    resolver.applyIterateSpec(WORKFLOW, NodeRef.alias("each_mail"), SpecOperation.REPLACE, spec);
            ResolutionReport second = resolver.resolveIterate(WORKFLOW, NodeRef.alias("each_mail"));

            assertThat(first.createdNodes()).containsExactly(9);
            assertThat(second.createdNodes()).isEmpty();
            assertThat(second.bodyPositions()).containsExactly(9);
            assertThat(store.list(WORKFLOW)).hasSize(9);
            assertThat(store.get(WORKFLOW, NodeRef.alias("summarize")).getParamsMap())
                    .containsEntry(NodeParams.PARENT_POSITION, 5);
        }

        @Test
        void shouldUnionSelectorListsOnAdd() {
            resolver.applyIterateSpec(
                    WORKFLOW, NodeRef.alias("each_mail"), SpecOperation.REPLACE, Map.of("by_aliases", List.of("read_mail")));

            ResolutionReport report =
                    resolver.applyIterateSpec(
                            WORKFLOW, NodeRef.alias("each_mail"), SpecOperation.ADD, Map.of("by_aliases", List.of("reply_mail")));

            assertThat(report.bodyPositions()).containsExactly(6, 8);
        }

        @Test
        void shouldRejectBodyMapWithoutBounds() {
            store.update(
                    WORKFLOW,
                    "uuid-each_mail",
                    NodePatch.params(Map.of("listVariable", "mails", "body", Map.of("from", 6))));

            assertThatThrownBy(() -> resolver.resolveIterate(WORKFLOW, NodeRef.alias("each_mail")))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("route spec patches")
    class RouteSpecPatches {

        @Test
        void shouldAddBranchWithSpec() {
            ResolutionReport report =
                    resolver.applyRouteSpec(
                            WORKFLOW,
                            NodeRef.alias("triage"),
                            SpecOperation.ADD,
                            Map.of("late", Map.of("by_positions", List.of(7))));

            assertThat(report.branches()).extracting(BranchResolution::name).containsExactly("urgent", "other", "late");
            assertThat(report.branches().get(2).positions()).containsExactly(7);
        }

        @Test
        void shouldRejectAddOfExistingBranch() {
            assertThatThrownBy(
                            () ->
                                    resolver.applyRouteSpec(
                                            WORKFLOW, NodeRef.alias("triage"), SpecOperation.ADD, Map.of("urgent", Map.of())))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("already exists");
        }

        @Test
        void shouldRejectReplaceOfUnknownBranch() {
            assertThatThrownBy(
                            () ->
                                    resolver.applyRouteSpec(
                                            WORKFLOW, NodeRef.alias("triage"), SpecOperation.REPLACE, Map.of("nope", Map.of())))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("unknown branch");
        }

        @Test
        void shouldRemoveBranch() {
            ResolutionReport report =
                    resolver.applyRouteSpec(
                            WORKFLOW, NodeRef.alias("triage"), SpecOperation.REMOVE, Map.of("other", Map.of()));

            assertThat(report.branches()).extracting(BranchResolution::name).containsExactly("urgent");
        }
    }
}
