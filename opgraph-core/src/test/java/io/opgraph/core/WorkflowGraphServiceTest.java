package io.opgraph.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.opgraph.core.edit.NodeDraft;
import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.execution.NodeResult;
import io.opgraph.core.record.RecordStatus;
import io.opgraph.core.record.WorkflowRecord;
import io.opgraph.core.renumber.RenumberResult;
import io.opgraph.core.resolve.ResolutionReport;
import io.opgraph.core.resolve.SpecOperation;
import io.opgraph.core.tree.TreeNode;
import io.opgraph.core.workflow.node.Node;
import io.opgraph.core.workflow.node.NodeRef;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("WorkflowGraphService")
class WorkflowGraphServiceTest {

    private static final String WORKFLOW = "mail-triage";

    private OpgraphEnvironment environment;
    private WorkflowGraphService graph;
    private final List<String> performed = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    void setUp() {
        environment =
                OpgraphFactory.builder()
                        .actionExecutor(
                                (executionId, node) -> {
                                    Object target = node.getParamsMap().get("target");
                                    performed.add(node.getAlias() + ":" + target);
                                    return NodeResult.success(target);
                                })
                        .build();
        graph = environment.getGraphService();
    }

    @AfterEach
    void tearDown() {
        environment.close();
    }

    @Test
    void shouldBuildResolveAndRenumberImportedWorkflow() {
        graph.importSequence(
                WORKFLOW,
                List.of(
                        Map.of("type", "action", "alias", "open_inbox"),
                        Map.of("type", "route", "alias", "check_spam", "params", Map.of(),
                                "paths", Map.of("spam", List.of(Map.of("type", "action", "alias", "delete_mail")))),
                        Map.of("type", "action", "alias", "close_inbox")));
        graph.createNode(
                WORKFLOW,
                NodeDraft.fromMap(
                        Map.of("type", "action", "alias", "flag_mail", "params", Map.of("target", "x"))));
        graph.applyRouteSpec(
                WORKFLOW,
                NodeRef.alias("check_spam"),
                SpecOperation.ADD,
                Map.of("ham", Map.of("by_aliases", List.of("flag_mail"))));

        RenumberResult renumbered = graph.renumber(WORKFLOW);

        assertThat(renumbered.isNoop()).isFalse();
        assertThat(graph.describe(WORKFLOW).nodes())
                .extracting(Node::getAlias)
                .containsExactly("open_inbox", "check_spam", "delete_mail", "flag_mail", "close_inbox");
        TreeNode route = graph.describe(WORKFLOW).tree().find(2).orElseThrow();
        assertThat(route.getPathPositions()).containsEntry("spam", List.of(3)).containsEntry("ham", List.of(4));
        assertThat(graph.renumber(WORKFLOW).isNoop()).isTrue();
    }

    @Test
    void shouldProcessExtractedRecords() {
        graph.createRecords(WORKFLOW, "email", List.of(Map.of("subject", "a"), Map.of("subject", "b")), "extract");
        graph.createNode(
                WORKFLOW,
                NodeDraft.fromMap(
                        Map.of("type", "iterate", "alias", "each_email", "params", Map.of("records", "email_*", "body", "reply"))));
        graph.createNode(
                WORKFLOW,
                NodeDraft.fromMap(
                        Map.of("type", "action", "alias", "reply", "params", Map.of("target", "{{current.fields.subject}}"))));

        ResolutionReport report = graph.resolveIterate(WORKFLOW, NodeRef.alias("each_email"));
        graph.executeIterate("exec-1", WORKFLOW, NodeRef.alias("each_email"));

        assertThat(report.bodyPositions()).containsExactly(2);
        assertThat(performed).containsExactly("reply:a", "reply:b");
        assertThat(graph.queryRecords(WORKFLOW, "email_*"))
                .extracting(WorkflowRecord::getStatus)
                .containsOnly(RecordStatus.COMPLETE);
        assertThat(graph.clearRecords(WORKFLOW, "*")).isEqualTo(2);
    }

    @Test
    void shouldExposeVariablesAndHistory() {
        graph.setVariable(WORKFLOW, "inbox.count", 3);
        graph.setVariable(WORKFLOW, "inbox.count", 4);

        assertThat(graph.getVariable(WORKFLOW, "inbox.count")).contains(4);
        assertThat(graph.getVariableHistory(WORKFLOW, 1)).singleElement().satisfies(m -> assertThat(m.newValue()).isEqualTo(4));
        assertThat(graph.deleteVariable(WORKFLOW, "inbox")).isTrue();
        assertThat(graph.getVariables(WORKFLOW)).isEmpty();
    }

    @Test
    void shouldRejectUnwritableVariablePath() {
        assertThatThrownBy(() -> graph.setVariable(WORKFLOW, "", 1)).isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldReleaseWorkflowLocksAfterEachOperation() {
        for (int i = 0; i < 50; i++) {
            graph.createNode("wf-" + i, NodeDraft.fromMap(Map.of("type", "action", "alias", "open_inbox")));
        }

        assertThat(graph.activeLockCount()).isZero();
        assertThat(graph.describe("wf-7").nodes()).hasSize(1);
    }
}
