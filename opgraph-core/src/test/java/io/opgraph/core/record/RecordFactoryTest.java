package io.opgraph.core.record;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.template.PathTemplateResolver;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RecordFactory")
class RecordFactoryTest {

    private static final String WORKFLOW = "wf-records";

    private InMemoryRecordStore store;
    private RecordFactory factory;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore();
        factory = new RecordFactory(store, new PathTemplateResolver());
    }

    @Test
    void shouldNumberRecordsSequentially() {
        List<WorkflowRecord> created =
                factory.createRecords(WORKFLOW, "email", List.of(Map.of("subject", "a"), Map.of("subject", "b")), "extract");

        assertThat(created).extracting(WorkflowRecord::getRecordId).containsExactly("email_001", "email_002");
        assertThat(created.get(0).getIterationNodeAlias()).isEqualTo("extract");
        assertThat(created.get(1).getFields()).containsEntry("subject", "b");
    }

    @Test
    void shouldContinueAfterHighestExistingNumber() {
        factory.createRecords(WORKFLOW, "email", List.of("x", "y", "z"), null);
        store.delete(WORKFLOW, "email_002");

        List<WorkflowRecord> created = factory.createRecords(WORKFLOW, "email", List.of("w"), null);

        assertThat(created).extracting(WorkflowRecord::getRecordId).containsExactly("email_004");
        assertThat(created.get(0).getFields()).containsEntry("value", "w");
    }

    @Test
    void shouldIgnoreExistingIdsNumberedPastIntRange() {
        Map<String, Object> spec = Map.of("type", "email", "id_pattern", "email_{{n}}");
        factory.createRecords(WORKFLOW, spec, List.of(Map.of("n", "99999999999")), null);

        List<WorkflowRecord> created = factory.createRecords(WORKFLOW, "email", List.of("w"), null);

        assertThat(created).extracting(WorkflowRecord::getRecordId).containsExactly("email_001");
        assertThat(store.queryRecords(WORKFLOW, "email_*")).hasSize(2);
    }

    @Test
    void shouldDeriveIdsFromPatternAndRefreshFields() {
        Map<String, Object> spec = Map.of("type", "email", "id_pattern", "email_{{sender}}");
        List<WorkflowRecord> first = factory.createRecords(WORKFLOW, spec, List.of(Map.of("sender", "ada", "n", 1)), null);
        store.updateVar(WORKFLOW, first.get(0).getRecordId(), "seen", true);

        List<WorkflowRecord> second =
                factory.createRecords(WORKFLOW, spec, List.of(Map.of("sender", "ada", "n", 2)), null);

        assertThat(second.get(0).getRecordId()).isEqualTo("email_ada");
        assertThat(second.get(0).getFields()).containsEntry("n", 2);
        assertThat(second.get(0).getVars()).containsEntry("seen", true);
        assertThat(store.queryRecords(WORKFLOW, "email_*")).hasSize(1);
    }

    @Test
    void shouldRejectPatternWithUnresolvedPlaceholder() {
        Map<String, Object> spec = Map.of("type", "email", "id_pattern", "email_{{missing}}");

        assertThatThrownBy(() -> factory.createRecords(WORKFLOW, spec, List.of(Map.of("sender", "ada")), null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldRequireType() {
        assertThatThrownBy(() -> factory.createRecords(WORKFLOW, Map.of(), List.of("x"), null))
                .isInstanceOf(ValidationException.class);
    }
}
