package io.opgraph.server.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.opgraph.core.OpgraphEnvironment;
import io.opgraph.core.OpgraphFactory;
import io.opgraph.core.exception.RecordNotFoundException;
import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.record.RecordStatus;
import io.opgraph.core.record.WorkflowRecord;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RecordResource")
@SuppressWarnings("unchecked")
class RecordResourceTest {

    private static final String WF = "wf-1";

    private OpgraphEnvironment env;
    private RecordResource resource;

    @BeforeEach
    void setUp() {
        env = OpgraphFactory.createEnvironment();
        resource = new RecordResource(env.getGraphService());
    }

    @AfterEach
    void tearDown() {
        env.close();
    }

    private WorkflowRecord save(String recordId, String mode) {
        Map<String, Object> body =
                Map.of(
                        "data", Map.of("fields", Map.of("subject", "Hello")),
                        "iterationNodeAlias", "each_mail");
        return (WorkflowRecord) resource.save(WF, recordId, mode, body).getEntity();
    }

    @Nested
    @DisplayName("Single records")
    class SingleRecords {

        @Test
        void shouldSaveAndFetchRecord() {
            save("email_001", "create");

            WorkflowRecord record = (WorkflowRecord) resource.get(WF, "email_001").getEntity();

            assertThat(record.getRecordType()).isEqualTo("email");
            assertThat(record.getFields()).containsEntry("subject", "Hello");
            assertThat(record.getIterationNodeAlias()).isEqualTo("each_mail");
        }

        @Test
        void shouldRejectDuplicateCreate() {
            save("email_001", "create");

            assertThatThrownBy(() -> save("email_001", "create"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("already exists");
        }

        @Test
        void shouldRejectUpdateOfMissingRecord() {
            assertThatThrownBy(() -> save("email_009", "update"))
                    .isInstanceOf(RecordNotFoundException.class);
        }

        @Test
        void shouldApplyStatusFromBody() {
            Map<String, Object> body = Map.of("status", "complete");

            WorkflowRecord saved =
                    (WorkflowRecord) resource.save(WF, "email_002", null, body).getEntity();

            assertThat(saved.getStatus()).isEqualTo(RecordStatus.COMPLETE);
        }

        @Test
        void shouldRejectNonObjectData() {
            assertThatThrownBy(() -> resource.save(WF, "email_001", null, Map.of("data", 5)))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("data");
        }

        @Test
        void shouldRejectUnsafeRecordId() {
            assertThatThrownBy(() -> resource.get(WF, "../secret"))
                    .isInstanceOf(BadRequestException.class)
                    .hasMessageContaining("recordId");
        }

        @Test
        void shouldDeleteRecordAndReportMissingOnes() {
            save("email_001", null);

            assertThat(resource.delete(WF, "email_001").getStatus()).isEqualTo(204);
            assertThatThrownBy(() -> resource.delete(WF, "email_001"))
                    .isInstanceOf(RecordNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Bulk operations")
    class Bulk {

        @Test
        void shouldCreateSequentialIdsFromItems() {
            Response response =
                    resource.create(
                            WF,
                            Map.of(
                                    "spec", "email",
                                    "items",
                                    List.of(Map.of("subject", "a"), Map.of("subject", "b")),
                                    "iterationNodeAlias", "each_mail"));

            assertThat(response.getStatus()).isEqualTo(201);
            Map<String, Object> body = (Map<String, Object>) response.getEntity();
            assertThat(body).containsEntry("count", 2);
            assertThat((List<WorkflowRecord>) body.get("records"))
                    .extracting(WorkflowRecord::getRecordId)
                    .containsExactly("email_001", "email_002");
        }

        @Test
        void shouldRequireItemsArray() {
            assertThatThrownBy(() -> resource.create(WF, Map.of("spec", "email")))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("items");
        }

        @Test
        void shouldQueryByGlobPattern() {
            save("email_001", null);
            save("email_002", null);
            save("task_001", null);

            Map<String, Object> body =
                    (Map<String, Object>) resource.query(WF, "email_*").getEntity();

            assertThat(body).containsEntry("count", 2);
        }

        @Test
        void shouldClearMatchingRecords() {
            save("email_001", null);
            save("task_001", null);

            Map<String, Object> body =
                    (Map<String, Object>) resource.clear(WF, "task_*").getEntity();

            assertThat(body).containsEntry("cleared", 1);
            assertThat((Map<String, Object>) resource.query(WF, null).getEntity())
                    .containsEntry("count", 1);
        }
    }
}
