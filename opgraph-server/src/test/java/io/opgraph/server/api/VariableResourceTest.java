package io.opgraph.server.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.opgraph.core.OpgraphEnvironment;
import io.opgraph.core.OpgraphFactory;
import io.opgraph.core.state.Mutation;
import io.opgraph.core.state.MutationOperation;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("VariableResource")
@SuppressWarnings("unchecked")
class VariableResourceTest {

    private static final String WF = "wf-1";

    private OpgraphEnvironment env;
    private VariableResource resource;

    @BeforeEach
    void setUp() {
        env = OpgraphFactory.createEnvironment();
        resource = new VariableResource(env.getGraphService());
    }

    @AfterEach
    void tearDown() {
        env.close();
    }

    @Test
    void shouldSetAndReadNestedPath() {
        resource.set(WF, "user.name", "Ada");

        Response response = resource.get(WF, "user.name");

        assertThat((Map<String, Object>) response.getEntity())
                .containsEntry("path", "user.name")
                .containsEntry("value", "Ada");
        assertThat((Map<String, Object>) resource.getAll(WF).getEntity())
                .containsEntry("user", Map.of("name", "Ada"));
    }

    @Test
    void shouldReturnNotFoundForMissingVariable() {
        assertThatThrownBy(() -> resource.get(WF, "ghost"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void shouldDeleteOnceThenReportNotFound() {
        resource.set(WF, "counter", 1);

        assertThat(resource.delete(WF, "counter").getStatus()).isEqualTo(204);
        assertThatThrownBy(() -> resource.delete(WF, "counter"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void shouldReturnNewestHistoryEntriesUpToLimit() {
        resource.set(WF, "a", 1);
        resource.set(WF, "b", 2);
        resource.delete(WF, "a");

        Map<String, Object> body = (Map<String, Object>) resource.history(WF, 2).getEntity();

        assertThat(body).containsEntry("count", 2);
        assertThat((List<Mutation>) body.get("history"))
                .extracting(Mutation::operation)
                .containsExactly(MutationOperation.SET, MutationOperation.DELETE);
    }

    @Test
    void shouldRejectNegativeHistoryLimit() {
        assertThatThrownBy(() -> resource.history(WF, -1))
                .isInstanceOf(BadRequestException.class);
    }

    @Test
    void shouldKeepVariablesPerWorkflow() {
        resource.set(WF, "shared", "one");

        assertThatThrownBy(() -> resource.get("wf-2", "shared"))
                .isInstanceOf(NotFoundException.class);
    }
}
