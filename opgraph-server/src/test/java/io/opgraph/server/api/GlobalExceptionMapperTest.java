package io.opgraph.server.api;

import static org.assertj.core.api.Assertions.assertThat;

import io.opgraph.core.exception.ConflictingParentException;
import io.opgraph.core.exception.IterationFailedException;
import io.opgraph.core.exception.NodeNotFoundException;
import io.opgraph.core.exception.PartialRenumberException;
import io.opgraph.core.exception.ValidationError;
import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.renumber.PositionChange;
import jakarta.ws.rs.InternalServerErrorException;
import jakarta.ws.rs.NotAllowedException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("GlobalExceptionMapper")
@SuppressWarnings("unchecked")
class GlobalExceptionMapperTest {

    private final GlobalExceptionMapper mapper = new GlobalExceptionMapper();

    private static Map<String, Object> body(Response response) {
        return (Map<String, Object>) response.getEntity();
    }

    @Test
    void shouldMapMissingNodeTo404() {
        Response response = mapper.toResponse(new NodeNotFoundException("wf-1", "alias:ghost"));

        assertThat(response.getStatus()).isEqualTo(404);
        assertThat(body(response)).containsEntry("status", 404);
        assertThat((String) body(response).get("error")).contains("ghost");
    }

    @Test
    void shouldListValidationErrors() {
        ValidationException exception =
                new ValidationException(
                        List.of(
                                new ValidationError("params.body", "must be a list"),
                                new ValidationError("alias", "already taken")));

        Response response = mapper.toResponse(exception);

        assertThat(response.getStatus()).isEqualTo(400);
        assertThat((List<Map<String, String>>) body(response).get("errors"))
                .containsExactly(
                        Map.of("field", "params.body", "message", "must be a list"),
                        Map.of("field", "alias", "message", "already taken"));
    }

    @Test
    void shouldMapConflictingParentsTo409() {
        Response response = mapper.toResponse(new ConflictingParentException(7, List.of(2, 5)));

        assertThat(response.getStatus()).isEqualTo(409);
        assertThat(body(response))
                .containsEntry("childPosition", 7)
                .containsEntry("claimingParents", List.of(2, 5));
    }

    @Test
    void shouldAdviseRefetchAfterPartialRenumber() {
        PositionChange done = new PositionChange("a", 3, 1);
        PositionChange left = new PositionChange("b", 1, 3);
        PartialRenumberException exception =
                new PartialRenumberException(
                        "wf-1",
                        List.of(done),
                        List.of(left),
                        false,
                        new IllegalStateException("store unavailable"));

        Response response = mapper.toResponse(exception);

        assertThat(response.getStatus()).isEqualTo(500);
        assertThat(body(response))
                .containsEntry("hint", GlobalExceptionMapper.REFETCH_HINT)
                .containsEntry("applied", List.of(done))
                .containsEntry("pending", List.of(left));
    }

    @Test
    void shouldReportIterationCoordinates() {
        IterationFailedException exception =
                new IterationFailedException(4, 2, 6, new IllegalStateException("boom"));

        Response response = mapper.toResponse(exception);

        assertThat(response.getStatus()).isEqualTo(500);
        assertThat(body(response))
                .containsEntry("iterateNodePosition", 4)
                .containsEntry("iterationIndex", 2)
                .containsEntry("failedNodePosition", 6);
    }

    @Test
    void shouldKeepClientErrorMessages() {
        Response response = mapper.toResponse(new NotFoundException("Variable not found: x"));

        assertThat(response.getStatus()).isEqualTo(404);
        assertThat(body(response)).containsEntry("error", "Variable not found: x");
    }

    @Test
    void shouldReplaceMethodNotAllowedMessage() {
        Response response =
                mapper.toResponse(new NotAllowedException("internal detail", "GET", new String[] {"POST"}));

        assertThat(response.getStatus()).isEqualTo(405);
        assertThat(body(response)).containsEntry("error", "Method not allowed");
    }

    @Test
    void shouldHideServerErrorDetails() {
        Response wrapped = mapper.toResponse(new InternalServerErrorException("db password"));
        Response unexpected = mapper.toResponse(new IllegalStateException("secret state"));

        assertThat(body(wrapped)).containsEntry("error", "Internal server error");
        assertThat(unexpected.getStatus()).isEqualTo(500);
        assertThat(body(unexpected)).containsEntry("error", "Internal server error");
    }
}
