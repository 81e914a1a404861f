package io.opgraph.server.api;

import static io.opgraph.server.validation.InputValidator.requireSafeId;
import static io.opgraph.server.validation.InputValidator.sanitize;

import io.opgraph.core.WorkflowGraphService;
import io.opgraph.core.state.Mutation;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/// REST API for a workflow's variable store.
///
/// Paths use dots for nesting (`user.profile.name`). Values are any JSON value.
@Path("/api/v1/workflows/{workflowId}/variables")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class VariableResource {

    private static final Logger LOG = Logger.getLogger(VariableResource.class);

    private final WorkflowGraphService graphService;

    @Inject
    public VariableResource(WorkflowGraphService graphService) {
        this.graphService = graphService;
    }

    @GET
    public Response getAll(@PathParam("workflowId") String workflowId) {
        requireSafeId("workflowId", workflowId);
        return Response.ok(graphService.getVariables(workflowId)).build();
    }

    /// Returns the newest mutation history entries, newest last.
    ///
    /// @param limit entries to return; the configured default when absent
    @GET
    @Path("/history")
    public Response history(
            @PathParam("workflowId") String workflowId, @QueryParam("limit") Integer limit) {
        requireSafeId("workflowId", workflowId);
        if (limit != null && limit < 0) {
            throw new BadRequestException("limit must not be negative");
        }
        List<Mutation> history = graphService.getVariableHistory(workflowId, limit);
        return Response.ok(Map.of("history", history, "count", history.size())).build();
    }

    @GET
    @Path("/{path: .+}")
    public Response get(
            @PathParam("workflowId") String workflowId, @PathParam("path") String path) {
        requireSafeId("workflowId", workflowId);
        Object value =
                graphService
                        .getVariable(workflowId, path)
                        .orElseThrow(() -> notFound(path));
        return Response.ok(entry(path, value)).build();
    }

    /// Sets a variable, creating intermediate objects as needed.
    ///
    /// ### Request
    /// ```
    /// PUT /api/v1/workflows/wf-1/variables/user.name
    /// "Ada"
    /// ```
    @PUT
    @Path("/{path: .+}")
    public Response set(
            @PathParam("workflowId") String workflowId,
            @PathParam("path") String path,
            Object value) {
        requireSafeId("workflowId", workflowId);
        graphService.setVariable(workflowId, path, value);
        LOG.debugv("Set variable: workflow={0}, path={1}", workflowId, sanitize(path));
        return Response.ok(entry(path, value)).build();
    }

    @DELETE
    @Path("/{path: .+}")
    public Response delete(
            @PathParam("workflowId") String workflowId, @PathParam("path") String path) {
        requireSafeId("workflowId", workflowId);
        if (!graphService.deleteVariable(workflowId, path)) {
            throw notFound(path);
        }
        return Response.noContent().build();
    }

    private static NotFoundException notFound(String path) {
        return new NotFoundException("Variable not found: " + sanitize(path));
    }

    private static Map<String, Object> entry(String path, Object value) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("path", path);
        body.put("value", value);
        return body;
    }
}
