package io.opgraph.server.api;

import static io.opgraph.server.validation.InputValidator.requireSafeId;

import io.opgraph.core.WorkflowGraphService;
import io.opgraph.core.exception.RecordNotFoundException;
import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.record.RecordStatus;
import io.opgraph.core.record.SaveMode;
import io.opgraph.core.record.WorkflowRecord;
import io.opgraph.core.util.Values;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/// REST API for the records processed by record-centric loops.
///
/// Record ids follow `<type>_<nnn>` (`email_001`); `pattern` query parameters are globs
/// where `*` matches any run of characters.
@Path("/api/v1/workflows/{workflowId}/records")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class RecordResource {

    private static final Logger LOG = Logger.getLogger(RecordResource.class);

    private final WorkflowGraphService graphService;

    @Inject
    public RecordResource(WorkflowGraphService graphService) {
        this.graphService = graphService;
    }

    @GET
    public Response query(
            @PathParam("workflowId") String workflowId, @QueryParam("pattern") String pattern) {
        requireSafeId("workflowId", workflowId);
        List<WorkflowRecord> records = graphService.queryRecords(workflowId, pattern);
        return Response.ok(Map.of("records", records, "count", records.size())).build();
    }

    @GET
    @Path("/{recordId}")
    public Response get(
            @PathParam("workflowId") String workflowId, @PathParam("recordId") String recordId) {
        requireSafeId("workflowId", workflowId);
        requireSafeId("recordId", recordId);
        return Response.ok(graphService.getRecord(workflowId, recordId)).build();
    }

    /// Saves a record.
    ///
    /// ### Request
    /// ```
    /// PUT /api/v1/workflows/wf-1/records/email_001?mode=create
    /// {"data": {"fields": {"subject": "Hello"}}, "iterationNodeAlias": "each_mail"}
    /// ```
    ///
    /// @param mode `create`, `update` or `upsert` (default)
    @PUT
    @Path("/{recordId}")
    public Response save(
            @PathParam("workflowId") String workflowId,
            @PathParam("recordId") String recordId,
            @QueryParam("mode") String mode,
            Map<String, Object> request) {
        requireSafeId("workflowId", workflowId);
        requireSafeId("recordId", recordId);
        Map<String, Object> body = request != null ? request : Map.of();

        Object data = body.get("data");
        if (data != null && Values.asMap(data) == null) {
            throw new ValidationException("data", "data must be an object");
        }
        WorkflowRecord.Builder record =
                WorkflowRecord.builder()
                        .workflowId(workflowId)
                        .recordId(recordId)
                        .data(Values.asMap(data));
        if (body.get("recordType") != null) {
            record.recordType(String.valueOf(body.get("recordType")));
        }
        if (body.get("iterationNodeAlias") != null) {
            record.iterationNodeAlias(String.valueOf(body.get("iterationNodeAlias")));
        }
        if (body.get("status") != null) {
            record.status(RecordStatus.fromWireName(String.valueOf(body.get("status"))));
        }

        WorkflowRecord saved = graphService.saveRecord(record.build(), SaveMode.fromWireName(mode));
        return Response.ok(saved).build();
    }

    @DELETE
    @Path("/{recordId}")
    public Response delete(
            @PathParam("workflowId") String workflowId, @PathParam("recordId") String recordId) {
        requireSafeId("workflowId", workflowId);
        requireSafeId("recordId", recordId);
        if (!graphService.deleteRecord(workflowId, recordId)) {
            throw new RecordNotFoundException(workflowId, recordId);
        }
        return Response.noContent().build();
    }

    /// Creates one record per item.
    ///
    /// ### Request
    /// ```json
    /// {"spec": {"type": "email", "id_pattern": "email_{{item.id}}"},
    ///  "items": [{"id": "a1", "subject": "Hello"}], "iterationNodeAlias": "each_mail"}
    /// ```
    @POST
    @Path("/create")
    public Response create(
            @PathParam("workflowId") String workflowId, Map<String, Object> request) {
        requireSafeId("workflowId", workflowId);
        if (request == null) {
            throw new BadRequestException("Request body is required");
        }
        List<Object> items = Values.asList(request.get("items"));
        if (items == null) {
            throw new ValidationException("items", "items must be an array");
        }
        Object alias = request.get("iterationNodeAlias");
        List<WorkflowRecord> created =
                graphService.createRecords(
                        workflowId,
                        request.get("spec"),
                        items,
                        alias != null ? String.valueOf(alias) : null);
        LOG.infov("Created records: workflow={0}, count={1}", workflowId, created.size());
        return Response.status(Response.Status.CREATED)
                .entity(Map.of("records", created, "count", created.size()))
                .build();
    }

    /// Removes every record matching `pattern`, or all records when it is absent.
    @DELETE
    public Response clear(
            @PathParam("workflowId") String workflowId, @QueryParam("pattern") String pattern) {
        requireSafeId("workflowId", workflowId);
        int cleared = graphService.clearRecords(workflowId, pattern);
        LOG.infov("Cleared records: workflow={0}, count={1}", workflowId, cleared);
        return Response.ok(Map.of("cleared", cleared)).build();
    }
}
