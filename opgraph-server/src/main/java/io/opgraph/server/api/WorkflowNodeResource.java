package io.opgraph.server.api;

import static io.opgraph.server.validation.InputValidator.requireSafeId;
import static io.opgraph.server.validation.InputValidator.sanitize;

import io.opgraph.core.WorkflowGraphService;
import io.opgraph.core.WorkflowView;
import io.opgraph.core.edit.DeleteOptions;
import io.opgraph.core.edit.DeletionResult;
import io.opgraph.core.edit.NodeDraft;
import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.execution.IterationOutcome;
import io.opgraph.core.renumber.RenumberResult;
import io.opgraph.core.resolve.BranchResolution;
import io.opgraph.core.resolve.ResolutionReport;
import io.opgraph.core.resolve.SpecOperation;
import io.opgraph.core.store.NodePatch;
import io.opgraph.core.tree.DanglingReference;
import io.opgraph.core.util.Values;
import io.opgraph.core.workflow.node.Node;
import io.opgraph.core.workflow.node.NodeRef;
import io.opgraph.core.workflow.node.NodeStatus;
import io.opgraph.core.workflow.node.NodeType;
import io.opgraph.serialization.WorkflowDefinitionReader;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.jboss.logging.Logger;

/// REST API for a workflow's node graph.
///
/// Provides endpoints for:
/// - Listing nodes together with the reconstructed tree
/// - Creating, inserting, patching and deleting nodes
/// - Resolving route and iterate references, and patching their selector specs
/// - Preorder renumbering and nested sequence import
/// - Running an iterate node
///
/// Node references (`{ref}` path segments and `routeRef`/`iterateRef` body fields) accept a
/// position, an alias or a uuid.
///
/// @see WorkflowGraphService for business logic
@Path("/api/v1/workflows/{workflowId}")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class WorkflowNodeResource {

    private static final Logger LOG = Logger.getLogger(WorkflowNodeResource.class);

    private final WorkflowGraphService graphService;

    @Inject
    public WorkflowNodeResource(WorkflowGraphService graphService) {
        this.graphService = graphService;
    }

    /// Lists the workflow's nodes with the tree built from them.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"nodes": [...], "tree": {"roots": [...]},
    ///  "diagnostics": {"danglingReferences": [...], "warnings": [], "flatFallback": false},
    ///  "meta": {"count": 12, "workflowId": "wf-1"}}
    /// ```
    @GET
    @Path("/nodes")
    public Response listNodes(@PathParam("workflowId") String workflowId) {
        requireSafeId("workflowId", workflowId);
        WorkflowView view = graphService.describe(workflowId);

        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put(
                "danglingReferences",
                view.tree().getDanglingReferences().stream()
                        .map(DanglingReference::describe)
                        .toList());
        diagnostics.put("warnings", view.tree().getWarnings());
        diagnostics.put("flatFallback", view.tree().isFlatFallback());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("nodes", view.nodes());
        body.put("tree", view.tree());
        body.put("diagnostics", diagnostics);
        body.put("meta", Map.of("count", view.nodes().size(), "workflowId", workflowId));
        return Response.ok(body).build();
    }

    @GET
    @Path("/nodes/{ref}")
    public Response getNode(
            @PathParam("workflowId") String workflowId, @PathParam("ref") String ref) {
        requireSafeId("workflowId", workflowId);
        return Response.ok(graphService.getNode(workflowId, NodeRef.parse(ref))).build();
    }

    /// Creates a node, appended at the end unless `position` is given.
    ///
    /// ### Request
    /// ```json
    /// {"type": "action", "alias": "open_inbox", "params": {"url": "https://mail.example"}}
    /// ```
    ///
    /// ### Response (201 Created)
    /// The stored node.
    @POST
    @Path("/nodes")
    public Response createNode(
            @PathParam("workflowId") String workflowId, Map<String, Object> request) {
        requireSafeId("workflowId", workflowId);
        NodeDraft draft = NodeDraft.fromMap(requireBody(request));
        LOG.infov(
                "Create node: workflow={0}, alias={1}",
                workflowId, sanitize(draft.alias()));
        Node created = graphService.createNode(workflowId, draft);
        return Response.status(Response.Status.CREATED).entity(created).build();
    }

    /// Inserts a node at `position`, shifting later nodes up by one.
    @POST
    @Path("/nodes/insert")
    public Response insertNode(
            @PathParam("workflowId") String workflowId, Map<String, Object> request) {
        requireSafeId("workflowId", workflowId);
        NodeDraft draft = NodeDraft.fromMap(requireBody(request));
        if (draft.position() == null) {
            throw new ValidationException("position", "position is required for insert");
        }
        Node created = graphService.insertNodeAt(workflowId, draft.position(), draft);
        return Response.status(Response.Status.CREATED).entity(created).build();
    }

    /// Patches a node. Only the fields present in the body change; `position` is rejected.
    ///
    /// ### Request
    /// ```json
    /// {"description": "Open the inbox", "status": "success"}
    /// ```
    @PATCH
    @Path("/nodes/{ref}")
    public Response updateNode(
            @PathParam("workflowId") String workflowId,
            @PathParam("ref") String ref,
            Map<String, Object> request) {
        requireSafeId("workflowId", workflowId);
        NodePatch patch = toPatch(requireBody(request));
        return Response.ok(graphService.updateNode(workflowId, NodeRef.parse(ref), patch)).build();
    }

    /// Deletes nodes.
    ///
    /// ### Request
    /// ```json
    /// {"ids": [4, "check_mail"], "handleDependencies": true, "deleteChildren": false,
    ///  "dryRun": false}
    /// ```
    @POST
    @Path("/nodes/delete")
    public Response deleteNodes(
            @PathParam("workflowId") String workflowId, Map<String, Object> request) {
        requireSafeId("workflowId", workflowId);
        Map<String, Object> body = requireBody(request);
        List<Object> ids = Values.asList(body.get("ids"));
        if (ids == null || ids.isEmpty()) {
            throw new ValidationException("ids", "at least one node reference is required");
        }
        List<NodeRef> refs = ids.stream().map(NodeRef::parse).toList();
        DeleteOptions defaults = DeleteOptions.defaults();
        DeleteOptions options =
                new DeleteOptions(
                        flag(body, "handleDependencies", defaults.handleDependencies()),
                        flag(body, "deleteChildren", defaults.deleteChildren()),
                        flag(body, "dryRun", defaults.dryRun()));

        DeletionResult result = graphService.deleteNodes(workflowId, refs, options);
        LOG.infov(
                "Deleted nodes: workflow={0}, positions={1}, dryRun={2}",
                workflowId, result.deletedPositions(), result.dryRun());
        return Response.ok(result).build();
    }

    // -- Route and iterate resolution --

    @POST
    @Path("/route/resolve")
    public Response resolveRoute(
            @PathParam("workflowId") String workflowId, Map<String, Object> request) {
        requireSafeId("workflowId", workflowId);
        NodeRef ref = refFrom(requireBody(request), "routeRef");
        return Response.ok(routeResponse(graphService.resolveRoute(workflowId, ref))).build();
    }

    /// Patches a route's `paths_spec` and resolves it.
    ///
    /// ### Request
    /// ```json
    /// {"routeRef": "check_mail", "op": "add",
    ///  "paths_spec": {"spam": {"by_aliases": ["delete_mail"]}}}
    /// ```
    @POST
    @Path("/route/apply")
    public Response applyRouteSpec(
            @PathParam("workflowId") String workflowId, Map<String, Object> request) {
        requireSafeId("workflowId", workflowId);
        Map<String, Object> body = requireBody(request);
        NodeRef ref = refFrom(body, "routeRef");
        Map<String, Object> pathsSpec = Values.asMap(body.get("paths_spec"));
        if (pathsSpec == null) {
            throw new ValidationException("paths_spec", "paths_spec must be an object");
        }
        SpecOperation op = SpecOperation.fromWireName(stringOrNull(body.get("op")));
        ResolutionReport report = graphService.applyRouteSpec(workflowId, ref, op, pathsSpec);
        return Response.ok(routeResponse(report)).build();
    }

    @POST
    @Path("/iterate/resolve")
    public Response resolveIterate(
            @PathParam("workflowId") String workflowId, Map<String, Object> request) {
        requireSafeId("workflowId", workflowId);
        NodeRef ref = refFrom(requireBody(request), "iterateRef");
        return Response.ok(iterateResponse(graphService.resolveIterate(workflowId, ref))).build();
    }

    /// Patches an iterate node's `body_spec` and resolves it.
    @POST
    @Path("/iterate/apply")
    public Response applyIterateSpec(
            @PathParam("workflowId") String workflowId, Map<String, Object> request) {
        requireSafeId("workflowId", workflowId);
        Map<String, Object> body = requireBody(request);
        NodeRef ref = refFrom(body, "iterateRef");
        SpecOperation op = SpecOperation.fromWireName(stringOrNull(body.get("op")));
        ResolutionReport report =
                graphService.applyIterateSpec(workflowId, ref, op, body.get("body_spec"));
        return Response.ok(iterateResponse(report)).build();
    }

    /// Runs an iterate node over its list or record source.
    ///
    /// ### Request
    /// ```json
    /// {"iterateRef": "each_mail", "executionId": "exec-42"}
    /// ```
    @POST
    @Path("/iterate/execute")
    public Response executeIterate(
            @PathParam("workflowId") String workflowId, Map<String, Object> request) {
        requireSafeId("workflowId", workflowId);
        Map<String, Object> body = requireBody(request);
        NodeRef ref = refFrom(body, "iterateRef");
        String executionId = stringOrNull(body.get("executionId"));
        if (executionId == null || executionId.isBlank()) {
            executionId = UUID.randomUUID().toString();
        }
        LOG.infov(
                "Execute iterate: workflow={0}, ref={1}, execution={2}",
                workflowId, ref.describe(), sanitize(executionId));
        IterationOutcome outcome = graphService.executeIterate(executionId, workflowId, ref);

        Map<String, Object> response = new LinkedHashMap<>(outcome.toSummary());
        response.put("executionId", executionId);
        response.put("iterations", outcome.iterations());
        return Response.ok(response).build();
    }

    // -- Renumbering and import --

    /// Renumbers the workflow in tree preorder.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"changes": [{"id": "...", "oldPosition": 5, "newPosition": 1}], "count": 1}
    /// ```
    @POST
    @Path("/renumber_preorder")
    public Response renumberPreorder(@PathParam("workflowId") String workflowId) {
        requireSafeId("workflowId", workflowId);
        RenumberResult result = graphService.renumber(workflowId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("changes", result.changes());
        body.put("count", result.changes().size());
        body.put("rewrittenNodes", result.rewrittenNodes());
        return Response.ok(body).build();
    }

    /// Imports a nested definition, appending its nodes after the existing ones.
    ///
    /// The body is either an array of entries or an object holding one under `nodes`.
    @POST
    @Path("/sequence")
    public Response importSequence(@PathParam("workflowId") String workflowId, String definition) {
        requireSafeId("workflowId", workflowId);
        if (definition == null || definition.isBlank()) {
            throw new BadRequestException("Request body is required");
        }
        List<Map<String, Object>> entries;
        try {
            entries = WorkflowDefinitionReader.read(definition);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(e.getMessage(), e);
        }
        List<Node> created = graphService.importSequence(workflowId, entries);
        LOG.infov("Imported sequence: workflow={0}, nodes={1}", workflowId, created.size());
        return Response.status(Response.Status.CREATED)
                .entity(Map.of("nodes", created, "count", created.size()))
                .build();
    }

    // -- Helpers --

    private static Map<String, Object> routeResponse(ResolutionReport report) {
        Map<String, Object> branches = new LinkedHashMap<>();
        for (BranchResolution branch : report.branches()) {
            branches.put(branch.name(), branch.positions());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("branches", branches);
        body.put("report", report);
        return body;
    }

    private static Map<String, Object> iterateResponse(ResolutionReport report) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("body", report.bodyPositions());
        body.put("report", report);
        return body;
    }

    static NodePatch toPatch(Map<String, Object> body) {
        NodePatch.Builder patch = NodePatch.builder();
        List<String> unknown = new ArrayList<>();
        for (Map.Entry<String, Object> entry : body.entrySet()) {
            Object value = entry.getValue();
            switch (entry.getKey()) {
                case "type" -> patch.type(NodeType.fromWireName(stringOrNull(value)));
                case "alias" -> patch.alias(stringOrNull(value));
                case "params" -> patch.params(value);
                case "description" -> patch.description(stringOrNull(value));
                case "status" -> patch.status(NodeStatus.fromWireName(stringOrNull(value)));
                case "result" -> patch.result(value);
                case "position" -> {
                    Integer position = Values.toInteger(value);
                    if (position == null) {
                        throw new ValidationException("position", "position must be a number");
                    }
                    patch.position(position);
                }
                default -> unknown.add(entry.getKey());
            }
        }
        if (!unknown.isEmpty()) {
            LOG.debugv("Ignoring unknown patch fields: {0}", unknown);
        }
        return patch.build();
    }

    private static NodeRef refFrom(Map<String, Object> body, String field) {
        Object raw = body.containsKey(field) ? body.get(field) : body.get("ref");
        if (raw == null) {
            throw new ValidationException(field, field + " is required");
        }
        return NodeRef.parse(raw);
    }

    private static Map<String, Object> requireBody(Map<String, Object> request) {
        if (request == null) {
            throw new BadRequestException("Request body is required");
        }
        return request;
    }

    private static boolean flag(Map<String, Object> body, String field, boolean fallback) {
        Object value = body.get(field);
        return value instanceof Boolean b ? b : fallback;
    }

    private static String stringOrNull(Object value) {
        return value != null ? String.valueOf(value) : null;
    }
}
