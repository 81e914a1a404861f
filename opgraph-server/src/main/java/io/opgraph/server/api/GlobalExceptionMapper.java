package io.opgraph.server.api;

import io.opgraph.core.exception.ConflictingParentException;
import io.opgraph.core.exception.IterationFailedException;
import io.opgraph.core.exception.NodeNotFoundException;
import io.opgraph.core.exception.PartialRenumberException;
import io.opgraph.core.exception.RecordNotFoundException;
import io.opgraph.core.exception.ValidationError;
import io.opgraph.core.exception.ValidationException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/// Maps engine and JAX-RS exceptions to JSON error responses.
///
/// ### Response Format
/// ```json
/// {"error": "Human-readable message", "status": 404}
/// ```
///
/// ```
/// exception                   status  extra fields
/// ———————————————————————————+———————+——————————————————————————————
/// NodeNotFoundException       │ 404   │
/// RecordNotFoundException     │ 404   │
/// ValidationException         │ 400   │ errors[{field, message}]
/// ConflictingParentException  │ 409   │ childPosition, claimingParents
/// PartialRenumberException    │ 500   │ applied, pending, hint
/// IterationFailedException    │ 500   │ iterateNodePosition, iterationIndex
/// anything else               │ 500   │ (message hidden)
/// ```
///
/// @implNote Thread-safe. Stateless. Unexpected exceptions are logged with their stack trace
/// and never echoed to the client.
@Provider
public class GlobalExceptionMapper implements ExceptionMapper<Throwable> {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMapper.class);

    static final String REFETCH_HINT =
            "Renumbering stopped part-way; re-fetch the workflow nodes before retrying";

    @Override
    public Response toResponse(Throwable exception) {
        if (exception instanceof NodeNotFoundException
                || exception instanceof RecordNotFoundException) {
            LOG.debugv("Not found: {0}", exception.getMessage());
            return respond(404, exception.getMessage(), Map.of());
        }

        if (exception instanceof ValidationException ve) {
            LOG.debugv("Validation failed: {0}", ve.getMessage());
            List<Map<String, String>> errors =
                    ve.getErrors().stream().map(GlobalExceptionMapper::toEntry).toList();
            return respond(400, ve.getMessage(), Map.of("errors", errors));
        }

        if (exception instanceof ConflictingParentException cpe) {
            LOG.warnv("Conflicting parents: {0}", cpe.getMessage());
            return respond(
                    409,
                    cpe.getMessage(),
                    Map.of(
                            "childPosition", cpe.getChildPosition(),
                            "claimingParents", cpe.getClaimingParents()));
        }

        if (exception instanceof PartialRenumberException pre) {
            LOG.errorv(
                    exception,
                    "Partial renumber of workflow {0}: {1} applied, {2} pending",
                    pre.getWorkflowId(),
                    pre.getApplied().size(),
                    pre.getPending().size());
            return respond(
                    500,
                    pre.getMessage(),
                    Map.of(
                            "hint", REFETCH_HINT,
                            "applied", pre.getApplied(),
                            "pending", pre.getPending()));
        }

        if (exception instanceof IterationFailedException ife) {
            LOG.errorv(exception, "Iteration failed: {0}", ife.getMessage());
            Map<String, Object> extra = new LinkedHashMap<>();
            extra.put("iterateNodePosition", ife.getIterateNodePosition());
            extra.put("iterationIndex", ife.getIterationIndex());
            if (ife.getFailedNodePosition() != null) {
                extra.put("failedNodePosition", ife.getFailedNodePosition());
            }
            return respond(500, ife.getMessage(), extra);
        }

        if (exception instanceof WebApplicationException wae) {
            int status = wae.getResponse().getStatus();
            String message = sanitize(status, wae.getMessage());
            if (status >= 500) {
                LOG.errorv(exception, "Server error: {0}", message);
            } else {
                LOG.debugv("Client error {0}: {1}", status, message);
            }
            return respond(status, message, Map.of());
        }

        LOG.errorv(exception, "Unhandled exception: {0}", exception.getMessage());
        return respond(500, "Internal server error", Map.of());
    }

    private static Response respond(int status, String message, Map<String, ?> extra) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message != null ? message : "Request failed");
        body.put("status", status);
        body.putAll(extra);
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(body).build();
    }

    private static Map<String, String> toEntry(ValidationError error) {
        return Map.of("field", error.field(), "message", error.message());
    }

    private static String sanitize(int status, String raw) {
        return switch (status) {
            case 400 -> raw != null ? raw : "Bad request";
            case 404 -> raw != null ? raw : "Resource not found";
            case 405 -> "Method not allowed";
            case 409 -> "Conflict";
            case 415 -> "Unsupported media type";
            default -> {
                if (status >= 500) yield "Internal server error";
                yield raw != null ? raw : "Request failed";
            }
        };
    }
}
