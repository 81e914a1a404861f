package io.opgraph.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.workflow.node.Node;
import io.opgraph.core.workflow.node.NodeStatus;
import io.opgraph.core.workflow.node.NodeType;
import java.io.IOException;
import java.io.Serial;
import java.time.Instant;

/// Deserializes JSON to a `Node`.
///
/// Accepts the shape written by {@link NodeSerializer} as well as stored rows using
/// snake_case column names (`uuid`, `workflow_id`, `created_at`, `updated_at`). Legacy type
/// spellings such as `browser_action` are normalized by {@link NodeType#fromWireName}.
/// `params` is kept as plain maps, lists and scalars; the typed views in core read it.
///
/// @implNote Package-private. Registered by {@link OpgraphJacksonModule}.
/// @see NodeSerializer for the inverse operation
class NodeDeserializer extends StdDeserializer<Node> {

    @Serial private static final long serialVersionUID = -7043860231794052317L;

    NodeDeserializer() {
        super(Node.class);
    }

    /// @throws IOException if `id`, `workflowId` or `type` is missing, or `type` is unknown
    @Override
    public Node deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String uuid = firstText(root, "id", "uuid");
        String workflowId = firstText(root, "workflowId", "workflow_id");
        String type = firstText(root, "type");
        if (uuid == null || workflowId == null || type == null) {
            return ctxt.reportInputMismatch(
                    this, "Node requires id, workflowId and type: %s", root.toString());
        }

        Node.Builder builder;
        try {
            builder =
                    Node.builder()
                            .uuid(uuid)
                            .workflowId(workflowId)
                            .type(NodeType.fromWireName(type))
                            .status(NodeStatus.fromWireName(firstText(root, "status")));
        } catch (ValidationException e) {
            return ctxt.reportInputMismatch(this, "%s", e.getMessage());
        }

        JsonNode position = root.get("position");
        if (position != null && position.canConvertToInt()) {
            builder.position(position.asInt());
        }
        builder.alias(firstText(root, "alias"));
        builder.description(firstText(root, "description"));
        if (hasValue(root, "params")) {
            builder.params(mapper.treeToValue(root.get("params"), Object.class));
        }
        if (hasValue(root, "result")) {
            builder.result(mapper.treeToValue(root.get("result"), Object.class));
        }
        builder.createdAt(readInstant(mapper, root, "createdAt", "created_at"));
        builder.updatedAt(readInstant(mapper, root, "updatedAt", "updated_at"));
        return builder.build();
    }

    private static Instant readInstant(ObjectMapper mapper, JsonNode root, String... fields)
            throws IOException {
        for (String field : fields) {
            if (hasValue(root, field)) {
                return mapper.treeToValue(root.get(field), Instant.class);
            }
        }
        return null;
    }

    private static String firstText(JsonNode root, String... fields) {
        for (String field : fields) {
            if (hasValue(root, field)) {
                return root.get(field).asText();
            }
        }
        return null;
    }

    private static boolean hasValue(JsonNode root, String field) {
        JsonNode value = root.get(field);
        return value != null && !value.isNull();
    }
}
