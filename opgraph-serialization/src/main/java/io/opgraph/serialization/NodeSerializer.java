package io.opgraph.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.opgraph.core.workflow.node.Node;
import java.io.IOException;
import java.io.Serial;

/// Serializes a `Node` to a flat JSON object.
///
/// ```
/// field        value
/// ————————————+——————————————————————————————————————————————
/// id          │ uuid, stable across renumbering
/// workflowId  │ owning workflow
/// position    │ canonical ordinal
/// alias       │ omitted when null
/// type        │ wire name, e.g. "iterate"
/// description │ omitted when null
/// params      │ stored form: object, or array for array-form routes
/// status      │ wire name, e.g. "pending"
/// result      │ omitted when null
/// createdAt   │ ISO-8601
/// updatedAt   │ ISO-8601
/// ```
///
/// @implNote Package-private. Registered by {@link OpgraphJacksonModule}.
/// @see NodeDeserializer for the inverse operation
class NodeSerializer extends StdSerializer<Node> {

    @Serial private static final long serialVersionUID = 5185734220364912087L;

    NodeSerializer() {
        super(Node.class);
    }

    @Override
    public void serialize(Node node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", node.getUuid());
        gen.writeStringField("workflowId", node.getWorkflowId());
        gen.writeNumberField("position", node.getPosition());
        writeIfNotNull(gen, "alias", node.getAlias());
        gen.writeStringField("type", node.getType().wireName());
        writeIfNotNull(gen, "description", node.getDescription());
        provider.defaultSerializeField("params", node.getParams(), gen);
        gen.writeStringField("status", node.getStatus().wireName());
        if (node.getResult() != null) {
            provider.defaultSerializeField("result", node.getResult(), gen);
        }
        provider.defaultSerializeField("createdAt", node.getCreatedAt(), gen);
        provider.defaultSerializeField("updatedAt", node.getUpdatedAt(), gen);
        gen.writeEndObject();
    }

    private static void writeIfNotNull(JsonGenerator gen, String field, String value)
            throws IOException {
        if (value != null) {
            gen.writeStringField(field, value);
        }
    }
}
