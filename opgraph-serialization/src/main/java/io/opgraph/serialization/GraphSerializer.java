package io.opgraph.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.opgraph.core.workflow.node.Node;
import java.util.List;

/// Utility class for converting opgraph nodes, trees and reports to and from JSON.
///
/// Provides a pre-configured `ObjectMapper` that knows the node wire format, the
/// lowercase enum spellings and `java.time` values.
///
/// ### Usage
/// {@snippet :
/// String json = GraphSerializer.toJson(service.describe("wf-1"));
/// List<Node> nodes = GraphSerializer.nodesFromJson(json);
/// ObjectMapper mapper = GraphSerializer.createMapper();
/// }
///
/// @implNote Thread-safe. A fresh mapper is created per call through `createMapper()`;
/// long-lived callers should cache their own.
///
/// @see OpgraphJacksonModule for the registered type handlers
public final class GraphSerializer {

    private GraphSerializer() {}

    /// Serializes any engine value (node, tree, report, record) to pretty-printed JSON.
    ///
    /// @param value the value to serialize, may be null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Object value) {
        try {
            return createMapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize value: " + e.getMessage(), e);
        }
    }

    /// Deserializes a single node.
    ///
    /// @param json JSON object, not null
    /// @return the node, never null
    /// @throws IllegalArgumentException if the JSON is malformed or misses required fields
    public static Node nodeFromJson(String json) {
        return fromJson(json, Node.class);
    }

    /// Deserializes a JSON array of nodes.
    ///
    /// @param json JSON array, not null
    /// @return nodes in array order, never null
    /// @throws IllegalArgumentException if the JSON is malformed
    public static List<Node> nodesFromJson(String json) {
        ObjectMapper mapper = createMapper();
        try {
            return mapper.readValue(
                    json, mapper.getTypeFactory().constructCollectionType(List.class, Node.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize nodes: " + e.getMessage(), e);
        }
    }

    /// Deserializes any type known to {@link OpgraphJacksonModule} or to plain Jackson.
    ///
    /// @param json JSON text, not null
    /// @param type target type, not null
    /// @return deserialized value
    /// @throws IllegalArgumentException if deserialization fails
    public static <T> T fromJson(String json, Class<T> type) {
        try {
            return createMapper().readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for opgraph serialization.
    ///
    /// Registers:
    /// - `OpgraphJacksonModule` for nodes, trees, records and enums
    /// - `JavaTimeModule` for `Instant` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return configure(new ObjectMapper()).enable(SerializationFeature.INDENT_OUTPUT);
    }

    /// Applies the opgraph modules and features to an existing mapper, such as the one
    /// owned by a web framework.
    ///
    /// @param mapper mapper to configure, not null
    /// @return the same mapper, for chaining
    public static ObjectMapper configure(ObjectMapper mapper) {
        return mapper.registerModule(new OpgraphJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
