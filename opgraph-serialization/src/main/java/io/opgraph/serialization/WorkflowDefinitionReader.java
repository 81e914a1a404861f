package io.opgraph.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opgraph.core.exception.ValidationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Reads nested workflow definitions for sequence import.
///
/// Accepted shapes:
/// - a top-level array of entries
/// - an object holding the array under `nodes` or `sequence`
///
/// Entries stay loosely typed; flattening and validation happen in
/// {@link io.opgraph.core.edit.SequenceFlattener} when the definition is imported.
///
/// {@snippet :
/// List<Map<String, Object>> definition = WorkflowDefinitionReader.read(json);
/// service.importSequence("wf-1", definition);
/// }
public final class WorkflowDefinitionReader {

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    private WorkflowDefinitionReader() {}

    /// @param json definition text, not null
    /// @return top-level entries in declared order, never null
    /// @throws IllegalArgumentException if the text is not valid JSON
    /// @throws ValidationException if the JSON has no entry list or an entry is not an object
    public static List<Map<String, Object>> read(String json) {
        ObjectMapper mapper = GraphSerializer.createMapper();
        try {
            return entries(mapper, mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to read workflow definition: " + e.getMessage(), e);
        }
    }

    /// @param in definition stream, not null, not closed by this method
    /// @return top-level entries in declared order, never null
    /// @throws UncheckedIOException if the stream cannot be read
    public static List<Map<String, Object>> read(InputStream in) {
        ObjectMapper mapper = GraphSerializer.createMapper();
        try {
            return entries(mapper, mapper.readTree(in));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to read workflow definition: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static List<Map<String, Object>> entries(ObjectMapper mapper, JsonNode root) {
        JsonNode list = root;
        if (root != null && root.isObject()) {
            list = root.has("nodes") ? root.get("nodes") : root.get("sequence");
        }
        if (list == null || !list.isArray()) {
            throw new ValidationException(
                    "sequence", "definition must be an array or hold one under 'nodes'");
        }
        List<Map<String, Object>> entries = new ArrayList<>(list.size());
        for (JsonNode entry : list) {
            if (!entry.isObject()) {
                throw new ValidationException("sequence", "entries must be objects");
            }
            entries.add(mapper.convertValue(entry, OBJECT_MAP));
        }
        return entries;
    }
}
