package io.opgraph.core.execution;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Outcome of one pass through a loop body.
///
/// @param index zero-based iteration index
/// @param item the item iterated over; for record loops the record data
/// @param recordId id of the record processed, null for list loops
/// @param success whether every body node succeeded
/// @param nodeResults results of the body nodes that ran, in body order
/// @param error failure message, null on success
/// @param failedNodePosition position of the node that failed, null on success
public record IterationResult(
        int index,
        Object item,
        String recordId,
        boolean success,
        List<NodeResult> nodeResults,
        String error,
        Integer failedNodePosition) {

    public IterationResult {
        nodeResults = List.copyOf(nodeResults);
    }

    /// Plain-map view stored into variables: `{index, success, result}` or `{index, error}`.
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("index", index);
        if (recordId != null) {
            map.put("record_id", recordId);
        }
        map.put("success", success);
        if (success) {
            map.put("result", nodeResults.stream().map(NodeResult::getOutput).toList());
        } else {
            map.put("error", error);
            map.put("node_position", failedNodePosition);
        }
        return map;
    }
}
