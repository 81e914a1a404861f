package io.opgraph.core.execution;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Summary of a complete loop run.
///
/// @param workflowId owning workflow
/// @param iterateNodePosition position of the iterate node
/// @param total number of items available before the iteration ceiling was applied
/// @param processed number of iterations run
/// @param iterations per-iteration outcomes in index order
public record IterationOutcome(
        String workflowId,
        int iterateNodePosition,
        int total,
        int processed,
        List<IterationResult> iterations) {

    public IterationOutcome {
        iterations = List.copyOf(iterations);
    }

    public List<IterationResult> results() {
        return iterations.stream().filter(IterationResult::success).toList();
    }

    public List<IterationResult> errors() {
        return iterations.stream().filter(r -> !r.success()).toList();
    }

    public boolean hasErrors() {
        return iterations.stream().anyMatch(r -> !r.success());
    }

    /// `{results, errors, processed, total}` with plain-map entries.
    public Map<String, Object> toSummary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("results", results().stream().map(IterationResult::toMap).toList());
        summary.put("errors", errors().stream().map(IterationResult::toMap).toList());
        summary.put("processed", processed);
        summary.put("total", total);
        return summary;
    }
}
