package io.opgraph.core.record;

import io.opgraph.core.exception.RecordNotFoundException;
import io.opgraph.core.exception.ValidationException;
import io.opgraph.core.state.VariablePath;
import io.opgraph.core.util.Values;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/// In-memory record store (default implementation).
///
/// Thread-safe, no external dependencies. Records are indexed by workflow id, then record
/// id; read-modify-write operations run atomically per record through
/// {@link Map#computeIfPresent}.
///
/// @see RecordStore for contract
public final class InMemoryRecordStore implements RecordStore {

    private static final List<String> SECTIONS =
            List.of(WorkflowRecord.FIELDS, WorkflowRecord.VARS, WorkflowRecord.TARGETS);

    private final Map<String, Map<String, WorkflowRecord>> storage = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRecordStore() {
        this(Clock.systemUTC());
    }

    public InMemoryRecordStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public WorkflowRecord save(WorkflowRecord record, SaveMode mode) {
        Objects.requireNonNull(record, "record must not be null");
        Objects.requireNonNull(mode, "mode must not be null");

        Map<String, WorkflowRecord> records = records(record.getWorkflowId());
        return switch (mode) {
            case CREATE -> {
                WorkflowRecord existing = records.putIfAbsent(record.getRecordId(), record);
                if (existing != null) {
                    throw new ValidationException(
                            "recordId", "record '" + record.getRecordId() + "' already exists");
                }
                yield record;
            }
            case UPDATE -> {
                WorkflowRecord updated =
                        records.computeIfPresent(
                                record.getRecordId(),
                                (id, current) ->
                                        record.toBuilder()
                                                .createdAt(current.getCreatedAt())
                                                .updatedAt(clock.instant())
                                                .build());
                if (updated == null) {
                    throw new RecordNotFoundException(record.getWorkflowId(), record.getRecordId());
                }
                yield updated;
            }
            case UPSERT ->
                    records.merge(
                            record.getRecordId(),
                            record,
                            (current, incoming) ->
                                    incoming.toBuilder()
                                            .createdAt(current.getCreatedAt())
                                            .updatedAt(clock.instant())
                                            .build());
        };
    }

    @Override
    public Optional<WorkflowRecord> find(String workflowId, String recordId) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        Objects.requireNonNull(recordId, "recordId must not be null");

        Map<String, WorkflowRecord> records = storage.get(workflowId);
        return records == null ? Optional.empty() : Optional.ofNullable(records.get(recordId));
    }

    @Override
    public boolean delete(String workflowId, String recordId) {
        Objects.requireNonNull(recordId, "recordId must not be null");
        Map<String, WorkflowRecord> records = storage.get(workflowId);
        return records != null && records.remove(recordId) != null;
    }

    @Override
    public int clearAll(String workflowId, String pattern) {
        Map<String, WorkflowRecord> records = storage.get(workflowId);
        if (records == null) {
            return 0;
        }
        Pattern glob = globPattern(pattern);
        int before = records.size();
        records.keySet().removeIf(id -> glob.matcher(id).matches());
        return before - records.size();
    }

    @Override
    public List<WorkflowRecord> queryRecords(String workflowId, String pattern) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        Map<String, WorkflowRecord> records = storage.get(workflowId);
        if (records == null) {
            return List.of();
        }
        Pattern glob = globPattern(pattern);
        return records.values().stream()
                .filter(r -> glob.matcher(r.getRecordId()).matches())
                .sorted(Comparator.comparing(WorkflowRecord::getRecordId))
                .toList();
    }

    @Override
    public WorkflowRecord updateVar(String workflowId, String recordId, String path, Object value) {
        Objects.requireNonNull(path, "path must not be null");
        List<String> segments = new ArrayList<>(VariablePath.parse(path));
        if (segments.isEmpty()) {
            throw new ValidationException("path", "path must not be empty");
        }
        if (!SECTIONS.contains(segments.get(0))) {
            segments.add(0, WorkflowRecord.VARS);
        }
        return modify(
                workflowId,
                recordId,
                record -> {
                    Map<String, Object> data = Values.mutableMap(record.getData());
                    if (!VariablePath.write(data, segments, Values.deepCopy(value))) {
                        throw new ValidationException(
                                "path", "cannot write '" + path + "' into record " + recordId);
                    }
                    return record.toBuilder().data(data).build();
                });
    }

    @Override
    public WorkflowRecord appendHistory(String workflowId, String recordId, Object entry) {
        return modify(
                workflowId,
                recordId,
                record -> {
                    Map<String, Object> data = Values.mutableMap(record.getData());
                    List<Object> history = Values.asList(data.get(WorkflowRecord.HISTORY));
                    history.add(Values.deepCopy(entry));
                    return record.toBuilder().data(data).build();
                });
    }

    @Override
    public WorkflowRecord updateStatus(
            String workflowId, String recordId, RecordStatus status, String errorMessage) {
        Objects.requireNonNull(status, "status must not be null");
        return modify(
                workflowId,
                recordId,
                record -> {
                    WorkflowRecord.Builder builder = record.toBuilder().status(status);
                    if (status == RecordStatus.FAILED) {
                        builder.retryCount(record.getRetryCount() + 1).errorMessage(errorMessage);
                    } else if (status == RecordStatus.COMPLETE) {
                        builder.processedAt(clock.instant()).errorMessage(null);
                    }
                    return builder.build();
                });
    }

    /// Removes all records (useful for testing).
    public void clear() {
        storage.clear();
    }

    private WorkflowRecord modify(
            String workflowId, String recordId, UnaryOperator<WorkflowRecord> change) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        Objects.requireNonNull(recordId, "recordId must not be null");
        WorkflowRecord updated =
                records(workflowId)
                        .computeIfPresent(
                                recordId,
                                (id, current) ->
                                        change.apply(current).toBuilder()
                                                .updatedAt(clock.instant())
                                                .build());
        if (updated == null) {
            throw new RecordNotFoundException(workflowId, recordId);
        }
        return updated;
    }

    private Map<String, WorkflowRecord> records(String workflowId) {
        return storage.computeIfAbsent(workflowId, k -> new ConcurrentHashMap<>());
    }

    /// Compiles a glob where `*` matches any run of characters and `?` a single one.
    static Pattern globPattern(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return Pattern.compile(".*");
        }
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : pattern.trim().toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString());
    }
}
