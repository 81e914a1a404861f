package io.opgraph.core.record;

import io.opgraph.core.util.Values;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A durable unit of work processed by record-centric iteration.
///
/// `data` always has the reserved sections `fields` (source data), `vars` (values
/// written while processing), `targets` and `history` (append-only log).
///
/// @implNote Immutable; `data` is a deep-frozen copy. Derive changes through
/// {@link #toBuilder()}.
public final class WorkflowRecord {

    public static final String FIELDS = "fields";
    public static final String VARS = "vars";
    public static final String TARGETS = "targets";
    public static final String HISTORY = "history";

    private final String workflowId;
    private final String recordId;
    private final String recordType;
    private final String iterationNodeAlias;
    private final Map<String, Object> data;
    private final RecordStatus status;
    private final int retryCount;
    private final String errorMessage;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant processedAt;

    private WorkflowRecord(Builder builder) {
        this.workflowId = Objects.requireNonNull(builder.workflowId, "workflowId must not be null");
        this.recordId = Objects.requireNonNull(builder.recordId, "recordId must not be null");
        this.recordType = builder.recordType != null ? builder.recordType : typeOf(builder.recordId);
        this.iterationNodeAlias = builder.iterationNodeAlias;
        this.data = Values.asMap(Values.freeze(normalize(builder.data)));
        this.status = builder.status != null ? builder.status : RecordStatus.DISCOVERED;
        this.retryCount = builder.retryCount;
        this.errorMessage = builder.errorMessage;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
        this.processedAt = builder.processedAt;
    }

    /// Derives the record type from an id such as `email_001` (everything before the last
    /// underscore), or the whole id when it has none.
    public static String typeOf(String recordId) {
        int underscore = recordId.lastIndexOf('_');
        return underscore > 0 ? recordId.substring(0, underscore) : recordId;
    }

    private static Map<String, Object> normalize(Map<String, Object> raw) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (raw != null) {
            data.putAll(Values.mutableMap(raw));
        }
        data.computeIfAbsent(FIELDS, k -> new LinkedHashMap<>());
        data.computeIfAbsent(VARS, k -> new LinkedHashMap<>());
        data.computeIfAbsent(TARGETS, k -> new LinkedHashMap<>());
        data.computeIfAbsent(HISTORY, k -> new ArrayList<>());
        return data;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getRecordId() {
        return recordId;
    }

    public String getRecordType() {
        return recordType;
    }

    public String getIterationNodeAlias() {
        return iterationNodeAlias;
    }

    /// @return frozen data with the reserved sections, never null
    public Map<String, Object> getData() {
        return data;
    }

    public Map<String, Object> getFields() {
        return Values.asMap(data.get(FIELDS));
    }

    public Map<String, Object> getVars() {
        return Values.asMap(data.get(VARS));
    }

    public List<Object> getHistory() {
        return Values.asList(data.get(HISTORY));
    }

    public RecordStatus getStatus() {
        return status;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }

    public Builder toBuilder() {
        return new Builder()
                .workflowId(workflowId)
                .recordId(recordId)
                .recordType(recordType)
                .iterationNodeAlias(iterationNodeAlias)
                .data(data)
                .status(status)
                .retryCount(retryCount)
                .errorMessage(errorMessage)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .processedAt(processedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "WorkflowRecord{" + recordId + ", status=" + status.wireName() + '}';
    }

    public static final class Builder {
        private String workflowId;
        private String recordId;
        private String recordType;
        private String iterationNodeAlias;
        private Map<String, Object> data;
        private RecordStatus status;
        private int retryCount;
        private String errorMessage;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant processedAt;

        private Builder() {}

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder recordId(String recordId) {
            this.recordId = recordId;
            return this;
        }

        public Builder recordType(String recordType) {
            this.recordType = recordType;
            return this;
        }

        public Builder iterationNodeAlias(String iterationNodeAlias) {
            this.iterationNodeAlias = iterationNodeAlias;
            return this;
        }

        public Builder data(Map<String, Object> data) {
            this.data = data;
            return this;
        }

        public Builder status(RecordStatus status) {
            this.status = status;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder processedAt(Instant processedAt) {
            this.processedAt = processedAt;
            return this;
        }

        public WorkflowRecord build() {
            return new WorkflowRecord(this);
        }
    }
}
