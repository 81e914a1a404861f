package io.opgraph.core.execution;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/// Immutable result of node execution containing status, output, and metadata.
///
/// ### Factory Methods
/// - {@link #success(Object)} and {@link #success(Object, Map)} for successful execution
/// - {@link #failure(Throwable)} for errors with exception
/// - {@link #failure(String)} for errors with message
/// - {@link #skipped(String)} for nodes the engine did not hand to the driver
///
/// @implNote Immutable after construction. Metadata map is wrapped in
/// an unmodifiable view when built via the builder.
///
/// @see ResultStatus for possible status values
/// @see NodeActionExecutor for execution logic
public final class NodeResult {

    private final ResultStatus status;
    private final Object output;
    private final Map<String, Object> metadata;
    private final Throwable error;
    private final Instant timestamp;

    private NodeResult(Builder builder) {
        this.status = builder.status;
        this.output = builder.output;
        this.metadata = builder.metadata;
        this.error = builder.error;
        this.timestamp = builder.timestamp;
    }

    /// @return status indicating success, failure or skip, never null
    public ResultStatus getStatus() {
        return status;
    }

    /// @return output produced by the node, may be null
    public Object getOutput() {
        return output;
    }

    /// @return unmodifiable metadata map, never null
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /// @return the exception, or null if execution succeeded
    public Throwable getError() {
        return error;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public boolean isSuccess() {
        return status == ResultStatus.SUCCESS;
    }

    /// Error text suitable for reports: the message of the error, or a generic description.
    public String getErrorMessage() {
        if (error == null) {
            return status == ResultStatus.FAILURE ? "node execution failed" : null;
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    public static NodeResult success(Object output) {
        return success(output, Map.of());
    }

    /// Creates a success result with output and metadata.
    ///
    /// @param output the execution output, may be null
    /// @param metadata additional metadata, not null
    /// @return new success result, never null
    public static NodeResult success(Object output, Map<String, Object> metadata) {
        return builder().status(ResultStatus.SUCCESS).output(output).metadata(metadata).build();
    }

    /// Creates a failure result from an exception.
    ///
    /// @param error the exception that caused failure, not null
    /// @return new failure result, never null
    public static NodeResult failure(Throwable error) {
        return builder().status(ResultStatus.FAILURE).output(null).error(error).build();
    }

    /// Creates a failure result with an error message.
    ///
    /// @param message description of the failure, not null
    /// @return new failure result, never null
    public static NodeResult failure(String message) {
        return failure(new IllegalStateException(message));
    }

    public static NodeResult skipped(String reason) {
        return builder()
                .status(ResultStatus.SKIPPED)
                .output(null)
                .metadata(Map.of("reason", reason))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "NodeResult{" + status + (error != null ? ", error=" + getErrorMessage() : "") + '}';
    }

    /// Builder for constructing NodeResult instances.
    public static final class Builder {
        private ResultStatus status = ResultStatus.SUCCESS;
        private Object output;
        private Map<String, Object> metadata = Map.of();
        private Throwable error;
        private Instant timestamp = Instant.now();

        private Builder() {}

        public Builder status(ResultStatus status) {
            this.status = status;
            return this;
        }

        public Builder output(Object output) {
            this.output = output;
            return this;
        }

        /// Sets additional metadata.
        ///
        /// @param metadata key-value pairs, not null
        /// @return this builder for chaining
        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = Collections.unmodifiableMap(new HashMap<>(metadata));
            return this;
        }

        public Builder error(Throwable error) {
            this.error = error;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public NodeResult build() {
            return new NodeResult(this);
        }
    }
}
