package io.opgraph.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.opgraph.core.execution.NodeResult;

/// Jackson mixin that binds `NodeResult` deserialization to its builder and keeps the raw
/// `Throwable` out of the JSON. The readable `errorMessage` is written instead.
///
/// @see NodeResultBuilderMixin
@JsonDeserialize(builder = NodeResult.Builder.class)
public abstract class NodeResultMixin {

    /// @return the execution error, may be null
    @JsonIgnore
    public abstract Throwable getError();
}
