package io.opgraph.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import io.opgraph.core.execution.NodeResult;

/// Jackson mixin for `NodeResult.Builder`.
///
/// `errorMessage` and `success` are derived on write and skipped on read; a restored
/// failure keeps its status but not the original exception.
///
/// @see NodeResultMixin
@JsonPOJOBuilder(withPrefix = "")
@JsonIgnoreProperties(value = {"errorMessage", "success"}, ignoreUnknown = true)
public abstract class NodeResultBuilderMixin {

    @JsonIgnore
    public abstract NodeResult.Builder error(Throwable error);
}
