package io.opgraph.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/// Jackson mixin for `WorkflowRecord.Builder`: setter names match JSON field names.
///
/// @see WorkflowRecordMixin
@JsonPOJOBuilder(withPrefix = "")
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class WorkflowRecordBuilderMixin {}
