package io.opgraph.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.opgraph.core.record.WorkflowRecord;

/// Jackson mixin that binds `WorkflowRecord` deserialization to its builder.
///
/// The `fields`, `vars` and `history` accessors are views into `data` and are left out of
/// the JSON so each section appears once.
///
/// @see WorkflowRecordBuilderMixin
/// @see io.opgraph.serialization.OpgraphJacksonModule
@JsonDeserialize(builder = WorkflowRecord.Builder.class)
@JsonIgnoreProperties({"fields", "vars", "history"})
public abstract class WorkflowRecordMixin {}
