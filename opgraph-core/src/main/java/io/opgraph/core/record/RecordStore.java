package io.opgraph.core.record;

import io.opgraph.core.exception.RecordNotFoundException;
import java.util.List;
import java.util.Optional;

/// Persistence for workflow records.
///
/// Record ids are unique per workflow. Query patterns are globs where `*` matches any run
/// of characters (`email_*`); a null or blank pattern matches everything.
///
/// @see InMemoryRecordStore for the in-memory implementation
public interface RecordStore {

    /// Saves a record according to the mode.
    ///
    /// @param record the record to persist, not null
    /// @param mode create, update or upsert semantics, not null
    /// @return the stored record
    /// @throws io.opgraph.core.exception.ValidationException if `CREATE` finds an existing record
    /// @throws RecordNotFoundException if `UPDATE` finds none
    WorkflowRecord save(WorkflowRecord record, SaveMode mode);

    Optional<WorkflowRecord> find(String workflowId, String recordId);

    /// @throws RecordNotFoundException if absent
    default WorkflowRecord get(String workflowId, String recordId) {
        return find(workflowId, recordId)
                .orElseThrow(() -> new RecordNotFoundException(workflowId, recordId));
    }

    /// @return true if a record was removed
    boolean delete(String workflowId, String recordId);

    /// Deletes every record matching the pattern.
    ///
    /// @return number of records removed
    int clearAll(String workflowId, String pattern);

    /// @return matching records ordered by record id, never null
    List<WorkflowRecord> queryRecords(String workflowId, String pattern);

    /// Writes a value at a dotted path inside the record data, for example
    /// `vars.classification`. A path without a reserved section prefix is written under
    /// `vars`.
    ///
    /// @throws RecordNotFoundException if absent
    WorkflowRecord updateVar(String workflowId, String recordId, String path, Object value);

    /// Appends an entry to the record's history.
    ///
    /// @throws RecordNotFoundException if absent
    WorkflowRecord appendHistory(String workflowId, String recordId, Object entry);

    /// Moves the record to a new status. Moving to `FAILED` increments the retry count and
    /// keeps the error message; moving to `COMPLETE` sets the processed timestamp and clears it.
    ///
    /// @throws RecordNotFoundException if absent
    WorkflowRecord updateStatus(
            String workflowId, String recordId, RecordStatus status, String errorMessage);
}
