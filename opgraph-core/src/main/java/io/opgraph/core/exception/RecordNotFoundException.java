package io.opgraph.core.exception;

import java.io.Serial;

public class RecordNotFoundException extends OpgraphException {

    @Serial private static final long serialVersionUID = 7736302164815590223L;

    private final String recordId;

    public RecordNotFoundException(String workflowId, String recordId) {
        super("Record not found in workflow " + workflowId + ": " + recordId);
        this.recordId = recordId;
    }

    public String getRecordId() {
        return recordId;
    }
}
