package org.opensearch.indexsync.common;

import lombok.Getter;

/**
 * Payload of the {@code error} notification: wraps whatever made an index or unindex operation fail.
 */
@Getter
public class IndexOperationFailed extends IndexSyncException {
    public enum Operation {
        INDEX,
        UNINDEX
    }

    private final Operation operation;
    private final String documentId;

    public IndexOperationFailed(Operation operation, String documentId, Throwable cause) {
        super(describe(operation) + " error for document " + documentId + ": " + cause.getMessage(), cause);
        this.operation = operation;
        this.documentId = documentId;
    }

    private static String describe(Operation operation) {
        return operation == Operation.INDEX ? "Search document indexing" : "Search document index deletion";
    }
}
