package org.opensearch.indexsync.common;

/**
 * Root of the exceptions raised while keeping a search index in step with the primary store.
 */
public class IndexSyncException extends RuntimeException {
    public IndexSyncException(String message) {
        super(message);
    }

    public IndexSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
