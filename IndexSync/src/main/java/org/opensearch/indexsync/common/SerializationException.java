package org.opensearch.indexsync.common;

/**
 * A record field could not be converted to JSON. Fatal for that one document.
 */
public class SerializationException extends IndexSyncException {
    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
