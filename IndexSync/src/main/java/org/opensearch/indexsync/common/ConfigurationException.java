package org.opensearch.indexsync.common;

/**
 * A required connection option was missing or malformed. Raised before any request is sent.
 */
public class ConfigurationException extends IndexSyncException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
