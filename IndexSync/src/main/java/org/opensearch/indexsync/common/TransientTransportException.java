package org.opensearch.indexsync.common;

import org.opensearch.indexsync.common.http.HttpResponse;

/**
 * Connection failure, timeout or 5xx response. Retried by {@link RequestBackoff}.
 */
public class TransientTransportException extends IndexSyncException {
    public final transient HttpResponse response;

    public TransientTransportException(String message, Throwable cause) {
        super(message, cause);
        this.response = null;
    }

    public TransientTransportException(String message, HttpResponse response) {
        super(message + "\nBody:\n" + response);
        this.response = response;
    }
}
