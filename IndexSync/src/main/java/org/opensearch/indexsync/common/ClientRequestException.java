package org.opensearch.indexsync.common;

import org.opensearch.indexsync.common.http.HttpResponse;

/**
 * The search service rejected the request with a 4xx status. Never retried.
 */
public class ClientRequestException extends IndexSyncException {
    public final transient HttpResponse response;

    public ClientRequestException(String message, HttpResponse response) {
        super(message + "\nBody:\n" + response);
        this.response = response;
    }
}
