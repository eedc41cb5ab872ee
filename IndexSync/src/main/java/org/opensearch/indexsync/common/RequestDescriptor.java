package org.opensearch.indexsync.common;

import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One logical request to the search service.
 */
@Value
@Builder
public class RequestDescriptor {
    @NonNull
    String method;
    @NonNull
    ConnectionOptions endpoint;
    @NonNull
    String path;
    String body;
    /** Non-2xx status codes that still count as success, e.g. 404 for a delete. */
    @Builder.Default
    Set<Integer> toleratedStatusCodes = Set.of();

    public boolean isTolerated(int statusCode) {
        return toleratedStatusCodes.contains(statusCode);
    }

    public String describe() {
        return method + " " + path;
    }
}
