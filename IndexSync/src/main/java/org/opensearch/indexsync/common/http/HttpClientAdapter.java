package org.opensearch.indexsync.common.http;

import java.util.List;
import java.util.Map;

import reactor.core.publisher.Mono;

/**
 * Interface for HTTP client adapters. This abstraction allows for different HTTP client implementations
 * to be used with the RestClient, and is the seam tests use to stand in for a search service.
 */
public interface HttpClientAdapter {
    /**
     * Performs an HTTP request.
     *
     * @param method The HTTP method (GET, PUT, DELETE, etc.)
     * @param uri The absolute request uri, including scheme, host and port
     * @param body The request body, or null if no body
     * @param headers The request headers
     * @return A cold Mono that emits the HTTP response once subscribed
     */
    Mono<HttpResponse> request(String method, String uri, String body, Map<String, List<String>> headers);
}
