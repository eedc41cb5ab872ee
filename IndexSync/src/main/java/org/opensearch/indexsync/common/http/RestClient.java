package org.opensearch.indexsync.common.http;

import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.opensearch.indexsync.common.ConnectionOptions;

import lombok.Getter;
import reactor.core.publisher.Mono;

/**
 * Sends JSON requests to the search service. The endpoint is taken from the {@link ConnectionOptions} passed with
 * each call, so nothing about the target is cached between requests.
 */
public class RestClient {
    @Getter
    protected final HttpClientAdapter httpClientAdapter;

    private static final String USER_AGENT_HEADER_NAME = "User-Agent";
    private static final String CONTENT_TYPE_HEADER_NAME = "Content-Type";
    private static final String HOST_HEADER_NAME = "Host";

    private static final String USER_AGENT = "IndexSync-1.0";
    private static final String JSON_CONTENT_TYPE = "application/json";

    public RestClient() {
        this(0);
    }

    /**
     * @param maxConnections If &gt; 0, bounds the size of the underlying connection pool.
     */
    public RestClient(int maxConnections) {
        this(new ReactorNettyAdapter(maxConnections));
    }

    public RestClient(HttpClientAdapter httpClientAdapter) {
        this.httpClientAdapter = httpClientAdapter;
    }

    /**
     * Gets the host header value for an endpoint, leaving out the port when it is the scheme's default.
     */
    public static String getHostHeaderValue(ConnectionOptions endpoint) {
        var uri = URI.create(endpoint.baseUri());
        String host = uri.getHost();
        int port = uri.getPort();
        if ("http".equals(uri.getScheme())) {
            if (port == -1 || port == 80) {
                return host;
            }
        } else if ("https".equals(uri.getScheme())) {
            if (port == -1 || port == 443) {
                return host;
            }
        } else {
            throw new IllegalArgumentException("Unexpected protocol " + uri.getScheme());
        }
        return host + ":" + port;
    }

    /**
     * Performs an HTTP request.
     *
     * @param method The HTTP method
     * @param endpoint Host and port to send to
     * @param path The request path, relative to the endpoint, optionally with a query string
     * @param body The request body, or null
     * @return A cold Mono that emits the HTTP response
     */
    public Mono<HttpResponse> asyncRequest(String method, ConnectionOptions endpoint, String path, String body) {
        return Mono.defer(() -> {
            var uri = endpoint.baseUri() + "/" + path;
            return httpClientAdapter.request(method, uri, body, prepareHeaders(endpoint, body));
        });
    }

    protected Map<String, List<String>> prepareHeaders(ConnectionOptions endpoint, String body) {
        Map<String, List<String>> headers = new HashMap<>();
        headers.put(USER_AGENT_HEADER_NAME, List.of(USER_AGENT));
        headers.put(HOST_HEADER_NAME, List.of(getHostHeaderValue(endpoint)));
        if (body != null) {
            headers.put(CONTENT_TYPE_HEADER_NAME, List.of(JSON_CONTENT_TYPE));
        }
        return headers;
    }
}
