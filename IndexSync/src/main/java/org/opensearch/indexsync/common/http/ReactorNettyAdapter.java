package org.opensearch.indexsync.common.http;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

/**
 * Implementation of HttpClientAdapter using Reactor Netty.
 */
public class ReactorNettyAdapter implements HttpClientAdapter {
    public static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient client;

    /**
     * @param maxConnections If &gt; 0, an HttpClient will be created with a provider
     *                       that uses this value for maxConnections.  Otherwise, a client
     *                       will be created with default values provided by Reactor.
     */
    public ReactorNettyAdapter(int maxConnections) {
        this(maxConnections <= 0
            ? HttpClient.create()
            : HttpClient.create(ConnectionProvider.create("IndexSyncClient", maxConnections)));
    }

    public ReactorNettyAdapter(HttpClient client) {
        this.client = client
            .responseTimeout(DEFAULT_RESPONSE_TIMEOUT)
            .keepAlive(true);
    }

    @Override
    public Mono<HttpResponse> request(String method, String uri, String body, Map<String, List<String>> headers) {
        var payload = Mono.justOrEmpty(body)
            .map(b -> Unpooled.wrappedBuffer(b.getBytes(StandardCharsets.UTF_8)));
        return client
            .headers(h -> headers.forEach(h::add))
            .request(HttpMethod.valueOf(method))
            .uri(uri)
            .send(payload)
            .responseSingle(
                (response, bytes) -> bytes.asString()
                    .singleOptional()
                    .map(bodyOp -> new HttpResponse(
                        response.status().code(),
                        response.status().reasonPhrase(),
                        extractHeaders(response.responseHeaders()),
                        bodyOp.orElse(null)
                    ))
            );
    }

    private static Map<String, String> extractHeaders(HttpHeaders headers) {
        return headers.entries().stream()
            .collect(Collectors.toMap(
                Map.Entry::getKey,
                Map.Entry::getValue,
                (v1, v2) -> v1 + "," + v2
            ));
    }
}
