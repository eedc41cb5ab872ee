package org.opensearch.indexsync.pipeline;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.opensearch.indexsync.common.http.HttpClientAdapter;
import org.opensearch.indexsync.common.http.HttpResponse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import reactor.core.publisher.Mono;

/**
 * In-memory stand-in for the search service. Keeps documents keyed by {@code index/type/id}, answers searches with
 * a substring match on the stored source, and records how many requests were outstanding at once.
 */
class FakeSearchService implements HttpClientAdapter {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final Map<String, ObjectNode> documents = new ConcurrentSkipListMap<>();
    private final Set<String> rejectedIds = ConcurrentHashMap.newKeySet();
    private final Duration latency;
    private final AtomicInteger inFlight = new AtomicInteger();
    @Getter
    private final AtomicInteger maxObservedInFlight = new AtomicInteger();
    @Getter
    private final AtomicInteger requestCount = new AtomicInteger();

    FakeSearchService() {
        this(Duration.ZERO);
    }

    FakeSearchService(Duration latency) {
        this.latency = latency;
    }

    /** Writes of these ids are answered with a 400. */
    void reject(String id) {
        rejectedIds.add(id);
    }

    ObjectNode document(String index, String type, String id) {
        return documents.get(index + "/" + type + "/" + id);
    }

    int size() {
        return documents.size();
    }

    @Override
    public Mono<HttpResponse> request(String method, String uri, String body, Map<String, List<String>> headers) {
        return Mono.fromCallable(() -> {
                requestCount.incrementAndGet();
                maxObservedInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                return handle(method, uri, body);
            })
            .delayElement(latency)
            .doFinally(signal -> inFlight.decrementAndGet());
    }

    private HttpResponse handle(String method, String uri, String body) throws JsonProcessingException {
        var rawPath = URI.create(uri).getRawPath().substring(1);
        if (rawPath.endsWith("/_search")) {
            return search(rawPath.substring(0, rawPath.length() - "/_search".length()), body);
        }
        var segments = rawPath.split("/");
        var id = URLDecoder.decode(segments[2], StandardCharsets.UTF_8);
        var key = segments[0] + "/" + segments[1] + "/" + id;
        switch (method) {
            case "PUT":
                if (rejectedIds.contains(id)) {
                    return response(400, "{\"error\":\"mapper_parsing_exception\"}");
                }
                var created = documents.put(key, (ObjectNode) OBJECT_MAPPER.readTree(body)) == null;
                return response(created ? 201 : 200, "{\"result\":\"" + (created ? "created" : "updated") + "\"}");
            case "DELETE":
                return documents.remove(key) != null
                    ? response(200, "{\"result\":\"deleted\"}")
                    : response(404, "{\"result\":\"not_found\"}");
            default:
                return response(405, "{}");
        }
    }

    private HttpResponse search(String target, String body) throws JsonProcessingException {
        var text = body == null ? "" : OBJECT_MAPPER.readTree(body)
            .path("query").findPath("query_string").path("query").asText("");
        var parts = target.split("/");
        var hits = OBJECT_MAPPER.createArrayNode();
        documents.forEach((key, source) -> {
            var keyParts = key.split("/", 3);
            boolean targeted = parts.length == 2
                ? keyParts[0].equals(parts[0]) && keyParts[1].equals(parts[1])
                : matchesAny(parts[0].split(","), keyParts[0]);
            if (targeted && matchesText(source, text)) {
                hits.addObject()
                    .put("_id", keyParts[2])
                    .put("_index", keyParts[0])
                    .put("_type", keyParts[1])
                    .put("_score", 1.0)
                    .set("_source", source);
            }
        });
        var root = OBJECT_MAPPER.createObjectNode();
        var hitsNode = root.putObject("hits");
        hitsNode.putObject("total").put("value", hits.size());
        hitsNode.set("hits", hits);
        return response(200, root.toString());
    }

    private static boolean matchesAny(String[] targets, String index) {
        for (var target : targets) {
            if (target.equals("_all") || target.equals(index)
                || (target.endsWith("*") && index.startsWith(target.substring(0, target.length() - 1)))) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesText(JsonNode source, String text) {
        return text.isBlank() || source.toString().toLowerCase(Locale.ROOT).contains(text.toLowerCase(Locale.ROOT));
    }

    private static HttpResponse response(int status, String body) {
        return new HttpResponse(status, "", Map.of(), body);
    }
}
