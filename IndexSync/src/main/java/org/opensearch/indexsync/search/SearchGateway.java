package org.opensearch.indexsync.search;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.opensearch.indexsync.common.ConfigRegistry;
import org.opensearch.indexsync.common.ConnectionOptions;
import org.opensearch.indexsync.common.IndexSyncException;
import org.opensearch.indexsync.common.RequestBackoff;
import org.opensearch.indexsync.common.RequestDescriptor;
import org.opensearch.indexsync.common.http.HttpResponse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Runs searches against one collection, several, or every collection under a prefix, and hides the engine's
 * response envelope behind {@link SearchResult}.
 */
@Slf4j
public class SearchGateway {
    public static final String ALL_COLLECTIONS = "_all";
    public static final String SEARCH_ENDPOINT =
        "_search?search_type=dfs_query_then_fetch&preference=_primary_first";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final ConfigRegistry configRegistry;
    private final RequestBackoff requestBackoff;

    public SearchGateway(ConfigRegistry configRegistry, RequestBackoff requestBackoff) {
        this.configRegistry = configRegistry;
        this.requestBackoff = requestBackoff;
    }

    /**
     * Searches the collections named by the query, resolved against the prefix in effect.
     *
     * @param override per-call options, merged over the registry defaults; may be null
     * @throws org.opensearch.indexsync.common.ConfigurationException if no host or port is known
     */
    public Mono<SearchResult> search(SearchQuery query, ConnectionOptions override) {
        var options = configRegistry.resolve(override);
        var targets = resolveTargets(query.getCollections(), options.getPrefix());
        return execute(options, String.join(",", targets) + "/" + SEARCH_ENDPOINT, query);
    }

    /**
     * Searches a single collection's index and type.
     *
     * @param collectionOptions fully resolved options of the collection
     */
    public Mono<SearchResult> searchCollection(SearchQuery query, ConnectionOptions collectionOptions) {
        collectionOptions.requireIndexAndType();
        var path = collectionOptions.getIndex() + "/" + collectionOptions.getType() + "/" + SEARCH_ENDPOINT;
        return execute(collectionOptions, path, query);
    }

    /**
     * With a prefix, listed collections become {@code prefix-name} and no collections becomes {@code prefix*}.
     * Without one, listed names are used as they are and no collections means {@link #ALL_COLLECTIONS}.
     */
    public static List<String> resolveTargets(List<String> collections, String prefix) {
        boolean hasCollections = collections != null && !collections.isEmpty();
        boolean hasPrefix = prefix != null && !prefix.isEmpty();
        if (hasPrefix) {
            if (hasCollections) {
                return collections.stream().map(c -> prefix + "-" + c).collect(Collectors.toList());
            }
            return List.of(prefix + "*");
        }
        return hasCollections ? List.copyOf(collections) : List.of(ALL_COLLECTIONS);
    }

    private Mono<SearchResult> execute(ConnectionOptions options, String path, SearchQuery query) {
        var request = RequestDescriptor.builder()
            .method("GET")
            .endpoint(options)
            .path(path)
            .body(query.toRequestBody().toString())
            .build();
        log.atDebug().setMessage("Searching {} with {}").addArgument(path).addArgument(request::getBody).log();
        return requestBackoff.execute(request).map(SearchGateway::normalize);
    }

    static SearchResult normalize(HttpResponse response) {
        if (response.body == null || response.body.isEmpty()) {
            return SearchResult.EMPTY;
        }
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(response.body);
        } catch (JsonProcessingException e) {
            throw new IndexSyncException("Search response could not be parsed: " + e.getOriginalMessage(), e);
        }
        var hitsNode = root.path("hits");
        var totalNode = hitsNode.path("total");
        long total = totalNode.isObject() ? totalNode.path("value").asLong() : totalNode.asLong();

        var hits = new ArrayList<SearchHit>();
        for (var hit : hitsNode.path("hits")) {
            var score = hit.path("_score");
            var source = hit.path("_source");
            hits.add(new SearchHit(
                hit.path("_id").asText(null),
                hit.path("_index").asText(null),
                hit.path("_type").asText(null),
                score.isNumber() ? score.asDouble() : null,
                source.isObject() ? (ObjectNode) source : OBJECT_MAPPER.createObjectNode()
            ));
        }
        return new SearchResult(total, List.copyOf(hits));
    }
}
