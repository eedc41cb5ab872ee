package org.opensearch.indexsync.search;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * What to search for and where. Either carries a ready-made request {@code body}, or the structured parameters
 * below, which are shaped into a request body without interpreting the query text.
 */
@Value
@Builder(toBuilder = true)
public class SearchQuery {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    /** Collections to search; empty means every collection. Only used by cross-collection searches. */
    @Singular
    List<String> collections;

    /** Sent as-is when set; every structured parameter is then ignored. */
    ObjectNode body;

    /** Free text handed to the engine's query_string query. */
    String query;
    @Singular
    List<String> fields;
    String fuzziness;
    /** 1-based. */
    Integer page;
    Integer pageSize;
    /** Exact-match filters, field to value. */
    @Singular
    Map<String, Object> filters;

    public boolean hasCollections() {
        return collections != null && !collections.isEmpty();
    }

    public ObjectNode toRequestBody() {
        if (body != null) {
            return body.deepCopy();
        }
        var root = OBJECT_MAPPER.createObjectNode();
        if (pageSize != null) {
            int currentPage = page == null || page < 1 ? 1 : page;
            root.put("from", (currentPage - 1) * pageSize);
            root.put("size", pageSize);
        }
        var textQuery = textQuery();
        if (filters.isEmpty()) {
            root.set("query", textQuery);
        } else {
            var bool = root.putObject("query").putObject("bool");
            bool.putArray("must").add(textQuery);
            ArrayNode filterArray = bool.putArray("filter");
            filters.forEach((field, value) ->
                filterArray.addObject().putObject("term").set(field, OBJECT_MAPPER.valueToTree(value)));
        }
        return root;
    }

    private ObjectNode textQuery() {
        var node = OBJECT_MAPPER.createObjectNode();
        if (query == null || query.isBlank()) {
            node.putObject("match_all");
            return node;
        }
        var queryString = node.putObject("query_string");
        queryString.put("query", query);
        if (!fields.isEmpty()) {
            var fieldArray = queryString.putArray("fields");
            fields.forEach(fieldArray::add);
        }
        if (fuzziness != null) {
            queryString.put("fuzziness", fuzziness);
        }
        return node;
    }
}
