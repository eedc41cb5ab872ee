package org.opensearch.indexsync.schema;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Payload of a single index request. Its id is always the originating record's id.
 */
public record IndexDocument(
    String index,
    String type,
    String id,
    ObjectNode body
) {
    /** Relative request path, {@code index/type/id}. */
    public String path() {
        return documentPath(index, type, id);
    }

    public static String documentPath(String index, String type, String id) {
        return index + "/" + type + "/" + encodePathSegment(id);
    }

    static String encodePathSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
