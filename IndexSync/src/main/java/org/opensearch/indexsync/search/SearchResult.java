package org.opensearch.indexsync.search;

import java.util.List;

/**
 * Engine-neutral search result: matching documents in ranking order plus the total match count.
 */
public record SearchResult(
    long total,
    List<SearchHit> hits
) {
    public static final SearchResult EMPTY = new SearchResult(0, List.of());
}
