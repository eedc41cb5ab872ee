package org.opensearch.indexsync.search;

import com.fasterxml.jackson.databind.node.ObjectNode;

public record SearchHit(
    String id,
    String index,
    String type,
    Double score,
    ObjectNode source
) {}
