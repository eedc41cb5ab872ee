package org.opensearch.indexsync.pipeline;

import org.opensearch.indexsync.common.BackoffPolicy;
import org.opensearch.indexsync.common.ConfigRegistry;
import org.opensearch.indexsync.common.ConnectionOptions;
import org.opensearch.indexsync.common.IndexClient;
import org.opensearch.indexsync.common.IndexingListener;
import org.opensearch.indexsync.common.RequestBackoff;
import org.opensearch.indexsync.common.http.RestClient;
import org.opensearch.indexsync.pipeline.source.RecordSource;
import org.opensearch.indexsync.search.SearchGateway;
import org.opensearch.indexsync.search.SearchQuery;
import org.opensearch.indexsync.search.SearchResult;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Entry point for an application: owns the process-wide defaults and the shared clients, registers collections,
 * and searches across them.
 */
@Slf4j
@Getter
public class IndexSync {
    private final ConfigRegistry configRegistry;
    private final IndexClient indexClient;
    private final SearchGateway searchGateway;
    private final SyncEngine syncEngine;

    public IndexSync(ConfigRegistry configRegistry, IndexClient indexClient, SearchGateway searchGateway,
                     SyncEngine syncEngine) {
        this.configRegistry = configRegistry;
        this.indexClient = indexClient;
        this.searchGateway = searchGateway;
        this.syncEngine = syncEngine;
    }

    public static IndexSync create(ConfigRegistry configRegistry, RecordSource recordSource) {
        return create(configRegistry, recordSource, new RestClient(), BackoffPolicy.DEFAULT,
            SyncEngine.DEFAULT_MAX_IN_FLIGHT);
    }

    public static IndexSync create(ConfigRegistry configRegistry,
                                   RecordSource recordSource,
                                   RestClient restClient,
                                   BackoffPolicy backoffPolicy,
                                   int maxInFlight) {
        var requestBackoff = new RequestBackoff(restClient, backoffPolicy);
        var indexClient = new IndexClient(requestBackoff);
        return new IndexSync(
            configRegistry,
            indexClient,
            new SearchGateway(configRegistry, requestBackoff),
            new SyncEngine(recordSource, indexClient, maxInFlight)
        );
    }

    /** Sets process-wide defaults; only the keys present in {@code options} change. */
    public ConnectionOptions configureSearch(ConnectionOptions options) {
        return configRegistry.configure(options);
    }

    /**
     * @return the listener to hand to the primary store's change hooks for this collection
     */
    public CollectionIndexer register(IndexedCollection collection, IndexingListener listener) {
        log.info("Registered collection {} with searchable fields {}", collection.getName(), collection.getFieldSet());
        return new CollectionIndexer(collection, configRegistry, indexClient, searchGateway, syncEngine, listener);
    }

    /** Searches across collections using the stored defaults. */
    public Mono<SearchResult> search(SearchQuery query) {
        return searchGateway.search(query, null);
    }

    public Mono<SearchResult> search(SearchQuery query, ConnectionOptions override) {
        return searchGateway.search(query, override);
    }
}
