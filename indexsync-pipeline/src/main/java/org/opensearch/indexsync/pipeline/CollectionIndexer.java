package org.opensearch.indexsync.pipeline;

import java.util.function.Consumer;

import org.opensearch.indexsync.common.ConfigRegistry;
import org.opensearch.indexsync.common.ConnectionOptions;
import org.opensearch.indexsync.common.IndexClient;
import org.opensearch.indexsync.common.IndexOperationFailed;
import org.opensearch.indexsync.common.IndexSyncException;
import org.opensearch.indexsync.common.IndexingListener;
import org.opensearch.indexsync.pipeline.ir.SyncSummary;
import org.opensearch.indexsync.pipeline.source.RecordLifecycleListener;
import org.opensearch.indexsync.schema.PrimaryRecord;
import org.opensearch.indexsync.schema.SchemaDescriptor;
import org.opensearch.indexsync.search.SearchGateway;
import org.opensearch.indexsync.search.SearchQuery;
import org.opensearch.indexsync.search.SearchResult;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Keeps one collection's index in step with the primary store: saves are indexed, removals unindexed, and the
 * whole collection can be resynced or searched. Options are resolved on every call so that configuration changes
 * apply to the next operation.
 */
@Slf4j
public class CollectionIndexer implements RecordLifecycleListener {
    @Getter
    private final IndexedCollection collection;
    private final ConfigRegistry configRegistry;
    private final IndexClient indexClient;
    private final SearchGateway searchGateway;
    private final SyncEngine syncEngine;
    private final IndexingListener listener;

    public CollectionIndexer(IndexedCollection collection,
                             ConfigRegistry configRegistry,
                             IndexClient indexClient,
                             SearchGateway searchGateway,
                             SyncEngine syncEngine,
                             IndexingListener listener) {
        this.collection = collection;
        this.configRegistry = configRegistry;
        this.indexClient = indexClient;
        this.searchGateway = searchGateway;
        this.syncEngine = syncEngine;
        this.listener = listener == null ? IndexingListener.LOGGING : listener;
    }

    /** Options for the next operation: collection values, then registry defaults, then built-ins. */
    public ConnectionOptions currentOptions() {
        return configRegistry.resolveFor(collection.getName(), collection.getOptions());
    }

    @Override
    public void onRecordSaved(PrimaryRecord record, SchemaDescriptor schema) {
        warnOnForeignSchema(schema);
        try {
            indexClient.indexRecord(record, collection.getFieldSet(), currentOptions(), listener);
        } catch (IndexSyncException e) {
            reportError(record, new IndexOperationFailed(IndexOperationFailed.Operation.INDEX, record.getId(), e));
        }
    }

    @Override
    public void onRecordRemoved(PrimaryRecord record, SchemaDescriptor schema) {
        warnOnForeignSchema(schema);
        deleteFromIndex(record);
    }

    /**
     * Removes the record's document while the record stays in the primary store, for stores that flag records as
     * deleted instead of removing them.
     */
    public void deleteFromIndex(PrimaryRecord record) {
        try {
            indexClient.unindexRecord(record, currentOptions(), listener);
        } catch (IndexSyncException e) {
            reportError(record, new IndexOperationFailed(IndexOperationFailed.Operation.UNINDEX, record.getId(), e));
        }
    }

    /**
     * @throws org.opensearch.indexsync.common.ConfigurationException if no host or port is known
     */
    public SyncJob resync() {
        return syncEngine.resync(collection, currentOptions());
    }

    public SyncJob resync(Consumer<SyncSummary> onFinished) {
        return syncEngine.resync(collection, currentOptions(), onFinished);
    }

    /**
     * @throws org.opensearch.indexsync.common.ConfigurationException if no host or port is known
     */
    public Mono<SearchResult> search(SearchQuery query) {
        return searchGateway.searchCollection(query, currentOptions());
    }

    private void reportError(PrimaryRecord record, IndexOperationFailed error) {
        try {
            listener.onError(record, error);
        } catch (RuntimeException e) {
            log.atError().setMessage("Indexing listener threw while handling record {}")
                .addArgument(record::getId)
                .setCause(e)
                .log();
        }
    }

    private void warnOnForeignSchema(SchemaDescriptor schema) {
        if (schema != null && !schema.equals(collection.getSchema())) {
            log.warn("Event for {} carried a schema other than the registered one; using the registered fields {}",
                collection.getName(), collection.getFieldSet());
        }
    }
}
