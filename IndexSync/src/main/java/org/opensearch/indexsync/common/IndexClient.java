package org.opensearch.indexsync.common;

import java.net.HttpURLConnection;
import java.util.Set;
import java.util.function.Consumer;

import org.opensearch.indexsync.common.http.HttpResponse;
import org.opensearch.indexsync.schema.DocumentSerializer;
import org.opensearch.indexsync.schema.IndexDocument;
import org.opensearch.indexsync.schema.PrimaryRecord;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

/**
 * Per-record index and unindex operations. Both are idempotent (replace by id, delete by id), which is what makes
 * retrying them safe.
 */
@Slf4j
public class IndexClient {
    @Getter
    private final RequestBackoff requestBackoff;
    @Getter
    private final DocumentSerializer serializer;

    public IndexClient(RequestBackoff requestBackoff) {
        this(requestBackoff, new DocumentSerializer());
    }

    public IndexClient(RequestBackoff requestBackoff, DocumentSerializer serializer) {
        this.requestBackoff = requestBackoff;
        this.serializer = serializer;
    }

    /**
     * Builds the document for a record. Index and type come from {@code options} as they are right now.
     *
     * @throws ConfigurationException if host, port, index or type is missing
     * @throws SerializationException if a selected field cannot be written as JSON
     */
    public IndexDocument prepare(PrimaryRecord record, Set<String> fieldSet, ConnectionOptions options) {
        options.requireIndexAndType();
        return serializer.toIndexDocument(record, fieldSet, options.getIndex(), options.getType());
    }

    /** Create-or-replace. Emits the response body. */
    public Mono<String> index(IndexDocument document, ConnectionOptions endpoint) {
        var request = RequestDescriptor.builder()
            .method("PUT")
            .endpoint(endpoint)
            .path(document.path())
            .body(document.body().toString())
            .build();
        return requestBackoff.execute(request)
            .doOnSuccess(r -> log.atDebug().setMessage("Indexed {} with status {}")
                .addArgument(document::path)
                .addArgument(() -> r.statusCode)
                .log())
            .map(IndexClient::bodyOf);
    }

    /** Delete by id; a document that is already gone counts as deleted. Emits the response body. */
    public Mono<String> unindex(String id, ConnectionOptions endpoint) {
        endpoint.requireIndexAndType();
        var request = RequestDescriptor.builder()
            .method("DELETE")
            .endpoint(endpoint)
            .path(IndexDocument.documentPath(endpoint.getIndex(), endpoint.getType(), id))
            .toleratedStatusCodes(Set.of(HttpURLConnection.HTTP_NOT_FOUND))
            .build();
        return requestBackoff.execute(request)
            .doOnSuccess(r -> {
                if (r.statusCode == HttpURLConnection.HTTP_NOT_FOUND) {
                    log.debug("Document {} was not in the index, nothing to delete", request.getPath());
                }
            })
            .map(IndexClient::bodyOf);
    }

    /**
     * Serializes the record and sends it off without waiting. The outcome arrives on {@code listener}; nothing is
     * thrown once the request has been dispatched.
     *
     * @throws ConfigurationException if host, port, index or type is missing
     * @throws SerializationException if a selected field cannot be written as JSON
     */
    public Disposable indexRecord(PrimaryRecord record, Set<String> fieldSet, ConnectionOptions options,
                                  IndexingListener listener) {
        var document = prepare(record, fieldSet, options);
        return index(document, options).subscribe(
            body -> notify(record, l -> l.onIndexed(record, body), listener),
            error -> notify(record, l -> l.onError(record, wrap(IndexOperationFailed.Operation.INDEX, record, error)),
                listener)
        );
    }

    /**
     * Removes the record's document without waiting; also the path for records that are only flagged deleted in
     * the primary store.
     *
     * @throws ConfigurationException if host, port, index or type is missing
     */
    public Disposable unindexRecord(PrimaryRecord record, ConnectionOptions options, IndexingListener listener) {
        options.requireIndexAndType();
        return unindex(record.getId(), options).subscribe(
            body -> notify(record, l -> l.onUnindexed(record, body), listener),
            error -> notify(record, l -> l.onError(record, wrap(IndexOperationFailed.Operation.UNINDEX, record, error)),
                listener)
        );
    }

    static IndexOperationFailed wrap(IndexOperationFailed.Operation operation, PrimaryRecord record, Throwable error) {
        if (error instanceof IndexOperationFailed) {
            return (IndexOperationFailed) error;
        }
        return new IndexOperationFailed(operation, record.getId(), error);
    }

    private static void notify(PrimaryRecord record, Consumer<IndexingListener> call, IndexingListener listener) {
        try {
            call.accept(listener);
        } catch (RuntimeException e) {
            log.atError().setMessage("Indexing listener threw while handling record {}")
                .addArgument(record::getId)
                .setCause(e)
                .log();
        }
    }

    private static String bodyOf(HttpResponse response) {
        return response.body == null ? "" : response.body;
    }
}
