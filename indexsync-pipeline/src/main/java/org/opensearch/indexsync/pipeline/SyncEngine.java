package org.opensearch.indexsync.pipeline;

import java.util.function.Consumer;

import org.opensearch.indexsync.common.ConnectionOptions;
import org.opensearch.indexsync.common.IndexClient;
import org.opensearch.indexsync.pipeline.ir.SyncSummary;
import org.opensearch.indexsync.pipeline.source.RecordSource;
import org.opensearch.indexsync.schema.PrimaryRecord;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Re-populates a collection's index from every record in the primary store.
 *
 * Records are read sequentially and written through the same path as single-record indexing, with at most
 * {@code maxInFlight} writes outstanding. A document that fails to serialize or write is counted and skipped; only
 * a failure of the record stream itself fails the job.
 */
@Slf4j
public class SyncEngine {
    public static final int DEFAULT_MAX_IN_FLIGHT = 8;

    private final RecordSource source;
    private final IndexClient indexClient;
    private final int maxInFlight;
    private final Scheduler readScheduler;

    public SyncEngine(RecordSource source, IndexClient indexClient) {
        this(source, indexClient, DEFAULT_MAX_IN_FLIGHT);
    }

    public SyncEngine(RecordSource source, IndexClient indexClient, int maxInFlight) {
        this(source, indexClient, maxInFlight, Schedulers.boundedElastic());
    }

    /**
     * @param readScheduler where the record stream is subscribed; store cursors usually block
     */
    public SyncEngine(RecordSource source, IndexClient indexClient, int maxInFlight, Scheduler readScheduler) {
        if (maxInFlight < 1) {
            throw new IllegalArgumentException("maxInFlight must be at least 1, was " + maxInFlight);
        }
        this.source = source;
        this.indexClient = indexClient;
        this.maxInFlight = maxInFlight;
        this.readScheduler = readScheduler;
    }

    /**
     * Starts a resync and returns immediately.
     *
     * @param options fully resolved options of the collection
     * @throws org.opensearch.indexsync.common.ConfigurationException if host, port, index or type is missing
     */
    public SyncJob resync(IndexedCollection collection, ConnectionOptions options) {
        return resync(collection, options, summary -> {});
    }

    /**
     * @param onFinished called once with the final summary, whatever the outcome
     */
    public SyncJob resync(IndexedCollection collection, ConnectionOptions options, Consumer<SyncSummary> onFinished) {
        options.requireIndexAndType();
        var job = new SyncJob(collection.getName());
        run(job, collection, options)
            .doOnNext(onFinished)
            .subscribe(
                summary -> {},
                error -> log.atError().setMessage("Resync callback for {} failed")
                    .addArgument(collection::getName)
                    .setCause(error)
                    .log()
            );
        return job;
    }

    Mono<SyncSummary> run(SyncJob job, IndexedCollection collection, ConnectionOptions options) {
        return Flux.defer(() -> source.readRecords(collection.getName()))
            .doOnComplete(job::markStreamDrained)
            .subscribeOn(readScheduler)
            .doOnSubscribe(s -> {
                job.markRunning();
                log.info("Starting resync of {} into {}/{}", collection.getName(), options.getIndex(),
                    options.getType());
            })
            .takeUntilOther(job.abortSignal())
            .doOnNext(r -> job.recordScanned())
            .flatMapDelayError(record -> writeRecord(job, collection, options, record), maxInFlight, maxInFlight)
            .then(Mono.fromCallable(() -> job.finish(null)))
            .onErrorResume(error -> {
                log.atError().setMessage("Reading records of {} failed, resync aborted")
                    .addArgument(collection::getName)
                    .setCause(error)
                    .log();
                return Mono.fromCallable(() -> job.finish(error));
            })
            .doOnNext(summary -> log.info("Resync of {} finished: {}", collection.getName(), summary));
    }

    private Mono<Void> writeRecord(SyncJob job, IndexedCollection collection, ConnectionOptions options,
                                   PrimaryRecord record) {
        return Mono.defer(() -> indexClient.index(indexClient.prepare(record, collection.getFieldSet(), options), options))
            .doOnSuccess(body -> job.recordIndexed())
            .onErrorResume(error -> {
                job.recordFailed();
                log.atWarn().setMessage("Record {} of {} was not indexed: {}")
                    .addArgument(record::getId)
                    .addArgument(collection::getName)
                    .addArgument(error::getMessage)
                    .log();
                return Mono.empty();
            })
            .then();
    }
}
