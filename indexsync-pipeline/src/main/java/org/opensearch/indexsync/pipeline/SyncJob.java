package org.opensearch.indexsync.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.opensearch.indexsync.pipeline.ir.SyncState;
import org.opensearch.indexsync.pipeline.ir.SyncSummary;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Handle on one running resync. Counters are live; {@link #completion()} emits the final summary exactly once.
 */
@Slf4j
public class SyncJob {
    @Getter
    private final String collectionName;
    private final AtomicReference<SyncState> state = new AtomicReference<>(SyncState.PENDING);
    private final AtomicLong scanned = new AtomicLong();
    private final AtomicLong indexed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicBoolean abortRequested = new AtomicBoolean();
    private final AtomicBoolean streamDrained = new AtomicBoolean();
    private final Sinks.One<Boolean> abortSignal = Sinks.one();
    private final Sinks.One<SyncSummary> result = Sinks.one();

    SyncJob(String collectionName) {
        this.collectionName = collectionName;
    }

    public SyncState getState() {
        return state.get();
    }

    public SyncSummary progress() {
        return summary(null);
    }

    /** Emits the final summary, also to subscribers that arrive after the job ended. Never errors. */
    public Mono<SyncSummary> completion() {
        return result.asMono();
    }

    public boolean isAbortRequested() {
        return abortRequested.get();
    }

    /**
     * Stops pulling records. Writes already sent are left to finish, then the job ends {@link SyncState#FAILED}.
     * Has no effect once every record has been read.
     */
    public void abort() {
        if (state.get().isTerminal() || streamDrained.get() || !abortRequested.compareAndSet(false, true)) {
            return;
        }
        log.info("Abort requested for resync of {}", collectionName);
        abortSignal.tryEmitValue(Boolean.TRUE);
    }

    Mono<Boolean> abortSignal() {
        return abortSignal.asMono();
    }

    void markRunning() {
        state.compareAndSet(SyncState.PENDING, SyncState.RUNNING);
    }

    /** The record stream completed on its own, so an abort arriving now cut nothing. */
    void markStreamDrained() {
        streamDrained.set(true);
    }

    void recordScanned() {
        scanned.incrementAndGet();
    }

    void recordIndexed() {
        indexed.incrementAndGet();
    }

    void recordFailed() {
        failed.incrementAndGet();
    }

    SyncSummary finish(Throwable cause) {
        var finalState = cause == null && !wasCutShort() ? SyncState.COMPLETED : SyncState.FAILED;
        state.set(finalState);
        var summary = summary(cause);
        result.tryEmitValue(summary);
        return summary;
    }

    private boolean wasCutShort() {
        return abortRequested.get() && !streamDrained.get();
    }

    private SyncSummary summary(Throwable cause) {
        return new SyncSummary(collectionName, state.get(), scanned.get(), indexed.get(), failed.get(),
            wasCutShort(), cause);
    }
}
