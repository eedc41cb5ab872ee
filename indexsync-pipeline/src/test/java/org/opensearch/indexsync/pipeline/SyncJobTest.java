package org.opensearch.indexsync.pipeline;

import java.time.Duration;

import org.opensearch.indexsync.pipeline.ir.SyncState;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyncJobTest {

    @Test
    void abortAfterTheStreamDrainedStillCompletes() {
        var job = new SyncJob("users");
        job.markRunning();
        job.recordScanned();
        job.recordIndexed();
        job.markStreamDrained();

        job.abort();
        var summary = job.finish(null);

        assertEquals(SyncState.COMPLETED, summary.state());
        assertFalse(summary.aborted());
        assertFalse(job.isAbortRequested());
    }

    @Test
    void abortRacingTheDrainIsNotReportedAsACut() {
        var job = new SyncJob("users");
        job.markRunning();
        job.abort();
        job.markStreamDrained();

        var summary = job.finish(null);

        assertEquals(SyncState.COMPLETED, summary.state());
        assertFalse(summary.aborted());
    }

    @Test
    void abortBeforeTheDrainFailsTheJob() {
        var job = new SyncJob("users");
        job.markRunning();
        job.recordScanned();

        job.abort();
        var summary = job.finish(null);

        assertEquals(SyncState.FAILED, summary.state());
        assertTrue(summary.aborted());
        assertEquals(1, summary.scanned());
    }

    @Test
    void progressReflectsLiveCounters() {
        var job = new SyncJob("users");
        assertEquals(SyncState.PENDING, job.progress().state());

        job.markRunning();
        job.recordScanned();
        job.recordScanned();
        job.recordIndexed();
        job.recordFailed();

        var progress = job.progress();
        assertEquals(SyncState.RUNNING, progress.state());
        assertEquals(2, progress.scanned());
        assertEquals(1, progress.indexed());
        assertEquals(1, progress.failed());
        assertEquals(2, progress.attempted());
    }

    @Test
    void completionReplaysToLateSubscribers() {
        var job = new SyncJob("users");
        job.markRunning();
        job.finish(null);

        StepVerifier.create(job.completion())
            .assertNext(summary -> assertEquals(SyncState.COMPLETED, summary.state()))
            .expectComplete()
            .verify(Duration.ofSeconds(5));
    }
}
