package org.opensearch.indexsync.pipeline;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.opensearch.indexsync.common.BackoffPolicy;
import org.opensearch.indexsync.common.ConfigurationException;
import org.opensearch.indexsync.common.ConnectionOptions;
import org.opensearch.indexsync.common.IndexClient;
import org.opensearch.indexsync.common.RequestBackoff;
import org.opensearch.indexsync.common.http.RestClient;
import org.opensearch.indexsync.pipeline.ir.SyncState;
import org.opensearch.indexsync.pipeline.ir.SyncSummary;
import org.opensearch.indexsync.pipeline.source.RecordSource;
import org.opensearch.indexsync.schema.PrimaryRecord;
import org.opensearch.indexsync.schema.SchemaDescriptor;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

class SyncEngineTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final ConnectionOptions OPTIONS = ConnectionOptions.builder()
        .host("localhost")
        .port(9200)
        .index("users")
        .type("User")
        .build();
    private static final IndexedCollection USERS = new IndexedCollection("User",
        SchemaDescriptor.builder().field("name").field("handle").notIndexed("passwordHash").build());

    private static IndexClient indexClient(FakeSearchService service) {
        var policy = BackoffPolicy.builder()
            .baseDelay(Duration.ofMillis(1))
            .maxDelay(Duration.ofMillis(2))
            .maxAttempts(2)
            .jitterSource(() -> 0.0)
            .build();
        return new IndexClient(new RequestBackoff(new RestClient(service), policy));
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within " + TIMEOUT);
            }
            Thread.sleep(5);
        }
    }

    private static PrimaryRecord user(String id) {
        return PrimaryRecord.builder().id(id).field("name", "user " + id).field("passwordHash", "x").build();
    }

    @Test
    void unserializableRecordIsCountedAndSkipped() {
        var service = new FakeSearchService();
        var records = List.of(
            user("u1"),
            PrimaryRecord.builder().id("u2").field("handle", new Object()).build(),
            user("u3"));
        RecordSource source = collection -> Flux.fromIterable(records);
        var engine = new SyncEngine(source, indexClient(service));

        var job = engine.resync(USERS, OPTIONS);

        StepVerifier.create(job.completion())
            .assertNext(summary -> {
                assertEquals(SyncState.COMPLETED, summary.state());
                assertEquals(3, summary.scanned());
                assertEquals(2, summary.indexed());
                assertEquals(1, summary.failed());
                assertFalse(summary.aborted());
                assertThat(summary.cause(), nullValue());
            })
            .expectComplete()
            .verify(TIMEOUT);
        assertEquals(SyncState.COMPLETED, job.getState());
        assertEquals(2, service.size());
        assertFalse(service.document("users", "User", "u1").has("passwordHash"));
    }

    @Test
    void rejectedWriteIsCountedAsFailure() {
        var service = new FakeSearchService();
        service.reject("u2");
        RecordSource source = collection -> Flux.just(user("u1"), user("u2"));
        var engine = new SyncEngine(source, indexClient(service));

        var summary = engine.resync(USERS, OPTIONS).completion().block(TIMEOUT);

        assertThat(summary, notNullValue());
        assertEquals(SyncState.COMPLETED, summary.state());
        assertEquals(1, summary.indexed());
        assertEquals(1, summary.failed());
        assertEquals(2, summary.attempted());
    }

    @Test
    void brokenCursorFailsTheJob() {
        var service = new FakeSearchService();
        RecordSource source = collection -> Flux.concat(
            Flux.just(user("u1")),
            Flux.error(new IllegalStateException("cursor lost")));
        var engine = new SyncEngine(source, indexClient(service));

        var summary = engine.resync(USERS, OPTIONS).completion().block(TIMEOUT);

        assertThat(summary, notNullValue());
        assertEquals(SyncState.FAILED, summary.state());
        assertThat(summary.cause().getMessage(), equalTo("cursor lost"));
    }

    @Test
    void abortStopsReadingAndFailsTheJob() {
        var service = new FakeSearchService();
        RecordSource source = collection -> Flux.concat(Flux.just(user("u1")), Flux.never());
        var engine = new SyncEngine(source, indexClient(service));

        var job = engine.resync(USERS, OPTIONS);
        job.abort();
        var summary = job.completion().block(TIMEOUT);

        assertThat(summary, notNullValue());
        assertEquals(SyncState.FAILED, summary.state());
        assertTrue(summary.aborted());
        assertThat(summary.cause(), nullValue());
    }

    @Test
    void abortLetsWritesAlreadySentFinish() throws Exception {
        var service = new FakeSearchService(Duration.ofMillis(300));
        RecordSource source = collection -> Flux.concat(Flux.just(user("u1"), user("u2")), Flux.never());
        var engine = new SyncEngine(source, indexClient(service));

        var job = engine.resync(USERS, OPTIONS);
        awaitCondition(() -> service.getRequestCount().get() == 2);

        var progress = job.progress();
        assertEquals(SyncState.RUNNING, progress.state());
        assertEquals(2, progress.scanned());
        assertFalse(progress.aborted());

        job.abort();
        var summary = job.completion().block(TIMEOUT);

        assertThat(summary, notNullValue());
        assertEquals(SyncState.FAILED, summary.state());
        assertTrue(summary.aborted());
        assertEquals(summary.scanned(), summary.indexed());
        assertEquals(0, summary.failed());
        assertThat(service.document("users", "User", "u1"), notNullValue());
        assertThat(service.document("users", "User", "u2"), notNullValue());
    }

    @Test
    void abortAfterCompletionIsIgnored() {
        RecordSource source = collection -> Flux.just(user("u1"));
        var engine = new SyncEngine(source, indexClient(new FakeSearchService()));

        var job = engine.resync(USERS, OPTIONS);
        job.completion().block(TIMEOUT);
        job.abort();

        assertEquals(SyncState.COMPLETED, job.getState());
        assertFalse(job.isAbortRequested());
    }

    @Test
    void writesStayWithinTheConcurrencyLimit() {
        var service = new FakeSearchService(Duration.ofMillis(20));
        var records = IntStream.range(0, 24).mapToObj(i -> user("u" + i)).collect(Collectors.toList());
        RecordSource source = collection -> Flux.fromIterable(records);
        var engine = new SyncEngine(source, indexClient(service), 3);

        var summary = engine.resync(USERS, OPTIONS).completion().block(TIMEOUT);

        assertThat(summary, notNullValue());
        assertEquals(24, summary.indexed());
        assertThat(service.getMaxObservedInFlight().get(), lessThanOrEqualTo(3));
        assertEquals(24, service.size());
    }

    @Test
    void finishedCallbackReceivesTheSummary() throws Exception {
        RecordSource source = collection -> Flux.just(user("u1"));
        var engine = new SyncEngine(source, indexClient(new FakeSearchService()));
        var received = new CompletableFuture<SyncSummary>();

        engine.resync(USERS, OPTIONS, received::complete);

        var summary = received.get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        assertEquals(SyncState.COMPLETED, summary.state());
        assertEquals(1, summary.indexed());
    }

    @Test
    void missingIndexIsReportedBeforeReading() {
        RecordSource source = collection -> {
            throw new AssertionError("records must not be read");
        };
        var engine = new SyncEngine(source, indexClient(new FakeSearchService()));

        assertThrows(ConfigurationException.class,
            () -> engine.resync(USERS, OPTIONS.toBuilder().index(null).build()));
    }

    @Test
    void concurrencyLimitMustBePositive() {
        RecordSource source = collection -> Flux.empty();

        assertThrows(IllegalArgumentException.class, () -> new SyncEngine(source, null, 0));
    }
}
