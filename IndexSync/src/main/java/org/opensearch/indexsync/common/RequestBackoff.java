package org.opensearch.indexsync.common;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import org.opensearch.indexsync.common.http.HttpResponse;
import org.opensearch.indexsync.common.http.RestClient;

import io.netty.channel.ChannelException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

/**
 * Wraps a single request with retries. Transport failures and 5xx responses are retried with exponential backoff,
 * 4xx responses fail immediately.
 */
@Slf4j
public class RequestBackoff {
    @Getter
    private final RestClient client;
    @Getter
    private final BackoffPolicy policy;
    private final Scheduler delayScheduler;

    public RequestBackoff(RestClient client) {
        this(client, BackoffPolicy.DEFAULT);
    }

    public RequestBackoff(RestClient client, BackoffPolicy policy) {
        this(client, policy, Schedulers.parallel());
    }

    public RequestBackoff(RestClient client, BackoffPolicy policy, Scheduler delayScheduler) {
        this.client = client;
        this.policy = policy;
        this.delayScheduler = delayScheduler;
    }

    public Mono<HttpResponse> execute(RequestDescriptor request) {
        return Mono.defer(() -> client.asyncRequest(
                request.getMethod(), request.getEndpoint(), request.getPath(), request.getBody()))
            .switchIfEmpty(Mono.error(() -> new TransientTransportException(
                request.describe() + " completed without a response", (Throwable) null)))
            .onErrorMap(
                RequestBackoff::isTransportFailure,
                e -> new TransientTransportException(request.describe() + " could not be sent: " + e.getMessage(), e)
            )
            .flatMap(response -> classify(request, response))
            .retryWhen(retryStrategy(request));
    }

    static Mono<HttpResponse> classify(RequestDescriptor request, HttpResponse response) {
        if (response.isSuccessful() || request.isTolerated(response.statusCode)) {
            return Mono.just(response);
        }
        if (response.isServerError()) {
            return Mono.error(new TransientTransportException(
                request.describe() + " failed with status " + response.statusCode, response));
        }
        return Mono.error(new ClientRequestException(
            request.describe() + " was rejected with status " + response.statusCode, response));
    }

    static boolean isTransportFailure(Throwable t) {
        return t instanceof IOException || t instanceof TimeoutException || t instanceof ChannelException;
    }

    private Retry retryStrategy(RequestDescriptor request) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            var failure = signal.failure();
            if (!(failure instanceof TransientTransportException)) {
                return Mono.<Long>error(failure);
            }
            long attemptsSoFar = signal.totalRetries() + 1;
            if (!policy.allowsAnotherAttempt(attemptsSoFar)) {
                log.atError()
                    .setMessage("Giving up on {} after {} attempts")
                    .addArgument(request::describe)
                    .addArgument(attemptsSoFar)
                    .setCause(failure)
                    .log();
                return Mono.<Long>error(failure);
            }
            var delay = policy.delayWithJitter(signal.totalRetries());
            log.atWarn()
                .setMessage("Attempt {} of {} failed, retrying in {} ms: {}")
                .addArgument(attemptsSoFar)
                .addArgument(request::describe)
                .addArgument(delay::toMillis)
                .addArgument(failure::getMessage)
                .log();
            return Mono.delay(delay, delayScheduler);
        }));
    }
}
