package org.opensearch.indexsync.common;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

import lombok.Builder;
import lombok.Value;

/**
 * Exponential backoff: {@code min(maxDelay, baseDelay * 2^attempt)} plus a random jitter in {@code [0, delay/2)}.
 */
@Value
@Builder(toBuilder = true)
public class BackoffPolicy {
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(200);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);
    public static final long DEFAULT_MAX_ATTEMPTS = 10;
    public static final long UNBOUNDED = Long.MAX_VALUE;

    public static final BackoffPolicy DEFAULT = BackoffPolicy.builder().build();

    @Builder.Default
    Duration baseDelay = DEFAULT_BASE_DELAY;
    @Builder.Default
    Duration maxDelay = DEFAULT_MAX_DELAY;
    /** Total attempts, the first one included. */
    @Builder.Default
    long maxAttempts = DEFAULT_MAX_ATTEMPTS;
    /** Uniform values in [0, 1). */
    @Builder.Default
    DoubleSupplier jitterSource = () -> ThreadLocalRandom.current().nextDouble();

    /** Retries transient failures until they stop happening. */
    public static BackoffPolicy unbounded(Duration baseDelay, Duration maxDelay) {
        return BackoffPolicy.builder().baseDelay(baseDelay).maxDelay(maxDelay).maxAttempts(UNBOUNDED).build();
    }

    public boolean isUnbounded() {
        return maxAttempts == UNBOUNDED;
    }

    /**
     * @param attempt zero-based retry number
     * @return the delay before that retry, jitter excluded
     */
    public Duration delay(long attempt) {
        long baseMillis = baseDelay.toMillis();
        long maxMillis = maxDelay.toMillis();
        long factor = attempt >= Long.SIZE - 2 ? Long.MAX_VALUE : 1L << attempt;
        if (baseMillis > 0 && baseMillis > maxMillis / factor) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.min(maxMillis, baseMillis * factor));
    }

    public Duration delayWithJitter(long attempt) {
        var delay = delay(attempt);
        long jitterMillis = (long) (jitterSource.getAsDouble() * (delay.toMillis() / 2.0));
        return delay.plusMillis(jitterMillis);
    }

    /** Whether another attempt may follow {@code attemptsSoFar} failed ones. */
    public boolean allowsAnotherAttempt(long attemptsSoFar) {
        return isUnbounded() || attemptsSoFar < maxAttempts;
    }
}
