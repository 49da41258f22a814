package com.outcast.rivalry.client;

import com.outcast.rivalry.config.SleeperApiProperties;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Retry rules for upstream calls: how many attempts, the exponential backoff schedule and which
 * failures are worth another attempt (connection errors, timeouts and the configured statuses).
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Set<Integer> retryableStatuses;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, Set<Integer> retryableStatuses) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.retryableStatuses = Set.copyOf(retryableStatuses);
    }

    public static RetryPolicy from(SleeperApiProperties.Retry props) {
        return new RetryPolicy(props.getMaxAttempts(), props.getInitialBackoff(),
                props.getMaxBackoff(), Set.copyOf(props.getRetryableStatuses()));
    }

    public static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, Set.of());
    }

    public boolean isRetryable(Throwable failure) {
        if (failure instanceof WebClientResponseException e) {
            return retryableStatuses.contains(e.getStatusCode().value());
        }
        return failure instanceof WebClientRequestException || failure instanceof TimeoutException;
    }

    /** Backoff retry that re-subscribes up to {@code maxAttempts - 1} times, rethrowing the last failure. */
    public Retry toReactorRetry() {
        return Retry.backoff(maxAttempts - 1L, initialBackoff)
                .maxBackoff(maxBackoff)
                .filter(this::isRetryable)
                .onRetryExhaustedThrow((backoff, signal) -> signal.failure());
    }

    /** Longest one call can take: every attempt hitting {@code attemptTimeout} plus the capped waits between them. */
    public Duration worstCase(Duration attemptTimeout) {
        return attemptTimeout.multipliedBy(maxAttempts).plus(maxBackoff.multipliedBy(maxAttempts - 1L));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public Set<Integer> getRetryableStatuses() {
        return retryableStatuses;
    }
}
