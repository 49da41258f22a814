package com.outcast.rivalry.client;

import com.outcast.rivalry.config.SleeperApiProperties;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private static WebClientResponseException status(HttpStatus status) {
        return WebClientResponseException.create(status.value(), status.getReasonPhrase(), HttpHeaders.EMPTY, new byte[0], null);
    }

    @Test
    void defaultsRetryRateLimitsAndServerErrorsOnly() {
        RetryPolicy policy = RetryPolicy.from(new SleeperApiProperties().getRetry());

        assertThat(policy.getMaxAttempts()).isEqualTo(3);
        assertThat(policy.isRetryable(status(HttpStatus.TOO_MANY_REQUESTS))).isTrue();
        assertThat(policy.isRetryable(status(HttpStatus.BAD_GATEWAY))).isTrue();
        assertThat(policy.isRetryable(status(HttpStatus.NOT_FOUND))).isFalse();
        assertThat(policy.isRetryable(new TimeoutException())).isTrue();
        assertThat(policy.isRetryable(new IllegalStateException("bug"))).isFalse();
    }

    @Test
    void zeroAttempts_rejected() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO, java.util.Set.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void worstCase_coversEveryAttemptAndTheCappedWaits() {
        RetryPolicy policy = RetryPolicy.from(new SleeperApiProperties().getRetry());

        assertThat(policy.worstCase(Duration.ofSeconds(8))).isEqualTo(Duration.ofSeconds(32));
        assertThat(RetryPolicy.none().worstCase(Duration.ofSeconds(8))).isEqualTo(Duration.ofSeconds(8));
    }
}
