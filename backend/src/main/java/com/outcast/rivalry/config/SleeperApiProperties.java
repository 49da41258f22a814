package com.outcast.rivalry.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "sleeper.api")
public class SleeperApiProperties {

    private String baseUrl = "https://api.sleeper.app/v1";
    private Duration connectTimeout = Duration.ofSeconds(5);
    /** Upper bound for one upstream attempt; each retry gets its own. */
    private Duration callTimeout = Duration.ofSeconds(8);
    private final Retry retry = new Retry();

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public void setCallTimeout(Duration callTimeout) {
        this.callTimeout = callTimeout;
    }

    public Retry getRetry() {
        return retry;
    }

    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private Duration maxBackoff = Duration.ofSeconds(4);
        private List<Integer> retryableStatuses = new ArrayList<>(List.of(429, 500, 502, 503, 504));

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public List<Integer> getRetryableStatuses() {
            return retryableStatuses;
        }

        public void setRetryableStatuses(List<Integer> retryableStatuses) {
            this.retryableStatuses = retryableStatuses;
        }
    }
}
