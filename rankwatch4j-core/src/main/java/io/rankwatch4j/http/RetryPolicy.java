package io.rankwatch4j.http;

import io.rankwatch4j.config.HttpClientProperties;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff: {@code baseDelay * backoffFactor^attempt}, capped at {@code maxDelay}.
 */
public record RetryPolicy(int maxRetries, Duration baseDelay, double backoffFactor, Duration maxDelay) {

    public RetryPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be >= 1.0");
        }
    }

    public static RetryPolicy from(HttpClientProperties props) {
        return new RetryPolicy(props.getMaxRetries(), props.getBaseDelay(), props.getBackoffFactor(), props.getMaxDelay());
    }

    /**
     * Delay before retry number {@code attempt + 1}; {@code attempt} starts at 0.
     */
    public Duration delayFor(int attempt) {
        int exp = Math.max(0, attempt);
        double ms = baseDelay.toMillis() * Math.pow(backoffFactor, exp);
        long capped = (long) Math.min(ms, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }
}
