package io.rankwatch4j.config;

import java.time.Duration;

/**
 * Settings of the rate-limited upstream client.
 */
public class HttpClientProperties {
    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (iPhone; CPU iPhone OS 16_6 like Mac OS X) AppleWebKit/605.1.15 "
                    + "(KHTML, like Gecko) Mobile/15E148";

    private Duration timeout = Duration.ofSeconds(30);
    private Duration connectTimeout = Duration.ofSeconds(15);
    private Duration rateLimitDelay = Duration.ofSeconds(1);
    private int maxRetries = 3; // additional attempts after the first
    private Duration baseDelay = Duration.ofSeconds(1);
    private double backoffFactor = 2.0;
    private Duration maxDelay = Duration.ofSeconds(60);
    private String userAgent = DEFAULT_USER_AGENT;

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getRateLimitDelay() {
        return rateLimitDelay;
    }

    public void setRateLimitDelay(Duration rateLimitDelay) {
        this.rateLimitDelay = rateLimitDelay;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public void setBaseDelay(Duration baseDelay) {
        this.baseDelay = baseDelay;
    }

    public double getBackoffFactor() {
        return backoffFactor;
    }

    public void setBackoffFactor(double backoffFactor) {
        this.backoffFactor = backoffFactor;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
        this.maxDelay = maxDelay;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }
}
