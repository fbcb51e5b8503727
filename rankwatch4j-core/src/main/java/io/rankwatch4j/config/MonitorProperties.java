package io.rankwatch4j.config;

import java.time.Duration;

/**
 * Runtime configuration for the gap monitor.
 */
public class MonitorProperties {
    private boolean enabled = true;
    private Duration interval = Duration.ofMinutes(30);
    private Duration evidenceWindow = Duration.ofMinutes(30); // +/- around each expected time
    private Duration retrySpacing = Duration.ofMinutes(10);
    private int maxRetries = 3; // per gap
    private Duration errorBackoff = Duration.ofSeconds(60);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getInterval() {
        return interval;
    }

    public void setInterval(Duration interval) {
        this.interval = interval;
    }

    public Duration getEvidenceWindow() {
        return evidenceWindow;
    }

    public void setEvidenceWindow(Duration evidenceWindow) {
        this.evidenceWindow = evidenceWindow;
    }

    public Duration getRetrySpacing() {
        return retrySpacing;
    }

    public void setRetrySpacing(Duration retrySpacing) {
        this.retrySpacing = retrySpacing;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getErrorBackoff() {
        return errorBackoff;
    }

    public void setErrorBackoff(Duration errorBackoff) {
        this.errorBackoff = errorBackoff;
    }
}
