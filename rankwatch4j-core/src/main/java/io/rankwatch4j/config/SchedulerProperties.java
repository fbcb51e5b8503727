package io.rankwatch4j.config;

import java.time.Duration;

/**
 * Runtime configuration for scheduler behavior.
 */
public class SchedulerProperties {
    private int maxWorkers = 5;
    private int batchSize = 50; // per poll
    private Duration processEvery = Duration.ofSeconds(5);
    private int maxRetries = 3; // job level
    private Duration retryBackoff = Duration.ofSeconds(30);
    private Duration maxRetryDelay = Duration.ofMinutes(10);
    private Duration historyRetention = Duration.ofDays(7);
    private Duration staleExecutionAfter = Duration.ofMinutes(30);
    private Duration maintenanceInterval = Duration.ofMinutes(1);
    private String workerId;

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public void setMaxWorkers(int maxWorkers) {
        this.maxWorkers = maxWorkers;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getProcessEvery() {
        return processEvery;
    }

    public void setProcessEvery(Duration processEvery) {
        this.processEvery = processEvery;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public void setRetryBackoff(Duration retryBackoff) {
        this.retryBackoff = retryBackoff;
    }

    public Duration getMaxRetryDelay() {
        return maxRetryDelay;
    }

    public void setMaxRetryDelay(Duration maxRetryDelay) {
        this.maxRetryDelay = maxRetryDelay;
    }

    public Duration getHistoryRetention() {
        return historyRetention;
    }

    public void setHistoryRetention(Duration historyRetention) {
        this.historyRetention = historyRetention;
    }

    public Duration getStaleExecutionAfter() {
        return staleExecutionAfter;
    }

    public void setStaleExecutionAfter(Duration staleExecutionAfter) {
        this.staleExecutionAfter = staleExecutionAfter;
    }

    public Duration getMaintenanceInterval() {
        return maintenanceInterval;
    }

    public void setMaintenanceInterval(Duration maintenanceInterval) {
        this.maintenanceInterval = maintenanceInterval;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }
}
