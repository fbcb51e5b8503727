package io.rankwatch4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One run of a job. Owned by the {@link io.rankwatch4j.store.JobStore}: callers get copies, and
 * every status change goes through a store transition.
 */
public class JobExecution {

    private String id;
    private String jobId;
    private List<String> targets = new ArrayList<>();
    private ExecutionStatus status = ExecutionStatus.PENDING;
    private ExecutionOrigin origin = ExecutionOrigin.SCHEDULED;

    private Instant createdAt;
    private Instant scheduledAt;
    private Instant startedAt;
    private Instant completedAt;

    private int retryCount;
    private int maxRetries;
    private Duration retryBackoff = Duration.ZERO;

    private String lastError;
    private List<String> errorHistory = new ArrayList<>();

    private int itemsCrawled;
    private int skippedItems;
    private int detailFailures;

    private String parentExecutionId;
    private List<String> childExecutionIds = new ArrayList<>();
    private String previousExecutionId;

    public JobExecution() {
    }

    public JobExecution copy() {
        JobExecution c = new JobExecution();
        c.id = id;
        c.jobId = jobId;
        c.targets = new ArrayList<>(targets);
        c.status = status;
        c.origin = origin;
        c.createdAt = createdAt;
        c.scheduledAt = scheduledAt;
        c.startedAt = startedAt;
        c.completedAt = completedAt;
        c.retryCount = retryCount;
        c.maxRetries = maxRetries;
        c.retryBackoff = retryBackoff;
        c.lastError = lastError;
        c.errorHistory = new ArrayList<>(errorHistory);
        c.itemsCrawled = itemsCrawled;
        c.skippedItems = skippedItems;
        c.detailFailures = detailFailures;
        c.parentExecutionId = parentExecutionId;
        c.childExecutionIds = new ArrayList<>(childExecutionIds);
        c.previousExecutionId = previousExecutionId;
        return c;
    }

    public boolean isBatch() {
        return targets.size() > 1;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public List<String> getTargets() {
        return targets;
    }

    public void setTargets(List<String> targets) {
        this.targets = targets == null ? new ArrayList<>() : new ArrayList<>(targets);
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public void setStatus(ExecutionStatus status) {
        this.status = status;
    }

    public ExecutionOrigin getOrigin() {
        return origin;
    }

    public void setOrigin(ExecutionOrigin origin) {
        this.origin = origin;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getScheduledAt() {
        return scheduledAt;
    }

    public void setScheduledAt(Instant scheduledAt) {
        this.scheduledAt = scheduledAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
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

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    /**
     * Errors of this execution and of the executions it retries, oldest first.
     */
    public List<String> getErrorHistory() {
        return errorHistory;
    }

    public void setErrorHistory(List<String> errorHistory) {
        this.errorHistory = errorHistory == null ? new ArrayList<>() : new ArrayList<>(errorHistory);
    }

    public int getItemsCrawled() {
        return itemsCrawled;
    }

    public void setItemsCrawled(int itemsCrawled) {
        this.itemsCrawled = itemsCrawled;
    }

    public int getSkippedItems() {
        return skippedItems;
    }

    public void setSkippedItems(int skippedItems) {
        this.skippedItems = skippedItems;
    }

    public int getDetailFailures() {
        return detailFailures;
    }

    public void setDetailFailures(int detailFailures) {
        this.detailFailures = detailFailures;
    }

    public String getParentExecutionId() {
        return parentExecutionId;
    }

    public void setParentExecutionId(String parentExecutionId) {
        this.parentExecutionId = parentExecutionId;
    }

    public List<String> getChildExecutionIds() {
        return childExecutionIds;
    }

    public void setChildExecutionIds(List<String> childExecutionIds) {
        this.childExecutionIds = childExecutionIds == null ? new ArrayList<>() : new ArrayList<>(childExecutionIds);
    }

    public String getPreviousExecutionId() {
        return previousExecutionId;
    }

    public void setPreviousExecutionId(String previousExecutionId) {
        this.previousExecutionId = previousExecutionId;
    }

    @Override
    public String toString() {
        return "JobExecution{id=" + id + ", jobId=" + jobId + ", status=" + status + ", origin=" + origin
                + ", retryCount=" + retryCount + ", itemsCrawled=" + itemsCrawled + "}";
    }
}
