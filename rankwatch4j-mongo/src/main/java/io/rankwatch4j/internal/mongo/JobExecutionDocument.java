package io.rankwatch4j.internal.mongo;

import io.rankwatch4j.core.ExecutionOrigin;
import io.rankwatch4j.core.ExecutionStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mongo document model for job executions.
 */
@Document(collection = "crawl_executions")
public class JobExecutionDocument {

    @Id
    private String id;

    private String jobId;
    private List<String> targets = new ArrayList<>();
    private ExecutionStatus status;
    private ExecutionOrigin origin;

    private Instant createdAt;
    private Instant scheduledAt;
    private Instant startedAt;
    private Instant completedAt;

    private int retryCount;
    private int maxRetries;
    private long retryBackoffMillis;

    private String lastError;
    private List<String> errorHistory = new ArrayList<>();

    private int itemsCrawled;
    private int skippedItems;
    private int detailFailures;

    private String parentExecutionId;
    private List<String> childExecutionIds = new ArrayList<>();
    private String previousExecutionId;

    public JobExecutionDocument() {
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
        this.targets = targets;
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

    public long getRetryBackoffMillis() {
        return retryBackoffMillis;
    }

    public void setRetryBackoffMillis(long retryBackoffMillis) {
        this.retryBackoffMillis = retryBackoffMillis;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public List<String> getErrorHistory() {
        return errorHistory;
    }

    public void setErrorHistory(List<String> errorHistory) {
        this.errorHistory = errorHistory;
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
        this.childExecutionIds = childExecutionIds;
    }

    public String getPreviousExecutionId() {
        return previousExecutionId;
    }

    public void setPreviousExecutionId(String previousExecutionId) {
        this.previousExecutionId = previousExecutionId;
    }
}
