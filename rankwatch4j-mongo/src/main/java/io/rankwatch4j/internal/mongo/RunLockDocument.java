package io.rankwatch4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One document per running job; the {@code _id} uniqueness is the single-flight guarantee.
 */
@Document(collection = "crawl_run_locks")
public class RunLockDocument {

    @Id
    private String jobId;

    private String executionId;
    private Instant lockedAt;

    public RunLockDocument() {
    }

    public RunLockDocument(String jobId, String executionId, Instant lockedAt) {
        this.jobId = jobId;
        this.executionId = executionId;
        this.lockedAt = lockedAt;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public String getExecutionId() {
        return executionId;
    }

    public void setExecutionId(String executionId) {
        this.executionId = executionId;
    }

    public Instant getLockedAt() {
        return lockedAt;
    }

    public void setLockedAt(Instant lockedAt) {
        this.lockedAt = lockedAt;
    }
}
