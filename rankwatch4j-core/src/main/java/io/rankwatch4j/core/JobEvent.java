package io.rankwatch4j.core;

import io.rankwatch4j.crawl.CrawlResult;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one execution, posted by a worker and consumed by the scheduler's event loop.
 *
 * @param result          crawl result; null for {@link JobEventType#ERRORED} and for batch parents
 * @param error           thrown exception for {@link JobEventType#ERRORED}
 * @param childExecutions executions created by a batch parent
 */
public record JobEvent(
        JobEventType type,
        String executionId,
        String jobId,
        CrawlResult result,
        Throwable error,
        List<String> childExecutions,
        Instant at
) {
    public JobEvent {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(jobId, "jobId must not be null");
        childExecutions = childExecutions == null ? List.of() : List.copyOf(childExecutions);
    }

    public static JobEvent of(String executionId, String jobId, CrawlResult result, Instant at) {
        JobEventType type = result.isSuccess() ? JobEventType.SUCCEEDED : JobEventType.FAILED;
        return new JobEvent(type, executionId, jobId, result, null, List.of(), at);
    }

    public static JobEvent dispatched(String executionId, String jobId, List<String> children, Instant at) {
        return new JobEvent(JobEventType.SUCCEEDED, executionId, jobId, null, null, children, at);
    }

    public static JobEvent errored(String executionId, String jobId, Throwable error, Instant at) {
        return new JobEvent(JobEventType.ERRORED, executionId, jobId, null, error, List.of(), at);
    }
}
