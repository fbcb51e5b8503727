package io.rankwatch4j.store;

import io.rankwatch4j.core.CancelResult;
import io.rankwatch4j.core.DueJob;
import io.rankwatch4j.core.ExecutionQuery;
import io.rankwatch4j.core.ExecutionStatus;
import io.rankwatch4j.core.JobDefinition;
import io.rankwatch4j.core.JobExecution;
import io.rankwatch4j.core.PersistResult;
import io.rankwatch4j.core.RunLock;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Job definitions and execution state; the single source of truth for what is running.
 *
 * <p>Every method that changes state is an atomic compare-and-set keyed by job id or execution id,
 * so several schedulers may share one store.
 */
public interface JobStore {

    /* ---------------- definitions ---------------- */

    /**
     * Create or replace a definition. Run-lock state is preserved.
     *
     * <p>{@code nextRunAt} is applied when the definition is new, when its trigger changed, or when
     * it was disabled. Re-saving an enabled definition with the same trigger keeps the stored next run.
     */
    PersistResult saveDefinition(JobDefinition definition, Instant nextRunAt);

    /**
     * Insert a definition unless one with the same id exists.
     *
     * @return true when inserted
     */
    boolean saveDefinitionIfAbsent(JobDefinition definition, Instant nextRunAt);

    Optional<JobDefinition> findDefinition(String jobId);

    List<JobDefinition> listDefinitions();

    long countDefinitions();

    /**
     * Definitions with a next run.
     */
    long countActiveDefinitions();

    /**
     * Clear the next run of a definition.
     */
    CancelResult disableDefinition(String jobId);

    CancelResult deleteDefinition(String jobId);

    /* ---------------- trigger evaluation ---------------- */

    /**
     * Definitions whose next run is at or before {@code windowEnd}, earliest first.
     */
    List<DueJob> findDueJobs(Instant windowEnd, int limit);

    /**
     * Move the next run of {@code jobId} from {@code expected} to {@code next} (null clears it).
     * Only one caller wins each tick.
     *
     * @return false when another caller already advanced it
     */
    boolean advanceNextRun(String jobId, Instant expected, Instant next);

    /* ---------------- run lock ---------------- */

    /**
     * Take the run lock of {@code jobId} for {@code executionId}. Succeeds when the lock is free or
     * already held by the same execution.
     */
    boolean claimRun(String jobId, String executionId, Instant now);

    /**
     * Release the run lock if {@code executionId} holds it.
     */
    boolean releaseRun(String jobId, String executionId);

    Optional<RunLock> findRunLock(String jobId);

    List<RunLock> findRunLocksOlderThan(Instant cutoff);

    /* ---------------- executions ---------------- */

    void insertExecution(JobExecution execution);

    /**
     * {@code PENDING -> RUNNING}.
     *
     * @return false when the execution is not PENDING
     */
    boolean markRunning(String executionId, Instant startedAt);

    /**
     * {@code RUNNING -> COMPLETED}.
     */
    boolean markCompleted(String executionId, Instant completedAt, int itemsCrawled, int skippedItems,
                          int detailFailures, List<String> childExecutionIds);

    /**
     * {@code PENDING | RUNNING -> FAILED}; appends {@code error} to the error history.
     */
    boolean markFailed(String executionId, Instant completedAt, String error);

    Optional<JobExecution> findExecution(String executionId);

    List<JobExecution> findExecutions(ExecutionQuery query);

    /**
     * PENDING executions scheduled at or before {@code windowEnd}, earliest first.
     */
    List<JobExecution> findDuePendingExecutions(Instant windowEnd, int limit);

    List<JobExecution> findRunningStartedBefore(Instant cutoff);

    long countByStatus(ExecutionStatus status);

    /**
     * Delete terminal executions completed before {@code cutoff}.
     *
     * @return deleted count
     */
    long pruneFinishedBefore(Instant cutoff);
}
