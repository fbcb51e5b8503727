package io.rankwatch4j;

import io.rankwatch4j.core.CancelMode;
import io.rankwatch4j.core.CancelResult;
import io.rankwatch4j.core.ExecutionQuery;
import io.rankwatch4j.core.JobDefinition;
import io.rankwatch4j.core.JobExecution;
import io.rankwatch4j.core.PersistResult;
import io.rankwatch4j.core.SchedulerStats;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Main scheduler API.
 *
 * <p>Runs recurring and one-shot crawl jobs on a bounded worker pool, at most one execution per job
 * at a time, with job-level retry of transient failures.
 */
public interface CrawlScheduler {

    /**
     * Job id prefix of manually triggered batches.
     */
    String MANUAL_BATCH_PREFIX = "batch:";

    void start();

    void stop();

    boolean isRunning();

    JobBuilder create(String jobId);

    /**
     * Create or replace a job definition and schedule its first run.
     *
     * @throws io.rankwatch4j.exception.ConfigurationException when a target is unknown
     */
    PersistResult register(JobDefinition definition);

    /**
     * Run a source, a {@code detail:<bookId>} target, a comma-separated list or a keyword
     * ({@code all}, {@code category}) once at {@code runAt}.
     *
     * @param runAt null means now
     * @return id of the created execution
     * @throws io.rankwatch4j.exception.ConfigurationException when the target is unknown
     */
    String trigger(String target, Instant runAt);

    default String triggerNow(String target) {
        return trigger(target, null);
    }

    Optional<JobExecution> getExecution(String executionId);

    List<JobExecution> listExecutions(ExecutionQuery query);

    SchedulerStats getStats();

    CancelResult cancel(String jobId, CancelMode mode);

    void addListener(JobEventListener listener);
}
