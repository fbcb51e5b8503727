package io.rankwatch4j.core;

import java.time.Instant;

/**
 * @param jobCount       registered job definitions
 * @param activeJobCount definitions with a next run
 * @param succeeded      executions in COMPLETED
 * @param failed         executions in FAILED
 */
public record SchedulerStats(
        boolean running,
        long jobCount,
        long activeJobCount,
        long pending,
        long inProgress,
        long succeeded,
        long failed,
        Instant startedAt
) {
}
