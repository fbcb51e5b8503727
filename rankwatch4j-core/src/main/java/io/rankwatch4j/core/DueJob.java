package io.rankwatch4j.core;

import java.time.Instant;

/**
 * A job definition whose trigger fires at {@code nextRunAt}.
 */
public record DueJob(JobDefinition definition, Instant nextRunAt) {
}
