package io.rankwatch4j.core;

import java.time.Instant;

/**
 * Single-flight marker: execution {@code executionId} owns job {@code jobId} since {@code lockedAt}.
 */
public record RunLock(String jobId, String executionId, Instant lockedAt) {
}
