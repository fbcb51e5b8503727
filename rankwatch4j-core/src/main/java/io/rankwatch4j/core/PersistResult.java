package io.rankwatch4j.core;

/**
 * Outcome of registering a job definition.
 */
public record PersistResult(
        String jobId,
        boolean created,
        boolean updated
) {
    public static PersistResult createdResult(String jobId) {
        return new PersistResult(jobId, true, false);
    }

    public static PersistResult updatedResult(String jobId) {
        return new PersistResult(jobId, false, true);
    }

    public static PersistResult noop(String jobId) {
        return new PersistResult(jobId, false, false);
    }
}
