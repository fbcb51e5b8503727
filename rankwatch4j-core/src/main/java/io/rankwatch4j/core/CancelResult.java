package io.rankwatch4j.core;

/**
 * Result of cancelling a job definition.
 *
 * matched  : 1 when the job id exists, else 0
 * modified : definitions disabled
 * deleted  : definitions removed
 */
public record CancelResult(
        long matched,
        long modified,
        long deleted
) {

    public static CancelResult empty() {
        return new CancelResult(0, 0, 0);
    }

    public static CancelResult disabled(long modified) {
        return new CancelResult(1, modified, 0);
    }

    public static CancelResult deleted(long deleted) {
        return new CancelResult(deleted, 0, deleted);
    }

    public boolean hasEffect() {
        return modified > 0 || deleted > 0;
    }
}
