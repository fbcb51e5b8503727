package io.rankwatch4j.core;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable job: what to crawl and when. A definition with more than one target is a batch job.
 *
 * @param targets      source ids, or {@code detail:<bookId>} targets
 * @param maxRetries   job-level retries after a transient failure
 * @param retryBackoff base delay of the job-level retry backoff
 */
public record JobDefinition(
        String id,
        List<String> targets,
        TriggerSpec trigger,
        int maxRetries,
        Duration retryBackoff
) {
    public JobDefinition {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(targets, "targets must not be null");
        Objects.requireNonNull(trigger, "trigger must not be null");
        Objects.requireNonNull(retryBackoff, "retryBackoff must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (targets.isEmpty()) {
            throw new IllegalArgumentException("targets must not be empty");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (retryBackoff.isNegative()) {
            throw new IllegalArgumentException("retryBackoff must not be negative");
        }
        targets = List.copyOf(targets);
    }

    public boolean isBatch() {
        return targets.size() > 1;
    }
}
