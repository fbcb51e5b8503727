package io.rankwatch4j.monitor;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of a missing crawl the monitor is repairing.
 *
 * @param expectedAt  hour the source should have produced a snapshot for
 * @param lastRetryAt null until the first repair attempt
 * @param exhausted   retry budget spent; no further attempts
 */
public record GapRecord(
        String key,
        String sourceId,
        Instant expectedAt,
        int retryCount,
        Instant lastRetryAt,
        List<String> errors,
        boolean exhausted
) {
    public GapRecord {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
