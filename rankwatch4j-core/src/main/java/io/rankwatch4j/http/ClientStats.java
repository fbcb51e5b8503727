package io.rankwatch4j.http;

import java.time.Instant;

/**
 * Snapshot of {@link RateLimitedClient} counters. Every sent attempt counts once in
 * {@code totalRequests}, then once in either {@code successfulRequests} or {@code failedRequests}.
 */
public record ClientStats(
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        long retries,
        Instant lastRequestAt
) {
}
