package io.rankwatch4j.crawl;

import io.rankwatch4j.normalize.NormalizedBook;
import io.rankwatch4j.normalize.NormalizedStat;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one {@link CrawlExecutor#run(CrawlSource)}: data, or a typed failure.
 *
 * @param skippedItems   malformed items dropped by the normalizer
 * @param detailFailures detail follow-up crawls that failed; they do not fail the result
 */
public record CrawlResult(
        String sourceId,
        List<NormalizedBook> books,
        List<NormalizedStat> stats,
        int skippedItems,
        int detailFailures,
        CrawlFailure failure,
        Instant startedAt,
        Instant finishedAt
) {
    public CrawlResult {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        books = books == null ? List.of() : List.copyOf(books);
        stats = stats == null ? List.of() : List.copyOf(stats);
    }

    public static CrawlResult failed(String sourceId, CrawlFailure failure, Instant startedAt, Instant finishedAt) {
        return new CrawlResult(sourceId, List.of(), List.of(), 0, 0,
                Objects.requireNonNull(failure, "failure must not be null"), startedAt, finishedAt);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public int itemsCrawled() {
        return books.size();
    }
}
