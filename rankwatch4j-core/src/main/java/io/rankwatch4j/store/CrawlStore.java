package io.rankwatch4j.store;

import io.rankwatch4j.normalize.NormalizedBook;
import io.rankwatch4j.normalize.NormalizedStat;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Persistence of crawled data. The only point where crawl runs write outside the job store.
 */
public interface CrawlStore {

    /**
     * Create-or-update keyed by {@link NormalizedBook#bookId()}.
     *
     * @return true when a new book record was created
     */
    boolean upsertBook(NormalizedBook book);

    /**
     * Append a stat snapshot; snapshots are never updated in place.
     */
    void appendStat(String bookId, NormalizedStat stat, Instant capturedAt);

    void appendRankingSnapshot(String sourceId, String bookId, int position, Instant capturedAt);

    /**
     * Time of the snapshot closest to {@code time} within {@code ±window}, looked up by source id
     * (ranking snapshots) or by book id (stat snapshots).
     */
    Optional<Instant> findSnapshotNear(String sourceIdOrBookId, Instant time, Duration window);
}
