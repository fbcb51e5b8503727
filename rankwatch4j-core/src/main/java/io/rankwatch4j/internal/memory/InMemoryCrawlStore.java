package io.rankwatch4j.internal.memory;

import io.rankwatch4j.normalize.NormalizedBook;
import io.rankwatch4j.normalize.NormalizedStat;
import io.rankwatch4j.store.CrawlStore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Single-process {@link CrawlStore}, used when no database is configured and in tests.
 */
public class InMemoryCrawlStore implements CrawlStore {

    public record StatSnapshot(String bookId, NormalizedStat stat, Instant capturedAt) {
    }

    public record RankingSnapshot(String sourceId, String bookId, int position, Instant capturedAt) {
    }

    private final Map<String, NormalizedBook> books = new LinkedHashMap<>();
    private final List<StatSnapshot> stats = new ArrayList<>();
    private final List<RankingSnapshot> rankings = new ArrayList<>();

    @Override
    public synchronized boolean upsertBook(NormalizedBook book) {
        Objects.requireNonNull(book, "book must not be null");
        return books.put(book.bookId(), book) == null;
    }

    @Override
    public synchronized void appendStat(String bookId, NormalizedStat stat, Instant capturedAt) {
        stats.add(new StatSnapshot(bookId, stat, capturedAt));
    }

    @Override
    public synchronized void appendRankingSnapshot(String sourceId, String bookId, int position, Instant capturedAt) {
        rankings.add(new RankingSnapshot(sourceId, bookId, position, capturedAt));
    }

    @Override
    public synchronized Optional<Instant> findSnapshotNear(String sourceIdOrBookId, Instant time, Duration window) {
        Instant from = time.minus(window);
        Instant to = time.plus(window);
        Instant best = null;
        for (RankingSnapshot r : rankings) {
            if (r.sourceId().equals(sourceIdOrBookId)) {
                best = closer(best, r.capturedAt(), time, from, to);
            }
        }
        for (StatSnapshot s : stats) {
            if (s.bookId().equals(sourceIdOrBookId)) {
                best = closer(best, s.capturedAt(), time, from, to);
            }
        }
        return Optional.ofNullable(best);
    }

    public synchronized Optional<NormalizedBook> findBook(String bookId) {
        return Optional.ofNullable(books.get(bookId));
    }

    public synchronized int bookCount() {
        return books.size();
    }

    public synchronized List<StatSnapshot> stats() {
        return List.copyOf(stats);
    }

    public synchronized List<RankingSnapshot> rankings() {
        return List.copyOf(rankings);
    }

    private static Instant closer(Instant best, Instant candidate, Instant time, Instant from, Instant to) {
        if (candidate.isBefore(from) || candidate.isAfter(to)) {
            return best;
        }
        if (best == null) {
            return candidate;
        }
        long dBest = Math.abs(Duration.between(time, best).toMillis());
        long dCandidate = Math.abs(Duration.between(time, candidate).toMillis());
        return dCandidate < dBest ? candidate : best;
    }
}
