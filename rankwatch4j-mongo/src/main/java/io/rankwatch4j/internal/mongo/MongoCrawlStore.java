package io.rankwatch4j.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.rankwatch4j.normalize.NormalizedBook;
import io.rankwatch4j.normalize.NormalizedStat;
import io.rankwatch4j.store.CrawlStore;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence of crawled data: one {@code books} document per book, append-only
 * {@code book_stats} and {@code ranking_snapshots}.
 */
public class MongoCrawlStore implements CrawlStore {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoCrawlStore(MongoTemplate mongoTemplate) {
        this(mongoTemplate, Clock.systemUTC());
    }

    public MongoCrawlStore(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public boolean upsertBook(NormalizedBook book) {
        Objects.requireNonNull(book, "book must not be null");
        Instant now = clock.instant();

        Update u = new Update()
                .set("title", book.title())
                .set("tags", new ArrayList<>(book.tags()))
                .set("updatedAt", now)
                .setOnInsert("firstSeenAt", now);
        setOrUnset(u, "authorId", book.authorId());
        setOrUnset(u, "authorName", book.authorName());
        setOrUnset(u, "category", book.category());

        UpdateResult result = mongoTemplate.upsert(new Query(Criteria.where("_id").is(book.bookId())), u, BookDocument.class);
        return result.getUpsertedId() != null;
    }

    @Override
    public void appendStat(String bookId, NormalizedStat stat, Instant capturedAt) {
        Objects.requireNonNull(bookId, "bookId must not be null");
        Objects.requireNonNull(stat, "stat must not be null");
        Objects.requireNonNull(capturedAt, "capturedAt must not be null");

        BookStatDocument doc = new BookStatDocument();
        doc.setBookId(bookId);
        doc.setClicks(stat.clicks());
        doc.setFavorites(stat.favorites());
        doc.setComments(stat.comments());
        doc.setChapters(stat.chapters());
        doc.setWordCount(stat.wordCount());
        doc.setNutrition(stat.nutrition());
        doc.setVipChapterId(stat.vipChapterId());
        doc.setCapturedAt(capturedAt);
        mongoTemplate.insert(doc);
    }

    @Override
    public void appendRankingSnapshot(String sourceId, String bookId, int position, Instant capturedAt) {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(bookId, "bookId must not be null");
        Objects.requireNonNull(capturedAt, "capturedAt must not be null");

        RankingSnapshotDocument doc = new RankingSnapshotDocument();
        doc.setSourceId(sourceId);
        doc.setBookId(bookId);
        doc.setPosition(position);
        doc.setCapturedAt(capturedAt);
        mongoTemplate.insert(doc);
    }

    /**
     * Nearest capture on each side of {@code time} in both snapshot collections; the closest wins.
     */
    @Override
    public Optional<Instant> findSnapshotNear(String sourceIdOrBookId, Instant time, Duration window) {
        Objects.requireNonNull(sourceIdOrBookId, "sourceIdOrBookId must not be null");
        Objects.requireNonNull(time, "time must not be null");
        Objects.requireNonNull(window, "window must not be null");

        Instant from = time.minus(window);
        Instant to = time.plus(window);

        Instant best = null;
        best = closer(best, nearest("sourceId", sourceIdOrBookId, from, time, true, RankingSnapshotDocument.class), time);
        best = closer(best, nearest("sourceId", sourceIdOrBookId, time, to, false, RankingSnapshotDocument.class), time);
        best = closer(best, nearest("bookId", sourceIdOrBookId, from, time, true, BookStatDocument.class), time);
        best = closer(best, nearest("bookId", sourceIdOrBookId, time, to, false, BookStatDocument.class), time);
        return Optional.ofNullable(best);
    }

    private Instant nearest(String keyField, String key, Instant from, Instant to, boolean latest, Class<?> type) {
        Query q = new Query(Criteria.where(keyField).is(key).and("capturedAt").gte(from).lte(to))
                .with(Sort.by(latest ? Sort.Order.desc("capturedAt") : Sort.Order.asc("capturedAt")))
                .limit(1);
        q.fields().include("capturedAt");

        Object doc = mongoTemplate.findOne(q, type);
        if (doc instanceof RankingSnapshotDocument r) {
            return r.getCapturedAt();
        }
        if (doc instanceof BookStatDocument s) {
            return s.getCapturedAt();
        }
        return null;
    }

    private static Instant closer(Instant best, Instant candidate, Instant time) {
        if (candidate == null) {
            return best;
        }
        if (best == null) {
            return candidate;
        }
        long dBest = Math.abs(Duration.between(time, best).toMillis());
        long dCandidate = Math.abs(Duration.between(time, candidate).toMillis());
        return dCandidate < dBest ? candidate : best;
    }

    private static void setOrUnset(Update u, String field, String value) {
        if (value != null && !value.isBlank()) {
            u.set(field, value);
        } else {
            u.unset(field);
        }
    }
}
