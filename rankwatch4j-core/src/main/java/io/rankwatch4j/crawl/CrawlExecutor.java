package io.rankwatch4j.crawl;

import com.fasterxml.jackson.databind.JsonNode;
import io.rankwatch4j.exception.CrawlException;
import io.rankwatch4j.http.RateLimitedClient;
import io.rankwatch4j.normalize.NormalizedBook;
import io.rankwatch4j.normalize.NormalizedPayload;
import io.rankwatch4j.normalize.NormalizedStat;
import io.rankwatch4j.normalize.RankedEntry;
import io.rankwatch4j.normalize.ResponseNormalizer;
import io.rankwatch4j.store.CrawlStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Runs one source end to end: build URL, fetch, normalize, persist.
 *
 * <p>Stateless and shared by all workers. {@link #run(CrawlSource)} never throws: every failure is
 * returned as a {@link CrawlFailure} on the result.
 */
public class CrawlExecutor {
    private static final Logger log = LoggerFactory.getLogger(CrawlExecutor.class);

    private final RateLimitedClient client;
    private final ResponseNormalizer normalizer;
    private final CrawlStore crawlStore;
    private final SourceCatalog catalog;
    private final Clock clock;

    public CrawlExecutor(RateLimitedClient client, ResponseNormalizer normalizer, CrawlStore crawlStore, SourceCatalog catalog) {
        this(client, normalizer, crawlStore, catalog, Clock.systemUTC());
    }

    public CrawlExecutor(RateLimitedClient client,
                         ResponseNormalizer normalizer,
                         CrawlStore crawlStore,
                         SourceCatalog catalog,
                         Clock clock) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.crawlStore = Objects.requireNonNull(crawlStore, "crawlStore must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public SourceCatalog getCatalog() {
        return catalog;
    }

    /**
     * Resolve {@code sourceId} through the catalog and run it. Unknown ids yield a FATAL result.
     */
    public CrawlResult run(String sourceId) {
        Instant startedAt = clock.instant();
        CrawlSource source;
        try {
            source = catalog.create(sourceId);
        } catch (CrawlException e) {
            log.warn("crawl source unavailable sourceId={} msg={}", sourceId, e.getMessage());
            return CrawlResult.failed(sourceId, CrawlFailure.of(e), startedAt, clock.instant());
        }
        return run(source);
    }

    public CrawlResult run(CrawlSource source) {
        Objects.requireNonNull(source, "source must not be null");
        Instant startedAt = clock.instant();
        log.debug("crawl started sourceId={} kind={}", source.id(), source.kind());

        NormalizedPayload payload;
        try {
            payload = fetch(source);
        } catch (CrawlException e) {
            log.warn("crawl failed sourceId={} retryable={} msg={}", source.id(), e.isRetryable(), e.getMessage());
            return CrawlResult.failed(source.id(), CrawlFailure.of(e), startedAt, clock.instant());
        } catch (RuntimeException e) {
            log.error("crawl failed unexpectedly sourceId={} msg={}", source.id(), e.getMessage(), e);
            return CrawlResult.failed(source.id(), CrawlFailure.transientFailure(e), startedAt, clock.instant());
        }

        Instant capturedAt = clock.instant();
        List<NormalizedBook> books = new ArrayList<>(payload.size());
        List<NormalizedStat> stats = new ArrayList<>(payload.size());
        try {
            for (RankedEntry entry : payload.entries()) {
                persist(source, entry, capturedAt);
                books.add(entry.book());
                stats.add(entry.stat());
            }
        } catch (RuntimeException e) {
            log.error("crawl persistence failed sourceId={} persisted={} msg={}", source.id(), books.size(), e.getMessage(), e);
            return CrawlResult.failed(source.id(), CrawlFailure.transientFailure(e), startedAt, clock.instant());
        }

        int detailFailures = 0;
        if (source.followDetails() && source.kind() != SourceKind.DETAIL) {
            detailFailures = crawlDetails(source, books);
        }

        Instant finishedAt = clock.instant();
        log.info("crawl finished sourceId={} items={} skipped={} detailFailures={} took={}ms",
                source.id(), books.size(), payload.skippedItems(), detailFailures,
                finishedAt.toEpochMilli() - startedAt.toEpochMilli());
        return new CrawlResult(source.id(), books, stats, payload.skippedItems(), detailFailures, null, startedAt, finishedAt);
    }

    private NormalizedPayload fetch(CrawlSource source) {
        String url = source.buildUrl();
        JsonNode json = client.get(url);
        normalizer.checkEnvelope(json);
        return normalizer.parse(json, source.expectedShape());
    }

    private void persist(CrawlSource source, RankedEntry entry, Instant capturedAt) {
        String bookId = entry.book().bookId();
        crawlStore.upsertBook(entry.book());
        crawlStore.appendStat(bookId, entry.stat(), capturedAt);
        if (source.kind().isRanked()) {
            crawlStore.appendRankingSnapshot(source.id(), bookId, entry.position(), capturedAt);
        }
    }

    private int crawlDetails(CrawlSource listSource, List<NormalizedBook> books) {
        Set<String> bookIds = new LinkedHashSet<>();
        for (NormalizedBook book : books) {
            bookIds.add(book.bookId());
        }

        int failures = 0;
        for (String bookId : bookIds) {
            CrawlResult detail;
            try {
                detail = run(catalog.detail(bookId));
            } catch (CrawlException e) {
                detail = CrawlResult.failed(DetailSource.ID_PREFIX + bookId, CrawlFailure.of(e), clock.instant(), clock.instant());
            }
            if (!detail.isSuccess()) {
                failures++;
                log.warn("detail crawl failed sourceId={} bookId={} failure={}", listSource.id(), bookId, detail.failure());
            }
        }
        return failures;
    }
}
