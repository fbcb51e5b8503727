package io.rankwatch4j.monitor;

import io.rankwatch4j.config.MonitorProperties;
import io.rankwatch4j.crawl.CrawlExecutor;
import io.rankwatch4j.crawl.CrawlResult;
import io.rankwatch4j.crawl.SourceCatalog;
import io.rankwatch4j.crawl.SourceDefinition;
import io.rankwatch4j.crawl.SourceKind;
import io.rankwatch4j.store.CrawlStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Compares the crawls that should have happened against stored snapshots and repairs the gaps.
 *
 * <p>Each check:
 * <ol>
 *   <li>computes the recent expected crawl hours of every monitored source: the last two hours for
 *       hot lists, the last three intervals for other sources with a known interval</li>
 *   <li>looks for a snapshot within {@code evidenceWindow} of each; a miss opens a gap</li>
 *   <li>re-runs the source for each open gap at most once per {@code retrySpacing}; a success closes
 *       the gap, a failure is recorded, and the last allowed failure logs a terminal warning</li>
 * </ol>
 *
 * <p>Gaps live in memory only. Runs on its own thread, outside the scheduler's worker pool.
 */
public class TaskMonitor {
    private static final Logger log = LoggerFactory.getLogger(TaskMonitor.class);

    private static final int HOT_LIST_LOOKBACK = 2;
    private static final int INTERVAL_LOOKBACK = 3;
    private static final Duration HOURLY = Duration.ofHours(1);
    private static final DateTimeFormatter KEY_HOUR =
            DateTimeFormatter.ofPattern("yyyyMMdd_HH").withZone(ZoneOffset.UTC);

    private final MonitorProperties props;
    private final SourceCatalog catalog;
    private final CrawlStore crawlStore;
    private final CrawlExecutor crawlExecutor;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Map<String, Gap> gaps = new ConcurrentHashMap<>();
    // repaired keys, kept while their hour is still checked
    private final Set<String> repaired = ConcurrentHashMap.newKeySet();
    private final Object checkLock = new Object();

    private volatile Instant lastCheckAt;
    private Thread monitorThread;

    private static final class Gap {
        final String key;
        final String sourceId;
        final Instant expectedAt;
        final List<String> errors = new CopyOnWriteArrayList<>();
        volatile int retryCount;
        volatile Instant lastRetryAt;
        volatile boolean exhausted;

        Gap(String key, String sourceId, Instant expectedAt) {
            this.key = key;
            this.sourceId = sourceId;
            this.expectedAt = expectedAt;
        }

        GapRecord snapshot() {
            return new GapRecord(key, sourceId, expectedAt, retryCount, lastRetryAt, errors, exhausted);
        }
    }

    public TaskMonitor(MonitorProperties props, SourceCatalog catalog, CrawlStore crawlStore, CrawlExecutor crawlExecutor) {
        this(props, catalog, crawlStore, crawlExecutor, Clock.systemUTC());
    }

    public TaskMonitor(MonitorProperties props,
                       SourceCatalog catalog,
                       CrawlStore crawlStore,
                       CrawlExecutor crawlExecutor,
                       Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.crawlStore = Objects.requireNonNull(crawlStore, "crawlStore must not be null");
        this.crawlExecutor = Objects.requireNonNull(crawlExecutor, "crawlExecutor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (props.getMaxRetries() < 1) {
            throw new IllegalArgumentException("rankwatch.monitor.maxRetries must be at least 1");
        }
    }

    /**
     * Start the periodic check loop. Idempotent.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        Duration interval = Objects.requireNonNull(props.getInterval(), "rankwatch.monitor.interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            running.set(false);
            throw new IllegalArgumentException("rankwatch.monitor.interval must be a positive duration");
        }

        monitorThread = new Thread(this::monitorLoop);
        monitorThread.setName("rankwatch.monitor");
        monitorThread.setDaemon(true);
        monitorThread.start();
        log.info("Task monitor started interval={} evidenceWindow={} maxRetries={}",
                interval, props.getEvidenceWindow(), props.getMaxRetries());
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        if (monitorThread != null) {
            monitorThread.interrupt();
            try {
                monitorThread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            monitorThread = null;
        }
        log.info("Task monitor stopped.");
    }

    public boolean isRunning() {
        return running.get();
    }

    public MonitorStatus status() {
        List<GapRecord> records = new ArrayList<>();
        for (Gap gap : gaps.values()) {
            records.add(gap.snapshot());
        }
        records.sort(Comparator.comparing(GapRecord::expectedAt).thenComparing(GapRecord::sourceId));
        return new MonitorStatus(running.get(), props.getInterval(), lastCheckAt, records);
    }

    private void monitorLoop() {
        while (running.get()) {
            Duration sleep = props.getInterval();
            try {
                checkOnce(clock.instant());
            } catch (RuntimeException e) {
                log.error("task monitor check failed msg={}", e.getMessage(), e);
                sleep = props.getErrorBackoff();
            }
            try {
                Thread.sleep(sleep.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    /**
     * One detect-and-repair pass at {@code now}.
     */
    public void checkOnce(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        synchronized (checkLock) {
            Set<String> expectedKeys = detectGaps(now);
            repairGaps(now);
            forgetOutdated(expectedKeys);
            lastCheckAt = now;
            log.info("Task monitor check finished openGaps={} now={}", countOpen(), now);
        }
    }

    private Set<String> detectGaps(Instant now) {
        Set<String> expectedKeys = new LinkedHashSet<>();
        for (SourceDefinition source : catalog.definitions()) {
            if (!source.monitored() || !source.kind().isRanked()) {
                continue;
            }
            for (Instant expectedAt : expectedTimes(source, now)) {
                String key = gapKey(source.id(), expectedAt);
                expectedKeys.add(key);
                if (gaps.containsKey(key) || repaired.contains(key)) {
                    continue;
                }
                if (!hasEvidence(source.id(), expectedAt)) {
                    log.warn("Missing crawl detected sourceId={} expectedAt={}", source.id(), expectedAt);
                    gaps.put(key, new Gap(key, source.id(), expectedAt));
                }
            }
        }
        return expectedKeys;
    }

    List<Instant> expectedTimes(SourceDefinition source, Instant now) {
        List<Instant> times = new ArrayList<>();
        if (source.kind() == SourceKind.HOT_LIST) {
            Instant hour = now.truncatedTo(ChronoUnit.HOURS);
            for (int i = 1; i <= HOT_LIST_LOOKBACK; i++) {
                times.add(hour.minus(HOURLY.multipliedBy(i)));
            }
            return times;
        }

        Duration interval = source.monitorInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            return times;
        }
        for (int i = 1; i <= INTERVAL_LOOKBACK; i++) {
            times.add(now.minus(interval.multipliedBy(i)).truncatedTo(ChronoUnit.HOURS));
        }
        return times;
    }

    private boolean hasEvidence(String sourceId, Instant expectedAt) {
        try {
            return crawlStore.findSnapshotNear(sourceId, expectedAt, props.getEvidenceWindow()).isPresent();
        } catch (RuntimeException e) {
            // unknown counts as present
            log.error("evidence lookup failed; assuming present sourceId={} expectedAt={} msg={}",
                    sourceId, expectedAt, e.getMessage());
            return true;
        }
    }

    private void repairGaps(Instant now) {
        Map<String, Gap> due = new LinkedHashMap<>();
        gaps.values().stream()
                .sorted(Comparator.comparing((Gap g) -> g.expectedAt))
                .filter(g -> !g.exhausted)
                .filter(g -> g.lastRetryAt == null || !now.isBefore(g.lastRetryAt.plus(props.getRetrySpacing())))
                .forEach(g -> due.put(g.key, g));

        for (Gap gap : due.values()) {
            try {
                repair(gap, now);
            } catch (RuntimeException e) {
                log.error("gap repair failed key={} msg={}", gap.key, e.getMessage(), e);
            }
        }
    }

    private void repair(Gap gap, Instant now) {
        log.info("Repairing gap key={} attempt={}/{}", gap.key, gap.retryCount + 1, props.getMaxRetries());

        String error;
        try {
            CrawlResult result = crawlExecutor.run(gap.sourceId);
            if (result.isSuccess()) {
                gaps.remove(gap.key);
                repaired.add(gap.key);
                log.info("Gap repaired key={} items={}", gap.key, result.itemsCrawled());
                return;
            }
            error = result.failure().toString();
        } catch (RuntimeException e) {
            error = e.getClass().getSimpleName() + ": " + e.getMessage();
        }

        gap.retryCount++;
        gap.lastRetryAt = now;
        gap.errors.add("attempt " + gap.retryCount + ": " + error);

        if (gap.retryCount >= props.getMaxRetries()) {
            gap.exhausted = true;
            log.warn("Gap repair gave up; manual intervention required sourceId={} expectedAt={} retries={}/{} errors={}",
                    gap.sourceId, gap.expectedAt, gap.retryCount, props.getMaxRetries(), List.copyOf(gap.errors));
        } else {
            log.warn("Gap repair failed key={} retries={}/{} error={}",
                    gap.key, gap.retryCount, props.getMaxRetries(), error);
        }
    }

    // Drops exhausted gaps and repair markers whose hour is no longer checked.
    private void forgetOutdated(Set<String> expectedKeys) {
        gaps.values().removeIf(g -> g.exhausted && !expectedKeys.contains(g.key));
        repaired.removeIf(key -> !expectedKeys.contains(key));
    }

    private long countOpen() {
        return gaps.values().stream().filter(g -> !g.exhausted).count();
    }

    static String gapKey(String sourceId, Instant expectedAt) {
        return sourceId + "_" + KEY_HOUR.format(expectedAt);
    }
}
