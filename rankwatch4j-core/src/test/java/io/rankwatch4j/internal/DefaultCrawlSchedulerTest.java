package io.rankwatch4j.internal;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.rankwatch4j.CrawlScheduler;
import io.rankwatch4j.config.SchedulerProperties;
import io.rankwatch4j.core.CancelMode;
import io.rankwatch4j.core.ExecutionOrigin;
import io.rankwatch4j.core.ExecutionQuery;
import io.rankwatch4j.core.ExecutionStatus;
import io.rankwatch4j.core.JobEvent;
import io.rankwatch4j.core.JobEventType;
import io.rankwatch4j.core.JobExecution;
import io.rankwatch4j.core.SchedulerStats;
import io.rankwatch4j.crawl.CrawlExecutor;
import io.rankwatch4j.crawl.CrawlFailure;
import io.rankwatch4j.crawl.CrawlResult;
import io.rankwatch4j.crawl.FailureKind;
import io.rankwatch4j.exception.ConfigurationException;
import io.rankwatch4j.internal.memory.InMemoryJobStore;
import io.rankwatch4j.normalize.NormalizedBook;
import io.rankwatch4j.normalize.NormalizedStat;
import io.rankwatch4j.testing.Fixtures;
import io.rankwatch4j.testing.ManualClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultCrawlSchedulerTest {

    private InMemoryJobStore jobStore;
    private CrawlExecutor crawlExecutor;
    private DefaultCrawlScheduler scheduler;
    private ListAppender<ILoggingEvent> logs;
    private Logger schedulerLogger;

    @BeforeEach
    void setUp() {
        jobStore = new InMemoryJobStore();
        crawlExecutor = mock(CrawlExecutor.class);
        when(crawlExecutor.getCatalog()).thenReturn(Fixtures.catalog());
        scheduler = new DefaultCrawlScheduler(defaultProps(), jobStore, crawlExecutor);

        schedulerLogger = (Logger) LoggerFactory.getLogger(DefaultCrawlScheduler.class);
        logs = new ListAppender<>();
        logs.start();
        schedulerLogger.addAppender(logs);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
        schedulerLogger.detachAppender(logs);
    }

    @Test
    void triggeredRunShouldCompleteWithItemCount() throws Exception {
        when(crawlExecutor.run("jiazi")).thenReturn(success("jiazi", 3));
        List<JobEvent> events = new CopyOnWriteArrayList<>();
        scheduler.addListener(events::add);
        scheduler.start();

        String id = scheduler.triggerNow("jiazi");

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> status(id) == ExecutionStatus.COMPLETED));
        JobExecution done = scheduler.getExecution(id).orElseThrow();
        assertEquals(3, done.getItemsCrawled());
        assertEquals(ExecutionOrigin.MANUAL, done.getOrigin());
        assertNotNull(done.getStartedAt());
        assertTrue(jobStore.findRunLock("jiazi").isEmpty());

        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> !events.isEmpty()));
        assertEquals(JobEventType.SUCCEEDED, events.get(0).type());
        assertEquals(id, events.get(0).executionId());
    }

    @Test
    void fatalFailureShouldFailWithoutRetry() throws Exception {
        when(crawlExecutor.run("jiazi")).thenReturn(failure("jiazi", FailureKind.FATAL, "MalformedResponseException"));
        scheduler.start();

        String id = scheduler.triggerNow("jiazi");

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> status(id) == ExecutionStatus.FAILED));
        Thread.sleep(300);

        assertTrue(retries("jiazi").isEmpty());
        JobExecution failed = scheduler.getExecution(id).orElseThrow();
        assertTrue(failed.getLastError().startsWith("FATAL MalformedResponseException"));
        assertTrue(hasWarn("not retryable"));
        verify(crawlExecutor, times(1)).run("jiazi");
    }

    @Test
    void transientFailureShouldRetryWithHistoryUntilSuccess() throws Exception {
        when(crawlExecutor.run("jiazi")).thenReturn(
                failure("jiazi", FailureKind.TRANSIENT, "TransientCrawlException"),
                failure("jiazi", FailureKind.TRANSIENT, "TransientCrawlException"),
                success("jiazi", 2));
        scheduler.start();

        String first = scheduler.triggerNow("jiazi");

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> retries("jiazi").stream()
                .anyMatch(e -> e.getStatus() == ExecutionStatus.COMPLETED)));

        JobExecution completed = retries("jiazi").stream()
                .filter(e -> e.getStatus() == ExecutionStatus.COMPLETED)
                .findFirst()
                .orElseThrow();
        assertEquals(2, completed.getRetryCount());
        assertEquals(2, completed.getErrorHistory().size());
        assertEquals(2, completed.getItemsCrawled());

        JobExecution second = scheduler.getExecution(completed.getPreviousExecutionId()).orElseThrow();
        assertEquals(ExecutionStatus.FAILED, second.getStatus());
        assertEquals(1, second.getRetryCount());
        assertEquals(first, second.getPreviousExecutionId());
        assertEquals(ExecutionStatus.FAILED, status(first));
    }

    @Test
    void exhaustedRetriesShouldFailTerminallyWithFullHistory() throws Exception {
        when(crawlExecutor.run("jiazi")).thenReturn(failure("jiazi", FailureKind.TRANSIENT, "TransientCrawlException"));
        scheduler.create("jiazi").runAt(Instant.now().plusSeconds(3600)).maxRetries(2).retryBackoff(Duration.ofMillis(20)).save();
        scheduler.start();

        scheduler.triggerNow("jiazi");

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> jobStore.countByStatus(ExecutionStatus.FAILED) == 3));
        Thread.sleep(300);

        assertEquals(3, jobStore.countByStatus(ExecutionStatus.FAILED));
        assertEquals(0, jobStore.countByStatus(ExecutionStatus.PENDING));
        JobExecution last = retries("jiazi").stream().filter(e -> e.getRetryCount() == 2).findFirst().orElseThrow();
        assertEquals(3, last.getErrorHistory().size());
        assertTrue(hasWarn("reached max retries"));
        verify(crawlExecutor, times(3)).run("jiazi");
    }

    @Test
    void unexpectedExceptionShouldBeTreatedAsTransient() throws Exception {
        when(crawlExecutor.run("jiazi"))
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(success("jiazi", 1));
        scheduler.start();

        String id = scheduler.triggerNow("jiazi");

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> retries("jiazi").stream()
                .anyMatch(e -> e.getStatus() == ExecutionStatus.COMPLETED)));
        assertTrue(scheduler.getExecution(id).orElseThrow().getLastError().contains("IllegalStateException"));
    }

    @Test
    void tickShouldBeSkippedWhileThePreviousRunIsActive() {
        Instant now = Instant.now();
        JobExecution running = new JobExecution();
        running.setId("jiazi-running");
        running.setJobId("jiazi");
        running.setTargets(List.of("jiazi"));
        running.setCreatedAt(now);
        running.setScheduledAt(now);
        jobStore.insertExecution(running);
        jobStore.markRunning("jiazi-running", now);
        jobStore.claimRun("jiazi", "jiazi-running", now);

        scheduler.create("jiazi").every("1 hour").save();
        Instant due = now.minusSeconds(1);
        Instant scheduled = jobStore.findDueJobs(now.plusSeconds(7200), 10).get(0).nextRunAt();
        assertTrue(jobStore.advanceNextRun("jiazi", scheduled, due));

        scheduler.pollOnce();

        assertEquals(1, jobStore.findExecutions(ExecutionQuery.builder().jobId("jiazi").build()).size());
        Instant next = jobStore.findDueJobs(now.plusSeconds(7200), 10).get(0).nextRunAt();
        assertEquals(due.plus(Duration.ofHours(1)), next);
        assertTrue(logs.list.stream().anyMatch(e -> e.getFormattedMessage().contains("Skipping tick")
                && e.getFormattedMessage().contains("jiazi-running")));
    }

    @Test
    void reRegisteringAfterRestartShouldKeepTheScheduledTick() {
        ManualClock clock = new ManualClock(Instant.parse("2026-03-01T10:00:00Z"));
        DefaultCrawlScheduler first = new DefaultCrawlScheduler(defaultProps(), jobStore, crawlExecutor, clock);
        first.create("jiazi").every("1 hour").save();
        Instant scheduled = jobStore.findDueJobs(Instant.MAX, 10).get(0).nextRunAt();
        assertEquals(Instant.parse("2026-03-01T11:00:00Z"), scheduled);

        clock.advance(Duration.ofMinutes(50));
        DefaultCrawlScheduler restarted = new DefaultCrawlScheduler(defaultProps(), jobStore, crawlExecutor, clock);
        assertTrue(restarted.create("jiazi").every("1 hour").save().updated());
        assertEquals(scheduled, jobStore.findDueJobs(Instant.MAX, 10).get(0).nextRunAt());

        restarted.create("jiazi").every("2 hours").save();
        assertEquals(Instant.parse("2026-03-01T12:50:00Z"), jobStore.findDueJobs(Instant.MAX, 10).get(0).nextRunAt());
    }

    @Test
    void pendingExecutionShouldWaitForTheRunLock() {
        jobStore.claimRun("jiazi", "someone-else", Instant.now());
        String id = scheduler.triggerNow("jiazi");

        scheduler.pollOnce();
        assertEquals("someone-else", jobStore.findRunLock("jiazi").orElseThrow().executionId());
        assertEquals(ExecutionStatus.PENDING, status(id));

        jobStore.releaseRun("jiazi", "someone-else");
        scheduler.pollOnce();
        assertEquals(id, jobStore.findRunLock("jiazi").orElseThrow().executionId());
    }

    @Test
    void recurringJobShouldFireOnSchedule() throws Exception {
        when(crawlExecutor.run("jiazi")).thenReturn(success("jiazi", 1));
        scheduler.create("jiazi").every("1 second").save();
        scheduler.start();

        assertTrue(waitUntil(6, TimeUnit.SECONDS, () -> jobStore.findExecutions(ExecutionQuery.builder()
                .jobId("jiazi").origin(ExecutionOrigin.SCHEDULED).status(ExecutionStatus.COMPLETED).build()).size() >= 2));
    }

    @Test
    void batchTriggerShouldFanOutOneChildPerSource() throws Exception {
        when(crawlExecutor.run(anyString())).thenAnswer(inv -> success(inv.getArgument(0), 1));
        scheduler.start();

        String parentId = scheduler.trigger("romance,fantasy", null);

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> status(parentId) == ExecutionStatus.COMPLETED));
        JobExecution parent = scheduler.getExecution(parentId).orElseThrow();
        assertEquals(CrawlScheduler.MANUAL_BATCH_PREFIX + "romance,fantasy", parent.getJobId());
        assertEquals(2, parent.getChildExecutionIds().size());

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> parent.getChildExecutionIds().stream()
                .allMatch(c -> status(c) == ExecutionStatus.COMPLETED)));

        List<JobExecution> children = scheduler.listExecutions(ExecutionQuery.builder()
                .parentExecutionId(parentId).build());
        assertEquals(2, children.size());
        List<String> childJobs = new ArrayList<>();
        for (JobExecution child : children) {
            assertEquals(ExecutionOrigin.BATCH_CHILD, child.getOrigin());
            childJobs.add(child.getJobId());
        }
        assertTrue(childJobs.containsAll(List.of("romance", "fantasy")));
        verify(crawlExecutor, never()).run("jiazi");
    }

    @Test
    void childFailureShouldNotFailTheBatch() throws Exception {
        when(crawlExecutor.run("romance")).thenReturn(success("romance", 1));
        when(crawlExecutor.run("fantasy")).thenReturn(failure("fantasy", FailureKind.FATAL, "MalformedItemException"));
        scheduler.start();

        String parentId = scheduler.trigger("category", null);

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> jobStore.countByStatus(ExecutionStatus.FAILED) == 1
                && jobStore.countByStatus(ExecutionStatus.COMPLETED) == 2));
        assertEquals(ExecutionStatus.COMPLETED, status(parentId));
    }

    @Test
    void staleRunningExecutionShouldBeFailedAndUnlocked() {
        Instant longAgo = Instant.now().minus(Duration.ofHours(2));
        JobExecution stuck = new JobExecution();
        stuck.setId("jiazi-stuck");
        stuck.setJobId("jiazi");
        stuck.setTargets(List.of("jiazi"));
        stuck.setCreatedAt(longAgo);
        stuck.setScheduledAt(longAgo);
        jobStore.insertExecution(stuck);
        jobStore.markRunning("jiazi-stuck", longAgo);
        jobStore.claimRun("jiazi", "jiazi-stuck", longAgo);

        scheduler.pollOnce();

        JobExecution failed = jobStore.findExecution("jiazi-stuck").orElseThrow();
        assertEquals(ExecutionStatus.FAILED, failed.getStatus());
        assertTrue(failed.getLastError().startsWith("stale execution"));
        assertTrue(jobStore.findRunLock("jiazi").isEmpty());
    }

    @Test
    void registerShouldValidateTargets() {
        assertThrows(ConfigurationException.class,
                () -> scheduler.create("nightly").targets("jiazi", "unknown").every("1 day").save());
        assertThrows(ConfigurationException.class,
                () -> scheduler.create("romance").targets("category").every("1 day").save());
        assertThrows(ConfigurationException.class, () -> scheduler.triggerNow("nope"));
        assertThrows(IllegalStateException.class, () -> scheduler.create("jiazi").save());

        scheduler.create("categories").targets("category").cron("0", "6,18", null).save();
        assertEquals(List.of("romance", "fantasy"), jobStore.findDefinition("categories").orElseThrow().targets());
    }

    @Test
    void cancelAndStatsShouldReflectDefinitions() {
        scheduler.create("jiazi").every("1 hour").save();
        scheduler.create("romance").every("2 hours").save();

        SchedulerStats before = scheduler.getStats();
        assertFalse(before.running());
        assertEquals(2, before.jobCount());
        assertEquals(2, before.activeJobCount());
        assertNull(before.startedAt());

        assertEquals(1, scheduler.cancel("jiazi", CancelMode.DISABLE).modified());
        assertEquals(1, scheduler.cancel("romance", CancelMode.DELETE).deleted());

        SchedulerStats after = scheduler.getStats();
        assertEquals(1, after.jobCount());
        assertEquals(0, after.activeJobCount());
    }

    @Test
    void startAndStopShouldBeIdempotent() {
        scheduler.start();
        scheduler.start();
        assertTrue(scheduler.isRunning());
        assertNotNull(scheduler.getStats().startedAt());

        scheduler.stop();
        scheduler.stop();
        assertFalse(scheduler.isRunning());
    }

    private ExecutionStatus status(String executionId) {
        return jobStore.findExecution(executionId).map(JobExecution::getStatus).orElse(null);
    }

    private List<JobExecution> retries(String jobId) {
        return jobStore.findExecutions(ExecutionQuery.builder().jobId(jobId).origin(ExecutionOrigin.RETRY).build());
    }

    private boolean hasWarn(String fragment) {
        return logs.list.stream()
                .anyMatch(e -> e.getLevel() == Level.WARN && e.getFormattedMessage().contains(fragment));
    }

    private static CrawlResult success(String sourceId, int items) {
        List<NormalizedBook> books = new ArrayList<>();
        List<NormalizedStat> stats = new ArrayList<>();
        for (int i = 0; i < items; i++) {
            String id = sourceId + "-" + i;
            books.add(new NormalizedBook(id, "Book " + id, null, null, null, List.of()));
            stats.add(new NormalizedStat(id, 1, 0, 0, 0, 0, 0, 0));
        }
        Instant now = Instant.now();
        return new CrawlResult(sourceId, books, stats, 0, 0, null, now, now);
    }

    private static CrawlResult failure(String sourceId, FailureKind kind, String type) {
        Instant now = Instant.now();
        return CrawlResult.failed(sourceId, new CrawlFailure(kind, type, "simulated"), now, now);
    }

    private static SchedulerProperties defaultProps() {
        SchedulerProperties props = new SchedulerProperties();
        props.setProcessEvery(Duration.ofMillis(50));
        props.setMaxWorkers(3);
        props.setBatchSize(10);
        props.setMaxRetries(3);
        props.setRetryBackoff(Duration.ofMillis(20));
        props.setMaxRetryDelay(Duration.ofMillis(200));
        props.setWorkerId("test-worker");
        return props;
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(50);
        }
        return false;
    }
}
