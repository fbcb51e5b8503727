package io.rankwatch4j.internal;

import io.rankwatch4j.CrawlScheduler;
import io.rankwatch4j.JobBuilder;
import io.rankwatch4j.JobEventListener;
import io.rankwatch4j.config.SchedulerProperties;
import io.rankwatch4j.core.CancelMode;
import io.rankwatch4j.core.CancelResult;
import io.rankwatch4j.core.DueJob;
import io.rankwatch4j.core.ExecutionOrigin;
import io.rankwatch4j.core.ExecutionQuery;
import io.rankwatch4j.core.ExecutionStatus;
import io.rankwatch4j.core.JobDefinition;
import io.rankwatch4j.core.JobEvent;
import io.rankwatch4j.core.JobExecution;
import io.rankwatch4j.core.PersistResult;
import io.rankwatch4j.core.RunLock;
import io.rankwatch4j.core.SchedulerStats;
import io.rankwatch4j.core.TriggerSpec;
import io.rankwatch4j.crawl.CrawlExecutor;
import io.rankwatch4j.crawl.CrawlFailure;
import io.rankwatch4j.crawl.CrawlResult;
import io.rankwatch4j.crawl.SourceCatalog;
import io.rankwatch4j.exception.ConfigurationException;
import io.rankwatch4j.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Store-backed crawl scheduler &amp; runner.
 *
 * <p>Threads:
 * <ul>
 *   <li>poller: fires due triggers, picks up due PENDING executions, reconciles stale state</li>
 *   <li>dispatcher: hands executions to the worker pool when their time comes</li>
 *   <li>workers ({@code maxWorkers}): run one crawl each and post the outcome as a {@link JobEvent}</li>
 *   <li>event loop: records outcomes and decides retry vs. terminal failure</li>
 * </ul>
 *
 * <p>Single flight: an execution only runs while it holds its job's run lock in the {@link JobStore}.
 * A recurring tick that cannot take the lock is skipped; a PENDING execution that cannot take it
 * stays PENDING until the lock is free.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.start();
 *
 * scheduler.create("jiazi").every("1 hour").save();
 * scheduler.create("morning-categories").targets("category").cron("0", "6,8,10,12,14,16,18", null).save();
 *
 * String executionId = scheduler.triggerNow("jiazi");
 * scheduler.stop();
 * }</pre>
 */
public class DefaultCrawlScheduler implements CrawlScheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultCrawlScheduler.class);

    private static final int MAX_POLL_FAILURES = 30;
    private static final int SLOW_BACKOFF_AFTER = 10;

    private final SchedulerProperties props;
    private final JobStore jobStore;
    private final CrawlExecutor crawlExecutor;
    private final SourceCatalog catalog;
    private final Clock clock;
    private final String workerId;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile Instant startedAt;

    private ExecutorService workerPool;
    private Thread pollerThread;
    private Thread dispatcherThread;
    private Thread eventThread;

    private final DelayQueue<DelayedExecution> queue = new DelayQueue<>();
    private final ConcurrentHashMap<String, Boolean> enqueued = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final BlockingQueue<JobEvent> events = new LinkedBlockingQueue<>();
    private final List<JobEventListener> listeners = new CopyOnWriteArrayList<>();

    private final Semaphore refillSignal = new Semaphore(0);
    private final Semaphore globalSem;

    private int systemErrorCount = 0;
    private Instant lastMaintenance;

    private final class DelayedExecution implements Delayed {
        private final JobExecution execution;
        private final Instant runAt;

        private DelayedExecution(JobExecution execution) {
            this.execution = execution;
            this.runAt = execution.getScheduledAt();
        }

        @Override
        public long getDelay(TimeUnit unit) {
            long ms = Duration.between(clock.instant(), runAt).toMillis();
            return unit.convert(ms, TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            if (other == this) return 0;
            if (other instanceof DelayedExecution o) {
                return this.runAt.compareTo(o.runAt);
            }
            return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }
    }

    public DefaultCrawlScheduler(SchedulerProperties props, JobStore jobStore, CrawlExecutor crawlExecutor) {
        this(props, jobStore, crawlExecutor, Clock.systemUTC());
    }

    public DefaultCrawlScheduler(SchedulerProperties props, JobStore jobStore, CrawlExecutor crawlExecutor, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.crawlExecutor = Objects.requireNonNull(crawlExecutor, "crawlExecutor must not be null");
        this.catalog = crawlExecutor.getCatalog();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (props.getMaxWorkers() <= 0) {
            throw new IllegalArgumentException("rankwatch.scheduler.maxWorkers must be positive");
        }
        this.globalSem = new Semaphore(props.getMaxWorkers());
        this.workerId = resolveWorkerId(props.getWorkerId());
    }

    /**
     * Start polling and executing due jobs. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration interval = Objects.requireNonNull(props.getProcessEvery(), "rankwatch.scheduler.processEvery must not be null");
        if (interval.isZero() || interval.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("rankwatch.scheduler.processEvery must be a positive duration");
        }

        log.info("Scheduler starting with processEvery={}, maxWorkers={}, batchSize={}, maxRetries={}, retryBackoff={}, workerId={}",
                props.getProcessEvery(),
                props.getMaxWorkers(),
                props.getBatchSize(),
                props.getMaxRetries(),
                props.getRetryBackoff(),
                workerId);

        startedAt = clock.instant();
        systemErrorCount = 0;

        workerPool = Executors.newFixedThreadPool(props.getMaxWorkers(), r -> {
            Thread t = new Thread(r);
            t.setName("rankwatch.worker");
            t.setDaemon(true);
            return t;
        });

        eventThread = daemon("rankwatch.events", this::eventLoop);
        dispatcherThread = daemon("rankwatch.dispatcher", this::dispatchLoop);
        pollerThread = daemon("rankwatch.poller", this::pollerLoop);

        log.info("Scheduler started successfully.");
    }

    /**
     * Stop polling and executing. In-flight crawls finish and their outcomes are recorded. Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Scheduler stopping...");

        if (pollerThread != null) {
            pollerThread.interrupt();
            pollerThread = null;
        }

        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
            dispatcherThread = null;
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(props.getProcessEvery().multipliedBy(12).toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Scheduler workers did not finish in time; interrupting");
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }

        if (eventThread != null) {
            eventThread.interrupt();
            try {
                eventThread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            eventThread = null;
        }
        // outcomes posted after the event thread exited
        JobEvent leftover;
        while ((leftover = events.poll()) != null) {
            handleEvent(leftover);
        }

        // queued executions keep their run lock; release it so another scheduler can take them
        for (DelayedExecution de : queue) {
            jobStore.releaseRun(de.execution.getJobId(), de.execution.getId());
        }
        queue.clear();
        enqueued.clear();
        refillSignal.drainPermits();
        log.info("Scheduler stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public JobBuilder create(String jobId) {
        return new SimpleJobBuilder(jobId, props.getMaxRetries(), props.getRetryBackoff(), this::register);
    }

    @Override
    public PersistResult register(JobDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");

        List<String> targets = expandTargets(definition.targets());
        if (targets.size() > 1 && catalog.find(definition.id()).isPresent()) {
            throw new ConfigurationException("batch job id must not be a source id: " + definition.id());
        }
        JobDefinition resolved = new JobDefinition(
                definition.id(), targets, definition.trigger(), definition.maxRetries(), definition.retryBackoff());

        Instant now = clock.instant();
        Instant firstRun = resolved.trigger().firstRunAt(now);
        PersistResult result = jobStore.saveDefinition(resolved, firstRun);
        log.info("Job registered jobId={} targets={} trigger={} created={}",
                resolved.id(), resolved.targets(), resolved.trigger(), result.created());
        log.debug("Job run time candidate jobId={} firstRunAt={}", resolved.id(), firstRun);
        refillSignal.release();
        return result;
    }

    @Override
    public String trigger(String target, Instant runAt) {
        Objects.requireNonNull(target, "target must not be null");
        List<String> targets = catalog.resolveTargets(target);

        Instant now = clock.instant();
        Instant at = runAt != null ? runAt : now;

        String jobId = targets.size() == 1 ? targets.get(0) : MANUAL_BATCH_PREFIX + target.trim();
        JobDefinition definition = jobStore.findDefinition(jobId).orElseGet(() -> {
            JobDefinition oneShot = new JobDefinition(
                    jobId, targets, TriggerSpec.once(at), props.getMaxRetries(), props.getRetryBackoff());
            jobStore.saveDefinitionIfAbsent(oneShot, null);
            return oneShot;
        });

        JobExecution execution = newExecution(definition, targets, ExecutionOrigin.MANUAL, at, now);
        jobStore.insertExecution(execution);
        log.info("Job triggered jobId={} executionId={} targets={} runAt={}", jobId, execution.getId(), targets, at);
        refillSignal.release();
        return execution.getId();
    }

    @Override
    public Optional<JobExecution> getExecution(String executionId) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        return jobStore.findExecution(executionId);
    }

    @Override
    public List<JobExecution> listExecutions(ExecutionQuery query) {
        return jobStore.findExecutions(query == null ? ExecutionQuery.all() : query);
    }

    @Override
    public SchedulerStats getStats() {
        return new SchedulerStats(
                started.get(),
                jobStore.countDefinitions(),
                jobStore.countActiveDefinitions(),
                jobStore.countByStatus(ExecutionStatus.PENDING),
                jobStore.countByStatus(ExecutionStatus.RUNNING),
                jobStore.countByStatus(ExecutionStatus.COMPLETED),
                jobStore.countByStatus(ExecutionStatus.FAILED),
                started.get() ? startedAt : null
        );
    }

    @Override
    public CancelResult cancel(String jobId, CancelMode mode) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(mode, "mode must not be null");

        CancelResult result = switch (mode) {
            case DISABLE -> jobStore.disableDefinition(jobId);
            case DELETE -> jobStore.deleteDefinition(jobId);
        };
        log.info("Job cancelled jobId={} mode={} result={}", jobId, mode, result);
        return result;
    }

    @Override
    public void addListener(JobEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /**
     * Utility: identity of this scheduler instance, used in logs.
     */
    public String getWorkerId() {
        return workerId;
    }

    private List<String> expandTargets(List<String> targets) {
        Set<String> out = new LinkedHashSet<>();
        for (String t : targets) {
            out.addAll(catalog.resolveTargets(t));
        }
        return List.copyOf(out);
    }

    private Thread daemon(String name, Runnable body) {
        Thread t = new Thread(body);
        t.setName(name);
        t.setDaemon(true);
        t.start();
        return t;
    }

    private String resolveWorkerId(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId;
        }

        String host = "rankwatch4j";
        try {
            host = java.net.InetAddress.getLocalHost().getHostName();
        } catch (java.io.IOException e) {
            log.debug("Could not resolve local host name, using default msg={}", e.getMessage());
        }

        String generated = host + "-" + ProcessHandle.current().pid() + "-" + java.util.UUID.randomUUID();
        return generated.length() > 128 ? generated.substring(0, 128) : generated;
    }

    /* ========================= poller ========================= */

    private void pollerLoop() {
        while (started.get()) {
            boolean backlog;
            try {
                backlog = pollOnce();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("scheduler pollOnce failed count={} msg={}", systemErrorCount, e.getMessage(), e);
                if (systemErrorCount >= MAX_POLL_FAILURES) {
                    log.error("Scheduler stopped due to repeated system failures...");
                    Thread stopper = new Thread(this::stop, "rankwatch.stopper");
                    stopper.setDaemon(true);
                    stopper.start();
                    break;
                }

                try {
                    Duration sleep = (systemErrorCount >= SLOW_BACKOFF_AFTER)
                            ? Duration.ofSeconds(60)
                            : backoff(systemErrorCount);
                    Thread.sleep(sleep.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            if (!started.get()) {
                break;
            }

            try {
                if (backlog) {
                    refillSignal.tryAcquire(200, TimeUnit.MILLISECONDS);
                } else {
                    refillSignal.tryAcquire(props.getProcessEvery().toMillis(), TimeUnit.MILLISECONDS);
                }
                refillSignal.drainPermits();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated poll-loop failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount - 1, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    /**
     * Job retry delay after a failed execution.
     * retryCount is that of the failed execution (0 for the first run).
     * Default: 30s, 60s, 120s... capped at maxRetryDelay.
     */
    private Duration retryDelay(Duration base, int retryCount) {
        int exp = Math.max(0, Math.min(retryCount, 20)); // avoid overflow
        long ms = base.toMillis() * (1L << exp);
        long cap = props.getMaxRetryDelay().toMillis();
        return Duration.ofMillis(ms < 0 ? cap : Math.min(ms, cap));
    }

    boolean pollOnce() {
        Instant now = clock.instant();
        Instant windowEnd = now.plus(props.getProcessEvery());

        fireDueTriggers(now);
        boolean backlog = enqueueDuePending(now, windowEnd);

        if (lastMaintenance == null
                || !now.isBefore(lastMaintenance.plus(props.getMaintenanceInterval()))) {
            lastMaintenance = now;
            reconcile(now);
        }
        return backlog;
    }

    private void fireDueTriggers(Instant now) {
        int batchSize = Math.max(1, props.getBatchSize());
        List<DueJob> dueJobs = jobStore.findDueJobs(now, batchSize);
        log.debug("Scheduler polled due jobs count={} now={}", dueJobs.size(), now);

        for (DueJob due : dueJobs) {
            JobDefinition def = due.definition();
            Instant next;
            try {
                next = def.trigger().nextRunAfter(due.nextRunAt(), now);
            } catch (IllegalArgumentException e) {
                log.error("cannot compute next run; disabling jobId={} trigger={} msg={}", def.id(), def.trigger(), e.getMessage());
                next = null;
            }

            if (!jobStore.advanceNextRun(def.id(), due.nextRunAt(), next)) {
                log.debug("tick already taken jobId={} firedAt={}", def.id(), due.nextRunAt());
                continue;
            }

            JobExecution execution = newExecution(def, def.targets(), ExecutionOrigin.SCHEDULED, due.nextRunAt(), now);
            if (!jobStore.claimRun(def.id(), execution.getId(), now)) {
                String holder = jobStore.findRunLock(def.id()).map(RunLock::executionId).orElse("?");
                log.info("Skipping tick; previous execution still active jobId={} firedAt={} activeExecutionId={} nextRunAt={}",
                        def.id(), due.nextRunAt(), holder, next);
                continue;
            }

            try {
                jobStore.insertExecution(execution);
            } catch (RuntimeException e) {
                jobStore.releaseRun(def.id(), execution.getId());
                throw e;
            }
            log.debug("tick fired jobId={} executionId={} nextRunAt={}", def.id(), execution.getId(), next);
        }
    }

    private boolean enqueueDuePending(Instant now, Instant windowEnd) {
        int batchSize = Math.max(1, props.getBatchSize());
        int limit = batchSize + enqueued.size() + inFlight.size();
        List<JobExecution> due = jobStore.findDuePendingExecutions(windowEnd, limit);

        int added = 0;
        for (JobExecution execution : due) {
            if (enqueued.containsKey(execution.getId()) || inFlight.contains(execution.getId())) {
                continue;
            }
            if (!jobStore.claimRun(execution.getJobId(), execution.getId(), now)) {
                log.debug("execution deferred; job is busy jobId={} executionId={}", execution.getJobId(), execution.getId());
                continue;
            }
            if (enqueued.putIfAbsent(execution.getId(), Boolean.TRUE) == null) {
                queue.offer(new DelayedExecution(execution));
                added++;
            }
        }
        log.debug("Scheduler enqueued executions count={} windowEnd={}", added, windowEnd);
        return due.size() >= limit;
    }

    /**
     * Fails RUNNING executions older than {@code staleExecutionAfter}, frees run locks left by
     * executions that are no longer running, and prunes old history.
     */
    private void reconcile(Instant now) {
        Instant staleCutoff = now.minus(props.getStaleExecutionAfter());

        for (JobExecution stale : jobStore.findRunningStartedBefore(staleCutoff)) {
            if (inFlight.contains(stale.getId())) {
                continue;
            }
            if (jobStore.markFailed(stale.getId(), now, "stale execution: running since " + stale.getStartedAt())) {
                log.warn("Stale execution marked failed jobId={} executionId={} startedAt={}",
                        stale.getJobId(), stale.getId(), stale.getStartedAt());
            }
            jobStore.releaseRun(stale.getJobId(), stale.getId());
        }

        for (RunLock lock : jobStore.findRunLocksOlderThan(staleCutoff)) {
            if (inFlight.contains(lock.executionId()) || enqueued.containsKey(lock.executionId())) {
                continue;
            }
            Optional<JobExecution> holder = jobStore.findExecution(lock.executionId());
            if (holder.isEmpty() || holder.get().getStatus() != ExecutionStatus.RUNNING) {
                if (jobStore.releaseRun(lock.jobId(), lock.executionId())) {
                    log.warn("Released orphaned run lock jobId={} executionId={} lockedAt={}",
                            lock.jobId(), lock.executionId(), lock.lockedAt());
                }
            }
        }

        long pruned = jobStore.pruneFinishedBefore(now.minus(props.getHistoryRetention()));
        if (pruned > 0) {
            log.info("Pruned finished executions count={} retention={}", pruned, props.getHistoryRetention());
        }
    }

    /* ========================= dispatch & workers ========================= */

    private void dispatchLoop() {
        while (started.get()) {
            try {
                DelayedExecution de = queue.take();
                submitToWorker(de.execution);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("scheduler dispatcher failed msg={}", e.getMessage(), e);
            }
        }
    }

    private void submitToWorker(JobExecution execution) throws InterruptedException {
        try {
            globalSem.acquire();
        } catch (InterruptedException e) {
            enqueued.remove(execution.getId());
            jobStore.releaseRun(execution.getJobId(), execution.getId());
            throw e;
        }
        try {
            workerPool.submit(() -> {
                try {
                    runExecution(execution);
                } finally {
                    globalSem.release();
                    refillSignal.release();
                }
            });
        } catch (RuntimeException e) {
            globalSem.release();
            enqueued.remove(execution.getId());
            jobStore.releaseRun(execution.getJobId(), execution.getId());
            throw e;
        }
    }

    private void runExecution(JobExecution execution) {
        String id = execution.getId();
        String jobId = execution.getJobId();
        try {
            Instant startedAt = clock.instant();
            if (!jobStore.markRunning(id, startedAt)) {
                log.debug("execution no longer pending; skipping jobId={} executionId={}", jobId, id);
                jobStore.releaseRun(jobId, id);
                return;
            }
            inFlight.add(id);
        } finally {
            enqueued.remove(id);
        }

        try {
            log.debug("Job started jobId={} executionId={} targets={}", jobId, id, execution.getTargets());
            if (execution.isBatch()) {
                List<String> children = fanOut(execution);
                events.offer(JobEvent.dispatched(id, jobId, children, clock.instant()));
            } else {
                CrawlResult result = crawlExecutor.run(execution.getTargets().get(0));
                events.offer(JobEvent.of(id, jobId, result, clock.instant()));
            }
        } catch (Exception e) {
            log.error("job failed jobId={} executionId={} msg={}", jobId, id, e.getMessage(), e);
            events.offer(JobEvent.errored(id, jobId, e, clock.instant()));
        }
    }

    /**
     * Creates one PENDING child execution per target, each under the target's own job id.
     */
    private List<String> fanOut(JobExecution parent) {
        Instant now = clock.instant();
        List<String> children = new ArrayList<>(parent.getTargets().size());
        for (String target : parent.getTargets()) {
            JobDefinition childDef = jobStore.findDefinition(target).orElseGet(() -> {
                JobDefinition oneShot = new JobDefinition(
                        target, List.of(target), TriggerSpec.once(now), props.getMaxRetries(), props.getRetryBackoff());
                jobStore.saveDefinitionIfAbsent(oneShot, null);
                return oneShot;
            });

            JobExecution child = newExecution(childDef, List.of(target), ExecutionOrigin.BATCH_CHILD, now, now);
            child.setParentExecutionId(parent.getId());
            jobStore.insertExecution(child);
            children.add(child.getId());
        }
        log.info("Batch dispatched jobId={} executionId={} children={}", parent.getJobId(), parent.getId(), children.size());
        return children;
    }

    /* ========================= outcomes ========================= */

    private void eventLoop() {
        while (started.get() || !events.isEmpty()) {
            try {
                handleEvent(events.take());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("scheduler event loop failed msg={}", e.getMessage(), e);
            }
        }
    }

    private void handleEvent(JobEvent event) {
        String id = event.executionId();
        try {
            Optional<JobExecution> found = jobStore.findExecution(id);
            if (found.isEmpty()) {
                log.warn("outcome for unknown execution ignored jobId={} executionId={}", event.jobId(), id);
                return;
            }
            JobExecution execution = found.get();

            switch (event.type()) {
                case SUCCEEDED -> onSuccess(execution, event);
                case FAILED -> onFailure(execution, event.result().failure(), event.at());
                case ERRORED -> onFailure(execution, CrawlFailure.transientFailure(event.error()), event.at());
            }
        } finally {
            inFlight.remove(id);
            jobStore.releaseRun(event.jobId(), id);
            refillSignal.release();
        }

        for (JobEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("job event listener failed executionId={} msg={}", id, e.getMessage(), e);
            }
        }
    }

    private void onSuccess(JobExecution execution, JobEvent event) {
        CrawlResult r = event.result();
        boolean marked = r == null
                ? jobStore.markCompleted(execution.getId(), event.at(), 0, 0, 0, event.childExecutions())
                : jobStore.markCompleted(execution.getId(), event.at(), r.itemsCrawled(), r.skippedItems(), r.detailFailures(), List.of());
        if (!marked) {
            log.warn("execution was no longer running when it completed jobId={} executionId={}", execution.getJobId(), execution.getId());
            return;
        }
        log.info("Job completed jobId={} executionId={} items={} retryCount={}",
                execution.getJobId(), execution.getId(), r == null ? 0 : r.itemsCrawled(), execution.getRetryCount());
    }

    private void onFailure(JobExecution execution, CrawlFailure failure, Instant at) {
        String error = failure.toString();
        if (!jobStore.markFailed(execution.getId(), at, error)) {
            log.warn("execution was already terminal when it failed jobId={} executionId={} error={}",
                    execution.getJobId(), execution.getId(), error);
            return;
        }

        List<String> history = new ArrayList<>(execution.getErrorHistory());
        history.add(error);

        if (!failure.isRetryable()) {
            log.warn("job failed terminally; error is not retryable jobId={} executionId={} error={} history={}",
                    execution.getJobId(), execution.getId(), error, history);
            return;
        }

        if (execution.getRetryCount() >= execution.getMaxRetries()) {
            log.warn("job failed terminally; reached max retries jobId={} executionId={} retries={} maxRetries={} history={}",
                    execution.getJobId(), execution.getId(), execution.getRetryCount(), execution.getMaxRetries(), history);
            return;
        }

        Duration delay = retryDelay(execution.getRetryBackoff(), execution.getRetryCount());
        JobExecution retry = new JobExecution();
        retry.setId(ExecutionIds.next(execution.getJobId(), at));
        retry.setJobId(execution.getJobId());
        retry.setTargets(execution.getTargets());
        retry.setStatus(ExecutionStatus.PENDING);
        retry.setOrigin(ExecutionOrigin.RETRY);
        retry.setCreatedAt(at);
        retry.setScheduledAt(at.plus(delay));
        retry.setRetryCount(execution.getRetryCount() + 1);
        retry.setMaxRetries(execution.getMaxRetries());
        retry.setRetryBackoff(execution.getRetryBackoff());
        retry.setErrorHistory(history);
        retry.setLastError(error);
        retry.setParentExecutionId(execution.getParentExecutionId());
        retry.setPreviousExecutionId(execution.getId());
        jobStore.insertExecution(retry);

        log.warn("job failed; retry scheduled jobId={} executionId={} retryExecutionId={} attempt={}/{} delay={} error={}",
                execution.getJobId(), execution.getId(), retry.getId(), retry.getRetryCount(), retry.getMaxRetries(), delay, error);
    }

    private JobExecution newExecution(JobDefinition def, List<String> targets, ExecutionOrigin origin,
                                      Instant scheduledAt, Instant now) {
        JobExecution e = new JobExecution();
        e.setId(ExecutionIds.next(def.id(), now));
        e.setJobId(def.id());
        e.setTargets(targets);
        e.setStatus(ExecutionStatus.PENDING);
        e.setOrigin(origin);
        e.setCreatedAt(now);
        e.setScheduledAt(scheduledAt);
        e.setRetryCount(0);
        e.setMaxRetries(def.maxRetries());
        e.setRetryBackoff(def.retryBackoff());
        return e;
    }
}
