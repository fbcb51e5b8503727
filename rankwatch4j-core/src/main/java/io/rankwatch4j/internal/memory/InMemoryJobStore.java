package io.rankwatch4j.internal.memory;

import io.rankwatch4j.core.CancelResult;
import io.rankwatch4j.core.DueJob;
import io.rankwatch4j.core.ExecutionQuery;
import io.rankwatch4j.core.ExecutionStatus;
import io.rankwatch4j.core.JobDefinition;
import io.rankwatch4j.core.JobExecution;
import io.rankwatch4j.core.PersistResult;
import io.rankwatch4j.core.RunLock;
import io.rankwatch4j.store.JobStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Single-process {@link JobStore}. Every method is synchronized on the store, which makes each
 * read-modify-write atomic. Executions are copied in and out.
 */
public class InMemoryJobStore implements JobStore {

    private static final class DefinitionEntry {
        private JobDefinition definition;
        private Instant nextRunAt;

        private DefinitionEntry(JobDefinition definition, Instant nextRunAt) {
            this.definition = definition;
            this.nextRunAt = nextRunAt;
        }
    }

    private final Map<String, DefinitionEntry> definitions = new LinkedHashMap<>();
    private final Map<String, RunLock> runLocks = new HashMap<>();
    private final Map<String, JobExecution> executions = new LinkedHashMap<>();

    @Override
    public synchronized PersistResult saveDefinition(JobDefinition definition, Instant nextRunAt) {
        Objects.requireNonNull(definition, "definition must not be null");
        DefinitionEntry existing = definitions.get(definition.id());
        if (existing == null) {
            definitions.put(definition.id(), new DefinitionEntry(definition, nextRunAt));
            return PersistResult.createdResult(definition.id());
        }
        boolean keepNextRun = existing.nextRunAt != null && existing.definition.trigger().equals(definition.trigger());
        existing.definition = definition;
        if (!keepNextRun) {
            existing.nextRunAt = nextRunAt;
        }
        return PersistResult.updatedResult(definition.id());
    }

    @Override
    public synchronized boolean saveDefinitionIfAbsent(JobDefinition definition, Instant nextRunAt) {
        Objects.requireNonNull(definition, "definition must not be null");
        if (definitions.containsKey(definition.id())) {
            return false;
        }
        definitions.put(definition.id(), new DefinitionEntry(definition, nextRunAt));
        return true;
    }

    @Override
    public synchronized Optional<JobDefinition> findDefinition(String jobId) {
        DefinitionEntry e = definitions.get(jobId);
        return e == null ? Optional.empty() : Optional.of(e.definition);
    }

    @Override
    public synchronized List<JobDefinition> listDefinitions() {
        List<JobDefinition> out = new ArrayList<>(definitions.size());
        definitions.values().forEach(e -> out.add(e.definition));
        return out;
    }

    @Override
    public synchronized long countDefinitions() {
        return definitions.size();
    }

    @Override
    public synchronized long countActiveDefinitions() {
        return definitions.values().stream().filter(e -> e.nextRunAt != null).count();
    }

    @Override
    public synchronized CancelResult disableDefinition(String jobId) {
        DefinitionEntry e = definitions.get(jobId);
        if (e == null) {
            return CancelResult.empty();
        }
        long modified = e.nextRunAt != null ? 1 : 0;
        e.nextRunAt = null;
        return CancelResult.disabled(modified);
    }

    @Override
    public synchronized CancelResult deleteDefinition(String jobId) {
        return definitions.remove(jobId) == null ? CancelResult.empty() : CancelResult.deleted(1);
    }

    @Override
    public synchronized List<DueJob> findDueJobs(Instant windowEnd, int limit) {
        Objects.requireNonNull(windowEnd, "windowEnd must not be null");
        return definitions.values().stream()
                .filter(e -> e.nextRunAt != null && !e.nextRunAt.isAfter(windowEnd))
                .sorted(Comparator.comparing(e -> e.nextRunAt))
                .limit(Math.max(0, limit))
                .map(e -> new DueJob(e.definition, e.nextRunAt))
                .toList();
    }

    @Override
    public synchronized boolean advanceNextRun(String jobId, Instant expected, Instant next) {
        DefinitionEntry e = definitions.get(jobId);
        if (e == null || !Objects.equals(e.nextRunAt, expected)) {
            return false;
        }
        e.nextRunAt = next;
        return true;
    }

    @Override
    public synchronized boolean claimRun(String jobId, String executionId, Instant now) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(executionId, "executionId must not be null");
        RunLock current = runLocks.get(jobId);
        if (current != null) {
            return current.executionId().equals(executionId);
        }
        runLocks.put(jobId, new RunLock(jobId, executionId, now));
        return true;
    }

    @Override
    public synchronized boolean releaseRun(String jobId, String executionId) {
        RunLock current = runLocks.get(jobId);
        if (current == null || !current.executionId().equals(executionId)) {
            return false;
        }
        runLocks.remove(jobId);
        return true;
    }

    @Override
    public synchronized Optional<RunLock> findRunLock(String jobId) {
        return Optional.ofNullable(runLocks.get(jobId));
    }

    @Override
    public synchronized List<RunLock> findRunLocksOlderThan(Instant cutoff) {
        return runLocks.values().stream()
                .filter(l -> l.lockedAt().isBefore(cutoff))
                .toList();
    }

    @Override
    public synchronized void insertExecution(JobExecution execution) {
        Objects.requireNonNull(execution, "execution must not be null");
        Objects.requireNonNull(execution.getId(), "execution id must not be null");
        if (executions.containsKey(execution.getId())) {
            throw new IllegalStateException("duplicate execution id: " + execution.getId());
        }
        executions.put(execution.getId(), execution.copy());
    }

    @Override
    public synchronized boolean markRunning(String executionId, Instant startedAt) {
        JobExecution e = executions.get(executionId);
        if (e == null || e.getStatus() != ExecutionStatus.PENDING) {
            return false;
        }
        e.setStatus(ExecutionStatus.RUNNING);
        e.setStartedAt(startedAt);
        return true;
    }

    @Override
    public synchronized boolean markCompleted(String executionId, Instant completedAt, int itemsCrawled, int skippedItems,
                                              int detailFailures, List<String> childExecutionIds) {
        JobExecution e = executions.get(executionId);
        if (e == null || e.getStatus() != ExecutionStatus.RUNNING) {
            return false;
        }
        e.setStatus(ExecutionStatus.COMPLETED);
        e.setCompletedAt(completedAt);
        e.setItemsCrawled(itemsCrawled);
        e.setSkippedItems(skippedItems);
        e.setDetailFailures(detailFailures);
        if (childExecutionIds != null && !childExecutionIds.isEmpty()) {
            e.setChildExecutionIds(childExecutionIds);
        }
        return true;
    }

    @Override
    public synchronized boolean markFailed(String executionId, Instant completedAt, String error) {
        JobExecution e = executions.get(executionId);
        if (e == null || e.getStatus().isTerminal()) {
            return false;
        }
        e.setStatus(ExecutionStatus.FAILED);
        e.setCompletedAt(completedAt);
        e.setLastError(error);
        e.getErrorHistory().add(error);
        return true;
    }

    @Override
    public synchronized Optional<JobExecution> findExecution(String executionId) {
        JobExecution e = executions.get(executionId);
        return e == null ? Optional.empty() : Optional.of(e.copy());
    }

    @Override
    public synchronized List<JobExecution> findExecutions(ExecutionQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        return executions.values().stream()
                .filter(query::matches)
                .sorted(Comparator.comparing(JobExecution::getCreatedAt).reversed())
                .skip(query.offset())
                .limit(query.size())
                .map(JobExecution::copy)
                .toList();
    }

    @Override
    public synchronized List<JobExecution> findDuePendingExecutions(Instant windowEnd, int limit) {
        return executions.values().stream()
                .filter(e -> e.getStatus() == ExecutionStatus.PENDING)
                .filter(e -> !e.getScheduledAt().isAfter(windowEnd))
                .sorted(Comparator.comparing(JobExecution::getScheduledAt))
                .limit(Math.max(0, limit))
                .map(JobExecution::copy)
                .toList();
    }

    @Override
    public synchronized List<JobExecution> findRunningStartedBefore(Instant cutoff) {
        return executions.values().stream()
                .filter(e -> e.getStatus() == ExecutionStatus.RUNNING)
                .filter(e -> e.getStartedAt() != null && e.getStartedAt().isBefore(cutoff))
                .map(JobExecution::copy)
                .toList();
    }

    @Override
    public synchronized long countByStatus(ExecutionStatus status) {
        return executions.values().stream().filter(e -> e.getStatus() == status).count();
    }

    @Override
    public synchronized long pruneFinishedBefore(Instant cutoff) {
        long removed = 0;
        Iterator<JobExecution> it = executions.values().iterator();
        while (it.hasNext()) {
            JobExecution e = it.next();
            if (e.getStatus().isTerminal() && e.getCompletedAt() != null && e.getCompletedAt().isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }
}
