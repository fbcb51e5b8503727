package io.rankwatch4j.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.rankwatch4j.core.CancelResult;
import io.rankwatch4j.core.DueJob;
import io.rankwatch4j.core.ExecutionQuery;
import io.rankwatch4j.core.ExecutionStatus;
import io.rankwatch4j.core.JobDefinition;
import io.rankwatch4j.core.JobExecution;
import io.rankwatch4j.core.PersistResult;
import io.rankwatch4j.core.RunLock;
import io.rankwatch4j.core.TriggerSpec;
import io.rankwatch4j.store.JobStore;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for job definitions, run locks and executions.
 *
 * <p>Every state change is a single conditional write:
 * <ul>
 *   <li>trigger advance: {@code updateFirst} matching the expected {@code nextRunAt}</li>
 *   <li>run lock: insert into {@code crawl_run_locks}; the duplicate {@code _id} of a held lock rejects the claim</li>
 *   <li>execution transitions: {@code updateFirst} matching the expected {@code status}</li>
 * </ul>
 * so several schedulers may share one database.
 */
public class MongoJobStore implements JobStore {

    private static final List<ExecutionStatus> TERMINAL = List.of(ExecutionStatus.COMPLETED, ExecutionStatus.FAILED);
    private static final List<ExecutionStatus> UNFINISHED = List.of(ExecutionStatus.PENDING, ExecutionStatus.RUNNING);

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this(mongoTemplate, Clock.systemUTC());
    }

    public MongoJobStore(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /* ---------------- definitions ---------------- */

    /**
     * Upsert by job id. Returns CREATED when the document did not exist, UPDATED otherwise.
     * An enabled definition whose trigger is unchanged keeps its stored {@code nextRunAt}.
     */
    @Override
    public PersistResult saveDefinition(JobDefinition definition, Instant nextRunAt) {
        Objects.requireNonNull(definition, "definition must not be null");

        Query unchanged = new Query(new Criteria().andOperator(
                Criteria.where("_id").is(definition.id()),
                Criteria.where("nextRunAt").ne(null),
                sameTrigger(definition.trigger())
        ));
        if (mongoTemplate.updateFirst(unchanged, definitionUpdate(definition), JobDefinitionDocument.class)
                .getMatchedCount() > 0) {
            return PersistResult.updatedResult(definition.id());
        }

        Query q = byId(definition.id());
        Update u = definitionUpdate(definition);
        if (nextRunAt != null) {
            u.set("nextRunAt", nextRunAt);
        } else {
            u.unset("nextRunAt");
        }

        UpdateResult result = mongoTemplate.upsert(q, u, JobDefinitionDocument.class);
        return result.getUpsertedId() != null
                ? PersistResult.createdResult(definition.id())
                : PersistResult.updatedResult(definition.id());
    }

    @Override
    public boolean saveDefinitionIfAbsent(JobDefinition definition, Instant nextRunAt) {
        Objects.requireNonNull(definition, "definition must not be null");
        JobDefinitionDocument doc = toDocument(definition, nextRunAt);
        try {
            mongoTemplate.insert(doc);
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    @Override
    public Optional<JobDefinition> findDefinition(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        JobDefinitionDocument doc = mongoTemplate.findById(jobId, JobDefinitionDocument.class);
        return Optional.ofNullable(doc).map(MongoJobStore::toDefinition);
    }

    @Override
    public List<JobDefinition> listDefinitions() {
        Query q = new Query().with(Sort.by(Sort.Order.asc("_id")));
        return mongoTemplate.find(q, JobDefinitionDocument.class).stream()
                .map(MongoJobStore::toDefinition)
                .toList();
    }

    @Override
    public long countDefinitions() {
        return mongoTemplate.count(new Query(), JobDefinitionDocument.class);
    }

    @Override
    public long countActiveDefinitions() {
        return mongoTemplate.count(new Query(Criteria.where("nextRunAt").ne(null)), JobDefinitionDocument.class);
    }

    /**
     * Keeps the document but clears its next run so it won't fire.
     */
    @Override
    public CancelResult disableDefinition(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Update u = new Update().unset("nextRunAt").set("updatedAt", clock.instant());
        UpdateResult r = mongoTemplate.updateFirst(
                new Query(Criteria.where("_id").is(jobId).and("nextRunAt").ne(null)), u, JobDefinitionDocument.class);
        if (r.getMatchedCount() > 0) {
            return CancelResult.disabled(r.getModifiedCount());
        }
        return mongoTemplate.exists(byId(jobId), JobDefinitionDocument.class)
                ? CancelResult.disabled(0)
                : CancelResult.empty();
    }

    @Override
    public CancelResult deleteDefinition(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        long deleted = mongoTemplate.remove(byId(jobId), JobDefinitionDocument.class).getDeletedCount();
        return deleted == 0 ? CancelResult.empty() : CancelResult.deleted(deleted);
    }

    /* ---------------- trigger evaluation ---------------- */

    @Override
    public List<DueJob> findDueJobs(Instant windowEnd, int limit) {
        Objects.requireNonNull(windowEnd, "windowEnd must not be null");
        if (limit <= 0) {
            return List.of();
        }
        Query q = new Query(Criteria.where("nextRunAt").ne(null).lte(windowEnd))
                .with(Sort.by(Sort.Order.asc("nextRunAt")))
                .limit(limit);

        List<DueJob> due = new ArrayList<>();
        for (JobDefinitionDocument doc : mongoTemplate.find(q, JobDefinitionDocument.class)) {
            due.add(new DueJob(toDefinition(doc), doc.getNextRunAt()));
        }
        return due;
    }

    @Override
    public boolean advanceNextRun(String jobId, Instant expected, Instant next) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Query q = new Query(Criteria.where("_id").is(jobId).and("nextRunAt").is(expected));
        Update u = new Update().set("updatedAt", clock.instant());
        if (next != null) {
            u.set("nextRunAt", next);
        } else {
            u.unset("nextRunAt");
        }
        return mongoTemplate.updateFirst(q, u, JobDefinitionDocument.class).getMatchedCount() > 0;
    }

    /* ---------------- run lock ---------------- */

    @Override
    public boolean claimRun(String jobId, String executionId, Instant now) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(now, "now must not be null");

        // a lock released between the failed insert and the read is claimed on the next pass
        for (int attempt = 0; attempt < 2; attempt++) {
            try {
                mongoTemplate.insert(new RunLockDocument(jobId, executionId, now));
                return true;
            } catch (DuplicateKeyException e) {
                RunLockDocument holder = mongoTemplate.findById(jobId, RunLockDocument.class);
                if (holder != null) {
                    return executionId.equals(holder.getExecutionId());
                }
            }
        }
        return false;
    }

    @Override
    public boolean releaseRun(String jobId, String executionId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Query q = new Query(Criteria.where("_id").is(jobId).and("executionId").is(executionId));
        return mongoTemplate.remove(q, RunLockDocument.class).getDeletedCount() > 0;
    }

    @Override
    public Optional<RunLock> findRunLock(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return Optional.ofNullable(mongoTemplate.findById(jobId, RunLockDocument.class))
                .map(MongoJobStore::toRunLock);
    }

    @Override
    public List<RunLock> findRunLocksOlderThan(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        Query q = new Query(Criteria.where("lockedAt").lt(cutoff));
        return mongoTemplate.find(q, RunLockDocument.class).stream()
                .map(MongoJobStore::toRunLock)
                .toList();
    }

    /* ---------------- executions ---------------- */

    @Override
    public void insertExecution(JobExecution execution) {
        Objects.requireNonNull(execution, "execution must not be null");
        Objects.requireNonNull(execution.getId(), "execution id must not be null");
        try {
            mongoTemplate.insert(toDocument(execution));
        } catch (DuplicateKeyException e) {
            throw new IllegalStateException("duplicate execution id: " + execution.getId(), e);
        }
    }

    @Override
    public boolean markRunning(String executionId, Instant startedAt) {
        Query q = new Query(Criteria.where("_id").is(executionId).and("status").is(ExecutionStatus.PENDING));
        Update u = new Update()
                .set("status", ExecutionStatus.RUNNING)
                .set("startedAt", startedAt);
        return mongoTemplate.updateFirst(q, u, JobExecutionDocument.class).getModifiedCount() > 0;
    }

    @Override
    public boolean markCompleted(String executionId, Instant completedAt, int itemsCrawled, int skippedItems,
                                 int detailFailures, List<String> childExecutionIds) {
        Query q = new Query(Criteria.where("_id").is(executionId).and("status").is(ExecutionStatus.RUNNING));
        Update u = new Update()
                .set("status", ExecutionStatus.COMPLETED)
                .set("completedAt", completedAt)
                .set("itemsCrawled", itemsCrawled)
                .set("skippedItems", skippedItems)
                .set("detailFailures", detailFailures);
        if (childExecutionIds != null && !childExecutionIds.isEmpty()) {
            u.set("childExecutionIds", childExecutionIds);
        }
        return mongoTemplate.updateFirst(q, u, JobExecutionDocument.class).getModifiedCount() > 0;
    }

    @Override
    public boolean markFailed(String executionId, Instant completedAt, String error) {
        Query q = new Query(Criteria.where("_id").is(executionId).and("status").in(UNFINISHED));
        Update u = new Update()
                .set("status", ExecutionStatus.FAILED)
                .set("completedAt", completedAt)
                .set("lastError", error)
                .push("errorHistory", error);
        return mongoTemplate.updateFirst(q, u, JobExecutionDocument.class).getModifiedCount() > 0;
    }

    @Override
    public Optional<JobExecution> findExecution(String executionId) {
        Objects.requireNonNull(executionId, "executionId must not be null");
        return Optional.ofNullable(mongoTemplate.findById(executionId, JobExecutionDocument.class))
                .map(MongoJobStore::toExecution);
    }

    @Override
    public List<JobExecution> findExecutions(ExecutionQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        Query q = new Query(buildCriteria(query))
                .with(Sort.by(Sort.Order.desc("createdAt")))
                .skip(query.offset())
                .limit(query.size());
        return mongoTemplate.find(q, JobExecutionDocument.class).stream()
                .map(MongoJobStore::toExecution)
                .toList();
    }

    @Override
    public List<JobExecution> findDuePendingExecutions(Instant windowEnd, int limit) {
        Objects.requireNonNull(windowEnd, "windowEnd must not be null");
        if (limit <= 0) {
            return List.of();
        }
        Query q = new Query(Criteria.where("status").is(ExecutionStatus.PENDING).and("scheduledAt").lte(windowEnd))
                .with(Sort.by(Sort.Order.asc("scheduledAt")))
                .limit(limit);
        return mongoTemplate.find(q, JobExecutionDocument.class).stream()
                .map(MongoJobStore::toExecution)
                .toList();
    }

    @Override
    public List<JobExecution> findRunningStartedBefore(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        Query q = new Query(Criteria.where("status").is(ExecutionStatus.RUNNING).and("startedAt").lt(cutoff));
        return mongoTemplate.find(q, JobExecutionDocument.class).stream()
                .map(MongoJobStore::toExecution)
                .toList();
    }

    @Override
    public long countByStatus(ExecutionStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        return mongoTemplate.count(new Query(Criteria.where("status").is(status)), JobExecutionDocument.class);
    }

    @Override
    public long pruneFinishedBefore(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        Query q = new Query(Criteria.where("status").in(TERMINAL).and("completedAt").lt(cutoff));
        return mongoTemplate.remove(q, JobExecutionDocument.class).getDeletedCount();
    }

    /* ---------------- mapping ---------------- */

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }

    private static Criteria sameTrigger(TriggerSpec trigger) {
        return new Criteria().andOperator(
                Criteria.where("triggerType").is(trigger.type()),
                Criteria.where("expression").is(trigger.expression()),
                Criteria.where("runAt").is(trigger.runAt()),
                Criteria.where("timezone").is(trigger.timezone())
        );
    }

    private static Criteria buildCriteria(ExecutionQuery query) {
        List<Criteria> parts = new ArrayList<>(4);
        if (query.jobId() != null) {
            parts.add(Criteria.where("jobId").is(query.jobId()));
        }
        if (query.status() != null) {
            parts.add(Criteria.where("status").is(query.status()));
        }
        if (query.origin() != null) {
            parts.add(Criteria.where("origin").is(query.origin()));
        }
        if (query.parentExecutionId() != null) {
            parts.add(Criteria.where("parentExecutionId").is(query.parentExecutionId()));
        }

        if (parts.isEmpty()) {
            return new Criteria();
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return new Criteria().andOperator(parts.toArray(new Criteria[0]));
    }

    private Update definitionUpdate(JobDefinition definition) {
        TriggerSpec trigger = definition.trigger();
        Instant now = clock.instant();

        Update u = new Update()
                .set("targets", definition.targets())
                .set("triggerType", trigger.type())
                .set("maxRetries", definition.maxRetries())
                .set("retryBackoffMillis", definition.retryBackoff().toMillis())
                .set("updatedAt", now)
                .setOnInsert("createdAt", now);

        if (trigger.expression() != null) {
            u.set("expression", trigger.expression());
        } else {
            u.unset("expression");
        }
        if (trigger.runAt() != null) {
            u.set("runAt", trigger.runAt());
        } else {
            u.unset("runAt");
        }
        if (trigger.timezone() != null) {
            u.set("timezone", trigger.timezone());
        } else {
            u.unset("timezone");
        }
        return u;
    }

    private JobDefinitionDocument toDocument(JobDefinition definition, Instant nextRunAt) {
        TriggerSpec trigger = definition.trigger();
        Instant now = clock.instant();

        JobDefinitionDocument doc = new JobDefinitionDocument();
        doc.setId(definition.id());
        doc.setTargets(new ArrayList<>(definition.targets()));
        doc.setTriggerType(trigger.type());
        doc.setExpression(trigger.expression());
        doc.setRunAt(trigger.runAt());
        doc.setTimezone(trigger.timezone());
        doc.setMaxRetries(definition.maxRetries());
        doc.setRetryBackoffMillis(definition.retryBackoff().toMillis());
        doc.setNextRunAt(nextRunAt);
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        return doc;
    }

    static JobDefinition toDefinition(JobDefinitionDocument doc) {
        TriggerSpec trigger = new TriggerSpec(doc.getTriggerType(), doc.getExpression(), doc.getRunAt(), doc.getTimezone());
        return new JobDefinition(
                doc.getId(),
                doc.getTargets(),
                trigger,
                doc.getMaxRetries(),
                Duration.ofMillis(doc.getRetryBackoffMillis())
        );
    }

    private static RunLock toRunLock(RunLockDocument doc) {
        return new RunLock(doc.getJobId(), doc.getExecutionId(), doc.getLockedAt());
    }

    static JobExecutionDocument toDocument(JobExecution e) {
        JobExecutionDocument doc = new JobExecutionDocument();
        doc.setId(e.getId());
        doc.setJobId(e.getJobId());
        doc.setTargets(new ArrayList<>(e.getTargets()));
        doc.setStatus(e.getStatus());
        doc.setOrigin(e.getOrigin());
        doc.setCreatedAt(e.getCreatedAt());
        doc.setScheduledAt(e.getScheduledAt());
        doc.setStartedAt(e.getStartedAt());
        doc.setCompletedAt(e.getCompletedAt());
        doc.setRetryCount(e.getRetryCount());
        doc.setMaxRetries(e.getMaxRetries());
        doc.setRetryBackoffMillis(e.getRetryBackoff() == null ? 0 : e.getRetryBackoff().toMillis());
        doc.setLastError(e.getLastError());
        doc.setErrorHistory(new ArrayList<>(e.getErrorHistory()));
        doc.setItemsCrawled(e.getItemsCrawled());
        doc.setSkippedItems(e.getSkippedItems());
        doc.setDetailFailures(e.getDetailFailures());
        doc.setParentExecutionId(e.getParentExecutionId());
        doc.setChildExecutionIds(new ArrayList<>(e.getChildExecutionIds()));
        doc.setPreviousExecutionId(e.getPreviousExecutionId());
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(JobExecution)}.
     */
    static JobExecution toExecution(JobExecutionDocument doc) {
        JobExecution e = new JobExecution();
        e.setId(doc.getId());
        e.setJobId(doc.getJobId());
        e.setTargets(doc.getTargets());
        e.setStatus(doc.getStatus());
        e.setOrigin(doc.getOrigin());
        e.setCreatedAt(doc.getCreatedAt());
        e.setScheduledAt(doc.getScheduledAt());
        e.setStartedAt(doc.getStartedAt());
        e.setCompletedAt(doc.getCompletedAt());
        e.setRetryCount(doc.getRetryCount());
        e.setMaxRetries(doc.getMaxRetries());
        e.setRetryBackoff(Duration.ofMillis(doc.getRetryBackoffMillis()));
        e.setLastError(doc.getLastError());
        e.setErrorHistory(doc.getErrorHistory());
        e.setItemsCrawled(doc.getItemsCrawled());
        e.setSkippedItems(doc.getSkippedItems());
        e.setDetailFailures(doc.getDetailFailures());
        e.setParentExecutionId(doc.getParentExecutionId());
        e.setChildExecutionIds(doc.getChildExecutionIds());
        e.setPreviousExecutionId(doc.getPreviousExecutionId());
        return e;
    }
}
