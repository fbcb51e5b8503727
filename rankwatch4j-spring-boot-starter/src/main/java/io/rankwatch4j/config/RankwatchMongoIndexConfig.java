package io.rankwatch4j.config;

import io.rankwatch4j.internal.mongo.BookStatDocument;
import io.rankwatch4j.internal.mongo.JobDefinitionDocument;
import io.rankwatch4j.internal.mongo.JobExecutionDocument;
import io.rankwatch4j.internal.mongo.RankingSnapshotDocument;
import io.rankwatch4j.internal.mongo.RunLockDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the rankwatch collections.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created at application startup unless
 * {@code rankwatch.ensure-indexes-on-startup=true}. In production they are usually managed by
 * migration scripts.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>idx_due_trigger</b> on {@code crawl_jobs}: { nextRunAt: 1 }
 *       <br/>Trigger evaluation.</li>
 *   <li><b>idx_status_scheduled</b> on {@code crawl_executions}: { status: 1, scheduledAt: 1 }
 *       <br/>Due PENDING executions, stale RUNNING executions, status counts.</li>
 *   <li><b>idx_job_created</b> on {@code crawl_executions}: { jobId: 1, createdAt: -1 }
 *       <br/>Execution history of one job, newest first.</li>
 *   <li><b>idx_completed</b> on {@code crawl_executions}: { completedAt: 1 }
 *       <br/>History pruning.</li>
 *   <li><b>idx_locked_at</b> on {@code crawl_run_locks}: { lockedAt: 1 }
 *       <br/>Orphaned lock reconciliation.</li>
 *   <li><b>idx_source_captured</b> on {@code ranking_snapshots}: { sourceId: 1, capturedAt: 1 }
 *       <br/>Gap detection evidence.</li>
 *   <li><b>idx_book_captured</b> on {@code book_stats}: { bookId: 1, capturedAt: 1 }</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.crawl_jobs.createIndex({ nextRunAt: 1 }, { name: "idx_due_trigger" });
 * db.crawl_executions.createIndex({ status: 1, scheduledAt: 1 }, { name: "idx_status_scheduled" });
 * db.crawl_executions.createIndex({ jobId: 1, createdAt: -1 }, { name: "idx_job_created" });
 * db.crawl_executions.createIndex({ completedAt: 1 }, { name: "idx_completed" });
 * db.crawl_run_locks.createIndex({ lockedAt: 1 }, { name: "idx_locked_at" });
 * db.ranking_snapshots.createIndex({ sourceId: 1, capturedAt: 1 }, { name: "idx_source_captured" });
 * db.book_stats.createIndex({ bookId: 1, capturedAt: 1 }, { name: "idx_book_captured" });
 * </pre>
 */
public class RankwatchMongoIndexConfig {

    public static final String IDX_DUE_TRIGGER = "idx_due_trigger";
    public static final String IDX_STATUS_SCHEDULED = "idx_status_scheduled";
    public static final String IDX_JOB_CREATED = "idx_job_created";
    public static final String IDX_COMPLETED = "idx_completed";
    public static final String IDX_LOCKED_AT = "idx_locked_at";
    public static final String IDX_SOURCE_CAPTURED = "idx_source_captured";
    public static final String IDX_BOOK_CAPTURED = "idx_book_captured";

    private final MongoTemplate mongoTemplate;

    public RankwatchMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Ensure all required indexes. Creating an existing index is a no-op.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(JobDefinitionDocument.class).ensureIndex(dueTriggerIndex());
        mongoTemplate.indexOps(JobExecutionDocument.class).ensureIndex(statusScheduledIndex());
        mongoTemplate.indexOps(JobExecutionDocument.class).ensureIndex(jobCreatedIndex());
        mongoTemplate.indexOps(JobExecutionDocument.class).ensureIndex(completedIndex());
        mongoTemplate.indexOps(RunLockDocument.class).ensureIndex(lockedAtIndex());
        mongoTemplate.indexOps(RankingSnapshotDocument.class).ensureIndex(sourceCapturedIndex());
        mongoTemplate.indexOps(BookStatDocument.class).ensureIndex(bookCapturedIndex());
    }

    public static Index dueTriggerIndex() {
        return new Index().on("nextRunAt", Sort.Direction.ASC).named(IDX_DUE_TRIGGER);
    }

    public static Index statusScheduledIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("scheduledAt", Sort.Direction.ASC)
                .named(IDX_STATUS_SCHEDULED);
    }

    public static Index jobCreatedIndex() {
        return new Index()
                .on("jobId", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.DESC)
                .named(IDX_JOB_CREATED);
    }

    public static Index completedIndex() {
        return new Index().on("completedAt", Sort.Direction.ASC).named(IDX_COMPLETED);
    }

    public static Index lockedAtIndex() {
        return new Index().on("lockedAt", Sort.Direction.ASC).named(IDX_LOCKED_AT);
    }

    public static Index sourceCapturedIndex() {
        return new Index()
                .on("sourceId", Sort.Direction.ASC)
                .on("capturedAt", Sort.Direction.ASC)
                .named(IDX_SOURCE_CAPTURED);
    }

    public static Index bookCapturedIndex() {
        return new Index()
                .on("bookId", Sort.Direction.ASC)
                .on("capturedAt", Sort.Direction.ASC)
                .named(IDX_BOOK_CAPTURED);
    }
}
