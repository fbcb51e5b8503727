package io.rankwatch4j.internal.memory;

import io.rankwatch4j.core.CancelResult;
import io.rankwatch4j.core.DueJob;
import io.rankwatch4j.core.ExecutionOrigin;
import io.rankwatch4j.core.ExecutionQuery;
import io.rankwatch4j.core.ExecutionStatus;
import io.rankwatch4j.core.JobDefinition;
import io.rankwatch4j.core.JobExecution;
import io.rankwatch4j.core.TriggerSpec;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryJobStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final InMemoryJobStore store = new InMemoryJobStore();

    private static JobDefinition def(String id) {
        return new JobDefinition(id, List.of(id), TriggerSpec.parse("1 hour", null), 3, Duration.ofSeconds(30));
    }

    private static JobExecution exec(String id, String jobId, Instant scheduledAt) {
        JobExecution e = new JobExecution();
        e.setId(id);
        e.setJobId(jobId);
        e.setTargets(List.of(jobId));
        e.setCreatedAt(scheduledAt);
        e.setScheduledAt(scheduledAt);
        return e;
    }

    @Test
    void saveDefinitionShouldReportCreateThenUpdate() {
        assertTrue(store.saveDefinition(def("jiazi"), NOW).created());
        assertTrue(store.saveDefinition(def("jiazi"), NOW.plusSeconds(60)).updated());
        assertFalse(store.saveDefinitionIfAbsent(def("jiazi"), null));

        assertEquals(1, store.countDefinitions());
    }

    @Test
    void resavingSameTriggerShouldKeepStoredNextRun() {
        store.saveDefinition(def("jiazi"), NOW);
        store.saveDefinition(def("jiazi"), NOW.plusSeconds(3000));
        assertEquals(NOW, store.findDueJobs(NOW, 10).get(0).nextRunAt());

        JobDefinition everyTwoHours = new JobDefinition(
                "jiazi", List.of("jiazi"), TriggerSpec.parse("2 hours", null), 3, Duration.ofSeconds(30));
        store.saveDefinition(everyTwoHours, NOW.plusSeconds(7200));
        assertEquals(NOW.plusSeconds(7200), store.findDueJobs(NOW.plusSeconds(7200), 10).get(0).nextRunAt());

        store.disableDefinition("jiazi");
        store.saveDefinition(everyTwoHours, NOW.plusSeconds(9000));
        assertEquals(NOW.plusSeconds(9000), store.findDueJobs(NOW.plusSeconds(9000), 10).get(0).nextRunAt());
    }

    @Test
    void advanceNextRunShouldLetOnlyOneCallerWinATick() {
        store.saveDefinition(def("jiazi"), NOW);

        assertTrue(store.advanceNextRun("jiazi", NOW, NOW.plusSeconds(3600)));
        assertFalse(store.advanceNextRun("jiazi", NOW, NOW.plusSeconds(3600)));
        assertTrue(store.findDueJobs(NOW, 10).isEmpty());
    }

    @Test
    void findDueJobsShouldOrderByNextRunAndSkipDisabled() {
        store.saveDefinition(def("b"), NOW.minusSeconds(10));
        store.saveDefinition(def("a"), NOW.minusSeconds(20));
        store.saveDefinition(def("later"), NOW.plusSeconds(600));
        store.saveDefinition(def("off"), null);

        List<DueJob> due = store.findDueJobs(NOW, 10);

        assertEquals(List.of("a", "b"), due.stream().map(d -> d.definition().id()).toList());
        assertEquals(3, store.countActiveDefinitions());
    }

    @Test
    void runLockShouldBeExclusiveAndReentrant() {
        assertTrue(store.claimRun("jiazi", "e1", NOW));
        assertTrue(store.claimRun("jiazi", "e1", NOW));
        assertFalse(store.claimRun("jiazi", "e2", NOW));

        assertFalse(store.releaseRun("jiazi", "e2"));
        assertTrue(store.releaseRun("jiazi", "e1"));
        assertTrue(store.claimRun("jiazi", "e2", NOW));
        assertEquals("e2", store.findRunLock("jiazi").orElseThrow().executionId());
    }

    @Test
    void executionTransitionsShouldFollowTheStateMachine() {
        store.insertExecution(exec("e1", "jiazi", NOW));

        assertFalse(store.markCompleted("e1", NOW, 3, 0, 0, List.of()));
        assertTrue(store.markRunning("e1", NOW));
        assertFalse(store.markRunning("e1", NOW));
        assertTrue(store.markCompleted("e1", NOW.plusSeconds(5), 3, 1, 0, List.of()));
        assertFalse(store.markFailed("e1", NOW, "late"));

        JobExecution done = store.findExecution("e1").orElseThrow();
        assertEquals(ExecutionStatus.COMPLETED, done.getStatus());
        assertEquals(3, done.getItemsCrawled());
        assertEquals(1, done.getSkippedItems());
    }

    @Test
    void markFailedShouldAppendHistory() {
        JobExecution e = exec("e1", "jiazi", NOW);
        e.setErrorHistory(List.of("TRANSIENT earlier"));
        store.insertExecution(e);
        store.markRunning("e1", NOW);

        assertTrue(store.markFailed("e1", NOW, "TRANSIENT now"));

        JobExecution failed = store.findExecution("e1").orElseThrow();
        assertEquals(List.of("TRANSIENT earlier", "TRANSIENT now"), failed.getErrorHistory());
        assertEquals("TRANSIENT now", failed.getLastError());
    }

    @Test
    void storedExecutionsShouldBeIsolatedFromCallerCopies() {
        JobExecution e = exec("e1", "jiazi", NOW);
        store.insertExecution(e);
        e.setStatus(ExecutionStatus.FAILED);

        JobExecution read = store.findExecution("e1").orElseThrow();
        read.setStatus(ExecutionStatus.COMPLETED);

        assertEquals(ExecutionStatus.PENDING, store.findExecution("e1").orElseThrow().getStatus());
        assertThrows(IllegalStateException.class, () -> store.insertExecution(exec("e1", "jiazi", NOW)));
    }

    @Test
    void findDuePendingShouldRespectWindowAndOrder() {
        store.insertExecution(exec("late", "a", NOW.plusSeconds(30)));
        store.insertExecution(exec("second", "b", NOW.minusSeconds(5)));
        store.insertExecution(exec("first", "c", NOW.minusSeconds(50)));

        List<JobExecution> due = store.findDuePendingExecutions(NOW, 10);

        assertEquals(List.of("first", "second"), due.stream().map(JobExecution::getId).toList());
    }

    @Test
    void findExecutionsShouldFilterAndPage() {
        for (int i = 0; i < 5; i++) {
            JobExecution e = exec("e" + i, "jiazi", NOW.plusSeconds(i));
            e.setOrigin(i % 2 == 0 ? ExecutionOrigin.SCHEDULED : ExecutionOrigin.RETRY);
            store.insertExecution(e);
        }
        store.insertExecution(exec("other", "romance", NOW));

        List<JobExecution> retries = store.findExecutions(ExecutionQuery.builder()
                .jobId("jiazi").origin(ExecutionOrigin.RETRY).build());
        assertEquals(List.of("e3", "e1"), retries.stream().map(JobExecution::getId).toList());

        List<JobExecution> page = store.findExecutions(ExecutionQuery.builder().jobId("jiazi").page(1, 2).build());
        assertEquals(List.of("e2", "e1"), page.stream().map(JobExecution::getId).toList());
    }

    @Test
    void cancelShouldDisableOrDelete() {
        store.saveDefinition(def("jiazi"), NOW);
        store.saveDefinition(def("romance"), NOW);

        CancelResult disabled = store.disableDefinition("jiazi");
        assertEquals(1, disabled.modified());
        assertEquals(0, store.disableDefinition("jiazi").modified());
        assertTrue(store.findDefinition("jiazi").isPresent());

        assertEquals(1, store.deleteDefinition("romance").deleted());
        assertFalse(store.deleteDefinition("romance").hasEffect());
        assertTrue(store.findDefinition("romance").isEmpty());
    }

    @Test
    void maintenanceQueriesShouldFindStaleRunsAndPruneHistory() {
        store.insertExecution(exec("old", "a", NOW.minusSeconds(7200)));
        store.markRunning("old", NOW.minusSeconds(7200));
        store.insertExecution(exec("fresh", "b", NOW));
        store.markRunning("fresh", NOW);
        store.insertExecution(exec("done", "c", NOW.minusSeconds(7200)));
        store.markRunning("done", NOW.minusSeconds(7200));
        store.markCompleted("done", NOW.minusSeconds(7100), 1, 0, 0, null);

        assertEquals(List.of("old"), store.findRunningStartedBefore(NOW.minusSeconds(60)).stream().map(JobExecution::getId).toList());
        assertEquals(1, store.pruneFinishedBefore(NOW.minusSeconds(3600)));
        assertTrue(store.findExecution("done").isEmpty());
        assertEquals(2, store.countByStatus(ExecutionStatus.RUNNING));
        assertNull(store.findExecution("old").orElseThrow().getCompletedAt());
    }
}
