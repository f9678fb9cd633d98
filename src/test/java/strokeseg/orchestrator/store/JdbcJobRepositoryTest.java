package strokeseg.orchestrator.store;

import strokeseg.orchestrator.model.Job;
import strokeseg.orchestrator.model.JobStatus;
import strokeseg.orchestrator.model.JobType;
import strokeseg.orchestrator.support.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobRepositoryTest {

    private static Database db;
    private static JdbcJobRepository repo;

    @BeforeAll
    static void setup() {
        db = TestDatabases.open("test-jobs");
        repo = new JdbcJobRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanJobs() throws Exception {
        TestDatabases.clean(db);
    }

    private static Job pending(String id, JobType type, String externalId) {
        return Job.builder()
                .id(id)
                .jobType(type)
                .externalId(externalId)
                .status(JobStatus.PENDING)
                .submissionArtifact("#!/bin/bash\necho " + id)
                .createdAt(Instant.now())
                .build();
    }

    @Test
    void saveAndFindById() {
        repo.save(pending("job-1", JobType.TRAINING, "100"));

        Optional<Job> found = repo.findById("job-1");
        assertTrue(found.isPresent());
        assertEquals("100", found.get().externalId());
        assertEquals(JobType.TRAINING, found.get().jobType());
        assertEquals(JobStatus.PENDING, found.get().status());
        assertEquals("#!/bin/bash\necho job-1", found.get().submissionArtifact());
        assertNull(found.get().endTime());
        assertTrue(found.get().isMonitorable());
        assertTrue(repo.findById("missing").isEmpty());
    }

    @Test
    void findMonitorableSkipsTerminalOtherTypesAndJobsWithoutExternalId() {
        repo.save(pending("a", JobType.TRAINING, "1"));
        repo.save(pending("b", JobType.INFERENCE, "2"));
        repo.save(Job.builder().id("c").jobType(JobType.TRAINING).status(JobStatus.FAILED)
                .errorMessage("sbatch failed").endTime(Instant.now()).submissionArtifact("x").build());
        repo.save(pending("d", JobType.TRAINING, "4"));
        repo.markFinished("d", JobStatus.PENDING, JobStatus.COMPLETED, null, Instant.now(), null);

        List<Job> monitorable = repo.findMonitorable(JobType.TRAINING);

        assertEquals(List.of("a"), monitorable.stream().map(Job::id).toList());
        assertEquals(1, repo.findByStatus(JobStatus.FAILED).size());
    }

    @Test
    void externalIdIsAssignedOnceAndMakesJobMonitorable() {
        repo.save(pending("job-1", JobType.TRAINING, null));
        assertTrue(repo.findMonitorable(JobType.TRAINING).isEmpty());

        assertTrue(repo.assignExternalId("job-1", "555"));
        assertFalse(repo.assignExternalId("job-1", "556"));

        assertEquals("555", repo.findById("job-1").orElseThrow().externalId());
        assertEquals(List.of("job-1"), repo.findMonitorable(JobType.TRAINING).stream().map(Job::id).toList());
    }

    @Test
    void externalIdIsNotAssignedToFailedJob() {
        repo.save(pending("job-1", JobType.TRAINING, null));
        repo.markFinished("job-1", JobStatus.PENDING, JobStatus.FAILED, null, Instant.now(), "sbatch failed");

        assertFalse(repo.assignExternalId("job-1", "555"));
        assertNull(repo.findById("job-1").orElseThrow().externalId());
    }

    @Test
    void markRunningIsCompareAndSwap() {
        repo.save(pending("job-1", JobType.TRAINING, "100"));
        Instant start = Instant.now().truncatedTo(ChronoUnit.SECONDS);

        assertTrue(repo.markRunning("job-1", JobStatus.PENDING, start));
        assertFalse(repo.markRunning("job-1", JobStatus.PENDING, Instant.now()));

        Job job = repo.findById("job-1").orElseThrow();
        assertEquals(JobStatus.RUNNING, job.status());
        assertEquals(start, job.startTime());
    }

    @Test
    void markFinishedSetsEndTimeOnlyOnce() {
        repo.save(pending("job-1", JobType.TRAINING, "100"));
        repo.markRunning("job-1", JobStatus.PENDING, Instant.now());
        Instant end = Instant.now().truncatedTo(ChronoUnit.SECONDS);

        assertTrue(repo.markFinished("job-1", JobStatus.RUNNING, JobStatus.FAILED, null, end, "Job state: FAILED"));
        assertFalse(repo.markFinished("job-1", JobStatus.RUNNING, JobStatus.COMPLETED, null, Instant.now(), null));

        Job job = repo.findById("job-1").orElseThrow();
        assertEquals(JobStatus.FAILED, job.status());
        assertEquals(end, job.endTime());
        assertEquals("Job state: FAILED", job.errorMessage());
        assertNotNull(job.startTime());
        assertFalse(job.isMonitorable());
    }

    @Test
    void markFinishedFromPendingFillsStartTime() {
        repo.save(pending("job-1", JobType.INFERENCE, "100"));
        Instant start = Instant.parse("2025-09-13T12:14:02Z");

        repo.markFinished("job-1", JobStatus.PENDING, JobStatus.COMPLETED, start, Instant.now(), null);

        assertEquals(start, repo.findById("job-1").orElseThrow().startTime());
    }

    @Test
    void markFinishedRejectsNonTerminalStatus() {
        assertThrows(IllegalArgumentException.class,
                () -> repo.markFinished("x", JobStatus.PENDING, JobStatus.RUNNING, null, Instant.now(), null));
    }

    @Test
    void unknownCounterIsGuardedByStatus() {
        repo.save(pending("job-1", JobType.EVALUATION, "100"));

        assertTrue(repo.updateUnknownObservations("job-1", JobStatus.PENDING, 2));
        assertFalse(repo.updateUnknownObservations("job-1", JobStatus.RUNNING, 3));
        assertEquals(2, repo.findById("job-1").orElseThrow().unknownObservations());

        repo.markRunning("job-1", JobStatus.PENDING, Instant.now());
        assertEquals(0, repo.findById("job-1").orElseThrow().unknownObservations());
    }

    @Test
    void generatedIdsAreUnique() {
        assertNotEquals(repo.generateId(), repo.generateId());
    }
}
