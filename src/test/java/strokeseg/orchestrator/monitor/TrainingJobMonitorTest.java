package strokeseg.orchestrator.monitor;

import strokeseg.orchestrator.exception.TransientQueryException;
import strokeseg.orchestrator.model.*;
import strokeseg.orchestrator.scheduler.CommandRunner;
import strokeseg.orchestrator.scheduler.ScontrolParser;
import strokeseg.orchestrator.scheduler.SchedulerJobInfo;
import strokeseg.orchestrator.scheduler.SlurmClient;
import strokeseg.orchestrator.scheduler.StateMapping;
import strokeseg.orchestrator.store.*;
import strokeseg.orchestrator.support.FakeSchedulerClient;
import strokeseg.orchestrator.support.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TrainingJobMonitorTest {

    private static Database db;
    private static JdbcJobRepository jobs;
    private static JdbcTrainingRepository trainings;
    private static JdbcModelRepository models;

    private FakeSchedulerClient scheduler;
    private TrainingJobMonitor monitor;

    @BeforeAll
    static void setup() {
        db = TestDatabases.open("test-training-monitor");
        jobs = new JdbcJobRepository(db);
        trainings = new JdbcTrainingRepository(db);
        models = new JdbcModelRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void reset() throws Exception {
        TestDatabases.clean(db);
        scheduler = new FakeSchedulerClient();
        monitor = newMonitor();
    }

    private TrainingJobMonitor newMonitor() {
        return new TrainingJobMonitor(db, jobs, trainings, models, scheduler,
                new JobStateMachine(StateMapping.slurmDefaults(), 3));
    }

    private static void submitted(String jobId, String externalId, String name) {
        jobs.save(Job.builder().id(jobId).jobType(JobType.TRAINING).externalId(externalId)
                .submissionArtifact("#!/bin/bash").createdAt(Instant.now()).build());
        trainings.save(new Training("t-" + jobId, name, "/img", "/lbl", "/models/" + name, "3d_fullres", 0,
                jobId, TrainingStatus.TRAINING, null, null, null, Instant.now()));
    }

    private static Job job(String id) {
        return jobs.findById(id).orElseThrow();
    }

    @Test
    void runningThenCompletedCreatesExactlyOneModel() {
        submitted("j1", "100", "m1");
        scheduler.report("100", "RUNNING", "COMPLETED");
        List<JobStatus> seen = new ArrayList<>();
        seen.add(job("j1").status());

        CycleReport first = monitor.pollOnce();
        Job running = job("j1");
        seen.add(running.status());
        assertEquals(1, first.transitioned());
        assertNotNull(running.startTime());
        assertNull(running.endTime());

        monitor.pollOnce();
        Job completed = job("j1");
        seen.add(completed.status());

        assertEquals(List.of(JobStatus.PENDING, JobStatus.RUNNING, JobStatus.COMPLETED), seen);
        assertEquals(running.startTime(), completed.startTime());
        assertNotNull(completed.endTime());
        assertNull(completed.errorMessage());

        Model model = models.findByTrainingId("t-j1").orElseThrow();
        assertEquals("m1_model", model.modelName());
        assertEquals("/models/m1", model.modelPath());
        assertEquals(TrainingStatus.TRAINED, trainings.findById("t-j1").orElseThrow().status());
    }

    @Test
    void repeatedPollsAfterCompletionDoNothing() {
        submitted("j1", "100", "m1");
        scheduler.report("100", "COMPLETED");
        monitor.pollOnce();
        Job done = job("j1");

        for (int i = 0; i < 5; i++) {
            CycleReport report = monitor.pollOnce();
            assertEquals(0, report.polled());
        }

        assertEquals(1, scheduler.queryCount("100"));
        assertEquals(done.updatedAt(), job("j1").updatedAt());
        assertTrue(models.findByTrainingId("t-j1").isPresent());
    }

    @Test
    void reconcilingATerminalJobDirectlyWritesNothing() {
        submitted("j1", "100", "m1");
        scheduler.report("100", "COMPLETED");
        monitor.pollOnce();
        Job done = job("j1");

        assertFalse(monitor.reconcile(done));
        assertFalse(monitor.reconcile(done));

        assertEquals(done.updatedAt(), job("j1").updatedAt());
        assertTrue(models.findByTrainingId("t-j1").isPresent());
    }

    @Test
    void overlappingCyclesCreateOneModel() throws Exception {
        submitted("j1", "100", "m1");
        scheduler.report("100", "COMPLETED");

        int threads = 4;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<CycleReport>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                TrainingJobMonitor m = newMonitor();
                results.add(pool.submit(() -> {
                    go.await();
                    return m.pollOnce();
                }));
            }
            go.countDown();
            int transitioned = 0;
            for (Future<CycleReport> f : results) {
                transitioned += f.get(30, TimeUnit.SECONDS).transitioned();
            }
            assertTrue(transitioned <= 1);
        } finally {
            pool.shutdownNow();
        }

        // a cycle that lost a lock wait retries on the next pass
        monitor.pollOnce();

        assertEquals(JobStatus.COMPLETED, job("j1").status());
        assertTrue(models.findByTrainingId("t-j1").isPresent());
        try (var conn = db.getDataSource().getConnection();
                var st = conn.createStatement();
                var rs = st.executeQuery("SELECT COUNT(*) FROM model")) {
            rs.next();
            assertEquals(1, rs.getInt(1));
        }
    }

    @Test
    void failureStoresSchedulerReasonOnJobAndTraining() {
        submitted("j1", "100", "m1");
        scheduler.report(new SchedulerJobInfo("100", "OUT_OF_MEMORY", Instant.parse("2025-01-01T10:00:00Z"),
                Instant.parse("2025-01-01T11:00:00Z"), "0:125", "OutOfMemory"));

        monitor.pollOnce();

        Job failed = job("j1");
        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals(Instant.parse("2025-01-01T10:00:00Z"), failed.startTime());
        assertEquals(Instant.parse("2025-01-01T11:00:00Z"), failed.endTime());
        assertTrue(failed.errorMessage().contains("OUT_OF_MEMORY"));
        assertTrue(failed.errorMessage().contains("Job ran out of memory"));

        Training training = trainings.findById("t-j1").orElseThrow();
        assertEquals(TrainingStatus.FAILED, training.status());
        assertEquals(failed.errorMessage(), training.errorMessage());
        assertTrue(models.findByTrainingId("t-j1").isEmpty());
    }

    @Test
    void unknownStatesEscalateOnThresholdCycleAndStopPolling() {
        submitted("j1", "100", "m1");
        scheduler.report("100", "GIBBERISH");

        monitor.pollOnce();
        monitor.pollOnce();
        assertEquals(JobStatus.PENDING, job("j1").status());
        assertEquals(2, job("j1").unknownObservations());

        monitor.pollOnce();
        Job escalated = job("j1");
        assertEquals(JobStatus.FAILED, escalated.status());
        assertTrue(escalated.errorMessage().startsWith("Reconciliation exhausted"));
        assertNotNull(escalated.endTime());
        assertEquals(TrainingStatus.FAILED, trainings.findById("t-j1").orElseThrow().status());

        monitor.pollOnce();
        assertEquals(3, scheduler.queryCount("100"));
    }

    @Test
    void recognisedStateResetsUnknownCounter() {
        submitted("j1", "100", "m1");
        scheduler.report("100", "???", "???", "PENDING", "???", "???", "RUNNING");

        for (int i = 0; i < 5; i++) {
            monitor.pollOnce();
        }
        assertEquals(JobStatus.PENDING, job("j1").status());
        assertEquals(2, job("j1").unknownObservations());

        monitor.pollOnce();
        assertEquals(JobStatus.RUNNING, job("j1").status());
        assertEquals(0, job("j1").unknownObservations());
    }

    @Test
    void timedOutQueriesCountAsUnknown() {
        submitted("j1", "100", "m1");
        TransientQueryException timeout = new TransientQueryException("scontrol timed out", null, true);
        scheduler.fail("100", timeout).fail("100", timeout).fail("100", timeout);

        monitor.pollOnce();
        monitor.pollOnce();
        assertEquals(JobStatus.PENDING, job("j1").status());

        monitor.pollOnce();
        assertEquals(JobStatus.FAILED, job("j1").status());
        assertTrue(job("j1").errorMessage().contains("query timed out"));
    }

    @Test
    void otherQueryErrorsLeaveJobUntouched() {
        submitted("j1", "100", "m1");
        scheduler.fail("100", new TransientQueryException("cannot spawn scontrol", null))
                .report("100", "RUNNING");

        CycleReport report = monitor.pollOnce();
        assertEquals(1, report.errors());
        assertEquals(JobStatus.PENDING, job("j1").status());
        assertEquals(0, job("j1").unknownObservations());

        monitor.pollOnce();
        assertEquals(JobStatus.RUNNING, job("j1").status());
    }

    @Test
    void oneBrokenJobDoesNotStopTheCycle() {
        submitted("j1", "100", "m1");
        // job without a training record: its side effect fails
        jobs.save(Job.builder().id("orphan").jobType(JobType.TRAINING).externalId("101")
                .submissionArtifact("x").createdAt(Instant.now()).build());
        submitted("j3", "102", "m3");
        scheduler.report("100", "COMPLETED").report("101", "COMPLETED")
                .fail("102", new RuntimeException("boom")).report("102", "COMPLETED");

        CycleReport report = monitor.pollOnce();

        assertEquals(3, report.polled());
        assertEquals(1, report.transitioned());
        assertEquals(2, report.errors());
        assertEquals(JobStatus.COMPLETED, job("j1").status());
        // the failed side effect rolled the status write back
        assertEquals(JobStatus.PENDING, job("orphan").status());
        assertEquals(JobStatus.PENDING, job("j3").status());

        monitor.pollOnce();
        assertEquals(JobStatus.COMPLETED, job("j3").status());
        assertEquals(JobStatus.PENDING, job("orphan").status());
    }

    @Test
    void unreachableControllerLeavesRunningJobAlone() {
        submitted("j1", "100", "m1");
        scheduler.report("100", "RUNNING");
        monitor.pollOnce();

        CommandRunner controllerDown = (command, timeout) -> new CommandRunner.Result(1, "",
                "slurm_load_jobs error: Unable to contact slurm controller (connect failure)");
        SlurmClient slurm = new SlurmClient(controllerDown, new ScontrolParser(), "sbatch", "scontrol",
                Duration.ofSeconds(5));
        TrainingJobMonitor slurmMonitor = new TrainingJobMonitor(db, jobs, trainings, models, slurm,
                new JobStateMachine(StateMapping.slurmDefaults(), 3));

        for (int i = 0; i < 5; i++) {
            CycleReport report = slurmMonitor.pollOnce();
            assertEquals(1, report.errors());
        }

        Job job = job("j1");
        assertEquals(JobStatus.RUNNING, job.status());
        assertEquals(0, job.unknownObservations());
        assertNull(job.endTime());
        assertTrue(models.findByTrainingId("t-j1").isEmpty());
        assertEquals(TrainingStatus.TRAINING, trainings.findById("t-j1").orElseThrow().status());
    }

    @Test
    void requeuedJobStaysRunning() {
        submitted("j1", "100", "m1");
        scheduler.report("100", "RUNNING", "REQUEUED");

        monitor.pollOnce();
        CycleReport report = monitor.pollOnce();

        assertEquals(1, report.unchanged());
        assertEquals(JobStatus.RUNNING, job("j1").status());
    }

    @Test
    void pollJobOnceReconcilesOnDemand() {
        submitted("j1", "100", "m1");
        scheduler.report("100", StateMapping.NOT_FOUND);

        Job result = monitor.pollJobOnce("j1");

        assertEquals(JobStatus.COMPLETED, result.status());
        assertTrue(models.findByTrainingId("t-j1").isPresent());
    }

    @Test
    void stopRequestEndsCycleBetweenJobs() {
        submitted("j1", "100", "m1");
        submitted("j2", "101", "m2");
        scheduler.report("100", "RUNNING").report("101", "RUNNING");
        int[] checks = { 0 };

        CycleReport report = monitor.pollOnce(() -> checks[0]++ >= 1);

        assertEquals(1, report.polled());
        assertEquals(1, report.transitioned());
        long running = jobs.findByStatus(JobStatus.RUNNING).size();
        long pending = jobs.findByStatus(JobStatus.PENDING).size();
        assertEquals(1, running);
        assertEquals(1, pending);
    }
}
