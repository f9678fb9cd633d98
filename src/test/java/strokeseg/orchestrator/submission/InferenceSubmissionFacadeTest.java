package strokeseg.orchestrator.submission;

import strokeseg.orchestrator.config.OrchestratorConfig;
import strokeseg.orchestrator.exception.SubmissionException;
import strokeseg.orchestrator.exception.ValidationException;
import strokeseg.orchestrator.model.*;
import strokeseg.orchestrator.store.*;
import strokeseg.orchestrator.support.FakeSchedulerClient;
import strokeseg.orchestrator.support.TestDatabases;
import strokeseg.orchestrator.template.ClasspathTemplateSource;
import strokeseg.orchestrator.template.TemplateRenderer;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class InferenceSubmissionFacadeTest {

    private static Database db;
    private static JdbcJobRepository jobs;
    private static JdbcTrainingRepository trainings;
    private static JdbcModelRepository models;
    private static JdbcInferenceRepository inferences;

    @TempDir
    Path modelsDir;

    private FakeSchedulerClient scheduler;
    private InferenceSubmissionFacade facade;
    private Path modelPath;

    @BeforeAll
    static void setup() {
        db = TestDatabases.open("test-inference-facade");
        jobs = new JdbcJobRepository(db);
        trainings = new JdbcTrainingRepository(db);
        models = new JdbcModelRepository(db);
        inferences = new JdbcInferenceRepository(db);
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
        OrchestratorConfig config = TestDatabases.config("test-inference-facade")
                .withModelsBasePath(modelsDir.toString());
        SubmissionSupport support = new SubmissionSupport(db, jobs,
                new TemplateRenderer(new ClasspathTemplateSource("templates")), scheduler, config);
        facade = new InferenceSubmissionFacade(support, models, inferences);

        modelPath = modelsDir.resolve("m1").resolve("20250101_120000");
        jobs.save(Job.builder().id("train-job").jobType(JobType.TRAINING).status(JobStatus.COMPLETED)
                .externalId("1").submissionArtifact("x").build());
        trainings.save(new Training("t1", "m1", "/img", "/lbl", modelPath.toString(), "3d_fullres", 0,
                "train-job", TrainingStatus.TRAINED, null, null, null, Instant.now()));
        models.save(new Model("model-1", "t1", "m1_model", modelPath.toString(), Instant.now()));
    }

    @Test
    void submitWritesIntoPerJobOutputDirectory() {
        SubmissionResult result = facade.submit(new InferenceRequest("m1_model", "/data/case_001", "3d_fullres", 0));

        Inference inference = inferences.findById(result.workflowId()).orElseThrow();
        assertEquals(InferenceStatus.PENDING, inference.status());
        assertEquals("model-1", inference.modelId());
        assertEquals(result.jobId(), inference.jobId());

        Path outputDir = Path.of(inference.outputDir());
        assertEquals(modelPath.resolve("inference"), outputDir.getParent());
        assertTrue(outputDir.getFileName().toString().matches(
                Pattern.quote(result.jobId()) + "-\\d{8}_\\d{6}"));
        assertTrue(Files.isDirectory(outputDir));

        String script = jobs.findById(result.jobId()).orElseThrow().submissionArtifact();
        assertTrue(script.contains(inference.outputDir()));
        assertTrue(script.contains("/data/case_001"));
    }

    @Test
    void twoSubmissionsNeverShareADirectory() {
        SubmissionResult a = facade.submit(new InferenceRequest("m1_model", "/data/a", "3d_fullres", 0));
        SubmissionResult b = facade.submit(new InferenceRequest("m1_model", "/data/b", "3d_fullres", 0));

        assertNotEquals(inferences.findById(a.workflowId()).orElseThrow().outputDir(),
                inferences.findById(b.workflowId()).orElseThrow().outputDir());
        assertNotEquals(a.externalJobId(), b.externalJobId());
    }

    @Test
    void unknownModelIsRejectedBeforeSubmitting() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> facade.submit(new InferenceRequest("nope", "/data/a", "3d_fullres", 0)));

        assertTrue(e.getMessage().contains("nope"));
        assertTrue(scheduler.submittedScripts().isEmpty());
    }

    @Test
    void rejectedSubmissionFailsInference() {
        scheduler.failSubmissions("sbatch: error: Batch job submission failed");

        SubmissionException e = assertThrows(SubmissionException.class,
                () -> facade.submit(new InferenceRequest("m1_model", "/data/a", "3d_fullres", 0)));

        Inference inference = inferences.findByJobId(e.jobId()).orElseThrow();
        assertEquals(InferenceStatus.FAILED, inference.status());
        assertTrue(inference.errorMessage().contains("Batch job submission failed"));
        assertEquals(JobStatus.FAILED, jobs.findById(e.jobId()).orElseThrow().status());
    }
}
