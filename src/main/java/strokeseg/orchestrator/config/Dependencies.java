package strokeseg.orchestrator.config;

import strokeseg.orchestrator.monitor.EvaluationJobMonitor;
import strokeseg.orchestrator.monitor.InferenceJobMonitor;
import strokeseg.orchestrator.monitor.JobMonitorManager;
import strokeseg.orchestrator.monitor.JobStateMachine;
import strokeseg.orchestrator.monitor.ResultCollector;
import strokeseg.orchestrator.monitor.TrainingJobMonitor;
import strokeseg.orchestrator.repository.EvaluationRepository;
import strokeseg.orchestrator.repository.InferenceRepository;
import strokeseg.orchestrator.repository.JobRepository;
import strokeseg.orchestrator.repository.ModelRepository;
import strokeseg.orchestrator.repository.TrainingRepository;
import strokeseg.orchestrator.scheduler.ProcessCommandRunner;
import strokeseg.orchestrator.scheduler.SchedulerClient;
import strokeseg.orchestrator.scheduler.SlurmClient;
import strokeseg.orchestrator.store.Database;
import strokeseg.orchestrator.store.JdbcEvaluationRepository;
import strokeseg.orchestrator.store.JdbcInferenceRepository;
import strokeseg.orchestrator.store.JdbcJobRepository;
import strokeseg.orchestrator.store.JdbcModelRepository;
import strokeseg.orchestrator.store.JdbcTrainingRepository;
import strokeseg.orchestrator.submission.EvaluationSubmissionFacade;
import strokeseg.orchestrator.submission.InferenceSubmissionFacade;
import strokeseg.orchestrator.submission.SubmissionSupport;
import strokeseg.orchestrator.submission.TrainingSubmissionFacade;
import strokeseg.orchestrator.template.ClasspathTemplateSource;
import strokeseg.orchestrator.template.TemplateRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Manual dependency injection container.
 * Creates and wires the store, scheduler client, monitors and submission facades.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(OrchestratorConfig.fromEnv());
 * deps.startMonitors();
 * deps.trainingFacade().submit(request);
 * // ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final OrchestratorConfig config;
    private final Database database;
    private final JobRepository jobRepository;
    private final TrainingRepository trainingRepository;
    private final ModelRepository modelRepository;
    private final InferenceRepository inferenceRepository;
    private final EvaluationRepository evaluationRepository;
    private final SchedulerClient schedulerClient;
    private final TemplateRenderer templateRenderer;

    private final TrainingSubmissionFacade trainingFacade;
    private final InferenceSubmissionFacade inferenceFacade;
    private final EvaluationSubmissionFacade evaluationFacade;
    private final JobMonitorManager monitorManager;

    private Dependencies(OrchestratorConfig config, SchedulerClient schedulerClient) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.schedulerClient = schedulerClient != null
                ? schedulerClient
                : new SlurmClient(new ProcessCommandRunner(), config);
        this.templateRenderer = new TemplateRenderer(new ClasspathTemplateSource(config.templateDirectory()));

        // Repositories
        this.jobRepository = new JdbcJobRepository(database);
        this.trainingRepository = new JdbcTrainingRepository(database);
        this.modelRepository = new JdbcModelRepository(database);
        this.inferenceRepository = new JdbcInferenceRepository(database);
        this.evaluationRepository = new JdbcEvaluationRepository(database);

        // Submission
        SubmissionSupport support = new SubmissionSupport(database, jobRepository, templateRenderer,
                this.schedulerClient, config);
        this.trainingFacade = new TrainingSubmissionFacade(support, trainingRepository);
        this.inferenceFacade = new InferenceSubmissionFacade(support, modelRepository, inferenceRepository);
        this.evaluationFacade = new EvaluationSubmissionFacade(support, modelRepository, evaluationRepository);

        // Monitoring
        JobStateMachine stateMachine = new JobStateMachine(config.stateMapping(), config.unknownStateThreshold());
        ResultCollector resultCollector = new ResultCollector();
        this.monitorManager = new JobMonitorManager(List.of(
                new TrainingJobMonitor(database, jobRepository, trainingRepository, modelRepository,
                        this.schedulerClient, stateMachine),
                new InferenceJobMonitor(database, jobRepository, inferenceRepository, resultCollector,
                        this.schedulerClient, stateMachine),
                new EvaluationJobMonitor(database, jobRepository, evaluationRepository, resultCollector,
                        this.schedulerClient, stateMachine)),
                jobRepository, config);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies talking to SLURM.
     */
    public static Dependencies create(OrchestratorConfig config) {
        return new Dependencies(config, null);
    }

    /**
     * Create dependencies with a custom scheduler client.
     */
    public static Dependencies create(OrchestratorConfig config, SchedulerClient schedulerClient) {
        return new Dependencies(config, schedulerClient);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(OrchestratorConfig.fromEnv());
    }

    // Getters
    public OrchestratorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public TrainingRepository trainingRepository() {
        return trainingRepository;
    }

    public ModelRepository modelRepository() {
        return modelRepository;
    }

    public InferenceRepository inferenceRepository() {
        return inferenceRepository;
    }

    public EvaluationRepository evaluationRepository() {
        return evaluationRepository;
    }

    public SchedulerClient schedulerClient() {
        return schedulerClient;
    }

    public TemplateRenderer templateRenderer() {
        return templateRenderer;
    }

    public TrainingSubmissionFacade trainingFacade() {
        return trainingFacade;
    }

    public InferenceSubmissionFacade inferenceFacade() {
        return inferenceFacade;
    }

    public EvaluationSubmissionFacade evaluationFacade() {
        return evaluationFacade;
    }

    public JobMonitorManager monitorManager() {
        return monitorManager;
    }

    /**
     * Start the background job monitors.
     */
    public void startMonitors() {
        monitorManager.start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop monitors first so no cycle runs against a closed pool
        try {
            monitorManager.stop();
        } catch (Exception e) {
            log.warn("Error stopping monitors: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
