package strokeseg.orchestrator.monitor;

import strokeseg.orchestrator.exception.SideEffectException;
import strokeseg.orchestrator.model.Inference;
import strokeseg.orchestrator.model.Job;
import strokeseg.orchestrator.model.JobType;
import strokeseg.orchestrator.repository.InferenceRepository;
import strokeseg.orchestrator.repository.JobRepository;
import strokeseg.orchestrator.scheduler.SchedulerClient;
import strokeseg.orchestrator.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Monitors inference jobs and attaches the prediction output once they complete.
 */
public class InferenceJobMonitor extends JobMonitor {

    private static final Logger log = LoggerFactory.getLogger(InferenceJobMonitor.class);

    static final String RESULT_FILE = "prediction.json";

    private final InferenceRepository inferenceRepository;
    private final ResultCollector resultCollector;

    public InferenceJobMonitor(Database db, JobRepository jobRepository, InferenceRepository inferenceRepository,
            ResultCollector resultCollector, SchedulerClient scheduler, JobStateMachine stateMachine) {
        super(JobType.INFERENCE, db, jobRepository, scheduler, stateMachine);
        this.inferenceRepository = inferenceRepository;
        this.resultCollector = resultCollector;
    }

    @Override
    protected void onRunning(Job job, Instant startTime) {
        inferenceRepository.markProcessing(inferenceFor(job).id(), startTime);
    }

    @Override
    protected void onCompleted(Job job, Instant endTime) {
        Inference inference = inferenceFor(job);
        String prediction = resultCollector.collect(inference.outputDir(), RESULT_FILE);
        if (!inferenceRepository.markCompleted(inference.id(), prediction, endTime)) {
            log.warn("Inference {} was already finished ({})", inference.id(), inference.status());
        }
    }

    @Override
    protected void onFailed(Job job, String errorMessage, Instant endTime) {
        inferenceRepository.markFailed(inferenceFor(job).id(), errorMessage, endTime);
    }

    private Inference inferenceFor(Job job) {
        return inferenceRepository.findByJobId(job.id())
                .orElseThrow(() -> new SideEffectException("No inference record for job " + job.id()));
    }
}
