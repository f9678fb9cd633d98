package strokeseg.orchestrator.monitor;

import strokeseg.orchestrator.exception.SideEffectException;
import strokeseg.orchestrator.model.Evaluation;
import strokeseg.orchestrator.model.Job;
import strokeseg.orchestrator.model.JobType;
import strokeseg.orchestrator.repository.EvaluationRepository;
import strokeseg.orchestrator.repository.JobRepository;
import strokeseg.orchestrator.scheduler.SchedulerClient;
import strokeseg.orchestrator.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Monitors evaluation jobs and attaches the metrics summary once they complete.
 */
public class EvaluationJobMonitor extends JobMonitor {

    private static final Logger log = LoggerFactory.getLogger(EvaluationJobMonitor.class);

    static final String RESULT_FILE = "summary.json";

    private final EvaluationRepository evaluationRepository;
    private final ResultCollector resultCollector;

    public EvaluationJobMonitor(Database db, JobRepository jobRepository, EvaluationRepository evaluationRepository,
            ResultCollector resultCollector, SchedulerClient scheduler, JobStateMachine stateMachine) {
        super(JobType.EVALUATION, db, jobRepository, scheduler, stateMachine);
        this.evaluationRepository = evaluationRepository;
        this.resultCollector = resultCollector;
    }

    @Override
    protected void onRunning(Job job, Instant startTime) {
        evaluationRepository.markEvaluating(evaluationFor(job).id(), startTime);
    }

    @Override
    protected void onCompleted(Job job, Instant endTime) {
        Evaluation evaluation = evaluationFor(job);
        String results = resultCollector.collect(evaluation.outputPath(), RESULT_FILE);
        if (!evaluationRepository.markCompleted(evaluation.id(), results, endTime)) {
            log.warn("Evaluation {} was already finished ({})", evaluation.id(), evaluation.status());
        }
    }

    @Override
    protected void onFailed(Job job, String errorMessage, Instant endTime) {
        evaluationRepository.markFailed(evaluationFor(job).id(), errorMessage, endTime);
    }

    private Evaluation evaluationFor(Job job) {
        return evaluationRepository.findByJobId(job.id())
                .orElseThrow(() -> new SideEffectException("No evaluation record for job " + job.id()));
    }
}
