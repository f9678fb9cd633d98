package strokeseg.orchestrator.monitor;

import strokeseg.orchestrator.exception.SideEffectException;
import strokeseg.orchestrator.model.Job;
import strokeseg.orchestrator.model.JobType;
import strokeseg.orchestrator.model.Model;
import strokeseg.orchestrator.model.Training;
import strokeseg.orchestrator.repository.JobRepository;
import strokeseg.orchestrator.repository.ModelRepository;
import strokeseg.orchestrator.repository.TrainingRepository;
import strokeseg.orchestrator.scheduler.SchedulerClient;
import strokeseg.orchestrator.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Monitors training jobs. A completed training produces exactly one model.
 */
public class TrainingJobMonitor extends JobMonitor {

    private static final Logger log = LoggerFactory.getLogger(TrainingJobMonitor.class);

    private final TrainingRepository trainingRepository;
    private final ModelRepository modelRepository;

    public TrainingJobMonitor(Database db, JobRepository jobRepository, TrainingRepository trainingRepository,
            ModelRepository modelRepository, SchedulerClient scheduler, JobStateMachine stateMachine) {
        super(JobType.TRAINING, db, jobRepository, scheduler, stateMachine);
        this.trainingRepository = trainingRepository;
        this.modelRepository = modelRepository;
    }

    @Override
    protected void onCompleted(Job job, Instant endTime) {
        Training training = trainingFor(job);

        Optional<Model> existing = modelRepository.findByTrainingId(training.id());
        if (existing.isPresent()) {
            log.info("Model {} already exists for training {}", existing.get().modelName(), training.id());
        } else {
            Model model = new Model(UUID.randomUUID().toString(), training.id(), training.modelName(),
                    training.modelPath(), Instant.now());
            modelRepository.save(model);
            log.info("Created model {} ({}) for training {}", model.modelName(), model.id(), training.id());
        }

        trainingRepository.markTrained(training.id(), endTime);
    }

    @Override
    protected void onFailed(Job job, String errorMessage, Instant endTime) {
        Training training = trainingFor(job);
        trainingRepository.markFailed(training.id(), errorMessage, endTime);
    }

    private Training trainingFor(Job job) {
        return trainingRepository.findByJobId(job.id())
                .orElseThrow(() -> new SideEffectException("No training record for job " + job.id()));
    }
}
