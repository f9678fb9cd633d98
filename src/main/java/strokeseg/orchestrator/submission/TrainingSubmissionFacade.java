package strokeseg.orchestrator.submission;

import strokeseg.orchestrator.model.JobType;
import strokeseg.orchestrator.model.Training;
import strokeseg.orchestrator.model.TrainingStatus;
import strokeseg.orchestrator.repository.TrainingRepository;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for training submissions.
 */
public class TrainingSubmissionFacade {

    static final String TEMPLATE = "training";

    private final SubmissionSupport support;
    private final TrainingRepository trainingRepository;

    public TrainingSubmissionFacade(SubmissionSupport support, TrainingRepository trainingRepository) {
        this.support = support;
        this.trainingRepository = trainingRepository;
    }

    public SubmissionResult submit(TrainingRequest request) {
        String name = SubmissionSupport.requireIdentifier(request.modelName(), "modelName");
        String imagesPath = SubmissionSupport.requireText(request.imagesPath(), "imagesPath");
        String labelsPath = SubmissionSupport.requireText(request.labelsPath(), "labelsPath");
        String configuration = SubmissionSupport.requireIdentifier(request.configuration(), "configuration");
        int foldIndex = SubmissionSupport.requireNonNegative(request.foldIndex(), "foldIndex");

        Instant now = Instant.now();
        String jobId = support.newJobId();
        String trainingId = UUID.randomUUID().toString();
        String modelPath = Path.of(support.config().modelsBasePath(), name,
                jobId + "-" + support.timestamp(now)).toString();

        Map<String, String> variables = new LinkedHashMap<>();
        variables.put("model_name", name);
        variables.put("model_path", modelPath);
        variables.put("configuration", configuration);
        variables.put("images_path", imagesPath);
        variables.put("labels_path", labelsPath);
        variables.put("fold_index", String.valueOf(foldIndex));
        variables.put("job_id", jobId);
        String script = support.render(TEMPLATE, variables);

        return support.submit(JobType.TRAINING, jobId, trainingId, script, modelPath,
                job -> trainingRepository.save(new Training(
                        trainingId, name, imagesPath, labelsPath, modelPath, configuration, foldIndex, job.id(),
                        TrainingStatus.TRAINING, null, null, null, job.createdAt())),
                (error, endTime) -> trainingRepository.markFailed(trainingId, error, endTime));
    }
}
