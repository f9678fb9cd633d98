package strokeseg.orchestrator.submission;

import strokeseg.orchestrator.exception.ValidationException;
import strokeseg.orchestrator.model.Inference;
import strokeseg.orchestrator.model.InferenceStatus;
import strokeseg.orchestrator.model.JobType;
import strokeseg.orchestrator.model.Model;
import strokeseg.orchestrator.repository.InferenceRepository;
import strokeseg.orchestrator.repository.ModelRepository;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for inference submissions.
 * Every job writes to its own directory {@code <model_path>/inference/<job id>-<timestamp>}.
 */
public class InferenceSubmissionFacade {

    static final String TEMPLATE = "inference";

    private final SubmissionSupport support;
    private final ModelRepository modelRepository;
    private final InferenceRepository inferenceRepository;

    public InferenceSubmissionFacade(SubmissionSupport support, ModelRepository modelRepository,
            InferenceRepository inferenceRepository) {
        this.support = support;
        this.modelRepository = modelRepository;
        this.inferenceRepository = inferenceRepository;
    }

    public SubmissionResult submit(InferenceRequest request) {
        String modelName = SubmissionSupport.requireText(request.modelName(), "modelName");
        String inputPath = SubmissionSupport.requireText(request.inputPath(), "inputPath");
        String configuration = SubmissionSupport.requireIdentifier(request.configuration(), "configuration");
        int foldIndex = SubmissionSupport.requireNonNegative(request.foldIndex(), "foldIndex");
        Model model = modelRepository.findByName(modelName)
                .orElseThrow(() -> new ValidationException("Model not found: " + modelName));

        String jobId = support.newJobId();
        String inferenceId = UUID.randomUUID().toString();
        String outputDir = Path.of(model.modelPath(), "inference",
                jobId + "-" + support.timestamp(Instant.now())).toString();

        Map<String, String> variables = new LinkedHashMap<>();
        variables.put("model_name", model.modelName());
        variables.put("model_path", model.modelPath());
        variables.put("input_path", inputPath);
        variables.put("output_path", outputDir);
        variables.put("configuration", configuration);
        variables.put("fold_index", String.valueOf(foldIndex));
        variables.put("job_id", jobId);
        String script = support.render(TEMPLATE, variables);

        return support.submit(JobType.INFERENCE, jobId, inferenceId, script, outputDir,
                job -> inferenceRepository.save(new Inference(
                        inferenceId, model.id(), job.id(), inputPath, outputDir, null,
                        InferenceStatus.PENDING, null, null, null, job.createdAt())),
                (error, endTime) -> inferenceRepository.markFailed(inferenceId, error, endTime));
    }
}
