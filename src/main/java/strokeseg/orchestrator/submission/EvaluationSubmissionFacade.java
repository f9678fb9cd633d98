package strokeseg.orchestrator.submission;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import strokeseg.orchestrator.exception.ValidationException;
import strokeseg.orchestrator.model.Evaluation;
import strokeseg.orchestrator.model.EvaluationStatus;
import strokeseg.orchestrator.model.JobType;
import strokeseg.orchestrator.model.Model;
import strokeseg.orchestrator.repository.EvaluationRepository;
import strokeseg.orchestrator.repository.ModelRepository;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for evaluation submissions.
 */
public class EvaluationSubmissionFacade {

    static final String TEMPLATE = "evaluation";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SubmissionSupport support;
    private final ModelRepository modelRepository;
    private final EvaluationRepository evaluationRepository;

    public EvaluationSubmissionFacade(SubmissionSupport support, ModelRepository modelRepository,
            EvaluationRepository evaluationRepository) {
        this.support = support;
        this.modelRepository = modelRepository;
        this.evaluationRepository = evaluationRepository;
    }

    public SubmissionResult submit(EvaluationRequest request) {
        String modelName = SubmissionSupport.requireText(request.modelName(), "modelName");
        String evaluationPath = SubmissionSupport.requireText(request.evaluationPath(), "evaluationPath");
        if (request.configurations() == null || request.configurations().isEmpty()) {
            throw new ValidationException("configurations must not be empty");
        }
        List<String> configurations = new ArrayList<>();
        for (String c : request.configurations()) {
            configurations.add(SubmissionSupport.requireIdentifier(c, "configurations"));
        }
        Model model = modelRepository.findByName(modelName)
                .orElseThrow(() -> new ValidationException("Model not found: " + modelName));

        String jobId = support.newJobId();
        String evaluationId = UUID.randomUUID().toString();
        String outputPath = Path.of(support.config().modelsBasePath(), model.modelName(), "evaluation",
                jobId + "-" + support.timestamp(Instant.now())).toString();
        String configurationsJson = toJson(configurations);

        Map<String, String> variables = new LinkedHashMap<>();
        variables.put("model_name", model.modelName());
        variables.put("model_path", model.modelPath());
        variables.put("evaluation_path", evaluationPath);
        variables.put("output_path", outputPath);
        variables.put("configurations", String.join(",", configurations));
        variables.put("job_id", jobId);
        String script = support.render(TEMPLATE, variables);

        return support.submit(JobType.EVALUATION, jobId, evaluationId, script, outputPath,
                job -> evaluationRepository.save(new Evaluation(
                        evaluationId, model.id(), job.id(), evaluationPath, outputPath, configurationsJson,
                        EvaluationStatus.PENDING, null, null, null, null, job.createdAt())),
                (error, endTime) -> evaluationRepository.markFailed(evaluationId, error, endTime));
    }

    private static String toJson(List<String> configurations) {
        try {
            return MAPPER.writeValueAsString(configurations);
        } catch (JsonProcessingException e) {
            throw new ValidationException("configurations cannot be serialized: " + e.getMessage());
        }
    }
}
