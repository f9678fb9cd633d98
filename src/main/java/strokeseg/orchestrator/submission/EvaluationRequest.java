package strokeseg.orchestrator.submission;

import java.util.List;

/**
 * Request to evaluate a trained model against a labelled dataset.
 *
 * @param modelName      model to evaluate
 * @param evaluationPath dataset directory (imagesTs / labelsTs)
 * @param configurations configuration identifiers to evaluate
 */
public record EvaluationRequest(
        String modelName,
        String evaluationPath,
        List<String> configurations) {
}
