package strokeseg.orchestrator.submission;

/**
 * Request to run a trained model over a set of images.
 */
public record InferenceRequest(
        String modelName,
        String inputPath,
        String configuration,
        int foldIndex) {
}
