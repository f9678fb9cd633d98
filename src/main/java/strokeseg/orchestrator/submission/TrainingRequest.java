package strokeseg.orchestrator.submission;

/**
 * Request to train a model.
 *
 * @param modelName     training name; the resulting model is called {@code <modelName>_model}
 * @param imagesPath    directory with training images
 * @param labelsPath    directory with training labels
 * @param configuration training configuration identifier, e.g. {@code 3d_fullres}
 * @param foldIndex     cross-validation fold
 */
public record TrainingRequest(
        String modelName,
        String imagesPath,
        String labelsPath,
        String configuration,
        int foldIndex) {
}
