package strokeseg.orchestrator.monitor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import strokeseg.orchestrator.exception.SideEffectException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * Builds the JSON payload stored on a finished inference or evaluation:
 * <pre>
 * {"output_dir": "...", "files": ["a.nii.gz", ...], "result": { parsed result file } }
 * </pre>
 * A missing directory or result file yields an empty listing and a null result.
 */
public class ResultCollector {

    private static final Logger log = LoggerFactory.getLogger(ResultCollector.class);

    private final ObjectMapper mapper;

    public ResultCollector() {
        this(new ObjectMapper());
    }

    public ResultCollector(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @param outputDir  directory the job wrote to
     * @param resultFile name of the JSON file inside it holding the structured result
     * @throws SideEffectException if the result file exists but cannot be read or parsed
     */
    public String collect(String outputDir, String resultFile) {
        Path dir = Path.of(outputDir);
        ObjectNode root = mapper.createObjectNode();
        root.put("output_dir", outputDir);
        ArrayNode files = root.putArray("files");

        if (!Files.isDirectory(dir)) {
            log.warn("Output directory {} does not exist", outputDir);
            root.putNull("result");
            return write(root);
        }

        try (Stream<Path> entries = Files.list(dir)) {
            entries.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .forEach(files::add);
        } catch (IOException e) {
            throw new SideEffectException("Failed to list output directory " + outputDir, e);
        }

        Path result = dir.resolve(resultFile);
        if (Files.isRegularFile(result)) {
            try {
                JsonNode parsed = mapper.readTree(result.toFile());
                root.set("result", parsed);
            } catch (IOException e) {
                throw new SideEffectException("Failed to parse " + result + ": " + e.getMessage(), e);
            }
        } else {
            root.putNull("result");
        }
        return write(root);
    }

    private String write(ObjectNode root) {
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new SideEffectException("Failed to serialize result payload", e);
        }
    }
}
