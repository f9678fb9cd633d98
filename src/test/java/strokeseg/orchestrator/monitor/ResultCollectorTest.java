package strokeseg.orchestrator.monitor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import strokeseg.orchestrator.exception.SideEffectException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ResultCollectorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ResultCollector collector = new ResultCollector(mapper);

    @TempDir
    Path dir;

    @Test
    void listsFilesSortedAndEmbedsResult() throws Exception {
        Files.writeString(dir.resolve("case_002.nii.gz"), "x");
        Files.writeString(dir.resolve("case_001.nii.gz"), "x");
        Files.writeString(dir.resolve("summary.json"), "{\"dice\": 0.81, \"cases\": 2}");
        Files.createDirectory(dir.resolve("logs"));

        JsonNode payload = mapper.readTree(collector.collect(dir.toString(), "summary.json"));

        assertEquals(dir.toString(), payload.get("output_dir").asText());
        assertEquals(3, payload.get("files").size());
        assertEquals("case_001.nii.gz", payload.get("files").get(0).asText());
        assertEquals("case_002.nii.gz", payload.get("files").get(1).asText());
        assertEquals(0.81, payload.get("result").get("dice").asDouble(), 1e-9);
    }

    @Test
    void missingResultFileGivesNullResult() throws Exception {
        Files.writeString(dir.resolve("mask.nii.gz"), "x");

        JsonNode payload = mapper.readTree(collector.collect(dir.toString(), "prediction.json"));

        assertTrue(payload.get("result").isNull());
        assertEquals(1, payload.get("files").size());
    }

    @Test
    void missingDirectoryGivesEmptyListing() throws Exception {
        String missing = dir.resolve("nope").toString();

        JsonNode payload = mapper.readTree(collector.collect(missing, "prediction.json"));

        assertEquals(0, payload.get("files").size());
        assertTrue(payload.get("result").isNull());
    }

    @Test
    void unparsableResultIsASideEffectFailure() throws Exception {
        Files.writeString(dir.resolve("prediction.json"), "{not json");

        SideEffectException e = assertThrows(SideEffectException.class,
                () -> collector.collect(dir.toString(), "prediction.json"));
        assertTrue(e.getMessage().contains("prediction.json"));
    }
}
