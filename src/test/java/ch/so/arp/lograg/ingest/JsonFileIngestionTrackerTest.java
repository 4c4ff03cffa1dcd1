package ch.so.arp.lograg.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

class JsonFileIngestionTrackerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void startsEmptyWithoutTrackerFile() {
        JsonFileIngestionTracker tracker = new JsonFileIngestionTracker(tempDir.resolve("tracker.json"), objectMapper);

        assertThat(tracker.has("/logs/day1.json")).isFalse();
    }

    @Test
    void persistsMarkedFilesAcrossInstances() throws Exception {
        Path trackerFile = tempDir.resolve("ingestracker").resolve("ingested_files.json");
        JsonFileIngestionTracker tracker = new JsonFileIngestionTracker(trackerFile, objectMapper);

        tracker.mark("/logs/day1.json");
        tracker.mark("/logs/day2.json");
        tracker.mark("/logs/day1.json");

        List<String> stored = objectMapper.readValue(trackerFile.toFile(), new TypeReference<List<String>>() {
        });
        assertThat(stored).containsExactly("/logs/day1.json", "/logs/day2.json");
        assertThat(trackerFile.resolveSibling("ingested_files.json.tmp")).doesNotExist();

        JsonFileIngestionTracker reloaded = new JsonFileIngestionTracker(trackerFile, objectMapper);
        assertThat(reloaded.has("/logs/day1.json")).isTrue();
        assertThat(reloaded.has("/logs/day2.json")).isTrue();
        assertThat(reloaded.has("/logs/day3.json")).isFalse();
    }

    @Test
    void honoursRecordClearedWhileRunning() throws Exception {
        Path trackerFile = tempDir.resolve("ingested_files.json");
        JsonFileIngestionTracker tracker = new JsonFileIngestionTracker(trackerFile, objectMapper);
        tracker.mark("/logs/day1.json");

        Files.writeString(trackerFile, "[]");

        assertThat(tracker.has("/logs/day1.json")).isFalse();
        tracker.mark("/logs/day2.json");
        List<String> stored = objectMapper.readValue(trackerFile.toFile(), new TypeReference<List<String>>() {
        });
        assertThat(stored).containsExactly("/logs/day2.json");
    }

    @Test
    void seesEntriesWrittenByAnotherInstance() {
        Path trackerFile = tempDir.resolve("ingested_files.json");
        JsonFileIngestionTracker first = new JsonFileIngestionTracker(trackerFile, objectMapper);
        JsonFileIngestionTracker second = new JsonFileIngestionTracker(trackerFile, objectMapper);

        first.mark("/logs/day1.json");
        second.mark("/logs/day2.json");

        assertThat(first.has("/logs/day2.json")).isTrue();
        assertThat(second.has("/logs/day1.json")).isTrue();
    }

    @Test
    void rejectsUnreadableTrackerFile() throws Exception {
        Path trackerFile = tempDir.resolve("tracker.json");
        Files.writeString(trackerFile, "{\"not\": \"a list\"}");

        assertThatThrownBy(() -> new JsonFileIngestionTracker(trackerFile, objectMapper))
                .isInstanceOf(IngestionTrackerException.class);
    }
}
