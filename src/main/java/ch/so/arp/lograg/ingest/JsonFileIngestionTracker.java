package ch.so.arp.lograg.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * {@link IngestionTracker} persisted as a JSON array of file identifiers. The
 * file is the only state: every call reads it again, so clearing it while the
 * application runs takes effect for the next file. Every
 * {@link #mark(String)} rewrites the whole list to a sibling temporary file
 * and moves it over the tracker file in one step.
 */
class JsonFileIngestionTracker implements IngestionTracker {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileIngestionTracker.class);

    private static final TypeReference<List<String>> FILE_LIST = new TypeReference<>() {
    };

    private final Path trackerFile;
    private final ObjectMapper objectMapper;

    JsonFileIngestionTracker(Path trackerFile, ObjectMapper objectMapper) {
        this.trackerFile = Objects.requireNonNull(trackerFile, "trackerFile").toAbsolutePath().normalize();
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        if (Files.exists(this.trackerFile)) {
            LOGGER.info("Loaded {} ingested files from {}", load().size(), this.trackerFile);
        } else {
            LOGGER.info("No ingestion tracker at {}, starting with an empty record", this.trackerFile);
        }
    }

    @Override
    public synchronized boolean has(String fileId) {
        return load().contains(fileId);
    }

    @Override
    public synchronized void mark(String fileId) {
        Set<String> ingested = load();
        if (!ingested.add(fileId)) {
            return;
        }
        try {
            Files.createDirectories(trackerFile.getParent());
            Path temporary = trackerFile.resolveSibling(trackerFile.getFileName() + ".tmp");
            objectMapper.writeValue(temporary.toFile(), List.copyOf(ingested));
            Files.move(temporary, trackerFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            throw new IngestionTrackerException("Unable to record '" + fileId + "' in " + trackerFile, ex);
        }
        LOGGER.debug("Marked '{}' as ingested ({} files tracked)", fileId, ingested.size());
    }

    private Set<String> load() {
        if (!Files.exists(trackerFile)) {
            return new LinkedHashSet<>();
        }
        try {
            List<String> stored = objectMapper.readValue(trackerFile.toFile(), FILE_LIST);
            return stored == null ? new LinkedHashSet<>() : new LinkedHashSet<>(stored);
        } catch (IOException ex) {
            throw new IngestionTrackerException("Ingestion tracker " + trackerFile + " is not a JSON list", ex);
        }
    }
}
