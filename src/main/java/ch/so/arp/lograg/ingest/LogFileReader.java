package ch.so.arp.lograg.ingest;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Finds log files in the input directory and parses them. A log file holds a
 * JSON array of log records; each record is a JSON object.
 */
class LogFileReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(LogFileReader.class);

    private final Path inputDirectory;
    private final String filePattern;
    private final ObjectMapper objectMapper;

    LogFileReader(Path inputDirectory, String filePattern, ObjectMapper objectMapper) {
        this.inputDirectory = Objects.requireNonNull(inputDirectory, "inputDirectory").toAbsolutePath().normalize();
        this.filePattern = Objects.requireNonNull(filePattern, "filePattern");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * @return the matching regular files, sorted by file name
     */
    List<Path> discover() {
        if (!Files.isDirectory(inputDirectory)) {
            LOGGER.warn("Input directory {} does not exist", inputDirectory);
            return List.of();
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(inputDirectory, filePattern)) {
            for (Path candidate : stream) {
                if (Files.isRegularFile(candidate)) {
                    files.add(candidate.toAbsolutePath().normalize());
                }
            }
        } catch (IOException ex) {
            throw new IngestionException("Unable to list log files in " + inputDirectory, ex);
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }

    /**
     * Parse all records of one file. Any malformed record fails the whole file.
     */
    List<ObjectNode> read(Path file) {
        String fileId = identifierOf(file);
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (JsonProcessingException ex) {
            throw new SourceFileParseException(fileId, "Invalid JSON in " + fileId + ": " + ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            throw new SourceFileParseException(fileId, "Unable to read " + fileId, ex);
        }
        if (root == null || root.isMissingNode()) {
            throw new SourceFileParseException(fileId, fileId + " is empty, expected a JSON array of log records");
        }
        if (!root.isArray()) {
            throw new SourceFileParseException(fileId,
                    fileId + " holds a JSON " + root.getNodeType() + ", expected an array of log records");
        }
        List<ObjectNode> records = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            JsonNode element = root.get(i);
            if (!element.isObject()) {
                throw new SourceFileParseException(fileId,
                        "Record " + i + " of " + fileId + " is a JSON " + element.getNodeType() + ", expected an object");
            }
            records.add((ObjectNode) element);
        }
        LOGGER.debug("Parsed {} records from {}", records.size(), fileId);
        return records;
    }

    Path inputDirectory() {
        return inputDirectory;
    }

    static String identifierOf(Path file) {
        return file.toAbsolutePath().normalize().toString();
    }
}
