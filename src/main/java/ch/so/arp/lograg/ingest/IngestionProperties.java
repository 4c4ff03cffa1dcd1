package ch.so.arp.lograg.ingest;

import java.nio.file.Path;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the incremental ingestion pipeline.
 */
@ConfigurationProperties(prefix = "lograg.ingestion")
public class IngestionProperties {

    /**
     * Directory scanned for log files.
     */
    private Path inputDirectory = Path.of("input-logs");

    /**
     * Glob matched against file names inside the input directory.
     */
    private String filePattern = "*.json";

    /**
     * JSON document listing the files that were fully ingested.
     */
    private Path trackerFile = Path.of("ingestracker", "ingested_files.json");

    /**
     * Number of log records rendered into one document.
     */
    private int logGroupSize = 20;

    /**
     * Maximum chunk length in characters.
     */
    private int chunkSize = 2000;

    /**
     * Maximum number of characters shared by consecutive chunks of a document.
     */
    private int chunkOverlap = 100;

    /**
     * Number of chunks embedded and upserted per request.
     */
    private int batchSize = 10;

    /**
     * Pause between two batches. A static safety margin for the embedding
     * provider's rate limit; tune it to the account's quota.
     */
    private Duration batchPacing = Duration.ofSeconds(2);

    /**
     * Collection used by the startup run.
     */
    private String collection = "aks_logs";

    /**
     * Run an ingestion when the application starts.
     */
    private boolean runOnStartup;

    public Path getInputDirectory() {
        return inputDirectory;
    }

    public void setInputDirectory(Path inputDirectory) {
        this.inputDirectory = inputDirectory;
    }

    public String getFilePattern() {
        return filePattern;
    }

    public void setFilePattern(String filePattern) {
        this.filePattern = filePattern;
    }

    public Path getTrackerFile() {
        return trackerFile;
    }

    public void setTrackerFile(Path trackerFile) {
        this.trackerFile = trackerFile;
    }

    public int getLogGroupSize() {
        return logGroupSize;
    }

    public void setLogGroupSize(int logGroupSize) {
        this.logGroupSize = logGroupSize;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getChunkOverlap() {
        return chunkOverlap;
    }

    public void setChunkOverlap(int chunkOverlap) {
        this.chunkOverlap = chunkOverlap;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getBatchPacing() {
        return batchPacing;
    }

    public void setBatchPacing(Duration batchPacing) {
        this.batchPacing = batchPacing;
    }

    public String getCollection() {
        return collection;
    }

    public void setCollection(String collection) {
        this.collection = collection;
    }

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }
}
