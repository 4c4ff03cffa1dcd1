package ch.so.arp.lograg.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

/**
 * Runs one ingestion when the application starts. A failing run stops the
 * startup, since the collection is unusable without it.
 */
class IngestionStartupRunner implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(IngestionStartupRunner.class);

    private final IngestionPipeline pipeline;
    private final String collection;

    IngestionStartupRunner(IngestionPipeline pipeline, String collection) {
        this.pipeline = pipeline;
        this.collection = collection;
    }

    @Override
    public void run(ApplicationArguments args) {
        LOGGER.info("Starting ingestion into collection '{}'", collection);
        IngestionReport report = pipeline.ingest(collection, () -> Thread.currentThread().isInterrupted());
        LOGGER.info("Startup ingestion finished: {}", report.summary());
    }
}
