package ch.so.arp.lograg.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link IngestionListener} writing one log line per file.
 */
class LoggingIngestionListener implements IngestionListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingIngestionListener.class);

    @Override
    public void onFileProcessed(FileOutcome outcome, int position, int total) {
        LOGGER.info("Progress {}/{}: '{}' {}", position, total, outcome.file(), outcome.state());
    }
}
