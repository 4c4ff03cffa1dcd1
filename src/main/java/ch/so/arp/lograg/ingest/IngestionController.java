package ch.so.arp.lograg.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;

/**
 * REST endpoint triggering an incremental ingestion run. The call blocks until
 * the run is finished.
 */
@RestController
@RequestMapping(path = "/api/ingestions", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class IngestionController {

    private static final Logger LOGGER = LoggerFactory.getLogger(IngestionController.class);

    private final IngestionPipeline pipeline;

    public IngestionController(IngestionPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public IngestionReport ingest(@Valid @RequestBody IngestionRequest request) {
        LOGGER.info("Ingestion into '{}' requested", request.collection());
        return pipeline.ingest(request.collection());
    }
}
