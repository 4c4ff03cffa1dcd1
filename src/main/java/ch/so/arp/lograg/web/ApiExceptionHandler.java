package ch.so.arp.lograg.web;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import ch.so.arp.lograg.ai.UpstreamUnavailableException;
import ch.so.arp.lograg.ingest.CollectionSetupException;
import ch.so.arp.lograg.ingest.IngestionException;
import ch.so.arp.lograg.query.CollectionNotReadyException;
import ch.so.arp.lograg.store.VectorStoreException;
import jakarta.validation.ConstraintViolationException;

/**
 * Maps failures of the REST endpoints to status codes with a small JSON body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({ MethodArgumentNotValidException.class, ConstraintViolationException.class,
            IllegalArgumentException.class })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST, "invalid_request", ex);
    }

    @ExceptionHandler(CollectionNotReadyException.class)
    public ResponseEntity<Map<String, Object>> handleNotReady(CollectionNotReadyException ex) {
        return respond(HttpStatus.CONFLICT, "collection_not_ready", ex);
    }

    @ExceptionHandler({ UpstreamUnavailableException.class, CollectionSetupException.class,
            VectorStoreException.class })
    public ResponseEntity<Map<String, Object>> handleUpstream(RuntimeException ex) {
        LOGGER.error("Upstream failure: {}", ex.getMessage(), ex);
        return respond(HttpStatus.BAD_GATEWAY, "upstream_unavailable", ex);
    }

    @ExceptionHandler(IngestionException.class)
    public ResponseEntity<Map<String, Object>> handleIngestion(IngestionException ex) {
        LOGGER.error("Ingestion failed: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "ingestion_failed", ex);
    }

    private ResponseEntity<Map<String, Object>> respond(HttpStatus status, String code, Exception ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("code", code);
        body.put("message", ex.getMessage());
        return ResponseEntity.status(status).body(body);
    }
}
