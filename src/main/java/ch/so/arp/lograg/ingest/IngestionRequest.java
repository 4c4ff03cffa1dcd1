package ch.so.arp.lograg.ingest;

import jakarta.validation.constraints.NotBlank;

/**
 * Incoming payload to start an ingestion run.
 */
public record IngestionRequest(@NotBlank String collection) {
}
