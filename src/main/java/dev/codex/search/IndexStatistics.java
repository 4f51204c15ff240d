package dev.codex.search;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Global statistics of the retrieval index.
 *
 * @param totalChunks indexed chunks
 * @param documents distinct source documents
 * @param jurisdictions distinct (region, jurisdiction) pairs
 * @param storageSizeBytes on-disk size of the chunk table including indexes
 * @param modelVersion active embedding model
 * @param dimension vector dimension
 * @param cachedEmbeddings embedding cache entries for the active model
 * @param lastIngestedAt most recent ingestion, or null if nothing was ingested
 */
public record IndexStatistics(
    long totalChunks,
    long documents,
    long jurisdictions,
    long storageSizeBytes,
    String modelVersion,
    int dimension,
    long cachedEmbeddings,
    @Nullable Instant lastIngestedAt) {}
