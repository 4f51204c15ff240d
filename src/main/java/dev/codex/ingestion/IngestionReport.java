package dev.codex.ingestion;

/**
 * Outcome of a multi-document ingestion.
 *
 * @param documents documents submitted
 * @param ingested documents that produced chunks
 * @param skipped documents skipped as empty or invalid input
 * @param chunksWritten chunks written across all ingested documents
 */
public record IngestionReport(int documents, int ingested, int skipped, int chunksWritten) {}
