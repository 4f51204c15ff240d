package dev.codex.api;

/** Response body of {@code POST /api/documents}. */
public record IngestDocumentResponse(String documentId, int chunksWritten) {}
