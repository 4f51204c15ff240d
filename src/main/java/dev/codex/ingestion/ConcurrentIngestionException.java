package dev.codex.ingestion;

import dev.codex.CodexException;

/**
 * Thrown to the loser when two ingestions of the same document race. The winner's chunks stay in
 * the index; the loser leaves it untouched.
 */
public class ConcurrentIngestionException extends CodexException {

  private final String documentId;

  public ConcurrentIngestionException(String documentId, Throwable cause) {
    super("Document '%s' was ingested concurrently by another writer".formatted(documentId), cause);
    this.documentId = documentId;
  }

  public String getDocumentId() {
    return documentId;
  }
}
