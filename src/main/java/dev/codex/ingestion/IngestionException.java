package dev.codex.ingestion;

import dev.codex.CodexException;
import java.util.function.Supplier;

/** Thrown when ingesting a document fails at a pipeline stage. */
public class IngestionException extends CodexException {

  private final String documentId;
  private final IngestionStage stage;

  public IngestionException(String documentId, IngestionStage stage, Throwable cause) {
    super(
        "Ingestion of document '%s' failed at stage %s: %s"
            .formatted(documentId, stage, cause.getMessage()),
        cause);
    this.documentId = documentId;
    this.stage = stage;
  }

  public String getDocumentId() {
    return documentId;
  }

  public IngestionStage getStage() {
    return stage;
  }

  /**
   * Runs one stage, wrapping unexpected failures with the document id and stage.
   * Codex exceptions raised by earlier stage wrapping or concurrency checks pass through as is.
   */
  static <T> T during(String documentId, IngestionStage stage, Supplier<T> work) {
    try {
      return work.get();
    } catch (IngestionException | ConcurrentIngestionException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new IngestionException(documentId, stage, e);
    }
  }
}
