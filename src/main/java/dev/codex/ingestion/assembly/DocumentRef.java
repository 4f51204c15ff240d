package dev.codex.ingestion.assembly;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Provenance of an ordinance document.
 *
 * @param documentId stable identifier of the source document
 * @param jurisdiction the city or county the ordinance belongs to
 * @param region the state the jurisdiction is in
 */
public record DocumentRef(String documentId, String jurisdiction, String region) {

  public DocumentRef {
    requireNotBlank(documentId, "documentId");
    requireNotBlank(jurisdiction, "jurisdiction");
    requireNotBlank(region, "region");
  }

  /**
   * Deterministic index id of a chunk of this document, stable across re-ingestion.
   *
   * @param chunkNumber the 0-based chunk ordinal
   */
  public UUID chunkId(int chunkNumber) {
    String key = documentId + "#" + chunkNumber;
    return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8));
  }

  private static void requireNotBlank(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
  }
}
