package dev.codex.ingestion;

import dev.codex.ingestion.assembly.OrdinanceChunk;
import dev.codex.ingestion.segment.Sentence;
import java.util.List;

/**
 * Intermediate results of chunking one document.
 *
 * @param normalizedText the normalized document text
 * @param sentences segmented sentences
 * @param boundaries chunk boundaries over {@code sentences}
 * @param chunks assembled chunks with extracted signals, not yet scored for coherence
 */
public record ChunkedDocument(
    String normalizedText,
    List<Sentence> sentences,
    List<Integer> boundaries,
    List<OrdinanceChunk> chunks) {

  public ChunkedDocument {
    sentences = List.copyOf(sentences);
    boundaries = List.copyOf(boundaries);
    chunks = List.copyOf(chunks);
  }
}
