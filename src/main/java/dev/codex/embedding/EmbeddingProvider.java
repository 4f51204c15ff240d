package dev.codex.embedding;

import java.util.List;

/**
 * A sentence-embedding model as seen by the ingestion and retrieval pipelines.
 *
 * <p>Implementations are constructed once per process and injected wherever vectors are needed.
 * The model version string scopes the embedding cache: vectors produced under different versions
 * are never mixed.
 */
public interface EmbeddingProvider {

  /** Identifier of the underlying model, e.g. {@code bge-small-en-v1.5-q}. */
  String modelVersion();

  /** Number of components in every vector this provider returns. */
  int dimension();

  /**
   * Embeds the given texts in one call.
   *
   * @param texts texts to embed, never empty
   * @return one vector per input text, in input order
   */
  List<float[]> embedAll(List<String> texts);
}
