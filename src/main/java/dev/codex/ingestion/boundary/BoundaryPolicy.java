package dev.codex.ingestion.boundary;

/**
 * Word budget and similarity threshold steering a {@link BoundaryDetector}.
 *
 * @param targetWords word count after which a soft break closes the chunk
 * @param maxWords hard cap on chunk size; only a single oversized sentence may exceed it
 * @param semanticThreshold cosine similarity below which adjacent sentences are a soft break
 */
public record BoundaryPolicy(int targetWords, int maxWords, double semanticThreshold) {

  public BoundaryPolicy {
    if (targetWords < 1) {
      throw new IllegalArgumentException("targetWords must be at least 1");
    }
    if (maxWords < targetWords) {
      throw new IllegalArgumentException("maxWords must be >= targetWords");
    }
    if (semanticThreshold < 0.0 || semanticThreshold > 1.0) {
      throw new IllegalArgumentException("semanticThreshold must be in [0.0, 1.0]");
    }
  }
}
