package dev.codex.ingestion;

import dev.codex.ingestion.boundary.BoundaryPolicy;
import org.jspecify.annotations.Nullable;

/**
 * Per-ingestion chunking configuration.
 *
 * @param targetWords word count after which a soft break closes a chunk
 * @param maxWords hard cap on chunk size (a single longer sentence is kept whole)
 * @param overlapSentences context sentences recorded on each side of a chunk
 * @param semanticThreshold cosine similarity below which adjacent sentences mark a topic shift
 * @param useSemanticBoundaries similarity-based boundaries when true, structural ones otherwise
 */
public record ChunkingOptions(
    int targetWords,
    int maxWords,
    int overlapSentences,
    double semanticThreshold,
    boolean useSemanticBoundaries) {

  public static final int DEFAULT_TARGET_WORDS = 400;
  public static final int DEFAULT_MAX_WORDS = 500;
  public static final int DEFAULT_OVERLAP_SENTENCES = 2;
  public static final double DEFAULT_SEMANTIC_THRESHOLD = 0.75;

  /** Compact constructor validating input. */
  public ChunkingOptions {
    if (targetWords < 1) {
      throw new IllegalArgumentException("targetWords must be at least 1, got " + targetWords);
    }
    if (maxWords < targetWords) {
      throw new IllegalArgumentException(
          "maxWords must be >= targetWords (" + targetWords + "), got " + maxWords);
    }
    if (overlapSentences < 0) {
      throw new IllegalArgumentException(
          "overlapSentences must not be negative, got " + overlapSentences);
    }
    if (semanticThreshold < 0.0 || semanticThreshold > 1.0) {
      throw new IllegalArgumentException(
          "semanticThreshold must be in [0.0, 1.0], got " + semanticThreshold);
    }
  }

  /** 400 target words, 500 max, 2 overlap sentences, 0.75 threshold, semantic boundaries. */
  public static ChunkingOptions defaults() {
    return new ChunkingOptions(
        DEFAULT_TARGET_WORDS,
        DEFAULT_MAX_WORDS,
        DEFAULT_OVERLAP_SENTENCES,
        DEFAULT_SEMANTIC_THRESHOLD,
        true);
  }

  /** Returns a copy with every non-null argument replacing the corresponding field. */
  public ChunkingOptions override(
      @Nullable Integer targetWords,
      @Nullable Integer maxWords,
      @Nullable Integer overlapSentences,
      @Nullable Double semanticThreshold,
      @Nullable Boolean useSemanticBoundaries) {
    return new ChunkingOptions(
        targetWords != null ? targetWords : this.targetWords,
        maxWords != null ? maxWords : this.maxWords,
        overlapSentences != null ? overlapSentences : this.overlapSentences,
        semanticThreshold != null ? semanticThreshold : this.semanticThreshold,
        useSemanticBoundaries != null ? useSemanticBoundaries : this.useSemanticBoundaries);
  }

  BoundaryPolicy toBoundaryPolicy() {
    return new BoundaryPolicy(targetWords, maxWords, semanticThreshold);
  }
}
