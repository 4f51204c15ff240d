package dev.codex.ingestion;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Default chunking configuration, bound from {@code codex.chunking.*}.
 *
 * <p>Callers may override any field per ingestion; see {@link ChunkingOptions#override}. Validated
 * at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "codex.chunking")
public class ChunkingProperties {

  private int targetWords = ChunkingOptions.DEFAULT_TARGET_WORDS;
  private int maxWords = ChunkingOptions.DEFAULT_MAX_WORDS;
  private int overlapSentences = ChunkingOptions.DEFAULT_OVERLAP_SENTENCES;
  private double semanticThreshold = ChunkingOptions.DEFAULT_SEMANTIC_THRESHOLD;
  private boolean useSemanticBoundaries = true;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    try {
      toOptions();
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException(
          "Invalid codex.chunking configuration: " + e.getMessage(), e);
    }
  }

  /** The configured defaults as an options record. */
  public ChunkingOptions toOptions() {
    return new ChunkingOptions(
        targetWords, maxWords, overlapSentences, semanticThreshold, useSemanticBoundaries);
  }

  public int getTargetWords() {
    return targetWords;
  }

  public void setTargetWords(int targetWords) {
    this.targetWords = targetWords;
  }

  public int getMaxWords() {
    return maxWords;
  }

  public void setMaxWords(int maxWords) {
    this.maxWords = maxWords;
  }

  public int getOverlapSentences() {
    return overlapSentences;
  }

  public void setOverlapSentences(int overlapSentences) {
    this.overlapSentences = overlapSentences;
  }

  public double getSemanticThreshold() {
    return semanticThreshold;
  }

  public void setSemanticThreshold(double semanticThreshold) {
    this.semanticThreshold = semanticThreshold;
  }

  public boolean isUseSemanticBoundaries() {
    return useSemanticBoundaries;
  }

  public void setUseSemanticBoundaries(boolean useSemanticBoundaries) {
    this.useSemanticBoundaries = useSemanticBoundaries;
  }
}
