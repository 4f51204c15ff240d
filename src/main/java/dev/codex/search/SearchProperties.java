package dev.codex.search;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for retrieval.
 *
 * <p>Properties are bound from {@code codex.search.*} in application.yml:
 *
 * <ul>
 *   <li>{@code default-top-k} - results returned when the caller does not say (default 5)
 *   <li>{@code max-top-k} - upper bound on requested results (default 50, bounded [1, 200])
 *   <li>{@code candidate-headroom} - extra candidates fetched from the store beyond top-k so that
 *       ties at the cut are ranked deterministically (default 20)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "codex.search")
public class SearchProperties {

  private int defaultTopK = SearchRequest.DEFAULT_TOP_K;
  private int maxTopK = 50;
  private int candidateHeadroom = 20;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (maxTopK < 1 || maxTopK > 200) {
      throw new IllegalStateException(
          "codex.search.max-top-k must be in [1, 200], got: " + maxTopK);
    }
    if (defaultTopK < 1 || defaultTopK > maxTopK) {
      throw new IllegalStateException(
          "codex.search.default-top-k must be in [1, max-top-k], got: " + defaultTopK);
    }
    if (candidateHeadroom < 0) {
      throw new IllegalStateException(
          "codex.search.candidate-headroom must not be negative, got: " + candidateHeadroom);
    }
  }

  public int getDefaultTopK() {
    return defaultTopK;
  }

  public void setDefaultTopK(int defaultTopK) {
    this.defaultTopK = defaultTopK;
  }

  public int getMaxTopK() {
    return maxTopK;
  }

  public void setMaxTopK(int maxTopK) {
    this.maxTopK = maxTopK;
  }

  public int getCandidateHeadroom() {
    return candidateHeadroom;
  }

  public void setCandidateHeadroom(int candidateHeadroom) {
    this.candidateHeadroom = candidateHeadroom;
  }
}
