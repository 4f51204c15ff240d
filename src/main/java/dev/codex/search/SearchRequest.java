package dev.codex.search;

import org.jspecify.annotations.Nullable;

/**
 * Domain request DTO for ordinance search.
 *
 * @param query the search query text (must not be null or blank)
 * @param jurisdiction optional city or county filter (exact match); blank means no filter
 * @param region required state filter (exact match)
 * @param topK the maximum number of results to return (must be >= 1)
 * @param minRelevance results scoring below this cosine relevance are dropped; 0.0 disables the
 *     threshold
 */
public record SearchRequest(
    String query, @Nullable String jurisdiction, String region, int topK, double minRelevance) {

  /** Default number of results when not specified. */
  public static final int DEFAULT_TOP_K = 5;

  /** Compact constructor validating input. */
  public SearchRequest {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    if (region == null || region.isBlank()) {
      throw new IllegalArgumentException("Region must not be blank");
    }
    if (topK < 1) {
      throw new IllegalArgumentException("topK must be at least 1");
    }
    if (minRelevance < 0.0 || minRelevance > 1.0) {
      throw new IllegalArgumentException("minRelevance must be in [0.0, 1.0]");
    }
    if (jurisdiction != null && jurisdiction.isBlank()) {
      jurisdiction = null;
    }
  }

  /** Convenience constructor defaulting topK to 5 and disabling the relevance threshold. */
  public SearchRequest(String query, @Nullable String jurisdiction, String region) {
    this(query, jurisdiction, region, DEFAULT_TOP_K, 0.0);
  }
}
