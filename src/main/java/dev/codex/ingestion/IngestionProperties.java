package dev.codex.ingestion;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Multi-document ingestion settings, bound from {@code codex.ingestion.*}.
 *
 * <ul>
 *   <li>{@code parallelism} - documents ingested concurrently by {@link
 *       IngestionService#ingestAll} (default 4, bounded [1, 64])
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "codex.ingestion")
public class IngestionProperties {

  private int parallelism = 4;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (parallelism < 1 || parallelism > 64) {
      throw new IllegalStateException(
          "codex.ingestion.parallelism must be in [1, 64], got: " + parallelism);
    }
  }

  public int getParallelism() {
    return parallelism;
  }

  public void setParallelism(int parallelism) {
    this.parallelism = parallelism;
  }
}
