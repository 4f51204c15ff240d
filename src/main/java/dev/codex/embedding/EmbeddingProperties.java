package dev.codex.embedding;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the embedding model and cache.
 *
 * <p>Properties are bound from {@code codex.embedding.*}:
 *
 * <ul>
 *   <li>{@code model-version} - active model identifier scoping cache entries (default {@code
 *       bge-small-en-v1.5-q})
 *   <li>{@code dimension} - expected vector length, must match the index column (default 384)
 *   <li>{@code batch-size} - texts per provider call (default 32, bounded [1, 1024])
 *   <li>{@code legacy-model-versions} - earlier model versions whose cache entries may still be
 *       looked up
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "codex.embedding")
public class EmbeddingProperties {

  private String modelVersion = "bge-small-en-v1.5-q";
  private int dimension = 384;
  private int batchSize = 32;
  private List<String> legacyModelVersions = new ArrayList<>();

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (modelVersion == null || modelVersion.isBlank()) {
      throw new IllegalStateException("codex.embedding.model-version must not be blank");
    }
    if (dimension < 1) {
      throw new IllegalStateException(
          "codex.embedding.dimension must be positive, got: " + dimension);
    }
    if (batchSize < 1 || batchSize > 1024) {
      throw new IllegalStateException(
          "codex.embedding.batch-size must be in [1, 1024], got: " + batchSize);
    }
    if (legacyModelVersions.contains(modelVersion)) {
      throw new IllegalStateException(
          "codex.embedding.legacy-model-versions must not contain the active model version "
              + modelVersion);
    }
  }

  /** Whether cache entries recorded under the given model version may be read. */
  public boolean isKnownModelVersion(String version) {
    return modelVersion.equals(version) || legacyModelVersions.contains(version);
  }

  public String getModelVersion() {
    return modelVersion;
  }

  public void setModelVersion(String modelVersion) {
    this.modelVersion = modelVersion;
  }

  public int getDimension() {
    return dimension;
  }

  public void setDimension(int dimension) {
    this.dimension = dimension;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public List<String> getLegacyModelVersions() {
    return legacyModelVersions;
  }

  public void setLegacyModelVersions(List<String> legacyModelVersions) {
    this.legacyModelVersions = legacyModelVersions;
  }
}
