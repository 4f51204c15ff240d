package dev.codex.embedding;

/**
 * Thrown when a cache lookup names a model version that is neither active nor declared in {@code
 * codex.embedding.legacy-model-versions}.
 */
public class UnknownModelVersionException extends EmbeddingConfigurationException {

  private final String modelVersion;

  public UnknownModelVersionException(String modelVersion) {
    super("Unknown embedding model version: " + modelVersion);
    this.modelVersion = modelVersion;
  }

  public String getModelVersion() {
    return modelVersion;
  }
}
