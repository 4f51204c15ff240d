package dev.codex.embedding;

/** Thrown when a vector's length differs from the configured index dimension. */
public class EmbeddingDimensionMismatchException extends EmbeddingConfigurationException {

  private final int expected;
  private final int actual;
  private final String modelVersion;

  public EmbeddingDimensionMismatchException(int expected, int actual, String modelVersion) {
    super(
        "Embedding dimension mismatch for model %s: expected %d, got %d"
            .formatted(modelVersion, expected, actual));
    this.expected = expected;
    this.actual = actual;
    this.modelVersion = modelVersion;
  }

  public int getExpected() {
    return expected;
  }

  public int getActual() {
    return actual;
  }

  public String getModelVersion() {
    return modelVersion;
  }
}
