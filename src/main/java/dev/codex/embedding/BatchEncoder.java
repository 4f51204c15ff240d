package dev.codex.embedding;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Encodes texts through the {@link EmbeddingProvider} in fixed-size batches, validating every
 * returned vector against the configured index dimension.
 *
 * <p>No caching happens here: sentence vectors used for boundary detection are transient, and the
 * {@link EmbeddingCache} calls this encoder only for its misses.
 */
@Component
public class BatchEncoder {

  private static final Logger log = LoggerFactory.getLogger(BatchEncoder.class);

  private final EmbeddingProvider provider;
  private final EmbeddingProperties properties;

  public BatchEncoder(EmbeddingProvider provider, EmbeddingProperties properties) {
    this.provider = provider;
    this.properties = properties;
  }

  /**
   * Embeds all texts, one provider call per batch of {@code codex.embedding.batch-size}.
   *
   * @param texts texts to embed
   * @return one vector per text, in input order; empty for empty input
   * @throws EmbeddingDimensionMismatchException if any vector has the wrong length
   */
  public List<float[]> encode(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    int batchSize = properties.getBatchSize();
    List<float[]> vectors = new ArrayList<>(texts.size());
    for (int i = 0; i < texts.size(); i += batchSize) {
      List<String> batch = texts.subList(i, Math.min(i + batchSize, texts.size()));
      List<float[]> batchVectors = provider.embedAll(batch);
      if (batchVectors.size() != batch.size()) {
        throw new IllegalStateException(
            "Embedding provider returned %d vectors for %d texts"
                .formatted(batchVectors.size(), batch.size()));
      }
      batchVectors.forEach(this::checkDimension);
      vectors.addAll(batchVectors);
      log.debug(
          "Encoded batch [{}, {}) of {} texts with {}",
          i,
          i + batch.size(),
          texts.size(),
          provider.modelVersion());
    }
    return vectors;
  }

  /**
   * Fails fast when a vector does not match the configured dimension.
   *
   * @throws EmbeddingDimensionMismatchException naming expected and actual dimension
   */
  void checkDimension(float[] vector) {
    int expected = properties.getDimension();
    if (vector.length != expected) {
      throw new EmbeddingDimensionMismatchException(
          expected, vector.length, provider.modelVersion());
    }
  }
}
