package dev.codex.ingestion.coherence;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Scores how well each chunk fits with its neighbors: the mean cosine similarity of a chunk's
 * vector to the previous and next chunk vectors, where those exist.
 */
@Component
public class CoherenceScorer {

  /**
   * Computes coherence scores for a document's chunks.
   *
   * @param chunkVectors chunk vectors in chunk order
   * @return one score in [-1, 1] per chunk; all zero when there are fewer than two chunks
   */
  public double[] score(List<float[]> chunkVectors) {
    int n = chunkVectors.size();
    double[] scores = new double[n];
    if (n < 2) {
      return scores;
    }
    for (int i = 0; i < n; i++) {
      double sum = 0.0;
      int neighbors = 0;
      if (i > 0) {
        sum += cosine(chunkVectors.get(i), chunkVectors.get(i - 1));
        neighbors++;
      }
      if (i < n - 1) {
        sum += cosine(chunkVectors.get(i), chunkVectors.get(i + 1));
        neighbors++;
      }
      scores[i] = sum / neighbors;
    }
    return scores;
  }

  /** 0.0 when either vector has zero norm. */
  private static double cosine(float[] a, float[] b) {
    return CosineSimilarity.between(Embedding.from(a), Embedding.from(b));
  }
}
