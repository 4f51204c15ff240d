package dev.codex.ingestion.boundary;

import dev.codex.embedding.BatchEncoder;
import dev.codex.ingestion.segment.Sentence;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Places soft breaks where the topic shifts: adjacent sentences whose embeddings have cosine
 * similarity below the policy threshold.
 *
 * <p>Sentence vectors are transient and go straight through the {@link BatchEncoder}, bypassing the
 * embedding cache.
 */
@Component
public class SimilarityBoundaryDetector extends WordBudgetBoundaryDetector {

  private static final Logger log = LoggerFactory.getLogger(SimilarityBoundaryDetector.class);

  private final BatchEncoder batchEncoder;

  public SimilarityBoundaryDetector(BatchEncoder batchEncoder) {
    this.batchEncoder = batchEncoder;
  }

  @Override
  protected boolean[] softBreaks(List<Sentence> sentences, BoundaryPolicy policy) {
    List<float[]> vectors = batchEncoder.encode(sentences.stream().map(Sentence::text).toList());
    boolean[] breaks = new boolean[sentences.size() - 1];
    int count = 0;
    for (int i = 0; i < breaks.length; i++) {
      Embedding current = Embedding.from(vectors.get(i));
      Embedding next = Embedding.from(vectors.get(i + 1));
      double similarity = CosineSimilarity.between(current, next);
      breaks[i] = similarity < policy.semanticThreshold();
      if (breaks[i]) {
        count++;
      }
    }
    log.debug(
        "{} topic shifts among {} sentences at threshold {}",
        count,
        sentences.size(),
        policy.semanticThreshold());
    return breaks;
  }
}
