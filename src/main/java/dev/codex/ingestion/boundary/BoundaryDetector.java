package dev.codex.ingestion.boundary;

import dev.codex.ingestion.segment.Sentence;
import java.util.List;

/** Decides where chunk breaks fall in a sequence of sentences. */
public interface BoundaryDetector {

  /**
   * Computes chunk boundaries.
   *
   * @param sentences the document's sentences in order
   * @param policy word budget and threshold
   * @return strictly increasing sentence indices, starting with 0 and ending with {@code
   *     sentences.size()}; just {@code [0]} for an empty document
   */
  List<Integer> detect(List<Sentence> sentences, BoundaryPolicy policy);
}
