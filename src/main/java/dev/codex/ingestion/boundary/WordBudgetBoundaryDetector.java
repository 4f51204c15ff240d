package dev.codex.ingestion.boundary;

import dev.codex.ingestion.segment.Sentence;
import java.util.ArrayList;
import java.util.List;

/**
 * Word-budget walk shared by the boundary strategies. Subclasses only decide where soft breaks
 * are.
 *
 * <p>Walking the sentences in order with a running word count:
 *
 * <ul>
 *   <li>before sentence {@code i}, if the count is positive and adding it would exceed {@code
 *       maxWords}, a boundary goes at {@code i};
 *   <li>after sentence {@code i}, a boundary goes at {@code i + 1} when the count reached {@code
 *       maxWords}, or when it reached {@code targetWords} and there is a soft break between {@code
 *       i} and {@code i + 1}.
 * </ul>
 *
 * <p>The count resets at every boundary, so each chunk holds at most {@code maxWords} words unless
 * it is a single sentence that is longer on its own.
 */
public abstract class WordBudgetBoundaryDetector implements BoundaryDetector {

  @Override
  public List<Integer> detect(List<Sentence> sentences, BoundaryPolicy policy) {
    List<Integer> boundaries = new ArrayList<>();
    boundaries.add(0);
    int n = sentences.size();
    if (n == 0) {
      return boundaries;
    }
    boolean[] softBreaks = n > 1 ? softBreaks(sentences, policy) : new boolean[0];

    int count = 0;
    for (int i = 0; i < n; i++) {
      int words = sentences.get(i).wordCount();
      if (count > 0 && count + words > policy.maxWords()) {
        boundaries.add(i);
        count = 0;
      }
      count += words;
      if (i < n - 1) {
        if (count >= policy.maxWords()
            || (count >= policy.targetWords() && softBreaks[i])) {
          boundaries.add(i + 1);
          count = 0;
        }
      }
    }
    boundaries.add(n);
    return boundaries;
  }

  /**
   * Soft break flags between adjacent sentences.
   *
   * @param sentences at least two sentences
   * @return array of length {@code sentences.size() - 1}; element {@code i} is true when a soft
   *     break separates sentence {@code i} from sentence {@code i + 1}
   */
  protected abstract boolean[] softBreaks(List<Sentence> sentences, BoundaryPolicy policy);
}
