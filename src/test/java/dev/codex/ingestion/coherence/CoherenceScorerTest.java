package dev.codex.ingestion.coherence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.Test;

class CoherenceScorerTest {

  private final CoherenceScorer scorer = new CoherenceScorer();

  @Test
  void fewerThanTwoChunksScoreZero() {
    assertThat(scorer.score(List.of())).isEmpty();
    assertThat(scorer.score(List.<float[]>of(new float[] {1f, 0f}))).containsExactly(0.0);
  }

  @Test
  void endChunksUseTheirSingleNeighbor() {
    List<float[]> vectors =
        List.of(new float[] {1f, 0f}, new float[] {1f, 0f}, new float[] {0f, 1f});

    double[] scores = scorer.score(vectors);

    assertThat(scores[0]).isCloseTo(1.0, within(1e-6));
    assertThat(scores[1]).isCloseTo(0.5, within(1e-6));
    assertThat(scores[2]).isCloseTo(0.0, within(1e-6));
  }

  @Test
  void identicalChunksAreFullyCoherent() {
    float[] v = {0.3f, 0.4f, 0.5f};

    for (double score : scorer.score(List.of(v, v, v, v))) {
      assertThat(score).isCloseTo(1.0, within(1e-6));
    }
  }

  @Test
  void zeroVectorNeighborContributesZero() {
    double[] scores = scorer.score(List.of(new float[] {0f, 0f}, new float[] {1f, 1f}));

    assertThat(scores).containsExactly(0.0, 0.0);
  }

  @Test
  void oppositeNeighborsScoreMinusOne() {
    double[] scores = scorer.score(List.of(new float[] {1f, 1f}, new float[] {-1f, -1f}));

    assertThat(scores[0]).isCloseTo(-1.0, within(1e-6));
    assertThat(scores[1]).isCloseTo(-1.0, within(1e-6));
  }
}
