package dev.codex.ingestion.assembly;

import dev.codex.embedding.ContentHasher;
import dev.codex.ingestion.metadata.ChunkSignals;
import dev.codex.ingestion.segment.Sentence;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Groups sentences between consecutive boundaries into {@link OrdinanceChunk}s.
 *
 * <p>Each chunk also carries up to {@code overlapSentences} sentences of context on either side,
 * its fractional position in the document and section information parsed from its leading text.
 * Signals and coherence are left empty for the later pipeline stages.
 */
@Component
public class ChunkAssembler {

  /**
   * Assembles chunks.
   *
   * @param document provenance shared by all chunks
   * @param sentences the document's sentences
   * @param boundaries strictly increasing indices from 0 to {@code sentences.size()}
   * @param overlapSentences context sentences to record on each side
   * @param normalizedLength length of the normalized text the sentence offsets refer to
   * @return chunks numbered from 0 in document order
   */
  public List<OrdinanceChunk> assemble(
      DocumentRef document,
      List<Sentence> sentences,
      List<Integer> boundaries,
      int overlapSentences,
      int normalizedLength) {
    validateBoundaries(boundaries, sentences.size());
    List<OrdinanceChunk> chunks = new ArrayList<>(Math.max(0, boundaries.size() - 1));
    for (int b = 0; b + 1 < boundaries.size(); b++) {
      int from = boundaries.get(b);
      int to = boundaries.get(b + 1);
      List<Sentence> span = sentences.subList(from, to);
      String text = join(span);
      Sentence first = span.get(0);
      chunks.add(
          new OrdinanceChunk(
              document,
              b,
              text,
              ContentHasher.sha256(text),
              position(first, normalizedLength),
              SectionParser.parse(first.text(), text),
              ChunkSignals.empty(),
              0.0,
              join(sentences.subList(Math.max(0, from - overlapSentences), from)),
              join(sentences.subList(to, Math.min(sentences.size(), to + overlapSentences))),
              Sentence.countWords(text),
              text.length(),
              span.size()));
    }
    return chunks;
  }

  private static double position(Sentence first, int normalizedLength) {
    if (normalizedLength <= 0) {
      return 0.0;
    }
    return Math.min((double) first.start() / normalizedLength, Math.nextDown(1.0));
  }

  private static String join(List<Sentence> sentences) {
    return sentences.stream().map(Sentence::text).collect(Collectors.joining(" "));
  }

  private static void validateBoundaries(List<Integer> boundaries, int sentenceCount) {
    if (boundaries.isEmpty()
        || boundaries.get(0) != 0
        || boundaries.get(boundaries.size() - 1) != sentenceCount) {
      throw new IllegalArgumentException(
          "Boundaries must start at 0 and end at " + sentenceCount + ": " + boundaries);
    }
    for (int i = 1; i < boundaries.size(); i++) {
      if (boundaries.get(i) <= boundaries.get(i - 1)) {
        throw new IllegalArgumentException("Boundaries must be strictly increasing: " + boundaries);
      }
    }
  }
}
