package dev.codex.ingestion.metadata;

import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Extracts {@link ChunkSignals} from chunk text by running a fixed, ordered list of independent
 * {@link ExtractionRule}s. Each rule produces exactly one field; a failing rule degrades that field
 * to its default and logs a warning.
 *
 * <p>Extraction depends only on the chunk text, so chunks can be processed in any order.
 */
@Component
public class MetadataExtractor {

  private final List<ExtractionRule<?>> rules;

  public MetadataExtractor() {
    this(defaultRules());
  }

  MetadataExtractor(List<ExtractionRule<?>> rules) {
    this.rules = List.copyOf(rules);
  }

  /**
   * Extracts signals from one chunk.
   *
   * @param text the chunk text
   * @return the extracted signals, never null
   */
  public ChunkSignals extract(String text) {
    ChunkSignals.Builder builder = new ChunkSignals.Builder();
    for (ExtractionRule<?> rule : rules) {
      rule.applyTo(text, builder);
    }
    return builder.build();
  }

  static List<ExtractionRule<?>> defaultRules() {
    return List.of(
        new ExtractionRule<Boolean>(
            "has_table", LegalPatterns::hasTable, false, ChunkSignals.Builder::hasTable),
        new ExtractionRule<Boolean>(
            "has_list", LegalPatterns::hasList, false, ChunkSignals.Builder::hasList),
        new ExtractionRule<List<String>>(
            "definitions",
            LegalPatterns::definitions,
            List.of(),
            ChunkSignals.Builder::definitions),
        new ExtractionRule<List<String>>(
            "citations", LegalPatterns::citations, List.of(), ChunkSignals.Builder::citations),
        new ExtractionRule<List<String>>(
            "cross_references",
            LegalPatterns::crossReferences,
            List.of(),
            ChunkSignals.Builder::crossReferences),
        new ExtractionRule<List<String>>(
            "legal_entities",
            LegalPatterns::legalEntities,
            List.of(),
            ChunkSignals.Builder::legalEntities),
        new ExtractionRule<List<String>>(
            "key_phrases", LegalPatterns::keyPhrases, List.of(), ChunkSignals.Builder::keyPhrases),
        new ExtractionRule<Double>(
            "semantic_density",
            LegalPatterns::semanticDensity,
            0.0,
            ChunkSignals.Builder::semanticDensity));
  }
}
