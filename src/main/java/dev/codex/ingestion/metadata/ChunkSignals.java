package dev.codex.ingestion.metadata;

import java.util.List;
import java.util.Objects;

/**
 * Classification and extracted legal signals for one chunk.
 *
 * <p>The boolean flags and the content type are derived from the extracted fields by {@link
 * Builder#build()}, so they always agree with them.
 *
 * @param contentType dominant content kind
 * @param hasTable whether the chunk contains a Markdown table
 * @param hasList whether the chunk contains parenthesized enumerators
 * @param hasDefinition whether any defined term was found
 * @param hasCitation whether any legal citation was found
 * @param definitions defined terms, sorted
 * @param citations legal citations, sorted
 * @param crossReferences referenced section numbers, sorted
 * @param legalEntities named jurisdictions and bodies, sorted
 * @param keyPhrases capitalized phrases in order of first appearance, at most ten
 * @param semanticDensity information density heuristic in [0, 1]
 */
public record ChunkSignals(
    ContentType contentType,
    boolean hasTable,
    boolean hasList,
    boolean hasDefinition,
    boolean hasCitation,
    List<String> definitions,
    List<String> citations,
    List<String> crossReferences,
    List<String> legalEntities,
    List<String> keyPhrases,
    double semanticDensity) {

  public ChunkSignals {
    Objects.requireNonNull(contentType, "contentType must not be null");
    definitions = List.copyOf(definitions);
    citations = List.copyOf(citations);
    crossReferences = List.copyOf(crossReferences);
    legalEntities = List.copyOf(legalEntities);
    keyPhrases = List.copyOf(keyPhrases);
    if (semanticDensity < 0.0 || semanticDensity > 1.0) {
      throw new IllegalArgumentException("semanticDensity must be in [0.0, 1.0]");
    }
  }

  /** Signals of a chunk nothing could be extracted from. */
  public static ChunkSignals empty() {
    return new Builder().build();
  }

  /** Mutable accumulator filled field by field by extraction rules. */
  public static final class Builder {

    private boolean hasTable;
    private boolean hasList;
    private List<String> definitions = List.of();
    private List<String> citations = List.of();
    private List<String> crossReferences = List.of();
    private List<String> legalEntities = List.of();
    private List<String> keyPhrases = List.of();
    private double semanticDensity;

    public Builder hasTable(boolean hasTable) {
      this.hasTable = hasTable;
      return this;
    }

    public Builder hasList(boolean hasList) {
      this.hasList = hasList;
      return this;
    }

    public Builder definitions(List<String> definitions) {
      this.definitions = definitions;
      return this;
    }

    public Builder citations(List<String> citations) {
      this.citations = citations;
      return this;
    }

    public Builder crossReferences(List<String> crossReferences) {
      this.crossReferences = crossReferences;
      return this;
    }

    public Builder legalEntities(List<String> legalEntities) {
      this.legalEntities = legalEntities;
      return this;
    }

    public Builder keyPhrases(List<String> keyPhrases) {
      this.keyPhrases = keyPhrases;
      return this;
    }

    public Builder semanticDensity(double semanticDensity) {
      this.semanticDensity = semanticDensity;
      return this;
    }

    public ChunkSignals build() {
      boolean hasDefinition = !definitions.isEmpty();
      boolean hasCitation = !citations.isEmpty();
      return new ChunkSignals(
          ContentType.classify(hasDefinition, hasCitation, hasTable, hasList),
          hasTable,
          hasList,
          hasDefinition,
          hasCitation,
          definitions,
          citations,
          crossReferences,
          legalEntities,
          keyPhrases,
          semanticDensity);
    }
  }
}
