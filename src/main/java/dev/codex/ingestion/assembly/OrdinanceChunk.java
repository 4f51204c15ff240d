package dev.codex.ingestion.assembly;

import static dev.codex.document.ChunkMetadata.ARTICLE;
import static dev.codex.document.ChunkMetadata.CHAR_COUNT;
import static dev.codex.document.ChunkMetadata.CHUNK_NUMBER;
import static dev.codex.document.ChunkMetadata.CITATIONS;
import static dev.codex.document.ChunkMetadata.COHERENCE_SCORE;
import static dev.codex.document.ChunkMetadata.CONTENT_HASH;
import static dev.codex.document.ChunkMetadata.CONTENT_TYPE;
import static dev.codex.document.ChunkMetadata.CROSS_REFERENCES;
import static dev.codex.document.ChunkMetadata.DEFINITIONS;
import static dev.codex.document.ChunkMetadata.DOCUMENT_POSITION;
import static dev.codex.document.ChunkMetadata.HAS_CITATION;
import static dev.codex.document.ChunkMetadata.HAS_DEFINITION;
import static dev.codex.document.ChunkMetadata.HAS_LIST;
import static dev.codex.document.ChunkMetadata.HAS_TABLE;
import static dev.codex.document.ChunkMetadata.JURISDICTION;
import static dev.codex.document.ChunkMetadata.KEY_PHRASES;
import static dev.codex.document.ChunkMetadata.LEGAL_ENTITIES;
import static dev.codex.document.ChunkMetadata.NEXT_PREVIEW_TEXT;
import static dev.codex.document.ChunkMetadata.PARENT_SECTION;
import static dev.codex.document.ChunkMetadata.PREV_OVERLAP_TEXT;
import static dev.codex.document.ChunkMetadata.REGION;
import static dev.codex.document.ChunkMetadata.SECTION_ID;
import static dev.codex.document.ChunkMetadata.SECTION_TITLE;
import static dev.codex.document.ChunkMetadata.SEMANTIC_DENSITY;
import static dev.codex.document.ChunkMetadata.SENTENCE_COUNT;
import static dev.codex.document.ChunkMetadata.SOURCE_DOCUMENT_ID;
import static dev.codex.document.ChunkMetadata.SUBSECTION_LEVEL;
import static dev.codex.document.ChunkMetadata.WORD_COUNT;

import dev.codex.document.ChunkMetadata;
import dev.codex.ingestion.metadata.ChunkSignals;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import java.util.Objects;
import java.util.UUID;

/**
 * A retrievable unit of an ordinance: consecutive sentences plus provenance, structure, extracted
 * signals and overlap context.
 *
 * <p>{@code prevOverlapText} and {@code nextPreviewText} are context for readers only; they are
 * never part of {@code text} and never embedded.
 *
 * @param document provenance of the source document
 * @param chunkNumber 0-based ordinal within the document
 * @param text the chunk's sentences joined with single spaces
 * @param contentHash SHA-256 hex of {@code text}
 * @param documentPosition offset of the first sentence divided by the normalized text length, in
 *     [0, 1)
 * @param section section hierarchy information
 * @param signals content classification and extracted legal signals
 * @param coherenceScore mean cosine similarity to neighboring chunks, 0.0 when not scored
 * @param prevOverlapText trailing sentences of the preceding span
 * @param nextPreviewText leading sentences of the following span
 * @param wordCount whitespace tokens in {@code text}
 * @param charCount characters in {@code text}
 * @param sentenceCount sentences in {@code text}
 */
public record OrdinanceChunk(
    DocumentRef document,
    int chunkNumber,
    String text,
    String contentHash,
    double documentPosition,
    SectionInfo section,
    ChunkSignals signals,
    double coherenceScore,
    String prevOverlapText,
    String nextPreviewText,
    int wordCount,
    int charCount,
    int sentenceCount) {

  public OrdinanceChunk {
    Objects.requireNonNull(document, "document must not be null");
    Objects.requireNonNull(text, "text must not be null");
    Objects.requireNonNull(contentHash, "contentHash must not be null");
    Objects.requireNonNull(section, "section must not be null");
    Objects.requireNonNull(signals, "signals must not be null");
    Objects.requireNonNull(prevOverlapText, "prevOverlapText must not be null");
    Objects.requireNonNull(nextPreviewText, "nextPreviewText must not be null");
    if (chunkNumber < 0) {
      throw new IllegalArgumentException("chunkNumber must not be negative");
    }
    if (documentPosition < 0.0 || documentPosition >= 1.0) {
      throw new IllegalArgumentException("documentPosition must be in [0.0, 1.0)");
    }
  }

  public OrdinanceChunk withSignals(ChunkSignals newSignals) {
    return new OrdinanceChunk(
        document, chunkNumber, text, contentHash, documentPosition, section, newSignals,
        coherenceScore, prevOverlapText, nextPreviewText, wordCount, charCount, sentenceCount);
  }

  public OrdinanceChunk withCoherenceScore(double newCoherenceScore) {
    return new OrdinanceChunk(
        document, chunkNumber, text, contentHash, documentPosition, section, signals,
        newCoherenceScore, prevOverlapText, nextPreviewText, wordCount, charCount, sentenceCount);
  }

  /** Deterministic index id; re-ingesting a document reuses the ids of its chunks. */
  public UUID id() {
    return document.chunkId(chunkNumber);
  }

  /**
   * Converts every chunk field to a langchain4j {@link Metadata} instance with the snake_case keys
   * of {@link ChunkMetadata}.
   */
  public Metadata toMetadata() {
    Metadata metadata =
        Metadata.from(SOURCE_DOCUMENT_ID, document.documentId())
            .put(JURISDICTION, document.jurisdiction())
            .put(REGION, document.region())
            .put(CHUNK_NUMBER, chunkNumber)
            .put(CONTENT_HASH, contentHash)
            .put(DOCUMENT_POSITION, documentPosition)
            .put(SECTION_ID, section.sectionId())
            .put(SECTION_TITLE, section.sectionTitle())
            .put(SUBSECTION_LEVEL, section.subsectionLevel())
            .put(CONTENT_TYPE, signals.contentType().value())
            .put(HAS_TABLE, String.valueOf(signals.hasTable()))
            .put(HAS_LIST, String.valueOf(signals.hasList()))
            .put(HAS_DEFINITION, String.valueOf(signals.hasDefinition()))
            .put(HAS_CITATION, String.valueOf(signals.hasCitation()))
            .put(DEFINITIONS, ChunkMetadata.encodeList(signals.definitions()))
            .put(CITATIONS, ChunkMetadata.encodeList(signals.citations()))
            .put(CROSS_REFERENCES, ChunkMetadata.encodeList(signals.crossReferences()))
            .put(LEGAL_ENTITIES, ChunkMetadata.encodeList(signals.legalEntities()))
            .put(KEY_PHRASES, ChunkMetadata.encodeList(signals.keyPhrases()))
            .put(SEMANTIC_DENSITY, signals.semanticDensity())
            .put(COHERENCE_SCORE, coherenceScore)
            .put(PREV_OVERLAP_TEXT, prevOverlapText)
            .put(NEXT_PREVIEW_TEXT, nextPreviewText)
            .put(WORD_COUNT, wordCount)
            .put(CHAR_COUNT, charCount)
            .put(SENTENCE_COUNT, sentenceCount);
    if (section.article() != null) {
      metadata.put(ARTICLE, section.article());
    }
    if (section.parentSection() != null) {
      metadata.put(PARENT_SECTION, section.parentSection());
    }
    return metadata;
  }

  /** Converts this chunk to a langchain4j {@link TextSegment} ready for indexing. */
  public TextSegment toTextSegment() {
    return TextSegment.from(text, toMetadata());
  }
}
