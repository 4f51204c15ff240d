package dev.codex.ingestion;

import static dev.codex.ingestion.IngestionException.during;

import dev.codex.ingestion.assembly.ChunkAssembler;
import dev.codex.ingestion.assembly.DocumentRef;
import dev.codex.ingestion.assembly.OrdinanceChunk;
import dev.codex.ingestion.boundary.BoundaryDetector;
import dev.codex.ingestion.boundary.SimilarityBoundaryDetector;
import dev.codex.ingestion.boundary.StructuralBoundaryDetector;
import dev.codex.ingestion.metadata.MetadataExtractor;
import dev.codex.ingestion.segment.Sentence;
import dev.codex.ingestion.segment.SentenceSegmenter;
import dev.codex.ingestion.segment.TextNormalizer;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns raw ordinance text into chunks: normalize, segment into sentences, detect boundaries,
 * assemble chunks, extract metadata.
 *
 * <p>Failures are reported as {@link IngestionException} naming the stage that failed. Coherence
 * scoring needs the stored chunk vectors and is left to {@link IngestionService}.
 */
@Component
public class OrdinanceChunker {

  private static final Logger log = LoggerFactory.getLogger(OrdinanceChunker.class);

  private final TextNormalizer normalizer;
  private final SentenceSegmenter segmenter;
  private final SimilarityBoundaryDetector similarityDetector;
  private final StructuralBoundaryDetector structuralDetector;
  private final ChunkAssembler assembler;
  private final MetadataExtractor metadataExtractor;

  public OrdinanceChunker(
      TextNormalizer normalizer,
      SentenceSegmenter segmenter,
      SimilarityBoundaryDetector similarityDetector,
      StructuralBoundaryDetector structuralDetector,
      ChunkAssembler assembler,
      MetadataExtractor metadataExtractor) {
    this.normalizer = normalizer;
    this.segmenter = segmenter;
    this.similarityDetector = similarityDetector;
    this.structuralDetector = structuralDetector;
    this.assembler = assembler;
    this.metadataExtractor = metadataExtractor;
  }

  /**
   * Chunks one document.
   *
   * @param document provenance of the document
   * @param rawText the scraped text
   * @param options chunking configuration
   * @return intermediate and final results; no chunks when the text has no sentences
   * @throws IngestionException if a stage fails
   */
  public ChunkedDocument chunk(DocumentRef document, String rawText, ChunkingOptions options) {
    String id = document.documentId();
    String normalized = during(id, IngestionStage.NORMALIZE, () -> normalizer.normalize(rawText));
    List<Sentence> sentences =
        during(id, IngestionStage.SEGMENT, () -> segmenter.segment(normalized));
    if (sentences.isEmpty()) {
      return new ChunkedDocument(normalized, sentences, List.of(0), List.of());
    }

    BoundaryDetector detector =
        options.useSemanticBoundaries() ? similarityDetector : structuralDetector;
    List<Integer> boundaries =
        during(
            id,
            IngestionStage.DETECT_BOUNDARIES,
            () -> detector.detect(sentences, options.toBoundaryPolicy()));
    List<OrdinanceChunk> assembled =
        during(
            id,
            IngestionStage.ASSEMBLE,
            () ->
                assembler.assemble(
                    document,
                    sentences,
                    boundaries,
                    options.overlapSentences(),
                    normalized.length()));
    List<OrdinanceChunk> chunks =
        during(
            id,
            IngestionStage.EXTRACT_METADATA,
            () ->
                assembled.stream()
                    .map(chunk -> chunk.withSignals(metadataExtractor.extract(chunk.text())))
                    .toList());

    log.debug(
        "Chunked {}: {} sentences into {} chunks ({} boundaries)",
        id,
        sentences.size(),
        chunks.size(),
        options.useSemanticBoundaries() ? "semantic" : "structural");
    return new ChunkedDocument(normalized, sentences, boundaries, chunks);
  }
}
