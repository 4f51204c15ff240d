package dev.codex.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.codex.embedding.BatchEncoder;
import dev.codex.embedding.EmbeddingDimensionMismatchException;
import dev.codex.embedding.EmbeddingProperties;
import dev.codex.fixture.Chunkers;
import dev.codex.fixture.FakeEmbeddingProvider;
import dev.codex.ingestion.assembly.ChunkAssembler;
import dev.codex.ingestion.assembly.DocumentRef;
import dev.codex.ingestion.assembly.OrdinanceChunk;
import dev.codex.ingestion.boundary.SimilarityBoundaryDetector;
import dev.codex.ingestion.boundary.StructuralBoundaryDetector;
import dev.codex.ingestion.metadata.ContentType;
import dev.codex.ingestion.metadata.MetadataExtractor;
import dev.codex.ingestion.segment.Sentence;
import dev.codex.ingestion.segment.SentenceSegmenter;
import dev.codex.ingestion.segment.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OrdinanceChunkerTest {

  private static final DocumentRef DOC = new DocumentRef("fl-test-101", "Testville", "FL");

  private static final String SCENARIO =
      "§101. Setbacks apply to all lots. No structure shall be built within 10 feet of a property"
          + " line. Fla. Stat. permits variance requests.";

  FakeEmbeddingProvider provider;
  OrdinanceChunker chunker;

  @BeforeEach
  void setUp() {
    provider = new FakeEmbeddingProvider();
    chunker = Chunkers.chunker(provider);
  }

  @Test
  void scenarioSegmentsIntoThreeSentences() {
    ChunkedDocument result =
        chunker.chunk(DOC, SCENARIO, new ChunkingOptions(8, 20, 1, 0.75, true));

    assertThat(result.sentences())
        .extracting(Sentence::text)
        .containsExactly(
            "§101. Setbacks apply to all lots.",
            "No structure shall be built within 10 feet of a property line.",
            "Fla. Stat. permits variance requests.");
  }

  @Test
  void scenarioRespectsMaxWordsAcrossBothStrategies() {
    for (boolean semantic : new boolean[] {true, false}) {
      ChunkedDocument result =
          chunker.chunk(DOC, SCENARIO, new ChunkingOptions(8, 20, 1, 0.75, semantic));

      assertThat(result.boundaries()).containsExactly(0, 2, 3);
      assertThat(result.chunks()).extracting(OrdinanceChunk::wordCount).containsExactly(18, 5);
      OrdinanceChunk first = result.chunks().get(0);
      OrdinanceChunk second = result.chunks().get(1);
      assertThat(first.nextPreviewText()).isEqualTo("Fla. Stat. permits variance requests.");
      assertThat(second.prevOverlapText()).startsWith("No structure");
      assertThat(first.signals().citations()).containsExactly("§101");
      assertThat(second.signals().citations()).containsExactly("Fla. Stat.");
    }
  }

  @Test
  void scenarioAsSingleChunkCarriesAllSignals() {
    ChunkedDocument result =
        chunker.chunk(DOC, SCENARIO, new ChunkingOptions(8, 30, 1, 0.75, false));

    assertThat(result.chunks()).hasSize(1);
    OrdinanceChunk chunk = result.chunks().get(0);
    assertThat(chunk.signals().hasCitation()).isTrue();
    assertThat(chunk.signals().citations()).containsExactly("Fla. Stat.", "§101");
    assertThat(chunk.signals().crossReferences()).containsExactly("101");
    assertThat(chunk.signals().contentType()).isEqualTo(ContentType.CITATION);
    assertThat(chunk.section().sectionId()).isEqualTo("101");
    assertThat(chunk.sentenceCount()).isEqualTo(3);
    assertThat(chunk.prevOverlapText()).isEmpty();
    assertThat(chunk.nextPreviewText()).isEmpty();
  }

  @Test
  void structuralStrategyNeedsNoEmbeddings() {
    chunker.chunk(DOC, SCENARIO, new ChunkingOptions(8, 20, 1, 0.75, false));

    assertThat(provider.calls()).isEmpty();
  }

  @Test
  void textWithoutSentencesYieldsNoChunks() {
    ChunkedDocument result =
        chunker.chunk(DOC, "Share Link to section x Compare versions", ChunkingOptions.defaults());

    assertThat(result.chunks()).isEmpty();
    assertThat(result.boundaries()).containsExactly(0);
  }

  @Test
  void chunkingIsDeterministic() {
    ChunkingOptions options = new ChunkingOptions(8, 20, 1, 0.75, true);

    ChunkedDocument first = chunker.chunk(DOC, SCENARIO, options);
    ChunkedDocument second = chunker.chunk(DOC, SCENARIO, options);

    assertThat(second.boundaries()).isEqualTo(first.boundaries());
    assertThat(second.chunks())
        .extracting(OrdinanceChunk::contentHash)
        .isEqualTo(first.chunks().stream().map(OrdinanceChunk::contentHash).toList());
    assertThat(second.chunks()).isEqualTo(first.chunks());
  }

  @Test
  void embeddingFailureNamesTheBoundaryStage() {
    FakeEmbeddingProvider wrongSize = new FakeEmbeddingProvider("fake-bow-v1", 8);
    EmbeddingProperties properties = wrongSize.properties(32);
    properties.setDimension(384);
    OrdinanceChunker broken =
        new OrdinanceChunker(
            new TextNormalizer(),
            new SentenceSegmenter(),
            new SimilarityBoundaryDetector(new BatchEncoder(wrongSize, properties)),
            new StructuralBoundaryDetector(),
            new ChunkAssembler(),
            new MetadataExtractor());

    assertThatThrownBy(
            () -> broken.chunk(DOC, SCENARIO, new ChunkingOptions(8, 20, 1, 0.75, true)))
        .isInstanceOf(IngestionException.class)
        .hasCauseInstanceOf(EmbeddingDimensionMismatchException.class)
        .satisfies(
            e -> {
              IngestionException ex = (IngestionException) e;
              assertThat(ex.getDocumentId()).isEqualTo("fl-test-101");
              assertThat(ex.getStage()).isEqualTo(IngestionStage.DETECT_BOUNDARIES);
            });
  }
}
