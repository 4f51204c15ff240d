package dev.codex.ingestion.assembly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.codex.document.ChunkMetadata;
import dev.codex.embedding.ContentHasher;
import dev.codex.ingestion.segment.Sentence;
import dev.langchain4j.data.document.Metadata;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChunkAssemblerTest {

  private static final DocumentRef DOC = new DocumentRef("springfield-zoning", "Springfield", "ZZ");

  private final ChunkAssembler assembler = new ChunkAssembler();

  private final List<Sentence> sentences =
      List.of(
          new Sentence("§101. Setbacks apply.", 0, true),
          new Sentence("Walls are measured.", 22, false),
          new Sentence("Fences are limited.", 42, false),
          new Sentence("Hedges are exempt.", 62, true));

  @Test
  void groupsSentencesBetweenBoundaries() {
    List<OrdinanceChunk> chunks = assembler.assemble(DOC, sentences, List.of(0, 2, 4), 1, 80);

    assertThat(chunks).hasSize(2);
    assertThat(chunks.get(0).text()).isEqualTo("§101. Setbacks apply. Walls are measured.");
    assertThat(chunks.get(1).text()).isEqualTo("Fences are limited. Hedges are exempt.");
    assertThat(chunks).extracting(OrdinanceChunk::chunkNumber).containsExactly(0, 1);
  }

  @Test
  void recordsOverlapContextOutsideTheChunkText() {
    List<OrdinanceChunk> chunks = assembler.assemble(DOC, sentences, List.of(0, 2, 4), 1, 80);

    assertThat(chunks.get(0).prevOverlapText()).isEmpty();
    assertThat(chunks.get(0).nextPreviewText()).isEqualTo("Fences are limited.");
    assertThat(chunks.get(1).prevOverlapText()).isEqualTo("Walls are measured.");
    assertThat(chunks.get(1).nextPreviewText()).isEmpty();
    assertThat(chunks.get(1).text()).doesNotContain("Walls");
  }

  @Test
  void zeroOverlapLeavesContextEmpty() {
    List<OrdinanceChunk> chunks = assembler.assemble(DOC, sentences, List.of(0, 2, 4), 0, 80);

    assertThat(chunks)
        .allSatisfy(
            c -> {
              assertThat(c.prevOverlapText()).isEmpty();
              assertThat(c.nextPreviewText()).isEmpty();
            });
  }

  @Test
  void fillsHashCountsPositionAndSection() {
    OrdinanceChunk first = assembler.assemble(DOC, sentences, List.of(0, 2, 4), 1, 80).get(0);
    OrdinanceChunk second = assembler.assemble(DOC, sentences, List.of(0, 2, 4), 1, 80).get(1);

    assertThat(first.contentHash()).isEqualTo(ContentHasher.sha256(first.text()));
    assertThat(first.wordCount()).isEqualTo(6);
    assertThat(first.charCount()).isEqualTo(first.text().length());
    assertThat(first.sentenceCount()).isEqualTo(2);
    assertThat(first.documentPosition()).isZero();
    assertThat(second.documentPosition()).isEqualTo(42.0 / 80);
    assertThat(first.section().sectionId()).isEqualTo("101");
    assertThat(second.section().sectionId()).isEqualTo(SectionInfo.UNKNOWN_ID);
  }

  @Test
  void rejectsMalformedBoundaries() {
    assertThatThrownBy(() -> assembler.assemble(DOC, sentences, List.of(1, 4), 0, 80))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> assembler.assemble(DOC, sentences, List.of(0, 2, 2, 4), 0, 80))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> assembler.assemble(DOC, sentences, List.of(0, 3), 0, 80))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void chunkIdsAreDeterministicPerDocumentAndNumber() {
    DocumentRef same = new DocumentRef("springfield-zoning", "Springfield", "ZZ");
    DocumentRef other = new DocumentRef("shelbyville-zoning", "Shelbyville", "ZZ");

    assertThat(DOC.chunkId(0)).isEqualTo(same.chunkId(0));
    assertThat(DOC.chunkId(0)).isNotEqualTo(DOC.chunkId(1));
    assertThat(DOC.chunkId(0)).isNotEqualTo(other.chunkId(0));
  }

  @Test
  void blankProvenanceIsRejected() {
    assertThatThrownBy(() -> new DocumentRef("doc", " ", "ZZ"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("jurisdiction");
  }

  @Test
  void metadataCarriesProvenanceAndSignals() {
    OrdinanceChunk chunk = assembler.assemble(DOC, sentences, List.of(0, 2, 4), 1, 80).get(0);

    Metadata metadata = chunk.toMetadata();

    assertThat(metadata.getString(ChunkMetadata.SOURCE_DOCUMENT_ID))
        .isEqualTo("springfield-zoning");
    assertThat(metadata.getString(ChunkMetadata.JURISDICTION)).isEqualTo("Springfield");
    assertThat(metadata.getString(ChunkMetadata.REGION)).isEqualTo("ZZ");
    assertThat(metadata.getInteger(ChunkMetadata.CHUNK_NUMBER)).isZero();
    assertThat(metadata.getString(ChunkMetadata.SECTION_ID)).isEqualTo("101");
    assertThat(metadata.getString(ChunkMetadata.HAS_CITATION)).isEqualTo("false");
    assertThat(metadata.getString(ChunkMetadata.CITATIONS)).isEqualTo("[]");
    assertThat(metadata.containsKey(ChunkMetadata.PARENT_SECTION)).isFalse();
    assertThat(chunk.toTextSegment().text()).isEqualTo(chunk.text());
  }
}
