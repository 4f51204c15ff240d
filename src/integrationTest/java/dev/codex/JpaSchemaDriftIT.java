package dev.codex;

import dev.codex.document.IndexedChunk;
import dev.codex.document.IndexedChunkRepository;
import dev.codex.ingestion.IngestionState;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Compensates for ddl-auto=none by verifying each JPA entity
 * can be persisted and read back against the Flyway schema.
 */
@Transactional
class JpaSchemaDriftIT extends BaseIntegrationTest {

    @Autowired
    private IndexedChunkRepository indexedChunkRepository;

    @Autowired
    private EmbeddingModel embeddingModel;

    @Test
    void indexedChunkReadableViaJpaAfterLangchain4jInsert() {
        String text = "No structure shall be built within 10 feet of a property line.";
        Embedding embedding = embeddingModel.embed(text).content();
        TextSegment segment = TextSegment.from(text, Metadata.from("source_document_id", "zz-drift")
                .put("jurisdiction", "Springfield")
                .put("region", "ZZ"));
        String storedId = embeddingStore.add(embedding, segment);

        UUID chunkId = UUID.fromString(storedId);
        IndexedChunk found = indexedChunkRepository.findById(chunkId).orElseThrow();

        assertThat(found.getText()).isEqualTo(text);
        assertThat(found.getMetadata()).contains("\"region\"").contains("ZZ");
        assertThat(indexedChunkRepository.countByDocumentId("zz-drift")).isEqualTo(1);
        assertThat(indexedChunkRepository.countByRegionGroupedByJurisdiction("ZZ"))
                .singleElement()
                .satisfies(row -> assertThat(row[0]).isEqualTo("Springfield"));
    }

    @Test
    void ingestionStateEntityRoundtripsAgainstFlywaySchema() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        IngestionState state = new IngestionState("zz-state", "Springfield", "ZZ");
        state.recordIngestion("abc123", "bge-small-en-v1.5-q", 7, now);

        IngestionState saved = ingestionStateRepository.saveAndFlush(state);
        IngestionState found = ingestionStateRepository.findByDocumentId("zz-state").orElseThrow();

        assertThat(found.getId()).isEqualTo(saved.getId());
        assertThat(found.getJurisdiction()).isEqualTo("Springfield");
        assertThat(found.getRegion()).isEqualTo("ZZ");
        assertThat(found.getContentHash()).isEqualTo("abc123");
        assertThat(found.getChunkCount()).isEqualTo(7);
        assertThat(found.getLastIngestedAt()).isEqualTo(now);
        assertThat(ingestionStateRepository.findMaxLastIngestedAt()).isEqualTo(now);
    }
}
