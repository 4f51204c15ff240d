package dev.codex.search;

import dev.codex.BaseIntegrationTest;
import dev.codex.document.ChunkMetadata;
import dev.codex.embedding.EmbeddingCache;
import dev.codex.ingestion.ChunkingOptions;
import dev.codex.ingestion.IngestionService;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class RetrievalServiceIT extends BaseIntegrationTest {

    private static final ChunkingOptions SMALL = new ChunkingOptions(20, 40, 1, 0.75, false);

    @Autowired
    IngestionService ingestionService;

    @Autowired
    RetrievalService retrievalService;

    @Autowired
    EmbeddingCache embeddingCache;

    @BeforeEach
    void indexJurisdictions() {
        ingestionService.ingest("zz-springfield-dogs", "Springfield", "ZZ",
                "Dogs must be kept on a leash in all public parks. Owners must remove pet waste.",
                SMALL);
        ingestionService.ingest("zz-shelbyville-dogs", "Shelbyville", "ZZ",
                "Dogs are permitted off leash on the north beach before 8 a.m.", SMALL);
        ingestionService.ingest("zz-springfield-noise", "Springfield", "ZZ",
                "Amplified music is prohibited between 10 p.m. and 7 a.m. on weekdays.", SMALL);
        ingestionService.ingest("yy-springfield-dogs", "Springfield", "YY",
                "Dogs must be kept on a leash in all public parks.", SMALL);
    }

    @Test
    void region_filter_never_leaks_other_states() {
        List<SearchResult> results = retrievalService.search(
                new SearchRequest("leash rules for dogs", null, "ZZ", 10, 0.0));

        assertThat(results).hasSize(3);
        assertThat(results).extracting(SearchResult::sourceDocumentId)
                .doesNotContain("yy-springfield-dogs");
        assertThat(results.get(0).sourceDocumentId()).isNotEqualTo("zz-springfield-noise");
    }

    @Test
    void jurisdiction_filter_narrows_results() {
        List<SearchResult> results = retrievalService.search(
                new SearchRequest("leash rules for dogs", "Shelbyville", "ZZ", 10, 0.0));

        assertThat(results).extracting(SearchResult::jurisdiction).containsOnly("Shelbyville");
    }

    @Test
    void small_jurisdiction_is_found_behind_many_closer_chunks() {
        String query = "sidewalk cafe permits";
        float[] q = embeddingCache.embed(query, true);
        Random random = new Random(7);
        List<Embedding> embeddings = new ArrayList<>();
        List<TextSegment> segments = new ArrayList<>();
        // 200 near neighbours of the query in a large jurisdiction
        for (int i = 0; i < 200; i++) {
            float[] v = q.clone();
            for (int d = 0; d < v.length; d++) {
                v[d] += (float) (random.nextGaussian() * 0.01);
            }
            embeddings.add(Embedding.from(v));
            segments.add(chunk("Bigtown", "fl-bigtown-" + i, "Bigtown rule " + i));
        }
        // 3 far chunks in a small one: components reversed, so roughly orthogonal to the query
        for (int i = 0; i < 3; i++) {
            float[] v = new float[q.length];
            for (int d = 0; d < v.length; d++) {
                v[d] = q[(v.length - 1 - d + i) % v.length];
            }
            embeddings.add(Embedding.from(v));
            segments.add(chunk("Tinytown", "fl-tinytown-" + i, "Tinytown rule " + i));
        }
        embeddingStore.addAll(embeddings, segments);

        List<SearchResult> results = retrievalService.search(
                new SearchRequest(query, "Tinytown", "FL", 3, 0.0));

        assertThat(results).hasSize(3);
        assertThat(results).extracting(SearchResult::jurisdiction).containsOnly("Tinytown");
    }

    private static TextSegment chunk(String jurisdiction, String documentId, String text) {
        return TextSegment.from(text, Metadata.from(Map.of(
                ChunkMetadata.REGION, "FL",
                ChunkMetadata.JURISDICTION, jurisdiction,
                ChunkMetadata.SOURCE_DOCUMENT_ID, documentId,
                ChunkMetadata.CHUNK_NUMBER, 0)));
    }

    @Test
    void higher_min_relevance_returns_a_subset() {
        List<SearchResult> all = retrievalService.search(
                new SearchRequest("leash rules for dogs", null, "ZZ", 10, 0.0));
        List<SearchResult> strict = retrievalService.search(
                new SearchRequest("leash rules for dogs", null, "ZZ", 10, 0.7));

        assertThat(all).containsAll(strict);
        assertThat(strict).allSatisfy(r -> assertThat(r.relevanceScore()).isGreaterThanOrEqualTo(0.7));
    }

    @Test
    void jurisdictions_are_listed_with_counts() {
        assertThat(retrievalService.listJurisdictions("ZZ"))
                .containsExactly(
                        new JurisdictionCount("Springfield", 2),
                        new JurisdictionCount("Shelbyville", 1));
        assertThat(retrievalService.listJurisdictions("QQ")).isEmpty();
    }

    @Test
    void statistics_reflect_the_index() {
        IndexStatistics stats = retrievalService.indexStatistics();

        assertThat(stats.totalChunks()).isEqualTo(4);
        assertThat(stats.documents()).isEqualTo(4);
        assertThat(stats.jurisdictions()).isEqualTo(3);
        assertThat(stats.dimension()).isEqualTo(384);
        assertThat(stats.storageSizeBytes()).isPositive();
        assertThat(stats.lastIngestedAt()).isNotNull();
    }
}
