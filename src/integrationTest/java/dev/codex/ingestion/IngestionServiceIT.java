package dev.codex.ingestion;

import dev.codex.BaseIntegrationTest;
import dev.codex.document.IndexedChunkRepository;
import dev.codex.search.RetrievalService;
import dev.codex.search.SearchRequest;
import dev.codex.search.SearchResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class IngestionServiceIT extends BaseIntegrationTest {

    private static final String SETBACKS = """
            §101. Setbacks apply to all lots. No structure shall be built within 10 feet of a \
            property line. Fla. Stat. permits variance requests.""";

    private static final String PARKING = """
            Sec. 12-4. Parking. No vehicle shall be parked on a public sidewalk.

            Vehicles parked in a fire lane may be towed at the owner's expense. \
            The fine for a first violation is fifty dollars.

            Sec. 12-5. Loading zones. Commercial loading zones may be used between 6 a.m. and \
            10 a.m. only.""";

    @Autowired
    IngestionService ingestionService;

    @Autowired
    RetrievalService retrievalService;

    @Autowired
    IndexedChunkRepository indexedChunkRepository;

    @Test
    void ingested_document_is_searchable_within_its_region() {
        int chunks = ingestionService.ingest("fl-testville-101", "Testville", "FL", SETBACKS,
                new ChunkingOptions(8, 30, 1, 0.75, false));

        assertThat(chunks).isEqualTo(1);
        List<SearchResult> results = retrievalService.search(
                new SearchRequest("how far from the property line can I build", null, "FL"));
        assertThat(results).singleElement().satisfies(r -> {
            assertThat(r.sourceDocumentId()).isEqualTo("fl-testville-101");
            assertThat(r.jurisdiction()).isEqualTo("Testville");
            assertThat(r.chunkNumber()).isZero();
            assertThat(r.relevanceScore()).isBetween(0.0, 1.0);
        });
        assertThat(retrievalService.search(new SearchRequest("setbacks", null, "GA"))).isEmpty();
    }

    @Test
    void reingestion_replaces_previous_chunks() {
        ingestionService.ingest("fl-parking", "Testville", "FL", PARKING,
                new ChunkingOptions(5, 10, 0, 0.75, false));
        long before = indexedChunkRepository.countByDocumentId("fl-parking");

        int after = ingestionService.ingest("fl-parking", "Testville", "FL", PARKING,
                new ChunkingOptions(100, 200, 0, 0.75, false));

        assertThat(before).isGreaterThan(1);
        assertThat(after).isEqualTo(1);
        assertThat(indexedChunkRepository.countByDocumentId("fl-parking")).isEqualTo(1);
        IngestionState state = ingestionStateRepository.findByDocumentId("fl-parking").orElseThrow();
        assertThat(state.getChunkCount()).isEqualTo(1);
        assertThat(state.getVersion()).isEqualTo(1);
    }

    @Test
    void chunks_carry_metadata_for_citation() {
        ingestionService.ingest("fl-parking", "Testville", "FL", PARKING,
                new ChunkingOptions(5, 10, 1, 0.75, false));

        List<SearchResult> results = retrievalService.search(
                new SearchRequest("towing from fire lanes", "Testville", "FL", 10, 0.0));

        assertThat(results).isNotEmpty();
        assertThat(results).extracting(SearchResult::chunkNumber).doesNotHaveDuplicates();
        assertThat(results).allSatisfy(r -> assertThat(r.sourceDocumentId()).isEqualTo("fl-parking"));
    }

    @Test
    void concurrent_ingestions_of_one_document_leave_one_consistent_version() throws Exception {
        ChunkingOptions options = new ChunkingOptions(5, 10, 0, 0.75, false);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        List<Future<Integer>> futures = new ArrayList<>();
        try {
            Callable<Integer> task = () -> ingestionService.ingest(
                    "fl-race", "Testville", "FL", PARKING, options);
            futures.add(pool.submit(task));
            futures.add(pool.submit(task));

            int expected = -1;
            int winners = 0;
            for (Future<Integer> future : futures) {
                try {
                    expected = future.get();
                    winners++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(ConcurrentIngestionException.class);
                }
            }

            assertThat(winners).isGreaterThanOrEqualTo(1);
            assertThat(indexedChunkRepository.countByDocumentId("fl-race")).isEqualTo(expected);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void racing_reingestions_with_different_text_never_mix_chunks() throws Exception {
        ChunkingOptions options = new ChunkingOptions(5, 10, 0, 0.75, false);
        ingestionService.ingest("qq-setbacks", "Reference", "QQ", SETBACKS, options);
        ingestionService.ingest("qq-parking", "Reference", "QQ", PARKING, options);
        List<String> setbackTexts = chunkTexts("QQ", "qq-setbacks");
        List<String> parkingTexts = chunkTexts("QQ", "qq-parking");

        ExecutorService pool = Executors.newFixedThreadPool(3);
        List<Future<Integer>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 6; i++) {
                String text = i % 2 == 0 ? SETBACKS : PARKING;
                futures.add(pool.submit(() -> ingestionService.ingest(
                        "fl-race", "Testville", "FL", text, options)));
            }
            for (Future<Integer> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(ConcurrentIngestionException.class);
                }
            }
        } finally {
            pool.shutdownNow();
        }

        List<String> indexed = chunkTexts("FL", "fl-race");
        IngestionState state = ingestionStateRepository.findByDocumentId("fl-race").orElseThrow();
        assertThat(indexed).hasSize(state.getChunkCount());
        assertThat(List.of(setbackTexts, parkingTexts)).anySatisfy(expected ->
                assertThat(indexed).containsExactlyInAnyOrderElementsOf(expected));
    }

    private List<String> chunkTexts(String region, String documentId) {
        return retrievalService.search(new SearchRequest("parking setbacks", null, region, 50, 0.0))
                .stream()
                .filter(r -> r.sourceDocumentId().equals(documentId))
                .map(SearchResult::content)
                .toList();
    }

    @Test
    void ingest_all_reports_skipped_documents() {
        IngestionReport report = ingestionService.ingestAll(List.of(
                new SourceDocument("fl-a", "Testville", "FL", SETBACKS),
                new SourceDocument("fl-b", "Otherville", "FL", PARKING),
                new SourceDocument("fl-empty", "Otherville", "FL", "  ")), null);

        assertThat(report.documents()).isEqualTo(3);
        assertThat(report.ingested()).isEqualTo(2);
        assertThat(report.skipped()).isEqualTo(1);
        assertThat(indexedChunkRepository.countDocuments()).isEqualTo(2);
    }
}
