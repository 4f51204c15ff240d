package dev.codex.ingestion;

import dev.codex.document.ChunkMetadata;
import dev.codex.embedding.ContentHasher;
import dev.codex.embedding.EmbeddingCache;
import dev.codex.embedding.EmbeddingDimensionMismatchException;
import dev.codex.fixture.Chunkers;
import dev.codex.fixture.FakeEmbeddingProvider;
import dev.codex.fixture.InProcessDocumentLock;
import dev.codex.ingestion.assembly.DocumentRef;
import dev.codex.ingestion.coherence.CoherenceScorer;
import dev.codex.ingestion.segment.TextNormalizer;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.Filter;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private static final String SCENARIO =
            "§101. Setbacks apply to all lots. No structure shall be built within 10 feet of a property"
                    + " line. Fla. Stat. permits variance requests.";

    private static final ChunkingOptions TWO_CHUNKS = new ChunkingOptions(8, 20, 1, 0.75, false);

    @Mock
    EmbeddingCache embeddingCache;

    @Mock
    EmbeddingStore<TextSegment> embeddingStore;

    @Mock
    IngestionStateRepository stateRepository;

    @Captor
    ArgumentCaptor<List<String>> idsCaptor;

    @Captor
    ArgumentCaptor<List<Embedding>> embeddingsCaptor;

    @Captor
    ArgumentCaptor<List<TextSegment>> segmentsCaptor;

    @Captor
    ArgumentCaptor<IngestionState> stateCaptor;

    FakeEmbeddingProvider provider;
    InProcessDocumentLock documentLock;
    IngestionService ingestionService;

    @BeforeEach
    void setUp() {
        provider = new FakeEmbeddingProvider();
        documentLock = new InProcessDocumentLock();
        ingestionService = serviceWith(embeddingStore);
    }

    private IngestionService serviceWith(EmbeddingStore<TextSegment> store) {
        return new IngestionService(
                Chunkers.chunker(provider),
                embeddingCache,
                provider,
                new CoherenceScorer(),
                store,
                stateRepository,
                documentLock,
                new ChunkingProperties(),
                Runnable::run,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void embedWithFakeProvider() {
        when(embeddingCache.embedAll(anyList(), eq(false))).thenAnswer(invocation -> {
            List<String> texts = invocation.getArgument(0);
            return texts.stream().map(provider::vector).toList();
        });
    }

    // --- Happy path ---

    @Test
    void ingestReplacesChunksAfterClaimingTheDocument() {
        when(stateRepository.findByDocumentId("fl-test-101")).thenReturn(Optional.empty());
        embedWithFakeProvider();

        int written = ingestionService.ingest(
                "fl-test-101", "Testville", "FL", SCENARIO, TWO_CHUNKS);

        assertThat(written).isEqualTo(2);
        InOrder order = inOrder(stateRepository, embeddingStore);
        order.verify(stateRepository).saveAndFlush(stateCaptor.capture());
        order.verify(embeddingStore).removeAll(any(Filter.class));
        order.verify(embeddingStore).addAll(
                idsCaptor.capture(), embeddingsCaptor.capture(), segmentsCaptor.capture());

        DocumentRef ref = new DocumentRef("fl-test-101", "Testville", "FL");
        assertThat(idsCaptor.getValue())
                .containsExactly(ref.chunkId(0).toString(), ref.chunkId(1).toString());
        assertThat(embeddingsCaptor.getValue()).hasSize(2);
        assertThat(segmentsCaptor.getValue())
                .allSatisfy(segment -> {
                    assertThat(segment.metadata().getString(ChunkMetadata.MODEL_VERSION))
                            .isEqualTo(FakeEmbeddingProvider.MODEL_VERSION);
                    assertThat(segment.metadata().getString(ChunkMetadata.REGION)).isEqualTo("FL");
                    assertThat(segment.metadata().getString(ChunkMetadata.JURISDICTION))
                            .isEqualTo("Testville");
                });
    }

    @Test
    void ingestRecordsStateOfTheWinningIngestion() {
        when(stateRepository.findByDocumentId("fl-test-101")).thenReturn(Optional.empty());
        embedWithFakeProvider();

        ingestionService.ingest("fl-test-101", "Testville", "FL", SCENARIO, TWO_CHUNKS);

        verify(stateRepository).saveAndFlush(stateCaptor.capture());
        IngestionState state = stateCaptor.getValue();
        assertThat(state.getDocumentId()).isEqualTo("fl-test-101");
        assertThat(state.getChunkCount()).isEqualTo(2);
        assertThat(state.getModelVersion()).isEqualTo(FakeEmbeddingProvider.MODEL_VERSION);
        assertThat(state.getLastIngestedAt()).isEqualTo(NOW);
        assertThat(state.getContentHash())
                .isEqualTo(ContentHasher.sha256(new TextNormalizer().normalize(SCENARIO)));
    }

    @Test
    void ingestStoresCoherenceScoresFromChunkVectors() {
        when(stateRepository.findByDocumentId(anyString())).thenReturn(Optional.empty());
        embedWithFakeProvider();

        ingestionService.ingest("fl-test-101", "Testville", "FL", SCENARIO, TWO_CHUNKS);

        verify(embeddingStore).addAll(anyList(), anyList(), segmentsCaptor.capture());
        List<TextSegment> segments = segmentsCaptor.getValue();
        Double first = segments.get(0).metadata().getDouble(ChunkMetadata.COHERENCE_SCORE);
        Double second = segments.get(1).metadata().getDouble(ChunkMetadata.COHERENCE_SCORE);
        // Two chunks are each other's only neighbour
        assertThat(first).isBetween(0.0, 1.0).isCloseTo(second, within(1e-9));
    }

    @Test
    void reingestionUpdatesExistingStateRow() {
        IngestionState existing = new IngestionState("fl-test-101", "Oldville", "FL");
        when(stateRepository.findByDocumentId("fl-test-101")).thenReturn(Optional.of(existing));
        embedWithFakeProvider();

        ingestionService.ingest("fl-test-101", "Testville", "FL", SCENARIO, TWO_CHUNKS);

        verify(stateRepository).saveAndFlush(existing);
        assertThat(existing.getJurisdiction()).isEqualTo("Testville");
    }

    // --- Skips ---

    @Test
    void blankTextWritesNothing() {
        int written = ingestionService.ingest("fl-empty", "Testville", "FL", "   \n ", null);

        assertThat(written).isZero();
        verifyNoInteractions(embeddingCache, embeddingStore, stateRepository);
    }

    @Test
    void boilerplateOnlyTextWritesNothing() {
        when(stateRepository.findByDocumentId("fl-nav")).thenReturn(Optional.empty());

        int written = ingestionService.ingest(
                "fl-nav", "Testville", "FL", "Share Link to section x Compare versions", null);

        assertThat(written).isZero();
        verifyNoInteractions(embeddingCache, embeddingStore);
        verify(stateRepository, never()).saveAndFlush(any());
    }

    @Test
    void blankIdentifierIsRejected() {
        assertThatThrownBy(() -> ingestionService.ingest(" ", "Testville", "FL", SCENARIO, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("documentId");
    }

    // --- Failures ---

    @Test
    void lostCompareAndSwapLeavesIndexUntouched() {
        when(stateRepository.findByDocumentId("fl-test-101")).thenReturn(Optional.empty());
        embedWithFakeProvider();
        when(stateRepository.saveAndFlush(any()))
                .thenThrow(new OptimisticLockingFailureException("stale version"));

        assertThatThrownBy(() ->
                ingestionService.ingest("fl-test-101", "Testville", "FL", SCENARIO, TWO_CHUNKS))
                .isInstanceOf(ConcurrentIngestionException.class)
                .hasCauseInstanceOf(OptimisticLockingFailureException.class);
        verifyNoInteractions(embeddingStore);
    }

    @Test
    void embeddingFailureIsReportedWithStage() {
        when(stateRepository.findByDocumentId("fl-test-101")).thenReturn(Optional.empty());
        when(embeddingCache.embedAll(anyList(), eq(false)))
                .thenThrow(new IllegalStateException("model unavailable"));

        assertThatThrownBy(() ->
                ingestionService.ingest("fl-test-101", "Testville", "FL", SCENARIO, TWO_CHUNKS))
                .isInstanceOfSatisfying(IngestionException.class, e -> {
                    assertThat(e.getStage()).isEqualTo(IngestionStage.EMBED);
                    assertThat(e.getDocumentId()).isEqualTo("fl-test-101");
                    assertThat(e.getMessage()).contains("model unavailable");
                });
        verify(stateRepository, never()).saveAndFlush(any());
        verifyNoInteractions(embeddingStore);
    }

    @Test
    void storeFailureIsReportedAtPersistStage() {
        when(stateRepository.findByDocumentId("fl-test-101")).thenReturn(Optional.empty());
        embedWithFakeProvider();
        doThrow(new RuntimeException("connection reset"))
                .when(embeddingStore).addAll(anyList(), anyList(), anyList());

        assertThatThrownBy(() ->
                ingestionService.ingest("fl-test-101", "Testville", "FL", SCENARIO, TWO_CHUNKS))
                .isInstanceOfSatisfying(IngestionException.class,
                        e -> assertThat(e.getStage()).isEqualTo(IngestionStage.PERSIST));
    }

    // --- Concurrent re-ingestion ---

    @Test
    void reingestionWaitsForInFlightIndexWritesOfTheSameDocument() throws Exception {
        InMemoryEmbeddingStore<TextSegment> store = spy(new InMemoryEmbeddingStore<>());
        IngestionService service = serviceWith(store);
        when(stateRepository.findByDocumentId("fl-race")).thenReturn(Optional.empty());
        embedWithFakeProvider();
        String alpha = "Alpha rule one applies to every fence. Alpha rule two applies to every shed.";
        String beta = "Beta rule one governs signs in yards. Beta rule two governs lights at night."
                + " Beta rule three governs noise after ten.";
        ExecutorService rivalThread = Executors.newSingleThreadExecutor();
        AtomicReference<Future<Integer>> rival = new AtomicReference<>();
        doAnswer(invocation -> {
            if (rival.get() == null) {
                // Start a second ingestion while the first one is between delete and insert
                rival.set(rivalThread.submit(
                        () -> service.ingest("fl-race", "Testville", "FL", beta, TWO_CHUNKS)));
                awaitWaiterOn("fl-race");
            }
            return invocation.callRealMethod();
        }).when(store).addAll(anyList(), anyList(), anyList());

        try {
            service.ingest("fl-race", "Testville", "FL", alpha, TWO_CHUNKS);
            int betaChunks = rival.get().get(10, TimeUnit.SECONDS);

            List<String> indexed = store.search(EmbeddingSearchRequest.builder()
                            .queryEmbedding(Embedding.from(provider.vector("rule governs applies")))
                            .maxResults(100)
                            .build())
                    .matches().stream()
                    .map(EmbeddingMatch::embedded)
                    .map(TextSegment::text)
                    .toList();
            assertThat(indexed).hasSize(betaChunks);
            assertThat(indexed).allSatisfy(text -> assertThat(text).startsWith("Beta"));
        } finally {
            rivalThread.shutdownNow();
        }
    }

    private void awaitWaiterOn(String documentId) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!documentLock.hasWaiters(documentId)) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("second ingestion of " + documentId + " did not wait");
            }
            Thread.sleep(5);
        }
    }

    // --- Batch ingestion ---

    @Test
    void ingestAllCountsSkippedDocuments() {
        when(stateRepository.findByDocumentId(anyString())).thenReturn(Optional.empty());
        embedWithFakeProvider();
        List<SourceDocument> documents = List.of(
                new SourceDocument("fl-a", "Testville", "FL", SCENARIO),
                new SourceDocument("fl-b", "Testville", "FL", ""),
                new SourceDocument("", "Testville", "FL", SCENARIO),
                new SourceDocument("fl-c", "Otherville", "FL", SCENARIO));

        IngestionReport report = ingestionService.ingestAll(documents, TWO_CHUNKS);

        assertThat(report).isEqualTo(new IngestionReport(4, 2, 2, 4));
        verify(embeddingStore, times(2)).addAll(anyList(), anyList(), anyList());
    }

    @Test
    void ingestAllRethrowsFailureAfterFinishingOtherDocuments() {
        when(stateRepository.findByDocumentId(anyString())).thenReturn(Optional.empty());
        embedWithFakeProvider();
        when(stateRepository.saveAndFlush(any()))
                .thenThrow(new OptimisticLockingFailureException("stale version"))
                .thenAnswer(invocation -> invocation.getArgument(0));
        List<SourceDocument> documents = List.of(
                new SourceDocument("fl-a", "Testville", "FL", SCENARIO),
                new SourceDocument("fl-b", "Testville", "FL", SCENARIO));

        assertThatThrownBy(() -> ingestionService.ingestAll(documents, TWO_CHUNKS))
                .isInstanceOf(ConcurrentIngestionException.class);
        verify(embeddingStore, times(1)).addAll(anyList(), anyList(), anyList());
    }

    @Test
    void ingestAllStopsStartingDocumentsAfterConfigurationError() {
        when(stateRepository.findByDocumentId(anyString())).thenReturn(Optional.empty());
        when(embeddingCache.embedAll(anyList(), eq(false)))
                .thenThrow(new EmbeddingDimensionMismatchException(64, 32, "fake-bow-v1"));
        List<SourceDocument> documents = List.of(
                new SourceDocument("fl-a", "Testville", "FL", SCENARIO),
                new SourceDocument("fl-b", "Testville", "FL", SCENARIO),
                new SourceDocument("fl-c", "Testville", "FL", SCENARIO));

        assertThatThrownBy(() -> ingestionService.ingestAll(documents, TWO_CHUNKS))
                .isInstanceOfSatisfying(IngestionException.class, e -> {
                    assertThat(e.getDocumentId()).isEqualTo("fl-a");
                    assertThat(e.getCause()).isInstanceOf(EmbeddingDimensionMismatchException.class);
                });
        verify(embeddingCache, times(1)).embedAll(anyList(), eq(false));
        verify(stateRepository, times(1)).findByDocumentId(anyString());
        verifyNoInteractions(embeddingStore);
    }
}
