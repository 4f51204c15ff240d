package dev.codex.ingestion;

import static dev.codex.ingestion.IngestionException.during;
import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.codex.document.ChunkMetadata;
import dev.codex.embedding.ContentHasher;
import dev.codex.embedding.EmbeddingCache;
import dev.codex.embedding.EmbeddingConfigurationException;
import dev.codex.embedding.EmbeddingProvider;
import dev.codex.ingestion.assembly.DocumentRef;
import dev.codex.ingestion.assembly.OrdinanceChunk;
import dev.codex.ingestion.coherence.CoherenceScorer;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

/**
 * Orchestrates the ingestion pipeline: raw text -> chunks -> vectors -> coherence -> index.
 *
 * <p>Every ingestion is a full reprocess of the document. Old chunks are replaced only after all
 * vectors have been computed, and only if this ingestion wins the compare-and-swap on the
 * document's {@link IngestionState} version: of two concurrent ingestions of the same document the
 * loser gets a {@link ConcurrentIngestionException} and leaves the index untouched.
 *
 * <p>The claim, the removal of old chunks and the insertion of new chunks run under the document's
 * {@link DocumentLock}, so an ingestion that starts after another one's claim waits for its writes
 * to finish before touching the index.
 *
 * <p><strong>Transaction semantics:</strong> the claim commits with the lock. The chunk store
 * writes are separate: if the final insert fails, the claim is rolled back, the document is left
 * with no chunks and the caller should retry the ingestion.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final OrdinanceChunker chunker;
    private final EmbeddingCache embeddingCache;
    private final EmbeddingProvider embeddingProvider;
    private final CoherenceScorer coherenceScorer;
    private final EmbeddingStore<TextSegment> embeddingStore;
    private final IngestionStateRepository stateRepository;
    private final DocumentLock documentLock;
    private final ChunkingProperties chunkingProperties;
    private final Executor ingestionExecutor;
    private final Clock clock;

    public IngestionService(OrdinanceChunker chunker,
                            EmbeddingCache embeddingCache,
                            EmbeddingProvider embeddingProvider,
                            CoherenceScorer coherenceScorer,
                            EmbeddingStore<TextSegment> embeddingStore,
                            IngestionStateRepository stateRepository,
                            DocumentLock documentLock,
                            ChunkingProperties chunkingProperties,
                            @Qualifier("ingestionExecutor") Executor ingestionExecutor,
                            Clock clock) {
        this.chunker = chunker;
        this.embeddingCache = embeddingCache;
        this.embeddingProvider = embeddingProvider;
        this.coherenceScorer = coherenceScorer;
        this.embeddingStore = embeddingStore;
        this.stateRepository = stateRepository;
        this.documentLock = documentLock;
        this.chunkingProperties = chunkingProperties;
        this.ingestionExecutor = ingestionExecutor;
        this.clock = clock;
    }

    /** The configured default chunking options ({@code codex.chunking.*}). */
    public ChunkingOptions defaultOptions() {
        return chunkingProperties.toOptions();
    }

    /**
     * Ingests one document, replacing any chunks previously indexed for it.
     *
     * @param documentId   stable document identifier
     * @param jurisdiction the city or county
     * @param region       the state
     * @param rawText      scraped document text
     * @param options      chunking options, or null for the configured defaults
     * @return number of chunks written; 0 when the document has no text
     * @throws IllegalArgumentException     if an identifier is blank
     * @throws IngestionException           if a pipeline stage fails
     * @throws ConcurrentIngestionException if another ingestion of the same document won the race
     */
    public int ingest(String documentId, String jurisdiction, String region,
                      @Nullable String rawText, @Nullable ChunkingOptions options) {
        DocumentRef document = new DocumentRef(documentId, jurisdiction, region);
        ChunkingOptions effective = options != null ? options : defaultOptions();
        if (rawText == null || rawText.isBlank()) {
            log.warn("Skipping document {}: empty text", documentId);
            return 0;
        }

        // Version read here is the one the final claim compares against
        IngestionState state = stateRepository.findByDocumentId(documentId)
                .orElseGet(() -> new IngestionState(documentId, jurisdiction, region));

        ChunkedDocument chunked = chunker.chunk(document, rawText, effective);
        if (chunked.chunks().isEmpty()) {
            log.warn("Skipping document {}: no sentences after normalization", documentId);
            return 0;
        }

        List<OrdinanceChunk> chunks = chunked.chunks();
        List<String> texts = chunks.stream().map(OrdinanceChunk::text).toList();
        List<float[]> vectors = during(documentId, IngestionStage.EMBED,
                () -> embeddingCache.embedAll(texts, false));
        List<OrdinanceChunk> scored = during(documentId, IngestionStage.SCORE_COHERENCE,
                () -> applyCoherence(chunks, vectors));
        String contentHash = ContentHasher.sha256(chunked.normalizedText());

        during(documentId, IngestionStage.PERSIST, () -> documentLock.withLock(documentId, () -> {
            replaceChunks(state, document, contentHash, scored, vectors);
            return null;
        }));

        log.info("Ingested document {} ({}, {}): {} sentences, {} chunks",
                documentId, jurisdiction, region, chunked.sentences().size(), scored.size());
        return scored.size();
    }

    /**
     * Ingests one upstream document.
     *
     * @see #ingest(String, String, String, String, ChunkingOptions)
     */
    public int ingest(SourceDocument document, @Nullable ChunkingOptions options) {
        return ingest(document.documentId(), document.jurisdiction(), document.region(),
                document.rawText(), options);
    }

    /**
     * Ingests several documents in parallel on the bounded ingestion executor.
     *
     * <p>Invalid or empty documents are counted as skipped and do not affect the others. An
     * embedding configuration error (unknown model version, dimension mismatch) aborts the batch:
     * documents that have not started yet are not ingested. Any failure is rethrown once every
     * started document has finished, configuration errors first, with further failures attached as
     * suppressed exceptions.
     *
     * @param documents the documents to ingest
     * @param options   chunking options, or null for the configured defaults
     * @return counts of ingested and skipped documents and written chunks
     */
    public IngestionReport ingestAll(List<SourceDocument> documents, @Nullable ChunkingOptions options) {
        AtomicBoolean aborted = new AtomicBoolean();
        List<CompletableFuture<Integer>> futures = documents.stream()
                .map(doc -> CompletableFuture.supplyAsync(
                        () -> ingestUnlessAborted(doc, options, aborted), ingestionExecutor))
                .toList();

        int ingested = 0;
        int skipped = 0;
        int notStarted = 0;
        int chunksWritten = 0;
        List<RuntimeException> failures = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            String documentId = documents.get(i).documentId();
            try {
                Integer chunks = futures.get(i).join();
                if (chunks == null) {
                    notStarted++;
                } else if (chunks == 0) {
                    skipped++;
                } else {
                    ingested++;
                    chunksWritten += chunks;
                }
            } catch (CompletionException e) {
                RuntimeException cause = unwrap(e);
                if (cause instanceof IllegalArgumentException) {
                    log.warn("Skipping document {}: {}", documentId, cause.getMessage());
                    skipped++;
                } else {
                    log.error("Ingestion of document {} failed: {}", documentId, cause.getMessage(), cause);
                    failures.add(cause);
                }
            }
        }

        if (!failures.isEmpty()) {
            if (aborted.get()) {
                log.error("Aborted batch after an embedding configuration error: {} of {} documents"
                        + " not started", notStarted, documents.size());
            }
            failures.sort(Comparator.comparing(
                    (RuntimeException failure) -> !isConfigurationError(failure)));
            RuntimeException first = failures.get(0);
            failures.subList(1, failures.size()).forEach(first::addSuppressed);
            throw first;
        }
        log.info("Ingested {} of {} documents ({} skipped): {} chunks",
                ingested, documents.size(), skipped, chunksWritten);
        return new IngestionReport(documents.size(), ingested, skipped, chunksWritten);
    }

    private @Nullable Integer ingestUnlessAborted(SourceDocument document,
                                                  @Nullable ChunkingOptions options,
                                                  AtomicBoolean aborted) {
        if (aborted.get()) {
            return null;
        }
        try {
            return ingest(document, options);
        } catch (RuntimeException e) {
            if (isConfigurationError(e)) {
                aborted.set(true);
            }
            throw e;
        }
    }

    static boolean isConfigurationError(RuntimeException e) {
        Throwable cause = e instanceof IngestionException ? e.getCause() : e;
        return cause instanceof EmbeddingConfigurationException;
    }

    List<OrdinanceChunk> applyCoherence(List<OrdinanceChunk> chunks, List<float[]> vectors) {
        double[] scores = coherenceScorer.score(vectors);
        List<OrdinanceChunk> scored = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            scored.add(chunks.get(i).withCoherenceScore(scores[i]));
        }
        return scored;
    }

    private void replaceChunks(IngestionState state, DocumentRef document, String contentHash,
                               List<OrdinanceChunk> chunks, List<float[]> vectors) {
        claim(state, document, contentHash, chunks.size());

        embeddingStore.removeAll(
                metadataKey(ChunkMetadata.SOURCE_DOCUMENT_ID).isEqualTo(document.documentId()));

        List<String> ids = chunks.stream().map(chunk -> chunk.id().toString()).toList();
        List<Embedding> embeddings = vectors.stream().map(Embedding::from).toList();
        List<TextSegment> segments = chunks.stream().map(this::toSegment).toList();
        embeddingStore.addAll(ids, embeddings, segments);
    }

    private void claim(IngestionState state, DocumentRef document, String contentHash, int chunkCount) {
        state.setJurisdiction(document.jurisdiction());
        state.setRegion(document.region());
        state.recordIngestion(contentHash, embeddingProvider.modelVersion(), chunkCount, clock.instant());
        try {
            stateRepository.saveAndFlush(state);
        } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
            throw new ConcurrentIngestionException(document.documentId(), e);
        }
    }

    private TextSegment toSegment(OrdinanceChunk chunk) {
        TextSegment segment = chunk.toTextSegment();
        segment.metadata().put(ChunkMetadata.MODEL_VERSION, embeddingProvider.modelVersion());
        return segment;
    }

    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        return cause instanceof RuntimeException runtime ? runtime : e;
    }
}
