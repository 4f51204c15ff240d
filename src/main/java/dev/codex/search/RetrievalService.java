package dev.codex.search;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.codex.document.ChunkMetadata;
import dev.codex.document.IndexedChunkRepository;
import dev.codex.embedding.EmbeddingCache;
import dev.codex.embedding.EmbeddingProvider;
import dev.codex.ingestion.IngestionStateRepository;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.CosineSimilarity;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingSearchResult;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.RelevanceScore;
import dev.langchain4j.store.embedding.filter.Filter;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Nearest-neighbor retrieval over indexed ordinance chunks with region and jurisdiction filters.
 *
 * <p>Pipeline: embed the query with query framing through the {@link EmbeddingCache} -> build the
 * metadata filter (region required, jurisdiction optional) -> fetch top-k plus headroom candidates
 * from the {@link EmbeddingStore} -> convert store scores back to cosine similarity -> drop results
 * under the relevance threshold -> rank by score descending, then chunk number, then document id
 * -> keep top-k.
 */
@Service
public class RetrievalService {

  private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

  /** Score descending; ties by chunk number, then source document id. */
  static final Comparator<SearchResult> RANKING =
      Comparator.comparingDouble(SearchResult::relevanceScore)
          .reversed()
          .thenComparingInt(SearchResult::chunkNumber)
          .thenComparing(SearchResult::sourceDocumentId);

  static final Comparator<JurisdictionCount> JURISDICTION_ORDER =
      Comparator.comparingLong(JurisdictionCount::chunkCount)
          .reversed()
          .thenComparing(JurisdictionCount::jurisdiction);

  private final EmbeddingStore<TextSegment> embeddingStore;
  private final EmbeddingCache embeddingCache;
  private final EmbeddingProvider embeddingProvider;
  private final IndexedChunkRepository chunkRepository;
  private final IngestionStateRepository stateRepository;
  private final SearchProperties properties;

  public RetrievalService(
      EmbeddingStore<TextSegment> embeddingStore,
      EmbeddingCache embeddingCache,
      EmbeddingProvider embeddingProvider,
      IndexedChunkRepository chunkRepository,
      IngestionStateRepository stateRepository,
      SearchProperties properties) {
    this.embeddingStore = embeddingStore;
    this.embeddingCache = embeddingCache;
    this.embeddingProvider = embeddingProvider;
    this.chunkRepository = chunkRepository;
    this.stateRepository = stateRepository;
    this.properties = properties;
  }

  /**
   * Searches the index.
   *
   * @param request query text, filters and limits; topK is capped at {@code codex.search.max-top-k}
   * @return results ordered by relevance descending; empty when nothing matches
   * @throws IndexUnavailableException if the index cannot be queried
   */
  public List<SearchResult> search(SearchRequest request) {
    int topK = request.topK();
    if (topK > properties.getMaxTopK()) {
      log.info(
          "top_k {} exceeds codex.search.max-top-k, returning at most {} results",
          topK,
          properties.getMaxTopK());
      topK = properties.getMaxTopK();
    }
    float[] queryVector;
    try {
      queryVector = embeddingCache.embed(request.query(), true);
    } catch (DataAccessException e) {
      throw new IndexUnavailableException("Embedding cache unavailable: " + e.getMessage(), e);
    }

    EmbeddingSearchRequest.EmbeddingSearchRequestBuilder builder =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(Embedding.from(queryVector))
            .filter(buildFilter(request))
            .maxResults(topK + properties.getCandidateHeadroom());
    if (request.minRelevance() > 0.0) {
      builder.minScore(RelevanceScore.fromCosineSimilarity(request.minRelevance()));
    }

    EmbeddingSearchResult<TextSegment> result;
    try {
      result = embeddingStore.search(builder.build());
    } catch (RuntimeException e) {
      throw new IndexUnavailableException("Retrieval index unavailable: " + e.getMessage(), e);
    }

    List<SearchResult> ranked = rank(result.matches(), request.minRelevance(), topK);
    log.debug(
        "Search '{}' in {}/{}: {} candidates, {} results",
        request.query(),
        request.region(),
        request.jurisdiction() != null ? request.jurisdiction() : "*",
        result.matches().size(),
        ranked.size());
    return ranked;
  }

  /**
   * Lists the jurisdictions of a region with their chunk counts.
   *
   * @param region the state to list
   * @return jurisdictions by chunk count descending, then name ascending
   * @throws IndexUnavailableException if the index cannot be queried
   */
  public List<JurisdictionCount> listJurisdictions(String region) {
    if (region == null || region.isBlank()) {
      throw new IllegalArgumentException("Region must not be blank");
    }
    try {
      return chunkRepository.countByRegionGroupedByJurisdiction(region).stream()
          .map(row -> new JurisdictionCount((String) row[0], ((Number) row[1]).longValue()))
          .sorted(JURISDICTION_ORDER)
          .toList();
    } catch (DataAccessException e) {
      throw new IndexUnavailableException("Retrieval index unavailable: " + e.getMessage(), e);
    }
  }

  /**
   * Returns global index statistics.
   *
   * @throws IndexUnavailableException if the index cannot be queried
   */
  public IndexStatistics indexStatistics() {
    try {
      return new IndexStatistics(
          chunkRepository.countAllChunks(),
          chunkRepository.countDocuments(),
          chunkRepository.countJurisdictions(),
          chunkRepository.getStorageSizeBytes(),
          embeddingProvider.modelVersion(),
          embeddingProvider.dimension(),
          embeddingCache.size(),
          stateRepository.findMaxLastIngestedAt());
    } catch (DataAccessException e) {
      throw new IndexUnavailableException("Retrieval index unavailable: " + e.getMessage(), e);
    }
  }

  /** Region is always required; jurisdiction narrows the search when present. */
  Filter buildFilter(SearchRequest request) {
    Filter filter = metadataKey(ChunkMetadata.REGION).isEqualTo(request.region());
    if (request.jurisdiction() != null) {
      filter =
          filter.and(metadataKey(ChunkMetadata.JURISDICTION).isEqualTo(request.jurisdiction()));
    }
    return filter;
  }

  List<SearchResult> rank(
      List<EmbeddingMatch<TextSegment>> matches, double minRelevance, int topK) {
    return matches.stream()
        .map(RetrievalService::toResult)
        .filter(r -> minRelevance <= 0.0 || r.relevanceScore() >= minRelevance)
        .sorted(RANKING)
        .limit(topK)
        .toList();
  }

  static SearchResult toResult(EmbeddingMatch<TextSegment> match) {
    Metadata metadata = match.embedded().metadata();
    double cosine = CosineSimilarity.fromRelevanceScore(match.score());
    Integer chunkNumber = metadata.getInteger(ChunkMetadata.CHUNK_NUMBER);
    return new SearchResult(
        match.embedded().text(),
        Objects.requireNonNullElse(metadata.getString(ChunkMetadata.JURISDICTION), ""),
        Objects.requireNonNullElse(metadata.getString(ChunkMetadata.SOURCE_DOCUMENT_ID), ""),
        chunkNumber != null ? chunkNumber : 0,
        Math.max(0.0, Math.min(1.0, cosine)));
  }
}
