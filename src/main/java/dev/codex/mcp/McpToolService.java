package dev.codex.mcp;

import dev.codex.ingestion.ChunkingOptions;
import dev.codex.ingestion.ConcurrentIngestionException;
import dev.codex.ingestion.IngestionException;
import dev.codex.ingestion.IngestionService;
import dev.codex.search.IndexStatistics;
import dev.codex.search.JurisdictionCount;
import dev.codex.search.RetrievalService;
import dev.codex.search.SearchProperties;
import dev.codex.search.SearchRequest;
import dev.codex.search.SearchResult;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing ordinance ingestion and retrieval as tool methods.
 *
 * <p>Tool methods follow the structured error pattern: every exception is caught and returned as a
 * descriptive error string, never thrown to the transport.
 *
 * <p>Tools: {@code search_ordinances}, {@code list_jurisdictions}, {@code ingest_ordinance}, {@code
 * index_statistics}.
 *
 * @see TokenBudgetTruncator
 * @see McpToolConfig
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  private final RetrievalService retrievalService;
  private final IngestionService ingestionService;
  private final TokenBudgetTruncator truncator;
  private final SearchProperties searchProperties;

  public McpToolService(
      RetrievalService retrievalService,
      IngestionService ingestionService,
      TokenBudgetTruncator truncator,
      SearchProperties searchProperties) {
    this.retrievalService = retrievalService;
    this.ingestionService = ingestionService;
    this.truncator = truncator;
    this.searchProperties = searchProperties;
  }

  /** Semantic search over indexed ordinances, restricted to a state and optionally a city. */
  @Tool(
      name = "search_ordinances",
      description =
          "Search indexed municipal ordinances by semantic query within a state. "
              + "Optionally restrict to one city or county. Returns excerpts with jurisdiction, "
              + "source document and chunk number for citation.")
  public String searchOrdinances(
      @ToolParam(description = "Search query text") @Nullable String query,
      @ToolParam(description = "State to search in, e.g. 'FL'") @Nullable String region,
      @ToolParam(description = "City or county to restrict to", required = false)
          @Nullable String jurisdiction,
      @ToolParam(description = "Maximum number of results (1-50, default 5)", required = false)
          @Nullable Integer topK,
      @ToolParam(
              description =
                  "Minimum relevance (0.0-1.0). Results below this threshold are excluded.",
              required = false)
          @Nullable Double minRelevance) {
    try {
      if (query == null || query.isBlank()) {
        return "Error: Query must not be empty. Provide a search query string.";
      }
      if (region == null || region.isBlank()) {
        return "Error: Region must not be empty. Provide a state such as 'FL'.";
      }
      List<SearchResult> results =
          retrievalService.search(
              new SearchRequest(
                  query,
                  jurisdiction,
                  region,
                  clampTopK(topK),
                  minRelevance != null ? minRelevance : 0.0));
      if (results.isEmpty()) {
        return jurisdiction == null || jurisdiction.isBlank()
            ? "No results found in %s for query: %s".formatted(region, query)
            : "No results found in %s, %s for query: %s".formatted(jurisdiction, region, query);
      }
      return truncator.truncate(results);
    } catch (Exception e) {
      return "Error searching ordinances: " + e.getMessage();
    }
  }

  /** Lists the indexed cities and counties of a state with chunk counts. */
  @Tool(
      name = "list_jurisdictions",
      description = "List indexed cities and counties of a state with their chunk counts.")
  public String listJurisdictions(
      @ToolParam(description = "State to list, e.g. 'FL'") @Nullable String region) {
    try {
      if (region == null || region.isBlank()) {
        return "Error: Region must not be empty. Provide a state such as 'FL'.";
      }
      List<JurisdictionCount> counts = retrievalService.listJurisdictions(region);
      if (counts.isEmpty()) {
        return "No jurisdictions indexed for region " + region + ".";
      }
      StringBuilder sb = new StringBuilder();
      for (JurisdictionCount count : counts) {
        sb.append(String.format("- %s: %,d chunks%n", count.jurisdiction(), count.chunkCount()));
      }
      return sb.toString();
    } catch (Exception e) {
      return "Error listing jurisdictions: " + e.getMessage();
    }
  }

  /**
   * Ingests one ordinance document, replacing any chunks previously indexed for it. Chunking
   * parameters fall back to the configured defaults.
   */
  @Tool(
      name = "ingest_ordinance",
      description =
          "Chunk, embed and index one ordinance document, replacing any earlier version of it. "
              + "Optional chunking parameters override the configured defaults.")
  public String ingestOrdinance(
      @ToolParam(description = "Stable identifier of the document") @Nullable String documentId,
      @ToolParam(description = "City or county the document belongs to")
          @Nullable String jurisdiction,
      @ToolParam(description = "State the jurisdiction belongs to") @Nullable String region,
      @ToolParam(description = "Raw document text") @Nullable String text,
      @ToolParam(description = "Target words per chunk", required = false)
          @Nullable Integer targetWords,
      @ToolParam(description = "Hard word cap per chunk", required = false)
          @Nullable Integer maxWords,
      @ToolParam(description = "Sentences of overlap context", required = false)
          @Nullable Integer overlapSentences,
      @ToolParam(description = "Use embedding similarity to find boundaries", required = false)
          @Nullable Boolean semantic) {
    if (documentId == null || documentId.isBlank()) {
      return "Error: Document ID must not be empty.";
    }
    try {
      ChunkingOptions options =
          ingestionService
              .defaultOptions()
              .override(targetWords, maxWords, overlapSentences, null, semantic);
      int chunks = ingestionService.ingest(documentId, jurisdiction, region, text, options);
      if (chunks == 0) {
        return "Document '%s' produced no chunks; nothing was indexed.".formatted(documentId);
      }
      return "Document '%s' indexed for %s, %s (%d chunks)."
          .formatted(documentId, jurisdiction, region, chunks);
    } catch (ConcurrentIngestionException e) {
      return "Error: Document '%s' is being ingested concurrently. Retry later."
          .formatted(documentId);
    } catch (IngestionException e) {
      log.warn("Ingestion of {} failed at {}", documentId, e.getStage(), e);
      return "Error ingesting document '%s' at stage %s: %s"
          .formatted(documentId, e.getStage(), e.getCause().getMessage());
    } catch (Exception e) {
      return "Error ingesting document: " + e.getMessage();
    }
  }

  /** Returns global index statistics. */
  @Tool(
      name = "index_statistics",
      description =
          "View global index statistics: total chunks, documents, jurisdictions, storage size, "
              + "embedding model, cache size and last ingestion timestamp.")
  public String indexStatistics() {
    try {
      IndexStatistics stats = retrievalService.indexStatistics();
      return """
          Index Statistics:
          - Total chunks: %,d
          - Documents: %,d
          - Jurisdictions: %,d
          - Embedding model: %s (%d dimensions)
          - Cached embeddings: %,d
          - Storage size: %s
          - Last ingestion: %s"""
          .formatted(
              stats.totalChunks(),
              stats.documents(),
              stats.jurisdictions(),
              stats.modelVersion(),
              stats.dimension(),
              stats.cachedEmbeddings(),
              formatBytes(stats.storageSizeBytes()),
              stats.lastIngestedAt() != null ? stats.lastIngestedAt().toString() : "never");
    } catch (Exception e) {
      return "Error retrieving index statistics: " + e.getMessage();
    }
  }

  private int clampTopK(@Nullable Integer topK) {
    if (topK == null || topK < 1) {
      return searchProperties.getDefaultTopK();
    }
    return Math.min(topK, searchProperties.getMaxTopK());
  }

  static String formatBytes(long bytes) {
    if (bytes < 1024) return bytes + " B";
    double kb = bytes / 1024.0;
    if (kb < 1024) return "%.1f KB".formatted(kb);
    double mb = kb / 1024.0;
    if (mb < 1024) return "%.1f MB".formatted(mb);
    return "%.1f GB".formatted(mb / 1024.0);
  }
}
