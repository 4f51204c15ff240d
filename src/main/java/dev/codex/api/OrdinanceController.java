package dev.codex.api;

import dev.codex.ingestion.ChunkingOptions;
import dev.codex.ingestion.IngestionService;
import dev.codex.search.JurisdictionCount;
import dev.codex.search.RetrievalService;
import dev.codex.search.SearchProperties;
import dev.codex.search.SearchRequest;
import dev.codex.search.SearchResult;
import jakarta.validation.Valid;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST surface over ingestion and retrieval. Errors are mapped to Problem Details by {@link
 * dev.codex.config.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api")
public class OrdinanceController {

  private final IngestionService ingestionService;
  private final RetrievalService retrievalService;
  private final SearchProperties searchProperties;

  public OrdinanceController(
      IngestionService ingestionService,
      RetrievalService retrievalService,
      SearchProperties searchProperties) {
    this.ingestionService = ingestionService;
    this.retrievalService = retrievalService;
    this.searchProperties = searchProperties;
  }

  /** Ingests one document, replacing its previously indexed chunks. */
  @PostMapping("/documents")
  public ResponseEntity<IngestDocumentResponse> ingest(
      @Valid @RequestBody IngestDocumentRequest request) {
    ChunkingOptions options =
        ingestionService
            .defaultOptions()
            .override(
                request.targetWords(),
                request.maxWords(),
                request.overlapSentences(),
                request.semanticThreshold(),
                request.useSemanticBoundaries());
    int chunks =
        ingestionService.ingest(
            request.documentId(),
            request.jurisdiction(),
            request.region(),
            request.text(),
            options);
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(new IngestDocumentResponse(request.documentId(), chunks));
  }

  /** Searches a region, optionally narrowed to one jurisdiction. */
  @GetMapping("/search")
  public List<SearchResult> search(
      @RequestParam("q") String query,
      @RequestParam String region,
      @RequestParam(required = false) @Nullable String jurisdiction,
      @RequestParam(required = false) @Nullable Integer topK,
      @RequestParam(defaultValue = "0.0") double minRelevance) {
    int k = topK != null ? topK : searchProperties.getDefaultTopK();
    return retrievalService.search(new SearchRequest(query, jurisdiction, region, k, minRelevance));
  }

  @GetMapping("/jurisdictions")
  public List<JurisdictionCount> jurisdictions(@RequestParam String region) {
    return retrievalService.listJurisdictions(region);
  }
}
