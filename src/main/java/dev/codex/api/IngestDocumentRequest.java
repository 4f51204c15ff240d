package dev.codex.api;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.jspecify.annotations.Nullable;

/**
 * Request body of {@code POST /api/documents}. Chunking fields left null fall back to the
 * configured defaults.
 */
public record IngestDocumentRequest(
    @NotBlank String documentId,
    @NotBlank String jurisdiction,
    @NotBlank String region,
    @NotBlank String text,
    @Nullable @Min(1) Integer targetWords,
    @Nullable @Min(1) Integer maxWords,
    @Nullable @Min(0) Integer overlapSentences,
    @Nullable @DecimalMin("0.0") @DecimalMax("1.0") Double semanticThreshold,
    @Nullable Boolean useSemanticBoundaries) {}
