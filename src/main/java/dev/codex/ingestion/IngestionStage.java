package dev.codex.ingestion;

/** Pipeline stages of a single document ingestion, in execution order. */
public enum IngestionStage {
  NORMALIZE,
  SEGMENT,
  DETECT_BOUNDARIES,
  ASSEMBLE,
  EXTRACT_METADATA,
  EMBED,
  SCORE_COHERENCE,
  PERSIST
}
