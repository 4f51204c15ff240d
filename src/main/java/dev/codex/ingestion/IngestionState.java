package dev.codex.ingestion;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.UUID;

/**
 * Ingestion bookkeeping for one source document.
 *
 * <p>The {@code version} column is a JPA optimistic lock: an ingestion claims the document by
 * saving this row with the version it read, so of two concurrent ingestions of the same document
 * only one can write its chunks. The unique constraint on {@code source_document_id} does the same
 * for the first ingestion.
 *
 * <p>Maps to the {@code ingestion_state} table managed by Flyway migrations.
 */
@Entity
@Table(name = "ingestion_state")
public class IngestionState {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "source_document_id", nullable = false, unique = true)
  private String documentId;

  @Column(nullable = false)
  private String jurisdiction;

  @Column(nullable = false)
  private String region;

  @Column(name = "content_hash", nullable = false)
  private String contentHash;

  @Column(name = "model_version", nullable = false)
  private String modelVersion;

  @Column(name = "chunk_count", nullable = false)
  private int chunkCount;

  @Version
  @Column(nullable = false)
  private long version;

  @Column(name = "last_ingested_at", nullable = false)
  private Instant lastIngestedAt;

  protected IngestionState() {
    // JPA requires no-arg constructor
  }

  /**
   * Creates the state record for a document's first ingestion.
   *
   * @param documentId the source document id
   * @param jurisdiction the city or county
   * @param region the state
   */
  public IngestionState(String documentId, String jurisdiction, String region) {
    this.documentId = documentId;
    this.jurisdiction = jurisdiction;
    this.region = region;
  }

  /** Records the outcome of an ingestion about to be written to the index. */
  public void recordIngestion(
      String contentHash, String modelVersion, int chunkCount, Instant ingestedAt) {
    this.contentHash = contentHash;
    this.modelVersion = modelVersion;
    this.chunkCount = chunkCount;
    this.lastIngestedAt = ingestedAt;
  }

  public UUID getId() {
    return id;
  }

  public String getDocumentId() {
    return documentId;
  }

  public String getJurisdiction() {
    return jurisdiction;
  }

  public void setJurisdiction(String jurisdiction) {
    this.jurisdiction = jurisdiction;
  }

  public String getRegion() {
    return region;
  }

  public void setRegion(String region) {
    this.region = region;
  }

  public String getContentHash() {
    return contentHash;
  }

  public String getModelVersion() {
    return modelVersion;
  }

  public int getChunkCount() {
    return chunkCount;
  }

  public long getVersion() {
    return version;
  }

  public Instant getLastIngestedAt() {
    return lastIngestedAt;
  }
}
