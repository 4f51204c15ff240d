package dev.codex.embedding;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A cached vector for one (content hash, model version) pair.
 *
 * <p>Rows are written only through {@link EmbeddingCacheRepository#insertIfAbsent} and never
 * updated, so the entity is mapped read-only.
 *
 * <p>Maps to the {@code embedding_cache} table managed by Flyway migrations.
 */
@Entity
@Immutable
@Table(
    name = "embedding_cache",
    uniqueConstraints = @UniqueConstraint(columnNames = {"content_hash", "model_version"}))
public class EmbeddingCacheEntry {

  @Id private UUID id;

  @Column(name = "content_hash", nullable = false, length = 64)
  private String contentHash;

  @Column(name = "model_version", nullable = false)
  private String modelVersion;

  @Column(name = "content_preview", columnDefinition = "TEXT")
  private String contentPreview;

  @JdbcTypeCode(SqlTypes.ARRAY)
  @Column(nullable = false, columnDefinition = "real[]")
  private float[] embedding;

  @Column(nullable = false)
  private int dimension;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected EmbeddingCacheEntry() {
    // JPA requires no-arg constructor
  }

  public UUID getId() {
    return id;
  }

  public String getContentHash() {
    return contentHash;
  }

  public String getModelVersion() {
    return modelVersion;
  }

  public String getContentPreview() {
    return contentPreview;
  }

  public float[] getEmbedding() {
    return embedding;
  }

  public int getDimension() {
    return dimension;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
