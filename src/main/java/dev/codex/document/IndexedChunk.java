package dev.codex.document;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A chunk record of the retrieval index.
 *
 * <p>Rows are written by LangChain4j's {@code PgVectorEmbeddingStore}, which also owns the
 * embedding vector; JPA only reads them for aggregate queries, so the entity is immutable and the
 * vector is not mapped.
 *
 * <p>Maps to the {@code ordinance_chunks} table managed by Flyway migrations.
 *
 * @see IndexedChunkRepository
 */
@Entity
@Immutable
@Table(name = "ordinance_chunks")
public class IndexedChunk {

  @Id
  @Column(name = "embedding_id")
  private UUID id;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String text;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(columnDefinition = "JSONB")
  private String metadata;

  @Column(name = "created_at", insertable = false, updatable = false)
  private Instant createdAt;

  protected IndexedChunk() {
    // JPA requires no-arg constructor
  }

  public UUID getId() {
    return id;
  }

  public String getText() {
    return text;
  }

  public String getMetadata() {
    return metadata;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
