package dev.codex.embedding;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/** Spring Data repository for {@link EmbeddingCacheEntry} rows. */
public interface EmbeddingCacheRepository extends JpaRepository<EmbeddingCacheEntry, UUID> {

  Optional<EmbeddingCacheEntry> findByContentHashAndModelVersion(
      String contentHash, String modelVersion);

  List<EmbeddingCacheEntry> findByModelVersionAndContentHashIn(
      String modelVersion, Collection<String> contentHashes);

  long countByModelVersion(String modelVersion);

  /**
   * Inserts a cache entry unless one already exists for the same (content hash, model version).
   *
   * @param embedding Postgres array literal, e.g. {@code {0.1,0.2}}
   * @return 1 if the row was inserted, 0 if another writer got there first
   */
  @Modifying
  @Transactional
  @Query(
      value =
          """
            INSERT INTO embedding_cache
                (id, content_hash, model_version, content_preview, embedding, dimension, created_at)
            VALUES (gen_random_uuid(), :contentHash, :modelVersion, :contentPreview,
                    CAST(:embedding AS real[]), :dimension, now())
            ON CONFLICT (content_hash, model_version) DO NOTHING
            """,
      nativeQuery = true)
  int insertIfAbsent(
      @Param("contentHash") String contentHash,
      @Param("modelVersion") String modelVersion,
      @Param("contentPreview") String contentPreview,
      @Param("embedding") String embedding,
      @Param("dimension") int dimension);
}
