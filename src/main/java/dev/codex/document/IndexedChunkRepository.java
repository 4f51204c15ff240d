package dev.codex.document;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Spring Data repository for aggregate queries over {@link IndexedChunk} rows. */
public interface IndexedChunkRepository extends JpaRepository<IndexedChunk, UUID> {

  /**
   * Counts chunks per jurisdiction within a region, most chunks first, ties by jurisdiction name.
   *
   * @param region the region (state) to list
   * @return list of [jurisdiction, count] pairs
   */
  @Query(
      value =
          """
            SELECT metadata->>'jurisdiction' AS jurisdiction, COUNT(*) AS cnt
            FROM ordinance_chunks
            WHERE metadata->>'region' = :region
            GROUP BY metadata->>'jurisdiction'
            ORDER BY cnt DESC, jurisdiction ASC
            """,
      nativeQuery = true)
  List<Object[]> countByRegionGroupedByJurisdiction(@Param("region") String region);

  /**
   * Counts the chunks currently indexed for one source document.
   *
   * @param documentId the source document id
   * @return chunk count
   */
  @Query(
      value =
          """
            SELECT COUNT(*) FROM ordinance_chunks
            WHERE metadata->>'source_document_id' = :documentId
            """,
      nativeQuery = true)
  long countByDocumentId(@Param("documentId") String documentId);

  /**
   * Counts total chunks across all documents.
   *
   * @return total chunk count
   */
  @Query(value = "SELECT COUNT(*) FROM ordinance_chunks", nativeQuery = true)
  long countAllChunks();

  /**
   * Counts distinct source documents in the index.
   *
   * @return document count
   */
  @Query(
      value = "SELECT COUNT(DISTINCT metadata->>'source_document_id') FROM ordinance_chunks",
      nativeQuery = true)
  long countDocuments();

  /**
   * Counts distinct (region, jurisdiction) pairs in the index.
   *
   * @return jurisdiction count
   */
  @Query(
      value =
          """
            SELECT COUNT(*) FROM (
                SELECT DISTINCT metadata->>'region', metadata->>'jurisdiction'
                FROM ordinance_chunks
            ) AS jurisdictions
            """,
      nativeQuery = true)
  long countJurisdictions();

  /**
   * Returns the total relation size (data + indexes + TOAST) of the ordinance_chunks table in
   * bytes.
   *
   * @return storage size in bytes
   */
  @Query(value = "SELECT pg_total_relation_size('ordinance_chunks')", nativeQuery = true)
  long getStorageSizeBytes();
}
