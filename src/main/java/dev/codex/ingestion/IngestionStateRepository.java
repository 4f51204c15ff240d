package dev.codex.ingestion;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

/** Spring Data repository for {@link IngestionState} entities. */
public interface IngestionStateRepository extends JpaRepository<IngestionState, UUID> {

  Optional<IngestionState> findByDocumentId(String documentId);

  /** Most recent ingestion time across all documents, or null if nothing was ingested. */
  @Query("SELECT MAX(s.lastIngestedAt) FROM IngestionState s")
  @Nullable Instant findMaxLastIngestedAt();
}
