package dev.codex.ingestion;

import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link DocumentLock} backed by a PostgreSQL transaction-scoped advisory lock keyed by the hash of
 * the document id, so it also holds across application instances sharing the database.
 *
 * <p>The action runs inside the lock's transaction: JPA writes it makes (the ingestion state claim)
 * commit when the lock is released and roll back if the action throws. {@code
 * PgVectorEmbeddingStore} uses its own connections, so store writes are not part of that
 * transaction and each in-flight ingestion needs a second pooled connection while it holds the
 * lock.
 */
@Component
public class AdvisoryDocumentLock implements DocumentLock {

  private static final Logger log = LoggerFactory.getLogger(AdvisoryDocumentLock.class);

  static final String LOCK_SQL = "SELECT pg_advisory_xact_lock(hashtext(?))";

  private final TransactionTemplate transactionTemplate;
  private final JdbcTemplate jdbcTemplate;

  public AdvisoryDocumentLock(
      PlatformTransactionManager transactionManager, JdbcTemplate jdbcTemplate) {
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public <T> T withLock(String documentId, Supplier<T> action) {
    return transactionTemplate.execute(
        status -> {
          jdbcTemplate.queryForList(LOCK_SQL, documentId);
          log.debug("Acquired ingestion lock for document {}", documentId);
          return action.get();
        });
  }
}
