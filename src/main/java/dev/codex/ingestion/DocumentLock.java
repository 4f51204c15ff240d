package dev.codex.ingestion;

import java.util.function.Supplier;

/**
 * Mutual exclusion per source document. {@link IngestionService} holds it from the state claim
 * until the new chunks are stored, so two ingestions of one document never interleave their index
 * writes.
 */
public interface DocumentLock {

  /**
   * Runs {@code action} while holding the lock for {@code documentId}, blocking until it is free.
   * The lock is released when the action returns or throws.
   */
  <T> T withLock(String documentId, Supplier<T> action);
}
