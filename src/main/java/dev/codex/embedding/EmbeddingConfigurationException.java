package dev.codex.embedding;

import dev.codex.CodexException;

/**
 * A misconfiguration between the embedding model, the cache and the index. Never retryable: the
 * same input fails the same way until configuration changes.
 */
public abstract class EmbeddingConfigurationException extends CodexException {

  protected EmbeddingConfigurationException(String message) {
    super(message);
  }
}
