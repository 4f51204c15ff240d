package dev.codex.search;

import dev.codex.CodexException;

/** Thrown when the retrieval index cannot be queried. An empty result is not an error. */
public class IndexUnavailableException extends CodexException {

  public IndexUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
