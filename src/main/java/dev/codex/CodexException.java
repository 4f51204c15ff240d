package dev.codex;

/**
 * Root of the application's unchecked exception hierarchy.
 *
 * <p>Adapters map subclasses to transport-level errors: Problem Details for REST, descriptive
 * error strings for MCP tools.
 */
public class CodexException extends RuntimeException {

  public CodexException(String message) {
    super(message);
  }

  public CodexException(String message, Throwable cause) {
    super(message, cause);
  }
}
