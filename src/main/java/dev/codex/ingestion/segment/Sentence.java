package dev.codex.ingestion.segment;

import java.util.Objects;

/**
 * One sentence of normalized document text.
 *
 * @param text the trimmed sentence text
 * @param start character offset of the first character in the normalized text
 * @param paragraphStart whether the sentence opens a paragraph
 */
public record Sentence(String text, int start, boolean paragraphStart) {

  public Sentence {
    Objects.requireNonNull(text, "text must not be null");
    if (start < 0) {
      throw new IllegalArgumentException("start must not be negative");
    }
  }

  /** Number of whitespace-separated tokens. */
  public int wordCount() {
    return countWords(text);
  }

  /** Joins this sentence with the one that follows it, keeping this sentence's position. */
  Sentence mergeWith(Sentence next) {
    return new Sentence(text + " " + next.text(), start, paragraphStart);
  }

  /** Counts whitespace-separated tokens in arbitrary text. */
  public static int countWords(String text) {
    String stripped = text.strip();
    return stripped.isEmpty() ? 0 : stripped.split("\\s+").length;
  }
}
