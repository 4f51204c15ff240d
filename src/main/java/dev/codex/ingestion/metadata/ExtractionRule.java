package dev.codex.ingestion.metadata;

import java.util.function.BiConsumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One independent metadata field extractor. A rule that fails leaves its own field at the fallback
 * value and does not affect the other rules.
 *
 * @param field name of the extracted field, used in log messages
 * @param extractor pure function from chunk text to the field value
 * @param fallback value used when the extractor throws
 * @param sink writes the value into the signals builder
 * @param <T> field type
 */
public record ExtractionRule<T>(
    String field,
    Function<String, T> extractor,
    T fallback,
    BiConsumer<ChunkSignals.Builder, T> sink) {

  private static final Logger log = LoggerFactory.getLogger(ExtractionRule.class);

  void applyTo(String text, ChunkSignals.Builder builder) {
    T value;
    try {
      value = extractor.apply(text);
    } catch (RuntimeException e) {
      log.warn("Extraction of '{}' failed, using default {}: {}", field, fallback, e.toString());
      value = fallback;
    }
    sink.accept(builder, value);
  }
}
