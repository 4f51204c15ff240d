package dev.codex.ingestion.assembly;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Position of a chunk in the ordinance's section hierarchy.
 *
 * @param sectionId e.g. {@code "3.2"}, {@code "ARTICLE IV"}, or {@link #UNKNOWN_ID}
 * @param sectionTitle the heading text, or {@link #UNKNOWN_TITLE}
 * @param article the first article mentioned in the chunk, if any
 * @param parentSection the enclosing section or article, if any
 * @param subsectionLevel dotted levels below the top section ({@code "3.2.1"} is level 2)
 */
public record SectionInfo(
    String sectionId,
    String sectionTitle,
    @Nullable String article,
    @Nullable String parentSection,
    int subsectionLevel) {

  public static final String UNKNOWN_ID = "UNKNOWN";
  public static final String UNKNOWN_TITLE = "Unknown Section";

  public SectionInfo {
    Objects.requireNonNull(sectionId, "sectionId must not be null");
    Objects.requireNonNull(sectionTitle, "sectionTitle must not be null");
    if (subsectionLevel < 0) {
      throw new IllegalArgumentException("subsectionLevel must not be negative");
    }
  }
}
