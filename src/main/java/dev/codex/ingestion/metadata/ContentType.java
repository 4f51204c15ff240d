package dev.codex.ingestion.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Dominant kind of content in an ordinance chunk. */
public enum ContentType {
  TEXT("text"),
  TABLE("table"),
  LIST("list"),
  DEFINITION("definition"),
  CITATION("citation"),
  MIXED("mixed");

  private final String value;

  ContentType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static ContentType fromValue(String value) {
    for (ContentType type : values()) {
      if (type.value.equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Invalid content type: " + value);
  }

  /**
   * Classifies a chunk from its structural flags. Definitions win over citations, which win over
   * layout; a chunk with both a table and a list is {@link #MIXED}.
   */
  public static ContentType classify(
      boolean hasDefinition, boolean hasCitation, boolean hasTable, boolean hasList) {
    if (hasDefinition) {
      return DEFINITION;
    }
    if (hasCitation) {
      return CITATION;
    }
    if (hasTable && hasList) {
      return MIXED;
    }
    if (hasTable) {
      return TABLE;
    }
    if (hasList) {
      return LIST;
    }
    return TEXT;
  }
}
