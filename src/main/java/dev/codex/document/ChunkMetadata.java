package dev.codex.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Snake_case keys of the JSONB {@code metadata} column of {@code ordinance_chunks}, shared by the
 * writers (ingestion) and readers (search, aggregate queries).
 *
 * <p>LangChain4j metadata values are scalars, so list fields are stored as JSON array strings and
 * boolean flags as {@code "true"} / {@code "false"}.
 */
public final class ChunkMetadata {

  public static final String SOURCE_DOCUMENT_ID = "source_document_id";
  public static final String JURISDICTION = "jurisdiction";
  public static final String REGION = "region";
  public static final String CHUNK_NUMBER = "chunk_number";
  public static final String CONTENT_HASH = "content_hash";
  public static final String DOCUMENT_POSITION = "document_position";
  public static final String SECTION_ID = "section_id";
  public static final String SECTION_TITLE = "section_title";
  public static final String ARTICLE = "article";
  public static final String PARENT_SECTION = "parent_section";
  public static final String SUBSECTION_LEVEL = "subsection_level";
  public static final String CONTENT_TYPE = "content_type";
  public static final String HAS_TABLE = "has_table";
  public static final String HAS_LIST = "has_list";
  public static final String HAS_DEFINITION = "has_definition";
  public static final String HAS_CITATION = "has_citation";
  public static final String DEFINITIONS = "definitions";
  public static final String CITATIONS = "citations";
  public static final String CROSS_REFERENCES = "cross_references";
  public static final String LEGAL_ENTITIES = "legal_entities";
  public static final String KEY_PHRASES = "key_phrases";
  public static final String SEMANTIC_DENSITY = "semantic_density";
  public static final String COHERENCE_SCORE = "coherence_score";
  public static final String PREV_OVERLAP_TEXT = "prev_overlap_text";
  public static final String NEXT_PREVIEW_TEXT = "next_preview_text";
  public static final String WORD_COUNT = "word_count";
  public static final String CHAR_COUNT = "char_count";
  public static final String SENTENCE_COUNT = "sentence_count";
  public static final String MODEL_VERSION = "model_version";

  private static final ObjectMapper JSON = new ObjectMapper();
  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

  private ChunkMetadata() {
    // constants and codec only
  }

  /** Encodes a list field as a JSON array string. */
  public static String encodeList(List<String> values) {
    try {
      return JSON.writeValueAsString(values);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot encode metadata list", e);
    }
  }

  /** Decodes a list field; a missing value decodes to an empty list. */
  public static List<String> decodeList(@Nullable String json) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      return JSON.readValue(json, STRING_LIST);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed metadata list: " + json, e);
    }
  }
}
