package dev.codex.ingestion.metadata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class ContentTypeTest {

  @Test
  void fromValueIsCaseInsensitive() {
    assertThat(ContentType.fromValue("Citation")).isEqualTo(ContentType.CITATION);
    assertThat(ContentType.fromValue("table")).isEqualTo(ContentType.TABLE);
  }

  @Test
  void fromValueRejectsUnknownType() {
    assertThatThrownBy(() -> ContentType.fromValue("prose"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("prose");
  }

  @Test
  void serializesAsLowercaseValue() throws Exception {
    ObjectMapper mapper = new ObjectMapper();

    assertThat(mapper.writeValueAsString(ContentType.DEFINITION)).isEqualTo("\"definition\"");
    assertThat(mapper.readValue("\"mixed\"", ContentType.class)).isEqualTo(ContentType.MIXED);
  }

  @Test
  void classificationPriority() {
    assertThat(ContentType.classify(true, true, true, true)).isEqualTo(ContentType.DEFINITION);
    assertThat(ContentType.classify(false, true, true, true)).isEqualTo(ContentType.CITATION);
    assertThat(ContentType.classify(false, false, true, true)).isEqualTo(ContentType.MIXED);
    assertThat(ContentType.classify(false, false, true, false)).isEqualTo(ContentType.TABLE);
    assertThat(ContentType.classify(false, false, false, true)).isEqualTo(ContentType.LIST);
    assertThat(ContentType.classify(false, false, false, false)).isEqualTo(ContentType.TEXT);
  }
}
