package dev.codex.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.codex.fixture.FakeEmbeddingProvider;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class BatchEncoderTest {

  @Test
  void splitsInputIntoBatchesOfConfiguredSize() {
    FakeEmbeddingProvider provider = new FakeEmbeddingProvider();
    BatchEncoder encoder = new BatchEncoder(provider, provider.properties(2));
    List<String> texts = IntStream.range(0, 5).mapToObj(i -> "text " + i).toList();

    List<float[]> vectors = encoder.encode(texts);

    assertThat(vectors).hasSize(5);
    assertThat(provider.calls()).extracting(List::size).containsExactly(2, 2, 1);
  }

  @Test
  void preservesInputOrder() {
    FakeEmbeddingProvider provider = new FakeEmbeddingProvider();
    BatchEncoder encoder = new BatchEncoder(provider, provider.properties(32));

    List<float[]> vectors = encoder.encode(List.of("zoning variance", "parking permit"));

    assertThat(vectors.get(0)).containsExactly(provider.vector("zoning variance"));
    assertThat(vectors.get(1)).containsExactly(provider.vector("parking permit"));
  }

  @Test
  void emptyInputMakesNoProviderCall() {
    FakeEmbeddingProvider provider = new FakeEmbeddingProvider();
    BatchEncoder encoder = new BatchEncoder(provider, provider.properties(32));

    assertThat(encoder.encode(List.of())).isEmpty();
    assertThat(provider.calls()).isEmpty();
  }

  @Test
  void wrongDimensionFailsFast() {
    FakeEmbeddingProvider provider = new FakeEmbeddingProvider("fake-bow-v1", 16);
    EmbeddingProperties properties = provider.properties(32);
    properties.setDimension(384);
    BatchEncoder encoder = new BatchEncoder(provider, properties);

    assertThatThrownBy(() -> encoder.encode(List.of("text")))
        .isInstanceOf(EmbeddingDimensionMismatchException.class)
        .hasMessageContaining("expected 384, got 16")
        .satisfies(
            e -> {
              EmbeddingDimensionMismatchException ex = (EmbeddingDimensionMismatchException) e;
              assertThat(ex.getExpected()).isEqualTo(384);
              assertThat(ex.getActual()).isEqualTo(16);
            });
  }

  @Test
  void providerReturningFewerVectorsIsRejected() {
    EmbeddingProvider shortProvider =
        new FakeEmbeddingProvider() {
          @Override
          public List<float[]> embedAll(List<String> texts) {
            return super.embedAll(texts.subList(0, 1));
          }
        };
    BatchEncoder encoder =
        new BatchEncoder(shortProvider, new FakeEmbeddingProvider().properties(32));

    assertThatThrownBy(() -> encoder.encode(List.of("a", "b")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("1 vectors for 2 texts");
  }
}
