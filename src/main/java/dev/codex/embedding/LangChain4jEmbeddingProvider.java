package dev.codex.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.util.List;

/**
 * {@link EmbeddingProvider} backed by a LangChain4j {@link EmbeddingModel}, typically the
 * in-process ONNX bge-small-en-v1.5 model.
 */
public class LangChain4jEmbeddingProvider implements EmbeddingProvider {

  private final EmbeddingModel model;
  private final String modelVersion;
  private final int dimension;

  public LangChain4jEmbeddingProvider(EmbeddingModel model, String modelVersion, int dimension) {
    this.model = model;
    this.modelVersion = modelVersion;
    this.dimension = dimension;
  }

  @Override
  public String modelVersion() {
    return modelVersion;
  }

  @Override
  public int dimension() {
    return dimension;
  }

  @Override
  public List<float[]> embedAll(List<String> texts) {
    List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();
    return model.embedAll(segments).content().stream().map(Embedding::vector).toList();
  }
}
