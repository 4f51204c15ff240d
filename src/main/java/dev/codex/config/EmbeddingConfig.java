package dev.codex.config;

import dev.codex.embedding.EmbeddingProperties;
import dev.codex.embedding.EmbeddingProvider;
import dev.codex.embedding.LangChain4jEmbeddingProvider;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the embedding model, the {@link EmbeddingProvider} singleton and the vector store.
 *
 * <p>Uses the ONNX-based bge-small-en-v1.5 quantized model (384 dimensions) running in-process,
 * avoiding any external embedding API. The {@link PgVectorEmbeddingStore} shares the application's
 * HikariCP {@link DataSource} to avoid duplicate connection pools.
 *
 * @see dev.codex.search.RetrievalService
 */
@Configuration
public class EmbeddingConfig {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingConfig.class);

  /**
   * Provides the in-process ONNX embedding model (bge-small-en-v1.5 quantized, 384 dimensions).
   *
   * @return a ready-to-use embedding model requiring no external API
   */
  @Bean
  public EmbeddingModel embeddingModel() {
    return new BgeSmallEnV15QuantizedEmbeddingModel();
  }

  /**
   * Wraps the embedding model as the process-wide {@link EmbeddingProvider}, labelled with the
   * configured model version and dimension.
   */
  @Bean
  public EmbeddingProvider embeddingProvider(
      EmbeddingModel embeddingModel, EmbeddingProperties properties) {
    log.info(
        "Embedding provider: model={}, dimension={}, batch-size={}",
        properties.getModelVersion(),
        properties.getDimension(),
        properties.getBatchSize());
    return new LangChain4jEmbeddingProvider(
        embeddingModel, properties.getModelVersion(), properties.getDimension());
  }

  /**
   * Configures the pgvector embedding store over the {@code ordinance_chunks} table.
   *
   * <p>Schema and HNSW index are managed by Flyway; {@code createTable} and {@code useIndex} are
   * disabled to avoid conflicts. The dimension must match the {@code vector(384)} column of the
   * V1 migration.
   *
   * @param dataSource the shared HikariCP data source (no duplicate pool)
   * @param properties embedding properties providing the vector dimension
   * @return an embedding store backed by pgvector
   */
  @Bean
  public EmbeddingStore<TextSegment> embeddingStore(
      DataSource dataSource, EmbeddingProperties properties) {
    return PgVectorEmbeddingStore.datasourceBuilder()
        .datasource(dataSource)
        .table("ordinance_chunks")
        .dimension(properties.getDimension())
        .createTable(false) // Schema managed by Flyway migrations
        .useIndex(false) // HNSW index managed by Flyway V1
        .build();
  }
}
