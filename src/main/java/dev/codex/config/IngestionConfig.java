package dev.codex.config;

import com.zaxxer.hikari.HikariDataSource;
import dev.codex.ingestion.IngestionProperties;
import java.time.Clock;
import java.util.concurrent.Executor;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Infrastructure beans for the ingestion pipeline: the worker pool and the clock. */
@Configuration
public class IngestionConfig {

  private static final Logger log = LoggerFactory.getLogger(IngestionConfig.class);

  /**
   * Bounded pool for multi-document ingestion. Callers block on the results, so the queue only
   * holds documents waiting for a free worker.
   *
   * <p>A worker holding a document lock keeps one connection and borrows another for the chunk
   * store, so the connection pool must be larger than the worker count.
   */
  @Bean(name = "ingestionExecutor")
  public Executor ingestionExecutor(IngestionProperties properties, DataSource dataSource) {
    int parallelism = properties.getParallelism();
    if (dataSource instanceof HikariDataSource hikari
        && hikari.getMaximumPoolSize() <= parallelism) {
      throw new IllegalStateException(
          ("spring.datasource.hikari.maximum-pool-size (%d) must exceed"
                  + " codex.ingestion.parallelism (%d)")
              .formatted(hikari.getMaximumPoolSize(), parallelism));
    }
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(parallelism);
    executor.setMaxPoolSize(parallelism);
    executor.setThreadNamePrefix("ingest-");
    executor.initialize();
    log.info("Initialized ingestion executor: pool={}", parallelism);
    return executor;
  }

  /** UTC clock used to timestamp ingestion state; replaced by a fixed clock in tests. */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
