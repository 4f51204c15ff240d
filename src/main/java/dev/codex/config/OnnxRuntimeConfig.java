package dev.codex.config;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtLoggingLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.context.EnvironmentAware;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Configures the ONNX Runtime environment before the embedding model bean is created.
 *
 * <p>Implemented as a {@link BeanFactoryPostProcessor} because the {@code
 * BgeSmallEnV15QuantizedEmbeddingModel} calls {@code OrtEnvironment.getEnvironment()} on
 * construction, and the environment is a singleton that cannot be reconfigured afterwards. Bean
 * factory post-processors run before {@code @ConfigurationProperties} binding, so the thread
 * counts are read straight from the {@link Environment}:
 *
 * <ul>
 *   <li>{@code codex.onnx.intra-op-threads} - parallelism within one inference (default 4)
 *   <li>{@code codex.onnx.inter-op-threads} - parallelism across inferences (default 2)
 *   <li>{@code codex.onnx.spinning} - busy-wait worker threads (default false)
 * </ul>
 */
@Configuration
public class OnnxRuntimeConfig implements BeanFactoryPostProcessor, EnvironmentAware {

  private static final Logger log = LoggerFactory.getLogger(OnnxRuntimeConfig.class);

  private int intraOpThreads = 4;
  private int interOpThreads = 2;
  private boolean spinning;

  @Override
  public void setEnvironment(Environment environment) {
    this.intraOpThreads =
        environment.getProperty("codex.onnx.intra-op-threads", Integer.class, 4);
    this.interOpThreads =
        environment.getProperty("codex.onnx.inter-op-threads", Integer.class, 2);
    this.spinning = environment.getProperty("codex.onnx.spinning", Boolean.class, false);
  }

  @Override
  public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory)
      throws BeansException {
    if (intraOpThreads < 1 || interOpThreads < 1) {
      throw new IllegalStateException(
          "codex.onnx thread counts must be positive, got intra-op=%d, inter-op=%d"
              .formatted(intraOpThreads, interOpThreads));
    }
    try (var threadingOptions = new OrtEnvironment.ThreadingOptions()) {
      threadingOptions.setGlobalSpinControl(spinning);
      threadingOptions.setGlobalIntraOpNumThreads(intraOpThreads);
      threadingOptions.setGlobalInterOpNumThreads(interOpThreads);

      OrtEnvironment.getEnvironment(
          OrtLoggingLevel.ORT_LOGGING_LEVEL_WARNING, "codex", threadingOptions);

      log.info(
          "ONNX Runtime initialized: spinning={}, intra-op={}, inter-op={}",
          spinning ? "on" : "off",
          intraOpThreads,
          interOpThreads);
    } catch (OrtException e) {
      throw new IllegalStateException("Failed to configure ONNX Runtime threading", e);
    } catch (IllegalStateException e) {
      log.warn(
          "ONNX Runtime environment already initialized, threading options not applied: {}",
          e.getMessage());
    }
  }
}
