package dev.codex.config;

import dev.codex.ingestion.ConcurrentIngestionException;
import dev.codex.ingestion.IngestionException;
import dev.codex.ingestion.IngestionStage;
import dev.codex.search.IndexUnavailableException;
import java.util.EnumSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <ul>
 *   <li>{@link IllegalArgumentException} - 400 Bad Request
 *   <li>{@link ConcurrentIngestionException} - 409 Conflict
 *   <li>{@link IngestionException} - 422 when the document text could not be processed, 500 when
 *       embedding or persistence failed
 *   <li>{@link IndexUnavailableException} - 503 Service Unavailable
 * </ul>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private static final Set<IngestionStage> TEXT_STAGES =
      EnumSet.of(
          IngestionStage.NORMALIZE,
          IngestionStage.SEGMENT,
          IngestionStage.DETECT_BOUNDARIES,
          IngestionStage.ASSEMBLE,
          IngestionStage.EXTRACT_METADATA);

  /**
   * Maps {@link IllegalArgumentException} to a 400 Bad Request Problem Detail.
   *
   * @param ex the exception thrown by validation logic
   * @return a Problem Detail with HTTP 400 status and the exception message
   */
  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(ConcurrentIngestionException.class)
  ProblemDetail handleConcurrentIngestion(ConcurrentIngestionException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, ex.getMessage());
    problem.setProperty("documentId", ex.getDocumentId());
    return problem;
  }

  @ExceptionHandler(IngestionException.class)
  ProblemDetail handleIngestion(IngestionException ex) {
    HttpStatus status =
        TEXT_STAGES.contains(ex.getStage())
            ? HttpStatus.UNPROCESSABLE_ENTITY
            : HttpStatus.INTERNAL_SERVER_ERROR;
    if (status.is5xxServerError()) {
      log.error("Ingestion failed: {}", ex.getMessage(), ex);
    }
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
    problem.setProperty("documentId", ex.getDocumentId());
    problem.setProperty("stage", ex.getStage().name());
    return problem;
  }

  @ExceptionHandler(IndexUnavailableException.class)
  ProblemDetail handleIndexUnavailable(IndexUnavailableException ex) {
    log.warn("Retrieval index unavailable: {}", ex.getMessage());
    return ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
  }
}
