package dev.lyceum.config;

import dev.lyceum.conversation.ConversationPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <p>Validation failures ({@link IllegalArgumentException}) become 400 Bad Request with the
 * validation message. Database failures become 503 with a generic detail; the cause is logged, not
 * returned.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

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

  /**
   * Maps {@link ConversationPersistenceException} to a 503 Service Unavailable Problem Detail.
   *
   * @param ex the persistence failure
   * @return a Problem Detail with HTTP 503 status and a generic message
   */
  @ExceptionHandler(ConversationPersistenceException.class)
  ProblemDetail handlePersistence(ConversationPersistenceException ex) {
    log.error("Conversation storage failed", ex);
    return ProblemDetail.forStatusAndDetail(
        HttpStatus.SERVICE_UNAVAILABLE, "Conversation storage is temporarily unavailable");
  }
}
