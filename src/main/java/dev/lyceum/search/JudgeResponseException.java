package dev.lyceum.search;

/** Thrown when a relevance judge's reply cannot be read as a list of integer scores. */
public class JudgeResponseException extends RuntimeException {

  public JudgeResponseException(String message) {
    super(message);
  }

  public JudgeResponseException(String message, Throwable cause) {
    super(message, cause);
  }
}
