package dev.lyceum.conversation;

/** Thrown when conversation messages cannot be read from or written to the database. */
public class ConversationPersistenceException extends RuntimeException {

  public ConversationPersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
