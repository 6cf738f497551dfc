package dev.lyceum.conversation;

import java.util.List;
import java.util.UUID;

/**
 * Persistence seam for conversation messages.
 *
 * <p>All methods throw {@link ConversationPersistenceException} when the underlying store fails.
 */
public interface ConversationStore {

  /**
   * Appends the user question and the assistant answer of one exchange, in that order.
   *
   * @param turn the completed exchange
   * @return the stored assistant message
   */
  ChatMessage appendTurn(AnsweredTurn turn);

  /**
   * Appends a single message without provenance.
   *
   * @param conversationId the conversation
   * @param role who wrote the message
   * @param content the message text
   * @return the stored message
   */
  ChatMessage appendMessage(UUID conversationId, MessageRole role, String content);

  /**
   * Nulls provenance on all but the {@code keepLastN} most recent assistant messages.
   *
   * @return number of messages pruned
   */
  int pruneCitations(UUID conversationId, int keepLastN);

  /**
   * Returns up to {@code limit} most recent messages, oldest first.
   */
  List<ChatMessage> recentHistory(UUID conversationId, int limit);

  /** Returns every message of the conversation, oldest first. */
  List<ChatMessage> messages(UUID conversationId);
}
