package dev.lyceum.conversation;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Spring Data repository for {@link ChatMessage} entities. */
public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {

  /**
   * Returns the messages of a conversation, newest first.
   *
   * @param conversationId the conversation
   * @param page page size bounds how many recent messages are read
   * @return messages ordered by {@code created_at DESC, id DESC}
   */
  List<ChatMessage> findByConversationIdOrderByCreatedAtDescIdDesc(
      UUID conversationId, Pageable page);

  /**
   * Returns all messages of a conversation in chronological order.
   *
   * @param conversationId the conversation
   * @return messages ordered by {@code created_at ASC, id ASC}
   */
  List<ChatMessage> findByConversationIdOrderByCreatedAtAscIdAsc(UUID conversationId);

  /**
   * Nulls citations and follow-up questions on every assistant message of a conversation except
   * the {@code keepLast} most recent ones. Messages that carry neither are not touched, so a repeat
   * run updates zero rows.
   *
   * @param conversationId the conversation to prune
   * @param keepLast how many recent assistant messages keep their provenance
   * @return number of rows updated
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      value =
          """
            UPDATE chat_messages
            SET citations = NULL, follow_up_question = NULL
            WHERE conversation_id = :conversationId
              AND role = 'ASSISTANT'
              AND (citations IS NOT NULL OR follow_up_question IS NOT NULL)
              AND id NOT IN (
                SELECT id FROM chat_messages
                WHERE conversation_id = :conversationId AND role = 'ASSISTANT'
                ORDER BY created_at DESC, id DESC
                LIMIT :keepLast)
            """,
      nativeQuery = true)
  int pruneCitations(
      @Param("conversationId") UUID conversationId, @Param("keepLast") int keepLast);

  /**
   * Counts assistant messages of a conversation that still carry citations.
   *
   * @param conversationId the conversation
   * @return number of assistant rows with non-null citations
   */
  @Query(
      value =
          """
            SELECT COUNT(*) FROM chat_messages
            WHERE conversation_id = :conversationId
              AND role = 'ASSISTANT'
              AND citations IS NOT NULL
            """,
      nativeQuery = true)
  long countRetainedCitations(@Param("conversationId") UUID conversationId);
}
