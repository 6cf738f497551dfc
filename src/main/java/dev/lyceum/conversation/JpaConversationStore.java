package dev.lyceum.conversation;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link ConversationStore} backed by Spring Data JPA and the {@code chat_messages} table.
 *
 * <p>Messages are stamped from the injected {@link Clock}. Within one exchange the answer is
 * stamped strictly after the question, so ordering by {@code created_at, id} keeps the pair in
 * order even with a coarse clock.
 */
@Service
public class JpaConversationStore implements ConversationStore {

  private final ChatMessageRepository repository;
  private final Clock clock;

  public JpaConversationStore(ChatMessageRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  @Override
  @Transactional
  public ChatMessage appendTurn(AnsweredTurn turn) {
    try {
      Instant askedAt = clock.instant();
      repository.save(
          new ChatMessage(turn.conversationId(), MessageRole.USER, turn.question(), askedAt));

      ChatMessage answer =
          new ChatMessage(
              turn.conversationId(), MessageRole.ASSISTANT, turn.answer(), askedAt.plusMillis(1));
      answer.setCitations(turn.citations());
      answer.setFollowUpQuestion(turn.followUpQuestion());
      answer.setInputTokens(turn.inputTokens());
      answer.setOutputTokens(turn.outputTokens());
      return repository.save(answer);
    } catch (DataAccessException e) {
      throw new ConversationPersistenceException(
          "Failed to store answer for conversation " + turn.conversationId(), e);
    }
  }

  @Override
  @Transactional
  public ChatMessage appendMessage(UUID conversationId, MessageRole role, String content) {
    try {
      return repository.save(new ChatMessage(conversationId, role, content, clock.instant()));
    } catch (DataAccessException e) {
      throw new ConversationPersistenceException(
          "Failed to store message for conversation " + conversationId, e);
    }
  }

  @Override
  @Transactional
  public int pruneCitations(UUID conversationId, int keepLastN) {
    try {
      return repository.pruneCitations(conversationId, keepLastN);
    } catch (DataAccessException e) {
      throw new ConversationPersistenceException(
          "Failed to prune citations for conversation " + conversationId, e);
    }
  }

  @Override
  @Transactional(readOnly = true)
  public List<ChatMessage> recentHistory(UUID conversationId, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    try {
      List<ChatMessage> newestFirst =
          new ArrayList<>(
              repository.findByConversationIdOrderByCreatedAtDescIdDesc(
                  conversationId, PageRequest.of(0, limit)));
      Collections.reverse(newestFirst);
      return newestFirst;
    } catch (DataAccessException e) {
      throw new ConversationPersistenceException(
          "Failed to read history for conversation " + conversationId, e);
    }
  }

  @Override
  @Transactional(readOnly = true)
  public List<ChatMessage> messages(UUID conversationId) {
    try {
      return repository.findByConversationIdOrderByCreatedAtAscIdAsc(conversationId);
    } catch (DataAccessException e) {
      throw new ConversationPersistenceException(
          "Failed to read messages for conversation " + conversationId, e);
    }
  }
}
