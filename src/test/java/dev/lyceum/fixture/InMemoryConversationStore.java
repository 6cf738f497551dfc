package dev.lyceum.fixture;

import dev.lyceum.conversation.AnsweredTurn;
import dev.lyceum.conversation.ChatMessage;
import dev.lyceum.conversation.ConversationStore;
import dev.lyceum.conversation.MessageRole;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * {@link ConversationStore} kept in a list, with the same ordering and pruning rules as the
 * database-backed store. Every message is stamped one second after the previous one.
 */
public final class InMemoryConversationStore implements ConversationStore {

  private static final Comparator<ChatMessage> NEWEST_FIRST =
      Comparator.comparing(ChatMessage::getCreatedAt)
          .thenComparing(ChatMessage::getId)
          .reversed();

  private final List<ChatMessage> messages = new ArrayList<>();
  private Instant now = Instant.parse("2026-01-15T10:00:00Z");
  private long nextId = 1;

  @Override
  public synchronized ChatMessage appendTurn(AnsweredTurn turn) {
    appendMessage(turn.conversationId(), MessageRole.USER, turn.question());
    ChatMessage answer = stamp(turn.conversationId(), MessageRole.ASSISTANT, turn.answer());
    answer.setCitations(turn.citations());
    answer.setFollowUpQuestion(turn.followUpQuestion());
    answer.setInputTokens(turn.inputTokens());
    answer.setOutputTokens(turn.outputTokens());
    return answer;
  }

  @Override
  public synchronized ChatMessage appendMessage(
      UUID conversationId, MessageRole role, String content) {
    return stamp(conversationId, role, content);
  }

  @Override
  public synchronized int pruneCitations(UUID conversationId, int keepLastN) {
    List<ChatMessage> answers =
        messages.stream()
            .filter(m -> m.getConversationId().equals(conversationId))
            .filter(m -> m.getRole() == MessageRole.ASSISTANT)
            .sorted(NEWEST_FIRST)
            .toList();
    int pruned = 0;
    for (ChatMessage answer : answers.subList(Math.min(keepLastN, answers.size()), answers.size())) {
      if (answer.getCitations() != null || answer.getFollowUpQuestion() != null) {
        answer.setCitations(null);
        answer.setFollowUpQuestion(null);
        pruned++;
      }
    }
    return pruned;
  }

  @Override
  public synchronized List<ChatMessage> recentHistory(UUID conversationId, int limit) {
    List<ChatMessage> newestFirst =
        messages.stream()
            .filter(m -> m.getConversationId().equals(conversationId))
            .sorted(NEWEST_FIRST)
            .limit(Math.max(0, limit))
            .toList();
    List<ChatMessage> oldestFirst = new ArrayList<>(newestFirst);
    Collections.reverse(oldestFirst);
    return oldestFirst;
  }

  @Override
  public synchronized List<ChatMessage> messages(UUID conversationId) {
    return messages.stream()
        .filter(m -> m.getConversationId().equals(conversationId))
        .sorted(NEWEST_FIRST.reversed())
        .toList();
  }

  /** Assistant messages of the conversation that still carry citations. */
  public synchronized long retainedCitations(UUID conversationId) {
    return messages.stream()
        .filter(m -> m.getConversationId().equals(conversationId))
        .filter(m -> m.getRole() == MessageRole.ASSISTANT)
        .filter(m -> m.getCitations() != null)
        .count();
  }

  private ChatMessage stamp(UUID conversationId, MessageRole role, String content) {
    ChatMessage message =
        new ChatMessageBuilder()
            .id(nextId++)
            .conversationId(conversationId)
            .role(role)
            .content(content)
            .createdAt(now)
            .build();
    now = now.plusSeconds(1);
    messages.add(message);
    return message;
  }
}
