package dev.lyceum.conversation;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stores completed answers and keeps provenance on a bounded trailing window of them.
 *
 * <p>{@link #recordAnswer} writes the exchange and prunes the conversation in one transaction: if
 * either step fails nothing is stored. The prune is a single UPDATE computed from the database's
 * current state; if concurrent writers briefly leave extra answers with provenance, the next write
 * to the conversation corrects it.
 */
@Service
public class CitationRetentionManager {

  private static final Logger log = LoggerFactory.getLogger(CitationRetentionManager.class);

  private final ConversationStore store;
  private final RetentionProperties properties;

  public CitationRetentionManager(ConversationStore store, RetentionProperties properties) {
    this.store = store;
    this.properties = properties;
  }

  /**
   * Persists a completed exchange and enforces the retention window.
   *
   * @param turn the completed exchange
   * @return the stored assistant message
   * @throws ConversationPersistenceException if storing or pruning fails
   */
  @Transactional
  public ChatMessage recordAnswer(AnsweredTurn turn) {
    ChatMessage stored = store.appendTurn(turn);
    enforce(turn.conversationId());
    return stored;
  }

  /**
   * Nulls provenance on all assistant answers of the conversation outside the retention window.
   * Running it again without new answers changes nothing.
   *
   * @param conversationId the conversation to prune
   * @return number of answers pruned
   */
  @Transactional
  public int enforce(UUID conversationId) {
    int pruned = store.pruneCitations(conversationId, properties.getKeepLast());
    if (pruned > 0) {
      log.debug(
          "Pruned citations from {} answer(s) in conversation {}", pruned, conversationId);
    }
    return pruned;
  }
}
