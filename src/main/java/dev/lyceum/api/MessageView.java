package dev.lyceum.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.lyceum.conversation.ChatMessage;
import dev.lyceum.conversation.CitationRecord;
import java.time.Instant;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/** A stored conversation message as returned by the messages endpoint. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageView(
    long id,
    String role,
    String content,
    @Nullable CitationRecord citations,
    @JsonProperty("follow_up") @Nullable String followUp,
    @JsonProperty("created_at") Instant createdAt) {

  static MessageView of(ChatMessage message) {
    return new MessageView(
        message.getId(),
        message.getRole().name().toLowerCase(Locale.ROOT),
        message.getContent(),
        message.getCitations(),
        message.getFollowUpQuestion(),
        message.getCreatedAt());
  }
}
