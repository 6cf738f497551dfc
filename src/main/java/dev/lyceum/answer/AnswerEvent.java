package dev.lyceum.answer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.lyceum.conversation.CitationRecord;
import org.jspecify.annotations.Nullable;

/**
 * One event of an answer stream, serialised as a JSON object with only the relevant fields:
 *
 * <ul>
 *   <li>{@code {"status":"searching"}} once retrieval starts
 *   <li>{@code {"chunk":"..."}} for each piece of answer text
 *   <li>{@code {"done":true,"answer":"...","follow_up":"...","citations":{...}}} after the answer
 *       is stored
 *   <li>{@code {"error":"..."}} when the answer failed; the text is safe to show to users
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnswerEvent(
    @Nullable String status,
    @Nullable String chunk,
    @Nullable Boolean done,
    @Nullable String answer,
    @JsonProperty("follow_up") @Nullable String followUp,
    @Nullable CitationRecord citations,
    @Nullable String error) {

  public static AnswerEvent searching() {
    return new AnswerEvent("searching", null, null, null, null, null, null);
  }

  public static AnswerEvent chunk(String text) {
    return new AnswerEvent(null, text, null, null, null, null, null);
  }

  public static AnswerEvent done(
      String answer, @Nullable String followUp, CitationRecord citations) {
    return new AnswerEvent(null, null, Boolean.TRUE, answer, followUp, citations, null);
  }

  public static AnswerEvent error(String message) {
    return new AnswerEvent(null, null, null, null, null, null, message);
  }

  /** True for the single event that ends a stream. */
  @JsonIgnore
  public boolean isTerminal() {
    return done != null || error != null;
  }
}
