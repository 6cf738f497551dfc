package dev.lyceum.api;

import dev.lyceum.answer.AnswerEvent;
import dev.lyceum.answer.AnswerProperties;
import dev.lyceum.answer.AnswerStreamer;
import dev.lyceum.conversation.ConversationStore;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * REST adapter for asking questions within a conversation.
 *
 * <ul>
 *   <li>{@code POST /api/conversations/{id}/ask} streams the answer as Server-Sent Events: {@code
 *       status}, then {@code chunk}s, then exactly one {@code done} or {@code error} event
 *   <li>{@code GET /api/conversations/{id}/messages} lists stored messages, oldest first, with the
 *       citations they still retain
 * </ul>
 *
 * <p>Answers run on the {@code answerExecutor} so the servlet thread is released while streaming.
 */
@RestController
@RequestMapping("/api/conversations")
public class AskController {

  private static final Logger log = LoggerFactory.getLogger(AskController.class);

  static final String BUSY_ERROR = "The service is busy. Please try again in a moment.";

  private final AnswerStreamer answerStreamer;
  private final ConversationStore conversationStore;
  private final Validator validator;
  private final AnswerProperties properties;
  private final Executor executor;

  public AskController(
      AnswerStreamer answerStreamer,
      ConversationStore conversationStore,
      Validator validator,
      AnswerProperties properties,
      @Qualifier("answerExecutor") Executor executor) {
    this.answerStreamer = answerStreamer;
    this.conversationStore = conversationStore;
    this.validator = validator;
    this.properties = properties;
    this.executor = executor;
  }

  /**
   * Streams the answer to a question.
   *
   * @param conversationId the conversation the question belongs to
   * @param request the question
   * @return the event stream
   * @throws IllegalArgumentException if the question is missing, blank or too long
   */
  @PostMapping("/{conversationId}/ask")
  public SseEmitter ask(@PathVariable UUID conversationId, @RequestBody AskRequest request) {
    validate(request);

    SseEmitter emitter = new SseEmitter(properties.getStreamTimeout().toMillis());
    SseAnswerSink sink = new SseAnswerSink(emitter);
    try {
      executor.execute(() -> answer(conversationId, request.question(), sink));
    } catch (RejectedExecutionException e) {
      log.warn("Answer executor saturated; rejecting question for conversation {}", conversationId);
      sink.send(AnswerEvent.error(BUSY_ERROR));
      sink.complete();
    }
    return emitter;
  }

  private void answer(UUID conversationId, String question, SseAnswerSink sink) {
    try {
      answerStreamer.stream(conversationId, question, sink);
    } catch (RuntimeException e) {
      log.error("Answer stream failed for conversation {}", conversationId, e);
      if (sink.isOpen()) {
        sink.send(AnswerEvent.error(AnswerStreamer.GENERIC_ERROR));
        sink.complete();
      }
    }
  }

  /**
   * Lists the stored messages of a conversation.
   *
   * @param conversationId the conversation
   * @return messages oldest first
   */
  @GetMapping("/{conversationId}/messages")
  public List<MessageView> messages(@PathVariable UUID conversationId) {
    return conversationStore.messages(conversationId).stream().map(MessageView::of).toList();
  }

  private void validate(AskRequest request) {
    Set<ConstraintViolation<AskRequest>> violations = validator.validate(request);
    if (!violations.isEmpty()) {
      String messages =
          violations.stream()
              .map(v -> v.getPropertyPath() + ": " + v.getMessage())
              .sorted()
              .collect(Collectors.joining(", "));
      throw new IllegalArgumentException("Validation failed: " + messages);
    }
  }
}
