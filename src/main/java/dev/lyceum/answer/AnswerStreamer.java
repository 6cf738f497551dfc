package dev.lyceum.answer;

import dev.lyceum.conversation.AnsweredTurn;
import dev.lyceum.conversation.ChatMessage;
import dev.lyceum.conversation.CitationRecord;
import dev.lyceum.conversation.CitationRetentionManager;
import dev.lyceum.conversation.ConversationStore;
import dev.lyceum.search.RankedPassages;
import dev.lyceum.search.RetrievalPipeline;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Answers one question as a stream of {@link AnswerEvent}s.
 *
 * <p>Lifecycle ({@link AnswerState}):
 *
 * <ol>
 *   <li>{@code SEARCHING}: emits {@code status=searching}, then runs the {@link RetrievalPipeline}
 *   <li>{@code GENERATING}: builds the grounded prompt and relays generated text as {@code chunk}
 *       events, with the follow-up trailer withheld by a {@link FollowUpFilter}
 *   <li>{@code DONE}: stores question, answer and citations through the {@link
 *       CitationRetentionManager}, then emits the {@code done} event
 * </ol>
 *
 * <p>Any failure on the way moves to {@code ERROR}: one user-safe {@code error} event is sent and
 * nothing is stored. If the caller disconnects, relaying and waiting stop and nothing is stored.
 * An answer is therefore either streamed completely and stored, or not stored at all.
 */
@Service
public class AnswerStreamer {

  private static final Logger log = LoggerFactory.getLogger(AnswerStreamer.class);

  public static final String GENERIC_ERROR =
      "Sorry, something went wrong while answering your question. Please try again.";
  static final String UNAVAILABLE_ERROR =
      "Answering is unavailable right now. Please try again later.";
  static final String TIMEOUT_ERROR =
      "The answer took too long to generate. Please try again.";
  static final String SAVE_ERROR = "Your answer could not be saved. Please try again.";

  private final RetrievalPipeline retrievalPipeline;
  private final GroundingPromptBuilder promptBuilder;
  private final Optional<TextGenerator> textGenerator;
  private final ConversationStore conversationStore;
  private final CitationRetentionManager retentionManager;
  private final AnswerProperties properties;

  public AnswerStreamer(
      RetrievalPipeline retrievalPipeline,
      GroundingPromptBuilder promptBuilder,
      Optional<TextGenerator> textGenerator,
      ConversationStore conversationStore,
      CitationRetentionManager retentionManager,
      AnswerProperties properties) {
    this.retrievalPipeline = retrievalPipeline;
    this.promptBuilder = promptBuilder;
    this.textGenerator = textGenerator;
    this.conversationStore = conversationStore;
    this.retentionManager = retentionManager;
    this.properties = properties;
    if (textGenerator.isEmpty()) {
      log.info("No text generation service configured; questions will be answered with an error");
    }
  }

  /**
   * Answers a question, blocking until the stream ends.
   *
   * @param conversationId the conversation the question belongs to
   * @param question the user question, not blank
   * @param sink where events go
   * @return the terminal state: {@link AnswerState#DONE} or {@link AnswerState#ERROR}
   */
  public AnswerState stream(UUID conversationId, String question, AnswerSink sink) {
    AnswerState state = AnswerState.IDLE.transitionTo(AnswerState.SEARCHING);
    if (!sink.send(AnswerEvent.searching())) {
      return abandon(conversationId, "before retrieval");
    }

    RankedPassages ranked;
    try {
      ranked = retrievalPipeline.retrieve(question);
    } catch (RuntimeException e) {
      log.error("Retrieval failed for conversation {}", conversationId, e);
      return fail(state, sink, GENERIC_ERROR);
    }
    if (!sink.isOpen()) {
      return abandon(conversationId, "during retrieval");
    }
    if (textGenerator.isEmpty()) {
      return fail(state, sink, UNAVAILABLE_ERROR);
    }

    state = state.transitionTo(AnswerState.GENERATING);
    GenerationRequest request;
    try {
      List<ChatMessage> history =
          conversationStore.recentHistory(conversationId, properties.getHistoryMessages());
      request = promptBuilder.build(question, ranked, history);
    } catch (RuntimeException e) {
      log.error("Could not load history for conversation {}", conversationId, e);
      return fail(state, sink, GENERIC_ERROR);
    }

    FollowUpFilter filter = new FollowUpFilter();
    CompletableFuture<Void> disconnected = new CompletableFuture<>();
    sink.onClose(() -> disconnected.complete(null));
    CompletableFuture<GeneratedAnswer> generation;
    try {
      generation =
          textGenerator.get().generate(request, chunk -> relay(chunk, filter, sink, disconnected));
    } catch (RuntimeException e) {
      log.error("Generation could not start for conversation {}", conversationId, e);
      return fail(state, sink, GENERIC_ERROR);
    }

    GeneratedAnswer generated;
    try {
      CompletableFuture.anyOf(generation, disconnected)
          .get(properties.getGenerationTimeout().toMillis(), TimeUnit.MILLISECONDS);
      if (disconnected.isDone() || !sink.isOpen()) {
        generation.cancel(true);
        return abandon(conversationId, "during generation");
      }
      generated = generation.join();
    } catch (TimeoutException e) {
      generation.cancel(true);
      log.warn(
          "Generation timed out after {} for conversation {}",
          properties.getGenerationTimeout(),
          conversationId);
      return fail(state, sink, TIMEOUT_ERROR);
    } catch (ExecutionException e) {
      log.error("Generation failed for conversation {}", conversationId, e.getCause());
      return fail(state, sink, GENERIC_ERROR);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      generation.cancel(true);
      return abandon(conversationId, "on interrupt");
    }

    FollowUpFilter.Outcome outcome = filter.finish();
    if (!outcome.tail().isEmpty() && !sink.send(AnswerEvent.chunk(outcome.tail()))) {
      return abandon(conversationId, "after generation");
    }
    if (!sink.isOpen()) {
      return abandon(conversationId, "after generation");
    }

    CitationRecord citations = CitationRecord.from(ranked, properties.getMaxCitationSources());
    String followUp = outcome.followUp().orElse(null);
    try {
      retentionManager.recordAnswer(
          new AnsweredTurn(
              conversationId,
              question,
              outcome.answer(),
              citations,
              followUp,
              generated.inputTokens(),
              generated.outputTokens()));
    } catch (RuntimeException e) {
      log.error("Could not store answer for conversation {}", conversationId, e);
      return fail(state, sink, SAVE_ERROR);
    }

    state = state.transitionTo(AnswerState.DONE);
    sink.send(AnswerEvent.done(outcome.answer(), followUp, citations));
    sink.complete();
    log.debug(
        "Answered question in conversation {} with {} source(s), confidence {}",
        conversationId,
        citations.sources().size(),
        citations.confidence().level());
    return state;
  }

  private static void relay(
      String chunk, FollowUpFilter filter, AnswerSink sink, CompletableFuture<Void> disconnected) {
    if (disconnected.isDone()) {
      return;
    }
    if (!sink.isOpen()) {
      disconnected.complete(null);
      return;
    }
    String visible = filter.accept(chunk);
    if (!visible.isEmpty() && !sink.send(AnswerEvent.chunk(visible))) {
      disconnected.complete(null);
    }
  }

  private static AnswerState fail(AnswerState state, AnswerSink sink, String message) {
    AnswerState failed = state.transitionTo(AnswerState.ERROR);
    sink.send(AnswerEvent.error(message));
    sink.complete();
    return failed;
  }

  private static AnswerState abandon(UUID conversationId, String stage) {
    log.info("Caller left conversation {} {}; answer discarded", conversationId, stage);
    return AnswerState.ERROR;
  }
}
