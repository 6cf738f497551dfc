package dev.lyceum.answer;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/** Streaming text generation service that answers grounded questions. */
public interface TextGenerator {

  /**
   * Starts generating an answer.
   *
   * <p>{@code onChunk} is called with each piece of text, in order, from a thread owned by the
   * implementation. The returned future completes with the full answer after the last chunk, or
   * exceptionally if generation fails. Cancelling the future asks the implementation to stop.
   *
   * @param request prompt, history and question
   * @param onChunk receiver for streamed text
   * @return the pending answer
   */
  CompletableFuture<GeneratedAnswer> generate(GenerationRequest request, Consumer<String> onChunk);
}
