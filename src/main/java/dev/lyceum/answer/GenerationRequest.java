package dev.lyceum.answer;

import java.util.List;

/**
 * Everything the generation service needs for one answer.
 *
 * @param systemPrompt instructions plus the grounding context
 * @param history earlier messages, oldest first
 * @param question the question to answer
 */
public record GenerationRequest(String systemPrompt, List<PriorMessage> history, String question) {

  public GenerationRequest {
    history = List.copyOf(history);
  }
}
