package dev.lyceum.answer;

import org.jspecify.annotations.Nullable;

/**
 * The complete output of one generation.
 *
 * @param text the full generated text, follow-up trailer included
 * @param inputTokens prompt tokens, if the service reported them
 * @param outputTokens completion tokens, if the service reported them
 */
public record GeneratedAnswer(
    String text, @Nullable Integer inputTokens, @Nullable Integer outputTokens) {}
