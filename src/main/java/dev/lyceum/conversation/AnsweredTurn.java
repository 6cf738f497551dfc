package dev.lyceum.conversation;

import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * A completed question-and-answer exchange, ready to be stored.
 *
 * @param conversationId the conversation the exchange belongs to
 * @param question the user's question
 * @param answer the full answer text as shown to the user
 * @param citations provenance of the answer
 * @param followUpQuestion suggested next question, if the answer offered a valid one
 * @param inputTokens prompt tokens reported by the generation service, if any
 * @param outputTokens completion tokens reported by the generation service, if any
 */
public record AnsweredTurn(
    UUID conversationId,
    String question,
    String answer,
    CitationRecord citations,
    @Nullable String followUpQuestion,
    @Nullable Integer inputTokens,
    @Nullable Integer outputTokens) {}
