package dev.lyceum.answer;

import dev.lyceum.conversation.MessageRole;

/** An earlier message of the conversation, replayed to the generation service as history. */
public record PriorMessage(MessageRole role, String content) {}
