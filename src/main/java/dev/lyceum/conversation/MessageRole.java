package dev.lyceum.conversation;

/** Author of a stored conversation message. */
public enum MessageRole {
  USER,
  ASSISTANT
}
