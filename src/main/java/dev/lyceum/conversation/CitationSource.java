package dev.lyceum.conversation;

/**
 * One source cited under an answer.
 *
 * @param label human-readable source label
 * @param score hybrid score of the passage, rounded to three decimals
 */
public record CitationSource(String label, double score) {}
