package dev.lyceum.search;

/**
 * Confidence summary shown next to an answer.
 *
 * @param level coarse level derived from {@code score}
 * @param score mean hybrid score of the top candidates, in [0, 1]
 * @param stars one star per fifth of the score, rounded; at least one when the score is positive
 * @param reasoning short human-readable explanation
 */
public record Confidence(ConfidenceLevel level, double score, String stars, String reasoning) {

  /** Confidence when nothing relevant was retrieved. */
  public static Confidence none() {
    return new Confidence(ConfidenceLevel.LOW, 0.0, "", "No relevant sources found");
  }
}
