package dev.lyceum.search;

import org.jspecify.annotations.Nullable;

/**
 * A deduplicated passage moving through the ranking stages.
 *
 * <p>Each stage produces new instances through the {@code with...} methods; the similarity score
 * assigned at merge time never changes afterwards. {@code boostedScore} starts equal to the
 * similarity score and {@code hybridScore} equal to the boosted score, so a candidate that skips a
 * stage still carries a usable ranking score.
 *
 * @param passageId stable identity: {@code sourceId#offset}, or {@code sha256:<hex>} of the text
 * @param text the passage text
 * @param sourceId identifier of the transcript, if known
 * @param sourceLabel label shown in citations
 * @param metadata lecture metadata of the passage
 * @param similarityScore best vector similarity across all query variants
 * @param boostedScore similarity plus metadata boosts, clamped
 * @param relevanceScore judge score 1..10, or null when the passage was not judged
 * @param hybridScore score used for the final ordering
 * @param mergeOrder first-seen position in the merged list, used for tie-breaks
 */
public record Candidate(
    String passageId,
    String text,
    @Nullable String sourceId,
    String sourceLabel,
    PassageMetadata metadata,
    double similarityScore,
    double boostedScore,
    @Nullable Integer relevanceScore,
    double hybridScore,
    int mergeOrder) {

  /** Creates a freshly merged candidate whose derived scores equal its similarity. */
  public static Candidate merged(String passageId, RetrievedPassage passage, int mergeOrder) {
    return new Candidate(
        passageId,
        passage.text(),
        passage.sourceId(),
        passage.sourceLabel(),
        passage.metadata(),
        passage.similarityScore(),
        passage.similarityScore(),
        null,
        passage.similarityScore(),
        mergeOrder);
  }

  public Candidate withBoostedScore(double boosted) {
    return new Candidate(
        passageId, text, sourceId, sourceLabel, metadata, similarityScore, boosted, relevanceScore,
        boosted, mergeOrder);
  }

  public Candidate withRelevance(@Nullable Integer relevance, double hybrid) {
    return new Candidate(
        passageId, text, sourceId, sourceLabel, metadata, similarityScore, boostedScore, relevance,
        hybrid, mergeOrder);
  }
}
