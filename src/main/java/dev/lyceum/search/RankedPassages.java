package dev.lyceum.search;

import java.util.List;

/**
 * Immutable output of the {@link RetrievalPipeline} for one question.
 *
 * @param question the question as asked
 * @param queryVariants the variants that were retrieved, original first
 * @param passages final candidates, ordered by hybrid score descending
 * @param confidence confidence summary over {@code passages}
 * @param judged whether relevance judgments contributed to the ranking
 */
public record RankedPassages(
    String question,
    List<String> queryVariants,
    List<Candidate> passages,
    Confidence confidence,
    boolean judged) {

  public RankedPassages {
    queryVariants = List.copyOf(queryVariants);
    passages = List.copyOf(passages);
  }

  public boolean isEmpty() {
    return passages.isEmpty();
  }
}
