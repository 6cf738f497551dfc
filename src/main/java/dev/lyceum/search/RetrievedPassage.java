package dev.lyceum.search;

import org.jspecify.annotations.Nullable;

/**
 * A single hit returned by a {@link VectorRetriever} for one query variant.
 *
 * @param text the passage text
 * @param sourceId identifier of the transcript the passage came from, if known
 * @param sourceLabel human-readable label used in citations (never blank)
 * @param offset position of the passage within its source, if known
 * @param metadata lecture metadata of the passage
 * @param similarityScore vector similarity in [0, 1]
 */
public record RetrievedPassage(
    String text,
    @Nullable String sourceId,
    String sourceLabel,
    @Nullable Integer offset,
    PassageMetadata metadata,
    double similarityScore) {

  public RetrievedPassage {
    if (similarityScore < 0.0 || similarityScore > 1.0) {
      throw new IllegalArgumentException(
          "similarityScore must be in [0, 1], got: " + similarityScore);
    }
  }
}
