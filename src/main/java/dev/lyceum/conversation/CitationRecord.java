package dev.lyceum.conversation;

import dev.lyceum.search.Candidate;
import dev.lyceum.search.Confidence;
import dev.lyceum.search.RankedPassages;
import java.util.List;

/**
 * Provenance stored with an assistant answer: the top sources and the confidence summary.
 *
 * <p>Serialised as JSON into {@code chat_messages.citations}. Only the most recent answers of a
 * conversation keep their record; see {@link CitationRetentionManager}.
 *
 * @param sources cited sources, best first, at most {@link #MAX_SOURCES}
 * @param confidence confidence summary of the ranking the answer was grounded on
 */
public record CitationRecord(List<CitationSource> sources, Confidence confidence) {

  public static final int MAX_SOURCES = 5;

  public CitationRecord {
    if (sources.size() > MAX_SOURCES) {
      throw new IllegalArgumentException(
          "At most " + MAX_SOURCES + " citation sources allowed, got: " + sources.size());
    }
    sources = List.copyOf(sources);
  }

  /**
   * Builds the record for a ranking: the first {@code maxSources} passages (capped at {@link
   * #MAX_SOURCES}) in ranking order.
   */
  public static CitationRecord from(RankedPassages ranked, int maxSources) {
    int limit = Math.min(Math.max(0, maxSources), MAX_SOURCES);
    List<CitationSource> sources =
        ranked.passages().stream().limit(limit).map(CitationRecord::toSource).toList();
    return new CitationRecord(sources, ranked.confidence());
  }

  private static CitationSource toSource(Candidate candidate) {
    return new CitationSource(
        candidate.sourceLabel(), Math.round(candidate.hybridScore() * 1000.0) / 1000.0);
  }
}
