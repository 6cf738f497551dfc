package dev.lyceum.search;

import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Summarises the final ranking into a {@link Confidence}.
 *
 * <p>The score is the mean hybrid score of the top {@code confidence-window} candidates, so it
 * never decreases when any of those scores increases.
 */
@Component
public class ConfidenceScorer {

  static final String STAR = "⭐";

  private final RankingProperties properties;

  public ConfidenceScorer(RankingProperties properties) {
    this.properties = properties;
  }

  /**
   * Scores a final candidate list.
   *
   * @param ranked final candidates ordered by hybrid score descending
   * @return the confidence summary
   */
  public Confidence score(List<Candidate> ranked) {
    if (ranked.isEmpty()) {
      return Confidence.none();
    }
    int window = Math.min(properties.getConfidenceWindow(), ranked.size());
    double sum = 0.0;
    for (int i = 0; i < window; i++) {
      sum += ranked.get(i).hybridScore();
    }
    double score = Math.max(0.0, Math.min(1.0, sum / window));

    ConfidenceLevel level;
    if (score >= properties.getHighConfidence()) {
      level = ConfidenceLevel.HIGH;
    } else if (score >= properties.getMediumConfidence()) {
      level = ConfidenceLevel.MEDIUM;
    } else {
      level = ConfidenceLevel.LOW;
    }

    int starCount = (int) Math.round(score * 5);
    if (score > 0.0) {
      starCount = Math.max(1, starCount);
    }

    long relevant =
        ranked.stream().filter(c -> c.hybridScore() >= properties.getMediumConfidence()).count();
    String reasoning =
        relevant == 1 ? "1 relevant source found" : relevant + " relevant sources found";

    return new Confidence(level, score, STAR.repeat(starCount), reasoning);
  }
}
