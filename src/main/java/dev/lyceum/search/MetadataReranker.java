package dev.lyceum.search;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Adds rule-based boosts to each candidate's similarity score from the lecture metadata.
 *
 * <p>{@code boosted = min(maxBoostedScore, similarity + sum of matching rule boosts)}. A candidate
 * that matches no rule keeps {@code boosted == similarity}. Candidate order is not changed here.
 */
@Component
public class MetadataReranker {

  private static final Logger log = LoggerFactory.getLogger(MetadataReranker.class);

  private final List<BoostRule> rules;
  private final double maxBoostedScore;

  public MetadataReranker(RankingProperties properties) {
    this(BoostRule.defaults(), properties.getMaxBoostedScore());
  }

  MetadataReranker(List<BoostRule> rules, double maxBoostedScore) {
    this.rules = List.copyOf(rules);
    this.maxBoostedScore = maxBoostedScore;
  }

  /**
   * Computes boosted scores for all candidates.
   *
   * @param query features of the user question
   * @param candidates merged candidates
   * @return new candidates, same order, with {@code boostedScore} (and {@code hybridScore}) set
   */
  public List<Candidate> rerank(QueryProfile query, List<Candidate> candidates) {
    List<Candidate> boosted = new ArrayList<>(candidates.size());
    int touched = 0;
    for (Candidate candidate : candidates) {
      double boost = 0.0;
      for (BoostRule rule : rules) {
        boost += rule.boost(query, candidate.metadata());
      }
      if (boost == 0.0) {
        boosted.add(candidate.withBoostedScore(candidate.similarityScore()));
        continue;
      }
      touched++;
      double score = Math.min(maxBoostedScore, candidate.similarityScore() + boost);
      boosted.add(candidate.withBoostedScore(score));
    }
    log.debug("Metadata boosts applied to {} of {} candidate(s)", touched, candidates.size());
    return List.copyOf(boosted);
  }
}
