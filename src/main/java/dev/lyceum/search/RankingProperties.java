package dev.lyceum.search;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the retrieval-and-ranking pipeline.
 *
 * <p>Properties are bound from {@code lyceum.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code top-k} - hits requested from the vector index per query variant (default 30)
 *   <li>{@code retrieval-timeout} - upper bound for one variant's retrieval (default 10s)
 *   <li>{@code max-query-variants} - cap on expanded variants, original included (default 4)
 *   <li>{@code metadata-filter} - restrict the search for the question as asked to the types and
 *       season it names (default true)
 *   <li>{@code judge-candidates} - how many boosted candidates go to the relevance judge (default
 *       20)
 *   <li>{@code judge-timeout} - upper bound for the batched judge call (default 8s)
 *   <li>{@code final-candidates} - size of the final ranked set (default 12)
 *   <li>{@code boosted-weight} / {@code relevance-weight} - hybrid blend weights, must sum to 1
 *       (default 0.4 / 0.6)
 *   <li>{@code max-boosted-score} - clamp applied after metadata boosts (default 1.0)
 *   <li>{@code high-confidence} / {@code medium-confidence} - confidence level thresholds (default
 *       0.75 / 0.5)
 *   <li>{@code confidence-window} - number of top candidates averaged for confidence (default 5)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "lyceum.search")
public class RankingProperties {

  private static final double WEIGHT_TOLERANCE = 1e-9;

  private int topK = 30;
  private Duration retrievalTimeout = Duration.ofSeconds(10);
  private int maxQueryVariants = 4;
  private boolean metadataFilter = true;
  private int judgeCandidates = 20;
  private Duration judgeTimeout = Duration.ofSeconds(8);
  private int finalCandidates = 12;
  private double boostedWeight = 0.4;
  private double relevanceWeight = 0.6;
  private double maxBoostedScore = 1.0;
  private double highConfidence = 0.75;
  private double mediumConfidence = 0.5;
  private int confidenceWindow = 5;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (topK < 1 || topK > 200) {
      throw new IllegalStateException("lyceum.search.top-k must be in [1, 200], got: " + topK);
    }
    requirePositive("retrieval-timeout", retrievalTimeout);
    requirePositive("judge-timeout", judgeTimeout);
    if (maxQueryVariants < 1) {
      throw new IllegalStateException(
          "lyceum.search.max-query-variants must be >= 1, got: " + maxQueryVariants);
    }
    if (finalCandidates < 1) {
      throw new IllegalStateException(
          "lyceum.search.final-candidates must be >= 1, got: " + finalCandidates);
    }
    if (judgeCandidates < finalCandidates) {
      throw new IllegalStateException(
          "lyceum.search.judge-candidates must be >= final-candidates ("
              + finalCandidates
              + "), got: "
              + judgeCandidates);
    }
    if (boostedWeight < 0.0 || relevanceWeight < 0.0) {
      throw new IllegalStateException("lyceum.search blend weights must not be negative");
    }
    if (Math.abs(boostedWeight + relevanceWeight - 1.0) > WEIGHT_TOLERANCE) {
      throw new IllegalStateException(
          "lyceum.search.boosted-weight + relevance-weight must equal 1.0, got: "
              + (boostedWeight + relevanceWeight));
    }
    if (maxBoostedScore <= 0.0) {
      throw new IllegalStateException(
          "lyceum.search.max-boosted-score must be > 0, got: " + maxBoostedScore);
    }
    if (!(mediumConfidence > 0.0 && mediumConfidence < highConfidence && highConfidence <= 1.0)) {
      throw new IllegalStateException(
          "lyceum.search confidence thresholds must satisfy 0 < medium < high <= 1, got: medium="
              + mediumConfidence
              + ", high="
              + highConfidence);
    }
    if (confidenceWindow < 1) {
      throw new IllegalStateException(
          "lyceum.search.confidence-window must be >= 1, got: " + confidenceWindow);
    }
  }

  private static void requirePositive(String name, Duration value) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new IllegalStateException("lyceum.search." + name + " must be positive, got: " + value);
    }
  }

  public int getTopK() {
    return topK;
  }

  public void setTopK(int topK) {
    this.topK = topK;
  }

  public Duration getRetrievalTimeout() {
    return retrievalTimeout;
  }

  public void setRetrievalTimeout(Duration retrievalTimeout) {
    this.retrievalTimeout = retrievalTimeout;
  }

  public int getMaxQueryVariants() {
    return maxQueryVariants;
  }

  public void setMaxQueryVariants(int maxQueryVariants) {
    this.maxQueryVariants = maxQueryVariants;
  }

  public boolean isMetadataFilter() {
    return metadataFilter;
  }

  public void setMetadataFilter(boolean metadataFilter) {
    this.metadataFilter = metadataFilter;
  }

  public int getJudgeCandidates() {
    return judgeCandidates;
  }

  public void setJudgeCandidates(int judgeCandidates) {
    this.judgeCandidates = judgeCandidates;
  }

  public Duration getJudgeTimeout() {
    return judgeTimeout;
  }

  public void setJudgeTimeout(Duration judgeTimeout) {
    this.judgeTimeout = judgeTimeout;
  }

  public int getFinalCandidates() {
    return finalCandidates;
  }

  public void setFinalCandidates(int finalCandidates) {
    this.finalCandidates = finalCandidates;
  }

  public double getBoostedWeight() {
    return boostedWeight;
  }

  public void setBoostedWeight(double boostedWeight) {
    this.boostedWeight = boostedWeight;
  }

  public double getRelevanceWeight() {
    return relevanceWeight;
  }

  public void setRelevanceWeight(double relevanceWeight) {
    this.relevanceWeight = relevanceWeight;
  }

  public double getMaxBoostedScore() {
    return maxBoostedScore;
  }

  public void setMaxBoostedScore(double maxBoostedScore) {
    this.maxBoostedScore = maxBoostedScore;
  }

  public double getHighConfidence() {
    return highConfidence;
  }

  public void setHighConfidence(double highConfidence) {
    this.highConfidence = highConfidence;
  }

  public double getMediumConfidence() {
    return mediumConfidence;
  }

  public void setMediumConfidence(double mediumConfidence) {
    this.mediumConfidence = mediumConfidence;
  }

  public int getConfidenceWindow() {
    return confidenceWindow;
  }

  public void setConfidenceWindow(int confidenceWindow) {
    this.confidenceWindow = confidenceWindow;
  }
}
