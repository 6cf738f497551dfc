package dev.lyceum.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Blends boosted scores with relevance judgments into the final ranking.
 *
 * <p>The top {@code judge-candidates} by boosted score are sent to the {@link RelevanceJudge} in one
 * batched call, bounded by {@code judge-timeout}. On a valid reply each candidate gets {@code
 * hybrid = clamp01(boosted) * boostedWeight + (relevance / 10) * relevanceWeight}. If no judge is
 * configured, or the call fails, times out or returns scores of the wrong shape, every candidate
 * keeps {@code relevance = null} and {@code hybrid = boosted}. Ranking failures never propagate.
 *
 * <p>Ordering: hybrid descending, then similarity descending, then merge order.
 *
 * <p>A judge call that misses the deadline is cancelled but not interrupted; the judge client's
 * own timeout is what frees the thread.
 */
@Component
public class RelevanceReranker {

  private static final Logger log = LoggerFactory.getLogger(RelevanceReranker.class);

  static final Comparator<Candidate> BY_BOOSTED =
      Comparator.comparingDouble(Candidate::boostedScore)
          .reversed()
          .thenComparing(Comparator.comparingDouble(Candidate::similarityScore).reversed())
          .thenComparingInt(Candidate::mergeOrder);

  static final Comparator<Candidate> BY_HYBRID =
      Comparator.comparingDouble(Candidate::hybridScore)
          .reversed()
          .thenComparing(Comparator.comparingDouble(Candidate::similarityScore).reversed())
          .thenComparingInt(Candidate::mergeOrder);

  private final Optional<RelevanceJudge> judge;
  private final Executor executor;
  private final RankingProperties properties;

  public RelevanceReranker(
      Optional<RelevanceJudge> judge,
      @Qualifier("retrievalExecutor") Executor executor,
      RankingProperties properties) {
    this.judge = judge;
    this.executor = executor;
    this.properties = properties;
    if (judge.isPresent()) {
      log.info("Relevance judge configured; hybrid ranking enabled");
    } else {
      log.info("No relevance judge configured; ranking on similarity and metadata only");
    }
  }

  /** Outcome of the relevance stage. */
  public record Result(List<Candidate> candidates, boolean judged) {}

  /**
   * Ranks boosted candidates.
   *
   * @param question the user question
   * @param boosted candidates with boosted scores, any order
   * @return at most {@code final-candidates} candidates ordered by hybrid score
   */
  public Result rerank(String question, List<Candidate> boosted) {
    List<Candidate> shortlist =
        boosted.stream().sorted(BY_BOOSTED).limit(properties.getJudgeCandidates()).toList();

    Optional<List<Integer>> scores = judge(question, shortlist);
    List<Candidate> scored =
        scores.map(s -> blend(shortlist, s)).orElseGet(() -> withoutJudgment(shortlist));

    List<Candidate> ranked =
        scored.stream().sorted(BY_HYBRID).limit(properties.getFinalCandidates()).toList();
    return new Result(ranked, scores.isPresent());
  }

  private Optional<List<Integer>> judge(String question, List<Candidate> shortlist) {
    if (judge.isEmpty() || shortlist.isEmpty()) {
      return Optional.empty();
    }
    RelevanceJudge relevanceJudge = judge.get();
    List<String> passages = shortlist.stream().map(Candidate::text).toList();

    Future<List<Integer>> call;
    try {
      call =
          CompletableFuture.supplyAsync(
              () -> relevanceJudge.scoreBatch(question, passages), executor);
    } catch (RejectedExecutionException e) {
      log.warn("Relevance judge skipped: executor saturated");
      return Optional.empty();
    }

    List<Integer> scores;
    try {
      scores = call.get(properties.getJudgeTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      call.cancel(true);
      log.warn("Relevance judge timed out after {}", properties.getJudgeTimeout());
      return Optional.empty();
    } catch (ExecutionException e) {
      log.warn("Relevance judge failed: {}", e.getCause() == null ? e : e.getCause().toString());
      return Optional.empty();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Relevance judge interrupted");
      return Optional.empty();
    }

    if (scores == null || scores.size() != shortlist.size()) {
      log.warn(
          "Relevance judge returned {} score(s) for {} passage(s); ignoring",
          scores == null ? 0 : scores.size(),
          shortlist.size());
      return Optional.empty();
    }
    for (Integer score : scores) {
      if (score == null || score < 1 || score > 10) {
        log.warn("Relevance judge returned out-of-range score {}; ignoring", score);
        return Optional.empty();
      }
    }
    return Optional.of(scores);
  }

  private List<Candidate> blend(List<Candidate> shortlist, List<Integer> scores) {
    List<Candidate> blended = new ArrayList<>(shortlist.size());
    for (int i = 0; i < shortlist.size(); i++) {
      Candidate candidate = shortlist.get(i);
      int relevance = scores.get(i);
      double boosted = Math.max(0.0, Math.min(1.0, candidate.boostedScore()));
      double hybrid =
          boosted * properties.getBoostedWeight()
              + (relevance / 10.0) * properties.getRelevanceWeight();
      blended.add(candidate.withRelevance(relevance, hybrid));
    }
    return blended;
  }

  private static List<Candidate> withoutJudgment(List<Candidate> shortlist) {
    return shortlist.stream().map(c -> c.withRelevance(null, c.boostedScore())).toList();
  }
}
