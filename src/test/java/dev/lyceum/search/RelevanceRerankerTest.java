package dev.lyceum.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.lyceum.fixture.CandidateBuilder;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@SuppressWarnings("NullAway.Init")
@ExtendWith(MockitoExtension.class)
class RelevanceRerankerTest {

  @Mock RelevanceJudge judge;

  @Captor ArgumentCaptor<List<String>> passagesCaptor;

  RankingProperties properties;

  @BeforeEach
  void setUp() {
    properties = new RankingProperties();
  }

  private RelevanceReranker reranker(Optional<RelevanceJudge> relevanceJudge) {
    return new RelevanceReranker(relevanceJudge, Runnable::run, properties);
  }

  private static List<Candidate> candidates(double... boosted) {
    List<Candidate> list = new ArrayList<>();
    for (int i = 0; i < boosted.length; i++) {
      list.add(
          new CandidateBuilder()
              .id("c" + i)
              .text("passage " + i)
              .similarity(Math.min(1.0, boosted[i]))
              .boosted(boosted[i])
              .mergeOrder(i)
              .build());
    }
    return list;
  }

  @Test
  void blendsBoostedAndRelevanceScores() {
    when(judge.scoreBatch(eq("q"), anyList())).thenReturn(List.of(2, 9));

    RelevanceReranker.Result result =
        reranker(Optional.of(judge)).rerank("q", candidates(0.8, 0.5));

    assertThat(result.judged()).isTrue();
    // c1: 0.5 * 0.4 + 0.9 * 0.6 = 0.74 ; c0: 0.8 * 0.4 + 0.2 * 0.6 = 0.44
    assertThat(result.candidates()).extracting(Candidate::passageId).containsExactly("c1", "c0");
    assertThat(result.candidates().get(0).hybridScore()).isCloseTo(0.74, within(1e-9));
    assertThat(result.candidates().get(0).relevanceScore()).isEqualTo(9);
    assertThat(result.candidates().get(1).hybridScore()).isCloseTo(0.44, within(1e-9));
  }

  @Test
  void boostedScoreAboveOneIsClampedBeforeBlending() {
    properties.setMaxBoostedScore(2.0);
    when(judge.scoreBatch(eq("q"), anyList())).thenReturn(List.of(10));

    RelevanceReranker.Result result = reranker(Optional.of(judge)).rerank("q", candidates(1.6));

    assertThat(result.candidates().get(0).hybridScore()).isCloseTo(1.0, within(1e-9));
  }

  @Test
  void sendsOnlyTopCandidatesByBoostedScoreToJudge() {
    properties.setJudgeCandidates(3);
    properties.setFinalCandidates(2);
    when(judge.scoreBatch(eq("q"), passagesCaptor.capture())).thenReturn(List.of(5, 5, 5));

    RelevanceReranker.Result result =
        reranker(Optional.of(judge)).rerank("q", candidates(0.1, 0.9, 0.5, 0.7));

    assertThat(passagesCaptor.getValue()).containsExactly("passage 1", "passage 3", "passage 2");
    assertThat(result.candidates()).extracting(Candidate::passageId).containsExactly("c1", "c3");
  }

  @Test
  void returnsAtMostFinalCandidates() {
    double[] scores = new double[30];
    Arrays.fill(scores, 0.5);

    RelevanceReranker.Result result = reranker(Optional.empty()).rerank("q", candidates(scores));

    assertThat(result.candidates()).hasSize(12);
  }

  @Test
  void withoutJudgeHybridEqualsBoostedAndRelevanceIsNull() {
    RelevanceReranker.Result result =
        reranker(Optional.empty()).rerank("q", candidates(0.3, 0.6));

    assertThat(result.judged()).isFalse();
    assertThat(result.candidates()).extracting(Candidate::passageId).containsExactly("c1", "c0");
    assertThat(result.candidates())
        .allSatisfy(
            c -> {
              assertThat(c.relevanceScore()).isNull();
              assertThat(c.hybridScore()).isEqualTo(c.boostedScore());
            });
  }

  @Test
  void judgeExceptionDegradesToBoostedRanking() {
    when(judge.scoreBatch(any(), anyList())).thenThrow(new JudgeResponseException("bad reply"));

    RelevanceReranker.Result result =
        reranker(Optional.of(judge)).rerank("q", candidates(0.3, 0.6));

    assertThat(result.judged()).isFalse();
    assertThat(result.candidates()).extracting(Candidate::relevanceScore).containsOnlyNulls();
    assertThat(result.candidates()).extracting(Candidate::hybridScore).containsExactly(0.6, 0.3);
  }

  @Test
  void wrongNumberOfScoresDegrades() {
    when(judge.scoreBatch(any(), anyList())).thenReturn(List.of(7));

    RelevanceReranker.Result result =
        reranker(Optional.of(judge)).rerank("q", candidates(0.3, 0.6));

    assertThat(result.judged()).isFalse();
    assertThat(result.candidates()).extracting(Candidate::relevanceScore).containsOnlyNulls();
  }

  @Test
  void outOfRangeScoreDegrades() {
    when(judge.scoreBatch(any(), anyList())).thenReturn(List.of(7, 11));

    RelevanceReranker.Result result =
        reranker(Optional.of(judge)).rerank("q", candidates(0.3, 0.6));

    assertThat(result.judged()).isFalse();
  }

  @Test
  void zeroScoreDegrades() {
    when(judge.scoreBatch(any(), anyList())).thenReturn(List.of(0, 5));

    RelevanceReranker.Result result =
        reranker(Optional.of(judge)).rerank("q", candidates(0.3, 0.6));

    assertThat(result.judged()).isFalse();
  }

  @Test
  void slowJudgeTimesOutAndDegrades() {
    properties.setJudgeTimeout(Duration.ofMillis(100));
    when(judge.scoreBatch(any(), anyList()))
        .thenAnswer(
            invocation -> {
              Thread.sleep(5_000);
              return List.of(10, 10);
            });
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      RelevanceReranker slow = new RelevanceReranker(Optional.of(judge), executor, properties);

      long start = System.nanoTime();
      RelevanceReranker.Result result = slow.rerank("q", candidates(0.3, 0.6));
      long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

      assertThat(result.judged()).isFalse();
      assertThat(result.candidates()).extracting(Candidate::hybridScore).containsExactly(0.6, 0.3);
      assertThat(elapsedMillis).isLessThan(3_000);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void saturatedExecutorDegrades() {
    RelevanceReranker saturated =
        new RelevanceReranker(
            Optional.of(judge),
            command -> {
              throw new RejectedExecutionException("full");
            },
            properties);

    RelevanceReranker.Result result = saturated.rerank("q", candidates(0.3, 0.6));

    assertThat(result.judged()).isFalse();
    verify(judge, never()).scoreBatch(any(), anyList());
  }

  @Test
  void emptyInputSkipsJudge() {
    RelevanceReranker.Result result = reranker(Optional.of(judge)).rerank("q", List.of());

    assertThat(result.candidates()).isEmpty();
    assertThat(result.judged()).isFalse();
    verify(judge, never()).scoreBatch(any(), anyList());
  }

  @Test
  void tiesBreakOnSimilarityThenMergeOrder() {
    Candidate first =
        new CandidateBuilder().id("first").similarity(0.4).boosted(0.7).mergeOrder(0).build();
    Candidate higherSimilarity =
        new CandidateBuilder().id("sim").similarity(0.6).boosted(0.7).mergeOrder(1).build();
    Candidate later =
        new CandidateBuilder().id("later").similarity(0.4).boosted(0.7).mergeOrder(2).build();

    RelevanceReranker.Result result =
        reranker(Optional.empty()).rerank("q", List.of(later, first, higherSimilarity));

    assertThat(result.candidates())
        .extracting(Candidate::passageId)
        .containsExactly("sim", "first", "later");
  }
}
