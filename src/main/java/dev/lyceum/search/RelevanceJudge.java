package dev.lyceum.search;

import java.util.List;

/**
 * External relevance judge rating how well each passage answers a question.
 *
 * <p>Implementations return the judge's raw scores; {@link RelevanceReranker} validates shape and
 * range and degrades to metadata-only ranking on anything unexpected, including exceptions thrown
 * from here.
 */
public interface RelevanceJudge {

  /**
   * Scores a batch of passages in one call.
   *
   * @param question the user question
   * @param passages passage texts, in candidate order
   * @return one score per passage, in the same order, nominally integers 1..10
   */
  List<Integer> scoreBatch(String question, List<String> passages);
}
