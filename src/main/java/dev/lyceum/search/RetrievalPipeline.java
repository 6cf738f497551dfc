package dev.lyceum.search;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Retrieval-and-ranking orchestration for one question.
 *
 * <p>Pipeline: expand the question into variants -> retrieve each variant concurrently on the
 * retrieval executor (each bounded by {@code retrieval-timeout}) -> merge and deduplicate -> apply
 * metadata boosts -> blend with relevance judgments -> score confidence.
 *
 * <p>The question as asked is searched with a {@link RetrievalFilter} on the types and season it
 * names; expanded variants search unfiltered, so a filter matching nothing only narrows one query.
 *
 * <p>A timed-out retrieval is abandoned, not interrupted: the call keeps its executor thread until
 * the retriever returns, so retrievers must bound their own I/O.
 *
 * <p>A variant whose retrieval times out or fails contributes no hits and is logged at WARN; the
 * remaining variants still count. If every variant fails the result is simply empty with low
 * confidence.
 */
@Service
public class RetrievalPipeline {

  private static final Logger log = LoggerFactory.getLogger(RetrievalPipeline.class);

  private final QueryExpander queryExpander;
  private final QueryAnalyzer queryAnalyzer;
  private final VectorRetriever vectorRetriever;
  private final CandidateMerger candidateMerger;
  private final MetadataReranker metadataReranker;
  private final RelevanceReranker relevanceReranker;
  private final ConfidenceScorer confidenceScorer;
  private final RankingProperties properties;
  private final Executor executor;

  public RetrievalPipeline(
      QueryExpander queryExpander,
      QueryAnalyzer queryAnalyzer,
      VectorRetriever vectorRetriever,
      CandidateMerger candidateMerger,
      MetadataReranker metadataReranker,
      RelevanceReranker relevanceReranker,
      ConfidenceScorer confidenceScorer,
      RankingProperties properties,
      @Qualifier("retrievalExecutor") Executor executor) {
    this.queryExpander = queryExpander;
    this.queryAnalyzer = queryAnalyzer;
    this.vectorRetriever = vectorRetriever;
    this.candidateMerger = candidateMerger;
    this.metadataReranker = metadataReranker;
    this.relevanceReranker = relevanceReranker;
    this.confidenceScorer = confidenceScorer;
    this.properties = properties;
    this.executor = executor;
  }

  /**
   * Runs the full pipeline.
   *
   * @param question the user question, not blank
   * @return ranked passages with confidence; empty when nothing could be retrieved
   * @throws IllegalArgumentException if the question is blank
   */
  public RankedPassages retrieve(String question) {
    if (question == null || question.isBlank()) {
      throw new IllegalArgumentException("Question must not be blank");
    }

    List<String> variants = queryExpander.expand(question);
    QueryProfile profile = queryAnalyzer.analyze(question);
    RetrievalFilter filter =
        properties.isMetadataFilter() ? RetrievalFilter.from(profile) : RetrievalFilter.NONE;

    List<CompletableFuture<List<RetrievedPassage>>> pending = new ArrayList<>();
    for (int i = 0; i < variants.size(); i++) {
      pending.add(retrieveVariant(variants.get(i), i == 0 ? filter : RetrievalFilter.NONE));
    }
    List<List<RetrievedPassage>> perVariant =
        pending.stream().map(CompletableFuture::join).toList();

    List<Candidate> merged = candidateMerger.merge(perVariant);
    List<Candidate> boosted = metadataReranker.rerank(profile, merged);
    RelevanceReranker.Result ranked = relevanceReranker.rerank(question, boosted);
    Confidence confidence = confidenceScorer.score(ranked.candidates());

    log.debug(
        "Retrieved {} variant(s) -> {} merged -> {} final, judged={}, confidence={}",
        variants.size(),
        merged.size(),
        ranked.candidates().size(),
        ranked.judged(),
        confidence.level());
    return new RankedPassages(
        question, variants, ranked.candidates(), confidence, ranked.judged());
  }

  /** Retrieves one variant; never completes exceptionally. */
  private CompletableFuture<List<RetrievedPassage>> retrieveVariant(
      String variant, RetrievalFilter filter) {
    if (!filter.isEmpty()) {
      log.debug("Filtering variant '{}' by {}", abbreviate(variant), filter);
    }
    CompletableFuture<List<RetrievedPassage>> call;
    try {
      call =
          CompletableFuture.supplyAsync(
              () -> vectorRetriever.search(variant, properties.getTopK(), filter), executor);
    } catch (RejectedExecutionException e) {
      log.warn("Retrieval skipped for variant '{}': executor saturated", abbreviate(variant));
      return CompletableFuture.completedFuture(List.of());
    }
    return call.orTimeout(properties.getRetrievalTimeout().toMillis(), TimeUnit.MILLISECONDS)
        .exceptionally(
            ex -> {
              Throwable cause =
                  ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
              if (cause instanceof TimeoutException) {
                log.warn(
                    "Retrieval timed out after {} for variant '{}'",
                    properties.getRetrievalTimeout(),
                    abbreviate(variant));
              } else {
                log.warn(
                    "Retrieval failed for variant '{}': {}", abbreviate(variant), cause.toString());
              }
              return List.of();
            });
  }

  private static String abbreviate(String text) {
    return text.length() > 60 ? text.substring(0, 60) + "..." : text;
  }
}
