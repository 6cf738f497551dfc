package dev.lyceum.search;

import java.util.List;

/**
 * Nearest-neighbour search over the lecture passage index.
 *
 * <p>Implementations may block and may throw; {@link RetrievalPipeline} runs each call on the
 * retrieval executor under {@code lyceum.search.retrieval-timeout} and treats a timeout or exception
 * as an empty result for that query.
 */
public interface VectorRetriever {

  /**
   * Finds the passages most similar to a query.
   *
   * @param query query text
   * @param topK maximum number of hits
   * @return hits ordered by similarity descending
   */
  List<RetrievedPassage> search(String query, int topK);

  /**
   * Finds the passages most similar to a query among those matching a metadata filter.
   * Implementations that cannot filter ignore it; metadata boosting still favours matching
   * passages afterwards.
   *
   * @param query query text
   * @param topK maximum number of hits
   * @param filter metadata restriction, {@link RetrievalFilter#NONE} for none
   * @return hits ordered by similarity descending
   */
  default List<RetrievedPassage> search(String query, int topK, RetrievalFilter filter) {
    return search(query, topK);
  }
}
