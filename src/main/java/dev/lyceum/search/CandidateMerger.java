package dev.lyceum.search;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Merges the per-variant hit lists into one deduplicated candidate list.
 *
 * <p>Passages are keyed by {@link PassageIdentity}. When several variants return the same passage,
 * the hit with the highest similarity wins (its metadata included), while the candidate keeps the
 * position at which the passage was first seen.
 */
@Component
public class CandidateMerger {

  private static final Logger log = LoggerFactory.getLogger(CandidateMerger.class);

  /**
   * Merges hit lists in variant order.
   *
   * @param perVariant hit lists, one per query variant, each possibly empty
   * @return deduplicated candidates in first-seen order
   */
  public List<Candidate> merge(List<List<RetrievedPassage>> perVariant) {
    // LinkedHashMap keeps first-seen order even when a later hit replaces the value
    Map<String, Candidate> byIdentity = new LinkedHashMap<>();
    int total = 0;
    for (List<RetrievedPassage> hits : perVariant) {
      for (RetrievedPassage hit : hits) {
        total++;
        String id = PassageIdentity.of(hit);
        Candidate existing = byIdentity.get(id);
        if (existing == null) {
          byIdentity.put(id, Candidate.merged(id, hit, byIdentity.size()));
        } else if (hit.similarityScore() > existing.similarityScore()) {
          byIdentity.put(id, Candidate.merged(id, hit, existing.mergeOrder()));
        }
      }
    }
    log.debug("Merged {} hit(s) into {} unique candidate(s)", total, byIdentity.size());
    return List.copyOf(byIdentity.values());
  }
}
