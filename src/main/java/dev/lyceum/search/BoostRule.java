package dev.lyceum.search;

import java.util.List;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.function.ToIntBiFunction;

/**
 * One entry of the metadata boost table: a matcher over the question profile and the passage
 * metadata, and the weight added per match.
 *
 * <p>Most rules match at most once; the type and function rules count one match per code shared by
 * question and passage.
 *
 * @param name short name used in debug logs
 * @param matcher number of times the rule matches (0 when it does not apply)
 * @param weight boost added per match
 */
public record BoostRule(
    String name, ToIntBiFunction<QueryProfile, PassageMetadata> matcher, double weight) {

  static final Set<String> RELATIONSHIP_KEYWORDS =
      Set.of("relationship", "compatible", "compatibility", "dating", "romantic", "partner",
          "marriage", "pair", "social");

  static final Set<String> DEVELOPMENT_KEYWORDS =
      Set.of("octagram", "development", "growth", "mature", "sophisticated", "integrated");

  static final Set<String> FUNCTION_KEYWORDS =
      Set.of("function", "cognitive", "hero", "parent", "child", "inferior", "demon", "nemesis",
          "critic", "trickster");

  /** Rule that contributes its weight once when the predicate holds. */
  public static BoostRule when(
      String name, BiPredicate<QueryProfile, PassageMetadata> predicate, double weight) {
    return new BoostRule(name, (query, passage) -> predicate.test(query, passage) ? 1 : 0, weight);
  }

  /** Rule that contributes its weight once per counted match. */
  public static BoostRule perMatch(
      String name, ToIntBiFunction<QueryProfile, PassageMetadata> counter, double weight) {
    return new BoostRule(name, counter, weight);
  }

  /** Boost this rule adds for the given question and passage. */
  public double boost(QueryProfile query, PassageMetadata passage) {
    return matcher.applyAsInt(query, passage) * weight;
  }

  /** The lecture boost table. */
  public static List<BoostRule> defaults() {
    return List.of(
        perMatch("type match", (q, p) -> countShared(q.types(), p.types()), 0.12),
        perMatch("function match", (q, p) -> countShared(q.functions(), p.functions()), 0.08),
        when(
            "explicit season",
            (q, p) -> q.season() != null && q.season().equals(p.season()),
            0.10),
        when("latest seasons", (q, p) -> p.season() != null && p.season() >= 20, 0.06),
        when(
            "recent seasons",
            (q, p) -> p.season() != null && p.season() >= 15 && p.season() < 20,
            0.03),
        when(
            "relationship intent",
            (q, p) ->
                q.mentionsAny(RELATIONSHIP_KEYWORDS) && p.contentType().contains("relationship"),
            0.10),
        when(
            "development intent",
            (q, p) ->
                q.mentionsAny(DEVELOPMENT_KEYWORDS)
                    && (p.contentType().contains("octagram")
                        || p.contentType().contains("development")),
            0.15),
        when(
            "function intent",
            (q, p) ->
                q.mentionsAny(FUNCTION_KEYWORDS)
                    && (p.contentType().contains("function")
                        || p.contentType().contains("cognitive")),
            0.08),
        when(
            "type comparison",
            (q, p) ->
                q.types().size() >= 2
                    && (p.contentType().contains("comparison")
                        || p.contentType().contains("dynamics")),
            0.10));
  }

  private static int countShared(Set<String> asked, Set<String> covered) {
    int shared = 0;
    for (String code : asked) {
      if (covered.contains(code)) {
        shared++;
      }
    }
    return shared;
  }
}
