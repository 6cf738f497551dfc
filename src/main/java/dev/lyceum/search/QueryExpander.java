package dev.lyceum.search;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Rule-based query expansion for multi-query retrieval over lecture transcripts.
 *
 * <p>Produces up to {@code lyceum.search.max-query-variants} variants of a question, the original
 * always first:
 *
 * <ol>
 *   <li>type codes spelled out ({@code INTJ} becomes {@code INTJ (Introverted Intuitive Thinking
 *       Judging)})
 *   <li>function codes spelled out ({@code Ni} becomes {@code Ni (Introverted Intuition)})
 *   <li>one variant per matched topic category, with the category's related lecture terms appended
 * </ol>
 *
 * <p>Variants are deduplicated case-insensitively. A code that is already followed by a
 * parenthesised long form is left alone, so expanding an expanded query adds nothing new.
 */
@Component
public class QueryExpander {

  private static final Logger log = LoggerFactory.getLogger(QueryExpander.class);

  /** Topic categories in priority order: triggers (lower case) and the terms they append. */
  static final List<TopicCategory> CATEGORIES =
      List.of(
          new TopicCategory(
              "negative behavior",
              Set.of(
                  "negative", "bad behavior", "toxic", "dark side", "unhealthy", "worst",
                  "stress"),
              "shadow functions demon inferior grip"),
          new TopicCategory(
              "relationship",
              Set.of(
                  "relationship", "compatible", "compatibility", "pair", "dating", "romantic",
                  "partner", "interact"),
              "compatibility golden pair pedagogue pair interaction"),
          new TopicCategory(
              "development",
              Set.of("growth", "develop", "mature", "improve"),
              "octagram development integration"),
          new TopicCategory(
              "four sides",
              Set.of("subconscious", "unconscious", "superego", "shadow"),
              "four sides ego subconscious unconscious superego"));

  private static final Pattern UNEXPANDED_TYPE =
      Pattern.compile(TypeVocabulary.TYPE_CODE.pattern() + "(?!\\s*\\()", Pattern.CASE_INSENSITIVE);

  private static final Pattern UNEXPANDED_FUNCTION =
      Pattern.compile(TypeVocabulary.FUNCTION_CODE.pattern() + "(?!\\s*\\()");

  private final int maxVariants;

  public QueryExpander(RankingProperties properties) {
    this(properties.getMaxQueryVariants());
  }

  QueryExpander(int maxVariants) {
    this.maxVariants = maxVariants;
  }

  /**
   * Expands a question into retrieval variants.
   *
   * @param question the user question
   * @return a non-empty list with the original question first, at most {@code maxVariants} long
   */
  public List<String> expand(String question) {
    List<String> candidates = new ArrayList<>();
    candidates.add(question);
    candidates.add(spellOut(question, UNEXPANDED_TYPE, true));
    candidates.add(spellOut(question, UNEXPANDED_FUNCTION, false));

    String lower = question.toLowerCase(Locale.ROOT);
    for (TopicCategory category : CATEGORIES) {
      if (category.matches(lower) && !lower.contains(category.terms())) {
        candidates.add(question + " " + category.terms());
      }
    }

    Set<String> seen = new LinkedHashSet<>();
    List<String> variants = new ArrayList<>();
    for (String candidate : candidates) {
      if (seen.add(candidate.strip().toLowerCase(Locale.ROOT))) {
        variants.add(candidate);
        if (variants.size() >= maxVariants) {
          break;
        }
      }
    }

    log.debug("Expanded question into {} variant(s)", variants.size());
    return variants;
  }

  private static String spellOut(String question, Pattern codes, boolean typeCodes) {
    Matcher matcher = codes.matcher(question);
    StringBuilder sb = new StringBuilder();
    while (matcher.find()) {
      String code = matcher.group(1);
      String longForm =
          typeCodes ? TypeVocabulary.typeLongForm(code) : TypeVocabulary.functionLongForm(code);
      matcher.appendReplacement(sb, Matcher.quoteReplacement(code + " (" + longForm + ")"));
    }
    matcher.appendTail(sb);
    return sb.toString();
  }

  /** A topic category whose presence in a question pulls in related lecture vocabulary. */
  record TopicCategory(String name, Set<String> triggers, String terms) {

    boolean matches(String lowerQuestion) {
      for (String trigger : triggers) {
        if (lowerQuestion.contains(trigger)) {
          return true;
        }
      }
      return false;
    }
  }
}
