package dev.lyceum.search;

import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Features of a user question that drive metadata boosting.
 *
 * @param lowerText the question, lower-cased, for keyword tests
 * @param types type codes named in the question, upper case
 * @param functions function codes named in the question
 * @param season the season explicitly asked about ("season 12"), if any
 */
public record QueryProfile(
    String lowerText, Set<String> types, Set<String> functions, @Nullable Integer season) {

  public QueryProfile {
    types = Set.copyOf(types);
    functions = Set.copyOf(functions);
  }

  /** True if the question contains any of the given lower-case keywords. */
  public boolean mentionsAny(Set<String> keywords) {
    for (String keyword : keywords) {
      if (lowerText.contains(keyword)) {
        return true;
      }
    }
    return false;
  }
}
