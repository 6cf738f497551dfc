package dev.lyceum.search;

import java.util.List;
import java.util.TreeSet;
import org.jspecify.annotations.Nullable;

/**
 * Metadata restriction for a vector search: passages must discuss at least one of {@code types}
 * (when any are given) and belong to {@code season} (when set).
 *
 * @param types type codes, upper case, sorted
 * @param season the season to restrict to, if any
 */
public record RetrievalFilter(List<String> types, @Nullable Integer season) {

  public static final RetrievalFilter NONE = new RetrievalFilter(List.of(), null);

  public RetrievalFilter {
    types = List.copyOf(new TreeSet<>(types));
  }

  /** Filter on the types and the explicit season the question names. */
  public static RetrievalFilter from(QueryProfile profile) {
    return new RetrievalFilter(List.copyOf(profile.types()), profile.season());
  }

  public boolean isEmpty() {
    return types.isEmpty() && season == null;
  }
}
