package dev.lyceum.search;

import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Lecture-specific metadata attached to a transcript passage at ingestion time.
 *
 * @param season the lecture season the passage belongs to, if known
 * @param types four-letter type codes discussed in the passage (upper case)
 * @param functions cognitive-function codes covered by the passage (e.g. {@code Ni})
 * @param contentType free-form category label, lower case; empty when unknown
 */
public record PassageMetadata(
    @Nullable Integer season, Set<String> types, Set<String> functions, String contentType) {

  public PassageMetadata {
    types = Set.copyOf(types);
    functions = Set.copyOf(functions);
    contentType = contentType == null ? "" : contentType;
  }

  /** Metadata for a passage that carries no lecture annotations. */
  public static PassageMetadata empty() {
    return new PassageMetadata(null, Set.of(), Set.of(), "");
  }
}
