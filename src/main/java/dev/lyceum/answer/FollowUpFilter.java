package dev.lyceum.answer;

import java.util.Optional;

/**
 * Separates the answer text shown to the user from the trailing follow-up suggestion.
 *
 * <p>The generation prompt asks for a final line {@code [[FOLLOW-UP]] <question>}. While chunks
 * stream in, {@link #accept} returns only text that can no longer turn out to be part of the
 * marker: a suffix that matches a prefix of the marker is held back until the next chunk decides
 * it, and everything from the marker on is withheld. {@link #finish} releases held-back text when
 * no marker followed and parses the trailer.
 *
 * <p>The trailer is accepted as a follow-up only if, once trimmed, it is a single non-empty line of
 * at most {@value #MAX_FOLLOW_UP_LENGTH} characters. Anything else is dropped; it is never shown.
 *
 * <p>Not thread-safe; one instance per answer, fed from one thread at a time.
 */
public class FollowUpFilter {

  public static final String MARKER = "[[FOLLOW-UP]]";

  static final int MAX_FOLLOW_UP_LENGTH = 300;

  private final StringBuilder pending = new StringBuilder();
  private final StringBuilder shown = new StringBuilder();
  private final StringBuilder trailer = new StringBuilder();
  private boolean markerSeen;

  /**
   * Feeds the next generated chunk.
   *
   * @param chunk generated text
   * @return text that may be relayed now, possibly empty
   */
  public String accept(String chunk) {
    if (markerSeen) {
      trailer.append(chunk);
      return "";
    }
    pending.append(chunk);

    int markerAt = pending.indexOf(MARKER);
    if (markerAt >= 0) {
      markerSeen = true;
      String released = pending.substring(0, markerAt);
      trailer.append(pending, markerAt + MARKER.length(), pending.length());
      pending.setLength(0);
      shown.append(released);
      return released;
    }

    int held = longestMarkerPrefixSuffix(pending);
    String released = pending.substring(0, pending.length() - held);
    pending.delete(0, pending.length() - held);
    shown.append(released);
    return released;
  }

  /**
   * Ends the stream.
   *
   * @return the remaining text to relay, the full shown answer and the follow-up, if valid
   */
  public Outcome finish() {
    String tail = pending.toString();
    pending.setLength(0);
    shown.append(tail);
    Optional<String> followUp = markerSeen ? parseTrailer(trailer.toString()) : Optional.empty();
    return new Outcome(tail, shown.toString().strip(), followUp);
  }

  static Optional<String> parseTrailer(String raw) {
    String candidate = raw.strip();
    if (candidate.isEmpty()
        || candidate.length() > MAX_FOLLOW_UP_LENGTH
        || candidate.indexOf('\n') >= 0
        || candidate.indexOf('\r') >= 0
        || candidate.contains("[[")) {
      return Optional.empty();
    }
    return Optional.of(candidate);
  }

  /** Length of the longest suffix of {@code text} that is a proper prefix of the marker. */
  private static int longestMarkerPrefixSuffix(CharSequence text) {
    int max = Math.min(text.length(), MARKER.length() - 1);
    for (int len = max; len > 0; len--) {
      boolean matches = true;
      for (int i = 0; i < len; i++) {
        if (text.charAt(text.length() - len + i) != MARKER.charAt(i)) {
          matches = false;
          break;
        }
      }
      if (matches) {
        return len;
      }
    }
    return 0;
  }

  /**
   * Result of a finished stream.
   *
   * @param tail held-back text still to be relayed, possibly empty
   * @param answer everything shown to the user, trimmed
   * @param followUp the follow-up question, if the trailer was valid
   */
  public record Outcome(String tail, String answer, Optional<String> followUp) {}
}
