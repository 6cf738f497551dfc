package dev.lyceum.search;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The typology vocabulary shared by query analysis and query expansion: the sixteen four-letter
 * type codes and the eight cognitive-function codes, with their descriptive long forms.
 */
public final class TypeVocabulary {

  /** Four-letter type codes, matched case-insensitively on word boundaries. */
  static final Pattern TYPE_CODE =
      Pattern.compile("\\b([IE][NS][TF][JP])\\b", Pattern.CASE_INSENSITIVE);

  /** Cognitive-function codes, matched case-sensitively so "Se" is not confused with "se". */
  static final Pattern FUNCTION_CODE = Pattern.compile("\\b([NSTF][ie])\\b");

  private static final Map<Character, String> LETTER_NAMES =
      Map.of(
          'I', "Introverted",
          'E', "Extraverted",
          'N', "Intuitive",
          'S', "Sensing",
          'T', "Thinking",
          'F', "Feeling",
          'J', "Judging",
          'P', "Perceiving");

  private static final Map<String, String> FUNCTION_NAMES =
      Map.of(
          "Ni", "Introverted Intuition",
          "Ne", "Extraverted Intuition",
          "Si", "Introverted Sensing",
          "Se", "Extraverted Sensing",
          "Ti", "Introverted Thinking",
          "Te", "Extraverted Thinking",
          "Fi", "Introverted Feeling",
          "Fe", "Extraverted Feeling");

  private TypeVocabulary() {
    // utility class
  }

  /**
   * Returns the descriptive long form of a type code, e.g. {@code INTJ} becomes "Introverted
   * Intuitive Thinking Judging".
   *
   * @param code a four-letter type code in any case
   * @return the long form
   * @throws IllegalArgumentException if the code is not a valid type code
   */
  public static String typeLongForm(String code) {
    String upper = code.toUpperCase(Locale.ROOT);
    if (!TYPE_CODE.matcher(upper).matches()) {
      throw new IllegalArgumentException("Not a type code: " + code);
    }
    StringBuilder sb = new StringBuilder();
    for (char letter : upper.toCharArray()) {
      if (sb.length() > 0) {
        sb.append(' ');
      }
      sb.append(LETTER_NAMES.get(letter));
    }
    return sb.toString();
  }

  /**
   * Returns the descriptive long form of a cognitive-function code, e.g. {@code Ni} becomes
   * "Introverted Intuition".
   *
   * @throws IllegalArgumentException if the code is not a function code
   */
  public static String functionLongForm(String code) {
    String name = FUNCTION_NAMES.get(code);
    if (name == null) {
      throw new IllegalArgumentException("Not a function code: " + code);
    }
    return name;
  }

  /** Type codes mentioned in the text, upper case, in order of first appearance. */
  public static Set<String> typesIn(String text) {
    Set<String> found = new LinkedHashSet<>();
    Matcher matcher = TYPE_CODE.matcher(text);
    while (matcher.find()) {
      found.add(matcher.group(1).toUpperCase(Locale.ROOT));
    }
    return found;
  }

  /** Function codes mentioned in the text, in order of first appearance. */
  public static Set<String> functionsIn(String text) {
    Set<String> found = new LinkedHashSet<>();
    Matcher matcher = FUNCTION_CODE.matcher(text);
    while (matcher.find()) {
      found.add(matcher.group(1));
    }
    return found;
  }
}
