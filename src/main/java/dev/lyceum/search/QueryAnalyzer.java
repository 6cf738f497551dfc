package dev.lyceum.search;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Extracts the typology entities a question mentions into a {@link QueryProfile}. */
@Component
public class QueryAnalyzer {

  private static final Pattern SEASON = Pattern.compile("\\bseason\\s*(\\d{1,3})\\b");

  public QueryProfile analyze(String question) {
    String lower = question.toLowerCase(Locale.ROOT);
    Matcher season = SEASON.matcher(lower);
    Integer explicitSeason = season.find() ? Integer.valueOf(season.group(1)) : null;
    return new QueryProfile(
        lower,
        TypeVocabulary.typesIn(question),
        TypeVocabulary.functionsIn(question),
        explicitSeason);
  }
}
