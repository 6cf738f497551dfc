package dev.lyceum.mcp;

import dev.lyceum.search.Candidate;
import dev.lyceum.search.Confidence;
import dev.lyceum.search.RankedPassages;
import java.util.List;
import java.util.Locale;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Formats ranked passages for MCP clients within a configurable token budget.
 *
 * <p>Uses character-based token estimation (chars / 4). The output starts with a confidence header,
 * then passage blocks are accumulated in ranking order until the budget is reached. If even the
 * first passage exceeds the remaining budget it is cut at the character level, keeping at least
 * {@value #MIN_FIRST_PASSAGE_CHARS} characters, so some passage text is always returned.
 */
@Component
public class TokenBudgetTruncator {

  private static final double CHARS_PER_TOKEN = 4.0;

  static final int MIN_FIRST_PASSAGE_CHARS = 200;

  private final int tokenBudget;

  public TokenBudgetTruncator(@Value("${lyceum.mcp.token-budget:5000}") int tokenBudget) {
    this.tokenBudget = tokenBudget;
  }

  /**
   * Formats and truncates a ranking to fit within the configured token budget.
   *
   * @param ranked the ranked passages
   * @return formatted text: confidence header plus as many passages as fit
   */
  public String truncate(RankedPassages ranked) {
    String header = formatHeader(ranked.confidence());
    StringBuilder output = new StringBuilder(header);
    int estimatedTokens = estimateTokens(header);

    List<Candidate> passages = ranked.passages();
    for (int i = 0; i < passages.size(); i++) {
      String formatted = formatPassage(i + 1, passages.get(i));
      int passageTokens = estimateTokens(formatted);

      if (i == 0 && estimatedTokens + passageTokens > tokenBudget) {
        // First passage exceeds budget: truncate at character level
        int maxChars =
            Math.max(
                MIN_FIRST_PASSAGE_CHARS,
                (int) (Math.max(0, tokenBudget - estimatedTokens) * CHARS_PER_TOKEN));
        output.append(formatted, 0, Math.min(maxChars, formatted.length()));
        break;
      }

      if (estimatedTokens + passageTokens > tokenBudget) {
        break;
      }

      output.append(formatted);
      estimatedTokens += passageTokens;
    }

    return output.toString();
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private String formatHeader(Confidence confidence) {
    return String.format(
        Locale.ROOT,
        "Confidence: %s (%.2f) %s - %s\n\n",
        confidence.level().value(),
        confidence.score(),
        confidence.stars(),
        confidence.reasoning());
  }

  private String formatPassage(int index, Candidate candidate) {
    String season =
        candidate.metadata().season() == null
            ? "unknown"
            : String.valueOf(candidate.metadata().season());
    String relevance =
        candidate.relevanceScore() == null ? "-" : candidate.relevanceScore() + "/10";
    return String.format(
        Locale.ROOT,
        "## [%d] Source: %s\nSeason: %s\nScore: %.3f (relevance %s)\n\n%s\n\n---\n",
        index,
        candidate.sourceLabel(),
        season,
        candidate.hybridScore(),
        relevance,
        candidate.text());
  }
}
