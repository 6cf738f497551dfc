package dev.lyceum.answer;

import dev.lyceum.conversation.ChatMessage;
import dev.lyceum.search.Candidate;
import dev.lyceum.search.PassageMetadata;
import dev.lyceum.search.RankedPassages;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Builds the generation prompt for a question from its ranked passages and the conversation
 * history.
 *
 * <p>Each passage is introduced by a single metadata line, for example:
 *
 * <pre>
 * [Source 1] | Season: 21 | Types: ENFP, INTJ | Functions: Ne, Ni | Category: relationship | Score: 0.842
 * </pre>
 */
@Component
public class GroundingPromptBuilder {

  static final String NO_CONTEXT = "No relevant content was found in the lecture transcripts.";

  static final String INSTRUCTIONS =
      """
      You answer questions about personality typology using only the lecture transcript \
      excerpts below. Cite excerpts inline as [Source N]. If the excerpts do not cover the \
      question, say so plainly instead of guessing. Prefer more recent seasons when excerpts \
      disagree.

      After the answer, write exactly one final line of the form:
      %s <one short follow-up question the student might ask next>
      """
          .formatted(FollowUpFilter.MARKER);

  /**
   * Builds the request for one answer.
   *
   * @param question the question being answered
   * @param ranked the ranked passages to ground the answer on
   * @param history earlier conversation messages, oldest first
   * @return the generation request
   */
  public GenerationRequest build(
      String question, RankedPassages ranked, List<ChatMessage> history) {
    String systemPrompt =
        INSTRUCTIONS + "\n<lecture_excerpts>\n" + formatContext(ranked) + "</lecture_excerpts>";
    List<PriorMessage> prior =
        history.stream().map(m -> new PriorMessage(m.getRole(), m.getContent())).toList();
    return new GenerationRequest(systemPrompt, prior, question);
  }

  static String formatContext(RankedPassages ranked) {
    if (ranked.isEmpty()) {
      return NO_CONTEXT + "\n";
    }
    StringBuilder sb = new StringBuilder();
    List<Candidate> passages = ranked.passages();
    for (int i = 0; i < passages.size(); i++) {
      Candidate candidate = passages.get(i);
      sb.append(headerLine(i + 1, candidate)).append('\n');
      sb.append(candidate.text().strip()).append("\n\n");
    }
    return sb.toString();
  }

  static String headerLine(int index, Candidate candidate) {
    PassageMetadata metadata = candidate.metadata();
    StringBuilder line = new StringBuilder("[Source ").append(index).append(']');
    if (metadata.season() != null) {
      line.append(" | Season: ").append(metadata.season());
    }
    if (!metadata.types().isEmpty()) {
      line.append(" | Types: ").append(String.join(", ", new TreeSet<>(metadata.types())));
    }
    if (!metadata.functions().isEmpty()) {
      line.append(" | Functions: ").append(String.join(", ", new TreeSet<>(metadata.functions())));
    }
    if (!metadata.contentType().isBlank() && !"unknown".equals(metadata.contentType())) {
      line.append(" | Category: ").append(metadata.contentType());
    }
    line.append(" | Score: ").append(String.format(Locale.ROOT, "%.3f", candidate.hybridScore()));
    return line.toString();
  }
}
