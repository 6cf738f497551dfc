package dev.lyceum.mcp;

import dev.lyceum.conversation.ChatMessage;
import dev.lyceum.conversation.CitationRecord;
import dev.lyceum.conversation.CitationSource;
import dev.lyceum.conversation.ConversationStore;
import dev.lyceum.conversation.MessageRole;
import dev.lyceum.search.RankedPassages;
import dev.lyceum.search.RetrievalPipeline;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing the lecture retrieval pipeline and stored citations as tool methods.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig}. Tool
 * methods follow the structured error pattern: all exceptions are caught and returned as
 * descriptive error strings, never thrown.
 *
 * <p>Tools: {@code search_lectures}, {@code conversation_citations}.
 *
 * @see TokenBudgetTruncator
 * @see McpToolConfig
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  private final RetrievalPipeline retrievalPipeline;
  private final ConversationStore conversationStore;
  private final TokenBudgetTruncator truncator;

  public McpToolService(
      RetrievalPipeline retrievalPipeline,
      ConversationStore conversationStore,
      TokenBudgetTruncator truncator) {
    this.retrievalPipeline = retrievalPipeline;
    this.conversationStore = conversationStore;
    this.truncator = truncator;
  }

  /** Runs the full retrieval-and-ranking pipeline for a question. */
  @Tool(
      name = "search_lectures",
      description =
          "Search the lecture transcripts for passages that answer a question. "
              + "Returns ranked excerpts with source labels, seasons and scores, "
              + "preceded by an overall confidence rating.")
  public String searchLectures(
      @ToolParam(description = "The question to find lecture passages for") @Nullable
          String question,
      @ToolParam(description = "Maximum number of passages (1-12, default 12)", required = false)
          @Nullable Integer maxResults) {
    try {
      if (question == null || question.isBlank()) {
        return "Error: Question must not be empty. Provide a question string.";
      }
      RankedPassages ranked = retrievalPipeline.retrieve(question);
      if (ranked.isEmpty()) {
        return "No lecture passages found for question: " + question;
      }
      int max = clampMaxResults(maxResults);
      RankedPassages limited =
          new RankedPassages(
              ranked.question(),
              ranked.queryVariants(),
              ranked.passages().stream().limit(max).toList(),
              ranked.confidence(),
              ranked.judged());
      return truncator.truncate(limited);
    } catch (Exception e) {
      log.warn("search_lectures failed", e);
      return "Error searching lectures: " + e.getMessage();
    }
  }

  /** Lists the citations still retained for the recent answers of a conversation. */
  @Tool(
      name = "conversation_citations",
      description =
          "List the sources cited by the most recent answers of a conversation. "
              + "Older answers keep their text but no longer carry citations.")
  public String conversationCitations(
      @ToolParam(description = "Conversation UUID") @Nullable String conversationId) {
    try {
      if (conversationId == null || conversationId.isBlank()) {
        return "Error: Conversation ID must not be empty.";
      }
      UUID id = UUID.fromString(conversationId.strip());
      List<ChatMessage> answers =
          conversationStore.messages(id).stream()
              .filter(m -> m.getRole() == MessageRole.ASSISTANT && m.getCitations() != null)
              .toList();
      if (answers.isEmpty()) {
        return "No retained citations for conversation " + id;
      }

      StringBuilder sb = new StringBuilder();
      for (ChatMessage answer : answers) {
        sb.append(formatAnswerCitations(answer));
      }
      return sb.toString();
    } catch (IllegalArgumentException e) {
      return "Error: Invalid conversation ID format: " + conversationId;
    } catch (Exception e) {
      log.warn("conversation_citations failed", e);
      return "Error reading citations: " + e.getMessage();
    }
  }

  private int clampMaxResults(@Nullable Integer maxResults) {
    if (maxResults == null || maxResults < 1) {
      return 12;
    }
    return Math.min(maxResults, 12);
  }

  private static String formatAnswerCitations(ChatMessage answer) {
    CitationRecord citations = answer.getCitations();
    StringBuilder sb = new StringBuilder();
    sb.append(
        String.format(
            Locale.ROOT,
            "- Answer %d (%s): confidence %s %.2f, %s%n",
            answer.getId(),
            answer.getCreatedAt(),
            citations.confidence().level().value(),
            citations.confidence().score(),
            citations.confidence().reasoning()));
    for (CitationSource source : citations.sources()) {
      sb.append(String.format(Locale.ROOT, "    * %s (%.3f)%n", source.label(), source.score()));
    }
    if (answer.getFollowUpQuestion() != null) {
      sb.append("    follow-up: ").append(answer.getFollowUpQuestion()).append('\n');
    }
    return sb.toString();
  }
}
