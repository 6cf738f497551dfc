package dev.lyceum.search;

import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RelevanceJudge} backed by a LangChain4j {@link ChatModel}.
 *
 * <p>All passages go into a single prompt with numbered tags; the model is asked for a bare JSON
 * array of integers 1-10 in passage order. Passages are cut to {@value #MAX_PASSAGE_CHARS}
 * characters to keep the batch inside the model's context.
 */
public class LlmRelevanceJudge implements RelevanceJudge {

  private static final Logger log = LoggerFactory.getLogger(LlmRelevanceJudge.class);

  static final int MAX_PASSAGE_CHARS = 800;

  static final String SYSTEM_PROMPT =
      """
      You grade lecture transcript passages for a question-answering system about personality \
      typology. For each passage, rate from 1 to 10 how directly it helps answer the question:
      10 = answers it directly, 5 = related background, 1 = unrelated.
      Reply with only a JSON array of integers, one per passage, in passage order. \
      Example for three passages: [7, 2, 9]""";

  private final ChatModel chatModel;
  private final JudgeResponseParser parser;

  public LlmRelevanceJudge(ChatModel chatModel, JudgeResponseParser parser) {
    this.chatModel = chatModel;
    this.parser = parser;
  }

  @Override
  public List<Integer> scoreBatch(String question, List<String> passages) {
    ChatRequest request =
        ChatRequest.builder()
            .messages(
                SystemMessage.from(SYSTEM_PROMPT), UserMessage.from(userPrompt(question, passages)))
            .build();
    ChatResponse response = chatModel.chat(request);
    String reply = response.aiMessage().text();
    log.debug("Relevance judge replied for {} passage(s)", passages.size());
    return parser.parse(reply);
  }

  static String userPrompt(String question, List<String> passages) {
    StringBuilder sb = new StringBuilder();
    sb.append("Question: ").append(question).append("\n\n");
    for (int i = 0; i < passages.size(); i++) {
      String passage = passages.get(i);
      if (passage.length() > MAX_PASSAGE_CHARS) {
        passage = passage.substring(0, MAX_PASSAGE_CHARS) + "...";
      }
      sb.append("<passage id=\"").append(i + 1).append("\">\n");
      sb.append(passage).append("\n</passage>\n\n");
    }
    sb.append("Return exactly ").append(passages.size()).append(" integers.");
    return sb.toString();
  }
}
