package dev.lyceum.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import dev.lyceum.answer.StreamingChatTextGenerator;
import dev.lyceum.answer.TextGenerator;
import dev.lyceum.search.JudgeResponseParser;
import dev.lyceum.search.LlmRelevanceJudge;
import dev.lyceum.search.RankingProperties;
import dev.lyceum.search.RelevanceJudge;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the LLM-backed services from {@link LlmProperties}: the streaming answer generator and the
 * relevance judge.
 *
 * <p>Both beans exist only when {@code lyceum.llm.api-key} is set. Consumers take them as {@code
 * Optional} and decide once, at startup, how to run without them.
 *
 * <p>The judge's HTTP timeout never exceeds {@code lyceum.search.judge-timeout}. The reranker stops
 * waiting at that deadline but cannot interrupt a blocked call, so the client has to give the
 * thread back on its own.
 */
@Configuration
@ConditionalOnExpression("!'${lyceum.llm.api-key:}'.isBlank()")
public class LlmConfig {

  @Bean
  public TextGenerator textGenerator(LlmProperties properties) {
    OpenAiStreamingChatModel model =
        OpenAiStreamingChatModel.builder()
            .baseUrl(properties.getBaseUrl())
            .apiKey(properties.getApiKey())
            .modelName(properties.getAnswerModel())
            .temperature(properties.getTemperature())
            .maxTokens(properties.getMaxAnswerTokens())
            .timeout(properties.getRequestTimeout())
            .logRequests(properties.isLogRequests())
            .build();
    return new StreamingChatTextGenerator(model);
  }

  @Bean
  public RelevanceJudge relevanceJudge(
      LlmProperties properties, RankingProperties ranking, ObjectMapper objectMapper) {
    OpenAiChatModel model =
        OpenAiChatModel.builder()
            .baseUrl(properties.getBaseUrl())
            .apiKey(properties.getApiKey())
            .modelName(properties.getJudgeModel())
            .temperature(0.0)
            .timeout(judgeClientTimeout(properties, ranking))
            .logRequests(properties.isLogRequests())
            .build();
    return new LlmRelevanceJudge(model, new JudgeResponseParser(objectMapper));
  }

  static Duration judgeClientTimeout(LlmProperties properties, RankingProperties ranking) {
    Duration request = properties.getRequestTimeout();
    Duration judge = ranking.getJudgeTimeout();
    return judge.compareTo(request) < 0 ? judge : request;
  }
}
