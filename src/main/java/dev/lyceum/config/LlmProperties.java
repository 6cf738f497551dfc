package dev.lyceum.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Connection settings for the OpenAI-compatible chat endpoint, bound from {@code lyceum.llm.*}.
 *
 * <p>When {@code api-key} is blank no chat models are created: answering reports an error and
 * ranking runs without relevance judgments.
 */
@Configuration
@ConfigurationProperties(prefix = "lyceum.llm")
public class LlmProperties {

  private String baseUrl = "https://api.openai.com/v1";
  private String apiKey = "";
  private String answerModel = "gpt-4o-mini";
  private String judgeModel = "gpt-4o-mini";
  private double temperature = 0.3;
  private int maxAnswerTokens = 2000;
  private Duration requestTimeout = Duration.ofSeconds(180);
  private boolean logRequests = false;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (temperature < 0.0 || temperature > 2.0) {
      throw new IllegalStateException(
          "lyceum.llm.temperature must be in [0.0, 2.0], got: " + temperature);
    }
    if (maxAnswerTokens < 1) {
      throw new IllegalStateException(
          "lyceum.llm.max-answer-tokens must be >= 1, got: " + maxAnswerTokens);
    }
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getApiKey() {
    return apiKey;
  }

  public void setApiKey(String apiKey) {
    this.apiKey = apiKey;
  }

  public String getAnswerModel() {
    return answerModel;
  }

  public void setAnswerModel(String answerModel) {
    this.answerModel = answerModel;
  }

  public String getJudgeModel() {
    return judgeModel;
  }

  public void setJudgeModel(String judgeModel) {
    this.judgeModel = judgeModel;
  }

  public double getTemperature() {
    return temperature;
  }

  public void setTemperature(double temperature) {
    this.temperature = temperature;
  }

  public int getMaxAnswerTokens() {
    return maxAnswerTokens;
  }

  public void setMaxAnswerTokens(int maxAnswerTokens) {
    this.maxAnswerTokens = maxAnswerTokens;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  public void setRequestTimeout(Duration requestTimeout) {
    this.requestTimeout = requestTimeout;
  }

  public boolean isLogRequests() {
    return logRequests;
  }

  public void setLogRequests(boolean logRequests) {
    this.logRequests = logRequests;
  }
}
