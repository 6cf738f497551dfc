package dev.lyceum.answer;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for answer streaming, bound from {@code lyceum.answer.*}.
 *
 * <ul>
 *   <li>{@code generation-timeout} - upper bound on waiting for the generation service to finish
 *       (default 120s)
 *   <li>{@code stream-timeout} - lifetime of one answer stream connection; must exceed the
 *       generation timeout (default 180s)
 *   <li>{@code history-messages} - most recent conversation messages included in the prompt
 *       (default 10, bounded [0, 50])
 *   <li>{@code max-citation-sources} - sources listed in the final payload (default 5, bounded [1,
 *       5])
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "lyceum.answer")
public class AnswerProperties {

  private Duration generationTimeout = Duration.ofSeconds(120);
  private Duration streamTimeout = Duration.ofSeconds(180);
  private int historyMessages = 10;
  private int maxCitationSources = 5;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (generationTimeout == null || generationTimeout.isZero() || generationTimeout.isNegative()) {
      throw new IllegalStateException(
          "lyceum.answer.generation-timeout must be positive, got: " + generationTimeout);
    }
    if (streamTimeout == null || streamTimeout.compareTo(generationTimeout) <= 0) {
      throw new IllegalStateException(
          "lyceum.answer.stream-timeout must exceed generation-timeout ("
              + generationTimeout
              + "), got: "
              + streamTimeout);
    }
    if (historyMessages < 0 || historyMessages > 50) {
      throw new IllegalStateException(
          "lyceum.answer.history-messages must be in [0, 50], got: " + historyMessages);
    }
    if (maxCitationSources < 1 || maxCitationSources > 5) {
      throw new IllegalStateException(
          "lyceum.answer.max-citation-sources must be in [1, 5], got: " + maxCitationSources);
    }
  }

  public Duration getGenerationTimeout() {
    return generationTimeout;
  }

  public void setGenerationTimeout(Duration generationTimeout) {
    this.generationTimeout = generationTimeout;
  }

  public Duration getStreamTimeout() {
    return streamTimeout;
  }

  public void setStreamTimeout(Duration streamTimeout) {
    this.streamTimeout = streamTimeout;
  }

  public int getHistoryMessages() {
    return historyMessages;
  }

  public void setHistoryMessages(int historyMessages) {
    this.historyMessages = historyMessages;
  }

  public int getMaxCitationSources() {
    return maxCitationSources;
  }

  public void setMaxCitationSources(int maxCitationSources) {
    this.maxCitationSources = maxCitationSources;
  }
}
