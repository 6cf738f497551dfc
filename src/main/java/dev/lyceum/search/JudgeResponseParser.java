package dev.lyceum.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Reads the JSON score array out of a free-text judge reply.
 *
 * <p>Models wrap JSON in markdown fences or prose, so the span from the first {@code [} to the last
 * {@code ]} is parsed. Every element must be an integral JSON number; anything else is rejected
 * rather than guessed at.
 */
public class JudgeResponseParser {

  private final ObjectMapper objectMapper;

  public JudgeResponseParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Parses a judge reply.
   *
   * @param reply raw model output
   * @return the scores in reply order
   * @throws JudgeResponseException if no integer array can be read
   */
  public List<Integer> parse(@Nullable String reply) {
    if (reply == null || reply.isBlank()) {
      throw new JudgeResponseException("Judge reply is empty");
    }
    int start = reply.indexOf('[');
    int end = reply.lastIndexOf(']');
    if (start < 0 || end <= start) {
      throw new JudgeResponseException("Judge reply contains no JSON array");
    }

    JsonNode node;
    try {
      node = objectMapper.readTree(reply.substring(start, end + 1));
    } catch (JsonProcessingException e) {
      throw new JudgeResponseException("Judge reply is not valid JSON", e);
    }
    if (node == null || !node.isArray()) {
      throw new JudgeResponseException("Judge reply is not a JSON array");
    }

    List<Integer> scores = new ArrayList<>(node.size());
    for (JsonNode element : node) {
      if (!element.isIntegralNumber() || !element.canConvertToInt()) {
        throw new JudgeResponseException("Judge score is not an integer: " + element);
      }
      scores.add(element.intValue());
    }
    return scores;
  }
}
