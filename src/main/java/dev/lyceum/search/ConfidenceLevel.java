package dev.lyceum.search;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Coarse confidence in an answer's grounding. Serialised in lower case. */
public enum ConfidenceLevel {
  HIGH,
  MEDIUM,
  LOW;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
