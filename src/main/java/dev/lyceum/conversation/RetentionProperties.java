package dev.lyceum.conversation;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for citation retention, bound from {@code lyceum.retention.*}.
 *
 * <ul>
 *   <li>{@code keep-last} - number of most recent assistant answers per conversation that keep
 *       their citations and follow-up question (default 6, bounded [1, 100])
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "lyceum.retention")
public class RetentionProperties {

  private int keepLast = 6;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (keepLast < 1 || keepLast > 100) {
      throw new IllegalStateException(
          "lyceum.retention.keep-last must be in [1, 100], got: " + keepLast);
    }
  }

  public int getKeepLast() {
    return keepLast;
  }

  public void setKeepLast(int keepLast) {
    this.keepLast = keepLast;
  }
}
