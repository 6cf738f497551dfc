package dev.lyceum.search;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Static utility deriving the stable identity of a retrieved passage. Two hits with the same
 * identity are the same passage, whichever query variant found them.
 */
public final class PassageIdentity {

  private PassageIdentity() {
    // utility class
  }

  /**
   * Returns {@code sourceId#offset} when both are known, otherwise {@code sha256:} followed by the
   * hex digest of the passage text.
   *
   * @param passage the retrieved passage
   * @return the identity key
   */
  public static String of(RetrievedPassage passage) {
    if (passage.sourceId() != null && !passage.sourceId().isBlank() && passage.offset() != null) {
      return passage.sourceId() + "#" + passage.offset();
    }
    return "sha256:" + sha256(passage.text());
  }

  /**
   * Compute the SHA-256 hash of the given content.
   *
   * @param content the content to hash
   * @return lowercase hex string of the SHA-256 hash
   */
  static String sha256(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
