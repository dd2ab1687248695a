package com.codeheadsystems.tessera.server.random;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random byte generation.
 * Used for session identifiers, CSRF tokens and password salts.
 */
public record RandomProvider(SecureRandom random) {

  private static final Base64.Encoder URL_SAFE = Base64.getUrlEncoder().withoutPadding();

  /**
   * Creates a RandomProvider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }

  /**
   * Generates a URL-safe base64 token (no padding) from {@code len} random bytes.
   * The result is safe to use as a cookie value and as a path segment.
   *
   * @param len the number of random bytes
   * @return the encoded token
   */
  public String urlSafeToken(int len) {
    return URL_SAFE.encodeToString(randomBytes(len));
  }
}
