package com.codeheadsystems.tessera.server.credential;

/**
 * Argon2id cost parameters for stored password hashes.
 *
 * @param memoryKib   memory cost in KiB
 * @param iterations  time cost
 * @param parallelism lanes
 */
public record PasswordHashParameters(int memoryKib, int iterations, int parallelism) {

  /**
   * OWASP minimum recommendation for Argon2id.
   */
  public static final PasswordHashParameters DEFAULT = new PasswordHashParameters(19_456, 2, 1);

  /**
   * Validates the parameters.
   */
  public PasswordHashParameters {
    if (memoryKib < 8 || iterations < 1 || parallelism < 1) {
      throw new IllegalArgumentException("Invalid Argon2 parameters: memoryKib=" + memoryKib
          + ", iterations=" + iterations + ", parallelism=" + parallelism);
    }
  }
}
