package com.codeheadsystems.tessera.server.credential;

import java.nio.charset.StandardCharsets;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;

/**
 * Derives password hashes with Argon2id.
 */
public class Argon2PasswordHasher {

  /**
   * Length in bytes of every derived hash.
   */
  public static final int HASH_LENGTH = 32;

  /**
   * Length in bytes of the per-user salt.
   */
  public static final int SALT_LENGTH = 16;

  private final PasswordHashParameters parameters;

  /**
   * Instantiates a new Argon2 password hasher.
   *
   * @param parameters the cost parameters
   */
  public Argon2PasswordHasher(PasswordHashParameters parameters) {
    this.parameters = parameters;
  }

  /**
   * Hashes the password with the given salt.
   *
   * @param password the password
   * @param salt     the salt
   * @return the {@value #HASH_LENGTH}-byte hash
   */
  public byte[] hash(String password, byte[] salt) {
    Argon2BytesGenerator gen = new Argon2BytesGenerator();
    Argon2Parameters params =
        new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
            .withSalt(salt)
            .withMemoryAsKB(parameters.memoryKib())
            .withIterations(parameters.iterations())
            .withParallelism(parameters.parallelism())
            .build();
    gen.init(params);
    byte[] output = new byte[HASH_LENGTH];
    gen.generateBytes(password.getBytes(StandardCharsets.UTF_8), output, 0, output.length);
    return output;
  }

  public PasswordHashParameters parameters() {
    return parameters;
  }
}
