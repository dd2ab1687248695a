package com.codeheadsystems.tessera.server.credential;

import com.codeheadsystems.tessera.server.random.RandomProvider;
import java.security.MessageDigest;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link CredentialVerifier} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Passwords are stored as salted Argon2id hashes and compared in constant time. A login
 * that does not exist still costs one hash, so response time does not reveal which logins
 * are registered. All users are lost on server restart. Suitable for development and
 * integration testing only.
 */
public class InMemoryCredentialStore implements CredentialVerifier {

  private static final Logger log = LoggerFactory.getLogger(InMemoryCredentialStore.class);

  private record StoredCredential(byte[] salt, byte[] hash) {
  }

  private final ConcurrentHashMap<String, StoredCredential> store = new ConcurrentHashMap<>();
  private final Argon2PasswordHasher hasher;
  private final RandomProvider randomProvider;
  private final StoredCredential decoy;

  /**
   * Instantiates a new In memory credential store.
   *
   * @param hasher         the password hasher
   * @param randomProvider the salt source
   */
  public InMemoryCredentialStore(Argon2PasswordHasher hasher, RandomProvider randomProvider) {
    this.hasher = hasher;
    this.randomProvider = randomProvider;
    byte[] decoySalt = randomProvider.randomBytes(Argon2PasswordHasher.SALT_LENGTH);
    this.decoy = new StoredCredential(decoySalt,
        randomProvider.randomBytes(Argon2PasswordHasher.HASH_LENGTH));
    log.warn("Using InMemoryCredentialStore. Users will NOT survive restarts. "
        + "Replace with a persistent CredentialVerifier for production.");
  }

  /**
   * Registers or replaces a user.
   *
   * @param login    the login
   * @param password the password
   * @throws IllegalArgumentException if either value is missing
   */
  public void register(String login, String password) {
    if (login == null || login.isBlank()) {
      throw new IllegalArgumentException("Missing required field: login");
    }
    if (password == null || password.isEmpty()) {
      throw new IllegalArgumentException("Missing required field: password");
    }
    byte[] salt = randomProvider.randomBytes(Argon2PasswordHasher.SALT_LENGTH);
    store.put(login, new StoredCredential(salt, hasher.hash(password, salt)));
    log.debug("Registered user login={}", login);
  }

  /**
   * Removes a user if present. Existing sessions are not affected.
   *
   * @param login the login
   */
  public void delete(String login) {
    store.remove(login);
  }

  @Override
  public Optional<String> verify(String login, String password) {
    if (login == null || password == null) {
      return Optional.empty();
    }
    StoredCredential stored = store.get(login);
    StoredCredential target = stored == null ? decoy : stored;
    boolean matches = MessageDigest.isEqual(target.hash(), hasher.hash(password, target.salt()));
    if (stored == null || !matches) {
      log.debug("Credential verification failed for login={}", login);
      return Optional.empty();
    }
    return Optional.of(login);
  }
}
