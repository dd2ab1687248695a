package com.codeheadsystems.tessera.server.credential;

import java.util.Optional;

/**
 * Checks a login and password pair.
 * <p>
 * Implementations must be thread-safe. The session manager never sees stored password
 * material, only the owner identifier returned on success.
 */
public interface CredentialVerifier {

  /**
   * Verifies the credentials.
   *
   * @param login    the login name
   * @param password the clear-text password
   * @return the owner credential identifier when the pair is valid, otherwise empty
   */
  Optional<String> verify(String login, String password);
}
