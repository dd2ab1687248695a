package com.codeheadsystems.tessera.server.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Server-side record of one authenticated login.
 * <p>
 * Instances are immutable; a refresh produces a new record with the same identifier and
 * CSRF token. Stores compare records by value when applying optimistic updates.
 *
 * @param identifier        opaque unique token, sent to the client as the cookie value
 * @param name              the cookie name the identifier travels under
 * @param csrfToken         secret bound to the session for its whole lifetime
 * @param ownerCredentialId the login of the user who authenticated
 * @param createdAt         when the login happened
 * @param lastRefreshedAt   when the session was created or last refreshed
 * @param expiresAt         instant after which the session is treated as deleted
 */
public record Session(
    String identifier,
    String name,
    String csrfToken,
    String ownerCredentialId,
    Instant createdAt,
    Instant lastRefreshedAt,
    Instant expiresAt) {

  /**
   * Creates a brand-new session whose refresh and expiry clocks start at {@code now}.
   *
   * @param identifier        the identifier
   * @param name              the cookie name
   * @param csrfToken         the csrf token
   * @param ownerCredentialId the owner
   * @param now               the creation instant
   * @param ttl               the sliding time-to-live
   * @return the session
   */
  public static Session create(String identifier, String name, String csrfToken,
                               String ownerCredentialId, Instant now, Duration ttl) {
    return new Session(identifier, name, csrfToken, ownerCredentialId, now, now, now.plus(ttl));
  }

  /**
   * Returns a copy with {@code lastRefreshedAt} moved to {@code now} and the expiry slid forward.
   *
   * @param now the refresh instant
   * @param ttl the sliding time-to-live
   * @return the refreshed session
   */
  public Session refreshed(Instant now, Duration ttl) {
    return new Session(identifier, name, csrfToken, ownerCredentialId, createdAt, now, now.plus(ttl));
  }

  /**
   * Is expired boolean.
   *
   * @param now the current instant
   * @return true once {@code now} has reached {@code expiresAt}
   */
  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }

  @Override
  public String toString() {
    return "Session[identifier=" + abbreviate(identifier) + ", owner=" + ownerCredentialId
        + ", expiresAt=" + expiresAt + "]";
  }

  /**
   * Shortens a secret for log output.
   *
   * @param token the token
   * @return the first few characters followed by an ellipsis
   */
  public static String abbreviate(String token) {
    if (token == null) {
      return "null";
    }
    return token.length() <= 6 ? "***" : token.substring(0, 6) + "...";
  }
}
