package com.codeheadsystems.tessera.server.manager;

import java.time.Duration;

/**
 * Tunables for {@link SessionManager}.
 *
 * @param cookieName  the cookie name reported as {@code Session.name}
 * @param ttl         sliding session lifetime
 * @param maxSessions cap on live sessions
 */
public record SessionManagerConfig(String cookieName, Duration ttl, int maxSessions) {

  /**
   * The constant DEFAULT_COOKIE_NAME.
   */
  public static final String DEFAULT_COOKIE_NAME = "TESSERASESSID";

  /**
   * Validates the config.
   */
  public SessionManagerConfig {
    if (cookieName == null || cookieName.isBlank()) {
      throw new IllegalArgumentException("cookieName is required");
    }
    if (ttl == null || ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    if (maxSessions < 1) {
      throw new IllegalArgumentException("maxSessions must be at least 1");
    }
  }

  /**
   * Defaults: {@value #DEFAULT_COOKIE_NAME}, 30 minutes, 10 000 sessions.
   *
   * @return the session manager config
   */
  public static SessionManagerConfig defaults() {
    return new SessionManagerConfig(DEFAULT_COOKIE_NAME, Duration.ofMinutes(30), 10_000);
  }
}
