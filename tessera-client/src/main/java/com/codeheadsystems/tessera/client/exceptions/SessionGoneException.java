package com.codeheadsystems.tessera.client.exceptions;

/**
 * Thrown when the server answers 404 for a session: it was deleted, expired or never
 * existed. Carries the response's {@code Set-Cookie} header so callers can see whether
 * the server asked for the cookie to be cleared.
 */
public class SessionGoneException extends RuntimeException {

  private final String setCookie;

  /**
   * Instantiates a new Session gone exception.
   *
   * @param message   the message
   * @param setCookie the Set-Cookie header, may be null
   */
  public SessionGoneException(final String message, final String setCookie) {
    super(message);
    this.setCookie = setCookie;
  }

  public String setCookie() {
    return setCookie;
  }
}
