package com.codeheadsystems.tessera.client.exceptions;

/**
 * The type Session accessor exception.
 */
public class SessionAccessorException extends RuntimeException {
  /**
   * Instantiates a new Session accessor exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public SessionAccessorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
