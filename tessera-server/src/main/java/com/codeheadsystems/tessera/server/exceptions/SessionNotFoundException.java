package com.codeheadsystems.tessera.server.exceptions;

/**
 * Thrown when no live session matches an identifier. Deleted and expired sessions are
 * reported the same way.
 */
public class SessionNotFoundException extends RuntimeException {

  /**
   * Instantiates a new Session not found exception.
   *
   * @param message the message
   */
  public SessionNotFoundException(String message) {
    super(message);
  }
}
