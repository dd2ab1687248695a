package com.codeheadsystems.tessera.server.exceptions;

/**
 * Thrown when the presented login and password do not match a known user.
 */
public class AuthenticationFailedException extends SecurityException {

  /**
   * Instantiates a new Authentication failed exception.
   *
   * @param message the message
   */
  public AuthenticationFailedException(String message) {
    super(message);
  }
}
