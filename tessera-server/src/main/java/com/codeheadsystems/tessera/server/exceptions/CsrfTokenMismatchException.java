package com.codeheadsystems.tessera.server.exceptions;

/**
 * Thrown when a mutating call arrives without a CSRF token, or with one that does not
 * belong to the addressed session.
 */
public class CsrfTokenMismatchException extends SecurityException {

  /**
   * Instantiates a new Csrf token mismatch exception.
   *
   * @param message the message
   */
  public CsrfTokenMismatchException(String message) {
    super(message);
  }
}
