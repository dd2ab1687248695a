package com.codeheadsystems.tessera.dropwizard.auth;

import java.security.Principal;

/**
 * Principal representing a user authenticated by session cookie.
 *
 * @param login             the login that created the session
 * @param sessionIdentifier the session identifier from the cookie
 */
public record SessionPrincipal(String login, String sessionIdentifier) implements Principal {

  @Override
  public String getName() {
    return login;
  }

  @Override
  public String toString() {
    return "SessionPrincipal[login=" + login + "]";
  }
}
