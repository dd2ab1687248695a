package com.codeheadsystems.tessera.dropwizard.auth;

import com.codeheadsystems.tessera.server.exceptions.SessionNotFoundException;
import com.codeheadsystems.tessera.server.manager.SessionManager;
import com.codeheadsystems.tessera.server.model.Session;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} that resolves session cookies through {@link SessionManager}.
 * Safe requests only need a live session; unsafe ones must also present its CSRF token.
 */
public class SessionAuthenticator implements Authenticator<SessionCredentials, SessionPrincipal> {

  private final SessionManager sessionManager;

  /**
   * Instantiates a new Session authenticator.
   *
   * @param sessionManager the session manager
   */
  public SessionAuthenticator(SessionManager sessionManager) {
    this.sessionManager = sessionManager;
  }

  @Override
  public Optional<SessionPrincipal> authenticate(SessionCredentials credentials) throws AuthenticationException {
    try {
      Session session = credentials.requiresCsrf()
          ? sessionManager.validate(credentials.identifier(), credentials.csrfToken())
          : sessionManager.find(credentials.identifier());
      return Optional.of(new SessionPrincipal(session.ownerCredentialId(), session.identifier()));
    } catch (SessionNotFoundException | SecurityException e) {
      return Optional.empty();
    }
  }
}
