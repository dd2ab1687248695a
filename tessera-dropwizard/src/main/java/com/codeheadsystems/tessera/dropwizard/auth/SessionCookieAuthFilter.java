package com.codeheadsystems.tessera.dropwizard.auth;

import com.codeheadsystems.tessera.server.manager.SessionManagerConfig;
import com.codeheadsystems.tessera.server.resource.SessionResource;
import io.dropwizard.auth.AuthFilter;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Cookie;
import java.io.IOException;
import java.security.Principal;
import java.util.Set;

/**
 * {@link AuthFilter} that authenticates requests by the session cookie.
 * <p>
 * Requests using an unsafe method (anything but GET, HEAD and OPTIONS) must also send the
 * session's CSRF token in the {@code X-CSRF-Token} header.
 *
 * @param <P> the principal type
 */
@Priority(Priorities.AUTHENTICATION)
public class SessionCookieAuthFilter<P extends Principal> extends AuthFilter<SessionCredentials, P> {

  /**
   * Scheme reported through the request's SecurityContext.
   */
  public static final String AUTHENTICATION_SCHEME = "SESSION";

  private static final Set<String> SAFE_METHODS = Set.of("GET", "HEAD", "OPTIONS");

  private final String cookieName;

  private SessionCookieAuthFilter(String cookieName) {
    this.cookieName = cookieName;
  }

  @Override
  public void filter(ContainerRequestContext requestContext) throws IOException {
    Cookie cookie = requestContext.getCookies().get(cookieName);
    SessionCredentials credentials = cookie == null || cookie.getValue() == null || cookie.getValue().isBlank()
        ? null
        : new SessionCredentials(
            cookie.getValue(),
            requestContext.getHeaderString(SessionResource.CSRF_HEADER),
            !SAFE_METHODS.contains(requestContext.getMethod()));
    if (!authenticate(requestContext, credentials, AUTHENTICATION_SCHEME)) {
      throw unauthorizedHandler.buildException(prefix, realm);
    }
  }

  /**
   * Builder for {@link SessionCookieAuthFilter}. Set the cookie name before the inherited
   * setters, which return the base builder type.
   *
   * @param <P> the principal type
   */
  public static class Builder<P extends Principal>
      extends AuthFilterBuilder<SessionCredentials, P, SessionCookieAuthFilter<P>> {

    private String cookieName = SessionManagerConfig.DEFAULT_COOKIE_NAME;

    /**
     * Sets cookie name.
     *
     * @param cookieName the cookie name
     * @return the builder
     */
    public Builder<P> setCookieName(String cookieName) {
      this.cookieName = cookieName;
      return this;
    }

    @Override
    protected SessionCookieAuthFilter<P> newInstance() {
      return new SessionCookieAuthFilter<>(cookieName);
    }
  }
}
