package com.codeheadsystems.tessera.server.resource;

import com.codeheadsystems.tessera.model.session.SessionCreateRequest;
import com.codeheadsystems.tessera.model.session.SessionInput;
import com.codeheadsystems.tessera.model.session.SessionResponse;
import com.codeheadsystems.tessera.model.session.SessionView;
import com.codeheadsystems.tessera.server.exceptions.SessionNotFoundException;
import com.codeheadsystems.tessera.server.manager.SessionManager;
import com.codeheadsystems.tessera.server.model.LoginResult;
import com.codeheadsystems.tessera.server.model.Session;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource exposing the session lifecycle.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /user/sessions}              : log in, 201 (or 200 when replacing a proven session)</li>
 *   <li>{@code GET /user/sessions/current}       : the session named by the cookie, 404 without one</li>
 *   <li>{@code POST /user/sessions/{id}/refresh} : slide the session's expiry</li>
 *   <li>{@code DELETE /user/sessions/{id}}       : log out</li>
 * </ul>
 * Mutating calls read the identifier from the session cookie and the CSRF token from the
 * {@value #CSRF_HEADER} header. Refresh and delete answer 404 with a cookie-clearing
 * {@code Set-Cookie} so the client's state converges even after races.
 */
@Singleton
@Path("/user/sessions")
@Produces(MediaType.APPLICATION_JSON)
public class SessionResource {

  /**
   * Request header carrying the CSRF token.
   */
  public static final String CSRF_HEADER = "X-CSRF-Token";

  private static final Logger log = LoggerFactory.getLogger(SessionResource.class);
  private static final String SESSIONS_PATH = "/user/sessions/";

  private final SessionManager sessionManager;
  private final SessionCookies sessionCookies;

  /**
   * Instantiates a new Session resource.
   *
   * @param sessionManager the session manager
   * @param sessionCookies the cookie codec
   */
  @Inject
  public SessionResource(final SessionManager sessionManager, final SessionCookies sessionCookies) {
    this.sessionManager = sessionManager;
    this.sessionCookies = sessionCookies;
    log.info("SessionResource({}, cookie={})", sessionManager, sessionCookies.cookieName());
  }

  /**
   * Log in.
   *
   * @param request      the credentials
   * @param cookieHeader the raw Cookie header
   * @param csrfToken    the CSRF token of the caller's current session, if any
   * @param uriInfo      the uri info
   * @return 201 or 200 with the session body and a Set-Cookie header
   */
  @POST
  @Consumes(MediaType.APPLICATION_JSON)
  public Response create(final SessionCreateRequest request,
                         @HeaderParam(HttpHeaders.COOKIE) final String cookieHeader,
                         @HeaderParam(CSRF_HEADER) final String csrfToken,
                         @Context final UriInfo uriInfo) {
    SessionInput input = request == null ? null : request.sessionInput();
    if (input == null) {
      throw new WebApplicationException("Missing required field: SessionInput", Response.Status.BAD_REQUEST);
    }
    log.debug("create(login={})", input.login());
    final LoginResult result;
    try {
      result = sessionManager.login(input.login(), input.password(),
          sessionCookies.identifierFrom(cookieHeader).orElse(null), csrfToken);
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    } catch (SecurityException e) {
      throw new WebApplicationException("Authentication failed", Response.Status.UNAUTHORIZED);
    } catch (IllegalStateException e) {
      throw new WebApplicationException("Service unavailable", Response.Status.SERVICE_UNAVAILABLE);
    }
    Session session = result.session();
    return Response.status(result.replacedExisting() ? Response.Status.OK : Response.Status.CREATED)
        .header(HttpHeaders.SET_COOKIE, sessionCookies.issue(session.identifier()))
        .entity(toResponse(session, uriInfo))
        .build();
  }

  /**
   * The session named by the caller's cookie.
   *
   * @param cookieHeader the raw Cookie header
   * @param uriInfo      the uri info
   * @return 200 with the session body, or 404 with no body
   */
  @GET
  @Path("/current")
  public Response current(@HeaderParam(HttpHeaders.COOKIE) final String cookieHeader,
                          @Context final UriInfo uriInfo) {
    Optional<String> identifier = sessionCookies.identifierFrom(cookieHeader);
    if (identifier.isEmpty()) {
      return Response.status(Response.Status.NOT_FOUND).build();
    }
    try {
      Session session = sessionManager.find(identifier.get());
      return Response.ok(toResponse(session, uriInfo)).build();
    } catch (SessionNotFoundException e) {
      return Response.status(Response.Status.NOT_FOUND).build();
    }
  }

  /**
   * Refresh the session.
   *
   * @param sessionId    the session identifier from the path
   * @param cookieHeader the raw Cookie header, which must name the same session
   * @param csrfToken    the CSRF token
   * @param uriInfo      the uri info
   * @return 200 with the session body
   */
  @POST
  @Path("/{sessionId}/refresh")
  public Response refresh(@PathParam("sessionId") final String sessionId,
                          @HeaderParam(HttpHeaders.COOKIE) final String cookieHeader,
                          @HeaderParam(CSRF_HEADER) final String csrfToken,
                          @Context final UriInfo uriInfo) {
    requireCsrfHeader(csrfToken);
    if (!cookieNames(cookieHeader, sessionId)) {
      return notFoundClearingCookie();
    }
    try {
      Session session = sessionManager.refresh(sessionId, csrfToken);
      return Response.ok(toResponse(session, uriInfo)).build();
    } catch (SessionNotFoundException e) {
      return notFoundClearingCookie();
    } catch (SecurityException e) {
      throw new WebApplicationException("Invalid CSRF token", Response.Status.UNAUTHORIZED);
    }
  }

  /**
   * Log out.
   *
   * @param sessionId    the session identifier from the path
   * @param cookieHeader the raw Cookie header, which must name the same session
   * @param csrfToken    the CSRF token
   * @return 204, or 404, both clearing the cookie
   */
  @DELETE
  @Path("/{sessionId}")
  public Response delete(@PathParam("sessionId") final String sessionId,
                         @HeaderParam(HttpHeaders.COOKIE) final String cookieHeader,
                         @HeaderParam(CSRF_HEADER) final String csrfToken) {
    requireCsrfHeader(csrfToken);
    if (!cookieNames(cookieHeader, sessionId)) {
      return notFoundClearingCookie();
    }
    try {
      sessionManager.delete(sessionId, csrfToken);
      return Response.noContent()
          .header(HttpHeaders.SET_COOKIE, sessionCookies.clear())
          .build();
    } catch (SessionNotFoundException e) {
      return notFoundClearingCookie();
    } catch (SecurityException e) {
      throw new WebApplicationException("Invalid CSRF token", Response.Status.UNAUTHORIZED);
    }
  }

  private void requireCsrfHeader(String csrfToken) {
    if (csrfToken == null || csrfToken.isBlank()) {
      throw new WebApplicationException("Missing " + CSRF_HEADER + " header", Response.Status.UNAUTHORIZED);
    }
  }

  private boolean cookieNames(String cookieHeader, String sessionId) {
    return sessionCookies.identifierFrom(cookieHeader).map(sessionId::equals).orElse(false);
  }

  private Response notFoundClearingCookie() {
    return Response.status(Response.Status.NOT_FOUND)
        .header(HttpHeaders.SET_COOKIE, sessionCookies.clear())
        .build();
  }

  private SessionResponse toResponse(Session session, UriInfo uriInfo) {
    return new SessionResponse(new SessionView(
        session.name(),
        session.identifier(),
        session.csrfToken(),
        hrefFor(session.identifier(), uriInfo),
        session.ownerCredentialId()));
  }

  private static String hrefFor(String identifier, UriInfo uriInfo) {
    String base = uriInfo == null ? "" : uriInfo.getBaseUri().getPath();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return base + SESSIONS_PATH + identifier;
  }
}
