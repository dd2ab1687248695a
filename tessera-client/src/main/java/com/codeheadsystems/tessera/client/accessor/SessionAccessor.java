package com.codeheadsystems.tessera.client.accessor;

import com.codeheadsystems.tessera.client.exceptions.SessionAccessorException;
import com.codeheadsystems.tessera.client.exceptions.SessionGoneException;
import com.codeheadsystems.tessera.client.model.ServerConnectionInfo;
import com.codeheadsystems.tessera.client.model.ServerIdentifier;
import com.codeheadsystems.tessera.client.model.SessionResult;
import com.codeheadsystems.tessera.model.session.SessionCreateRequest;
import com.codeheadsystems.tessera.model.session.SessionResponse;
import com.codeheadsystems.tessera.model.session.SessionView;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the session REST endpoints exposed by {@code tessera-server}.
 * <p>
 * Handles request serialization, HTTP dispatch, status-code checking, and response
 * deserialization. The {@code endpoint} stored in {@link ServerConnectionInfo} is treated
 * as the <em>base URL</em> of the application; the session paths are appended to it.
 * The session cookie and {@code X-CSRF-Token} header are sent explicitly on every call,
 * so the client holds no cookie jar of its own.
 * <p>
 * A 401 response is surfaced as a {@link SecurityException}, a 404 as a
 * {@link SessionGoneException}. I/O errors and interruptions are wrapped in
 * {@link SessionAccessorException}.
 */
@Singleton
public class SessionAccessor {

  /**
   * Request header carrying the CSRF token.
   */
  public static final String CSRF_HEADER = "X-CSRF-Token";

  private static final Logger log = LoggerFactory.getLogger(SessionAccessor.class);
  private static final String SESSIONS_PATH = "/user/sessions";

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Map<ServerIdentifier, ServerConnectionInfo> serverConnections;

  /**
   * Instantiates a new Session accessor.
   *
   * @param httpClient        the http client
   * @param objectMapper      the object mapper
   * @param serverConnections the server connections
   */
  @Inject
  public SessionAccessor(final HttpClient httpClient,
                         final ObjectMapper objectMapper,
                         final Map<ServerIdentifier, ServerConnectionInfo> serverConnections) {
    log.info("SessionAccessor()");
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.serverConnections = serverConnections;
  }

  /**
   * Logs in without presenting any prior session.
   *
   * @param serverId the server id
   * @param login    the login
   * @param password the password
   * @return the result, status 201
   * @throws SecurityException if the credentials are rejected
   */
  public SessionResult create(final ServerIdentifier serverId,
                              final String login,
                              final String password) {
    return create(serverId, login, password, null);
  }

  /**
   * Logs in, presenting the cookie and, if known, the CSRF token of a prior session.
   * The server answers 200 when the prior session was proven and replaced, 201 otherwise.
   *
   * @param serverId the server id
   * @param login    the login
   * @param password the password
   * @param prior    the prior session, may be null; its csrfToken may be null
   * @return the result
   * @throws SecurityException if the credentials are rejected
   */
  public SessionResult create(final ServerIdentifier serverId,
                              final String login,
                              final String password,
                              final SessionView prior) {
    log.debug("create(serverId={}, login={})", serverId, login);
    try {
      String requestBody = objectMapper.writeValueAsString(SessionCreateRequest.of(login, password));
      HttpRequest.Builder builder = HttpRequest.newBuilder()
          .uri(uri(serverId, SESSIONS_PATH))
          .header("Content-Type", "application/json")
          .header("Accept", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString(requestBody));
      if (prior != null) {
        withSession(builder, prior);
      }
      return send(serverId, builder.build());
    } catch (IOException e) {
      throw new SessionAccessorException("HTTP request failed for server: " + serverId, e);
    }
  }

  /**
   * Reads the session named by the cookie.
   *
   * @param serverId the server id
   * @param session  the session whose cookie to present
   * @return the result, status 200
   * @throws SessionGoneException if the server does not know the session
   */
  public SessionResult current(final ServerIdentifier serverId, final SessionView session) {
    log.debug("current(serverId={})", serverId);
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(uri(serverId, SESSIONS_PATH + "/current"))
        .header("Accept", "application/json")
        .GET();
    if (session != null) {
      builder.header("Cookie", session.name() + "=" + session.identifier());
    }
    return send(serverId, builder.build());
  }

  /**
   * Refreshes the session.
   *
   * @param serverId the server id
   * @param session  the session
   * @return the result, status 200
   * @throws SecurityException    if the CSRF token is missing or wrong
   * @throws SessionGoneException if the session was deleted or expired
   */
  public SessionResult refresh(final ServerIdentifier serverId, final SessionView session) {
    log.debug("refresh(serverId={})", serverId);
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(uri(serverId, SESSIONS_PATH + "/" + session.identifier() + "/refresh"))
        .header("Accept", "application/json")
        .POST(HttpRequest.BodyPublishers.noBody());
    return send(serverId, withSession(builder, session).build());
  }

  /**
   * Deletes the session at its {@code _href}.
   *
   * @param serverId the server id
   * @param session  the session
   * @return the result, status 204 with a cookie-clearing header
   * @throws SecurityException    if the CSRF token is missing or wrong
   * @throws SessionGoneException if the session was already gone
   */
  public SessionResult delete(final ServerIdentifier serverId, final SessionView session) {
    log.debug("delete(serverId={})", serverId);
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(baseUri(serverId).resolve(session.href()))
        .DELETE();
    return send(serverId, withSession(builder, session).build());
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private HttpRequest.Builder withSession(HttpRequest.Builder builder, SessionView session) {
    builder.header("Cookie", session.name() + "=" + session.identifier());
    if (session.csrfToken() != null) {
      builder.header(CSRF_HEADER, session.csrfToken());
    }
    return builder;
  }

  private SessionResult send(ServerIdentifier serverId, HttpRequest request) {
    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      String setCookie = response.headers().firstValue("Set-Cookie").orElse(null);
      checkStatus(serverId, response.statusCode(), setCookie);
      String body = response.body();
      SessionView session = body == null || body.isBlank()
          ? null
          : objectMapper.readValue(body, SessionResponse.class).session();
      return new SessionResult(response.statusCode(), session, setCookie);
    } catch (IOException e) {
      throw new SessionAccessorException("HTTP request failed for server: " + serverId, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SessionAccessorException("HTTP request interrupted for server: " + serverId, e);
    }
  }

  private URI baseUri(ServerIdentifier serverId) {
    ServerConnectionInfo info = serverConnections.get(serverId);
    if (info == null) {
      throw new IllegalArgumentException("No connection info for server: " + serverId);
    }
    return info.endpoint();
  }

  private URI uri(ServerIdentifier serverId, String path) {
    URI base = baseUri(serverId);
    String basePath = base.getPath() == null ? "" : base.getPath();
    if (basePath.endsWith("/")) {
      basePath = basePath.substring(0, basePath.length() - 1);
    }
    return base.resolve(basePath + path);
  }

  private void checkStatus(ServerIdentifier serverId, int statusCode, String setCookie) {
    if (statusCode == 401) {
      throw new SecurityException("Server rejected request (401) for server: " + serverId);
    }
    if (statusCode == 404) {
      throw new SessionGoneException("Session not found on server: " + serverId, setCookie);
    }
    if (statusCode >= 400) {
      throw new SessionAccessorException(
          "Server returned HTTP " + statusCode + " for server: " + serverId, null);
    }
  }
}
