package com.codeheadsystems.tessera.server.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.tessera.model.session.SessionCreateRequest;
import com.codeheadsystems.tessera.model.session.SessionResponse;
import com.codeheadsystems.tessera.server.exceptions.AuthenticationFailedException;
import com.codeheadsystems.tessera.server.exceptions.CsrfTokenMismatchException;
import com.codeheadsystems.tessera.server.exceptions.SessionNotFoundException;
import com.codeheadsystems.tessera.server.manager.SessionManager;
import com.codeheadsystems.tessera.server.model.LoginResult;
import com.codeheadsystems.tessera.server.model.Session;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionResourceTest {

  private static final String ID = "session-identifier";
  private static final String CSRF = "csrf-token";
  private static final String COOKIE = "SID=" + ID;
  private static final Session SESSION = Session.create(ID, "SID", CSRF, "admin",
      Instant.parse("2024-01-01T00:00:00Z"), Duration.ofMinutes(30));

  @Mock private SessionManager sessionManager;
  @Mock private UriInfo uriInfo;
  private SessionResource resource;

  @BeforeEach
  void setUp() {
    resource = new SessionResource(sessionManager, new SessionCookies("SID", false));
  }

  private static int statusOf(WebApplicationException e) {
    return e.getResponse().getStatus();
  }

  // ── create ───────────────────────────────────────────────────────────────

  @Test
  void create_fresh_returns201WithCookieAndBody() {
    when(uriInfo.getBaseUri()).thenReturn(URI.create("http://localhost:8080/api/"));
    when(sessionManager.login("admin", "publish", null, null))
        .thenReturn(new LoginResult(SESSION, false));

    Response response = resource.create(SessionCreateRequest.of("admin", "publish"), null, null, uriInfo);

    assertThat(response.getStatus()).isEqualTo(201);
    assertThat(response.getHeaderString(HttpHeaders.SET_COOKIE))
        .isEqualTo("SID=" + ID + "; Path=/; HttpOnly; SameSite=Lax");
    SessionResponse body = (SessionResponse) response.getEntity();
    assertThat(body.session().identifier()).isEqualTo(ID);
    assertThat(body.session().csrfToken()).isEqualTo(CSRF);
    assertThat(body.session().name()).isEqualTo("SID");
    assertThat(body.session().login()).isEqualTo("admin");
    assertThat(body.session().href()).isEqualTo("/api/user/sessions/" + ID);
  }

  @Test
  void create_replacingProvenSession_returns200() {
    when(uriInfo.getBaseUri()).thenReturn(URI.create("http://localhost:8080/"));
    when(sessionManager.login("admin", "publish", "old-id", "old-csrf"))
        .thenReturn(new LoginResult(SESSION, true));

    Response response = resource.create(
        SessionCreateRequest.of("admin", "publish"), "SID=old-id", "old-csrf", uriInfo);

    assertThat(response.getStatus()).isEqualTo(200);
    assertThat(((SessionResponse) response.getEntity()).session().href())
        .isEqualTo("/user/sessions/" + ID);
  }

  @Test
  void create_badCredentials_throws401() {
    when(sessionManager.login("admin", "bad", null, null))
        .thenThrow(new AuthenticationFailedException("nope"));

    assertThatThrownBy(() -> resource.create(SessionCreateRequest.of("admin", "bad"), null, null, uriInfo))
        .isInstanceOf(WebApplicationException.class)
        .satisfies(e -> assertThat(statusOf((WebApplicationException) e)).isEqualTo(401));
  }

  @Test
  void create_missingEnvelope_throws400() {
    assertThatThrownBy(() -> resource.create(new SessionCreateRequest(null), null, null, uriInfo))
        .isInstanceOf(WebApplicationException.class)
        .satisfies(e -> assertThat(statusOf((WebApplicationException) e)).isEqualTo(400));
    assertThatThrownBy(() -> resource.create(null, null, null, uriInfo))
        .isInstanceOf(WebApplicationException.class);
  }

  @Test
  void create_missingPassword_throws400() {
    when(sessionManager.login("admin", null, null, null))
        .thenThrow(new IllegalArgumentException("Missing required field: password"));

    assertThatThrownBy(() -> resource.create(SessionCreateRequest.of("admin", null), null, null, uriInfo))
        .isInstanceOf(WebApplicationException.class)
        .satisfies(e -> assertThat(statusOf((WebApplicationException) e)).isEqualTo(400));
  }

  @Test
  void create_atCapacity_throws503() {
    when(sessionManager.login("admin", "publish", null, null))
        .thenThrow(new IllegalStateException("Too many sessions"));

    assertThatThrownBy(() -> resource.create(SessionCreateRequest.of("admin", "publish"), null, null, uriInfo))
        .isInstanceOf(WebApplicationException.class)
        .satisfies(e -> assertThat(statusOf((WebApplicationException) e)).isEqualTo(503));
  }

  // ── current ──────────────────────────────────────────────────────────────

  @Test
  void current_withCookie_returns200() {
    when(uriInfo.getBaseUri()).thenReturn(URI.create("http://localhost:8080/"));
    when(sessionManager.find(ID)).thenReturn(SESSION);

    Response response = resource.current(COOKIE, uriInfo);

    assertThat(response.getStatus()).isEqualTo(200);
    assertThat(((SessionResponse) response.getEntity()).session().identifier()).isEqualTo(ID);
  }

  @Test
  void current_withoutCookie_returns404WithoutBodyOrClearing() {
    Response response = resource.current(null, uriInfo);

    assertThat(response.getStatus()).isEqualTo(404);
    assertThat(response.hasEntity()).isFalse();
    assertThat(response.getHeaderString(HttpHeaders.SET_COOKIE)).isNull();
    verify(sessionManager, never()).find(anyString());
  }

  @Test
  void current_unknownSession_returns404() {
    when(sessionManager.find(ID)).thenThrow(new SessionNotFoundException("gone"));

    Response response = resource.current(COOKIE, uriInfo);

    assertThat(response.getStatus()).isEqualTo(404);
    assertThat(response.hasEntity()).isFalse();
  }

  // ── refresh ──────────────────────────────────────────────────────────────

  @Test
  void refresh_valid_returns200() {
    when(uriInfo.getBaseUri()).thenReturn(URI.create("http://localhost:8080/"));
    when(sessionManager.refresh(ID, CSRF)).thenReturn(SESSION);

    Response response = resource.refresh(ID, COOKIE, CSRF, uriInfo);

    assertThat(response.getStatus()).isEqualTo(200);
    assertThat(response.getHeaderString(HttpHeaders.SET_COOKIE)).isNull();
  }

  @Test
  void refresh_missingCsrfHeader_throws401BeforeLookingAnythingUp() {
    assertThatThrownBy(() -> resource.refresh("unknown", null, null, uriInfo))
        .isInstanceOf(WebApplicationException.class)
        .satisfies(e -> assertThat(statusOf((WebApplicationException) e)).isEqualTo(401));
    verify(sessionManager, never()).refresh(any(), any());
  }

  @Test
  void refresh_wrongCsrf_throws401() {
    when(sessionManager.refresh(ID, "forged")).thenThrow(new CsrfTokenMismatchException("bad"));

    assertThatThrownBy(() -> resource.refresh(ID, COOKIE, "forged", uriInfo))
        .isInstanceOf(WebApplicationException.class)
        .satisfies(e -> assertThat(statusOf((WebApplicationException) e)).isEqualTo(401));
  }

  @Test
  void refresh_unknownSession_returns404AndClearsCookie() {
    when(sessionManager.refresh(ID, CSRF)).thenThrow(new SessionNotFoundException("gone"));

    Response response = resource.refresh(ID, COOKIE, CSRF, uriInfo);

    assertThat(response.getStatus()).isEqualTo(404);
    assertThat(response.getHeaderString(HttpHeaders.SET_COOKIE)).startsWith("SID=deleted;");
  }

  @Test
  void refresh_cookieNamingOtherSession_returns404AndClearsCookie() {
    Response response = resource.refresh(ID, "SID=someone-else", CSRF, uriInfo);

    assertThat(response.getStatus()).isEqualTo(404);
    assertThat(response.getHeaderString(HttpHeaders.SET_COOKIE)).startsWith("SID=deleted;");
    verify(sessionManager, never()).refresh(any(), any());
  }

  // ── delete ───────────────────────────────────────────────────────────────

  @Test
  void delete_valid_returns204AndClearsCookie() {
    Response response = resource.delete(ID, COOKIE, CSRF);

    assertThat(response.getStatus()).isEqualTo(204);
    assertThat(response.getHeaderString(HttpHeaders.SET_COOKIE)).startsWith("SID=deleted;");
    verify(sessionManager).delete(ID, CSRF);
  }

  @Test
  void delete_alreadyDeleted_returns404AndClearsCookie() {
    doThrow(new SessionNotFoundException("gone")).when(sessionManager).delete(ID, CSRF);

    Response response = resource.delete(ID, COOKIE, CSRF);

    assertThat(response.getStatus()).isEqualTo(404);
    assertThat(response.getHeaderString(HttpHeaders.SET_COOKIE)).startsWith("SID=deleted;");
  }

  @Test
  void delete_missingCsrfHeader_throws401() {
    assertThatThrownBy(() -> resource.delete(ID, COOKIE, ""))
        .isInstanceOf(WebApplicationException.class)
        .satisfies(e -> assertThat(statusOf((WebApplicationException) e)).isEqualTo(401));
    verify(sessionManager, never()).delete(any(), any());
  }

  @Test
  void delete_wrongCsrf_throws401() {
    doThrow(new CsrfTokenMismatchException("bad")).when(sessionManager).delete(ID, "forged");

    assertThatThrownBy(() -> resource.delete(ID, COOKIE, "forged"))
        .isInstanceOf(WebApplicationException.class)
        .satisfies(e -> assertThat(statusOf((WebApplicationException) e)).isEqualTo(401));
  }
}
