package com.codeheadsystems.tessera.server.resource;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SessionCookiesTest {

  private final SessionCookies cookies = new SessionCookies("SID", false);

  @Test
  void identifierFrom_findsNamedCookieAmongOthers() {
    assertThat(cookies.identifierFrom("theme=dark; SID=abc-123; lang=en")).contains("abc-123");
    assertThat(cookies.identifierFrom("SID=abc-123")).contains("abc-123");
    assertThat(cookies.identifierFrom("SID=\"abc-123\"")).contains("abc-123");
  }

  @Test
  void identifierFrom_ignoresOtherNamesAndEmptyValues() {
    assertThat(cookies.identifierFrom(null)).isEmpty();
    assertThat(cookies.identifierFrom("")).isEmpty();
    assertThat(cookies.identifierFrom("XSID=abc")).isEmpty();
    assertThat(cookies.identifierFrom("SID=")).isEmpty();
    assertThat(cookies.identifierFrom("SID=deleted")).isEmpty();
    assertThat(cookies.identifierFrom("garbage")).isEmpty();
  }

  @Test
  void issue_isHttpOnlyAndLax() {
    assertThat(cookies.issue("abc")).isEqualTo("SID=abc; Path=/; HttpOnly; SameSite=Lax");
    assertThat(new SessionCookies("SID", true).issue("abc")).endsWith("; Secure");
  }

  @Test
  void clear_startsWithDeletedValueAndExpires() {
    assertThat(cookies.clear())
        .startsWith("SID=deleted;")
        .contains("Expires=Thu, 01 Jan 1970 00:00:00 GMT")
        .contains("Max-Age=0");
  }
}
