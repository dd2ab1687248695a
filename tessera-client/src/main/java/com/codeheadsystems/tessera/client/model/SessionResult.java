package com.codeheadsystems.tessera.client.model;

import com.codeheadsystems.tessera.model.session.SessionView;

/**
 * Outcome of a successful call to a session endpoint.
 *
 * @param statusCode the HTTP status
 * @param session    the session from the body, null for 204
 * @param setCookie  the first {@code Set-Cookie} header, null when absent
 */
public record SessionResult(int statusCode, SessionView session, String setCookie) {

  /**
   * True for 201, a login that did not replace an existing session.
   *
   * @return the boolean
   */
  public boolean created() {
    return statusCode == 201;
  }

  /**
   * Whether the response told the client to drop the named cookie.
   *
   * @param cookieName the cookie name
   * @return the boolean
   */
  public boolean clearsCookie(String cookieName) {
    return clears(setCookie, cookieName);
  }

  /**
   * Whether a Set-Cookie value clears the named cookie.
   *
   * @param setCookie  the header value, may be null
   * @param cookieName the cookie name
   * @return the boolean
   */
  public static boolean clears(String setCookie, String cookieName) {
    return setCookie != null && setCookie.startsWith(cookieName + "=deleted;");
  }
}
