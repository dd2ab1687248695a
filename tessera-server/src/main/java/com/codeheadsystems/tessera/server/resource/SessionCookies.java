package com.codeheadsystems.tessera.server.resource;

import java.util.Optional;

/**
 * Reads the session cookie from a {@code Cookie} request header and renders the
 * {@code Set-Cookie} values that issue or clear it.
 */
public class SessionCookies {

  /**
   * Value written into a cleared cookie.
   */
  public static final String DELETED_VALUE = "deleted";

  private final String cookieName;
  private final boolean secure;

  /**
   * Instantiates new Session cookies.
   *
   * @param cookieName the cookie name
   * @param secure     whether issued cookies carry the {@code Secure} attribute
   */
  public SessionCookies(String cookieName, boolean secure) {
    this.cookieName = cookieName;
    this.secure = secure;
  }

  /**
   * Finds the session identifier in a raw {@code Cookie} header.
   *
   * @param cookieHeader the header value, may be null
   * @return the identifier, or empty when the cookie is absent, empty or already cleared
   */
  public Optional<String> identifierFrom(String cookieHeader) {
    if (cookieHeader == null || cookieHeader.isBlank()) {
      return Optional.empty();
    }
    for (String pair : cookieHeader.split("[;,]")) {
      int eq = pair.indexOf('=');
      if (eq < 0) {
        continue;
      }
      String name = pair.substring(0, eq).trim();
      if (name.equals(cookieName)) {
        String value = unquote(pair.substring(eq + 1).trim());
        if (value.isEmpty() || value.equals(DELETED_VALUE)) {
          return Optional.empty();
        }
        return Optional.of(value);
      }
    }
    return Optional.empty();
  }

  /**
   * Set-Cookie value handing the identifier to the client.
   *
   * @param identifier the session identifier
   * @return the header value
   */
  public String issue(String identifier) {
    StringBuilder sb = new StringBuilder()
        .append(cookieName).append('=').append(identifier)
        .append("; Path=/; HttpOnly; SameSite=Lax");
    if (secure) {
      sb.append("; Secure");
    }
    return sb.toString();
  }

  /**
   * Set-Cookie value telling the client to drop the session cookie immediately.
   *
   * @return the header value
   */
  public String clear() {
    return cookieName + "=" + DELETED_VALUE
        + "; Expires=Thu, 01 Jan 1970 00:00:00 GMT; Max-Age=0; Path=/; HttpOnly";
  }

  public String cookieName() {
    return cookieName;
  }

  private static String unquote(String value) {
    if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
      return value.substring(1, value.length() - 1);
    }
    return value;
  }
}
