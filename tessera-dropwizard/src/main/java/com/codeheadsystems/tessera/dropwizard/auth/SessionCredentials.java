package com.codeheadsystems.tessera.dropwizard.auth;

/**
 * What a request presents to prove its session.
 *
 * @param identifier   the session identifier from the cookie
 * @param csrfToken    the {@code X-CSRF-Token} header, may be null
 * @param requiresCsrf true for unsafe HTTP methods, which must carry the session's CSRF token
 */
public record SessionCredentials(String identifier, String csrfToken, boolean requiresCsrf) {
}
