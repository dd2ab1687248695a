package com.codeheadsystems.tessera.model.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Client-visible representation of a live session.
 * <p>
 * The client echoes {@code identifier} back in the {@code name} cookie and
 * {@code csrfToken} in the {@code X-CSRF-Token} header on every mutating call.
 * {@code _href} addresses the session for refresh and delete.
 *
 * @param name       the cookie name carrying the identifier
 * @param identifier the opaque session identifier
 * @param csrfToken  the CSRF token bound to this session
 * @param href       the session's resource path
 * @param login      the login of the user owning the session
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionView(
    @JsonProperty("name") String name,
    @JsonProperty("identifier") String identifier,
    @JsonProperty("csrfToken") String csrfToken,
    @JsonProperty("_href") String href,
    @JsonProperty("login") String login) {
}
