package com.codeheadsystems.tessera.model.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire envelope for {@code POST /user/sessions}.
 * <p>
 * The body is a single-key object: {@code {"SessionInput": {"login": "...", "password": "..."}}}.
 *
 * @param sessionInput the credentials, may be null when the client sent an empty envelope
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionCreateRequest(
    @JsonProperty("SessionInput") SessionInput sessionInput) {

  /**
   * Convenience constructor for clients.
   *
   * @param login    the login
   * @param password the password
   * @return the request
   */
  public static SessionCreateRequest of(String login, String password) {
    return new SessionCreateRequest(new SessionInput(login, password));
  }
}
