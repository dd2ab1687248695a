package com.codeheadsystems.tessera.model.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Credentials presented when creating a session.
 *
 * @param login    the user's login name
 * @param password the user's password, in clear text over TLS
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionInput(
    @JsonProperty("login") String login,
    @JsonProperty("password") String password) {

  @Override
  public String toString() {
    return "SessionInput[login=" + login + ", password=****]";
  }
}
