package com.codeheadsystems.tessera.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;

/**
 * A login / password pair seeded into the in-memory credential store at startup.
 */
public class ConfiguredUser {

  @NotEmpty
  private String login;

  @NotEmpty
  private String password;

  public ConfiguredUser() {
  }

  public ConfiguredUser(String login, String password) {
    this.login = login;
    this.password = password;
  }

  @JsonProperty
  public String getLogin() {
    return login;
  }

  @JsonProperty
  public void setLogin(String login) {
    this.login = login;
  }

  @JsonProperty
  public String getPassword() {
    return password;
  }

  @JsonProperty
  public void setPassword(String password) {
    this.password = password;
  }

  @Override
  public String toString() {
    return "ConfiguredUser[login=" + login + "]";
  }
}
