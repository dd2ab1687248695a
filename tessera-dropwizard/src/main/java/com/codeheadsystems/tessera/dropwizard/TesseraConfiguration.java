package com.codeheadsystems.tessera.dropwizard;

import com.codeheadsystems.tessera.server.manager.SessionManagerConfig;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Dropwizard configuration for the session endpoints.
 * <p>
 * The {@code users} list seeds the in-memory credential store used by the no-argument
 * {@link TesseraBundle} constructor. Applications that supply their own
 * {@code CredentialVerifier} can leave it empty.
 */
public class TesseraConfiguration extends Configuration {

  /**
   * Name of the cookie carrying the session identifier.
   */
  @NotEmpty
  private String cookieName = SessionManagerConfig.DEFAULT_COOKIE_NAME;

  /**
   * Sliding session lifetime in seconds. Every refresh restarts the window.
   */
  @Min(1)
  private long sessionTtlSeconds = 1800;

  /**
   * Maximum concurrent live sessions. Logins beyond this are refused with HTTP 503.
   */
  @Min(1)
  private int maxSessions = 10_000;

  /**
   * Adds the {@code Secure} attribute to issued cookies. Enable whenever the server is
   * reached over HTTPS.
   */
  private boolean secureCookie = false;

  /**
   * Argon2id memory cost in kibibytes for stored password hashes.
   */
  @Min(8)
  private int argon2MemoryKib = 19_456;

  /**
   * Argon2id iteration count.
   */
  @Min(1)
  private int argon2Iterations = 2;

  /**
   * Argon2id parallelism.
   */
  @Min(1)
  private int argon2Parallelism = 1;

  /**
   * Users for the in-memory credential store.
   */
  @Valid
  @NotNull
  private List<ConfiguredUser> users = new ArrayList<>();

  /**
   * Gets cookie name.
   *
   * @return the cookie name
   */
  @JsonProperty
  public String getCookieName() {
    return cookieName;
  }

  /**
   * Sets cookie name.
   *
   * @param cookieName the cookie name
   */
  @JsonProperty
  public void setCookieName(String cookieName) {
    this.cookieName = cookieName;
  }

  /**
   * Gets session ttl seconds.
   *
   * @return the session ttl seconds
   */
  @JsonProperty
  public long getSessionTtlSeconds() {
    return sessionTtlSeconds;
  }

  /**
   * Sets session ttl seconds.
   *
   * @param sessionTtlSeconds the session ttl seconds
   */
  @JsonProperty
  public void setSessionTtlSeconds(long sessionTtlSeconds) {
    this.sessionTtlSeconds = sessionTtlSeconds;
  }

  /**
   * Gets max sessions.
   *
   * @return the max sessions
   */
  @JsonProperty
  public int getMaxSessions() {
    return maxSessions;
  }

  /**
   * Sets max sessions.
   *
   * @param maxSessions the max sessions
   */
  @JsonProperty
  public void setMaxSessions(int maxSessions) {
    this.maxSessions = maxSessions;
  }

  @JsonProperty
  public boolean isSecureCookie() {
    return secureCookie;
  }

  @JsonProperty
  public void setSecureCookie(boolean secureCookie) {
    this.secureCookie = secureCookie;
  }

  @JsonProperty
  public int getArgon2MemoryKib() {
    return argon2MemoryKib;
  }

  @JsonProperty
  public void setArgon2MemoryKib(int argon2MemoryKib) {
    this.argon2MemoryKib = argon2MemoryKib;
  }

  @JsonProperty
  public int getArgon2Iterations() {
    return argon2Iterations;
  }

  @JsonProperty
  public void setArgon2Iterations(int argon2Iterations) {
    this.argon2Iterations = argon2Iterations;
  }

  @JsonProperty
  public int getArgon2Parallelism() {
    return argon2Parallelism;
  }

  @JsonProperty
  public void setArgon2Parallelism(int argon2Parallelism) {
    this.argon2Parallelism = argon2Parallelism;
  }

  /**
   * Gets users.
   *
   * @return the users
   */
  @JsonProperty
  public List<ConfiguredUser> getUsers() {
    return users;
  }

  /**
   * Sets users.
   *
   * @param users the users
   */
  @JsonProperty
  public void setUsers(List<ConfiguredUser> users) {
    this.users = users;
  }

  /**
   * The manager settings derived from this configuration.
   *
   * @return the session manager config
   */
  public SessionManagerConfig sessionManagerConfig() {
    return new SessionManagerConfig(cookieName, Duration.ofSeconds(sessionTtlSeconds), maxSessions);
  }
}
