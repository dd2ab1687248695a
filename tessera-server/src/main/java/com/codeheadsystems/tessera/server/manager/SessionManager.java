package com.codeheadsystems.tessera.server.manager;

import com.codeheadsystems.tessera.server.credential.CredentialVerifier;
import com.codeheadsystems.tessera.server.exceptions.AuthenticationFailedException;
import com.codeheadsystems.tessera.server.exceptions.CsrfTokenMismatchException;
import com.codeheadsystems.tessera.server.exceptions.SessionNotFoundException;
import com.codeheadsystems.tessera.server.model.LoginResult;
import com.codeheadsystems.tessera.server.model.Session;
import com.codeheadsystems.tessera.server.random.RandomProvider;
import com.codeheadsystems.tessera.server.store.SessionStore;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service owning the lifecycle of login sessions.
 * <p>
 * Creates sessions on successful credential checks, looks them up, refreshes them and
 * deletes them. Every mutating call must present the session's CSRF token. Framework
 * adapters ({@code SessionResource} for JAX-RS / Dropwizard) stay thin wrappers that only
 * translate exceptions into HTTP responses.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link IllegalArgumentException}       : missing login or password, HTTP 400</li>
 *   <li>{@link AuthenticationFailedException}  : bad credentials, HTTP 401</li>
 *   <li>{@link CsrfTokenMismatchException}     : missing or wrong CSRF token, HTTP 401</li>
 *   <li>{@link SessionNotFoundException}       : unknown, deleted or expired session, HTTP 404</li>
 *   <li>{@link IllegalStateException}          : session store at capacity, HTTP 503</li>
 * </ul>
 * A missing CSRF token is reported before the identifier is looked up, so callers without a
 * token learn nothing about which sessions exist.
 */
public class SessionManager {

  private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

  /**
   * Random bytes behind each identifier and CSRF token.
   */
  static final int TOKEN_BYTES = 32;

  /**
   * Attempts to find an unused identifier / token pair before giving up.
   */
  static final int MAX_ALLOCATION_ATTEMPTS = 5;

  private final CredentialVerifier credentialVerifier;
  private final SessionStore sessionStore;
  private final RandomProvider randomProvider;
  private final Clock clock;
  private final SessionManagerConfig config;
  // Only allocate() inserts, so holding this across the capacity check and the insert
  // keeps the store within maxSessions.
  private final Object allocationLock = new Object();

  private final ScheduledExecutorService sessionReaper =
      Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "tessera-session-reaper");
        t.setDaemon(true);
        return t;
      });

  /**
   * Instantiates a new Session manager on the system clock.
   *
   * @param credentialVerifier the credential verifier
   * @param sessionStore       the session store
   * @param config             the config
   */
  public SessionManager(CredentialVerifier credentialVerifier,
                        SessionStore sessionStore,
                        SessionManagerConfig config) {
    this(credentialVerifier, sessionStore, new RandomProvider(), Clock.systemUTC(), config);
  }

  /**
   * Instantiates a new Session manager.
   *
   * @param credentialVerifier the credential verifier
   * @param sessionStore       the session store
   * @param randomProvider     source of identifiers and CSRF tokens
   * @param clock              the clock
   * @param config             the config
   */
  public SessionManager(CredentialVerifier credentialVerifier,
                        SessionStore sessionStore,
                        RandomProvider randomProvider,
                        Clock clock,
                        SessionManagerConfig config) {
    this.credentialVerifier = credentialVerifier;
    this.sessionStore = sessionStore;
    this.randomProvider = randomProvider;
    this.clock = clock;
    this.config = config;
    long periodSeconds = Math.max(1, config.ttl().toSeconds() / 4);
    sessionReaper.scheduleAtFixedRate(
        sessionStore::evictExpired, periodSeconds, periodSeconds, TimeUnit.SECONDS);
  }

  /**
   * Shuts down the session reaper thread.
   * <p>
   * Should be called on application shutdown to release the background thread.
   * In Dropwizard, register a {@code Managed} component that calls this.
   */
  public void shutdown() {
    sessionReaper.shutdown();
  }

  /**
   * Authenticates and creates a brand-new session.
   *
   * @param login    the login
   * @param password the password
   * @return the new session
   * @throws IllegalArgumentException       if login or password is missing
   * @throws AuthenticationFailedException if the credentials are wrong
   * @throws IllegalStateException          if the store is at capacity
   */
  public Session create(String login, String password) {
    log.debug("create(login={})", login);
    return allocate(authenticate(login, password));
  }

  /**
   * Authenticates and creates a brand-new session, replacing the caller's current session
   * when the caller proves it owns one.
   * <p>
   * Proof means the presented identifier names a live session of the same user and the
   * presented CSRF token matches it. That session is removed after the new one is stored,
   * re-reading it if a concurrent refresh changed it in between.
   * Without proof any prior session is left untouched and simply superseded on the client.
   *
   * @param login              the login
   * @param password           the password
   * @param presentedIdentifier identifier from the caller's cookie, may be null
   * @param presentedCsrfToken  CSRF token from the caller's header, may be null
   * @return the new session and whether a prior session was replaced
   * @throws IllegalArgumentException       if login or password is missing
   * @throws AuthenticationFailedException if the credentials are wrong
   * @throws IllegalStateException          if the store is at capacity
   */
  public LoginResult login(String login, String password,
                           String presentedIdentifier, String presentedCsrfToken) {
    log.debug("login(login={})", login);
    String owner = authenticate(login, password);
    boolean presented = !isBlank(presentedIdentifier) && !isBlank(presentedCsrfToken);
    Optional<Session> prior = presented
        ? provenPrior(owner, presentedIdentifier, presentedCsrfToken)
        : Optional.empty();
    Session session = allocate(owner);
    boolean replaced = false;
    while (prior.isPresent()) {
      if (sessionStore.remove(prior.get())) {
        log.debug("Replaced session {} with {}", prior.get(), session);
        replaced = true;
        break;
      }
      // Refreshed or deleted since it was read.
      prior = provenPrior(owner, presentedIdentifier, presentedCsrfToken);
    }
    return new LoginResult(session, replaced);
  }

  /**
   * Looks up a live session. No side effects beyond evicting an expired record.
   *
   * @param identifier the identifier
   * @return the session
   * @throws SessionNotFoundException if no live session has this identifier
   */
  public Session find(String identifier) {
    log.trace("find({})", Session.abbreviate(identifier));
    if (isBlank(identifier)) {
      throw new SessionNotFoundException("Session not found");
    }
    return sessionStore.load(identifier)
        .orElseThrow(() -> new SessionNotFoundException("Session not found"));
  }

  /**
   * Looks up a live session and checks the presented CSRF token against it without
   * changing anything. Used to authenticate unsafe requests to other resources.
   *
   * @param identifier the identifier
   * @param csrfToken  the presented CSRF token
   * @return the session
   * @throws CsrfTokenMismatchException if the token is missing or does not match
   * @throws SessionNotFoundException   if no live session has this identifier
   */
  public Session validate(String identifier, String csrfToken) {
    log.trace("validate({})", Session.abbreviate(identifier));
    requireCsrfToken(csrfToken);
    return loadAndCheck(identifier, csrfToken);
  }

  /**
   * Marks the session as used now and slides its expiry. The CSRF token is unchanged.
   *
   * @param identifier the identifier
   * @param csrfToken  the presented CSRF token
   * @return the refreshed session
   * @throws CsrfTokenMismatchException if the token is missing or does not match
   * @throws SessionNotFoundException   if no live session has this identifier
   */
  public Session refresh(String identifier, String csrfToken) {
    log.debug("refresh({})", Session.abbreviate(identifier));
    requireCsrfToken(csrfToken);
    while (true) {
      Session current = loadAndCheck(identifier, csrfToken);
      Instant now = clock.instant();
      if (current.isExpired(now)) {
        sessionStore.remove(current);
        throw new SessionNotFoundException("Session not found");
      }
      Session updated = current.refreshed(now, config.ttl());
      if (sessionStore.replace(current, updated)) {
        return updated;
      }
      // Lost a race with another refresh or a delete; re-read.
    }
  }

  /**
   * Permanently removes the session. Later calls for this identifier report not found.
   *
   * @param identifier the identifier
   * @param csrfToken  the presented CSRF token
   * @throws CsrfTokenMismatchException if the token is missing or does not match
   * @throws SessionNotFoundException   if no live session has this identifier
   */
  public void delete(String identifier, String csrfToken) {
    log.debug("delete({})", Session.abbreviate(identifier));
    requireCsrfToken(csrfToken);
    while (true) {
      Session current = loadAndCheck(identifier, csrfToken);
      if (sessionStore.remove(current)) {
        return;
      }
    }
  }

  /**
   * Number of sessions currently held, including expired ones awaiting eviction.
   *
   * @return the count
   */
  public int sessionCount() {
    return sessionStore.size();
  }

  public SessionManagerConfig config() {
    return config;
  }

  private String authenticate(String login, String password) {
    if (isBlank(login)) {
      throw new IllegalArgumentException("Missing required field: login");
    }
    if (password == null || password.isEmpty()) {
      throw new IllegalArgumentException("Missing required field: password");
    }
    return credentialVerifier.verify(login, password)
        .orElseThrow(() -> new AuthenticationFailedException("Invalid login or password"));
  }

  private Session allocate(String owner) {
    synchronized (allocationLock) {
      if (sessionStore.size() >= config.maxSessions()) {
        sessionStore.evictExpired();
        if (sessionStore.size() >= config.maxSessions()) {
          throw new IllegalStateException("Too many sessions");
        }
      }
      for (int attempt = 1; attempt <= MAX_ALLOCATION_ATTEMPTS; attempt++) {
        Session session = Session.create(
            randomProvider.urlSafeToken(TOKEN_BYTES),
            config.cookieName(),
            randomProvider.urlSafeToken(TOKEN_BYTES),
            owner,
            clock.instant(),
            config.ttl());
        if (sessionStore.insert(session)) {
          log.debug("Created session {}", session);
          return session;
        }
        log.warn("Session token collision on attempt {}", attempt);
      }
    }
    throw new IllegalStateException("Unable to allocate a unique session identifier");
  }

  private Optional<Session> provenPrior(String owner, String identifier, String csrfToken) {
    return sessionStore.load(identifier)
        .filter(s -> s.ownerCredentialId().equals(owner))
        .filter(s -> tokensMatch(s.csrfToken(), csrfToken));
  }

  private Session loadAndCheck(String identifier, String csrfToken) {
    Session session = find(identifier);
    if (!tokensMatch(session.csrfToken(), csrfToken)) {
      throw new CsrfTokenMismatchException("CSRF token does not match");
    }
    return session;
  }

  private static void requireCsrfToken(String csrfToken) {
    if (isBlank(csrfToken)) {
      throw new CsrfTokenMismatchException("Missing CSRF token");
    }
  }

  private static boolean tokensMatch(String expected, String presented) {
    return MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8),
        presented.getBytes(StandardCharsets.UTF_8));
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
