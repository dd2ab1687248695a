package com.codeheadsystems.tessera.server.store;

import com.codeheadsystems.tessera.server.model.Session;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Expired sessions are lazily evicted on {@link #load} and in bulk by {@link #evictExpired}.
 * All sessions are lost on server restart. Suitable for development, single-node
 * deployments and integration testing.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final ConcurrentHashMap<String, Session> store = new ConcurrentHashMap<>();
  // CSRF token -> identifier, kept in sync with store.
  private final ConcurrentHashMap<String, String> csrfIndex = new ConcurrentHashMap<>();
  private final Clock clock;

  /**
   * Instantiates a new In memory session store on the system clock.
   */
  public InMemorySessionStore() {
    this(Clock.systemUTC());
  }

  /**
   * Instantiates a new In memory session store.
   *
   * @param clock the clock used to judge expiry
   */
  public InMemorySessionStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public boolean insert(Session session) {
    if (csrfIndex.putIfAbsent(session.csrfToken(), session.identifier()) != null) {
      log.debug("CSRF token collision on insert");
      return false;
    }
    if (store.putIfAbsent(session.identifier(), session) != null) {
      csrfIndex.remove(session.csrfToken(), session.identifier());
      log.debug("Identifier collision on insert");
      return false;
    }
    log.debug("Stored session {}", session);
    return true;
  }

  @Override
  public Optional<Session> load(String identifier) {
    if (identifier == null) {
      return Optional.empty();
    }
    Session session = store.get(identifier);
    if (session == null) {
      return Optional.empty();
    }
    if (session.isExpired(clock.instant())) {
      remove(session);
      return Optional.empty();
    }
    return Optional.of(session);
  }

  @Override
  public boolean replace(Session expected, Session updated) {
    if (!expected.identifier().equals(updated.identifier())
        || !expected.csrfToken().equals(updated.csrfToken())) {
      throw new IllegalArgumentException("Replacement must keep identifier and CSRF token");
    }
    return store.replace(expected.identifier(), expected, updated);
  }

  @Override
  public boolean remove(Session expected) {
    if (store.remove(expected.identifier(), expected)) {
      csrfIndex.remove(expected.csrfToken(), expected.identifier());
      log.debug("Removed session {}", expected);
      return true;
    }
    return false;
  }

  @Override
  public int evictExpired() {
    Instant now = clock.instant();
    int evicted = 0;
    for (Session session : store.values()) {
      if (session.isExpired(now) && remove(session)) {
        evicted++;
      }
    }
    if (evicted > 0) {
      log.debug("Evicted {} expired session(s)", evicted);
    }
    return evicted;
  }

  @Override
  public int size() {
    return store.size();
  }
}
