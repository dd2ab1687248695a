package com.codeheadsystems.tessera.server.store;

import com.codeheadsystems.tessera.server.model.Session;
import java.util.Optional;

/**
 * Storage abstraction for live login sessions.
 * <p>
 * Implementations must be thread-safe and enforce uniqueness of both the identifier and
 * the CSRF token at write time. Updates are optimistic: {@link #replace} and {@link #remove}
 * only succeed when the stored record still equals the one the caller read, so two racing
 * writers on the same identifier resolve to exactly one winner.
 */
public interface SessionStore {

  /**
   * Adds a new session.
   *
   * @param session the session
   * @return false if another session already uses the identifier or the CSRF token
   */
  boolean insert(Session session);

  /**
   * Retrieves a live session. Expired sessions are removed and reported as absent.
   *
   * @param identifier the session identifier
   * @return the session, or empty if unknown, deleted or expired
   */
  Optional<Session> load(String identifier);

  /**
   * Replaces {@code expected} with {@code updated} if the stored record is still {@code expected}.
   *
   * @param expected the record previously read
   * @param updated  the new record, with the same identifier and CSRF token
   * @return true if the replacement happened
   */
  boolean replace(Session expected, Session updated);

  /**
   * Removes {@code expected} if the stored record is still {@code expected}.
   *
   * @param expected the record previously read
   * @return true if this call removed it
   */
  boolean remove(Session expected);

  /**
   * Removes every expired session.
   *
   * @return the number of sessions removed
   */
  int evictExpired();

  /**
   * Number of stored sessions, including expired ones not yet evicted.
   *
   * @return the size
   */
  int size();
}
