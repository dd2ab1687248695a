package com.codeheadsystems.tessera.client.manager;

import com.codeheadsystems.tessera.client.accessor.SessionAccessor;
import com.codeheadsystems.tessera.client.exceptions.SessionGoneException;
import com.codeheadsystems.tessera.client.model.ServerIdentifier;
import com.codeheadsystems.tessera.model.session.SessionView;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * High-level login / logout flow over {@link SessionAccessor}.
 * <p>
 * Callers hold on to the returned {@link SessionView}; it carries everything needed for the
 * cookie and CSRF header on later calls.
 */
@Singleton
public class SessionClientManager {

  private static final Logger log = LoggerFactory.getLogger(SessionClientManager.class);

  private final SessionAccessor accessor;

  @Inject
  public SessionClientManager(final SessionAccessor accessor) {
    log.info("SessionClientManager()");
    this.accessor = accessor;
  }

  /**
   * Logs in.
   *
   * @param serverId the server id
   * @param login    the login
   * @param password the password
   * @return the new session
   * @throws SecurityException if the credentials are rejected
   */
  public SessionView login(final ServerIdentifier serverId, final String login, final String password) {
    log.debug("login(serverId={}, login={})", serverId, login);
    return accessor.create(serverId, login, password).session();
  }

  /**
   * Logs in again, replacing the given session when the server accepts it as proof.
   *
   * @param serverId the server id
   * @param login    the login
   * @param password the password
   * @param current  the session currently held
   * @return the new session
   */
  public SessionView relogin(final ServerIdentifier serverId, final String login, final String password,
                             final SessionView current) {
    log.debug("relogin(serverId={}, login={})", serverId, login);
    return accessor.create(serverId, login, password, current).session();
  }

  /**
   * Asks the server whether the session is still live.
   *
   * @param serverId the server id
   * @param session  the session
   * @return the server's view of the session, or empty if it is gone
   */
  public Optional<SessionView> check(final ServerIdentifier serverId, final SessionView session) {
    log.debug("check(serverId={})", serverId);
    try {
      return Optional.ofNullable(accessor.current(serverId, session).session());
    } catch (SessionGoneException e) {
      return Optional.empty();
    }
  }

  /**
   * Keeps the session alive.
   *
   * @param serverId the server id
   * @param session  the session
   * @return the refreshed session
   * @throws SessionGoneException if the session is gone
   */
  public SessionView refresh(final ServerIdentifier serverId, final SessionView session) {
    log.debug("refresh(serverId={})", serverId);
    return accessor.refresh(serverId, session).session();
  }

  /**
   * Logs out.
   *
   * @param serverId the server id
   * @param session  the session
   * @return true if this call deleted the session, false if it was already gone
   */
  public boolean logout(final ServerIdentifier serverId, final SessionView session) {
    log.debug("logout(serverId={})", serverId);
    try {
      accessor.delete(serverId, session);
      return true;
    } catch (SessionGoneException e) {
      return false;
    }
  }
}
