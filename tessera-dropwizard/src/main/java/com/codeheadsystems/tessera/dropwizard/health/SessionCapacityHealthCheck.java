package com.codeheadsystems.tessera.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.tessera.server.manager.SessionManager;

/**
 * Health check that reports the number of held sessions against the configured cap.
 * Unhealthy once the cap is reached, since new logins are then refused.
 */
public class SessionCapacityHealthCheck extends HealthCheck {

  private final SessionManager sessionManager;

  /**
   * Instantiates a new Session capacity health check.
   *
   * @param sessionManager the session manager
   */
  public SessionCapacityHealthCheck(SessionManager sessionManager) {
    this.sessionManager = sessionManager;
  }

  @Override
  protected Result check() {
    int count = sessionManager.sessionCount();
    int max = sessionManager.config().maxSessions();
    if (count >= max) {
      return Result.unhealthy("Session store at capacity: sessions=%d max=%d", count, max);
    }
    return Result.healthy("sessions=%d max=%d", count, max);
  }
}
