package com.codeheadsystems.tessera.dropwizard;

import com.codeheadsystems.tessera.dropwizard.auth.SessionAuthenticator;
import com.codeheadsystems.tessera.dropwizard.auth.SessionCookieAuthFilter;
import com.codeheadsystems.tessera.dropwizard.auth.SessionPrincipal;
import com.codeheadsystems.tessera.dropwizard.health.SessionCapacityHealthCheck;
import com.codeheadsystems.tessera.server.credential.Argon2PasswordHasher;
import com.codeheadsystems.tessera.server.credential.CredentialVerifier;
import com.codeheadsystems.tessera.server.credential.InMemoryCredentialStore;
import com.codeheadsystems.tessera.server.credential.PasswordHashParameters;
import com.codeheadsystems.tessera.server.manager.SessionManager;
import com.codeheadsystems.tessera.server.random.RandomProvider;
import com.codeheadsystems.tessera.server.resource.SessionCookies;
import com.codeheadsystems.tessera.server.resource.SessionResource;
import com.codeheadsystems.tessera.server.store.InMemorySessionStore;
import com.codeheadsystems.tessera.server.store.SessionStore;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.lifecycle.Managed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the session endpoints into an existing Dropwizard application.
 * <p>
 * Registers the session JAX-RS resource, a capacity health check, the session reaper
 * lifecycle and a cookie authentication filter so that consumer resources can declare
 * {@code @Auth SessionPrincipal}. Requires a {@link TesseraConfiguration} block in the
 * application's YAML config.
 * <p>
 * Embed in your application with in-memory stores seeded from {@code users} (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new TesseraBundle<>());
 * }</pre>
 * <p>
 * Or supply your own credential backend and store:
 * <pre>{@code
 *   bootstrap.addBundle(new TesseraBundle<>(myCredentialVerifier, mySessionStore));
 * }</pre>
 */
@Singleton
public class TesseraBundle<C extends TesseraConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(TesseraBundle.class);

  private final CredentialVerifier credentialVerifier;
  private final SessionStore sessionStore;

  /**
   * Creates a bundle backed by in-memory stores. The credential store is seeded from the
   * configuration's {@code users} list when the application starts.
   * <p>
   * For dev/test only: all users and sessions are lost on restart.
   */
  public TesseraBundle() {
    this.credentialVerifier = null;
    this.sessionStore = new InMemorySessionStore();
    log.warn("""
        #################################################################
        # WARNING: Using in-memory credential and session stores.       #
        # Users come from configuration; all sessions are lost on       #
        # restart. Do not use in production.                            #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied credential verifier and session store.
   * The configuration's {@code users} list is ignored.
   *
   * @param credentialVerifier the credential verifier
   * @param sessionStore       the session store
   */
  @Inject
  public TesseraBundle(CredentialVerifier credentialVerifier, SessionStore sessionStore) {
    this.credentialVerifier = credentialVerifier;
    this.sessionStore = sessionStore;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    RandomProvider randomProvider = new RandomProvider();
    CredentialVerifier verifier = credentialVerifier != null
        ? credentialVerifier
        : buildCredentialStore(configuration, randomProvider);

    SessionManager sessionManager = new SessionManager(verifier, sessionStore, randomProvider,
        Clock.systemUTC(), configuration.sessionManagerConfig());
    environment.lifecycle().manage(new Managed() {
      @Override
      public void start() {
        // Reaper starts with the manager.
      }

      @Override
      public void stop() {
        sessionManager.shutdown();
      }
    });

    SessionCookies sessionCookies =
        new SessionCookies(configuration.getCookieName(), configuration.isSecureCookie());
    if (!configuration.isSecureCookie()) {
      log.warn("Session cookies are issued without the Secure attribute. "
          + "Set secureCookie: true when serving over HTTPS.");
    }
    environment.jersey().register(new SessionResource(sessionManager, sessionCookies));
    environment.healthChecks().register("session-capacity", new SessionCapacityHealthCheck(sessionManager));

    // Session cookie auth filter for consumer resources
    environment.jersey().register(new AuthDynamicFeature(
        new SessionCookieAuthFilter.Builder<SessionPrincipal>()
            .setCookieName(configuration.getCookieName())
            .setAuthenticator(new SessionAuthenticator(sessionManager))
            .setPrefix("Session")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(SessionPrincipal.class));
  }

  private InMemoryCredentialStore buildCredentialStore(C configuration, RandomProvider randomProvider) {
    PasswordHashParameters parameters = new PasswordHashParameters(
        configuration.getArgon2MemoryKib(),
        configuration.getArgon2Iterations(),
        configuration.getArgon2Parallelism());
    InMemoryCredentialStore store =
        new InMemoryCredentialStore(new Argon2PasswordHasher(parameters), randomProvider);
    if (configuration.getUsers().isEmpty()) {
      log.warn("No users configured. Every login will be rejected.");
    }
    for (ConfiguredUser user : configuration.getUsers()) {
      store.register(user.getLogin(), user.getPassword());
    }
    log.info("Seeded {} user(s) into the in-memory credential store", configuration.getUsers().size());
    return store;
  }
}
