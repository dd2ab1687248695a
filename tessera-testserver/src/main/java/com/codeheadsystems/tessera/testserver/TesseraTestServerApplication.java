package com.codeheadsystems.tessera.testserver;

import com.codeheadsystems.tessera.dropwizard.TesseraBundle;
import com.codeheadsystems.tessera.dropwizard.TesseraConfiguration;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Runnable Dropwizard application for local developer testing of session clients.
 * Sessions and credentials live in memory and are lost on restart. Users, cookie name and
 * session lifetime come from {@code config/config.yml}.
 * Start with {@code server config/config.yml} from the tessera-testserver directory.
 */
public class TesseraTestServerApplication extends Application<TesseraConfiguration> {

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   * @throws Exception the exception
   */
  public static void main(String[] args) throws Exception {
    new TesseraTestServerApplication().run(args);
  }

  @Override
  public String getName() {
    return "tessera-testserver";
  }

  @Override
  public void initialize(Bootstrap<TesseraConfiguration> bootstrap) {
    // ${ENV_VAR:-default} substitution lets the environment override single keys.
    bootstrap.setConfigurationSourceProvider(
        new SubstitutingSourceProvider(
            bootstrap.getConfigurationSourceProvider(),
            new EnvironmentVariableSubstitutor(false)
        )
    );
    bootstrap.addBundle(new TesseraBundle<>());
  }

  @Override
  public void run(TesseraConfiguration configuration, Environment environment) {
    // Protected endpoint: confirms the session cookie grants access to other resources.
    environment.jersey().register(new WhoAmIResource());
  }
}
