package com.codeheadsystems.tessera.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import io.dropwizard.testing.ConfigOverride;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Logins beyond the configured session cap are refused and reported by the health check.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class SessionCapacityIntegrationTest {

  static final DropwizardAppExtension<TesseraConfiguration> APP =
      new DropwizardAppExtension<>(
          TesseraApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"),
          ConfigOverride.config("maxSessions", "2"));

  private final HttpClient httpClient = HttpClient.newHttpClient();

  @Test
  void login_beyondCapacity_returns503AndHealthCheckFails() throws Exception {
    assertThat(login().statusCode()).isEqualTo(201);
    assertThat(login().statusCode()).isEqualTo(201);
    assertThat(login().statusCode()).isEqualTo(503);

    HttpResponse<String> health = httpClient.send(HttpRequest.newBuilder()
            .uri(URI.create(String.format("http://localhost:%d/healthcheck", APP.getAdminPort())))
            .GET()
            .build(),
        HttpResponse.BodyHandlers.ofString());
    assertThat(health.statusCode()).isEqualTo(500);
    assertThat(health.body()).contains("session-capacity");
  }

  private HttpResponse<String> login() throws Exception {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(String.format("http://localhost:%d/user/sessions", APP.getLocalPort())))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(
            "{\"SessionInput\":{\"login\":\"admin\",\"password\":\"publish\"}}"))
        .build();
    return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
  }
}
