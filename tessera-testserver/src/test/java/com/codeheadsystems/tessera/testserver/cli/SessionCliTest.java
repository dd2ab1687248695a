package com.codeheadsystems.tessera.testserver.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.tessera.dropwizard.TesseraConfiguration;
import com.codeheadsystems.tessera.testserver.TesseraTestServerApplication;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Drives the CLI against a running test server.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class SessionCliTest {

  static final DropwizardAppExtension<TesseraConfiguration> APP =
      new DropwizardAppExtension<>(
          TesseraTestServerApplication.class,
          ResourceHelpers.resourceFilePath("testserver-config.yml"));

  private ByteArrayOutputStream out;
  private ByteArrayOutputStream err;

  @BeforeEach
  void setUp() {
    out = new ByteArrayOutputStream();
    err = new ByteArrayOutputStream();
  }

  @Test
  void whoami_fullRoundTrip_succeeds() {
    int code = run("whoami", "admin", "publish");

    assertThat(code).isZero();
    assertThat(stdout()).contains("HTTP status : 200").contains("\"login\":\"admin\"");
  }

  @Test
  void login_printsCookieAndCsrfToken() {
    int code = run("login", "admin", "publish");

    assertThat(code).isZero();
    assertThat(stdout()).contains("cookie      : TESSERASESSID=").contains("csrfToken   : ");
  }

  @Test
  void login_wrongPassword_exitsWithRejected() {
    assertThat(run("login", "admin", "wrong")).isEqualTo(2);
    assertThat(stderr()).contains("Rejected");
  }

  @Test
  void check_unknownSession_exitsWithGone() {
    assertThat(run("check", "no-such-session")).isEqualTo(3);
    assertThat(stdout()).contains("No live session.");
  }

  @Test
  void logout_unknownSession_exitsWithGone() {
    assertThat(run("logout", "no-such-session", "no-such-token")).isEqualTo(3);
  }

  @Test
  void refresh_missingCsrfToken_printsUsage() {
    assertThat(run("refresh", "some-session")).isEqualTo(1);
    assertThat(stderr()).contains("Usage: SessionCli");
  }

  @Test
  void unknownCommand_printsUsage() {
    assertThat(run("frobnicate", "x")).isEqualTo(1);
    assertThat(stderr()).contains("Unknown command: frobnicate");
  }

  @Test
  void optionWithoutValue_printsUsage() {
    int code = SessionCli.run(new String[]{"login", "admin", "publish", "--server"},
        new PrintStream(out, true, StandardCharsets.UTF_8),
        new PrintStream(err, true, StandardCharsets.UTF_8));

    assertThat(code).isEqualTo(1);
    assertThat(stderr()).contains("Missing value for --server").contains("Usage: SessionCli");
  }

  private int run(String... command) {
    String[] args = new String[command.length + 2];
    args[0] = "--server";
    args[1] = "http://localhost:" + APP.getLocalPort();
    System.arraycopy(command, 0, args, 2, command.length);
    return SessionCli.run(args,
        new PrintStream(out, true, StandardCharsets.UTF_8),
        new PrintStream(err, true, StandardCharsets.UTF_8));
  }

  private String stdout() {
    return out.toString(StandardCharsets.UTF_8);
  }

  private String stderr() {
    return err.toString(StandardCharsets.UTF_8);
  }
}
