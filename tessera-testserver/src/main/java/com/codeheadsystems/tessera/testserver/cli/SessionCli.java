package com.codeheadsystems.tessera.testserver.cli;

import com.codeheadsystems.tessera.client.accessor.SessionAccessor;
import com.codeheadsystems.tessera.client.exceptions.SessionGoneException;
import com.codeheadsystems.tessera.client.manager.SessionClientManager;
import com.codeheadsystems.tessera.client.model.ServerConnectionInfo;
import com.codeheadsystems.tessera.client.model.ServerIdentifier;
import com.codeheadsystems.tessera.model.session.SessionView;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Command-line client for exercising the testserver's session endpoints.
 *
 * <pre>
 * Usage:
 *   SessionCli &lt;command&gt; &lt;args...&gt; [options]
 *
 * Commands:
 *   login   &lt;login&gt; &lt;password&gt;         Log in and print the identifier and CSRF token.
 *   check   &lt;identifier&gt;                 GET /user/sessions/current with the cookie.
 *   refresh &lt;identifier&gt; &lt;csrfToken&gt;     Refresh the session.
 *   logout  &lt;identifier&gt; &lt;csrfToken&gt;     Delete the session.
 *   whoami  &lt;login&gt; &lt;password&gt;         Log in, call GET /api/whoami, refresh, log out.
 *
 * Options:
 *   --server &lt;url&gt;      Server base URL   (default: http://localhost:8080)
 *   --cookie &lt;name&gt;     Session cookie    (default: TESSERASESSID)
 * </pre>
 *
 * <p>The cookie name must match the server's {@code cookieName} setting.
 */
public class SessionCli {

  private static final ServerIdentifier SERVER_ID = new ServerIdentifier("testserver");
  private static final String DEFAULT_SERVER = "http://localhost:8080";
  private static final String DEFAULT_COOKIE = "TESSERASESSID";

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    int exitCode = run(args, System.out, System.err);
    if (exitCode != 0) {
      System.exit(exitCode);
    }
  }

  /**
   * Runs one command.
   *
   * @param args command-line arguments
   * @param out  standard output
   * @param err  error output
   * @return the process exit code: 0 success, 1 usage or transport error, 2 rejected, 3 gone
   */
  public static int run(String[] args, PrintStream out, PrintStream err) {
    String server = DEFAULT_SERVER;
    String cookie = DEFAULT_COOKIE;
    List<String> positional = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      if (args[i].startsWith("--") && i + 1 >= args.length) {
        err.println("Missing value for " + args[i]);
        printUsage(err);
        return 1;
      }
      switch (args[i]) {
        case "--server" -> server = args[++i];
        case "--cookie" -> cookie = args[++i];
        default         -> positional.add(args[i]);
      }
    }

    if (positional.size() < 2) {
      printUsage(err);
      return 1;
    }

    HttpClient httpClient = HttpClient.newHttpClient();
    Map<ServerIdentifier, ServerConnectionInfo> connections = Map.of(
        SERVER_ID, new ServerConnectionInfo(URI.create(server)));
    SessionClientManager manager = new SessionClientManager(
        new SessionAccessor(httpClient, new ObjectMapper(), connections));

    out.println("Server : " + server);
    out.println("Cookie : " + cookie);
    out.println();

    String command = positional.get(0);
    try {
      switch (command) {
        case "login" -> {
          requireArgs(positional, 3);
          print(out, manager.login(SERVER_ID, positional.get(1), positional.get(2)));
        }
        case "check" -> {
          Optional<SessionView> current = manager.check(SERVER_ID, held(cookie, positional.get(1), null));
          if (current.isEmpty()) {
            out.println("No live session.");
            return 3;
          }
          print(out, current.get());
        }
        case "refresh" -> {
          requireArgs(positional, 3);
          print(out, manager.refresh(SERVER_ID, held(cookie, positional.get(1), positional.get(2))));
        }
        case "logout" -> {
          requireArgs(positional, 3);
          if (!manager.logout(SERVER_ID, held(cookie, positional.get(1), positional.get(2)))) {
            out.println("Session was already gone.");
            return 3;
          }
          out.println("Logged out.");
        }
        case "whoami" -> {
          requireArgs(positional, 3);
          return runWhoami(manager, httpClient, server, positional.get(1), positional.get(2), out, err);
        }
        default -> {
          err.println("Unknown command: " + command);
          printUsage(err);
          return 1;
        }
      }
      return 0;
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      printUsage(err);
      return 1;
    } catch (SecurityException e) {
      err.println("Rejected (wrong password or CSRF token): " + e.getMessage());
      return 2;
    } catch (SessionGoneException e) {
      err.println("Session not found: " + e.getMessage());
      return 3;
    } catch (Exception e) {
      err.println("Error: " + e.getMessage());
      return 1;
    }
  }

  private static int runWhoami(SessionClientManager manager, HttpClient httpClient, String server,
                               String login, String password, PrintStream out, PrintStream err)
      throws IOException, InterruptedException {
    out.println("Logging in...");
    SessionView session = manager.login(SERVER_ID, login, password);
    out.println("Calling GET /api/whoami with the session cookie...");

    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(server + "/api/whoami"))
        .header("Cookie", session.name() + "=" + session.identifier())
        .GET()
        .build();
    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    out.println("  HTTP status : " + response.statusCode());
    out.println("  Body        : " + response.body());

    out.println("Refreshing...");
    manager.refresh(SERVER_ID, session);
    out.println("Logging out...");
    manager.logout(SERVER_ID, session);

    if (response.statusCode() != 200) {
      err.println("Unexpected status code: " + response.statusCode());
      return 1;
    }
    return 0;
  }

  private static SessionView held(String cookie, String identifier, String csrfToken) {
    return new SessionView(cookie, identifier, csrfToken, "/user/sessions/" + identifier, null);
  }

  private static void requireArgs(List<String> positional, int count) {
    if (positional.size() < count) {
      throw new IllegalArgumentException("Missing arguments for " + positional.get(0));
    }
  }

  private static void print(PrintStream out, SessionView session) {
    out.println("  login       : " + session.login());
    out.println("  cookie      : " + session.name() + "=" + session.identifier());
    out.println("  csrfToken   : " + session.csrfToken());
    out.println("  href        : " + session.href());
  }

  private static void printUsage(PrintStream err) {
    err.println("Usage: SessionCli <command> <args...> [options]");
    err.println();
    err.println("Commands:");
    err.println("  login   <login> <password>        Log in and print the identifier and CSRF token");
    err.println("  check   <identifier>              Show the session named by the cookie");
    err.println("  refresh <identifier> <csrfToken>  Refresh the session");
    err.println("  logout  <identifier> <csrfToken>  Delete the session");
    err.println("  whoami  <login> <password>        Log in + GET /api/whoami + refresh + log out");
    err.println();
    err.println("Options:");
    err.println("  --server <url>     Server base URL  (default: " + DEFAULT_SERVER + ")");
    err.println("  --cookie <name>    Session cookie   (default: " + DEFAULT_COOKIE + ")");
  }
}
