package com.codeheadsystems.tessera.testserver;

import com.codeheadsystems.tessera.dropwizard.auth.SessionPrincipal;
import io.dropwizard.auth.Auth;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.Map;

/**
 * Cookie-protected endpoint that returns the authenticated login.
 * Log in, then call GET /api/whoami with the session cookie and confirm the response
 * names the expected user.
 */
@Path("/api/whoami")
@Produces(MediaType.APPLICATION_JSON)
public class WhoAmIResource {

  /**
   * Returns the login of the session owner.
   *
   * @param principal the principal injected by the Dropwizard auth filter
   * @return a map containing {@code login}
   */
  @GET
  public Map<String, String> whoAmI(@Auth SessionPrincipal principal) {
    return Map.of("login", principal.login());
  }
}
