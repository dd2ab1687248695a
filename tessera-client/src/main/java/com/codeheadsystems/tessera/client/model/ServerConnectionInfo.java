package com.codeheadsystems.tessera.client.model;

import java.net.URI;

/**
 * Network connection details for a single session server.
 *
 * @param endpoint The base URI of the application (e.g. http://host:8080). The session
 *                 endpoints live under {@code /user/sessions} relative to it.
 */
public record ServerConnectionInfo(URI endpoint) {
}
