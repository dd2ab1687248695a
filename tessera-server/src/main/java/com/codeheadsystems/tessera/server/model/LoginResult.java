package com.codeheadsystems.tessera.server.model;

/**
 * Outcome of a login through the session endpoint.
 *
 * @param session          the newly created session
 * @param replacedExisting true when the caller proved ownership of a live session for the same
 *                         user and that session was replaced by this one
 */
public record LoginResult(Session session, boolean replacedExisting) {
}
