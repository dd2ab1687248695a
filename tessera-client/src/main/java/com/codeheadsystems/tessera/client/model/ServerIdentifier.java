package com.codeheadsystems.tessera.client.model;

/**
 * Logical name of a session server the client talks to.
 *
 * @param name the name
 */
public record ServerIdentifier(String name) {
}
