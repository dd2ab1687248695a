package com.codeheadsystems.tessera.model.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire envelope for every successful session response: {@code {"Session": {...}}}.
 *
 * @param session the session
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionResponse(
    @JsonProperty("Session") SessionView session) {
}
