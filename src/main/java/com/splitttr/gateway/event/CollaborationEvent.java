package com.splitttr.gateway.event;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Observability record for room lifecycle changes. {@code action} and {@code msg} are optional.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CollaborationEvent(
    LogLevel level,
    String room,
    String path,
    String action,      // "initialize", "load", "overwrite", "clean"
    String msg
) {}
