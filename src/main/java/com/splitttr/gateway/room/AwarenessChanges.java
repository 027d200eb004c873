package com.splitttr.gateway.room;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of applying an awareness update: which participants appeared, changed or left, and
 * the new state of those that appeared or changed.
 */
public record AwarenessChanges(
    List<Long> added,
    List<Long> updated,
    List<Long> removed,
    Map<Long, JsonNode> states
) {

    public boolean isEmpty() {
        return added.isEmpty() && updated.isEmpty() && removed.isEmpty();
    }

    /**
     * Display name advertised under {@code user.name}, if any.
     */
    public Optional<String> userName(long clientId) {
        JsonNode state = states.get(clientId);
        if (state == null) {
            return Optional.empty();
        }
        JsonNode name = state.path("user").path("name");
        return name.isTextual() ? Optional.of(name.asText()) : Optional.empty();
    }
}
