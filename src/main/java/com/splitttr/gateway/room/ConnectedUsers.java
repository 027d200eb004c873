package com.splitttr.gateway.room;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide directory of participants seen through awareness updates, by client id.
 * Only used for observability.
 */
public final class ConnectedUsers {

    private final ConcurrentHashMap<Long, String> names = new ConcurrentHashMap<>();

    public void joined(long clientId, String name) {
        names.put(clientId, name);
    }

    public Optional<String> left(long clientId) {
        return Optional.ofNullable(names.remove(clientId));
    }

    public Optional<String> nameOf(long clientId) {
        return Optional.ofNullable(names.get(clientId));
    }

    public Map<Long, String> snapshot() {
        return Map.copyOf(names);
    }

    public int size() {
        return names.size();
    }
}
