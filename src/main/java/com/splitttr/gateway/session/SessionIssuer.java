package com.splitttr.gateway.session;

import java.util.UUID;

/**
 * Identifies the current server process. Clients receive the token with their document
 * session and present it when connecting; a different token belongs to an earlier process.
 */
public final class SessionIssuer {

    private final String current;

    public SessionIssuer() {
        this(UUID.randomUUID().toString());
    }

    public SessionIssuer(String current) {
        this.current = current;
    }

    public String current() {
        return current;
    }

    public boolean isCurrent(String sessionId) {
        return current.equals(sessionId);
    }
}
