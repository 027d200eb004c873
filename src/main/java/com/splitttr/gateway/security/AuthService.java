package com.splitttr.gateway.security;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.jwt.JsonWebToken;

@ApplicationScoped
public class AuthService {

    @Inject
    JsonWebToken jwt;

    /**
     * Subject of the caller's token, or null outside an authenticated request.
     */
    public String getCurrentUserId() {
        try {
            return jwt.getSubject();
        } catch (RuntimeException e) {
            return null;
        }
    }

    /**
     * Name to show in logs: the {@code preferred_username} claim, falling back to the subject.
     */
    public String getCurrentUserName() {
        try {
            String name = jwt.getClaim("preferred_username");
            return name != null ? name : jwt.getSubject();
        } catch (RuntimeException e) {
            return null;
        }
    }
}
