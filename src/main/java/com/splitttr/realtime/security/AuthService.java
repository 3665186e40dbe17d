package com.splitttr.realtime.security;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.NotAuthorizedException;
import org.eclipse.microprofile.jwt.JsonWebToken;

import java.util.Optional;

@ApplicationScoped
public class AuthService {

    @Inject
    JsonWebToken jwt;

    /**
     * The subject of the caller's JWT, empty when the request carries no valid token.
     */
    public Optional<String> currentUserId() {
        try {
            String subject = jwt.getSubject();
            return subject == null || subject.isBlank() ? Optional.empty() : Optional.of(subject);
        } catch (RuntimeException e) {
            return Optional.empty();
        }
    }

    public boolean isAuthenticated() {
        return currentUserId().isPresent();
    }

    public String requireUserId() {
        return currentUserId().orElseThrow(() -> new NotAuthorizedException("Bearer"));
    }
}
