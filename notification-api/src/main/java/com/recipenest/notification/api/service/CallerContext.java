package com.recipenest.notification.api.service;

import java.util.Set;
import java.util.UUID;

/**
 * Identity of the caller, passed explicitly into every operation that checks ownership.
 *
 * @param callerId authenticated user id, null for anonymous internal calls
 * @param scopes granted scopes (e.g. {@value #ADMIN_SCOPE})
 */
public record CallerContext(UUID callerId, Set<String> scopes) {

    public static final String ADMIN_SCOPE = "notification:admin";

    public CallerContext {
        scopes = scopes != null ? Set.copyOf(scopes) : Set.of();
    }

    public static CallerContext user(UUID callerId) {
        return new CallerContext(callerId, Set.of());
    }

    public static CallerContext admin(UUID callerId) {
        return new CallerContext(callerId, Set.of(ADMIN_SCOPE));
    }

    public boolean isAdmin() {
        return scopes.contains(ADMIN_SCOPE);
    }

    public UUID requireCallerId() {
        if (callerId == null) {
            throw new ForbiddenException("Authenticated caller required");
        }
        return callerId;
    }
}
