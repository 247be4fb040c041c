package com.Quartermaster.inventory_backend.security;

import com.Quartermaster.inventory_backend.exception.PermissionDeniedException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Optional;

/**
 * Result of an {@link AccessPolicy} check. A denial carries the exception the caller should raise.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuthorizationDecision {
    private static final AuthorizationDecision ALLOWED = new AuthorizationDecision(null);

    private final PermissionDeniedException denial;

    public static AuthorizationDecision allowed() {
        return ALLOWED;
    }

    public static AuthorizationDecision denied(PermissionDeniedException denial) {
        return new AuthorizationDecision(denial);
    }

    public boolean isAllowed() {
        return denial == null;
    }

    public Optional<String> reason() {
        return Optional.ofNullable(denial).map(PermissionDeniedException::getErrorCode);
    }
}
