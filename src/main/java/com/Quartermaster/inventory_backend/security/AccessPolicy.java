package com.Quartermaster.inventory_backend.security;

import com.Quartermaster.inventory_backend.enums.Operation;
import com.Quartermaster.inventory_backend.enums.Role;
import com.Quartermaster.inventory_backend.exception.PermissionDeniedException;
import com.Quartermaster.inventory_backend.model.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Role table for every operation. Holds no state; the account-active check runs before the
 * role is looked at so a disabled account is always reported as such.
 */
@Slf4j
@Component
public class AccessPolicy {

    private static final Set<Role> EVERYONE = EnumSet.allOf(Role.class);
    private static final Set<Role> ADMIN_AND_UP = EnumSet.of(Role.ADMIN, Role.QUARTERMASTER);
    private static final Set<Role> ADMIN_ONLY = EnumSet.of(Role.ADMIN);
    private static final Set<Role> QUARTERMASTER_ONLY = EnumSet.of(Role.QUARTERMASTER);

    public static Set<Role> allowedRoles(Operation operation) {
        return switch (operation) {
            case READ_ITEMS, CHECKOUT_CHECKIN, READ_CATALOG, READ_OWN_REQUESTS, MANAGE_OWN_ACCOUNT -> EVERYONE;
            case UPDATE_ITEM, VIEW_STATS, MANAGE_CATALOG -> ADMIN_AND_UP;
            case SUBMIT_REQUEST -> ADMIN_ONLY;
            case CREATE_ITEM, DELETE_ITEM, REVIEW_REQUEST, MANAGE_USERS -> QUARTERMASTER_ONLY;
        };
    }

    public AuthorizationDecision authorize(User subject, Operation operation) {
        if (!subject.isActive()) {
            return AuthorizationDecision.denied(PermissionDeniedException.accountDisabled(operation));
        }
        Set<Role> allowed = allowedRoles(operation);
        if (!allowed.contains(subject.getRole())) {
            return AuthorizationDecision.denied(PermissionDeniedException.roleNotPermitted(operation, allowed));
        }
        return AuthorizationDecision.allowed();
    }

    /**
     * Throws {@link PermissionDeniedException} unless the subject may perform the operation.
     */
    public void enforce(User subject, Operation operation) {
        AuthorizationDecision decision = authorize(subject, operation);
        if (!decision.isAllowed()) {
            log.warn("User {} ({}) denied {}: {}", subject.getId(), subject.getRole().getValue(),
                    operation, decision.getDenial().getErrorCode());
            throw decision.getDenial();
        }
    }
}
