package com.Quartermaster.inventory_backend.security;

import com.Quartermaster.inventory_backend.enums.Operation;
import com.Quartermaster.inventory_backend.enums.Role;
import com.Quartermaster.inventory_backend.exception.PermissionDeniedException;
import com.Quartermaster.inventory_backend.model.User;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccessPolicyTest {

    private final AccessPolicy accessPolicy = new AccessPolicy();

    @Test
    void memberMayReadAndMoveItemsButNotManageThem() {
        User member = user(Role.MEMBER, true);

        assertThat(accessPolicy.authorize(member, Operation.READ_ITEMS).isAllowed()).isTrue();
        assertThat(accessPolicy.authorize(member, Operation.CHECKOUT_CHECKIN).isAllowed()).isTrue();
        assertThat(accessPolicy.authorize(member, Operation.CREATE_ITEM).isAllowed()).isFalse();
        assertThat(accessPolicy.authorize(member, Operation.UPDATE_ITEM).isAllowed()).isFalse();
        assertThat(accessPolicy.authorize(member, Operation.VIEW_STATS).isAllowed()).isFalse();
        assertThat(accessPolicy.authorize(member, Operation.SUBMIT_REQUEST).isAllowed()).isFalse();
    }

    @Test
    void adminProposesButCannotCreateOrDeleteDirectly() {
        User admin = user(Role.ADMIN, true);

        assertThat(accessPolicy.authorize(admin, Operation.UPDATE_ITEM).isAllowed()).isTrue();
        assertThat(accessPolicy.authorize(admin, Operation.VIEW_STATS).isAllowed()).isTrue();
        assertThat(accessPolicy.authorize(admin, Operation.SUBMIT_REQUEST).isAllowed()).isTrue();
        assertThat(accessPolicy.authorize(admin, Operation.CREATE_ITEM).isAllowed()).isFalse();
        assertThat(accessPolicy.authorize(admin, Operation.DELETE_ITEM).isAllowed()).isFalse();
        assertThat(accessPolicy.authorize(admin, Operation.REVIEW_REQUEST).isAllowed()).isFalse();
    }

    @Test
    void quartermasterReviewsButDoesNotSubmitRequests() {
        User quartermaster = user(Role.QUARTERMASTER, true);

        assertThat(accessPolicy.authorize(quartermaster, Operation.CREATE_ITEM).isAllowed()).isTrue();
        assertThat(accessPolicy.authorize(quartermaster, Operation.DELETE_ITEM).isAllowed()).isTrue();
        assertThat(accessPolicy.authorize(quartermaster, Operation.REVIEW_REQUEST).isAllowed()).isTrue();
        assertThat(accessPolicy.authorize(quartermaster, Operation.MANAGE_USERS).isAllowed()).isTrue();
        assertThat(accessPolicy.authorize(quartermaster, Operation.SUBMIT_REQUEST).isAllowed()).isFalse();
    }

    @ParameterizedTest
    @EnumSource(Operation.class)
    void inactiveAccountIsDeniedEverythingAsDisabled(Operation operation) {
        AuthorizationDecision decision = accessPolicy.authorize(user(Role.QUARTERMASTER, false), operation);

        assertThat(decision.isAllowed()).isFalse();
        assertThat(decision.reason()).contains(PermissionDeniedException.ACCOUNT_DISABLED);
    }

    @Test
    void roleDenialNamesTheRequiredRoles() {
        AuthorizationDecision decision = accessPolicy.authorize(user(Role.MEMBER, true), Operation.UPDATE_ITEM);

        assertThat(decision.reason()).contains(PermissionDeniedException.ROLE_NOT_PERMITTED);
        assertThat(decision.getDenial().getMessage()).isEqualTo("Access denied. Required roles: admin, quartermaster");
        assertThat(decision.getDenial().getDetails()).containsEntry("operation", "UPDATE_ITEM");
    }

    @Test
    void enforceThrowsTheDenial() {
        assertThatThrownBy(() -> accessPolicy.enforce(user(Role.ADMIN, true), Operation.REVIEW_REQUEST))
                .isInstanceOf(PermissionDeniedException.class)
                .extracting("errorCode")
                .isEqualTo(PermissionDeniedException.ROLE_NOT_PERMITTED);
    }

    @Test
    void allowedDecisionHasNoReason() {
        assertThat(accessPolicy.authorize(user(Role.MEMBER, true), Operation.READ_CATALOG).reason()).isEmpty();
    }

    private static User user(Role role, boolean active) {
        return User.builder().id(1L).username("u").fullName("U").role(role).active(active).build();
    }
}
