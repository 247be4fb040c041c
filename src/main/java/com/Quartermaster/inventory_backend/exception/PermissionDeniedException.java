package com.Quartermaster.inventory_backend.exception;

import com.Quartermaster.inventory_backend.enums.Operation;
import com.Quartermaster.inventory_backend.enums.Role;
import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Getter
public class PermissionDeniedException extends ApiException {
    public static final String ROLE_NOT_PERMITTED = "ROLE_NOT_PERMITTED";
    public static final String ACCOUNT_DISABLED = "ACCOUNT_DISABLED";

    private final Operation operation;

    private PermissionDeniedException(String message, String errorCode, Operation operation,
                                      Map<String, Object> details) {
        super(message, HttpStatus.FORBIDDEN, errorCode, details);
        this.operation = operation;
    }

    public static PermissionDeniedException accountDisabled(Operation operation) {
        return new PermissionDeniedException("User account is inactive", ACCOUNT_DISABLED, operation,
                Map.of("operation", operation.name()));
    }

    public static PermissionDeniedException roleNotPermitted(Operation operation, Set<Role> allowedRoles) {
        String required = allowedRoles.stream()
                .map(Role::getValue)
                .sorted()
                .collect(Collectors.joining(", "));
        return new PermissionDeniedException("Access denied. Required roles: " + required,
                ROLE_NOT_PERMITTED, operation,
                Map.of("operation", operation.name(), "requiredRoles", required));
    }
}
