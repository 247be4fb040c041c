package com.Quartermaster.inventory_backend.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class DuplicateUsernameException extends ApiException {
    public DuplicateUsernameException(String username) {
        super("Username already registered: " + username,
                HttpStatus.CONFLICT,
                "DUPLICATE_USERNAME",
                Map.of("username", username));
    }
}
