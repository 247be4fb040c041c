package com.Quartermaster.inventory_backend.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class DuplicateNameException extends ApiException {
    public DuplicateNameException(String resourceName, String name) {
        super(String.format("%s already exists: %s", resourceName, name),
                HttpStatus.CONFLICT,
                "DUPLICATE_NAME",
                Map.of("resource", resourceName, "name", name));
    }
}
