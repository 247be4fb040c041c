package com.Quartermaster.inventory_backend.exception;

import org.springframework.http.HttpStatus;

public class InvalidRequestShapeException extends ApiException {
    public InvalidRequestShapeException(String message) {
        super(message, HttpStatus.BAD_REQUEST, "INVALID_REQUEST_SHAPE");
    }
}
