package com.Quartermaster.inventory_backend.exception;

import org.springframework.http.HttpStatus;

public class ServiceUnavailableException extends ApiException {
    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, HttpStatus.SERVICE_UNAVAILABLE, "SERVICE_UNAVAILABLE", cause);
    }
}
