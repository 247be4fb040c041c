package com.Quartermaster.inventory_backend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type for every business failure surfaced to API callers. The {@code details} map
 * carries whatever context a caller needs to act without re-querying state.
 */
@Getter
public class ApiException extends RuntimeException {
    private final HttpStatus status;
    private final String errorCode;
    private final Map<String, Object> details;

    public ApiException(String message, HttpStatus status) {
        this(message, status, status.name());
    }

    public ApiException(String message, HttpStatus status, String errorCode) {
        this(message, status, errorCode, Collections.emptyMap());
    }

    public ApiException(String message, HttpStatus status, String errorCode, Map<String, Object> details) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ApiException(String message, HttpStatus status, String errorCode, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errorCode = errorCode;
        this.details = Collections.emptyMap();
    }
}
